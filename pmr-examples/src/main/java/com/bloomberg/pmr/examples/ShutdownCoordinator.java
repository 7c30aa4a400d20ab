/*
 * Copyright 2023 Bloomberg Finance L.P.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.bloomberg.pmr.examples;

import java.lang.invoke.MethodHandles;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits for an interrupt signal and then terminates the receiver and disconnects the service, in
 * that order.
 *
 * <p>The signal is either a SIGINT observed by the JVM shutdown hook installed with {@link #arm},
 * or a call to {@link #signal}. The shutdown hook keeps the JVM alive until the shutdown routine
 * completes.
 */
public class ShutdownCoordinator {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final Duration GRACE_PERIOD = Duration.ofSeconds(1);

    // Upper bound for the shutdown hook to wait for the shutdown routine
    static final Duration HOOK_TIMEOUT = Duration.ofSeconds(10);

    /** Final state of the receiver and the service after shutdown. */
    public static final class ShutdownReport {
        private final boolean isTerminated;
        private final boolean isConnected;

        ShutdownReport(boolean isTerminated, boolean isConnected) {
            this.isTerminated = isTerminated;
            this.isConnected = isConnected;
        }

        public boolean isTerminated() {
            return isTerminated;
        }

        public boolean isConnected() {
            return isConnected;
        }

        @Override
        public String toString() {
            return "[ ShutdownReport terminated="
                    + isTerminated
                    + " connected="
                    + isConnected
                    + " ]";
        }
    }

    private final boolean handleSignals;
    private final CountDownLatch signalled = new CountDownLatch(1);
    private final CountDownLatch completed = new CountDownLatch(1);

    /**
     * Creates a coordinator.
     *
     * @param handleSignals whether {@link #arm} installs a JVM shutdown hook
     */
    public ShutdownCoordinator(boolean handleSignals) {
        this.handleSignals = handleSignals;
    }

    /** Starts observing the interrupt signal of the process. */
    public void arm() {
        if (!handleSignals) {
            return;
        }
        Runtime.getRuntime()
                .addShutdownHook(
                        new Thread(
                                () -> {
                                    logger.info("Interrupt signal received");
                                    signal();
                                    try {
                                        if (!completed.await(
                                                HOOK_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                                            logger.warn("Shutdown did not complete in time");
                                        }
                                    } catch (InterruptedException e) {
                                        Thread.currentThread().interrupt();
                                    }
                                },
                                "pmr-shutdown-hook"));
    }

    public void signal() {
        signalled.countDown();
    }

    public boolean isSignalled() {
        return signalled.getCount() == 0;
    }

    /**
     * Blocks until the interrupt signal, then shuts the context down.
     *
     * <p>If the calling thread is interrupted while waiting, the context is shut down right away
     * and the interrupt status is preserved.
     *
     * @param ctx service and receiver to shut down
     * @return ShutdownReport final state
     */
    public ShutdownReport awaitAndShutdown(ReceiverContext ctx) {
        Objects.requireNonNull(ctx);
        try {
            signalled.await();
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for the shutdown signal");
            Thread.currentThread().interrupt();
        }
        try {
            return shutdown(ctx);
        } finally {
            completed.countDown();
        }
    }

    /**
     * Terminates the receiver with {@link #GRACE_PERIOD} and disconnects the service. Never
     * throws.
     *
     * @param ctx service and receiver to shut down
     * @return ShutdownReport final state
     */
    public ShutdownReport shutdown(ReceiverContext ctx) {
        Objects.requireNonNull(ctx);

        logger.info(
                "Terminating receiver for queue '{}', grace period: {} ms",
                ctx.queue().name(),
                GRACE_PERIOD.toMillis());
        try {
            ctx.receiver().terminate(GRACE_PERIOD);
        } catch (RuntimeException e) {
            logger.error("Failed to terminate receiver: ", e);
        }

        logger.info("Disconnecting messaging service");
        try {
            ctx.service().disconnect();
        } catch (RuntimeException e) {
            logger.error("Failed to disconnect messaging service: ", e);
        }

        ShutdownReport report =
                new ShutdownReport(ctx.receiver().isTerminated(), ctx.service().isConnected());
        logger.info("Receiver terminated: {}", report.isTerminated());
        logger.info("Messaging service connected: {}", report.isConnected());
        return report;
    }
}
