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
package com.bloomberg.pmr.impl;

import com.bloomberg.pmr.InboundMessage;
import com.bloomberg.pmr.MessageHandler;
import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.PersistentMessageReceiver;
import com.bloomberg.pmr.PmrException;
import com.bloomberg.pmr.QueueReference;
import com.bloomberg.pmr.ReceiverOptions;
import com.bloomberg.pmr.ResultCodes.GenericResult;
import com.bloomberg.pmr.impl.infr.stat.ReceiverStats;
import com.bloomberg.pmr.impl.infr.util.Argument;
import com.bloomberg.pmr.impl.intf.BrokerClient;
import com.bloomberg.pmr.impl.intf.BrokerFlow;
import com.bloomberg.pmr.impl.intf.FlowListener;
import com.bloomberg.pmr.impl.intf.ReceiverState;
import java.lang.invoke.MethodHandles;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Thread-safe, state transitions guarded by 'lock'.
// Messages flow: transport thread -> InboundMessageBuffer -> dispatcher thread -> handler
@ThreadSafe
public final class PersistentReceiverImpl implements PersistentMessageReceiver, FlowListener {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final long POLL_INTERVAL_MS = 100;

    // Immutable fields
    private final BrokerClient brokerClient;
    private final QueueReference queue;
    private final ReceiverOptions options;
    private final ReceiverStats stats;
    private final InboundMessageBuffer buffer;
    private final ExecutorService dispatcher;
    private final Object lock;

    // Fields exposed to user and dispatcher threads
    private volatile ReceiverState state;
    private volatile BrokerFlow flow = null;
    private volatile MessageHandler handler = null;

    public PersistentReceiverImpl(
            BrokerClient brokerClient, QueueReference queue, ReceiverOptions options) {
        this.brokerClient = Argument.expectNonNull(brokerClient, "brokerClient");
        this.queue = Argument.expectNonNull(queue, "queue");
        this.options = Argument.expectNonNull(options, "options");

        stats = new ReceiverStats();
        buffer = new InboundMessageBuffer(options.inboundBufferWaterMark(), stats);
        dispatcher =
                Executors.newSingleThreadExecutor(
                        r -> {
                            Thread t = new Thread(r, "pmr-receiver-" + queue.name());
                            t.setDaemon(true);
                            return t;
                        });
        lock = new Object();
        state = ReceiverState.e_CREATED;

        logger.debug("Created receiver, queue: {}, options: {}", queue, options);
    }

    @Override
    public void start() {
        synchronized (lock) {
            if (state != ReceiverState.e_CREATED) {
                throw new PmrException(
                        "Receiver for queue '"
                                + queue.name()
                                + "' can't be started in state "
                                + state,
                        GenericResult.ILLEGAL_STATE);
            }
            if (!brokerClient.isConnected()) {
                throw new PmrException(
                        "Can't start receiver for queue '"
                                + queue.name()
                                + "', service is not connected",
                        GenericResult.NOT_CONNECTED);
            }

            // Throws MISSING_RESOURCE if the broker doesn't know the queue
            BrokerFlow newFlow = brokerClient.bind(queue, options, this);
            flow = newFlow;
            setState(ReceiverState.e_STARTED);

            try {
                newFlow.start();
            } catch (PmrException e) {
                flow = null;
                closeFlow(newFlow);
                setState(ReceiverState.e_CREATED);
                throw e;
            }
            setState(ReceiverState.e_RUNNING);
        }
        logger.info("Receiver for queue '{}' is running", queue.name());
    }

    @Override
    public boolean isRunning() {
        return state == ReceiverState.e_RUNNING;
    }

    @Override
    public void receiveAsync(MessageHandler messageHandler) {
        Argument.expectNonNull(messageHandler, "handler");
        synchronized (lock) {
            if (state == ReceiverState.e_TERMINATING || state == ReceiverState.e_TERMINATED) {
                throw new PmrException(
                        "Can't register handler, receiver for queue '"
                                + queue.name()
                                + "' is "
                                + state,
                        GenericResult.ILLEGAL_STATE);
            }
            if (handler != null) {
                throw new PmrException(
                        "Message handler is already registered for queue '" + queue.name() + "'",
                        GenericResult.ILLEGAL_STATE);
            }
            handler = messageHandler;
            dispatcher.execute(this::dispatch);
        }
        logger.debug("Message handler registered for queue '{}'", queue.name());
    }

    @Override
    public GenericResult settle(InboundMessage message, MessageSettlementOutcome outcome) {
        Argument.expectNonNull(message, "message");
        Argument.expectNonNull(outcome, "outcome");

        if (!options.supportsOutcome(outcome)) {
            logger.warn(
                    "Outcome {} is not supported by receiver for queue '{}', options: {}",
                    outcome,
                    queue.name(),
                    options);
            return GenericResult.NOT_SUPPORTED;
        }

        final ReceiverState currentState = state;
        final BrokerFlow currentFlow = flow;
        if (currentState == ReceiverState.e_TERMINATED) {
            return GenericResult.CANCELED;
        }
        if (currentFlow == null) {
            return GenericResult.NOT_READY;
        }

        try {
            currentFlow.settle(message, outcome);
        } catch (PmrException e) {
            stats.onSettleFailure();
            logger.error(
                    "Failed to settle message {} with outcome {}: ",
                    message.getMessageId(),
                    outcome,
                    e);
            return e.code() == GenericResult.SUCCESS ? GenericResult.UNKNOWN : e.code();
        }
        stats.onSettle(outcome);
        return GenericResult.SUCCESS;
    }

    @Override
    public void terminate(Duration gracePeriod) {
        Argument.expectNonNegative(gracePeriod, "gracePeriod");

        final BrokerFlow currentFlow;
        synchronized (lock) {
            if (state == ReceiverState.e_TERMINATING || state == ReceiverState.e_TERMINATED) {
                logger.debug("Receiver for queue '{}' is already {}", queue.name(), state);
                return;
            }
            setState(ReceiverState.e_TERMINATING);
            currentFlow = flow;
        }
        logger.info(
                "Terminating receiver for queue '{}', grace period: {} ms",
                queue.name(),
                gracePeriod.toMillis());

        // Messages arriving from now on stay unsettled and are redelivered by the broker
        buffer.close();
        if (currentFlow != null) {
            try {
                currentFlow.stop();
            } catch (RuntimeException e) {
                logger.error("Failed to stop flow for queue '{}': ", queue.name(), e);
            }
        }

        awaitDispatcher(gracePeriod);

        List<InboundMessage> unprocessed = buffer.drain();
        if (!unprocessed.isEmpty()) {
            logger.warn(
                    "{} buffered message(s) of queue '{}' left unsettled",
                    unprocessed.size(),
                    queue.name());
        }

        if (currentFlow != null) {
            closeFlow(currentFlow);
        }

        synchronized (lock) {
            flow = null;
            setState(ReceiverState.e_TERMINATED);
        }
        dumpStats();
    }

    @Override
    public boolean isTerminating() {
        return state == ReceiverState.e_TERMINATING;
    }

    @Override
    public boolean isTerminated() {
        return state == ReceiverState.e_TERMINATED;
    }

    @Override
    public QueueReference queue() {
        return queue;
    }

    @Override
    public ReceiverOptions options() {
        return options;
    }

    @Override
    public void onMessage(InboundMessage message) {
        try {
            buffer.put(message);
        } catch (InterruptedException e) {
            logger.warn(
                    "Interrupted while buffering message {} of queue '{}'",
                    message.getMessageId(),
                    queue.name());
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void onException(Exception exception) {
        logger.error("Flow failure on queue '{}': ", queue.name(), exception);
    }

    ReceiverState state() {
        return state;
    }

    ReceiverStats stats() {
        return stats;
    }

    private void setState(ReceiverState newState) {
        logger.debug("Changing state [{}] -> [{}] for queue '{}'", state, newState, queue.name());
        state = newState;
    }

    private void dispatch() {
        while (true) {
            InboundMessage message;
            try {
                message = buffer.poll(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                logger.info("Dispatcher for queue '{}' interrupted", queue.name());
                Thread.currentThread().interrupt();
                return;
            }
            if (message == null) {
                if (buffer.isClosed() && buffer.size() == 0) {
                    logger.debug("Dispatcher for queue '{}' finished", queue.name());
                    return;
                }
                continue;
            }
            try {
                handler.onMessage(message);
            } catch (RuntimeException e) {
                stats.onHandlerFailure();
                logger.error(
                        "Message handler failed on message {} of queue '{}': ",
                        message.getMessageId(),
                        queue.name(),
                        e);
            }
        }
    }

    private void awaitDispatcher(Duration gracePeriod) {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn(
                        "Grace period expired for queue '{}', {} message(s) not processed",
                        queue.name(),
                        buffer.size());
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void closeFlow(BrokerFlow brokerFlow) {
        try {
            brokerFlow.close();
        } catch (RuntimeException e) {
            logger.error("Failed to close flow for queue '{}': ", queue.name(), e);
        }
    }

    private void dumpStats() {
        StringBuilder builder = new StringBuilder();
        builder.append("Final stats for queue '").append(queue.name()).append("':\n");
        stats.dump(builder);
        logger.info("{}", builder);
    }
}
