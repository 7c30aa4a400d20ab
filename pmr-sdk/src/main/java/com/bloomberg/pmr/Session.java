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
package com.bloomberg.pmr;

import com.bloomberg.pmr.impl.PersistentReceiverImpl;
import com.bloomberg.pmr.impl.infr.util.Argument;
import com.bloomberg.pmr.impl.intf.BrokerClient;
import com.bloomberg.pmr.impl.intf.ServiceState;
import com.bloomberg.pmr.impl.jcsmp.JcsmpBrokerClient;
import java.lang.invoke.MethodHandles;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A session with the message broker.
 *
 * <p>The session connects to the first reachable host from {@link ServiceOptions#hosts}. It owns
 * the receivers created through its builders and terminates those still active on {@link
 * #disconnect}.
 *
 * <H2>Example</H2>
 *
 * <pre>
 * void runSession()  {
 *     MessagingService service = new Session(ServiceOptions.fromEnvironment(System.getenv()));
 *     try {
 *         service.connect();
 *         System.out.println("Connected: " + service.isConnected());
 *
 *         // Build receivers, start them and register handlers
 *
 *     } catch (PmrException e) {
 *         System.out.println("Operation error: " + e);
 *     } finally {
 *         service.disconnect();
 *     }
 * }
 * </pre>
 */
@ThreadSafe
public final class Session implements MessagingService {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final ServiceOptions options;
    private final BrokerClient brokerClient;
    private final Object lock = new Object();
    private final List<PersistentReceiverImpl> receivers = new ArrayList<>();

    private volatile ServiceState state = ServiceState.e_DISCONNECTED;

    /**
     * Creates a new session object with default service options.
     *
     * @see com.bloomberg.pmr.ServiceOptions
     */
    public Session() {
        this(ServiceOptions.createDefault());
    }

    /**
     * Creates a new session object.
     *
     * @param so specified options
     * @throws IllegalArgumentException if the specified options are null
     */
    public Session(ServiceOptions so) {
        this(so, new JcsmpBrokerClient());
    }

    /**
     * Creates a new session object over a custom broker client.
     *
     * @param so specified options
     * @param client broker client implementation
     * @throws IllegalArgumentException if the specified options or broker client is null
     */
    public Session(ServiceOptions so, BrokerClient client) {
        options = Argument.expectNonNull(so, "service options");
        brokerClient = Argument.expectNonNull(client, "broker client");
    }

    @Override
    public void connect() {
        synchronized (lock) {
            if (state == ServiceState.e_CONNECTED) {
                logger.debug("Session is already connected");
                return;
            }
            logger.info("Connecting to [{}], VPN '{}'", options.hostList(), options.vpnName());
            brokerClient.connect(options);
            state = ServiceState.e_CONNECTED;
        }
        logger.info("Session connected");
    }

    @Override
    public void disconnect() {
        final List<PersistentReceiverImpl> active;
        synchronized (lock) {
            if (state == ServiceState.e_DISCONNECTED) {
                logger.debug("Session is already disconnected");
                return;
            }
            active = new ArrayList<>(receivers);
            receivers.clear();
        }

        for (PersistentReceiverImpl receiver : active) {
            if (!receiver.isTerminated()) {
                receiver.terminate(Duration.ZERO);
            }
        }

        try {
            brokerClient.disconnect();
        } catch (RuntimeException e) {
            logger.error("Failed to disconnect broker client: ", e);
        }
        state = ServiceState.e_DISCONNECTED;
        logger.info("Session disconnected");
    }

    @Override
    public boolean isConnected() {
        return state == ServiceState.e_CONNECTED && brokerClient.isConnected();
    }

    @Override
    public PersistentMessageReceiverBuilder createPersistentMessageReceiverBuilder() {
        return new PersistentMessageReceiverBuilder(this);
    }

    @Override
    public ServiceOptions options() {
        return options;
    }

    Set<MessageSettlementOutcome> supportedOutcomes() {
        return brokerClient.supportedOutcomes();
    }

    PersistentMessageReceiver createReceiver(QueueReference queue, ReceiverOptions ro) {
        PersistentReceiverImpl receiver = new PersistentReceiverImpl(brokerClient, queue, ro);
        synchronized (lock) {
            // Terminated receivers hold no broker resources
            receivers.removeIf(PersistentReceiverImpl::isTerminated);
            receivers.add(receiver);
        }
        return receiver;
    }

    int trackedReceivers() {
        synchronized (lock) {
            return receivers.size();
        }
    }
}
