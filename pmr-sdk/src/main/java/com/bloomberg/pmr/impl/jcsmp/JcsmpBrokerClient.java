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
package com.bloomberg.pmr.impl.jcsmp;

import com.bloomberg.pmr.AcknowledgementMode;
import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.PmrException;
import com.bloomberg.pmr.QueueReference;
import com.bloomberg.pmr.ReceiverOptions;
import com.bloomberg.pmr.ResultCodes.GenericResult;
import com.bloomberg.pmr.ServiceOptions;
import com.bloomberg.pmr.impl.infr.util.Argument;
import com.bloomberg.pmr.impl.intf.BrokerClient;
import com.bloomberg.pmr.impl.intf.BrokerFlow;
import com.bloomberg.pmr.impl.intf.FlowListener;
import com.solacesystems.jcsmp.BytesXMLMessage;
import com.solacesystems.jcsmp.ConsumerFlowProperties;
import com.solacesystems.jcsmp.EndpointProperties;
import com.solacesystems.jcsmp.FlowReceiver;
import com.solacesystems.jcsmp.InvalidPropertiesException;
import com.solacesystems.jcsmp.JCSMPChannelProperties;
import com.solacesystems.jcsmp.JCSMPErrorResponseException;
import com.solacesystems.jcsmp.JCSMPErrorResponseSubcodeEx;
import com.solacesystems.jcsmp.JCSMPException;
import com.solacesystems.jcsmp.JCSMPFactory;
import com.solacesystems.jcsmp.JCSMPProperties;
import com.solacesystems.jcsmp.JCSMPSession;
import com.solacesystems.jcsmp.Queue;
import com.solacesystems.jcsmp.XMLMessageListener;
import java.lang.invoke.MethodHandles;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link BrokerClient} over a Solace JCSMP session. */
public final class JcsmpBrokerClient implements BrokerClient {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final Set<MessageSettlementOutcome> SUPPORTED_OUTCOMES =
            Collections.unmodifiableSet(EnumSet.allOf(MessageSettlementOutcome.class));

    private volatile JCSMPSession session = null;

    public JcsmpBrokerClient() {}

    /**
     * Creates a client over an already connected session.
     *
     * @param session JCSMP session
     */
    JcsmpBrokerClient(JCSMPSession session) {
        this.session = Argument.expectNonNull(session, "session");
    }

    static JCSMPProperties toJcsmpProperties(ServiceOptions options) {
        JCSMPProperties props = new JCSMPProperties();
        props.setProperty(JCSMPProperties.HOST, options.hostList());
        props.setProperty(JCSMPProperties.VPN_NAME, options.vpnName());
        props.setProperty(JCSMPProperties.USERNAME, options.username());
        if (!options.password().isEmpty()) {
            props.setProperty(JCSMPProperties.PASSWORD, options.password());
        }

        JCSMPChannelProperties channelProps = new JCSMPChannelProperties();
        // The connect timeout is bounded to the int range by ServiceOptions
        channelProps.setConnectTimeoutInMillis(
                Math.toIntExact(options.connectTimeout().toMillis()));
        channelProps.setConnectRetries(options.connectRetries());
        props.setProperty(JCSMPProperties.CLIENT_CHANNEL_PROPERTIES, channelProps);
        return props;
    }

    @Override
    public void connect(ServiceOptions options) {
        Argument.expectNonNull(options, "options");

        JCSMPSession newSession = null;
        try {
            newSession =
                    JCSMPFactory.onlyInstance()
                            .createSession(
                                    toJcsmpProperties(options),
                                    null,
                                    event -> logger.info("Session event: {}", event));
            newSession.connect();
        } catch (InvalidPropertiesException e) {
            throw new PmrException(
                    "Invalid connection properties: " + e.getMessage(),
                    e,
                    GenericResult.INVALID_ARGUMENT);
        } catch (JCSMPErrorResponseException e) {
            closeQuietly(newSession);
            throw new PmrException(
                    "Broker refused connection: " + e.getMessage(), e, GenericResult.REFUSED);
        } catch (JCSMPException e) {
            closeQuietly(newSession);
            throw new PmrException(
                    "Failed to connect to [" + options.hostList() + "]: " + e.getMessage(),
                    e,
                    GenericResult.NOT_CONNECTED);
        }
        session = newSession;
    }

    @Override
    public void disconnect() {
        JCSMPSession current = session;
        session = null;
        if (current != null) {
            current.closeSession();
        }
    }

    @Override
    public boolean isConnected() {
        JCSMPSession current = session;
        return current != null && !current.isClosed();
    }

    @Override
    public BrokerFlow bind(QueueReference queue, ReceiverOptions options, FlowListener listener) {
        Argument.expectNonNull(queue, "queue");
        Argument.expectNonNull(options, "options");
        Argument.expectNonNull(listener, "listener");

        JCSMPSession current = session;
        if (current == null || current.isClosed()) {
            throw new PmrException("Session is not connected", GenericResult.NOT_CONNECTED);
        }

        FlowReceiver flowReceiver;
        try {
            Queue endpoint =
                    queue.isDurable()
                            ? JCSMPFactory.onlyInstance().createQueue(queue.name())
                            : current.createTemporaryQueue(queue.name());

            ConsumerFlowProperties flowProps = new ConsumerFlowProperties();
            flowProps.setEndpoint(endpoint);
            flowProps.setAckMode(
                    options.ackMode() == AcknowledgementMode.CLIENT
                            ? JCSMPProperties.SUPPORTED_MESSAGE_ACK_CLIENT
                            : JCSMPProperties.SUPPORTED_MESSAGE_ACK_AUTO);
            for (MessageSettlementOutcome outcome : options.requiredOutcomes()) {
                flowProps.addRequiredSettlementOutcomes(JcsmpBrokerFlow.toJcsmpOutcome(outcome));
            }

            flowReceiver =
                    current.createFlow(
                            new FlowListenerAdapter(listener),
                            flowProps,
                            new EndpointProperties());
        } catch (JCSMPErrorResponseException e) {
            if (e.getSubcodeEx() == JCSMPErrorResponseSubcodeEx.UNKNOWN_QUEUE_NAME) {
                throw new PmrException(
                        "Queue '" + queue.name() + "' does not exist on the broker",
                        e,
                        GenericResult.MISSING_RESOURCE);
            }
            throw new PmrException(
                    "Broker refused to bind to queue '" + queue.name() + "': " + e.getMessage(),
                    e,
                    GenericResult.REFUSED);
        } catch (JCSMPException e) {
            throw new PmrException(
                    "Failed to bind to queue '" + queue.name() + "': " + e.getMessage(),
                    e,
                    GenericResult.UNKNOWN);
        }

        logger.info("Bound flow to {}, ack mode: {}", queue, options.ackMode());
        return new JcsmpBrokerFlow(flowReceiver, queue.name());
    }

    @Override
    public Set<MessageSettlementOutcome> supportedOutcomes() {
        return SUPPORTED_OUTCOMES;
    }

    private static void closeQuietly(JCSMPSession s) {
        if (s == null) {
            return;
        }
        try {
            s.closeSession();
        } catch (RuntimeException e) {
            logger.error("Failed to close session: ", e);
        }
    }

    private static class FlowListenerAdapter implements XMLMessageListener {

        private final FlowListener listener;

        FlowListenerAdapter(FlowListener listener) {
            this.listener = listener;
        }

        @Override
        public void onReceive(BytesXMLMessage message) {
            listener.onMessage(new JcsmpInboundMessage(message));
        }

        @Override
        public void onException(JCSMPException e) {
            listener.onException(e);
        }
    }
}
