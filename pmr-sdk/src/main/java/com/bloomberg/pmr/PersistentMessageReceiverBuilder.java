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

import com.bloomberg.pmr.ResultCodes.GenericResult;
import com.bloomberg.pmr.impl.infr.util.Argument;
import java.lang.invoke.MethodHandles;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builder of {@link PersistentMessageReceiver} objects.
 *
 * <p>Receiver settings may be specified either with explicit method calls or with a configuration
 * property map keyed by {@link ReceiverProperty} constants. Both ways are equivalent, and the last
 * call wins when the same setting is specified more than once.
 *
 * <H2>Usage Example 1</H2>
 *
 * <pre>
 *
 * PersistentMessageReceiver receiver =
 *         service.createPersistentMessageReceiverBuilder()
 *                .withMessageClientAcknowledgement()
 *                .withRequiredMessageOutcomeSupport(
 *                        MessageSettlementOutcome.FAILED, MessageSettlementOutcome.REJECTED)
 *                .build(QueueReference.durableExclusive("durable-queue"));
 * </pre>
 *
 * <H2>Usage Example 2</H2>
 *
 * <pre>
 *
 * Map&lt;String, String&gt; props = new HashMap&lt;&gt;();
 * props.put(ReceiverProperty.ACK_STRATEGY, "client");
 * props.put(ReceiverProperty.REQUIRED_OUTCOME_SUPPORT, "FAILED,REJECTED");
 *
 * PersistentMessageReceiver receiver =
 *         service.createPersistentMessageReceiverBuilder()
 *                .fromConfigurationProvider(props)
 *                .build(QueueReference.durableExclusive("durable-queue"));
 * </pre>
 */
public class PersistentMessageReceiverBuilder {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final Session session;

    private AcknowledgementMode ackMode = AcknowledgementMode.AUTO;
    private Set<MessageSettlementOutcome> requiredOutcomes =
            EnumSet.noneOf(MessageSettlementOutcome.class);
    private ReceiverOptions.InboundBufferWaterMark inboundWaterMark =
            new ReceiverOptions.InboundBufferWaterMark();

    PersistentMessageReceiverBuilder(Session session) {
        this.session = Argument.expectNonNull(session, "session");
    }

    /**
     * Makes the application responsible for settling each message.
     *
     * @return PersistentMessageReceiverBuilder this object
     */
    public PersistentMessageReceiverBuilder withMessageClientAcknowledgement() {
        ackMode = AcknowledgementMode.CLIENT;
        return this;
    }

    /**
     * Makes the receiver acknowledge each message once it is delivered. This is the default.
     *
     * @return PersistentMessageReceiverBuilder this object
     */
    public PersistentMessageReceiverBuilder withMessageAutoAcknowledgement() {
        ackMode = AcknowledgementMode.AUTO;
        return this;
    }

    /**
     * Declares the settlement outcomes the flow must support in addition to {@code ACCEPTED}.
     * Replaces outcomes specified before.
     *
     * @param outcomes required outcomes
     * @return PersistentMessageReceiverBuilder this object
     * @throws IllegalArgumentException if outcomes or any of them is null
     */
    public PersistentMessageReceiverBuilder withRequiredMessageOutcomeSupport(
            MessageSettlementOutcome... outcomes) {
        Argument.expectNonNull(outcomes, "outcomes");
        EnumSet<MessageSettlementOutcome> res = EnumSet.noneOf(MessageSettlementOutcome.class);
        for (MessageSettlementOutcome outcome : outcomes) {
            res.add(Argument.expectNonNull(outcome, "outcome"));
        }
        requiredOutcomes = res;
        return this;
    }

    /**
     * Sets watermarks of the buffer between the broker delivery thread and the handler.
     *
     * @param lowWaterMark zero or positive LWM
     * @param highWaterMark HWM greater than LWM
     * @return PersistentMessageReceiverBuilder this object
     * @throws IllegalArgumentException if watermarks are invalid
     */
    public PersistentMessageReceiverBuilder withInboundBufferWaterMark(
            int lowWaterMark, int highWaterMark) {
        inboundWaterMark = new ReceiverOptions.InboundBufferWaterMark(lowWaterMark, highWaterMark);
        return this;
    }

    /**
     * Applies settings from a configuration property map. Keys not present in the map keep their
     * current values, unknown keys are ignored.
     *
     * @param properties receiver properties keyed by {@link ReceiverProperty} constants
     * @return PersistentMessageReceiverBuilder this object
     * @throws IllegalArgumentException if the map is null
     * @throws PmrException with {@code INVALID_ARGUMENT} code if any value can't be parsed
     */
    public PersistentMessageReceiverBuilder fromConfigurationProvider(
            Map<String, String> properties) {
        Argument.expectNonNull(properties, "properties");

        try {
            String value = properties.get(ReceiverProperty.ACK_STRATEGY);
            if (value != null) {
                ackMode = AcknowledgementMode.fromPropertyValue(value);
            }

            value = properties.get(ReceiverProperty.REQUIRED_OUTCOME_SUPPORT);
            if (value != null) {
                requiredOutcomes = MessageSettlementOutcome.parseList(value);
            }

            String lwm = properties.get(ReceiverProperty.BUFFER_LOW_WATERMARK);
            String hwm = properties.get(ReceiverProperty.BUFFER_HIGH_WATERMARK);
            if (lwm != null || hwm != null) {
                inboundWaterMark =
                        new ReceiverOptions.InboundBufferWaterMark(
                                lwm != null
                                        ? parseInt(lwm, ReceiverProperty.BUFFER_LOW_WATERMARK)
                                        : inboundWaterMark.lowWaterMark(),
                                hwm != null
                                        ? parseInt(hwm, ReceiverProperty.BUFFER_HIGH_WATERMARK)
                                        : inboundWaterMark.highWaterMark());
            }
        } catch (IllegalArgumentException e) {
            throw new PmrException(
                    "Invalid receiver configuration: " + e.getMessage(),
                    e,
                    GenericResult.INVALID_ARGUMENT);
        }
        return this;
    }

    /**
     * Creates a receiver bound to the specified queue. The queue existence is not checked here,
     * it is validated by the broker when the receiver is started.
     *
     * @param queue queue to bind the receiver to
     * @return PersistentMessageReceiver new receiver in created state
     * @throws IllegalArgumentException if the queue is null
     * @throws PmrException with {@code NOT_SUPPORTED} code if a required outcome can't be provided
     */
    public PersistentMessageReceiver build(QueueReference queue) {
        Argument.expectNonNull(queue, "queue");

        ReceiverOptions options = new ReceiverOptions(ackMode, requiredOutcomes, inboundWaterMark);

        if (!options.requiredOutcomes().isEmpty()) {
            if (options.ackMode() != AcknowledgementMode.CLIENT) {
                throw new PmrException(
                        "Outcomes ["
                                + MessageSettlementOutcome.toList(options.requiredOutcomes())
                                + "] require client acknowledgement",
                        GenericResult.NOT_SUPPORTED);
            }
            Set<MessageSettlementOutcome> supported = session.supportedOutcomes();
            if (!supported.containsAll(options.requiredOutcomes())) {
                EnumSet<MessageSettlementOutcome> missing =
                        EnumSet.copyOf(options.requiredOutcomes());
                missing.removeAll(supported);
                throw new PmrException(
                        "Outcomes ["
                                + MessageSettlementOutcome.toList(missing)
                                + "] are not supported by the broker client",
                        GenericResult.NOT_SUPPORTED);
            }
        }

        logger.debug("Building receiver for queue '{}', options: {}", queue.name(), options);
        return session.createReceiver(queue, options);
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid value for '" + key + "': '" + value + "'", e);
        }
    }
}
