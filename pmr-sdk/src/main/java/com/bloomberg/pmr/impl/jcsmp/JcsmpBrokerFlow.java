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

import com.bloomberg.pmr.InboundMessage;
import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.PmrException;
import com.bloomberg.pmr.ResultCodes.GenericResult;
import com.bloomberg.pmr.impl.infr.util.Argument;
import com.bloomberg.pmr.impl.intf.BrokerFlow;
import com.solacesystems.jcsmp.ClosedFacilityException;
import com.solacesystems.jcsmp.FlowReceiver;
import com.solacesystems.jcsmp.JCSMPException;
import com.solacesystems.jcsmp.XMLMessage;
import java.lang.invoke.MethodHandles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JcsmpBrokerFlow implements BrokerFlow {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final FlowReceiver flowReceiver;
    private final String queueName;

    JcsmpBrokerFlow(FlowReceiver flowReceiver, String queueName) {
        this.flowReceiver = Argument.expectNonNull(flowReceiver, "flowReceiver");
        this.queueName = Argument.expectNonEmpty(queueName, "queueName");
    }

    static XMLMessage.Outcome toJcsmpOutcome(MessageSettlementOutcome outcome) {
        switch (Argument.expectNonNull(outcome, "outcome")) {
            case ACCEPTED:
                return XMLMessage.Outcome.ACCEPTED;
            case FAILED:
                return XMLMessage.Outcome.FAILED;
            case REJECTED:
                return XMLMessage.Outcome.REJECTED;
            default:
                throw new IllegalArgumentException("Unexpected outcome: " + outcome);
        }
    }

    @Override
    public void start() {
        try {
            flowReceiver.start();
        } catch (JCSMPException e) {
            throw new PmrException(
                    "Failed to start flow for queue '" + queueName + "': " + e.getMessage(),
                    e,
                    GenericResult.UNKNOWN);
        }
        logger.debug("Flow for queue '{}' started", queueName);
    }

    @Override
    public void stop() {
        flowReceiver.stop();
        logger.debug("Flow for queue '{}' stopped", queueName);
    }

    @Override
    public void close() {
        flowReceiver.close();
        logger.debug("Flow for queue '{}' closed", queueName);
    }

    @Override
    public void settle(InboundMessage message, MessageSettlementOutcome outcome) {
        if (!(message instanceof JcsmpInboundMessage)) {
            throw new PmrException(
                    "Message was not received over JCSMP: " + message,
                    GenericResult.INVALID_ARGUMENT);
        }
        try {
            ((JcsmpInboundMessage) message).message().settle(toJcsmpOutcome(outcome));
        } catch (ClosedFacilityException e) {
            throw new PmrException(
                    "Flow for queue '" + queueName + "' is closed", e, GenericResult.CANCELED);
        } catch (JCSMPException e) {
            throw new PmrException(
                    "Failed to settle message: " + e.getMessage(), e, GenericResult.UNKNOWN);
        }
    }
}
