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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.PmrException;
import com.bloomberg.pmr.ResultCodes.GenericResult;
import com.bloomberg.pmr.util.TestInboundMessage;
import com.solacesystems.jcsmp.BytesXMLMessage;
import com.solacesystems.jcsmp.FlowReceiver;
import com.solacesystems.jcsmp.JCSMPException;
import com.solacesystems.jcsmp.XMLMessage;
import org.junit.jupiter.api.Test;

class JcsmpBrokerFlowTest {

    @Test
    void testOutcomeMapping() {
        assertEquals(
                XMLMessage.Outcome.ACCEPTED,
                JcsmpBrokerFlow.toJcsmpOutcome(MessageSettlementOutcome.ACCEPTED));
        assertEquals(
                XMLMessage.Outcome.FAILED,
                JcsmpBrokerFlow.toJcsmpOutcome(MessageSettlementOutcome.FAILED));
        assertEquals(
                XMLMessage.Outcome.REJECTED,
                JcsmpBrokerFlow.toJcsmpOutcome(MessageSettlementOutcome.REJECTED));
    }

    @Test
    void testSettle() throws JCSMPException {
        FlowReceiver receiver = mock(FlowReceiver.class);
        BytesXMLMessage msg = mock(BytesXMLMessage.class);
        JcsmpBrokerFlow flow = new JcsmpBrokerFlow(receiver, "durable-queue");

        flow.settle(new JcsmpInboundMessage(msg), MessageSettlementOutcome.REJECTED);

        verify(msg).settle(XMLMessage.Outcome.REJECTED);
    }

    @Test
    void testSettleFailure() throws JCSMPException {
        FlowReceiver receiver = mock(FlowReceiver.class);
        BytesXMLMessage msg = mock(BytesXMLMessage.class);
        doThrow(new JCSMPException("Simulated failure"))
                .when(msg)
                .settle(XMLMessage.Outcome.FAILED);
        JcsmpBrokerFlow flow = new JcsmpBrokerFlow(receiver, "durable-queue");

        try {
            flow.settle(new JcsmpInboundMessage(msg), MessageSettlementOutcome.FAILED);
            fail(); // Should not get here
        } catch (PmrException e) {
            assertEquals(GenericResult.UNKNOWN, e.code());
        }

        try {
            flow.settle(TestInboundMessage.text("1", "a"), MessageSettlementOutcome.ACCEPTED);
            fail(); // Should not get here
        } catch (PmrException e) {
            assertEquals(GenericResult.INVALID_ARGUMENT, e.code());
        }
    }

    @Test
    void testStartFailure() throws JCSMPException {
        FlowReceiver receiver = mock(FlowReceiver.class);
        doThrow(new JCSMPException("Simulated failure")).when(receiver).start();
        JcsmpBrokerFlow flow = new JcsmpBrokerFlow(receiver, "durable-queue");

        try {
            flow.start();
            fail(); // Should not get here
        } catch (PmrException e) {
            assertEquals(GenericResult.UNKNOWN, e.code());
            assertEquals(
                    "Failed to start flow for queue 'durable-queue': Simulated failure",
                    e.getMessage());
        }

        flow.stop();
        flow.close();
        verify(receiver).stop();
        verify(receiver).close();
    }
}
