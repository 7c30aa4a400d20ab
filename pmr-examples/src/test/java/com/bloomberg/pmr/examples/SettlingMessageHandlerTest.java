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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.bloomberg.pmr.InboundMessage;
import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.PersistentMessageReceiver;
import com.bloomberg.pmr.ResultCodes.GenericResult;
import org.junit.jupiter.api.Test;

class SettlingMessageHandlerTest {

    private static InboundMessage message(String text, byte[] bytes) {
        InboundMessage msg = mock(InboundMessage.class);
        when(msg.getMessageId()).thenReturn("ID:1");
        when(msg.getPayloadAsString()).thenReturn(text);
        when(msg.getPayloadAsBytes()).thenReturn(bytes);
        return msg;
    }

    @Test
    void testExtractBody() {
        // String payload takes precedence
        InboundMessage both = message("text", "bytes".getBytes(UTF_8));
        assertEquals("text", SettlingMessageHandler.extractBody(both));

        InboundMessage binary = message(null, "hello".getBytes(UTF_8));
        assertEquals("hello", SettlingMessageHandler.extractBody(binary));

        assertEquals("", SettlingMessageHandler.extractBody(message(null, null)));
    }

    @Test
    void testSettlesWithConfiguredOutcome() {
        PersistentMessageReceiver receiver = mock(PersistentMessageReceiver.class);
        InboundMessage msg = message(null, "hello".getBytes(UTF_8));
        when(receiver.settle(msg, MessageSettlementOutcome.REJECTED))
                .thenReturn(GenericResult.SUCCESS);

        SettlingMessageHandler handler =
                new SettlingMessageHandler(receiver, MessageSettlementOutcome.REJECTED);
        handler.onMessage(msg);

        verify(receiver).settle(msg, MessageSettlementOutcome.REJECTED);
    }

    @Test
    void testSettleFailureDoesNotThrow() {
        PersistentMessageReceiver receiver = mock(PersistentMessageReceiver.class);
        InboundMessage msg = message("hello", null);
        when(receiver.settle(msg, MessageSettlementOutcome.FAILED))
                .thenReturn(GenericResult.CANCELED);

        SettlingMessageHandler handler =
                new SettlingMessageHandler(receiver, MessageSettlementOutcome.FAILED);
        handler.onMessage(msg);

        verify(receiver).settle(msg, MessageSettlementOutcome.FAILED);
        assertEquals(MessageSettlementOutcome.FAILED, handler.outcome());
    }
}
