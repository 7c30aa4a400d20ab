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

import com.bloomberg.pmr.InboundMessage;
import com.bloomberg.pmr.MessageHandler;
import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.PersistentMessageReceiver;
import com.bloomberg.pmr.ResultCodes.GenericResult;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the body of each inbound message and settles the message with a fixed outcome.
 *
 * <p>Settlement errors are logged and not retried. The broker decides what happens to a message
 * whose outcome could not be delivered.
 */
public class SettlingMessageHandler implements MessageHandler {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final PersistentMessageReceiver receiver;
    private final MessageSettlementOutcome outcome;

    public SettlingMessageHandler(
            PersistentMessageReceiver receiver, MessageSettlementOutcome outcome) {
        this.receiver = Objects.requireNonNull(receiver);
        this.outcome = Objects.requireNonNull(outcome);
    }

    /**
     * Returns the message body as text: the string payload if present, otherwise the binary
     * payload decoded as UTF-8, otherwise an empty string.
     *
     * @param message inbound message
     * @return String message body, never null
     */
    public static String extractBody(InboundMessage message) {
        String text = message.getPayloadAsString();
        if (text != null) {
            return text;
        }
        byte[] bytes = message.getPayloadAsBytes();
        if (bytes != null) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return "";
    }

    public MessageSettlementOutcome outcome() {
        return outcome;
    }

    @Override
    public void onMessage(InboundMessage message) {
        final String body = extractBody(message);
        logger.info("Received message: {}", body);

        GenericResult res = receiver.settle(message, outcome);
        if (res.isSuccess()) {
            logger.info("Message {} settled as {}", message.getMessageId(), outcome);
        } else {
            logger.error(
                    "Failed to settle message {} as {}: {}", message.getMessageId(), outcome, res);
        }
    }
}
