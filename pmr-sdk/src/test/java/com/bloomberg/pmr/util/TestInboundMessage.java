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
package com.bloomberg.pmr.util;

import com.bloomberg.pmr.InboundMessage;
import java.nio.charset.StandardCharsets;

/** Inbound message with a configurable payload representation. */
public final class TestInboundMessage implements InboundMessage {

    private final String messageId;
    private final String text;
    private final byte[] bytes;

    private TestInboundMessage(String messageId, String text, byte[] bytes) {
        this.messageId = messageId;
        this.text = text;
        this.bytes = bytes;
    }

    /** Message whose payload is only available as a string. */
    public static TestInboundMessage text(String messageId, String text) {
        return new TestInboundMessage(messageId, text, null);
    }

    /** Message whose payload is only available as bytes. */
    public static TestInboundMessage bytes(String messageId, String text) {
        return new TestInboundMessage(messageId, null, text.getBytes(StandardCharsets.UTF_8));
    }

    /** Message without payload. */
    public static TestInboundMessage empty(String messageId) {
        return new TestInboundMessage(messageId, null, null);
    }

    @Override
    public String getPayloadAsString() {
        return text;
    }

    @Override
    public byte[] getPayloadAsBytes() {
        return bytes;
    }

    @Override
    public String getMessageId() {
        return messageId;
    }

    @Override
    public boolean isRedelivered() {
        return false;
    }

    @Override
    public int getDeliveryCount() {
        return 1;
    }

    @Override
    public String getDestinationName() {
        return null;
    }

    @Override
    public String toString() {
        return "[ TestInboundMessage id=" + messageId + " ]";
    }
}
