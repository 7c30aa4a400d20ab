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
import com.bloomberg.pmr.impl.infr.util.Argument;
import com.solacesystems.jcsmp.BytesMessage;
import com.solacesystems.jcsmp.BytesXMLMessage;
import com.solacesystems.jcsmp.Destination;
import com.solacesystems.jcsmp.TextMessage;

/** {@link InboundMessage} view of a message received over a JCSMP flow. */
public final class JcsmpInboundMessage implements InboundMessage {

    private final BytesXMLMessage message;

    public JcsmpInboundMessage(BytesXMLMessage message) {
        this.message = Argument.expectNonNull(message, "message");
    }

    BytesXMLMessage message() {
        return message;
    }

    @Override
    public String getPayloadAsString() {
        if (message instanceof TextMessage) {
            return ((TextMessage) message).getText();
        }
        return null;
    }

    @Override
    public byte[] getPayloadAsBytes() {
        if (message instanceof BytesMessage) {
            byte[] data = ((BytesMessage) message).getData();
            if (data != null) {
                return data;
            }
        }
        int length = message.getAttachmentContentLength();
        if (length <= 0) {
            return null;
        }
        byte[] res = new byte[length];
        message.readAttachmentBytes(res);
        return res;
    }

    @Override
    public String getMessageId() {
        return message.getMessageId();
    }

    @Override
    public boolean isRedelivered() {
        return message.getRedelivered();
    }

    @Override
    public int getDeliveryCount() {
        try {
            return message.getDeliveryCount();
        } catch (UnsupportedOperationException e) {
            // Delivery count is not enabled on the broker
            return -1;
        }
    }

    @Override
    public String getDestinationName() {
        Destination destination = message.getDestination();
        return destination != null ? destination.getName() : null;
    }

    @Override
    public String toString() {
        return "[ JcsmpInboundMessage id="
                + getMessageId()
                + " redelivered="
                + isRedelivered()
                + " ]";
    }
}
