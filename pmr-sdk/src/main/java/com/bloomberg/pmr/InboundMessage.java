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

/**
 * A guaranteed message delivered to a {@link PersistentMessageReceiver}.
 *
 * <p>The message must be settled by means of {@link PersistentMessageReceiver#settle} once it has
 * been processed unless the receiver acknowledges messages automatically.
 */
public interface InboundMessage {

    /**
     * Returns the payload as text.
     *
     * @return String payload text, or null if the payload is not a text payload
     */
    String getPayloadAsString();

    /**
     * Returns the raw payload bytes.
     *
     * @return byte[] payload bytes, or null if the message carries no binary payload
     */
    byte[] getPayloadAsBytes();

    /**
     * Returns the broker-assigned message identifier.
     *
     * @return String message id, may be null
     */
    String getMessageId();

    /**
     * Check if the broker has delivered this message before.
     *
     * @return true if this is a redelivery
     */
    boolean isRedelivered();

    /**
     * Returns the number of times the broker delivered this message.
     *
     * @return int delivery count, or -1 if the broker does not report it
     */
    int getDeliveryCount();

    /**
     * Returns the name of the queue or topic this message was published to.
     *
     * @return String destination name, may be null
     */
    String getDestinationName();
}
