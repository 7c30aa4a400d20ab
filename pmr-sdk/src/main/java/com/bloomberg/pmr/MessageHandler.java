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

/** Interface to handle guaranteed messages delivered to a {@link PersistentMessageReceiver}. */
@FunctionalInterface
public interface MessageHandler {

    /**
     * User specified handler for inbound messages.
     *
     * <p>Invoked on the receiver dispatcher thread, one message at a time, in broker delivery
     * order.
     *
     * @param message inbound message
     */
    void onMessage(InboundMessage message);
}
