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

import com.bloomberg.pmr.MessagingService;
import com.bloomberg.pmr.PersistentMessageReceiver;
import com.bloomberg.pmr.QueueReference;
import java.util.Objects;

/** Handles of the messaging service and the receiver, passed to the shutdown routine. */
public final class ReceiverContext {

    private final MessagingService service;
    private final PersistentMessageReceiver receiver;

    public ReceiverContext(MessagingService service, PersistentMessageReceiver receiver) {
        this.service = Objects.requireNonNull(service);
        this.receiver = Objects.requireNonNull(receiver);
    }

    public MessagingService service() {
        return service;
    }

    public PersistentMessageReceiver receiver() {
        return receiver;
    }

    public QueueReference queue() {
        return receiver.queue();
    }
}
