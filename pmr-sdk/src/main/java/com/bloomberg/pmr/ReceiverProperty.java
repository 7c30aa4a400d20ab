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
 * Keys of a persistent receiver property map.
 *
 * @see PersistentMessageReceiverBuilder#fromConfigurationProvider(java.util.Map)
 */
public final class ReceiverProperty {

    /** Acknowledgement strategy, {@code "client"} or {@code "auto"}. */
    public static final String ACK_STRATEGY = "pmr.receiver.persistent.ack.strategy";

    /**
     * Comma-delimited settlement outcomes the flow must support in addition to {@code ACCEPTED},
     * e.g. {@code "FAILED,REJECTED"}.
     */
    public static final String REQUIRED_OUTCOME_SUPPORT =
            "pmr.receiver.persistent.required-outcome-support";

    /** Inbound buffer low watermark, number of messages. */
    public static final String BUFFER_LOW_WATERMARK = "pmr.receiver.buffer.low-watermark";

    /** Inbound buffer high watermark (capacity), number of messages. */
    public static final String BUFFER_HIGH_WATERMARK = "pmr.receiver.buffer.high-watermark";

    private ReceiverProperty() {
        throw new IllegalStateException("Utility class");
    }
}
