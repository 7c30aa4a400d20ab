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
package com.bloomberg.pmr.impl.intf;

import com.bloomberg.pmr.InboundMessage;
import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.PmrException;

public interface BrokerFlow {
    // Internal interface representing a consumer flow bound to one broker queue.

    /** @throws PmrException if delivery can't be enabled */
    void start();

    void stop();

    void close();

    /**
     * Communicates the outcome of a message to the broker.
     *
     * @throws PmrException if the outcome can't be delivered
     */
    void settle(InboundMessage message, MessageSettlementOutcome outcome);
}
