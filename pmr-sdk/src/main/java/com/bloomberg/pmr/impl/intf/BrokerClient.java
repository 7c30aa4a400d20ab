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

import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.PmrException;
import com.bloomberg.pmr.QueueReference;
import com.bloomberg.pmr.ReceiverOptions;
import com.bloomberg.pmr.ServiceOptions;
import java.util.Set;

public interface BrokerClient {
    // Internal interface representing a session with the message broker.

    /** @throws PmrException if the connection can't be established */
    void connect(ServiceOptions options);

    void disconnect();

    boolean isConnected();

    /**
     * Creates a consumer flow bound to the queue. Delivery begins once the flow is started.
     *
     * @throws PmrException with {@code MISSING_RESOURCE} code if the queue doesn't exist
     */
    BrokerFlow bind(QueueReference queue, ReceiverOptions options, FlowListener listener);

    Set<MessageSettlementOutcome> supportedOutcomes();
}
