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

/** Interface to the service that provides access to the message broker */
public interface MessagingService {

    /**
     * Connect to the message broker.
     *
     * <p>This method blocks until either the service is connected to one of the configured hosts,
     * or all connect attempts failed. Calling this method on a connected service has no effect.
     *
     * @throws PmrException if the connection can't be established
     */
    void connect();

    /**
     * Disconnect from the message broker.
     *
     * <p>Receivers created by this service which are still active are terminated without grace
     * period. Calling this method on a disconnected service has no effect.
     */
    void disconnect();

    /**
     * Check if the service is connected
     *
     * @return true if the service is connected, otherwise false
     */
    boolean isConnected();

    /**
     * Returns a builder for receivers of guaranteed messages bound to this service.
     *
     * @return PersistentMessageReceiverBuilder new builder object
     */
    PersistentMessageReceiverBuilder createPersistentMessageReceiverBuilder();

    /**
     * Returns options this service has been created with.
     *
     * @return ServiceOptions service options
     */
    ServiceOptions options();
}
