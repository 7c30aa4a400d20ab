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

import java.time.Duration;

/**
 * Receiver of guaranteed messages bound to a single queue.
 *
 * <p>A receiver passes the following states:
 *
 * <pre>
 *
 *   CREATED --start()--&gt; STARTED --(delivery possible)--&gt; RUNNING
 *   RUNNING --terminate()--&gt; TERMINATING --(drained or grace period expired)--&gt; TERMINATED
 * </pre>
 *
 * <p>{@code TERMINATED} is final.
 */
public interface PersistentMessageReceiver {

    /**
     * Binds this receiver to its queue and enables message delivery.
     *
     * @throws PmrException with {@code MISSING_RESOURCE} code if the queue doesn't exist on the
     *     broker, {@code NOT_CONNECTED} if the service is not connected, {@code ILLEGAL_STATE} if
     *     the receiver has already been started or terminated
     */
    void start();

    /**
     * Check if messages may be delivered to this receiver
     *
     * @return true if the receiver is running
     */
    boolean isRunning();

    /**
     * Registers the handler which is asynchronously invoked for each inbound message. Messages
     * received before the registration are buffered and passed to the handler once it is set.
     *
     * @param handler message handler
     * @throws IllegalArgumentException if the handler is null
     * @throws PmrException with {@code ILLEGAL_STATE} code if a handler is already registered or
     *     the receiver is terminating or terminated
     */
    void receiveAsync(MessageHandler handler);

    /**
     * Settles the message with the specified outcome.
     *
     * <p>Errors are reported by the returned code; they are neither thrown nor retried.
     *
     * @param message message received by this receiver
     * @param outcome settlement outcome
     * @return ResultCodes.GenericResult {@code SUCCESS} or error code
     */
    ResultCodes.GenericResult settle(InboundMessage message, MessageSettlementOutcome outcome);

    /**
     * Stops message delivery and releases the receiver.
     *
     * <p>Messages already buffered are passed to the handler for at most the specified grace
     * period. The receiver reaches the terminated state when that's done or when the grace period
     * expires. This method never throws and may be called more than once.
     *
     * @param gracePeriod time given to the handler to process buffered messages
     * @throws IllegalArgumentException if the grace period is null or negative
     */
    void terminate(Duration gracePeriod);

    boolean isTerminating();

    boolean isTerminated();

    /**
     * Returns the queue this receiver is bound to.
     *
     * @return QueueReference queue reference
     */
    QueueReference queue();

    /**
     * Returns options this receiver has been built with.
     *
     * @return ReceiverOptions receiver options
     */
    ReceiverOptions options();
}
