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
package com.bloomberg.pmr.impl;

import com.bloomberg.pmr.InboundMessage;
import com.bloomberg.pmr.ReceiverOptions;
import com.bloomberg.pmr.impl.infr.stat.ReceiverStats;
import com.bloomberg.pmr.impl.infr.util.Argument;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded FIFO between the transport delivery thread and the receiver dispatcher thread.
 *
 * <p>The capacity equals the high watermark. The producer blocks while the buffer is full, which
 * stops the transport from reading more messages for this flow.
 */
@ThreadSafe
public final class InboundMessageBuffer {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final long PUT_RETRY_INTERVAL_MS = 100;

    private final LinkedBlockingQueue<InboundMessage> messageFIFO;
    private final ReceiverOptions.InboundBufferWaterMark watermarks;
    private final ReceiverStats receiverStats;

    private final AtomicBoolean reportLwm = new AtomicBoolean(false);
    private volatile boolean isClosed = false;

    public InboundMessageBuffer(
            ReceiverOptions.InboundBufferWaterMark wms, ReceiverStats receiverStats) {
        watermarks = Argument.expectNonNull(wms, "wms");
        this.receiverStats = Argument.expectNonNull(receiverStats, "receiverStats");
        messageFIFO = new LinkedBlockingQueue<>(watermarks.highWaterMark());
    }

    int size() {
        return messageFIFO.size();
    }

    boolean isClosed() {
        return isClosed;
    }

    private String getBufferStatus() {
        return " LWM="
                + watermarks.lowWaterMark()
                + " HWM="
                + watermarks.highWaterMark()
                + " BUFFER_SIZE="
                + messageFIFO.size();
    }

    /**
     * Adds the message to the tail of the buffer, waiting for free space if the buffer is full.
     *
     * @param message inbound message
     * @return true if the message has been buffered, false if the buffer is closed
     * @throws InterruptedException if interrupted while waiting for free space
     */
    public boolean put(InboundMessage message) throws InterruptedException {
        Argument.expectNonNull(message, "message");

        // Update the stats first so the dispatcher never sees a negative size.
        receiverStats.onReceive();
        boolean isAdded = false;
        try {
            while (!isClosed && !isAdded) {
                isAdded =
                        messageFIFO.offer(message, PUT_RETRY_INTERVAL_MS, TimeUnit.MILLISECONDS);
            }
        } finally {
            if (!isAdded) {
                receiverStats.onDrop(1);
            }
        }
        if (!isAdded) {
            logger.debug("Buffer is closed, message dropped: {}", message.getMessageId());
            return false;
        }

        if (messageFIFO.size() >= watermarks.highWaterMark()
                && reportLwm.compareAndSet(false, true)) {
            logger.warn("Inbound message buffer size reached HWM.{}", getBufferStatus());
        }
        return true;
    }

    /**
     * Retrieves and removes the head of the buffer, waiting if necessary.
     *
     * @param timeoutMs how long to wait for a message
     * @return InboundMessage the head of the buffer, or null if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    public InboundMessage poll(long timeoutMs) throws InterruptedException {
        InboundMessage message =
                messageFIFO.poll(
                        Argument.expectNonNegative(timeoutMs, "timeoutMs"), TimeUnit.MILLISECONDS);

        if (message != null) {
            receiverStats.onDispatch();
        }

        if (messageFIFO.size() <= watermarks.lowWaterMark()
                && reportLwm.compareAndSet(true, false)) {
            logger.warn("Inbound message buffer size is back to normal.{}", getBufferStatus());
        }
        return message;
    }

    /** Rejects further messages. Messages already buffered may still be polled. */
    public void close() {
        isClosed = true;
    }

    /**
     * Removes all buffered messages.
     *
     * @return List messages which have not been polled
     */
    public List<InboundMessage> drain() {
        List<InboundMessage> res = new ArrayList<>();
        messageFIFO.drainTo(res);
        receiverStats.onDrop(res.size());
        return res;
    }
}
