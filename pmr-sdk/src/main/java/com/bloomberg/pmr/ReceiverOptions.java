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

import com.bloomberg.pmr.impl.infr.util.Argument;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import javax.annotation.concurrent.Immutable;

/**
 * A value-semantic type holding the configuration of a {@link PersistentMessageReceiver}.
 *
 * <p>Objects of this class are created by {@link PersistentMessageReceiverBuilder}, either from
 * explicit builder method calls or from a configuration property map. Both ways yield equal
 * options for the same logical settings.
 */
@Immutable
public final class ReceiverOptions {

    /**
     * Low and high watermarks of the buffer between the broker delivery thread and the receiver
     * dispatcher thread. A warning is logged when the number of buffered messages reaches HWM, and
     * another one when it drops back to LWM. The delivery thread blocks while the buffer holds
     * HWM messages.
     */
    @Immutable
    public static class InboundBufferWaterMark {

        private static final int DEFAULT_BUFFER_LWM = 500; // num of messages
        private static final int DEFAULT_BUFFER_HWM = 1000; // num of messages

        private final int bufferLwm;
        private final int bufferHwm;

        /** Creates this class object with default high and low watermark values. */
        public InboundBufferWaterMark() {
            this(DEFAULT_BUFFER_LWM, DEFAULT_BUFFER_HWM);
        }

        /**
         * Creates this class object with specified high and low watermark values.
         *
         * @param lowWaterMark zero or positive integer value for low watermark
         * @param highWaterMark positive integer value for high watermark
         * @throws IllegalArgumentException in case of either LWM is negative or HWM isn't greater
         *     than LWM
         */
        public InboundBufferWaterMark(int lowWaterMark, int highWaterMark) {
            bufferLwm = Argument.expectNonNegative(lowWaterMark, "lowWaterMark");
            bufferHwm = Argument.expectPositive(highWaterMark, "highWaterMark");
            Argument.expectCondition(
                    lowWaterMark < highWaterMark,
                    "'highWaterMark' must be greater than 'lowWaterMark'");
        }

        public int lowWaterMark() {
            return bufferLwm;
        }

        public int highWaterMark() {
            return bufferHwm;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof InboundBufferWaterMark)) {
                return false;
            }
            InboundBufferWaterMark other = (InboundBufferWaterMark) obj;
            return bufferLwm == other.bufferLwm && bufferHwm == other.bufferHwm;
        }

        @Override
        public int hashCode() {
            return Objects.hash(bufferLwm, bufferHwm);
        }
    }

    private final AcknowledgementMode ackMode;
    private final Set<MessageSettlementOutcome> requiredOutcomes;
    private final InboundBufferWaterMark inboundWaterMark;

    ReceiverOptions(
            AcknowledgementMode ackMode,
            Set<MessageSettlementOutcome> requiredOutcomes,
            InboundBufferWaterMark inboundWaterMark) {
        this.ackMode = Argument.expectNonNull(ackMode, "ackMode");
        Argument.expectNonNull(requiredOutcomes, "requiredOutcomes");
        EnumSet<MessageSettlementOutcome> outcomes =
                EnumSet.noneOf(MessageSettlementOutcome.class);
        outcomes.addAll(requiredOutcomes);
        outcomes.remove(MessageSettlementOutcome.ACCEPTED);
        this.requiredOutcomes = Collections.unmodifiableSet(outcomes);
        this.inboundWaterMark = Argument.expectNonNull(inboundWaterMark, "inboundWaterMark");
    }

    public AcknowledgementMode ackMode() {
        return ackMode;
    }

    /**
     * Returns outcomes requested for the flow in addition to {@code ACCEPTED}, which is always
     * supported and never part of this set.
     *
     * @return Set unmodifiable set of required outcomes
     */
    public Set<MessageSettlementOutcome> requiredOutcomes() {
        return requiredOutcomes;
    }

    public InboundBufferWaterMark inboundBufferWaterMark() {
        return inboundWaterMark;
    }

    /**
     * Returns true if a message received with these options may be settled with the specified
     * outcome.
     *
     * @param outcome settlement outcome
     * @return boolean true if the outcome is supported
     */
    public boolean supportsOutcome(MessageSettlementOutcome outcome) {
        if (ackMode != AcknowledgementMode.CLIENT) {
            return false;
        }
        return outcome == MessageSettlementOutcome.ACCEPTED || requiredOutcomes.contains(outcome);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ReceiverOptions)) {
            return false;
        }
        ReceiverOptions other = (ReceiverOptions) obj;
        return ackMode == other.ackMode
                && requiredOutcomes.equals(other.requiredOutcomes)
                && inboundWaterMark.equals(other.inboundWaterMark);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ackMode, requiredOutcomes, inboundWaterMark);
    }

    @Override
    public String toString() {
        JsonObject obj = new JsonObject();
        obj.addProperty("ackMode", ackMode.propertyValue());
        obj.addProperty("requiredOutcomes", MessageSettlementOutcome.toList(requiredOutcomes));
        obj.addProperty("lowWaterMark", inboundWaterMark.lowWaterMark());
        obj.addProperty("highWaterMark", inboundWaterMark.highWaterMark());
        return new Gson().toJson(obj);
    }
}
