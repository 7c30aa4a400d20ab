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
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.stream.Collectors;
import javax.annotation.concurrent.Immutable;

/**
 * Verdict of a consumer on a guaranteed message, communicated back to the broker.
 *
 * <ul>
 *   <li>{@code ACCEPTED}: the message is consumed and will not be redelivered.
 *   <li>{@code FAILED}: transient processing problem, the broker may redeliver the message.
 *   <li>{@code REJECTED}: permanent processing problem, the broker does not redeliver the message
 *       to this consumer in the same way.
 * </ul>
 *
 * <p>A settlement is irreversible once applied to a message. {@code ACCEPTED} is always supported;
 * {@code FAILED} and {@code REJECTED} must be requested when building the receiver.
 */
@Immutable
public enum MessageSettlementOutcome {
    ACCEPTED,
    FAILED,
    REJECTED;

    static final String DELIMITER = ",";

    /**
     * Parses a single outcome name, case-insensitive.
     *
     * @param name outcome name, e.g. {@code "FAILED"}
     * @return MessageSettlementOutcome parsed outcome
     * @throws IllegalArgumentException if the name is null or doesn't denote an outcome
     */
    public static MessageSettlementOutcome fromString(String name) {
        Argument.expectNonNull(name, "outcome");
        String trimmed = name.trim().toUpperCase(Locale.ROOT);
        for (MessageSettlementOutcome outcome : values()) {
            if (outcome.name().equals(trimmed)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown settlement outcome: '" + name + "'");
    }

    /**
     * Parses a comma-delimited list of outcome names, e.g. {@code "FAILED,REJECTED"}. Blank
     * entries are ignored.
     *
     * @param delimited outcome list
     * @return EnumSet parsed outcomes, may be empty
     * @throws IllegalArgumentException if any entry doesn't denote an outcome
     */
    public static EnumSet<MessageSettlementOutcome> parseList(String delimited) {
        Argument.expectNonNull(delimited, "outcome list");
        EnumSet<MessageSettlementOutcome> res = EnumSet.noneOf(MessageSettlementOutcome.class);
        for (String entry : delimited.split(DELIMITER)) {
            if (!entry.trim().isEmpty()) {
                res.add(fromString(entry));
            }
        }
        return res;
    }

    /**
     * Formats outcomes as a comma-delimited list accepted by {@link #parseList}.
     *
     * @param outcomes outcomes to format
     * @return String delimited outcome names in declaration order
     */
    public static String toList(Collection<MessageSettlementOutcome> outcomes) {
        Argument.expectNonNull(outcomes, "outcomes");
        if (outcomes.isEmpty()) {
            return "";
        }
        return EnumSet.copyOf(outcomes).stream()
                .map(Enum::name)
                .collect(Collectors.joining(DELIMITER));
    }
}
