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
import java.util.Locale;
import javax.annotation.concurrent.Immutable;

/** Defines who decides when a guaranteed message is durably consumed. */
@Immutable
public enum AcknowledgementMode {
    // The library acknowledges each message once it is delivered
    AUTO("auto"),
    // The application settles each message explicitly
    CLIENT("client");

    private final String propertyValue;

    AcknowledgementMode(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    /**
     * Returns the value used for this mode in a receiver property map.
     *
     * @return String property value, {@code "auto"} or {@code "client"}
     * @see ReceiverProperty#ACK_STRATEGY
     */
    public String propertyValue() {
        return propertyValue;
    }

    /**
     * Parses a property value, case-insensitive.
     *
     * @param value {@code "auto"} or {@code "client"}
     * @return AcknowledgementMode parsed mode
     * @throws IllegalArgumentException if the value is null or unknown
     */
    public static AcknowledgementMode fromPropertyValue(String value) {
        Argument.expectNonNull(value, "ack strategy");
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        for (AcknowledgementMode mode : values()) {
            if (mode.propertyValue.equals(trimmed)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown acknowledgement strategy: '" + value + "'");
    }
}
