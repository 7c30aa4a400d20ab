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
package com.bloomberg.pmr.impl.infr.util;

import java.time.Duration;

public class Argument {
    public static int expectPositive(int value, String varname) {
        if (value <= 0) {
            throw new IllegalArgumentException(quoted(varname) + " must be positive");
        }
        return value;
    }

    public static int expectNonNegative(int value, String varname) {
        if (value < 0) {
            throw new IllegalArgumentException(quoted(varname) + " must be non-negative");
        }
        return value;
    }

    public static long expectNonNegative(long value, String varname) {
        if (value < 0) {
            throw new IllegalArgumentException(quoted(varname) + " must be non-negative");
        }
        return value;
    }

    public static <T> T expectNonNull(T value, String varname) {
        if (value == null) {
            throw new IllegalArgumentException(quoted(varname) + " must be non-null");
        }
        return value;
    }

    public static String expectNonEmpty(String value, String varname) {
        expectNonNull(value, varname);
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException(quoted(varname) + " must be non-empty");
        }
        return value;
    }

    public static Duration expectNonNegative(Duration value, String varname) {
        expectNonNull(value, varname);
        if (value.isNegative()) {
            throw new IllegalArgumentException(quoted(varname) + " must be non-negative");
        }
        return value;
    }

    public static Duration expectPositive(Duration value, String varname) {
        expectNonNull(value, varname);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(quoted(varname) + " must be positive");
        }
        return value;
    }

    public static void expectCondition(boolean condition, Object... failMessage)
            throws IllegalArgumentException {
        if (!condition) {
            StringBuilder sb = new StringBuilder();
            for (Object s : failMessage) {
                sb.append(s);
            }
            throw new IllegalArgumentException(sb.toString());
        }
    }

    private static String quoted(String varname) {
        return "'" + varname + "'";
    }

    private Argument() {
        throw new IllegalStateException("Utility class");
    }
}
