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
package com.bloomberg.pmr.impl.infr.stat;

import com.bloomberg.pmr.impl.infr.util.Argument;

class StatsUtil {

    static String formatCenter(String s, int width) {
        Argument.expectNonNull(s, "string");
        Argument.expectPositive(width, "width");

        int strlen = s.length();

        if (width > strlen + 1) {
            int extra = (width - strlen) / 2;
            int min = width - extra;

            String format = String.format("%%%ds%%%ds", min, extra);

            return String.format(format, s, "");
        } else {
            String format = String.format("%%%ds", width);

            return String.format(format, s);
        }
    }

    static String formatNum(long num) {
        Argument.expectNonNegative(num, "number");
        return String.format("%,d", num);
    }

    static void repeatCharacter(StringBuilder builder, char c, int times) {
        for (int i = 0; i < times; i++) {
            builder.append(c);
        }
    }

    private StatsUtil() {
        throw new IllegalStateException("Utility class");
    }
}
