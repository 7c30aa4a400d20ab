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
package com.bloomberg.pmr.examples;

/** Process exit codes of {@link GuaranteedReceiverNack}, one per fatal error category. */
public enum ExitCode {
    SUCCESS(0),
    USAGE(2),
    CONNECTION_ERROR(3),
    BUILD_ERROR(4),
    MISSING_QUEUE(5),
    START_ERROR(6),
    REGISTRATION_ERROR(7),
    INTERRUPTED(8);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
