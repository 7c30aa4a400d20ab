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

import javax.annotation.concurrent.Immutable;

/** Result codes reported by the messaging service, receivers and settlement calls. */
@Immutable
public class ResultCodes {

    @Immutable
    public enum GenericResult {
        SUCCESS,
        UNKNOWN,
        NOT_CONNECTED,
        CANCELED,
        NOT_SUPPORTED,
        REFUSED,
        INVALID_ARGUMENT,
        NOT_READY,
        ILLEGAL_STATE,
        // The broker does not know the requested resource (e.g. queue)
        MISSING_RESOURCE;

        public boolean isSuccess() {
            return this == SUCCESS;
        }
    }

    private ResultCodes() {
        throw new IllegalStateException("Utility class");
    }
}
