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

/**
 * Unchecked exception raised by the messaging service and its receivers.
 *
 * <p>The attached {@link ResultCodes.GenericResult} tells the failure category apart, e.g. {@code
 * MISSING_RESOURCE} when the broker does not know the queue a receiver is bound to, or {@code
 * NOT_SUPPORTED} when a receiver is built with a settlement outcome the flow cannot provide.
 */
@SuppressWarnings("serial")
public class PmrException extends RuntimeException {

    private final ResultCodes.GenericResult result;

    public PmrException(String message) {
        this(message, ResultCodes.GenericResult.UNKNOWN);
    }

    public PmrException(String message, Throwable cause) {
        this(message, cause, ResultCodes.GenericResult.UNKNOWN);
    }

    public PmrException(String message, ResultCodes.GenericResult code) {
        super(message);
        result = code;
    }

    public PmrException(String message, Throwable cause, ResultCodes.GenericResult code) {
        super(message, cause);
        result = code;
    }

    public ResultCodes.GenericResult code() {
        return result;
    }
}
