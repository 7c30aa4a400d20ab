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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.bloomberg.pmr.ResultCodes.GenericResult;
import org.junit.jupiter.api.Test;

// ================================================================
// GenericResult tests
// ================================================================
class ResultCodesTest {

    @Test
    void testValues() {
        // Every code is produced by the session, a receiver or a settlement call
        assertArrayEquals(
                new GenericResult[] {
                    GenericResult.SUCCESS,
                    GenericResult.UNKNOWN,
                    GenericResult.NOT_CONNECTED,
                    GenericResult.CANCELED,
                    GenericResult.NOT_SUPPORTED,
                    GenericResult.REFUSED,
                    GenericResult.INVALID_ARGUMENT,
                    GenericResult.NOT_READY,
                    GenericResult.ILLEGAL_STATE,
                    GenericResult.MISSING_RESOURCE
                },
                GenericResult.values());
    }

    @Test
    void testIsSuccess() {
        for (GenericResult res : GenericResult.values()) {
            if (res == GenericResult.SUCCESS) {
                assertTrue(res.isSuccess());
            } else {
                assertFalse(res.isSuccess(), res.name());
            }
        }
    }
}
