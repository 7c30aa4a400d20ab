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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import org.junit.jupiter.api.Test;

class QueueReferenceTest {

    @Test
    void testFactories() {
        QueueReference queue = QueueReference.durableExclusive("durable-queue");
        assertEquals("durable-queue", queue.name());
        assertTrue(queue.isDurable());
        assertTrue(queue.isExclusive());

        queue = QueueReference.durableNonExclusive("shared");
        assertTrue(queue.isDurable());
        assertFalse(queue.isExclusive());

        queue = QueueReference.nonDurableExclusive("temp");
        assertFalse(queue.isDurable());
        assertTrue(queue.isExclusive());
    }

    @Test
    void testEquality() {
        assertEquals(
                QueueReference.durableExclusive("q"), QueueReference.durableExclusive("q"));
        assertEquals(
                QueueReference.durableExclusive("q").hashCode(),
                QueueReference.durableExclusive("q").hashCode());
        assertNotEquals(
                QueueReference.durableExclusive("q"), QueueReference.durableNonExclusive("q"));
        assertNotEquals(
                QueueReference.durableExclusive("q"), QueueReference.durableExclusive("p"));
        assertEquals(
                "[ QueueReference name=\"q\" durable=true exclusive=true ]",
                QueueReference.durableExclusive("q").toString());
    }

    @Test
    void testInvalidName() {
        try {
            QueueReference.durableExclusive("");
            fail(); // Should not get here
        } catch (IllegalArgumentException e) {
            assertEquals("'queue name' must be non-empty", e.getMessage());
        }
    }
}
