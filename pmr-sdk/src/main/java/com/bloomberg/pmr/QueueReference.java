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
import java.util.Objects;
import javax.annotation.concurrent.Immutable;

/**
 * Identifies a broker queue a persistent receiver binds to.
 *
 * <p>This is a plain reference without local state. The queue must be provisioned on the broker
 * beforehand; its existence is validated by the broker when the receiver is started.
 *
 * <H2>Usage Example</H2>
 *
 * <pre>
 *
 * QueueReference queue = QueueReference.durableExclusive("durable-queue");
 * </pre>
 */
@Immutable
public final class QueueReference {

    private final String name;
    private final boolean durable;
    private final boolean exclusive;

    private QueueReference(String name, boolean durable, boolean exclusive) {
        this.name = Argument.expectNonEmpty(name, "queue name");
        this.durable = durable;
        this.exclusive = exclusive;
    }

    /**
     * Creates a reference to a durable queue which permits at most one bound consumer at a time.
     *
     * @param name queue name
     * @return QueueReference queue reference
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static QueueReference durableExclusive(String name) {
        return new QueueReference(name, true, true);
    }

    /**
     * Creates a reference to a durable queue shared by several consumers.
     *
     * @param name queue name
     * @return QueueReference queue reference
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static QueueReference durableNonExclusive(String name) {
        return new QueueReference(name, true, false);
    }

    /**
     * Creates a reference to a temporary queue owned by a single consumer.
     *
     * @param name queue name
     * @return QueueReference queue reference
     * @throws IllegalArgumentException if the name is null or blank
     */
    public static QueueReference nonDurableExclusive(String name) {
        return new QueueReference(name, false, true);
    }

    public String name() {
        return name;
    }

    public boolean isDurable() {
        return durable;
    }

    public boolean isExclusive() {
        return exclusive;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof QueueReference)) {
            return false;
        }
        QueueReference other = (QueueReference) obj;
        return name.equals(other.name) && durable == other.durable && exclusive == other.exclusive;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, durable, exclusive);
    }

    @Override
    public String toString() {
        return "[ QueueReference name=\""
                + name
                + "\" durable="
                + durable
                + " exclusive="
                + exclusive
                + " ]";
    }
}
