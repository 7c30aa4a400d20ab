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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import com.bloomberg.pmr.ResultCodes.GenericResult;
import com.bloomberg.pmr.util.TestBrokerClient;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SessionTest {

    static final QueueReference QUEUE = QueueReference.durableExclusive("durable-queue");

    @Test
    void testConnectDisconnect() {
        TestBrokerClient client = new TestBrokerClient(QUEUE.name());
        ServiceOptions options = ServiceOptions.createDefault();
        Session session = new Session(options, client);

        assertSame(options, session.options());
        assertFalse(session.isConnected());

        session.connect();
        assertTrue(session.isConnected());

        // Second connect is a no-op
        session.connect();
        assertEquals(1, client.connectCount());

        session.disconnect();
        assertFalse(session.isConnected());

        // Second disconnect is a no-op
        session.disconnect();
        assertEquals(1, client.disconnectCount());
    }

    @Test
    void testConnectFailure() {
        TestBrokerClient client = new TestBrokerClient(QUEUE.name());
        client.setFailConnect(true);
        Session session = new Session(ServiceOptions.createDefault(), client);

        try {
            session.connect();
            fail(); // Should not get here
        } catch (PmrException e) {
            assertEquals(GenericResult.NOT_CONNECTED, e.code());
        }
        assertFalse(session.isConnected());

        // Disconnecting a session which never connected is a no-op
        session.disconnect();
        assertEquals(0, client.disconnectCount());
    }

    @Test
    void testDisconnectTerminatesReceivers() {
        TestBrokerClient client = new TestBrokerClient(QUEUE.name());
        Session session = new Session(ServiceOptions.createDefault(), client);
        session.connect();

        PersistentMessageReceiver started =
                session.createPersistentMessageReceiverBuilder()
                        .withMessageClientAcknowledgement()
                        .build(QUEUE);
        started.start();
        started.receiveAsync(msg -> {});

        PersistentMessageReceiver notStarted =
                session.createPersistentMessageReceiverBuilder().build(QUEUE);

        session.disconnect();

        assertTrue(started.isTerminated());
        assertTrue(notStarted.isTerminated());
        assertTrue(client.lastFlow().isStopped());
        assertTrue(client.lastFlow().isClosed());
    }

    @Test
    void testTerminatedReceiversAreReleased() {
        TestBrokerClient client = new TestBrokerClient(QUEUE.name());
        Session session = new Session(ServiceOptions.createDefault(), client);
        session.connect();

        for (int i = 0; i < 10; i++) {
            PersistentMessageReceiver receiver =
                    session.createPersistentMessageReceiverBuilder().build(QUEUE);
            receiver.start();
            receiver.terminate(Duration.ZERO);
        }
        PersistentMessageReceiver live =
                session.createPersistentMessageReceiverBuilder().build(QUEUE);

        assertEquals(1, session.trackedReceivers());

        session.disconnect();
        assertTrue(live.isTerminated());
        assertEquals(0, session.trackedReceivers());
    }

    @Test
    void testStartOnDisconnectedSession() {
        Session session = new Session(ServiceOptions.createDefault(), new TestBrokerClient());

        PersistentMessageReceiver receiver =
                session.createPersistentMessageReceiverBuilder().build(QUEUE);
        try {
            receiver.start();
            fail(); // Should not get here
        } catch (PmrException e) {
            assertEquals(GenericResult.NOT_CONNECTED, e.code());
        }
        assertFalse(receiver.isRunning());
    }
}
