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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.bloomberg.pmr.MessageHandler;
import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.MessagingService;
import com.bloomberg.pmr.PersistentMessageReceiver;
import com.bloomberg.pmr.PersistentMessageReceiverBuilder;
import com.bloomberg.pmr.PmrException;
import com.bloomberg.pmr.QueueReference;
import com.bloomberg.pmr.ReceiverProperty;
import com.bloomberg.pmr.ResultCodes.GenericResult;
import com.bloomberg.pmr.ServiceOptions;
import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class GuaranteedReceiverNackTest {

    static final QueueReference QUEUE = QueueReference.durableExclusive("durable-queue");

    private MessagingService service;
    private PersistentMessageReceiverBuilder builder;
    private PersistentMessageReceiver receiver;
    private AtomicReference<ServiceOptions> usedOptions;
    private Function<ServiceOptions, MessagingService> factory;

    @BeforeEach
    void setUp() {
        service = mock(MessagingService.class);
        builder = mock(PersistentMessageReceiverBuilder.class, RETURNS_SELF);
        receiver = mock(PersistentMessageReceiver.class);

        when(service.createPersistentMessageReceiverBuilder()).thenReturn(builder);
        when(service.isConnected()).thenReturn(true);
        when(builder.build(any(QueueReference.class))).thenReturn(receiver);
        when(receiver.queue()).thenReturn(QUEUE);

        usedOptions = new AtomicReference<>();
        factory =
                options -> {
                    usedOptions.set(options);
                    return service;
                };
    }

    private static ShutdownCoordinator signalledCoordinator() {
        ShutdownCoordinator coordinator = new ShutdownCoordinator(false);
        coordinator.signal();
        return coordinator;
    }

    private ExitCode run(String... args) {
        return GuaranteedReceiverNack.run(
                args, Collections.emptyMap(), factory, signalledCoordinator());
    }

    @Test
    void testParseArguments() {
        assertEquals(
                MessageSettlementOutcome.ACCEPTED, GuaranteedReceiverNack.parseOutcome("accept"));
        assertEquals(MessageSettlementOutcome.FAILED, GuaranteedReceiverNack.parseOutcome("FAIL"));
        assertEquals(
                MessageSettlementOutcome.REJECTED, GuaranteedReceiverNack.parseOutcome("reject"));
        assertEquals(
                GuaranteedReceiverNack.ConfigurationPath.PROVIDER,
                GuaranteedReceiverNack.parseConfigurationPath("provider"));
    }

    @Test
    void testUsageError() {
        assertEquals(ExitCode.USAGE, run("accept", "builder", "extra"));
        assertEquals(ExitCode.USAGE, run("nack"));
        assertEquals(ExitCode.USAGE, run("reject", "yaml"));
        assertNull(usedOptions.get());
    }

    @Test
    void testDefaultConnectionOptions() {
        assertEquals(ExitCode.SUCCESS, run());

        ServiceOptions options = usedOptions.get();
        assertEquals(
                Arrays.asList(
                        URI.create("tcp://localhost:55555"), URI.create("tcp://localhost:55554")),
                options.hosts());
        assertEquals("default", options.vpnName());
        assertEquals("default", options.username());
        assertEquals("default", options.password());
    }

    @Test
    void testConnectionOptionsFromEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("SOLACE_HOST", "tcp://broker:55555");
        env.put("SOLACE_VPN", "trading");
        env.put("SOLACE_USERNAME", "alice");
        env.put("SOLACE_PASSWORD", "secret");

        ExitCode code =
                GuaranteedReceiverNack.run(
                        new String[0], env, factory, signalledCoordinator());

        assertEquals(ExitCode.SUCCESS, code);
        assertEquals("tcp://broker:55555", usedOptions.get().hostList());
        assertEquals("trading", usedOptions.get().vpnName());
        assertEquals("alice", usedOptions.get().username());
        assertEquals("secret", usedOptions.get().password());
    }

    @Test
    void testConnectionError() {
        doThrow(new PmrException("Simulated failure", GenericResult.NOT_CONNECTED))
                .when(service)
                .connect();

        assertEquals(ExitCode.CONNECTION_ERROR, run());
        verify(service, never()).createPersistentMessageReceiverBuilder();

        Map<String, String> env = Collections.singletonMap("SOLACE_HOST", " , ");
        ExitCode code =
                GuaranteedReceiverNack.run(
                        new String[0], env, factory, signalledCoordinator());
        assertEquals(ExitCode.CONNECTION_ERROR, code);
    }

    @Test
    void testBuildError() {
        when(builder.build(any(QueueReference.class)))
                .thenThrow(new PmrException("Simulated failure", GenericResult.NOT_SUPPORTED));

        assertEquals(ExitCode.BUILD_ERROR, run());
        verify(service).disconnect();
    }

    @Test
    void testMissingQueue() {
        doThrow(
                        new PmrException(
                                "Queue 'durable-queue' does not exist on the broker",
                                GenericResult.MISSING_RESOURCE))
                .when(receiver)
                .start();

        assertEquals(ExitCode.MISSING_QUEUE, run());

        InOrder order = inOrder(receiver, service);
        order.verify(receiver).terminate(Duration.ofSeconds(1));
        order.verify(service).disconnect();
        verify(receiver, never()).receiveAsync(any(MessageHandler.class));
    }

    @Test
    void testMissingQueueDiagnostic() {
        String diagnostic =
                GuaranteedReceiverNack.missingQueueDiagnostic(
                        GuaranteedReceiverNack.QUEUE_NAME,
                        new PmrException("Unknown queue", GenericResult.MISSING_RESOURCE));

        assertTrue(diagnostic.contains("'durable-queue'"));
        assertTrue(diagnostic.contains("Unknown queue"));
    }

    @Test
    void testStartError() {
        doThrow(new PmrException("Simulated failure", GenericResult.NOT_CONNECTED))
                .when(receiver)
                .start();

        assertEquals(ExitCode.START_ERROR, run());
        verify(service).disconnect();
    }

    @Test
    void testRegistrationError() {
        doThrow(new PmrException("Simulated failure", GenericResult.ILLEGAL_STATE))
                .when(receiver)
                .receiveAsync(any(MessageHandler.class));

        assertEquals(ExitCode.REGISTRATION_ERROR, run());
        verify(receiver).terminate(ShutdownCoordinator.GRACE_PERIOD);
        verify(service).disconnect();
    }

    @Test
    void testBuilderMethodPath() {
        assertEquals(ExitCode.SUCCESS, run("reject", "builder"));

        verify(builder).withMessageClientAcknowledgement();
        verify(builder)
                .withRequiredMessageOutcomeSupport(
                        MessageSettlementOutcome.FAILED, MessageSettlementOutcome.REJECTED);
        verify(builder).build(QUEUE);
        verify(builder, never()).fromConfigurationProvider(anyMap());

        ArgumentCaptor<MessageHandler> handler = ArgumentCaptor.forClass(MessageHandler.class);
        InOrder order = inOrder(receiver, service);
        order.verify(service).connect();
        order.verify(receiver).start();
        order.verify(receiver).receiveAsync(handler.capture());
        order.verify(receiver).terminate(Duration.ofSeconds(1));
        order.verify(service).disconnect();

        assertEquals(
                MessageSettlementOutcome.REJECTED,
                ((SettlingMessageHandler) handler.getValue()).outcome());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testConfigurationProviderPath() {
        assertEquals(ExitCode.SUCCESS, run("fail", "provider"));

        ArgumentCaptor<Map<String, String>> props = ArgumentCaptor.forClass(Map.class);
        verify(builder).fromConfigurationProvider(props.capture());
        verify(builder).build(QUEUE);
        verify(builder, never()).withMessageClientAcknowledgement();

        assertEquals("client", props.getValue().get(ReceiverProperty.ACK_STRATEGY));
        assertEquals(
                "FAILED,REJECTED", props.getValue().get(ReceiverProperty.REQUIRED_OUTCOME_SUPPORT));

        ArgumentCaptor<MessageHandler> handler = ArgumentCaptor.forClass(MessageHandler.class);
        verify(receiver).receiveAsync(handler.capture());
        assertEquals(
                MessageSettlementOutcome.FAILED,
                ((SettlingMessageHandler) handler.getValue()).outcome());
    }

    @Test
    void testInterruptedWhileWaiting() {
        Thread.currentThread().interrupt();
        try {
            ExitCode code =
                    GuaranteedReceiverNack.run(
                            new String[0],
                            Collections.emptyMap(),
                            factory,
                            new ShutdownCoordinator(false));

            assertEquals(ExitCode.INTERRUPTED, code);
            verify(receiver).terminate(ShutdownCoordinator.GRACE_PERIOD);
            verify(service).disconnect();
        } finally {
            // Clear the interrupt flag for the following tests
            Thread.interrupted();
        }
    }
}
