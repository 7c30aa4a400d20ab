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

import com.bloomberg.pmr.MessageSettlementOutcome;
import com.bloomberg.pmr.MessagingService;
import com.bloomberg.pmr.PersistentMessageReceiver;
import com.bloomberg.pmr.PmrException;
import com.bloomberg.pmr.QueueReference;
import com.bloomberg.pmr.ReceiverProperty;
import com.bloomberg.pmr.ResultCodes.GenericResult;
import com.bloomberg.pmr.ServiceOptions;
import com.bloomberg.pmr.Session;
import java.lang.invoke.MethodHandles;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application which consumes guaranteed messages from a durable exclusive queue and settles each
 * of them with a configurable outcome.
 *
 * <h2>Guaranteed receiver with negative acknowledgement</h2>
 *
 * In a nutshell, this example does the following:
 *
 * <ul>
 *   <li>1. Connects to the broker using {@code SOLACE_HOST}, {@code SOLACE_VPN}, {@code
 *       SOLACE_USERNAME} and {@code SOLACE_PASSWORD} environment variables
 *   <li>2. Builds a client acknowledged receiver supporting {@code FAILED} and {@code REJECTED}
 *       outcomes, either with builder methods or from a configuration property map
 *   <li>3. Binds the receiver to queue {@code durable-queue}, which must exist on the broker
 *   <li>4. Prints and settles each message until Ctrl-C is pressed
 *   <li>5. Terminates the receiver and disconnects
 * </ul>
 *
 * <p>Usage: {@code GuaranteedReceiverNack [accept|fail|reject] [builder|provider]}
 *
 * <p>Each fatal error maps to its own {@link ExitCode}.
 */
public class GuaranteedReceiverNack {

    static final Logger logger = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    static final String QUEUE_NAME = "durable-queue";

    static final String USAGE =
            "Usage: GuaranteedReceiverNack [accept|fail|reject] [builder|provider]";

    /** How the receiver settings are specified. */
    enum ConfigurationPath {
        BUILDER,
        PROVIDER
    }

    static MessageSettlementOutcome parseOutcome(String arg) {
        switch (arg.toLowerCase(Locale.ROOT)) {
            case "accept":
                return MessageSettlementOutcome.ACCEPTED;
            case "fail":
                return MessageSettlementOutcome.FAILED;
            case "reject":
                return MessageSettlementOutcome.REJECTED;
            default:
                throw new IllegalArgumentException("Unknown outcome: '" + arg + "'");
        }
    }

    static ConfigurationPath parseConfigurationPath(String arg) {
        switch (arg.toLowerCase(Locale.ROOT)) {
            case "builder":
                return ConfigurationPath.BUILDER;
            case "provider":
                return ConfigurationPath.PROVIDER;
            default:
                throw new IllegalArgumentException("Unknown configuration path: '" + arg + "'");
        }
    }

    /**
     * Builds a client acknowledged receiver supporting {@code FAILED} and {@code REJECTED}
     * outcomes with explicit builder method calls.
     */
    static PersistentMessageReceiver buildWithBuilderMethod(
            MessagingService service, QueueReference queue) {
        return service.createPersistentMessageReceiverBuilder()
                .withMessageClientAcknowledgement()
                .withRequiredMessageOutcomeSupport(
                        MessageSettlementOutcome.FAILED, MessageSettlementOutcome.REJECTED)
                .build(queue);
    }

    /** Builds the same receiver as {@link #buildWithBuilderMethod} from a property map. */
    static PersistentMessageReceiver buildWithConfigurationProvider(
            MessagingService service, QueueReference queue) {
        Map<String, String> props = new HashMap<>();
        props.put(ReceiverProperty.ACK_STRATEGY, "client");
        props.put(
                ReceiverProperty.REQUIRED_OUTCOME_SUPPORT,
                MessageSettlementOutcome.toList(
                        EnumSet.of(
                                MessageSettlementOutcome.FAILED,
                                MessageSettlementOutcome.REJECTED)));

        return service.createPersistentMessageReceiverBuilder()
                .fromConfigurationProvider(props)
                .build(queue);
    }

    static String missingQueueDiagnostic(String queueName, PmrException error) {
        return "Queue '"
                + queueName
                + "' is not provisioned on the broker, create it before running this example ("
                + error.getMessage()
                + ")";
    }

    /**
     * Runs the example until the shutdown signal.
     *
     * @param args command line arguments
     * @param env environment variables
     * @param serviceFactory creates a messaging service from the connection options
     * @param coordinator shutdown coordinator
     * @return ExitCode process exit code
     */
    static ExitCode run(
            String[] args,
            Map<String, String> env,
            Function<ServiceOptions, MessagingService> serviceFactory,
            ShutdownCoordinator coordinator) {
        if (args.length > 2) {
            logger.error(USAGE);
            return ExitCode.USAGE;
        }

        final MessageSettlementOutcome outcome;
        final ConfigurationPath path;
        try {
            outcome =
                    args.length > 0 ? parseOutcome(args[0]) : MessageSettlementOutcome.ACCEPTED;
            path = args.length > 1 ? parseConfigurationPath(args[1]) : ConfigurationPath.BUILDER;
        } catch (IllegalArgumentException e) {
            logger.error("{}. {}", e.getMessage(), USAGE);
            return ExitCode.USAGE;
        }

        final MessagingService service;
        try {
            ServiceOptions options = ServiceOptions.fromEnvironment(env);
            logger.info("Connection options: {}", options);
            service = serviceFactory.apply(options);
            service.connect();
        } catch (IllegalArgumentException | PmrException e) {
            logger.error("Failed to connect to the broker: {}", e.getMessage());
            return ExitCode.CONNECTION_ERROR;
        }
        logger.info("Messaging service connected: {}", service.isConnected());

        final QueueReference queue = QueueReference.durableExclusive(QUEUE_NAME);
        final PersistentMessageReceiver receiver;
        try {
            receiver =
                    path == ConfigurationPath.BUILDER
                            ? buildWithBuilderMethod(service, queue)
                            : buildWithConfigurationProvider(service, queue);
        } catch (PmrException e) {
            logger.error("Failed to build receiver: {}", e.getMessage());
            service.disconnect();
            return ExitCode.BUILD_ERROR;
        }

        final ReceiverContext ctx = new ReceiverContext(service, receiver);
        try {
            receiver.start();
        } catch (PmrException e) {
            if (e.code() == GenericResult.MISSING_RESOURCE) {
                logger.error(missingQueueDiagnostic(QUEUE_NAME, e));
                coordinator.shutdown(ctx);
                return ExitCode.MISSING_QUEUE;
            }
            logger.error("Failed to start receiver: {}", e.getMessage());
            coordinator.shutdown(ctx);
            return ExitCode.START_ERROR;
        }
        logger.info("Persistent receiver running: {}", receiver.isRunning());

        try {
            receiver.receiveAsync(new SettlingMessageHandler(receiver, outcome));
        } catch (PmrException e) {
            logger.error("Failed to register message handler: {}", e.getMessage());
            coordinator.shutdown(ctx);
            return ExitCode.REGISTRATION_ERROR;
        }

        coordinator.arm();
        logger.info("*** Settling messages as {}, press Ctrl-C to exit ***", outcome);
        coordinator.awaitAndShutdown(ctx);

        return Thread.currentThread().isInterrupted() ? ExitCode.INTERRUPTED : ExitCode.SUCCESS;
    }

    public static void main(String[] args) {
        final ShutdownCoordinator coordinator = new ShutdownCoordinator(true);
        final ExitCode code = run(args, System.getenv(), Session::new, coordinator);

        // Calling exit from a JVM which is already shutting down would block
        if (code != ExitCode.SUCCESS && !coordinator.isSignalled()) {
            System.exit(code.code());
        }
    }
}
