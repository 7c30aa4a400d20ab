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
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.annotation.concurrent.Immutable;

/**
 * A value-semantic type to configure the connection of a {@link MessagingService} with the broker.
 *
 * <p>The following parameters are supported:
 *
 * <ul>
 *   <li>{@code hosts}: one or more broker URIs in the format {@code tcp://<host>:<port>}. When a
 *       host is given without scheme {@code tcp://} is assumed. The service connects to the first
 *       reachable host of the list. Default is {@code tcp://localhost:55555,tcp://localhost:55554}.
 *   <li>{@code vpnName}: message VPN (namespace) to join. Default is {@code "default"}.
 *   <li>{@code username}, {@code password}: basic authentication credentials. Default is {@code
 *       "default"} for both.
 *   <li>{@code connectTimeout}: timeout of a single connect attempt. Default is 30 seconds.
 *   <li>{@code connectRetries}: number of additional connect attempts. Default is 0, connection
 *       failures are reported to the caller right away.
 * </ul>
 *
 * <H2>Thread Safety</H2>
 *
 * Once created {@code ServiceOptions} object is immutable and thread safe. Helper class {@code
 * Builder} is provided for {@code ServiceOptions} creation.
 *
 * <H2>Usage Example 1</H2>
 *
 * Create {@code ServiceOptions} from the process environment ({@code SOLACE_HOST}, {@code
 * SOLACE_VPN}, {@code SOLACE_USERNAME}, {@code SOLACE_PASSWORD}):
 *
 * <pre>
 *
 * ServiceOptions opts = ServiceOptions.fromEnvironment(System.getenv());
 * </pre>
 *
 * <H2>Usage Example 2</H2>
 *
 * Create {@code ServiceOptions} object with custom values:
 *
 * <pre>
 *
 * ServiceOptions opts = ServiceOptions.builder()
 *                                     .setHosts("tcp://broker:55555")
 *                                     .setVpnName("trading")
 *                                     .build();
 * </pre>
 */
@Immutable
public final class ServiceOptions {

    public static final String ENV_HOST = "SOLACE_HOST";
    public static final String ENV_VPN = "SOLACE_VPN";
    public static final String ENV_USERNAME = "SOLACE_USERNAME";
    public static final String ENV_PASSWORD = "SOLACE_PASSWORD";

    static final String DEFAULT_HOSTS = "tcp://localhost:55555,tcp://localhost:55554";
    static final String DEFAULT_VPN = "default";
    static final String DEFAULT_USERNAME = "default";
    static final String DEFAULT_PASSWORD = "default";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_CONNECT_RETRIES = 0;

    private static final String DEFAULT_SCHEME = "tcp://";
    private static final String HOST_DELIMITER = ",";

    private final List<URI> hosts;
    private final String vpnName;
    private final String username;
    private final String password;
    private final Duration connectTimeout;
    private final int connectRetries;

    private ServiceOptions(Builder builder) {
        hosts = Collections.unmodifiableList(new ArrayList<>(builder.hosts));
        vpnName = builder.vpnName;
        username = builder.username;
        password = builder.password;
        connectTimeout = builder.connectTimeout;
        connectRetries = builder.connectRetries;
    }

    /**
     * Creates this class object with default settings.
     *
     * @return ServiceOptions immutable service settings object with default values
     */
    public static ServiceOptions createDefault() {
        return builder().build();
    }

    /**
     * Returns a helper class object to set different service level options.
     *
     * @return Builder service options setter
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates options from environment variables. Variables which are not set fall back to the
     * defaults.
     *
     * @param env environment, usually {@code System.getenv()}
     * @return ServiceOptions immutable service settings
     * @throws IllegalArgumentException if {@code SOLACE_HOST} is not a parseable host list
     */
    public static ServiceOptions fromEnvironment(Map<String, String> env) {
        Argument.expectNonNull(env, "env");
        return builder()
                .setHosts(env.getOrDefault(ENV_HOST, DEFAULT_HOSTS))
                .setVpnName(env.getOrDefault(ENV_VPN, DEFAULT_VPN))
                .setUsername(env.getOrDefault(ENV_USERNAME, DEFAULT_USERNAME))
                .setPassword(env.getOrDefault(ENV_PASSWORD, DEFAULT_PASSWORD))
                .build();
    }

    /**
     * Creates options from a property map keyed by {@link ServiceProperty} constants. Missing keys
     * fall back to the defaults, unknown keys are ignored.
     *
     * @param properties service property map
     * @return ServiceOptions immutable service settings
     * @throws IllegalArgumentException if any value can't be parsed
     */
    public static ServiceOptions fromProperties(Map<String, String> properties) {
        Argument.expectNonNull(properties, "properties");
        Builder builder = builder();

        String value = properties.get(ServiceProperty.TRANSPORT_HOST);
        if (value != null) {
            builder.setHosts(value);
        }
        value = properties.get(ServiceProperty.VPN_NAME);
        if (value != null) {
            builder.setVpnName(value);
        }
        value = properties.get(ServiceProperty.BASIC_USERNAME);
        if (value != null) {
            builder.setUsername(value);
        }
        value = properties.get(ServiceProperty.BASIC_PASSWORD);
        if (value != null) {
            builder.setPassword(value);
        }
        value = properties.get(ServiceProperty.CONNECT_TIMEOUT_MS);
        if (value != null) {
            builder.setConnectTimeout(
                    Duration.ofMillis(parseNumber(value, ServiceProperty.CONNECT_TIMEOUT_MS)));
        }
        value = properties.get(ServiceProperty.CONNECT_RETRIES);
        if (value != null) {
            builder.setConnectRetries(parseInt(value, ServiceProperty.CONNECT_RETRIES));
        }
        return builder.build();
    }

    /**
     * Parses a comma-separated host list.
     *
     * @param hostList e.g. {@code "tcp://host1:55555, host2:55554"}
     * @return List of broker URIs, never empty
     * @throws IllegalArgumentException if the list is empty or contains an invalid URI
     */
    public static List<URI> parseHosts(String hostList) {
        Argument.expectNonNull(hostList, "hosts");

        List<URI> res = new ArrayList<>();
        for (String entry : hostList.split(HOST_DELIMITER)) {
            String host = entry.trim();
            if (host.isEmpty()) {
                continue;
            }
            if (!host.contains("://")) {
                host = DEFAULT_SCHEME + host;
            }
            URI uri;
            try {
                uri = URI.create(host);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid broker URI: '" + entry.trim() + "'", e);
            }
            // Registry-based authorities (e.g. 'solace_broker:55555') are passed to the broker
            // client as is
            Argument.expectCondition(
                    uri.getAuthority() != null, "Invalid broker URI: '", entry.trim(), "'");
            res.add(uri);
        }
        Argument.expectCondition(!res.isEmpty(), "'hosts' must contain at least one broker URI");
        return res;
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid value for '" + key + "': '" + value + "'", e);
        }
    }

    private static long parseNumber(String value, String key) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid value for '" + key + "': '" + value + "'", e);
        }
    }

    /**
     * Returns broker URIs in connection order.
     *
     * @return List unmodifiable list of broker URIs
     */
    public List<URI> hosts() {
        return hosts;
    }

    /**
     * Returns broker URIs as a comma-separated list.
     *
     * @return String host list
     */
    public String hostList() {
        return hosts.stream().map(URI::toString).collect(Collectors.joining(HOST_DELIMITER));
    }

    public String vpnName() {
        return vpnName;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public int connectRetries() {
        return connectRetries;
    }

    @Override
    public String toString() {
        JsonArray hostArray = new JsonArray();
        for (URI uri : hosts) {
            hostArray.add(uri.toString());
        }
        JsonObject obj = new JsonObject();
        obj.add("hosts", hostArray);
        obj.addProperty("vpnName", vpnName);
        obj.addProperty("username", username);
        obj.addProperty("password", "******");
        obj.addProperty("connectTimeoutMs", connectTimeout.toMillis());
        obj.addProperty("connectRetries", connectRetries);
        return new Gson().toJson(obj);
    }

    /** Helper class to create a {@code ServiceOptions} object with custom settings. */
    public static class Builder {
        private List<URI> hosts;
        private String vpnName;
        private String username;
        private String password;
        private Duration connectTimeout;
        private int connectRetries;

        private Builder() {
            hosts = parseHosts(DEFAULT_HOSTS);
            vpnName = DEFAULT_VPN;
            username = DEFAULT_USERNAME;
            password = DEFAULT_PASSWORD;
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
            connectRetries = DEFAULT_CONNECT_RETRIES;
        }

        /**
         * Creates a {@code ServiceOptions} object based on this {@code Builder} properties.
         *
         * @return ServiceOptions immutable service options with custom settings
         */
        public ServiceOptions build() {
            return new ServiceOptions(this);
        }

        /**
         * Sets broker URIs from a comma-separated host list.
         *
         * @param hostList comma-separated broker URIs
         * @return Builder this object
         * @throws IllegalArgumentException if the list can't be parsed
         */
        public Builder setHosts(String hostList) {
            hosts = parseHosts(hostList);
            return this;
        }

        /**
         * Sets broker URIs.
         *
         * @param value non-empty list of broker URIs
         * @return Builder this object
         * @throws IllegalArgumentException if the list is null or empty
         */
        public Builder setHosts(List<URI> value) {
            Argument.expectNonNull(value, "hosts");
            Argument.expectCondition(
                    !value.isEmpty(), "'hosts' must contain at least one broker URI");
            hosts = new ArrayList<>(value);
            return this;
        }

        public Builder setVpnName(String value) {
            vpnName = Argument.expectNonNull(value, "vpn name");
            return this;
        }

        public Builder setUsername(String value) {
            username = Argument.expectNonNull(value, "username");
            return this;
        }

        public Builder setPassword(String value) {
            password = Argument.expectNonNull(value, "password");
            return this;
        }

        public Builder setConnectTimeout(Duration value) {
            Argument.expectPositive(value, "connect timeout");
            Argument.expectCondition(
                    value.toMillis() <= Integer.MAX_VALUE,
                    "'connect timeout' must not exceed ",
                    Integer.MAX_VALUE,
                    " ms");
            connectTimeout = value;
            return this;
        }

        public Builder setConnectRetries(int value) {
            connectRetries = Argument.expectNonNegative(value, "connect retries");
            return this;
        }
    }
}
