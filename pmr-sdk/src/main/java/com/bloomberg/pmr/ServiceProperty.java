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
 * Keys of a service property map.
 *
 * @see ServiceOptions#fromProperties(java.util.Map)
 */
public final class ServiceProperty {

    /** Comma-separated list of broker URIs, e.g. {@code "tcp://host1:55555,tcp://host2:55555"}. */
    public static final String TRANSPORT_HOST = "pmr.transport.host";

    /** Message VPN (namespace) to join on the broker. */
    public static final String VPN_NAME = "pmr.service.vpn-name";

    /** Username for basic authentication. */
    public static final String BASIC_USERNAME = "pmr.authentication.basic.username";

    /** Password for basic authentication. */
    public static final String BASIC_PASSWORD = "pmr.authentication.basic.password";

    /** Connect timeout in milliseconds. */
    public static final String CONNECT_TIMEOUT_MS = "pmr.transport.connect-timeout-ms";

    /** Number of additional connect attempts, 0 disables retries. */
    public static final String CONNECT_RETRIES = "pmr.transport.connect-retries";

    private ServiceProperty() {
        throw new IllegalStateException("Utility class");
    }
}
