package express.mvp.mcpr.transport.config;

import express.mvp.mcpr.transport.error.ReconnectPolicy;
import express.mvp.mcpr.transport.routing.CapabilityKind;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolved configuration for a router and the connections it owns.
 *
 * <p>This immutable object names the available endpoints, binds capability kinds to them and
 * carries the connection-wide tuning shared by every connection.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Transport Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>endpoints</td><td>none</td><td>Named {@link EndpointConfig}s</td></tr>
 *   <tr><td>bindings</td><td>none</td><td>Capability kind to endpoint name</td></tr>
 *   <tr><td>defaultEndpoint</td><td>sole endpoint</td><td>Fallback for unbound kinds</td></tr>
 *   <tr><td>reconnectPolicy</td><td>5 x 200ms..10s</td><td>Backoff when re-opening</td></tr>
 *   <tr><td>heartbeat</td><td>15s / 5s / 3</td><td>Liveness probing</td></tr>
 *   <tr><td>callTimeout</td><td>30s</td><td>Deadline of calls without one</td></tr>
 *   <tr><td>sweepInterval</td><td>100ms</td><td>Period of the deadline sweep</td></tr>
 *   <tr><td>authTokenProvider</td><td>none</td><td>Credentials for socket/event-stream</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * TransportConfig config = TransportConfig.builder()
 *     .endpoint("tools", EndpointConfig.socket("localhost", 7070).build())
 *     .endpoint("resources", EndpointConfig.pipe("resource-server").build())
 *     .bind(CapabilityKind.TOOL, "tools")
 *     .bind(CapabilityKind.RESOURCE, "resources")
 *     .defaultEndpoint("tools")
 *     .build();
 *
 * TransportRouter router = new TransportRouter(config);
 * }</pre>
 *
 * @see express.mvp.mcpr.transport.routing.TransportRouter
 */
public final class TransportConfig {

    private final Map<String, EndpointConfig> endpoints;
    private final Map<CapabilityKind, String> bindings;
    private final String defaultEndpoint;
    private final ReconnectPolicy reconnectPolicy;
    private final HeartbeatConfig heartbeat;
    private final Duration callTimeout;
    private final Duration sweepInterval;
    private final AuthTokenProvider authTokenProvider;

    private TransportConfig(Builder builder) {
        this.endpoints = Collections.unmodifiableMap(new LinkedHashMap<>(builder.endpoints));
        EnumMap<CapabilityKind, String> copy = new EnumMap<>(CapabilityKind.class);
        copy.putAll(builder.bindings);
        this.bindings = Collections.unmodifiableMap(copy);
        this.defaultEndpoint = builder.defaultEndpoint;
        this.reconnectPolicy = builder.reconnectPolicy;
        this.heartbeat = builder.heartbeat;
        this.callTimeout = builder.callTimeout;
        this.sweepInterval = builder.sweepInterval;
        this.authTokenProvider = builder.authTokenProvider;
    }

    /**
     * Creates a new builder for constructing configuration.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the named endpoints in declaration order.
     *
     * @return endpoints by name
     */
    public Map<String, EndpointConfig> endpoints() {
        return endpoints;
    }

    /**
     * Returns the explicit capability bindings.
     *
     * @return endpoint name by capability kind
     */
    public Map<CapabilityKind, String> bindings() {
        return bindings;
    }

    /**
     * Returns the fallback endpoint name.
     *
     * @return the default endpoint name, or null if none
     */
    public String defaultEndpoint() {
        return defaultEndpoint;
    }

    /**
     * Returns the endpoint name serving a capability kind.
     *
     * @param kind the capability kind
     * @return the bound endpoint name, the default one, or empty if neither exists
     */
    public Optional<String> endpointFor(CapabilityKind kind) {
        String bound = bindings.get(kind);
        return Optional.ofNullable(bound != null ? bound : defaultEndpoint);
    }

    /**
     * Returns the names of endpoints that some capability resolves to.
     *
     * @return referenced endpoint names in declaration order
     */
    public Set<String> referencedEndpoints() {
        Set<String> referenced = new LinkedHashSet<>();
        for (String name : endpoints.keySet()) {
            if (name.equals(defaultEndpoint) || bindings.containsValue(name)) {
                referenced.add(name);
            }
        }
        return referenced;
    }

    /**
     * Returns the reconnect policy.
     *
     * @return backoff parameters
     */
    public ReconnectPolicy reconnectPolicy() {
        return reconnectPolicy;
    }

    /**
     * Returns the heartbeat configuration.
     *
     * @return heartbeat parameters
     */
    public HeartbeatConfig heartbeat() {
        return heartbeat;
    }

    /**
     * Returns the deadline applied to calls submitted without one.
     *
     * @return default call timeout
     */
    public Duration callTimeout() {
        return callTimeout;
    }

    /**
     * Returns the period of the pending-call deadline sweep.
     *
     * @return sweep interval
     */
    public Duration sweepInterval() {
        return sweepInterval;
    }

    /**
     * Returns the credential provider.
     *
     * @return the provider, or empty when transports connect without credentials
     */
    public Optional<AuthTokenProvider> authTokenProvider() {
        return Optional.ofNullable(authTokenProvider);
    }

    /**
     * Checks cross-references and the completeness of every referenced endpoint.
     *
     * @throws ConfigException describing the first problem found
     */
    public void validate() {
        if (endpoints.isEmpty()) {
            throw new ConfigException("no endpoints configured");
        }
        if (defaultEndpoint != null && !endpoints.containsKey(defaultEndpoint)) {
            throw new ConfigException("default endpoint '" + defaultEndpoint + "' is not defined");
        }
        for (Map.Entry<CapabilityKind, String> binding : bindings.entrySet()) {
            if (!endpoints.containsKey(binding.getValue())) {
                throw new ConfigException(
                        binding.getKey()
                                + " is bound to undefined endpoint '"
                                + binding.getValue()
                                + "'");
            }
        }
        for (String name : referencedEndpoints()) {
            endpoints.get(name).validate(name);
        }
    }

    /** Builder for {@link TransportConfig}. */
    public static final class Builder {
        private final Map<String, EndpointConfig> endpoints = new LinkedHashMap<>();
        private final Map<CapabilityKind, String> bindings = new EnumMap<>(CapabilityKind.class);
        private String defaultEndpoint;
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();
        private HeartbeatConfig heartbeat = HeartbeatConfig.defaults();
        private Duration callTimeout = Duration.ofSeconds(30);
        private Duration sweepInterval = Duration.ofMillis(100);
        private AuthTokenProvider authTokenProvider;

        private Builder() {}

        /**
         * Adds a named endpoint.
         *
         * @param name unique endpoint name
         * @param endpoint endpoint parameters
         * @return this builder
         * @throws ConfigException if the name is blank or already used
         */
        public Builder endpoint(String name, EndpointConfig endpoint) {
            Objects.requireNonNull(endpoint, "endpoint");
            if (name == null || name.isBlank()) {
                throw new ConfigException("endpoint name must not be blank");
            }
            if (endpoints.putIfAbsent(name, endpoint) != null) {
                throw new ConfigException("duplicate endpoint name '" + name + "'");
            }
            return this;
        }

        /**
         * Binds a capability kind to an endpoint.
         *
         * <p>Binding {@link CapabilityKind#DEFAULT} is the same as {@link #defaultEndpoint}.
         *
         * @param kind the capability kind
         * @param endpointName the endpoint name
         * @return this builder
         */
        public Builder bind(CapabilityKind kind, String endpointName) {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(endpointName, "endpointName");
            if (kind == CapabilityKind.DEFAULT) {
                this.defaultEndpoint = endpointName;
            } else {
                bindings.put(kind, endpointName);
            }
            return this;
        }

        /**
         * Sets the fallback endpoint for unbound capability kinds.
         *
         * @param endpointName the endpoint name
         * @return this builder
         */
        public Builder defaultEndpoint(String endpointName) {
            this.defaultEndpoint = Objects.requireNonNull(endpointName, "endpointName");
            return this;
        }

        /**
         * Sets the reconnect policy.
         *
         * @param policy the policy
         * @return this builder
         */
        public Builder reconnectPolicy(ReconnectPolicy policy) {
            this.reconnectPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        /**
         * Sets the heartbeat configuration.
         *
         * @param heartbeat the heartbeat parameters
         * @return this builder
         */
        public Builder heartbeat(HeartbeatConfig heartbeat) {
            this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
            return this;
        }

        /**
         * Sets the default call timeout.
         *
         * @param timeout the timeout
         * @return this builder
         * @throws ConfigException if not positive
         */
        public Builder callTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new ConfigException("callTimeout must be positive");
            }
            this.callTimeout = timeout;
            return this;
        }

        /**
         * Sets the deadline sweep interval.
         *
         * @param interval the interval
         * @return this builder
         * @throws ConfigException if not positive
         */
        public Builder sweepInterval(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative() || interval.isZero()) {
                throw new ConfigException("sweepInterval must be positive");
            }
            this.sweepInterval = interval;
            return this;
        }

        /**
         * Sets the credential provider.
         *
         * @param provider the provider, or null for none
         * @return this builder
         */
        public Builder authTokenProvider(AuthTokenProvider provider) {
            this.authTokenProvider = provider;
            return this;
        }

        /**
         * Builds the configuration. A single endpoint becomes the default when none is set.
         *
         * @return new configuration
         */
        public TransportConfig build() {
            if (defaultEndpoint == null && endpoints.size() == 1) {
                defaultEndpoint = endpoints.keySet().iterator().next();
            }
            return new TransportConfig(this);
        }
    }
}
