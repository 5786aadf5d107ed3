package express.mvp.mcpr.transport.routing;

import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportFactory;
import express.mvp.mcpr.transport.codec.JsonMessageCodec;
import express.mvp.mcpr.transport.codec.MessageCodec;
import express.mvp.mcpr.transport.config.AuthTokenProvider;
import express.mvp.mcpr.transport.config.ConfigException;
import express.mvp.mcpr.transport.config.EndpointConfig;
import express.mvp.mcpr.transport.config.TransportConfig;
import express.mvp.mcpr.transport.connection.ConnectionManager;
import express.mvp.mcpr.transport.lifecycle.ConnectionState;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps capability kinds to connections.
 *
 * <p>Built once from a {@link TransportConfig}. Construction validates the configuration (so an
 * incomplete endpoint is a {@link ConfigException} here, never a runtime error later), creates one
 * {@link ConnectionManager} per referenced endpoint, and starts them. Capabilities bound to the
 * same endpoint share its connection; kinds without a binding use the default endpoint.
 *
 * <h2>Partial Failure</h2>
 *
 * <p>Connections are independent. A tool connection stuck in {@code RECONNECTING} does not
 * affect calls resolved to a healthy resource connection. When a connection ends up
 * {@code FAILED}, registered {@link ConnectionFailureListener}s are told and the decision of what
 * to do is theirs.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (TransportRouter router = new TransportRouter(config)) {
 *     router.addFailureListener((connection, cause) ->
 *         LOGGER.severe(connection.name() + " is gone: " + cause));
 *     MessageDispatcher dispatcher = new MessageDispatcher(router);
 *     JsonNode page = dispatcher.call(CapabilityKind.RESOURCE, "resources/read", params, timeout);
 * }
 * }</pre>
 */
public final class TransportRouter implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(TransportRouter.class.getName());

    private final TransportConfig config;
    private final MessageCodec codec;
    private final Map<String, ConnectionManager> connections;
    private final Map<CapabilityKind, ConnectionManager> routes;
    private final List<ConnectionFailureListener> failureListeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a router with the JSON codec and the standard transports.
     *
     * @param config the transport configuration
     * @throws ConfigException if the configuration is invalid or incomplete
     */
    public TransportRouter(TransportConfig config) {
        this(config, new JsonMessageCodec(), TransportFactory::create);
    }

    /**
     * Creates a router with a custom codec and transport source.
     *
     * @param config the transport configuration
     * @param codec the message codec shared by all connections
     * @param transports creates the transport for an endpoint
     * @throws ConfigException if the configuration is invalid or incomplete
     */
    public TransportRouter(
            TransportConfig config,
            MessageCodec codec,
            BiFunction<EndpointConfig, AuthTokenProvider, Transport> transports) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(transports, "transports");
        config.validate();

        AuthTokenProvider tokens = config.authTokenProvider().orElse(null);
        Map<String, ConnectionManager> created = new LinkedHashMap<>();
        for (String name : config.referencedEndpoints()) {
            Transport transport = transports.apply(config.endpoints().get(name), tokens);
            ConnectionManager connection = new ConnectionManager(name, transport, codec, config);
            connection.addStateListener(
                    (previous, current, cause) -> {
                        if (current == ConnectionState.FAILED) {
                            onFailed(connection, cause);
                        }
                    });
            created.put(name, connection);
        }
        this.connections = Collections.unmodifiableMap(created);

        EnumMap<CapabilityKind, ConnectionManager> resolved = new EnumMap<>(CapabilityKind.class);
        for (CapabilityKind kind : CapabilityKind.values()) {
            config.endpointFor(kind).ifPresent(name -> resolved.put(kind, created.get(name)));
        }
        this.routes = Collections.unmodifiableMap(resolved);

        for (ConnectionManager connection : created.values()) {
            connection.start();
        }
        LOGGER.log(Level.INFO, "Router started with connections {0}", created.keySet());
    }

    /**
     * Returns the connection serving a capability kind.
     *
     * @param kind the capability kind
     * @return its connection (the default connection when the kind is unbound)
     * @throws IllegalArgumentException if no connection serves the kind
     */
    public ConnectionManager resolve(CapabilityKind kind) {
        ConnectionManager connection = routes.get(Objects.requireNonNull(kind, "kind"));
        if (connection == null) {
            throw new IllegalArgumentException("no connection serves " + kind);
        }
        return connection;
    }

    /**
     * Returns all connections by endpoint name.
     *
     * @return the connections
     */
    public Map<String, ConnectionManager> connections() {
        return connections;
    }

    /**
     * Returns a connection by endpoint name.
     *
     * @param name the endpoint name
     * @return the connection
     * @throws IllegalArgumentException if no such connection exists
     */
    public ConnectionManager connection(String name) {
        ConnectionManager connection = connections.get(name);
        if (connection == null) {
            throw new IllegalArgumentException("no connection named '" + name + "'");
        }
        return connection;
    }

    /**
     * Returns the configuration this router was built from.
     *
     * @return the configuration
     */
    public TransportConfig config() {
        return config;
    }

    /**
     * Returns the codec shared by all connections.
     *
     * @return the codec
     */
    public MessageCodec codec() {
        return codec;
    }

    /**
     * Registers a listener for connections that become {@code FAILED}.
     *
     * @param listener the listener
     */
    public void addFailureListener(ConnectionFailureListener listener) {
        failureListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /** Shuts every connection down. Idempotent. */
    public void shutdown() {
        for (ConnectionManager connection : connections.values()) {
            connection.shutdown();
        }
        LOGGER.info("Router shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void onFailed(ConnectionManager connection, Throwable cause) {
        LOGGER.log(
                Level.WARNING,
                "Connection {0} failed; capabilities routed to it are unavailable",
                connection.name());
        for (ConnectionFailureListener listener : failureListeners) {
            try {
                listener.onConnectionFailed(connection, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection failure listener failed", e);
            }
        }
    }
}
