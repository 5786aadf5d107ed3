package express.mvp.mcpr.server;

import express.mvp.mcpr.transport.codec.JsonMessageCodec;
import express.mvp.mcpr.transport.codec.MessageCodec;
import express.mvp.mcpr.transport.config.EndpointConfig;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link McprServer} instance.
 *
 * <p>The server can listen on a socket, serve an event stream over HTTP, or both. Either listener
 * is turned off with a port of {@code -1}; port {@code 0} binds an ephemeral port, readable from
 * the server after {@link McprServer#awaitReady}. A server with both listeners off is still useful
 * for {@link McprServer#serveStdio()}.
 *
 * <h2>Configuration Categories</h2>
 *
 * <table border="1">
 *   <caption>Configuration options by category</caption>
 *   <tr><th>Category</th><th>Options</th><th>Description</th></tr>
 *   <tr><td>Network</td><td>host, port, eventStreamPort</td><td>Listener addresses</td></tr>
 *   <tr><td>Behavior</td><td>methods, notificationListener, codec</td><td>What sessions do</td></tr>
 *   <tr><td>Security</td><td>authGate, handshakeTimeout</td><td>Who may open a session</td></tr>
 *   <tr><td>Event stream</td><td>keepAliveInterval, replayBacklog</td><td>SSE tuning</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * McprServerConfig config = McprServerConfig.builder()
 *     .host("127.0.0.1")
 *     .port(7070)
 *     .eventStreamPort(8080)
 *     .methods(MethodTable.builder().method("tools/call", tools::call).build())
 *     .authGate(AuthGate.requireToken(secret))
 *     .build();
 * }</pre>
 *
 * @see McprServer
 */
public final class McprServerConfig {

    /** Port value that turns a listener off. */
    public static final int DISABLED = -1;

    private final String host;
    private final int port;
    private final int eventStreamPort;
    private final MethodTable methods;
    private final NotificationListener notificationListener;
    private final MessageCodec codec;
    private final AuthGate authGate;
    private final Duration handshakeTimeout;
    private final Duration keepAliveInterval;
    private final int replayBacklog;
    private final int maxFrameSize;

    private McprServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.eventStreamPort = builder.eventStreamPort;
        this.methods = builder.methods;
        this.notificationListener = builder.notificationListener;
        this.codec = builder.codec;
        this.authGate = builder.authGate;
        this.handshakeTimeout = builder.handshakeTimeout;
        this.keepAliveInterval = builder.keepAliveInterval;
        this.replayBacklog = builder.replayBacklog;
        this.maxFrameSize = builder.maxFrameSize;
    }

    /**
     * Returns the address both listeners bind to.
     *
     * @return the host
     */
    public String getHost() {
        return host;
    }

    /**
     * Returns the socket listener port.
     *
     * @return the port, 0 for ephemeral, or {@link #DISABLED}
     */
    public int getPort() {
        return port;
    }

    /**
     * Returns the event-stream listener port.
     *
     * @return the port, 0 for ephemeral, or {@link #DISABLED}
     */
    public int getEventStreamPort() {
        return eventStreamPort;
    }

    /**
     * Returns the methods every session serves.
     *
     * @return the method table
     */
    public MethodTable getMethods() {
        return methods;
    }

    /**
     * Returns the listener for client notifications.
     *
     * @return the listener, or null
     */
    public NotificationListener getNotificationListener() {
        return notificationListener;
    }

    /**
     * Returns the codec shared by all sessions.
     *
     * @return the codec
     */
    public MessageCodec getCodec() {
        return codec;
    }

    /**
     * Returns the credential check applied to new sessions.
     *
     * @return the gate
     */
    public AuthGate getAuthGate() {
        return authGate;
    }

    /**
     * Returns how long an accepted socket may take to send its first frame.
     *
     * @return the handshake timeout
     */
    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    /**
     * Returns the idle time after which an event stream gets a {@code : keep-alive} comment.
     *
     * @return the keep-alive interval
     */
    public Duration getKeepAliveInterval() {
        return keepAliveInterval;
    }

    /**
     * Returns how many recent events each event-stream session keeps for {@code Last-Event-ID}
     * replay.
     *
     * @return the backlog size
     */
    public int getReplayBacklog() {
        return replayBacklog;
    }

    /**
     * Returns the largest socket frame body accepted from clients.
     *
     * @return the limit in bytes
     */
    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link McprServerConfig}.
     *
     * <h2>Default Values</h2>
     *
     * <ul>
     *   <li>host: "127.0.0.1"
     *   <li>port: 0 (ephemeral)
     *   <li>eventStreamPort: {@link #DISABLED}
     *   <li>methods: {@link MethodTable#empty()}
     *   <li>authGate: {@link AuthGate#allowAll()}
     *   <li>handshakeTimeout: 10 seconds
     *   <li>keepAliveInterval: 15 seconds
     *   <li>replayBacklog: 256 events
     * </ul>
     */
    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = 0;
        private int eventStreamPort = DISABLED;
        private MethodTable methods = MethodTable.empty();
        private NotificationListener notificationListener;
        private MessageCodec codec = new JsonMessageCodec();
        private AuthGate authGate = AuthGate.allowAll();
        private Duration handshakeTimeout = Duration.ofSeconds(10);
        private Duration keepAliveInterval = Duration.ofSeconds(15);
        private int replayBacklog = 256;
        private int maxFrameSize = EndpointConfig.DEFAULT_MAX_FRAME_SIZE;

        private Builder() {}

        /**
         * Sets the bind address.
         *
         * @param host host name or address
         * @return this builder
         */
        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        /**
         * Sets the socket listener port.
         *
         * @param port 0 to 65535, or {@link #DISABLED}
         * @return this builder
         */
        public Builder port(int port) {
            this.port = checkPort(port);
            return this;
        }

        /**
         * Sets the event-stream listener port.
         *
         * @param port 0 to 65535, or {@link #DISABLED}
         * @return this builder
         */
        public Builder eventStreamPort(int port) {
            this.eventStreamPort = checkPort(port);
            return this;
        }

        /**
         * Sets the method table.
         *
         * @param methods the methods
         * @return this builder
         */
        public Builder methods(MethodTable methods) {
            this.methods = Objects.requireNonNull(methods, "methods");
            return this;
        }

        /**
         * Sets the notification listener.
         *
         * @param listener the listener, or null
         * @return this builder
         */
        public Builder notificationListener(NotificationListener listener) {
            this.notificationListener = listener;
            return this;
        }

        /**
         * Sets the codec.
         *
         * @param codec the codec
         * @return this builder
         */
        public Builder codec(MessageCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /**
         * Sets the credential check.
         *
         * @param gate the gate
         * @return this builder
         */
        public Builder authGate(AuthGate gate) {
            this.authGate = Objects.requireNonNull(gate, "gate");
            return this;
        }

        /**
         * Sets the socket handshake timeout.
         *
         * @param timeout a positive duration
         * @return this builder
         */
        public Builder handshakeTimeout(Duration timeout) {
            this.handshakeTimeout = positive(timeout, "handshakeTimeout");
            return this;
        }

        /**
         * Sets the event-stream keep-alive interval.
         *
         * @param interval a positive duration
         * @return this builder
         */
        public Builder keepAliveInterval(Duration interval) {
            this.keepAliveInterval = positive(interval, "keepAliveInterval");
            return this;
        }

        /**
         * Sets the per-session replay backlog.
         *
         * @param events number of events kept, at least 0
         * @return this builder
         */
        public Builder replayBacklog(int events) {
            if (events < 0) {
                throw new IllegalArgumentException("replayBacklog must not be negative: " + events);
            }
            this.replayBacklog = events;
            return this;
        }

        /**
         * Sets the largest accepted socket frame body.
         *
         * @param bytes a positive size
         * @return this builder
         */
        public Builder maxFrameSize(int bytes) {
            if (bytes <= 0) {
                throw new IllegalArgumentException("maxFrameSize must be positive: " + bytes);
            }
            this.maxFrameSize = bytes;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the immutable configuration
         */
        public McprServerConfig build() {
            return new McprServerConfig(this);
        }

        private static int checkPort(int port) {
            if (port != DISABLED && (port < 0 || port > 65535)) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            return port;
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
