package express.mvp.mcpr.transport.config;

import express.mvp.mcpr.transport.TransportKind;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters for one transport endpoint.
 *
 * <p>An endpoint is one of three {@link TransportKind kinds}; only the parameters of its kind are
 * meaningful. Range checks happen in the builder. Completeness (a socket without a port, a pipe
 * without a command) is checked by {@link #validate(String)}, which the router calls at
 * construction so that an incomplete endpoint is reported before any connection is attempted.
 *
 * <h2>Parameters</h2>
 *
 * <table border="1">
 *   <caption>Endpoint parameters by kind</caption>
 *   <tr><th>Kind</th><th>Parameter</th><th>Default</th></tr>
 *   <tr><td>PIPE</td><td>command (program + args)</td><td>required</td></tr>
 *   <tr><td>PIPE</td><td>workingDirectory</td><td>inherited</td></tr>
 *   <tr><td>PIPE</td><td>environment</td><td>inherited, plus overrides</td></tr>
 *   <tr><td>PIPE</td><td>closeGrace</td><td>2s</td></tr>
 *   <tr><td>EVENT_STREAM</td><td>baseUri</td><td>required</td></tr>
 *   <tr><td>EVENT_STREAM</td><td>eventsPath / messagesPath</td><td>/events, /messages</td></tr>
 *   <tr><td>EVENT_STREAM</td><td>requestTimeout</td><td>10s</td></tr>
 *   <tr><td>EVENT_STREAM</td><td>headers</td><td>none</td></tr>
 *   <tr><td>SOCKET</td><td>host / port</td><td>required</td></tr>
 *   <tr><td>SOCKET</td><td>connectTimeout</td><td>5s</td></tr>
 *   <tr><td>SOCKET</td><td>maxFrameSize</td><td>16MB</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EndpointConfig tools = EndpointConfig.socket("localhost", 7070)
 *     .connectTimeout(Duration.ofSeconds(2))
 *     .build();
 *
 * EndpointConfig resources = EndpointConfig.pipe("java", "-jar", "resources-server.jar")
 *     .closeGrace(Duration.ofSeconds(1))
 *     .build();
 * }</pre>
 */
public final class EndpointConfig {

    /** Largest frame accepted when none is configured. */
    public static final int DEFAULT_MAX_FRAME_SIZE = 16 * 1024 * 1024;

    private final TransportKind kind;

    private final List<String> command;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final Duration closeGrace;

    private final URI baseUri;
    private final String eventsPath;
    private final String messagesPath;
    private final Duration requestTimeout;
    private final Map<String, String> headers;

    private final String host;
    private final int port;
    private final Duration connectTimeout;
    private final int maxFrameSize;

    private EndpointConfig(Builder builder) {
        this.kind = builder.kind;
        this.command = Collections.unmodifiableList(new ArrayList<>(builder.command));
        this.workingDirectory = builder.workingDirectory;
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environment));
        this.closeGrace = builder.closeGrace;
        this.baseUri = builder.baseUri;
        this.eventsPath = builder.eventsPath;
        this.messagesPath = builder.messagesPath;
        this.requestTimeout = builder.requestTimeout;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.host = builder.host;
        this.port = builder.port;
        this.connectTimeout = builder.connectTimeout;
        this.maxFrameSize = builder.maxFrameSize;
    }

    /**
     * Starts a pipe endpoint.
     *
     * @param program the program to run
     * @param args its arguments
     * @return a builder
     */
    public static Builder pipe(String program, String... args) {
        Builder builder = new Builder(TransportKind.PIPE);
        if (program != null) {
            builder.command.add(program);
        }
        Collections.addAll(builder.command, args);
        return builder;
    }

    /**
     * Starts a pipe endpoint from a full command line.
     *
     * @param command program followed by its arguments
     * @return a builder
     */
    public static Builder pipe(List<String> command) {
        Builder builder = new Builder(TransportKind.PIPE);
        builder.command.addAll(command);
        return builder;
    }

    /**
     * Starts an event-stream endpoint.
     *
     * @param baseUri the server's base URI, for example {@code http://localhost:8080}
     * @return a builder
     */
    public static Builder eventStream(URI baseUri) {
        Builder builder = new Builder(TransportKind.EVENT_STREAM);
        builder.baseUri = baseUri;
        return builder;
    }

    /**
     * Starts a socket endpoint.
     *
     * @param host the host name or address
     * @param port the TCP port
     * @return a builder
     */
    public static Builder socket(String host, int port) {
        return new Builder(TransportKind.SOCKET).host(host).port(port);
    }

    /**
     * Starts an endpoint of the given kind with no parameters set.
     *
     * @param kind the transport kind
     * @return a builder
     */
    public static Builder builder(TransportKind kind) {
        return new Builder(Objects.requireNonNull(kind, "kind"));
    }

    /**
     * Checks that every parameter the kind requires is present.
     *
     * @param name the endpoint name, for the error message
     * @throws ConfigException naming the endpoint and the missing parameter
     */
    public void validate(String name) {
        switch (kind) {
            case PIPE -> {
                if (command.isEmpty() || command.get(0).isBlank()) {
                    throw new ConfigException("pipe endpoint '" + name + "' has no command");
                }
            }
            case EVENT_STREAM -> {
                if (baseUri == null) {
                    throw new ConfigException(
                            "event-stream endpoint '" + name + "' has no base URI");
                }
                String scheme = baseUri.getScheme();
                if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                    throw new ConfigException(
                            "event-stream endpoint '"
                                    + name
                                    + "' needs an http(s) URI, got "
                                    + baseUri);
                }
            }
            case SOCKET -> {
                if (host == null || host.isBlank()) {
                    throw new ConfigException("socket endpoint '" + name + "' has no host");
                }
                if (port < 0) {
                    throw new ConfigException("socket endpoint '" + name + "' has no port");
                }
            }
        }
    }

    /**
     * Returns the transport kind.
     *
     * @return the kind
     */
    public TransportKind kind() {
        return kind;
    }

    /**
     * Returns the pipe command line.
     *
     * @return program followed by arguments; empty for other kinds
     */
    public List<String> command() {
        return command;
    }

    /**
     * Returns the pipe working directory.
     *
     * @return the directory, or null to inherit
     */
    public Path workingDirectory() {
        return workingDirectory;
    }

    /**
     * Returns extra environment variables for the pipe process.
     *
     * @return environment overrides
     */
    public Map<String, String> environment() {
        return environment;
    }

    /**
     * Returns how long a closing pipe waits for the process to exit before killing it.
     *
     * @return close grace timeout
     */
    public Duration closeGrace() {
        return closeGrace;
    }

    /**
     * Returns the event-stream base URI.
     *
     * @return base URI, or null for other kinds
     */
    public URI baseUri() {
        return baseUri;
    }

    /**
     * Returns the path of the inbound event stream.
     *
     * @return events path
     */
    public String eventsPath() {
        return eventsPath;
    }

    /**
     * Returns the path outbound messages are posted to until the server names another.
     *
     * @return messages path
     */
    public String messagesPath() {
        return messagesPath;
    }

    /**
     * Returns the timeout for the stream handshake and each outbound POST.
     *
     * @return request timeout
     */
    public Duration requestTimeout() {
        return requestTimeout;
    }

    /**
     * Returns extra HTTP headers sent with every event-stream request.
     *
     * @return headers
     */
    public Map<String, String> headers() {
        return headers;
    }

    /**
     * Returns the socket host.
     *
     * @return host, or null for other kinds
     */
    public String host() {
        return host;
    }

    /**
     * Returns the socket port.
     *
     * @return port, or -1 when unset
     */
    public int port() {
        return port;
    }

    /**
     * Returns the socket connect timeout.
     *
     * @return connect timeout
     */
    public Duration connectTimeout() {
        return connectTimeout;
    }

    /**
     * Returns the largest accepted frame, for pipe lines and socket frames.
     *
     * @return max frame size in bytes
     */
    public int maxFrameSize() {
        return maxFrameSize;
    }

    /**
     * Returns a short human-readable target description for log messages.
     *
     * @return description such as {@code socket localhost:7070}
     */
    public String describe() {
        return switch (kind) {
            case PIPE -> "pipe " + String.join(" ", command);
            case EVENT_STREAM -> "event-stream " + baseUri + eventsPath;
            case SOCKET -> "socket " + host + ":" + port;
        };
    }

    @Override
    public String toString() {
        return "EndpointConfig[" + describe() + "]";
    }

    /** Builder for {@link EndpointConfig}. */
    public static final class Builder {
        private final TransportKind kind;
        private final List<String> command = new ArrayList<>();
        private Path workingDirectory;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private Duration closeGrace = Duration.ofSeconds(2);
        private URI baseUri;
        private String eventsPath = "/events";
        private String messagesPath = "/messages";
        private Duration requestTimeout = Duration.ofSeconds(10);
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String host;
        private int port = -1;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int maxFrameSize = DEFAULT_MAX_FRAME_SIZE;

        private Builder(TransportKind kind) {
            this.kind = kind;
        }

        /**
         * Sets the pipe working directory.
         *
         * @param directory the directory
         * @return this builder
         */
        public Builder workingDirectory(Path directory) {
            this.workingDirectory = directory;
            return this;
        }

        /**
         * Adds an environment variable for the pipe process.
         *
         * @param name variable name
         * @param value variable value
         * @return this builder
         */
        public Builder environment(String name, String value) {
            environment.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value));
            return this;
        }

        /**
         * Sets the pipe close grace timeout.
         *
         * @param grace grace timeout
         * @return this builder
         * @throws ConfigException if negative
         */
        public Builder closeGrace(Duration grace) {
            this.closeGrace = nonNegative(grace, "closeGrace");
            return this;
        }

        /**
         * Sets the event-stream base URI.
         *
         * @param uri base URI
         * @return this builder
         */
        public Builder baseUri(URI uri) {
            this.baseUri = uri;
            return this;
        }

        /**
         * Sets the events path.
         *
         * @param path path starting with {@code /}
         * @return this builder
         * @throws ConfigException if the path does not start with a slash
         */
        public Builder eventsPath(String path) {
            this.eventsPath = absolutePath(path, "eventsPath");
            return this;
        }

        /**
         * Sets the messages path.
         *
         * @param path path starting with {@code /}
         * @return this builder
         * @throws ConfigException if the path does not start with a slash
         */
        public Builder messagesPath(String path) {
            this.messagesPath = absolutePath(path, "messagesPath");
            return this;
        }

        /**
         * Sets the event-stream request timeout.
         *
         * @param timeout timeout
         * @return this builder
         * @throws ConfigException if not positive
         */
        public Builder requestTimeout(Duration timeout) {
            this.requestTimeout = positive(timeout, "requestTimeout");
            return this;
        }

        /**
         * Adds an HTTP header to every event-stream request.
         *
         * @param name header name
         * @param value header value
         * @return this builder
         */
        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value));
            return this;
        }

        /**
         * Sets the socket host.
         *
         * @param host host name or address
         * @return this builder
         */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * Sets the socket port.
         *
         * @param port port 0-65535
         * @return this builder
         * @throws ConfigException if out of range
         */
        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new ConfigException("port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        /**
         * Sets the socket connect timeout.
         *
         * @param timeout timeout
         * @return this builder
         * @throws ConfigException if not positive
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = positive(timeout, "connectTimeout");
            return this;
        }

        /**
         * Sets the largest accepted frame.
         *
         * @param bytes size in bytes
         * @return this builder
         * @throws ConfigException if not positive
         */
        public Builder maxFrameSize(int bytes) {
            if (bytes <= 0) {
                throw new ConfigException("maxFrameSize must be positive");
            }
            this.maxFrameSize = bytes;
            return this;
        }

        /**
         * Builds the endpoint.
         *
         * @return new endpoint configuration
         */
        public EndpointConfig build() {
            return new EndpointConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new ConfigException(name + " must be positive");
            }
            return value;
        }

        private static Duration nonNegative(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative()) {
                throw new ConfigException(name + " must not be negative");
            }
            return value;
        }

        private static String absolutePath(String path, String name) {
            Objects.requireNonNull(path, name);
            if (!path.startsWith("/")) {
                throw new ConfigException(name + " must start with '/': " + path);
            }
            return path;
        }
    }
}
