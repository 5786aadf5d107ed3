package express.mvp.mcpr.transport;

import express.mvp.mcpr.transport.config.AuthTokenProvider;
import express.mvp.mcpr.transport.config.EndpointConfig;
import express.mvp.mcpr.transport.pipe.PipeTransport;
import express.mvp.mcpr.transport.socket.SocketTransport;
import express.mvp.mcpr.transport.stream.EventStreamTransport;
import java.util.Objects;

/**
 * Factory for creating transport instances from endpoint configuration.
 *
 * <p>Selection is a closed switch over {@link TransportKind}; each kind maps to exactly one
 * implementation. The returned transport is not yet open.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EndpointConfig endpoint = EndpointConfig.socket("localhost", 7070).build();
 * Transport transport = TransportFactory.create(endpoint, AuthTokenProvider.fixed("s3cret"));
 * transport.open();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This factory is thread-safe. Multiple threads can create transports concurrently.
 *
 * @see Transport
 * @see EndpointConfig
 */
public final class TransportFactory {

    private TransportFactory() {
        // Utility class
    }

    /**
     * Creates a transport for an endpoint.
     *
     * @param endpoint the endpoint parameters
     * @param tokenProvider credentials for socket and event-stream transports (may be null)
     * @return a new, unopened transport
     */
    public static Transport create(EndpointConfig endpoint, AuthTokenProvider tokenProvider) {
        Objects.requireNonNull(endpoint, "endpoint");
        return switch (endpoint.kind()) {
            case PIPE -> new PipeTransport(endpoint);
            case EVENT_STREAM -> new EventStreamTransport(endpoint, tokenProvider);
            case SOCKET -> new SocketTransport(endpoint, tokenProvider);
        };
    }

    /**
     * Creates a transport without credentials.
     *
     * @param endpoint the endpoint parameters
     * @return a new, unopened transport
     */
    public static Transport create(EndpointConfig endpoint) {
        return create(endpoint, null);
    }
}
