package express.mvp.mcpr.server;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.pipe.PipeTransport;
import express.mvp.mcpr.transport.socket.FrameType;
import express.mvp.mcpr.transport.socket.SocketFrame;
import express.mvp.mcpr.transport.socket.SocketFrameCodec;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server side of the message exchange: answers requests from clients on any transport.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────┐
 * │                        McprServer                           │
 * ├─────────────────────────────────────────────────────────────┤
 * │   ┌──────────────┐   ┌──────────────────┐   ┌────────────┐  │
 * │   │ accept loop  │   │ EventStream-     │   │ serveStdio │  │
 * │   │ (socket)     │   │ Endpoint (HTTP)  │   │ (pipe)     │  │
 * │   └──────┬───────┘   └────────┬─────────┘   └─────┬──────┘  │
 * │          │ AUTH via AuthGate  │ Bearer via gate   │         │
 * │          ▼                    ▼                   ▼         │
 * │   ┌─────────────────────────────────────────────────────┐   │
 * │   │   ServerSession per client (own thread)             │   │
 * │   │   request → MethodTable → reply                     │   │
 * │   └─────────────────────────────────────────────────────┘   │
 * └─────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Socket Handshake</h2>
 *
 * <p>A client holding a token sends it in an {@link FrameType#AUTH} frame first and gets
 * {@link FrameType#AUTH_OK} or {@link FrameType#AUTH_REJECTED}. A client without a token simply
 * starts sending; it is admitted if the gate admits a null token. When the gate refuses null
 * tokens, the first frame must arrive within the handshake timeout.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * McprServerConfig config = McprServerConfig.builder()
 *     .port(7070)
 *     .methods(MethodTable.builder()
 *         .method("tools/call", params -> tools.call(params))
 *         .build())
 *     .build();
 *
 * try (McprServer server = new McprServer(config)) {
 *     server.start();
 *     server.awaitReady(5, TimeUnit.SECONDS);
 *     // serve until stopped
 * }
 * }</pre>
 *
 * @see McprServerConfig
 * @see ServerSession
 */
public class McprServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(McprServer.class.getName());

    private final McprServerConfig config;

    private final Set<ServerSession> sessions = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final CountDownLatch readyLatch = new CountDownLatch(1);

    private final AtomicLong sessionIds = new AtomicLong();

    @SuppressFBWarnings(
            value = "AT_UNSAFE_RESOURCE_ACCESS_IN_THREAD",
            justification = "Socket is published before the ready latch and closed once by stop.")
    private volatile ServerSocket serverSocket;

    private volatile EventStreamEndpoint eventStream;

    private volatile Throwable startupFailure;

    private Thread acceptThread;

    /**
     * Creates a server; nothing is bound until {@link #start()}.
     *
     * @param config server configuration
     */
    public McprServer(McprServerConfig config) {
        this.config = config;
    }

    /**
     * Starts the listeners.
     *
     * <p>Binding happens on a background thread, which then runs the socket accept loop. Use
     * {@link #awaitReady(long, TimeUnit)} before connecting.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            acceptThread = new Thread(this::runLoop, "mcpr-server-accept");
            acceptThread.setDaemon(true);
            acceptThread.start();
        }
    }

    /**
     * Waits until every configured listener is bound.
     *
     * @param timeout the maximum time to wait
     * @param unit the time unit of the timeout argument
     * @return true if the server is ready, false if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     * @throws TransportException if a listener could not be bound
     */
    public boolean awaitReady(long timeout, TimeUnit unit) throws InterruptedException {
        boolean ready = readyLatch.await(timeout, unit);
        Throwable failure = startupFailure;
        if (failure != null) {
            throw new TransportException(
                    "server failed to start: " + failure.getMessage(), failure);
        }
        return ready;
    }

    private void runLoop() {
        try {
            bind();
        } catch (IOException | RuntimeException e) {
            startupFailure = e;
            LOGGER.log(Level.SEVERE, "Server failed to start", e);
            readyLatch.countDown();
            return;
        }
        readyLatch.countDown();

        ServerSocket listener = serverSocket;
        if (listener == null) {
            return;
        }
        while (running.get()) {
            Socket client;
            try {
                client = listener.accept();
            } catch (IOException e) {
                if (running.get()) {
                    LOGGER.log(Level.WARNING, "Accept failed, stopping listener", e);
                }
                return;
            }
            long id = sessionIds.incrementAndGet();
            Thread thread = new Thread(() -> serveSocket(client, id), "mcpr-session-" + id);
            thread.setDaemon(true);
            thread.start();
        }
    }

    private void bind() throws IOException {
        if (config.getEventStreamPort() != McprServerConfig.DISABLED) {
            EventStreamEndpoint endpoint = new EventStreamEndpoint(config);
            endpoint.start(new InetSocketAddress(config.getHost(), config.getEventStreamPort()));
            eventStream = endpoint;
        }
        if (config.getPort() != McprServerConfig.DISABLED) {
            ServerSocket listener = new ServerSocket();
            listener.setReuseAddress(true);
            listener.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            serverSocket = listener;
            LOGGER.log(
                    Level.INFO,
                    "Listening on {0}:{1,number,#}",
                    new Object[] {config.getHost(), listener.getLocalPort()});
        }
    }

    private void serveSocket(Socket client, long id) {
        String name = "socket-" + id;
        Transport transport;
        try {
            transport = handshake(client, name);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(
                    Level.INFO, "[{0}] handshake failed: {1}", new Object[] {name, e.getMessage()});
            closeQuietly(client);
            return;
        }
        if (transport != null) {
            run(newSession(name, transport));
        }
    }

    /** Returns the session transport, or null after refusing the client. */
    private Transport handshake(Socket client, String name) throws IOException {
        client.setTcpNoDelay(true);
        InputStream in = new BufferedInputStream(client.getInputStream());
        OutputStream out = new BufferedOutputStream(client.getOutputStream());
        SocketFrameCodec frames = new SocketFrameCodec(config.getMaxFrameSize());
        AuthGate gate = config.getAuthGate();
        boolean anonymousAllowed = gate.admit(null);

        if (!anonymousAllowed) {
            client.setSoTimeout((int) config.getHandshakeTimeout().toMillis());
        }
        SocketFrame first;
        try {
            first = frames.read(in);
        } catch (SocketTimeoutException e) {
            refuse(client, out, frames, name, "authentication required");
            return null;
        }
        client.setSoTimeout(0);
        if (first == null) {
            closeQuietly(client);
            return null;
        }
        if (first.type() == FrameType.AUTH) {
            String token = new String(first.body(), StandardCharsets.UTF_8);
            if (!gate.admit(token)) {
                refuse(client, out, frames, name, "invalid token");
                return null;
            }
            frames.write(out, FrameType.AUTH_OK, new byte[0]);
            first = null;
        } else if (!anonymousAllowed) {
            refuse(client, out, frames, name, "authentication required");
            return null;
        }
        return new AcceptedSocketTransport(client, in, out, frames, first);
    }

    private static void refuse(
            Socket client, OutputStream out, SocketFrameCodec frames, String name, String reason)
            throws IOException {
        LOGGER.log(Level.WARNING, "[{0}] refused: {1}", new Object[] {name, reason});
        try {
            frames.write(out, FrameType.AUTH_REJECTED, reason.getBytes(StandardCharsets.UTF_8));
        } finally {
            closeQuietly(client);
        }
    }

    /**
     * Serves one client over standard input and output on the calling thread, until input ends.
     *
     * <p>This is the subordinate-process mode: a client spawns this program and talks to it over
     * pipes. Nothing else may write to {@code System.out} meanwhile; logging goes to
     * {@code System.err}.
     */
    public void serveStdio() {
        serve(new PipeTransport(System.in, System.out), "stdio");
    }

    /**
     * Opens a transport and serves one client over it on the calling thread.
     *
     * @param transport an unopened transport
     * @param name session name used in logs
     * @throws TransportException if the transport cannot be opened
     */
    public void serve(Transport transport, String name) {
        transport.open();
        run(newSession(name, transport));
    }

    private ServerSession newSession(String name, Transport transport) {
        return new ServerSession(
                name,
                transport,
                config.getMethods(),
                config.getCodec(),
                config.getNotificationListener());
    }

    private void run(ServerSession session) {
        sessions.add(session);
        try {
            session.run();
        } finally {
            sessions.remove(session);
        }
    }

    /**
     * Returns the bound socket port.
     *
     * @return the port
     * @throws IllegalStateException if the socket listener is not running
     */
    public int port() {
        ServerSocket listener = serverSocket;
        if (listener == null) {
            throw new IllegalStateException("socket listener not running");
        }
        return listener.getLocalPort();
    }

    /**
     * Returns the event-stream base URI.
     *
     * @return {@code http://host:port}
     * @throws IllegalStateException if the event-stream listener is not running
     */
    public URI eventStreamUri() {
        EventStreamEndpoint endpoint = eventStream;
        if (endpoint == null) {
            throw new IllegalStateException("event-stream listener not running");
        }
        return endpoint.baseUri();
    }

    /**
     * Returns the number of socket and stdio sessions being served.
     *
     * @return the session count
     */
    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Sends a notification to every connected client on every transport.
     *
     * @param method the notification method
     * @param params the params, or null
     */
    public void broadcast(String method, JsonNode params) {
        for (ServerSession session : sessions) {
            try {
                session.notify(method, params);
            } catch (TransportException e) {
                LOGGER.log(Level.FINE, "Broadcast to " + session.name() + " failed", e);
            }
        }
        EventStreamEndpoint endpoint = eventStream;
        if (endpoint != null) {
            endpoint.broadcast(method, params);
        }
    }

    /**
     * Stops the server.
     *
     * <p>Closes the listeners, waits up to 5 seconds for the accept loop to end, then closes every
     * session.
     */
    public void stop() {
        running.set(false);
        ServerSocket listener = serverSocket;
        if (listener != null) {
            closeQuietly(listener);
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        close();
    }

    @Override
    public void close() {
        running.set(false);
        ServerSocket listener = serverSocket;
        if (listener != null) {
            closeQuietly(listener);
        }
        EventStreamEndpoint endpoint = eventStream;
        if (endpoint != null) {
            endpoint.close();
        }
        for (ServerSession session : sessions) {
            session.close();
        }
        sessions.clear();
        LOGGER.log(Level.FINE, "Server closed");
    }

    private static void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            LOGGER.log(Level.FINE, "Close failed", e);
        }
    }
}
