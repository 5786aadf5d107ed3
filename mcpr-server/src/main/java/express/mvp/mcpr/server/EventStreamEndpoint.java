package express.mvp.mcpr.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import express.mvp.mcpr.transport.InboundQueue;
import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportCounters;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.TransportHealth;
import express.mvp.mcpr.transport.TransportKind;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP endpoint serving sessions as a server-sent event stream plus posted requests.
 *
 * <h2>Protocol</h2>
 *
 * <pre>
 * client                                   server
 *   │  GET /events                            │
 *   │  Accept: text/event-stream              │
 *   │ ───────────────────────────────────────▶│  new session s
 *   │◀─────────────────────────────────────── │  event: endpoint
 *   │                                         │  data: /messages?session=s
 *   │  POST /messages?session=s  {request}    │
 *   │ ───────────────────────────────────────▶│  202 Accepted
 *   │◀─────────────────────────────────────── │  id: s-1
 *   │                                         │  event: message
 *   │                                         │  data: {response}
 *   │◀─────────────────────────────────────── │  : keep-alive   (when idle)
 * </pre>
 *
 * <h2>Resumption</h2>
 *
 * <p>Event ids have the form {@code <session>-<sequence>}. A {@code GET /events} carrying
 * {@code Last-Event-ID} re-attaches to that session and first replays every buffered event after
 * the given sequence. Each session keeps the last {@link McprServerConfig#getReplayBacklog()}
 * events, including those produced while no stream was attached. An unknown marker starts a new
 * session.
 *
 * <h2>Authentication</h2>
 *
 * <p>Both routes pass the {@code Authorization: Bearer} token (or null) to the configured
 * {@link AuthGate}; a refusal answers HTTP 401.
 *
 * <p>Each session runs a {@link ServerSession} on its own thread. Sessions live until the
 * endpoint is closed.
 */
public final class EventStreamEndpoint implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(EventStreamEndpoint.class.getName());

    /** Path of the event stream. */
    public static final String EVENTS_PATH = "/events";

    /** Path requests are posted to. */
    public static final String MESSAGES_PATH = "/messages";

    private static final String BEARER = "Bearer ";

    private final McprServerConfig config;
    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger threadIds = new AtomicInteger();
    private final ExecutorService executor =
            Executors.newCachedThreadPool(
                    runnable -> {
                        String name = "mcpr-sse-http-" + threadIds.incrementAndGet();
                        Thread thread = new Thread(runnable, name);
                        thread.setDaemon(true);
                        return thread;
                    });
    private volatile HttpServer http;

    /**
     * Creates an endpoint; nothing is bound until {@link #start(InetSocketAddress)}.
     *
     * @param config server configuration (methods, gate, keep-alive, backlog)
     */
    public EventStreamEndpoint(McprServerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Binds and starts serving.
     *
     * @param address bind address; port 0 picks an ephemeral port
     * @throws IOException if the address cannot be bound
     * @throws IllegalStateException if already started
     */
    public synchronized void start(InetSocketAddress address) throws IOException {
        if (http != null) {
            throw new IllegalStateException("event-stream endpoint already started");
        }
        HttpServer server = HttpServer.create(address, 0);
        server.createContext(EVENTS_PATH, this::handleEvents);
        server.createContext(MESSAGES_PATH, this::handleMessages);
        server.setExecutor(executor);
        server.start();
        http = server;
        LOGGER.log(Level.INFO, "Event stream listening on {0}", baseUri());
    }

    /**
     * Returns the bound port.
     *
     * @return the port
     * @throws IllegalStateException if not started
     */
    public int port() {
        HttpServer server = http;
        if (server == null) {
            throw new IllegalStateException("event-stream endpoint not started");
        }
        return server.getAddress().getPort();
    }

    /**
     * Returns the base URI clients connect to.
     *
     * @return {@code http://host:port}
     */
    public URI baseUri() {
        return URI.create("http://" + config.getHost() + ":" + port());
    }

    /**
     * Returns the number of live sessions, attached or not.
     *
     * @return the session count
     */
    public int sessionCount() {
        return sessions.size();
    }

    /**
     * Sends a notification to every live session. Sessions without an attached stream buffer it
     * for replay.
     *
     * @param method the notification method
     * @param params the params, or null
     */
    public void broadcast(String method, JsonNode params) {
        for (StreamSession session : sessions.values()) {
            ServerSession server = session.server;
            if (server == null) {
                continue;
            }
            try {
                server.notify(method, params);
            } catch (TransportException e) {
                LOGGER.log(Level.FINE, "Broadcast to " + session.id + " failed", e);
            }
        }
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equals(exchange.getRequestMethod())) {
                reply(exchange, 405);
                return;
            }
            if (!admitted(exchange)) {
                reply(exchange, 401);
                return;
            }
            String marker = exchange.getRequestHeaders().getFirst("Last-Event-ID");
            StreamSession session = resume(marker);
            long after = 0;
            if (session != null) {
                after = sequenceOf(marker);
                LOGGER.log(
                        Level.INFO,
                        "Session {0} resumed after event {1}",
                        new Object[] {session.id, after});
            } else {
                session = openSession();
            }
            stream(exchange, session, after);
        } finally {
            exchange.close();
        }
    }

    private StreamSession resume(String marker) {
        if (marker == null) {
            return null;
        }
        int dash = marker.lastIndexOf('-');
        StreamSession session = dash > 0 ? sessions.get(marker.substring(0, dash)) : null;
        if (session == null || session.closed || sequenceOf(marker) < 0) {
            LOGGER.log(Level.FINE, "Unknown resume marker {0}, starting a new session", marker);
            return null;
        }
        return session;
    }

    private static long sequenceOf(String marker) {
        try {
            return Long.parseLong(marker.substring(marker.lastIndexOf('-') + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private StreamSession openSession() {
        StreamSession session =
                new StreamSession(UUID.randomUUID().toString(), config.getReplayBacklog());
        ServerSession server =
                new ServerSession(
                        "sse-" + session.id.substring(0, 8),
                        session,
                        config.getMethods(),
                        config.getCodec(),
                        config.getNotificationListener());
        session.server = server;
        sessions.put(session.id, session);
        Thread thread = new Thread(server, "mcpr-sse-session-" + session.id.substring(0, 8));
        thread.setDaemon(true);
        thread.start();
        return session;
    }

    private void stream(HttpExchange exchange, StreamSession session, long after)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.sendResponseHeaders(200, 0);
        BlockingQueue<SseEvent> queue = session.attach(after);
        long keepAliveMillis = config.getKeepAliveInterval().toMillis();
        try {
            OutputStream out = exchange.getResponseBody();
            write(out, "event: endpoint\ndata: " + postPath(session) + "\n\n");
            while (true) {
                SseEvent event = queue.poll(keepAliveMillis, TimeUnit.MILLISECONDS);
                if (event == null) {
                    write(out, ": keep-alive\n\n");
                } else if (event == SseEvent.END) {
                    return;
                } else {
                    write(out, event.render());
                }
            }
        } catch (IOException e) {
            LOGGER.log(
                    Level.FINE,
                    "Stream for session {0} dropped: {1}",
                    new Object[] {session.id, e.getMessage()});
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            session.detach(queue);
        }
    }

    private static String postPath(StreamSession session) {
        return MESSAGES_PATH + "?session=" + session.id;
    }

    private static void write(OutputStream out, String text) throws IOException {
        out.write(text.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private void handleMessages(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equals(exchange.getRequestMethod())) {
                reply(exchange, 405);
                return;
            }
            if (!admitted(exchange)) {
                reply(exchange, 401);
                return;
            }
            StreamSession session = sessions.get(sessionParameter(exchange.getRequestURI()));
            if (session == null || session.closed) {
                reply(exchange, 404);
                return;
            }
            byte[] body = exchange.getRequestBody().readAllBytes();
            if (body.length == 0) {
                reply(exchange, 400);
                return;
            }
            session.deliver(body);
            reply(exchange, 202);
        } finally {
            exchange.close();
        }
    }

    private static String sessionParameter(URI uri) {
        String query = uri.getRawQuery();
        if (query == null) {
            return "";
        }
        for (String pair : query.split("&")) {
            if (pair.startsWith("session=")) {
                return pair.substring("session=".length());
            }
        }
        return "";
    }

    private boolean admitted(HttpExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        String token =
                header != null && header.startsWith(BEARER)
                        ? header.substring(BEARER.length()).trim()
                        : null;
        return config.getAuthGate().admit(token);
    }

    private static void reply(HttpExchange exchange, int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
    }

    /** Stops the HTTP server and ends every session. */
    @Override
    public synchronized void close() {
        HttpServer server = http;
        http = null;
        for (StreamSession session : sessions.values()) {
            ServerSession running = session.server;
            if (running != null) {
                running.close();
            } else {
                session.close();
            }
        }
        sessions.clear();
        if (server != null) {
            server.stop(0);
        }
        executor.shutdownNow();
        LOGGER.log(Level.FINE, "Event stream endpoint closed");
    }

    /** One buffered event. {@link #END} tells a stream writer to finish. */
    private static final class SseEvent {
        static final SseEvent END = new SseEvent(null, null);

        final String id;
        final String data;

        SseEvent(String id, String data) {
            this.id = id;
            this.data = data;
        }

        long sequence() {
            return sequenceOf(id);
        }

        String render() {
            StringBuilder text = new StringBuilder(data.length() + 48);
            text.append("id: ").append(id).append('\n');
            text.append("event: message\n");
            for (String line : data.split("\n", -1)) {
                text.append("data: ").append(line).append('\n');
            }
            return text.append('\n').toString();
        }
    }

    /**
     * Server-side transport of one event-stream session: posted bodies are received, sent
     * payloads become events.
     */
    private static final class StreamSession implements Transport {
        final String id;
        private final int backlogLimit;
        private final Deque<SseEvent> backlog = new ArrayDeque<>();
        private final InboundQueue inbound = new InboundQueue();
        private final TransportCounters counters = new TransportCounters();
        private long sequence;
        private BlockingQueue<SseEvent> attached;
        volatile boolean closed;
        volatile ServerSession server;

        StreamSession(String id, int backlogLimit) {
            this.id = id;
            this.backlogLimit = backlogLimit;
        }

        synchronized BlockingQueue<SseEvent> attach(long after) {
            if (attached != null) {
                attached.offer(SseEvent.END);
            }
            BlockingQueue<SseEvent> queue = new LinkedBlockingQueue<>();
            for (SseEvent event : backlog) {
                if (event.sequence() > after) {
                    queue.offer(event);
                }
            }
            if (closed) {
                queue.offer(SseEvent.END);
            }
            attached = queue;
            return queue;
        }

        synchronized void detach(BlockingQueue<SseEvent> queue) {
            if (attached == queue) {
                attached = null;
            }
        }

        void deliver(byte[] body) {
            counters.recordReceived(body.length);
            inbound.offer(body);
        }

        @Override
        public void open() {
            throw new IllegalStateException("event-stream sessions open on GET " + EVENTS_PATH);
        }

        @Override
        public synchronized void send(byte[] payload) {
            if (closed) {
                throw new TransportException("session " + id + " is closed");
            }
            String data = new String(payload, StandardCharsets.UTF_8);
            SseEvent event = new SseEvent(id + "-" + (++sequence), data);
            if (backlogLimit > 0) {
                backlog.addLast(event);
                while (backlog.size() > backlogLimit) {
                    backlog.removeFirst();
                }
            }
            if (attached != null) {
                attached.offer(event);
            }
            counters.recordSent(payload.length);
        }

        @Override
        public byte[] receive() {
            return inbound.take();
        }

        @Override
        public boolean probe(Duration deadline) {
            return !closed;
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            inbound.fail(new TransportException("session " + id + " closed"));
            if (attached != null) {
                attached.offer(SseEvent.END);
            }
        }

        @Override
        public TransportKind kind() {
            return TransportKind.EVENT_STREAM;
        }

        @Override
        public boolean isOpen() {
            return !closed;
        }

        @Override
        public TransportHealth health() {
            return counters.snapshot(!closed);
        }
    }
}
