package express.mvp.mcpr.transport.stream;

import express.mvp.mcpr.transport.InboundQueue;
import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportCounters;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.TransportHealth;
import express.mvp.mcpr.transport.TransportKind;
import express.mvp.mcpr.transport.config.AuthTokenProvider;
import express.mvp.mcpr.transport.config.EndpointConfig;
import express.mvp.mcpr.transport.error.AuthRejectedException;
import express.mvp.mcpr.transport.framing.EventStreamAssembler;
import express.mvp.mcpr.transport.framing.FramingException;
import express.mvp.mcpr.transport.framing.ServerSentEvent;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport pairing a server-sent event stream (inbound) with HTTP POSTs (outbound).
 *
 * <p>{@link #open()} issues {@code GET {base}{eventsPath}} with {@code Accept: text/event-stream}
 * and hands the response body to a pump thread. The pump feeds an {@link EventStreamAssembler}
 * and reacts to each complete event:
 *
 * <ul>
 *   <li>{@code endpoint}: the data names the URI (usually carrying a session id) that outbound
 *       messages are posted to from now on;
 *   <li>{@code message} (or no event name): the data is one encoded message, queued for
 *       {@link #receive()};
 *   <li>anything else is logged and ignored.
 * </ul>
 *
 * <p>Outbound messages are {@code POST}ed as {@code application/json}; any 2xx status counts as
 * delivered. The actual reply arrives later on the stream.
 *
 * <h2>Resumption</h2>
 *
 * <p>The assembler outlives a single stream. After a drop, the next {@code open()} sends the
 * last seen event id as {@code Last-Event-ID} so the server can replay what was missed.
 *
 * <h2>Liveness</h2>
 *
 * <p>{@link #probe(Duration)} succeeds when the stream is open and has produced bytes (events or
 * {@code :} keep-alive comments) within the deadline, waiting up to the deadline for new bytes
 * if it has been quiet.
 */
public final class EventStreamTransport implements Transport {

    private static final Logger LOGGER = Logger.getLogger(EventStreamTransport.class.getName());

    /** Media type of the inbound stream. */
    public static final String EVENT_STREAM_TYPE = "text/event-stream";

    private static final String ENDPOINT_EVENT = "endpoint";

    private final EndpointConfig endpoint;
    private final AuthTokenProvider tokenProvider;
    private final HttpClient http;
    private final EventStreamAssembler assembler;
    private final TransportCounters counters = new TransportCounters();
    private final Object activityMonitor = new Object();

    private volatile long lastActivityNanos;
    private volatile URI postUri;
    private volatile String token;
    private volatile InputStream stream;
    private volatile InboundQueue inbound = new InboundQueue();
    private volatile Thread pump;
    private volatile boolean open;

    /**
     * Creates an event-stream transport.
     *
     * @param endpoint an {@code EVENT_STREAM} endpoint
     * @param tokenProvider credential source, or null
     */
    public EventStreamTransport(EndpointConfig endpoint, AuthTokenProvider tokenProvider) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.tokenProvider = tokenProvider;
        this.http =
                HttpClient.newBuilder()
                        .connectTimeout(endpoint.requestTimeout())
                        .version(HttpClient.Version.HTTP_1_1)
                        .build();
        this.assembler = new EventStreamAssembler(endpoint.maxFrameSize());
    }

    @Override
    public synchronized void open() {
        if (open) {
            throw new IllegalStateException("event-stream transport already open");
        }
        Optional<String> current =
                tokenProvider != null ? tokenProvider.currentToken() : Optional.empty();
        token = current.orElse(null);

        URI eventsUri = endpoint.baseUri().resolve(endpoint.eventsPath());
        HttpRequest.Builder request =
                HttpRequest.newBuilder(eventsUri)
                        .GET()
                        .timeout(endpoint.requestTimeout())
                        .header("Accept", EVENT_STREAM_TYPE)
                        .header("Cache-Control", "no-cache");
        String resumeFrom = assembler.lastEventId();
        if (resumeFrom != null) {
            request.header("Last-Event-ID", resumeFrom);
        }
        applyCommonHeaders(request);

        HttpResponse<InputStream> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            counters.recordError(e);
            throw new TransportException(
                    "connect to " + endpoint.describe() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while opening " + endpoint.describe(), e);
        }

        checkStreamResponse(response);

        InputStream body = response.body();
        assembler.reset();
        postUri = endpoint.baseUri().resolve(endpoint.messagesPath());
        InboundQueue queue = new InboundQueue();
        CountDownLatch firstBytes = new CountDownLatch(1);
        inbound = queue;
        stream = body;
        open = true;
        lastActivityNanos = System.nanoTime();
        counters.clearError();

        Thread thread = new Thread(() -> pumpLoop(body, queue, firstBytes), "mcpr-event-stream");
        thread.setDaemon(true);
        pump = thread;
        thread.start();

        // The endpoint event normally leads the stream; give it a chance to arrive first
        try {
            if (!firstBytes.await(endpoint.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.log(
                        Level.FINE,
                        "No event within {0} ms, posting to {1}",
                        new Object[] {endpoint.requestTimeout().toMillis(), postUri});
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.log(
                Level.INFO,
                "Opened {0}{1}",
                new Object[] {
                    endpoint.describe(), resumeFrom != null ? " resuming after " + resumeFrom : ""
                });
    }

    private void checkStreamResponse(HttpResponse<InputStream> response) {
        int status = response.statusCode();
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        TransportException failure = null;
        if (status == 401 || status == 403) {
            failure = new AuthRejectedException("event stream refused credentials: HTTP " + status);
        } else if (status != 200) {
            failure = new TransportException("event stream answered HTTP " + status);
        } else if (!contentType.toLowerCase(Locale.ROOT).startsWith(EVENT_STREAM_TYPE)) {
            failure =
                    new TransportException(
                            "event stream answered with unexpected content type '"
                                    + contentType
                                    + "'");
        }
        if (failure != null) {
            closeQuietly(response.body());
            counters.recordError(failure);
            throw failure;
        }
    }

    private void pumpLoop(InputStream body, InboundQueue queue, CountDownLatch firstBytes) {
        byte[] buffer = new byte[8192];
        try {
            int read;
            while ((read = body.read(buffer)) != -1) {
                markActivity();
                for (ServerSentEvent event : assembler.feed(buffer, 0, read)) {
                    onEvent(event, queue);
                }
                firstBytes.countDown();
            }
            queue.fail(new TransportException("event stream ended"));
        } catch (IOException | FramingException e) {
            counters.recordError(e);
            queue.fail(
                    new TransportException(
                            open
                                    ? "event stream read failed: " + e.getMessage()
                                    : "event stream closed",
                            e));
        } finally {
            firstBytes.countDown();
            if (inbound == queue) {
                open = false;
            }
            synchronized (activityMonitor) {
                activityMonitor.notifyAll();
            }
        }
    }

    private void onEvent(ServerSentEvent event, InboundQueue queue) {
        String name = event.event();
        if (ENDPOINT_EVENT.equals(name)) {
            URI target = endpoint.baseUri().resolve(event.data().trim());
            postUri = target;
            LOGGER.log(Level.FINE, "Posting messages to {0}", target);
        } else if (ServerSentEvent.DEFAULT_EVENT.equals(name)) {
            byte[] payload = event.data().getBytes(StandardCharsets.UTF_8);
            if (payload.length > 0) {
                counters.recordReceived(payload.length);
                queue.offer(payload);
            }
        } else {
            LOGGER.log(Level.FINE, "Ignoring event ''{0}''", name);
        }
    }

    private void markActivity() {
        lastActivityNanos = System.nanoTime();
        synchronized (activityMonitor) {
            activityMonitor.notifyAll();
        }
    }

    @Override
    public void send(byte[] payload) {
        URI target = postUri;
        if (!open || target == null) {
            throw new TransportException("event-stream transport is not open");
        }
        HttpRequest.Builder request =
                HttpRequest.newBuilder(target)
                        .timeout(endpoint.requestTimeout())
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofByteArray(payload));
        applyCommonHeaders(request);
        HttpResponse<Void> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            counters.recordError(e);
            throw new TransportException("POST to " + target + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while posting to " + target, e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            TransportException failure =
                    new TransportException("POST to " + target + " answered HTTP " + status);
            counters.recordError(failure);
            throw failure;
        }
        counters.recordSent(payload.length);
    }

    private void applyCommonHeaders(HttpRequest.Builder request) {
        for (Map.Entry<String, String> header : endpoint.headers().entrySet()) {
            request.header(header.getKey(), header.getValue());
        }
        String bearer = token;
        if (bearer != null) {
            request.header("Authorization", "Bearer " + bearer);
        }
    }

    @Override
    public byte[] receive() {
        return inbound.take();
    }

    @Override
    public boolean probe(Duration deadline) {
        long window = deadline.toNanos();
        long start = System.nanoTime();
        synchronized (activityMonitor) {
            while (open) {
                long now = System.nanoTime();
                if (now - lastActivityNanos <= window) {
                    return true;
                }
                long remaining = window - (now - start);
                if (remaining <= 0) {
                    return false;
                }
                try {
                    activityMonitor.wait(Math.max(1, remaining / 1_000_000L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    @Override
    public synchronized void close() {
        InputStream body = stream;
        if (body == null) {
            return;
        }
        open = false;
        inbound.fail(new TransportException("event-stream transport closed"));
        closeQuietly(body);
        Thread thread = pump;
        if (thread != null && thread != Thread.currentThread()) {
            // A body read blocked on the client's buffer queue only wakes on interrupt
            thread.interrupt();
        }
        synchronized (activityMonitor) {
            activityMonitor.notifyAll();
        }
        stream = null;
        pump = null;
        LOGGER.log(Level.FINE, "Closed {0}", endpoint.describe());
    }

    @Override
    public TransportKind kind() {
        return TransportKind.EVENT_STREAM;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public TransportHealth health() {
        return counters.snapshot(open);
    }

    /**
     * Returns the URI outbound messages are currently posted to.
     *
     * @return the post target, or null before the first open
     */
    public URI postUri() {
        return postUri;
    }

    /**
     * Returns the resumption marker that the next open will send.
     *
     * @return the last seen event id, or null
     */
    public String lastEventId() {
        return assembler.lastEventId();
    }

    private static void closeQuietly(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Closing event stream body failed", e);
        }
    }
}
