package express.mvp.mcpr.transport.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.codec.JsonMessageCodec;
import express.mvp.mcpr.transport.connection.ConnectionManager;
import express.mvp.mcpr.transport.connection.CorrelationTable;
import express.mvp.mcpr.transport.error.CallCancelledException;
import express.mvp.mcpr.transport.error.CallTimeoutException;
import express.mvp.mcpr.transport.message.ErrorResponse;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Notification;
import express.mvp.mcpr.transport.message.Request;
import express.mvp.mcpr.transport.message.RequestId;
import express.mvp.mcpr.transport.message.Response;
import express.mvp.mcpr.transport.routing.CapabilityKind;
import express.mvp.mcpr.transport.routing.TransportRouter;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request/response correlation on top of a {@link TransportRouter}.
 *
 * <p>A call allocates a fresh id, registers it in the correlation table of the connection its
 * capability kind resolves to, writes the request, and completes when the matching reply
 * arrives. Timeouts, local cancellation and connection-level failures complete the call with an
 * error instead; a call never hangs and never completes twice.
 *
 * <h2>Inbound Messages</h2>
 *
 * <p>The dispatcher installs itself as the message handler of every routed connection. Replies
 * that match a pending call complete it; everything else (notifications, peer-initiated
 * requests, late replies) goes to the {@link InboundSink}. Method names are never interpreted
 * here.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MessageDispatcher dispatcher = new MessageDispatcher(router);
 * dispatcher.setInboundSink((connection, message) -> events.add(message));
 *
 * Sum sum = dispatcher.call(CapabilityKind.TOOL, "add", Map.of("a", 2, "b", 3),
 *         Sum.class, Duration.ofSeconds(5));
 *
 * PendingCall pending = dispatcher.callAsync(CapabilityKind.RESOURCE, "resources/list",
 *         null, Duration.ofSeconds(5));
 * pending.result().thenAccept(page -> render(page));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods may be called concurrently. Calls on one connection complete in whatever order
 * the peer answers them.
 */
public final class MessageDispatcher {

    private static final Logger LOGGER = Logger.getLogger(MessageDispatcher.class.getName());

    /** Extra wait beyond a call's own deadline before the blocking path gives up on the sweep. */
    private static final long SWEEP_GRACE_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final TransportRouter router;
    private final JsonMessageCodec codec;
    private final AtomicLong nextId = new AtomicLong(1);

    private volatile InboundSink sink =
            (connection, message) ->
                    LOGGER.log(
                            Level.FINE,
                            "[{0}] dropping unmatched {1}",
                            new Object[] {connection, message});

    /**
     * Creates a dispatcher converting payloads with a default JSON codec.
     *
     * @param router the router to send through
     */
    public MessageDispatcher(TransportRouter router) {
        this(router, new JsonMessageCodec());
    }

    /**
     * Creates a dispatcher.
     *
     * @param router the router to send through
     * @param codec converts application parameters and results to and from JSON trees
     */
    public MessageDispatcher(TransportRouter router, JsonMessageCodec codec) {
        this.router = Objects.requireNonNull(router, "router");
        this.codec = Objects.requireNonNull(codec, "codec");
        for (ConnectionManager connection : router.connections().values()) {
            connection.setMessageHandler(this::onMessage);
        }
    }

    /**
     * Calls a method and waits for its result.
     *
     * @param kind capability kind that selects the connection
     * @param method the method name
     * @param params parameters (a {@link JsonNode}, any Jackson-mappable value, or null)
     * @param timeout how long to wait for the reply
     * @return the result payload
     * @throws RemoteErrorException if the peer answered with an error
     * @throws CallTimeoutException if no reply arrived in time
     * @throws CallCancelledException if the call was cancelled or the caller interrupted
     * @throws TransportException if the connection failed the call
     */
    public JsonNode call(CapabilityKind kind, String method, Object params, Duration timeout) {
        PendingCall pending = callAsync(kind, method, params, timeout);
        long waitNanos = timeout.toNanos() + SWEEP_GRACE_NANOS;
        try {
            return pending.result().get(waitNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.cancel();
            throw new CallTimeoutException(
                    "call " + pending.id() + " (" + method + ") timed out after " + timeout);
        } catch (InterruptedException e) {
            pending.cancel();
            Thread.currentThread().interrupt();
            throw new CallCancelledException(
                    "call " + pending.id() + " (" + method + ") interrupted");
        } catch (CancellationException e) {
            throw new CallCancelledException(
                    "call " + pending.id() + " (" + method + ") cancelled");
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    /**
     * Calls a method, waits, and converts the result.
     *
     * @param kind capability kind that selects the connection
     * @param method the method name
     * @param params parameters
     * @param type result type
     * @param timeout how long to wait for the reply
     * @param <T> result type
     * @return the converted result
     * @throws IllegalArgumentException if the result does not fit {@code type}
     */
    public <T> T call(
            CapabilityKind kind, String method, Object params, Class<T> type, Duration timeout) {
        return codec.fromTree(call(kind, method, params, timeout), type);
    }

    /**
     * Starts a call without waiting for its result.
     *
     * <p>The request is written before this returns. If the connection is still opening or
     * reconnecting, that write waits for it, bounded by {@code timeout}. Failures to write complete
     * the returned call instead of being thrown.
     *
     * @param kind capability kind that selects the connection
     * @param method the method name
     * @param params parameters
     * @param timeout deadline for the reply, measured from now
     * @return the pending call
     */
    public PendingCall callAsync(
            CapabilityKind kind, String method, Object params, Duration timeout) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(timeout, "timeout");
        JsonNode tree = codec.toTree(params);
        ConnectionManager connection = router.resolve(kind);
        CorrelationTable correlations = connection.correlations();

        RequestId id = RequestId.of(nextId.getAndIncrement());
        long deadline = System.nanoTime() + timeout.toNanos();
        CorrelationTable.Entry entry = correlations.register(id, method, deadline);

        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        entry.reply()
                .whenComplete(
                        (reply, failure) -> {
                            if (failure != null) {
                                result.completeExceptionally(unwrap(failure));
                            } else if (reply instanceof ErrorResponse) {
                                result.completeExceptionally(
                                        new RemoteErrorException(
                                                method, ((ErrorResponse) reply).error()));
                            } else {
                                result.complete(((Response) reply).result());
                            }
                        });
        result.whenComplete(
                (value, failure) -> {
                    if (result.isCancelled()) {
                        correlations.cancel(id);
                    }
                });

        try {
            connection.send(new Request(id, method, tree), deadline);
        } catch (RuntimeException e) {
            LOGGER.log(
                    Level.FINE,
                    "[{0}] call {1} ({2}) not sent: {3}",
                    new Object[] {connection.name(), id, method, e.getMessage()});
            correlations.fail(id, e);
        }
        return new PendingCall(id, method, connection, result);
    }

    /**
     * Sends a notification. No reply is expected and nothing is registered.
     *
     * @param kind capability kind that selects the connection
     * @param method the method name
     * @param params parameters
     * @throws TransportException if the notification could not be written
     */
    public void notify(CapabilityKind kind, String method, Object params) {
        Objects.requireNonNull(method, "method");
        ConnectionManager connection = router.resolve(kind);
        long deadline = System.nanoTime() + router.config().callTimeout().toNanos();
        connection.send(new Notification(method, codec.toTree(params)), deadline);
    }

    /**
     * Answers a request the peer initiated, on the connection it arrived on.
     *
     * @param connection name of the connection, as passed to the {@link InboundSink}
     * @param reply a {@link Response} or {@link ErrorResponse}
     * @throws IllegalArgumentException if {@code reply} is not a reply
     */
    public void respond(String connection, Message reply) {
        if (!reply.isReply()) {
            throw new IllegalArgumentException("not a reply: " + reply);
        }
        long deadline = System.nanoTime() + router.config().callTimeout().toNanos();
        router.connection(connection).send(reply, deadline);
    }

    /**
     * Sets the sink for unmatched inbound messages. Replaces any previous sink.
     *
     * @param sink the sink
     */
    public void setInboundSink(InboundSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    private void onMessage(ConnectionManager connection, Message message) {
        if (message.isReply() && connection.correlations().complete(message)) {
            return;
        }
        if (message.isReply()) {
            LOGGER.log(
                    Level.FINE,
                    "[{0}] reply {1} matches no pending call",
                    new Object[] {connection.name(), message.id()});
        }
        try {
            sink.onInbound(connection.name(), message);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Inbound sink failed on " + connection.name(), e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new TransportException("call failed", cause);
    }
}
