package express.mvp.mcpr.transport.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.mcpr.transport.connection.ConnectionManager;
import express.mvp.mcpr.transport.message.RequestId;
import java.util.concurrent.CompletableFuture;

/**
 * Handle for a call in flight.
 *
 * <p>{@link #result()} completes exactly once: with the result payload, or exceptionally with
 * {@link RemoteErrorException}, {@link express.mvp.mcpr.transport.error.CallTimeoutException},
 * {@link express.mvp.mcpr.transport.error.CallCancelledException},
 * {@link express.mvp.mcpr.transport.error.ConnectionResetException} or another transport error.
 * Cancelling the future itself is the same as {@link #cancel()}.
 */
public final class PendingCall {

    private final RequestId id;
    private final String method;
    private final ConnectionManager connection;
    private final CompletableFuture<JsonNode> result;

    PendingCall(
            RequestId id,
            String method,
            ConnectionManager connection,
            CompletableFuture<JsonNode> result) {
        this.id = id;
        this.method = method;
        this.connection = connection;
        this.result = result;
    }

    /**
     * Returns the correlation id of the request.
     *
     * @return the id
     */
    public RequestId id() {
        return id;
    }

    /**
     * Returns the called method.
     *
     * @return the method name
     */
    public String method() {
        return method;
    }

    /**
     * Returns the name of the connection the request went out on.
     *
     * @return the connection name
     */
    public String connection() {
        return connection.name();
    }

    /**
     * Returns the eventual result.
     *
     * @return the result future
     */
    public CompletableFuture<JsonNode> result() {
        return result;
    }

    /**
     * Cancels the call locally. The peer is not told and may still process the request; a late
     * reply is handed to the inbound sink.
     *
     * @return true if the call was still pending
     */
    public boolean cancel() {
        return connection.correlations().cancel(id);
    }

    @Override
    public String toString() {
        return "PendingCall{" + method + " #" + id + " on " + connection.name() + "}";
    }
}
