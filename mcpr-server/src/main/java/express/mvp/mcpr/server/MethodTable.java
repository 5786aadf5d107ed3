package express.mvp.mcpr.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import express.mvp.mcpr.transport.message.ErrorObject;
import express.mvp.mcpr.transport.message.ErrorResponse;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Request;
import express.mvp.mcpr.transport.message.Response;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable mapping from method names to handlers.
 *
 * <p>{@link #dispatch(Request)} always produces exactly one reply:
 *
 * <ul>
 *   <li>a {@link Response} with the handler's result;
 *   <li>{@link ErrorObject#METHOD_NOT_FOUND} for a name nobody registered;
 *   <li>{@link ErrorObject#SERVER_ERROR} with the message {@code "Tool execution failed: ..."}
 *       when the handler throws.
 * </ul>
 *
 * <p>Every table answers {@value #PING} with an empty object unless a handler is registered for
 * it.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MethodTable methods = MethodTable.builder()
 *     .method("tools/call", params -> runTool(params))
 *     .method("resources/read", params -> readResource(params))
 *     .build();
 * }</pre>
 */
public final class MethodTable {

    private static final Logger LOGGER = Logger.getLogger(MethodTable.class.getName());

    /** Liveness method every table answers. */
    public static final String PING = "ping";

    private final Map<String, MethodHandler> handlers;

    private MethodTable(Builder builder) {
        Map<String, MethodHandler> copy = new LinkedHashMap<>(builder.handlers);
        copy.putIfAbsent(PING, params -> JsonNodeFactory.instance.objectNode());
        this.handlers = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a table that only answers {@value #PING}.
     *
     * @return the table
     */
    public static MethodTable empty() {
        return builder().build();
    }

    /**
     * Invokes the handler for a request and builds its reply.
     *
     * @param request the request
     * @return a {@link Response} or an {@link ErrorResponse} carrying the request id
     */
    public Message dispatch(Request request) {
        MethodHandler handler = handlers.get(request.method());
        if (handler == null) {
            return new ErrorResponse(
                    request.id(),
                    new ErrorObject(
                            ErrorObject.METHOD_NOT_FOUND, "Method not found: " + request.method()));
        }
        try {
            JsonNode result = handler.handle(request.params());
            return new Response(request.id(), result != null ? result : NullNode.getInstance());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(request, e);
        } catch (Exception e) {
            return failure(request, e);
        }
    }

    private static Message failure(Request request, Exception e) {
        LOGGER.log(Level.FINE, "Handler for " + request.method() + " failed", e);
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new ErrorResponse(
                request.id(),
                new ErrorObject(ErrorObject.SERVER_ERROR, "Tool execution failed: " + detail));
    }

    /**
     * Checks whether a method is registered.
     *
     * @param method the method name
     * @return true if {@link #dispatch} would find a handler
     */
    public boolean contains(String method) {
        return handlers.containsKey(method);
    }

    /**
     * Returns the registered method names, {@value #PING} included.
     *
     * @return an unmodifiable view
     */
    public Set<String> methods() {
        return handlers.keySet();
    }

    /** Builder for {@link MethodTable}. */
    public static final class Builder {

        private final Map<String, MethodHandler> handlers = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a handler.
         *
         * @param name the method name
         * @param handler the handler
         * @return this builder
         * @throws IllegalArgumentException if the name is blank or already registered
         */
        public Builder method(String name, MethodHandler handler) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(handler, "handler");
            if (name.isBlank()) {
                throw new IllegalArgumentException("method name must not be blank");
            }
            if (handlers.putIfAbsent(name, handler) != null) {
                throw new IllegalArgumentException("method already registered: " + name);
            }
            return this;
        }

        /**
         * Builds the table.
         *
         * @return the immutable table
         */
        public MethodTable build() {
            return new MethodTable(this);
        }
    }
}
