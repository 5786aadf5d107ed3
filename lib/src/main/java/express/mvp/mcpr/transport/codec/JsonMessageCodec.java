package express.mvp.mcpr.transport.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.mcpr.transport.message.ErrorObject;
import express.mvp.mcpr.transport.message.ErrorResponse;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Notification;
import express.mvp.mcpr.transport.message.Request;
import express.mvp.mcpr.transport.message.RequestId;
import express.mvp.mcpr.transport.message.Response;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON-RPC 2.0 implementation of {@link MessageCodec} backed by Jackson.
 *
 * <h2>Envelope</h2>
 *
 * <pre>
 * {"jsonrpc":"2.0", "id":..., "method":"...", "params":{...}, "result":..., "error":{...}}
 * </pre>
 *
 * <table border="1">
 *   <caption>Variant selection on decode</caption>
 *   <tr><th>Members present</th><th>Variant</th></tr>
 *   <tr><td>method, id</td><td>Request</td></tr>
 *   <tr><td>method</td><td>Notification</td></tr>
 *   <tr><td>id, result</td><td>Response</td></tr>
 *   <tr><td>id, error</td><td>ErrorResponse (id may be null)</td></tr>
 *   <tr><td>result and error</td><td>MALFORMED</td></tr>
 *   <tr><td>anything else</td><td>UNKNOWN_VARIANT</td></tr>
 * </table>
 *
 * <p>Unknown members are ignored. Output is always a single line of UTF-8, so newline framing
 * never splits a message.
 */
public final class JsonMessageCodec implements MessageCodec {

    /** Protocol version written to, and accepted from, the {@code jsonrpc} member. */
    public static final String VERSION = "2.0";

    private final ObjectMapper mapper;

    /** Creates a codec with a default object mapper. */
    public JsonMessageCodec() {
        this(new ObjectMapper());
    }

    /**
     * Creates a codec around a caller-supplied mapper.
     *
     * <p>The mapper is reconfigured to reject trailing tokens after the envelope.
     *
     * @param mapper the object mapper
     */
    public JsonMessageCodec(ObjectMapper mapper) {
        this.mapper =
                Objects.requireNonNull(mapper, "mapper")
                        .copy()
                        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public byte[] encode(Message message) {
        Objects.requireNonNull(message, "message");
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", VERSION);
        switch (message.kind()) {
            case REQUEST -> {
                Request request = (Request) message;
                putId(root, request.id());
                root.put("method", request.method());
                if (request.params() != null) {
                    root.set("params", request.params());
                }
            }
            case NOTIFICATION -> {
                Notification notification = (Notification) message;
                root.put("method", notification.method());
                if (notification.params() != null) {
                    root.set("params", notification.params());
                }
            }
            case RESPONSE -> {
                Response response = (Response) message;
                putId(root, response.id());
                root.set("result", response.result());
            }
            case ERROR -> {
                ErrorResponse error = (ErrorResponse) message;
                putId(root, error.id());
                ObjectNode body = root.putObject("error");
                body.put("code", error.error().code());
                body.put("message", error.error().message());
                if (error.error().data() != null) {
                    body.set("data", error.error().data());
                }
            }
        }
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode " + message, e);
        }
    }

    @Override
    public Message decode(byte[] payload, int offset, int length) {
        if (payload == null || length <= 0) {
            throw DecodeException.malformed("Empty payload");
        }

        JsonNode root;
        try {
            root = mapper.readTree(payload, offset, length);
        } catch (IOException e) {
            throw new DecodeException(
                    DecodeException.Kind.MALFORMED, "Payload is not valid JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            throw DecodeException.malformed("Empty payload");
        }
        if (!root.isObject()) {
            throw DecodeException.malformed("Payload is not a JSON object");
        }

        JsonNode version = root.get("jsonrpc");
        if (version != null && !(version.isTextual() && VERSION.equals(version.asText()))) {
            throw DecodeException.unknownVariant("Unsupported protocol version: " + version);
        }

        boolean hasId = root.has("id");
        boolean hasMethod = root.has("method");
        boolean hasResult = root.has("result");
        boolean hasError = root.has("error");

        if (hasMethod) {
            JsonNode method = root.get("method");
            if (!method.isTextual()) {
                throw DecodeException.malformed("Member 'method' must be a string");
            }
            JsonNode params = readParams(root);
            if (hasId) {
                return new Request(readId(root.get("id")), method.asText(), params);
            }
            return new Notification(method.asText(), params);
        }

        if (hasResult && hasError) {
            throw DecodeException.malformed("Reply carries both 'result' and 'error'");
        }
        if (hasId && hasResult) {
            return new Response(readId(root.get("id")), root.get("result"));
        }
        if (hasId && hasError) {
            JsonNode id = root.get("id");
            return new ErrorResponse(id.isNull() ? null : readId(id), readError(root.get("error")));
        }

        List<String> members = new ArrayList<>();
        root.fieldNames().forEachRemaining(members::add);
        throw DecodeException.unknownVariant("Unrecognized message shape, members " + members);
    }

    /**
     * Converts an application value into a JSON tree.
     *
     * @param value the value (null yields null)
     * @return the tree
     */
    public JsonNode toTree(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        return mapper.valueToTree(value);
    }

    /**
     * Converts a JSON tree into an application type.
     *
     * @param node the tree
     * @param type target type
     * @param <T> target type
     * @return the converted value
     * @throws IllegalArgumentException if the tree does not fit the type
     */
    public <T> T fromTree(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Cannot convert payload to " + type.getSimpleName(), e);
        }
    }

    /**
     * Returns the mapper used by this codec.
     *
     * @return the object mapper
     */
    public ObjectMapper objectMapper() {
        return mapper;
    }

    private static void putId(ObjectNode root, RequestId id) {
        if (id == null) {
            root.putNull("id");
        } else if (id.isNumeric()) {
            root.put("id", id.asLong());
        } else {
            root.put("id", id.asString());
        }
    }

    private static RequestId readId(JsonNode id) {
        if (id.isIntegralNumber() && id.canConvertToLong()) {
            return RequestId.of(id.asLong());
        }
        if (id.isTextual()) {
            return RequestId.of(id.asText());
        }
        throw DecodeException.malformed("Member 'id' must be a string or integer: " + id);
    }

    private static JsonNode readParams(JsonNode root) {
        JsonNode params = root.get("params");
        if (params == null || params.isNull()) {
            return null;
        }
        if (!params.isObject() && !params.isArray()) {
            throw DecodeException.malformed("Member 'params' must be an object or array");
        }
        return params;
    }

    private static ErrorObject readError(JsonNode error) {
        if (error == null || !error.isObject()) {
            throw DecodeException.malformed("Member 'error' must be an object");
        }
        JsonNode code = error.get("code");
        JsonNode message = error.get("message");
        if (code == null || !code.isInt()) {
            throw DecodeException.malformed("Error member 'code' must be an integer");
        }
        if (message == null || !message.isTextual()) {
            throw DecodeException.malformed("Error member 'message' must be a string");
        }
        JsonNode data = error.get("data");
        return new ErrorObject(code.asInt(), message.asText(), data);
    }
}
