package express.mvp.mcpr.transport.message;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Error payload carried by an {@link ErrorResponse}.
 *
 * <p>Codes follow the JSON-RPC 2.0 conventions. The optional {@code data} member carries
 * structured detail owned by the capability layer.
 */
public final class ErrorObject {

    /** Invalid JSON was received. */
    public static final int PARSE_ERROR = -32700;

    /** The JSON sent is not a valid request object. */
    public static final int INVALID_REQUEST = -32600;

    /** The method does not exist or is not available. */
    public static final int METHOD_NOT_FOUND = -32601;

    /** Invalid method parameters. */
    public static final int INVALID_PARAMS = -32602;

    /** Internal error on the peer. */
    public static final int INTERNAL_ERROR = -32603;

    /** Generic server-side failure (handler threw). */
    public static final int SERVER_ERROR = -32000;

    private final int code;
    private final String message;
    private final JsonNode data;

    /**
     * Creates an error payload.
     *
     * @param code the error code
     * @param message short description
     * @param data optional detail (may be null)
     */
    public ErrorObject(int code, String message, JsonNode data) {
        this.code = code;
        this.message = Objects.requireNonNull(message, "message");
        this.data = data;
    }

    /**
     * Creates an error payload without detail.
     *
     * @param code the error code
     * @param message short description
     */
    public ErrorObject(int code, String message) {
        this(code, message, null);
    }

    public int code() {
        return code;
    }

    public String message() {
        return message;
    }

    /**
     * Returns the optional detail.
     *
     * @return the data node, or null if absent
     */
    public JsonNode data() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorObject)) {
            return false;
        }
        ErrorObject other = (ErrorObject) o;
        return code == other.code
                && message.equals(other.message)
                && Objects.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, data);
    }

    @Override
    public String toString() {
        return "ErrorObject[code=" + code + ", message=" + message + "]";
    }
}
