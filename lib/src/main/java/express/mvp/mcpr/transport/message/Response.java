package express.mvp.mcpr.transport.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

/** Successful reply to a {@link Request}. */
public final class Response implements Message {

    private final RequestId id;
    private final JsonNode result;

    /**
     * Creates a response.
     *
     * @param id id of the request being answered
     * @param result the result payload; null is stored as a JSON null
     */
    public Response(RequestId id, JsonNode result) {
        this.id = Objects.requireNonNull(id, "id");
        this.result = result != null ? result : NullNode.getInstance();
    }

    @Override
    public Kind kind() {
        return Kind.RESPONSE;
    }

    @Override
    public RequestId id() {
        return id;
    }

    /**
     * Returns the result payload.
     *
     * @return the result (never null, possibly a JSON null node)
     */
    public JsonNode result() {
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Response)) {
            return false;
        }
        Response other = (Response) o;
        return id.equals(other.id) && result.equals(other.result);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, result);
    }

    @Override
    public String toString() {
        return "Response[id=" + id + "]";
    }
}
