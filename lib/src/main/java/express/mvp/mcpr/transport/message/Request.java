package express.mvp.mcpr.transport.message;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** A request expecting exactly one {@link Response} or {@link ErrorResponse} with the same id. */
public final class Request implements Message {

    private final RequestId id;
    private final String method;
    private final JsonNode params;

    /**
     * Creates a request.
     *
     * @param id correlation id
     * @param method logical operation name
     * @param params payload (may be null when the operation takes none; a JSON null is treated
     *     as absent)
     */
    public Request(RequestId id, String method, JsonNode params) {
        this.id = Objects.requireNonNull(id, "id");
        this.method = Objects.requireNonNull(method, "method");
        this.params = params == null || params.isNull() ? null : params;
    }

    @Override
    public Kind kind() {
        return Kind.REQUEST;
    }

    @Override
    public RequestId id() {
        return id;
    }

    public String method() {
        return method;
    }

    /**
     * Returns the request parameters.
     *
     * @return the params node, or null if absent
     */
    public JsonNode params() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Request)) {
            return false;
        }
        Request other = (Request) o;
        return id.equals(other.id)
                && method.equals(other.method)
                && Objects.equals(params, other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, method, params);
    }

    @Override
    public String toString() {
        return "Request[id=" + id + ", method=" + method + "]";
    }
}
