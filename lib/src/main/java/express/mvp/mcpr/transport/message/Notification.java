package express.mvp.mcpr.transport.message;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** One-way message; carries no id and is never answered. */
public final class Notification implements Message {

    private final String method;
    private final JsonNode params;

    /**
     * Creates a notification.
     *
     * @param method logical operation name
     * @param params payload (may be null; a JSON null is treated as absent)
     */
    public Notification(String method, JsonNode params) {
        this.method = Objects.requireNonNull(method, "method");
        this.params = params == null || params.isNull() ? null : params;
    }

    @Override
    public Kind kind() {
        return Kind.NOTIFICATION;
    }

    @Override
    public RequestId id() {
        return null;
    }

    public String method() {
        return method;
    }

    /**
     * Returns the notification parameters.
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
        if (!(o instanceof Notification)) {
            return false;
        }
        Notification other = (Notification) o;
        return method.equals(other.method) && Objects.equals(params, other.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, params);
    }

    @Override
    public String toString() {
        return "Notification[method=" + method + "]";
    }
}
