package express.mvp.mcpr.transport.message;

import java.util.Objects;

/**
 * Failed reply to a {@link Request}.
 *
 * <p>The id is absent when the peer could not read the request it is complaining about (for
 * example a parse error). Such messages never match a pending call.
 */
public final class ErrorResponse implements Message {

    private final RequestId id;
    private final ErrorObject error;

    /**
     * Creates an error reply.
     *
     * @param id id of the failed request, or null if unknown
     * @param error the error payload
     */
    public ErrorResponse(RequestId id, ErrorObject error) {
        this.id = id;
        this.error = Objects.requireNonNull(error, "error");
    }

    @Override
    public Kind kind() {
        return Kind.ERROR;
    }

    @Override
    public RequestId id() {
        return id;
    }

    public ErrorObject error() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorResponse)) {
            return false;
        }
        ErrorResponse other = (ErrorResponse) o;
        return Objects.equals(id, other.id) && error.equals(other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, error);
    }

    @Override
    public String toString() {
        return "ErrorResponse[id=" + id + ", code=" + error.code() + "]";
    }
}
