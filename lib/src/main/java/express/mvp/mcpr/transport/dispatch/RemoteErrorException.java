package express.mvp.mcpr.transport.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.mcpr.transport.message.ErrorObject;
import java.util.Objects;

/** The peer answered a call with an error payload. */
public class RemoteErrorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ErrorObject error;

    /**
     * Creates an exception for an error reply.
     *
     * @param method the method that was called
     * @param error the error payload
     */
    public RemoteErrorException(String method, ErrorObject error) {
        super(method + " failed with " + error.code() + ": " + error.message());
        this.error = Objects.requireNonNull(error, "error");
    }

    /**
     * Returns the error code.
     *
     * @return the code
     */
    public int code() {
        return error.code();
    }

    /**
     * Returns the error payload.
     *
     * @return the payload
     */
    public ErrorObject error() {
        return error;
    }

    /**
     * Returns the optional structured detail.
     *
     * @return the data, or null
     */
    public JsonNode data() {
        return error.data();
    }
}
