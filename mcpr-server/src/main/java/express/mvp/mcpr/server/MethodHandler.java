package express.mvp.mcpr.server;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Implementation of one request method.
 *
 * <p>Handlers run on the session thread that read the request, one request at a time per
 * session. A handler that throws is answered with an error reply; the session keeps serving.
 */
@FunctionalInterface
public interface MethodHandler {

    /**
     * Handles one request.
     *
     * @param params the request params, or null if the request carried none
     * @return the result (null is sent as JSON {@code null})
     * @throws Exception any failure; reported to the caller as a server error
     */
    JsonNode handle(JsonNode params) throws Exception;
}
