package express.mvp.mcpr.server;

import java.util.Objects;

/**
 * Decides whether a client may open a session.
 *
 * <p>Socket clients present their token in an {@code AUTH} frame; event-stream clients in an
 * {@code Authorization: Bearer} header. A client that presents nothing is asked about with a null
 * token.
 */
@FunctionalInterface
public interface AuthGate {

    /**
     * Checks a client's credentials.
     *
     * @param token the presented token, or null if the client sent none
     * @return true to admit the client
     */
    boolean admit(String token);

    /**
     * Returns a gate that admits every client.
     *
     * @return the open gate
     */
    static AuthGate allowAll() {
        return token -> true;
    }

    /**
     * Returns a gate that admits only clients presenting {@code expected}.
     *
     * @param expected the shared token
     * @return the gate
     */
    static AuthGate requireToken(String expected) {
        Objects.requireNonNull(expected, "expected");
        return expected::equals;
    }
}
