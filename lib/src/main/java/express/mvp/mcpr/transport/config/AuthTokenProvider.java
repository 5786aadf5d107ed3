package express.mvp.mcpr.transport.config;

import java.util.Optional;

/**
 * Supplies a credential that socket and event-stream transports attach before each
 * {@code open()}.
 *
 * <p>The provider is invoked on the connection's control thread, once per open attempt, so a
 * rotated token is picked up on the next reconnect. Pipe transports never call it.
 */
@FunctionalInterface
public interface AuthTokenProvider {

    /**
     * Returns the current token.
     *
     * @return the bearer token, or empty to connect without credentials
     */
    Optional<String> currentToken();

    /**
     * Returns a provider that always hands out the same token.
     *
     * @param token the token
     * @return a fixed provider
     */
    static AuthTokenProvider fixed(String token) {
        Optional<String> value = Optional.of(token);
        return () -> value;
    }
}
