package express.mvp.mcpr.transport.config;

/**
 * Thrown when a transport configuration is invalid or incomplete.
 *
 * <p>Raised from configuration builders and from router construction only. A connection that
 * has been built never fails with this exception at runtime.
 */
public class ConfigException extends RuntimeException {

    /**
     * Creates the exception.
     *
     * @param message what is wrong with the configuration
     */
    public ConfigException(String message) {
        super(message);
    }
}
