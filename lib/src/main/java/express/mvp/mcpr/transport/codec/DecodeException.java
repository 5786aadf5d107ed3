package express.mvp.mcpr.transport.codec;

/**
 * Thrown when a received payload cannot be turned into a {@link
 * express.mvp.mcpr.transport.message.Message}.
 *
 * <p>A decode failure concerns one message only. The connection that delivered it stays up; the
 * offending payload is logged and dropped.
 */
public class DecodeException extends RuntimeException {

    /** Why decoding failed. */
    public enum Kind {
        /** Empty, not JSON, not an object, or a required member is missing or mistyped. */
        MALFORMED,

        /** Well-formed JSON whose shape matches no known message variant. */
        UNKNOWN_VARIANT
    }

    private final Kind kind;

    /**
     * Creates a decode exception.
     *
     * @param kind the failure kind
     * @param message detail message
     */
    public DecodeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates a decode exception with a cause.
     *
     * @param kind the failure kind
     * @param message detail message
     * @param cause the parser failure
     */
    public DecodeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the failure kind.
     *
     * @return the kind (never null)
     */
    public Kind kind() {
        return kind;
    }

    static DecodeException malformed(String message) {
        return new DecodeException(Kind.MALFORMED, message);
    }

    static DecodeException unknownVariant(String message) {
        return new DecodeException(Kind.UNKNOWN_VARIANT, message);
    }
}
