package express.mvp.mcpr.transport.message;

import java.util.Objects;

/**
 * Correlation identifier carried by requests and their responses.
 *
 * <p>The wire format allows either an integer or a string. Both forms are preserved exactly so a
 * response echoes the identifier in the same shape the request used.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RequestId numeric = RequestId.of(42);
 * RequestId text = RequestId.of("cli-7");
 *
 * numeric.isNumeric();   // true
 * text.asString();       // "cli-7"
 * }</pre>
 */
public final class RequestId {

    /** Numeric value, meaningful only when {@link #text} is null. */
    private final long number;

    /** String value, or null for numeric identifiers. */
    private final String text;

    private RequestId(long number, String text) {
        this.number = number;
        this.text = text;
    }

    /**
     * Creates a numeric identifier.
     *
     * @param number the numeric value
     * @return the identifier
     */
    public static RequestId of(long number) {
        return new RequestId(number, null);
    }

    /**
     * Creates a string identifier.
     *
     * @param text the string value
     * @return the identifier
     */
    public static RequestId of(String text) {
        Objects.requireNonNull(text, "text");
        return new RequestId(0L, text);
    }

    /**
     * Checks whether this identifier is numeric.
     *
     * @return true for integer identifiers
     */
    public boolean isNumeric() {
        return text == null;
    }

    /**
     * Returns the numeric value.
     *
     * @return the number
     * @throws IllegalStateException if this is a string identifier
     */
    public long asLong() {
        if (text != null) {
            throw new IllegalStateException("Request id is not numeric: " + text);
        }
        return number;
    }

    /**
     * Returns the identifier rendered as a string.
     *
     * @return the string form
     */
    public String asString() {
        return text != null ? text : Long.toString(number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RequestId)) {
            return false;
        }
        RequestId other = (RequestId) o;
        return number == other.number && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return text != null ? text.hashCode() : Long.hashCode(number);
    }

    @Override
    public String toString() {
        return text != null ? '"' + text + '"' : Long.toString(number);
    }
}
