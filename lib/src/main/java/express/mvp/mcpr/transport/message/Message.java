package express.mvp.mcpr.transport.message;

/**
 * A single wire message.
 *
 * <p>Messages form a closed set of four variants, identified by {@link #kind()}:
 *
 * <ul>
 *   <li>{@link Request} - carries an id, expects exactly one reply
 *   <li>{@link Response} - successful reply, carries the request id and a result
 *   <li>{@link ErrorResponse} - failed reply, carries the request id and an error payload
 *   <li>{@link Notification} - one-way, no id, never answered
 * </ul>
 *
 * <p>All implementations are immutable and compare by value.
 *
 * @see express.mvp.mcpr.transport.codec.MessageCodec
 */
public interface Message {

    /** Variant tag for a {@link Message}. */
    enum Kind {
        REQUEST,
        RESPONSE,
        ERROR,
        NOTIFICATION
    }

    /**
     * Returns the variant of this message.
     *
     * @return the kind (never null)
     */
    Kind kind();

    /**
     * Returns the correlation id, if this variant carries one.
     *
     * @return the id, or null for notifications and anonymous errors
     */
    RequestId id();

    /**
     * Checks whether this message answers a request.
     *
     * @return true for {@link Response} and {@link ErrorResponse}
     */
    default boolean isReply() {
        Kind kind = kind();
        return kind == Kind.RESPONSE || kind == Kind.ERROR;
    }
}
