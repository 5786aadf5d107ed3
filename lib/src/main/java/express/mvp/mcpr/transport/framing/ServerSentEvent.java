package express.mvp.mcpr.transport.framing;

/**
 * One complete {@code text/event-stream} event.
 *
 * @param id the last event id in effect when the event was dispatched (may be null)
 * @param event the event type, {@code "message"} when the stream did not name one
 * @param data the event data, lines joined with {@code '\n'}
 */
public record ServerSentEvent(String id, String event, String data) {

    /** Event type used when an event carries no {@code event:} field. */
    public static final String DEFAULT_EVENT = "message";
}
