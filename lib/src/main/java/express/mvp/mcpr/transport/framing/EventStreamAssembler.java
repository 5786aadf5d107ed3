package express.mvp.mcpr.transport.framing;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Incremental parser for {@code text/event-stream} bodies.
 *
 * <p>An event stream arrives in chunks whose boundaries have nothing to do with event
 * boundaries: a chunk may end halfway through a line, or even halfway through a multi-byte UTF-8
 * character. The assembler buffers the incomplete tail and only emits events once the blank line
 * that terminates them has been seen.
 *
 * <h2>Supported Syntax</h2>
 *
 * <ul>
 *   <li>Line terminators {@code \n}, {@code \r\n} and {@code \r}, including a {@code \r\n} pair
 *       split across chunks
 *   <li>{@code event:}, {@code data:} (repeated lines are joined with {@code \n}), {@code id:}
 *       and {@code retry:} fields; one space after the colon is dropped
 *   <li>Comment lines starting with {@code :}, used by servers as keep-alives
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EventStreamAssembler assembler = new EventStreamAssembler();
 * byte[] chunk = new byte[8192];
 * int n;
 * while ((n = body.read(chunk)) != -1) {
 *     for (ServerSentEvent event : assembler.feed(chunk, 0, n)) {
 *         handle(event);
 *     }
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. One assembler per stream, fed by the single thread that reads it.
 */
public final class EventStreamAssembler {

    /** The default maximum size of one line or one event's data: 16 MB. */
    public static final int DEFAULT_MAX_EVENT_SIZE = 16 * 1024 * 1024;

    private final int maxEventSize;

    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);
    private final StringBuilder data = new StringBuilder();
    private String eventType;
    private String lastEventId;
    private String pendingId;
    private long retryMillis = -1;
    private long commentCount;
    private boolean skipLineFeed;

    /** Creates an assembler with the default size limit. */
    public EventStreamAssembler() {
        this(DEFAULT_MAX_EVENT_SIZE);
    }

    /**
     * Creates an assembler with a size limit.
     *
     * @param maxEventSize maximum bytes for one line and characters for one event's data
     */
    public EventStreamAssembler(int maxEventSize) {
        if (maxEventSize <= 0) {
            throw new IllegalArgumentException("maxEventSize must be positive: " + maxEventSize);
        }
        this.maxEventSize = maxEventSize;
    }

    /**
     * Feeds a chunk and returns the events it completes.
     *
     * @param chunk buffer holding the chunk
     * @param offset start of the chunk
     * @param length chunk length
     * @return completed events in stream order (possibly empty)
     * @throws FramingException if a line or an event exceeds the size limit
     */
    public List<ServerSentEvent> feed(byte[] chunk, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, chunk.length);
        List<ServerSentEvent> completed = null;

        for (int i = offset; i < offset + length; i++) {
            byte b = chunk[i];
            if (skipLineFeed) {
                skipLineFeed = false;
                if (b == '\n') {
                    continue;
                }
            }
            if (b == '\n' || b == '\r') {
                skipLineFeed = b == '\r';
                ServerSentEvent event = processLine(line.toString(StandardCharsets.UTF_8));
                line.reset();
                if (event != null) {
                    if (completed == null) {
                        completed = new ArrayList<>(2);
                    }
                    completed.add(event);
                }
                continue;
            }
            if (line.size() >= maxEventSize) {
                throw new FramingException("Event stream line exceeds " + maxEventSize + " bytes");
            }
            line.write(b);
        }

        return completed != null ? completed : Collections.emptyList();
    }

    /**
     * Returns the id of the most recent event that carried one.
     *
     * <p>This is the resumption marker sent as {@code Last-Event-ID} after a reconnect. An
     * {@code id:} line only takes effect once the blank line ending its event arrives.
     *
     * @return the last event id, or null if none was seen
     */
    public String lastEventId() {
        return lastEventId;
    }

    /**
     * Seeds the last event id, for example when resuming a stream with a fresh assembler.
     *
     * @param lastEventId the marker (may be null)
     */
    public void lastEventId(String lastEventId) {
        this.lastEventId = lastEventId;
        this.pendingId = null;
    }

    /**
     * Returns the reconnection delay requested by the server.
     *
     * @return the delay in milliseconds, or -1 if the server sent none
     */
    public long retryMillis() {
        return retryMillis;
    }

    /**
     * Returns how many comment lines have been seen.
     *
     * @return the comment count
     */
    public long commentCount() {
        return commentCount;
    }

    /** Discards any partially received event, its id included; the last event id is kept. */
    public void reset() {
        line.reset();
        data.setLength(0);
        eventType = null;
        pendingId = null;
        skipLineFeed = false;
    }

    private ServerSentEvent processLine(String text) {
        if (text.isEmpty()) {
            return dispatch();
        }
        if (text.charAt(0) == ':') {
            commentCount++;
            return null;
        }

        String field;
        String value;
        int colon = text.indexOf(':');
        if (colon < 0) {
            field = text;
            value = "";
        } else {
            field = text.substring(0, colon);
            value = text.substring(colon + 1);
            if (!value.isEmpty() && value.charAt(0) == ' ') {
                value = value.substring(1);
            }
        }

        switch (field) {
            case "event" -> eventType = value;
            case "data" -> {
                if (data.length() + value.length() + 1 > maxEventSize) {
                    throw new FramingException("Event data exceeds " + maxEventSize + " characters");
                }
                data.append(value).append('\n');
            }
            case "id" -> {
                if (value.indexOf('\0') < 0) {
                    pendingId = value;
                }
            }
            case "retry" -> {
                if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
                    try {
                        retryMillis = Long.parseLong(value);
                    } catch (NumberFormatException e) {
                        retryMillis = Long.MAX_VALUE;
                    }
                }
            }
            default -> {
                // Unknown fields are ignored
            }
        }
        return null;
    }

    private ServerSentEvent dispatch() {
        if (pendingId != null) {
            lastEventId = pendingId;
            pendingId = null;
        }
        if (data.length() == 0) {
            eventType = null;
            return null;
        }
        String payload = data.substring(0, data.length() - 1);
        String type = eventType == null || eventType.isEmpty()
                ? ServerSentEvent.DEFAULT_EVENT
                : eventType;
        data.setLength(0);
        eventType = null;
        return new ServerSentEvent(lastEventId, type, payload);
    }
}
