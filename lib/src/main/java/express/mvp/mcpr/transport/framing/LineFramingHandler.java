package express.mvp.mcpr.transport.framing;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * A framing handler that terminates each payload with a line feed.
 *
 * <h2>Frame Format</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────┬──────┐
 * │        Payload (no '\n' bytes)      │ '\n' │
 * └─────────────────────────────────────┴──────┘
 * </pre>
 *
 * <p>On read, a trailing carriage return is stripped and blank lines are skipped. Payloads must
 * not contain a line feed; the JSON codec never emits one.
 *
 * <p>Reads go one byte at a time, so pass a buffered stream.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is immutable and thread-safe.
 */
public final class LineFramingHandler implements FramingHandler {

    /** The default maximum line length: 16 MB. */
    public static final int DEFAULT_MAX_PAYLOAD_SIZE = 16 * 1024 * 1024;

    private static final int LF = '\n';
    private static final int CR = '\r';

    private final int maxPayloadSize;

    /** Creates a handler with the default maximum line length. */
    public LineFramingHandler() {
        this(DEFAULT_MAX_PAYLOAD_SIZE);
    }

    /**
     * Creates a handler with the specified maximum line length.
     *
     * @param maxPayloadSize maximum payload bytes per line, excluding the terminator
     */
    public LineFramingHandler(int maxPayloadSize) {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive: " + maxPayloadSize);
        }
        this.maxPayloadSize = maxPayloadSize;
    }

    @Override
    public void writeFrame(OutputStream out, byte[] payload) throws IOException {
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(payload, "payload must not be null");

        if (payload.length > maxPayloadSize) {
            throw new FramingException(String.format(
                    "Payload size %d exceeds maximum allowed size %d",
                    payload.length, maxPayloadSize));
        }
        for (byte b : payload) {
            if (b == LF) {
                throw new FramingException("Payload contains a line feed");
            }
        }

        byte[] frame = new byte[payload.length + 1];
        System.arraycopy(payload, 0, frame, 0, payload.length);
        frame[payload.length] = LF;
        out.write(frame);
        out.flush();
    }

    @Override
    public byte[] readFrame(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");

        ByteArrayOutputStream line = new ByteArrayOutputStream(256);
        while (true) {
            int b = in.read();
            if (b == -1) {
                if (line.size() == 0) {
                    return null;
                }
                throw new EOFException("Stream ended inside a line of " + line.size() + " bytes");
            }
            if (b == LF) {
                byte[] frame = stripCarriageReturn(line.toByteArray());
                if (frame.length == 0) {
                    line.reset();
                    continue; // Blank line
                }
                return frame;
            }
            if (line.size() >= maxPayloadSize + 1) {
                throw new FramingException(String.format(
                        "Line exceeds maximum allowed size %d", maxPayloadSize));
            }
            line.write(b);
        }
    }

    @Override
    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    private static byte[] stripCarriageReturn(byte[] line) {
        int length = line.length;
        if (length > 0 && line[length - 1] == CR) {
            byte[] stripped = new byte[length - 1];
            System.arraycopy(line, 0, stripped, 0, length - 1);
            return stripped;
        }
        return line;
    }

    @Override
    public String toString() {
        return "LineFramingHandler[maxPayloadSize=" + maxPayloadSize + "]";
    }
}
