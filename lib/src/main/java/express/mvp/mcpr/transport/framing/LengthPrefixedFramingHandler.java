package express.mvp.mcpr.transport.framing;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * A framing handler that uses a 4-byte big-endian length prefix.
 *
 * <h2>Frame Format</h2>
 *
 * <pre>
 * ┌────────────────────────┬─────────────────────────────────────┐
 * │  Length (4 bytes, BE)  │           Payload (N bytes)         │
 * └────────────────────────┴─────────────────────────────────────┘
 * </pre>
 *
 * <p>The length prefix counts payload bytes only. The maximum payload size is fixed at
 * construction; a prefix above it is rejected before anything is allocated.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @see FramingHandler
 */
public final class LengthPrefixedFramingHandler implements FramingHandler {

    /** The size of the length prefix header in bytes. */
    public static final int HEADER_SIZE = 4;

    /** The default maximum payload size: 16 MB. */
    public static final int DEFAULT_MAX_PAYLOAD_SIZE = 16 * 1024 * 1024;

    private final int maxPayloadSize;

    /** Creates a handler with the default maximum payload size. */
    public LengthPrefixedFramingHandler() {
        this(DEFAULT_MAX_PAYLOAD_SIZE);
    }

    /**
     * Creates a handler with the specified maximum payload size.
     *
     * @param maxPayloadSize the maximum payload size in bytes
     * @throws IllegalArgumentException if maxPayloadSize is not positive or would overflow the
     *     frame size
     */
    public LengthPrefixedFramingHandler(int maxPayloadSize) {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be positive: " + maxPayloadSize);
        }
        if (maxPayloadSize > Integer.MAX_VALUE - HEADER_SIZE) {
            throw new IllegalArgumentException(
                    "maxPayloadSize too large, would overflow frame size: " + maxPayloadSize);
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

        byte[] frame = new byte[HEADER_SIZE + payload.length];
        ByteBuffer.wrap(frame).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).put(payload);
        out.write(frame);
        out.flush();
    }

    @Override
    public byte[] readFrame(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");

        byte[] header = new byte[HEADER_SIZE];
        int headerRead = readFully(in, header);
        if (headerRead == 0) {
            return null; // Clean EOF between frames
        }
        if (headerRead < HEADER_SIZE) {
            throw new EOFException(
                    "Stream ended inside a frame header after " + headerRead + " bytes");
        }

        int payloadLength = ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN).getInt();
        if (payloadLength < 0) {
            throw new FramingException("Invalid negative length prefix: " + payloadLength);
        }
        if (payloadLength > maxPayloadSize) {
            throw new FramingException(String.format(
                    "Length prefix %d exceeds maximum allowed size %d",
                    payloadLength, maxPayloadSize));
        }

        byte[] payload = new byte[payloadLength];
        int payloadRead = readFully(in, payload);
        if (payloadRead < payloadLength) {
            throw new EOFException(String.format(
                    "Stream ended after %d of %d payload bytes", payloadRead, payloadLength));
        }
        return payload;
    }

    @Override
    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    /** Reads until the buffer is full or EOF; returns the number of bytes read. */
    private static int readFully(InputStream in, byte[] buffer) throws IOException {
        int offset = 0;
        while (offset < buffer.length) {
            int read = in.read(buffer, offset, buffer.length - offset);
            if (read == -1) {
                break;
            }
            offset += read;
        }
        return offset;
    }

    @Override
    public String toString() {
        return String.format("LengthPrefixedFramingHandler[headerSize=%d, maxPayloadSize=%d]",
                HEADER_SIZE, maxPayloadSize);
    }
}
