package express.mvp.mcpr.transport.socket;

import express.mvp.mcpr.transport.framing.FramingException;
import express.mvp.mcpr.transport.framing.LengthPrefixedFramingHandler;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * Reads and writes typed socket frames on top of {@link LengthPrefixedFramingHandler}.
 *
 * <p>The length prefix covers the type byte and the body. Shared by the client transport and the
 * server's socket sessions.
 *
 * <p>Stateless and thread-safe; callers serialize writes to one stream themselves.
 */
public final class SocketFrameCodec {

    private final LengthPrefixedFramingHandler framing;

    /**
     * Creates a codec.
     *
     * @param maxBodySize largest accepted body in bytes
     */
    public SocketFrameCodec(int maxBodySize) {
        this.framing = new LengthPrefixedFramingHandler(maxBodySize + 1);
    }

    /**
     * Writes one frame and flushes.
     *
     * @param out destination stream
     * @param type frame type
     * @param body frame body
     * @throws IOException if the write fails
     * @throws FramingException if the body is too large
     */
    public void write(OutputStream out, FrameType type, byte[] body) throws IOException {
        byte[] payload = new byte[body.length + 1];
        payload[0] = type.code();
        System.arraycopy(body, 0, payload, 1, body.length);
        framing.writeFrame(out, payload);
    }

    /**
     * Reads one frame.
     *
     * @param in source stream
     * @return the frame, or null on a clean end of stream between frames
     * @throws IOException if the read fails or the stream ends inside a frame
     * @throws FramingException on an invalid length or an unknown type
     */
    public SocketFrame read(InputStream in) throws IOException {
        byte[] payload = framing.readFrame(in);
        if (payload == null) {
            return null;
        }
        if (payload.length == 0) {
            throw new FramingException("Empty socket frame has no type byte");
        }
        return new SocketFrame(
                FrameType.fromCode(payload[0]), Arrays.copyOfRange(payload, 1, payload.length));
    }
}
