package express.mvp.mcpr.transport.framing;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Strategy interface for delimiting encoded messages in a continuous byte stream.
 *
 * <p>Stream substrates (process pipes, TCP sockets) carry no message boundaries of their own. A
 * framing handler writes each payload with whatever boundary marker its substrate uses and reads
 * them back one at a time. Payload contents are opaque to the handler.
 *
 * <h2>Framing Process</h2>
 *
 * <pre>
 * Sender:                                    Receiver:
 * ┌──────────────┐                          ┌──────────────┐
 * │   Payload    │                          │   Payload    │
 * └──────────────┘                          └──────────────┘
 *        │                                         ▲
 *        ▼ writeFrame()                            │ readFrame()
 * ┌──────────────────┐     stream      ┌──────────────────┐
 * │ boundary+payload │  ───────────▶  │ boundary+payload │
 * └──────────────────┘                 └──────────────────┘
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations are stateless and immutable; one instance may serve any number of streams.
 * Callers must serialize writes to a single stream themselves (the transports hold a send lock)
 * and only one thread may read a given stream.
 *
 * @see LineFramingHandler
 * @see LengthPrefixedFramingHandler
 * @see FramingException
 */
public interface FramingHandler {

    /**
     * Writes one framed payload and flushes the stream.
     *
     * @param out the destination stream
     * @param payload the payload bytes
     * @throws FramingException if the payload cannot be represented by this framing
     * @throws IOException if the stream fails
     */
    void writeFrame(OutputStream out, byte[] payload) throws IOException;

    /**
     * Reads the next complete payload.
     *
     * @param in the source stream
     * @return the payload, or {@code null} if the stream ended cleanly between frames
     * @throws FramingException if the stream contains an invalid or oversized frame
     * @throws IOException if the stream fails or ends inside a frame
     */
    byte[] readFrame(InputStream in) throws IOException;

    /**
     * Returns the maximum payload size accepted in either direction.
     *
     * @return the maximum payload size in bytes
     */
    int getMaxPayloadSize();
}
