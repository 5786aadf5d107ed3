package express.mvp.mcpr.transport.socket;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * One typed frame read from or written to a socket.
 *
 * @param type the frame type
 * @param body the frame body (may be empty, never null)
 */
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "Frame bodies are handed over without copying on the I/O path.")
public record SocketFrame(FrameType type, byte[] body) {}
