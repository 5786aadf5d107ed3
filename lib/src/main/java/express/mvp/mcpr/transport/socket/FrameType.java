package express.mvp.mcpr.transport.socket;

import express.mvp.mcpr.transport.framing.FramingException;

/**
 * Type byte carried after the length prefix of every socket frame.
 *
 * <pre>
 * ┌──────────────────┬──────────┬──────────────────────┐
 * │ length (4, BE)   │ type (1) │ body (length - 1)    │
 * └──────────────────┴──────────┴──────────────────────┘
 * </pre>
 */
public enum FrameType {
    /** An encoded message. */
    DATA((byte) 0),
    /** Liveness probe; the receiver answers with {@link #PONG} carrying the same body. */
    PING((byte) 1),
    /** Answer to {@link #PING}. */
    PONG((byte) 2),
    /** Client credentials (UTF-8 token); must be the first frame when present. */
    AUTH((byte) 3),
    /** Server accepted the credentials. */
    AUTH_OK((byte) 4),
    /** Server refused the credentials; the body carries the reason. The socket is closed next. */
    AUTH_REJECTED((byte) 5);

    private final byte code;

    FrameType(byte code) {
        this.code = code;
    }

    /**
     * Returns the wire code.
     *
     * @return the type byte
     */
    public byte code() {
        return code;
    }

    /**
     * Looks up a frame type by wire code.
     *
     * @param code the type byte
     * @return the frame type
     * @throws FramingException if the code is unknown
     */
    public static FrameType fromCode(byte code) {
        for (FrameType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new FramingException("Unknown socket frame type: " + code);
    }
}
