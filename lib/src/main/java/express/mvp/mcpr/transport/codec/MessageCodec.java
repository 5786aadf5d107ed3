package express.mvp.mcpr.transport.codec;

import express.mvp.mcpr.transport.message.Message;

/**
 * Converts between {@link Message} values and encoded payload bytes.
 *
 * <p>The codec is substrate-agnostic: a given message always encodes to the same payload. How
 * payloads are delimited in a byte or event stream is the transport's concern, see the {@code
 * framing} package.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations must be thread-safe; one instance is shared by every connection.
 */
public interface MessageCodec {

    /**
     * Encodes a message.
     *
     * @param message the message to encode
     * @return the encoded payload (never null, never empty)
     */
    byte[] encode(Message message);

    /**
     * Decodes a payload.
     *
     * @param payload buffer holding the payload
     * @param offset start of the payload within the buffer
     * @param length payload length in bytes
     * @return the decoded message
     * @throws DecodeException if the payload is malformed or of an unknown shape
     */
    Message decode(byte[] payload, int offset, int length);

    /**
     * Decodes a whole buffer.
     *
     * @param payload the payload
     * @return the decoded message
     * @throws DecodeException if the payload is malformed or of an unknown shape
     */
    default Message decode(byte[] payload) {
        return decode(payload, 0, payload.length);
    }
}
