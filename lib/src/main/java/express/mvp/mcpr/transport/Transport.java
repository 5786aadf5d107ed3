package express.mvp.mcpr.transport;

import java.time.Duration;

/**
 * Core transport abstraction: moves whole encoded messages over one substrate.
 *
 * <p>A transport knows nothing about message structure. It delimits payloads on the wire
 * (framing) and moves them; encoding is the codec's concern, lifecycle decisions are the
 * connection manager's.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────┐
 * │                   ConnectionManager                     │
 * │  lifecycle, send gate, reader thread, heartbeat         │
 * └─────────────────────────────────────────────────────────┘
 *                           │
 *                           ▼
 * ┌─────────────────────────────────────────────────────────┐
 * │                       Transport                         │
 * ├─────────────────────────────────────────────────────────┤
 * │  pipe (lines)  │  event stream (SSE+POST)  │  socket    │
 * └─────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Contract</h2>
 *
 * <ul>
 *   <li>{@link #open()} establishes the channel; a transport may be re-opened after
 *       {@link #close()}.
 *   <li>{@link #send(byte[])} writes one payload. Callers serialize sends; implementations need
 *       not be safe for concurrent senders.
 *   <li>{@link #receive()} blocks until a whole payload is available. It has a single caller.
 *       After a transient failure that leaves the channel open, the next call may succeed. Once
 *       the channel is closed, locally or by the peer, it throws.
 *   <li>{@link #probe(Duration)} checks liveness without consuming inbound messages, so it may
 *       run while another thread is blocked in {@code receive()}.
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Transport transport = TransportFactory.create(EndpointConfig.socket("localhost", 7070).build());
 * transport.open();
 * try {
 *     transport.send(codec.encode(request));
 *     Message reply = codec.decode(transport.receive());
 * } finally {
 *     transport.close();
 * }
 * }</pre>
 *
 * @see TransportFactory
 * @see express.mvp.mcpr.transport.connection.ConnectionManager
 */
public interface Transport extends AutoCloseable {

    /**
     * Establishes the channel.
     *
     * @throws TransportException if the channel cannot be established
     * @throws IllegalStateException if already open
     */
    void open();

    /**
     * Writes one payload.
     *
     * @param payload the encoded message; must not be empty
     * @throws express.mvp.mcpr.transport.error.FrameRejectedException if the payload cannot be
     *     framed; nothing was written
     * @throws TransportException if the write fails or the channel is closed
     */
    void send(byte[] payload);

    /**
     * Blocks until one whole payload is available.
     *
     * @return the payload
     * @throws TransportException on disconnect, on local close, or on a read failure
     */
    byte[] receive();

    /**
     * Checks whether the peer is still reachable.
     *
     * @param deadline how long to wait for evidence of liveness
     * @return true if the peer answered (or is otherwise known alive) within the deadline
     */
    boolean probe(Duration deadline);

    /**
     * Releases the channel. Idempotent. A thread blocked in {@link #receive()} is released with
     * a {@link TransportException}.
     */
    @Override
    void close();

    /**
     * Returns the substrate this transport runs over.
     *
     * @return the kind
     */
    TransportKind kind();

    /**
     * Checks if the channel is currently open.
     *
     * @return true between a successful {@code open()} and the channel closing
     */
    boolean isOpen();

    /**
     * Returns a health snapshot.
     *
     * @return current counters and last error
     */
    TransportHealth health();
}
