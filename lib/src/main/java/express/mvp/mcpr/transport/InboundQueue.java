package express.mvp.mcpr.transport;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hand-off between a transport's pump thread and the single caller of {@link Transport#receive()}.
 *
 * <p>The pump {@link #offer offers} whole payloads; when the channel ends it {@link #fail fails}
 * the queue. Payloads queued before the failure are still delivered, after which every
 * {@link #take()} throws the failure. One queue serves one open channel; a re-opened transport
 * creates a fresh queue.
 */
public final class InboundQueue {

    private static final byte[] END = new byte[0];

    private final LinkedBlockingQueue<byte[]> queue = new LinkedBlockingQueue<>();
    private final AtomicReference<TransportException> failure = new AtomicReference<>();

    /**
     * Queues one payload.
     *
     * @param payload the payload
     */
    public void offer(byte[] payload) {
        queue.add(payload);
    }

    /**
     * Ends the queue. Only the first failure is kept.
     *
     * @param cause what ended the channel
     */
    public void fail(TransportException cause) {
        if (failure.compareAndSet(null, cause)) {
            queue.add(END);
        }
    }

    /**
     * Checks if the queue has been ended.
     *
     * @return true after {@link #fail}
     */
    public boolean isFailed() {
        return failure.get() != null;
    }

    /**
     * Blocks until a payload is available.
     *
     * @return the next payload
     * @throws TransportException once the queue has been ended and drained, or when interrupted
     */
    public byte[] take() {
        byte[] next;
        try {
            next = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while waiting for a message", e);
        }
        if (next == END) {
            queue.add(END);
            throw failure.get();
        }
        return next;
    }
}
