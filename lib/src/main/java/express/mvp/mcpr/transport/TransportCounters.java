package express.mvp.mcpr.transport;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live counters a transport updates as it moves frames, snapshotted into {@link TransportHealth}.
 *
 * <p>All methods are thread-safe; the send path, the pump thread and health readers may touch the
 * counters concurrently.
 */
public final class TransportCounters {

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicReference<ErrorMark> lastError = new AtomicReference<>();

    private record ErrorMark(Instant at, String message) {}

    /**
     * Records one outbound message.
     *
     * @param bytes its payload size
     */
    public void recordSent(int bytes) {
        messagesSent.incrementAndGet();
        bytesSent.addAndGet(bytes);
    }

    /**
     * Records one inbound message.
     *
     * @param bytes its payload size
     */
    public void recordReceived(int bytes) {
        messagesReceived.incrementAndGet();
        bytesReceived.addAndGet(bytes);
    }

    /**
     * Records a failure.
     *
     * @param error the failure
     */
    public void recordError(Throwable error) {
        lastError.set(new ErrorMark(Instant.now(), String.valueOf(error.getMessage())));
    }

    /** Forgets the last error, typically after a successful open. */
    public void clearError() {
        lastError.set(null);
    }

    /**
     * Takes a snapshot.
     *
     * @param open whether the channel is currently open
     * @return the health snapshot
     */
    public TransportHealth snapshot(boolean open) {
        TransportHealth.Builder builder =
                TransportHealth.builder()
                        .open(open)
                        .healthy(open)
                        .messages(messagesSent.get(), messagesReceived.get())
                        .bytes(bytesSent.get(), bytesReceived.get());
        ErrorMark mark = lastError.get();
        if (mark != null) {
            builder.lastError(mark.at(), mark.message());
        }
        return builder.build();
    }
}
