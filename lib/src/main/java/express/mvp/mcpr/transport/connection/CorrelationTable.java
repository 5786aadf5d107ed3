package express.mvp.mcpr.transport.connection;

import express.mvp.mcpr.transport.error.CallCancelledException;
import express.mvp.mcpr.transport.error.CallTimeoutException;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.RequestId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pending calls of one connection, keyed by request id.
 *
 * <p>Every entry is removed exactly once, by whichever path gets there first: a matching reply,
 * the caller cancelling, the deadline sweep, or a connection-level failure. The losing paths see
 * the entry gone and do nothing, so a call never completes twice and never leaks.
 *
 * <h2>Send Epochs</h2>
 *
 * <p>The owning connection stamps each entry with the epoch (activation count) in which its
 * request was written. After a reconnect, {@link #failSentBefore(long, RuntimeException)} fails
 * the entries written to the previous channel while leaving entries that were still waiting to be
 * written untouched.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe.
 */
public final class CorrelationTable {

    private static final Logger LOGGER = Logger.getLogger(CorrelationTable.class.getName());

    private final String owner;
    private final Map<RequestId, Entry> pending = new ConcurrentHashMap<>();

    /**
     * Creates an empty table.
     *
     * @param owner connection name for log and error messages
     */
    public CorrelationTable(String owner) {
        this.owner = owner;
    }

    /** One outstanding call. */
    public static final class Entry {
        private final RequestId id;
        private final String method;
        private final long deadlineNanos;
        private final CompletableFuture<Message> reply = new CompletableFuture<>();
        private volatile long sentEpoch = -1;

        private Entry(RequestId id, String method, long deadlineNanos) {
            this.id = id;
            this.method = method;
            this.deadlineNanos = deadlineNanos;
        }

        /**
         * Returns the request id.
         *
         * @return the id
         */
        public RequestId id() {
            return id;
        }

        /**
         * Returns the request method.
         *
         * @return the method name
         */
        public String method() {
            return method;
        }

        /**
         * Returns the absolute deadline.
         *
         * @return {@link System#nanoTime()} deadline
         */
        public long deadlineNanos() {
            return deadlineNanos;
        }

        /**
         * Returns the future completed with the reply ({@code Response} or
         * {@code ErrorResponse}) or with the failure that ended the call.
         *
         * @return the reply future
         */
        public CompletableFuture<Message> reply() {
            return reply;
        }

        /**
         * Returns the epoch the request was written in.
         *
         * @return the epoch, or -1 if not yet written
         */
        public long sentEpoch() {
            return sentEpoch;
        }
    }

    /**
     * Registers a call.
     *
     * @param id the request id
     * @param method the method name, for diagnostics
     * @param deadlineNanos absolute {@link System#nanoTime()} deadline
     * @return the new entry
     * @throws IllegalStateException if the id is already pending
     */
    public Entry register(RequestId id, String method, long deadlineNanos) {
        Objects.requireNonNull(id, "id");
        Entry entry = new Entry(id, method, deadlineNanos);
        if (pending.putIfAbsent(id, entry) != null) {
            throw new IllegalStateException("request id " + id + " already pending on " + owner);
        }
        return entry;
    }

    /**
     * Records that a pending request was written in an epoch.
     *
     * @param id the request id
     * @param epoch the connection epoch
     */
    public void markSent(RequestId id, long epoch) {
        Entry entry = pending.get(id);
        if (entry != null) {
            entry.sentEpoch = epoch;
        }
    }

    /**
     * Completes the call a reply belongs to.
     *
     * @param reply a {@code Response} or {@code ErrorResponse}
     * @return true if a pending call matched; false if the reply is unmatched
     */
    public boolean complete(Message reply) {
        RequestId id = reply.id();
        if (id == null) {
            return false;
        }
        Entry entry = pending.remove(id);
        if (entry == null) {
            return false;
        }
        entry.reply.complete(reply);
        return true;
    }

    /**
     * Cancels a pending call. The peer is not told.
     *
     * @param id the request id
     * @return true if the call was still pending
     */
    public boolean cancel(RequestId id) {
        Entry entry = pending.remove(id);
        if (entry == null) {
            return false;
        }
        entry.reply.completeExceptionally(
                new CallCancelledException("call " + id + " (" + entry.method + ") cancelled"));
        return true;
    }

    /**
     * Fails one pending call.
     *
     * @param id the request id
     * @param cause the failure
     * @return true if the call was still pending
     */
    public boolean fail(RequestId id, Throwable cause) {
        Entry entry = pending.remove(id);
        if (entry == null) {
            return false;
        }
        entry.reply.completeExceptionally(cause);
        return true;
    }

    /**
     * Fails every call whose deadline is at or before {@code nowNanos}.
     *
     * @param nowNanos the current {@link System#nanoTime()}
     * @return the number of calls expired
     */
    public int expire(long nowNanos) {
        int expired = 0;
        for (Entry entry : snapshot(e -> e.deadlineNanos - nowNanos <= 0)) {
            if (pending.remove(entry.id, entry)) {
                entry.reply.completeExceptionally(
                        new CallTimeoutException(
                                "call " + entry.id + " (" + entry.method + ") on " + owner
                                        + " timed out"));
                expired++;
            }
        }
        if (expired > 0) {
            LOGGER.log(Level.FINE, "[{0}] expired {1} call(s)", new Object[] {owner, expired});
        }
        return expired;
    }

    /**
     * Fails every call written in an epoch before {@code epoch}.
     *
     * @param epoch the new epoch
     * @param cause the failure to complete them with
     * @return the number of calls failed
     */
    public int failSentBefore(long epoch, RuntimeException cause) {
        return failMatching(e -> e.sentEpoch >= 0 && e.sentEpoch < epoch, cause);
    }

    /**
     * Fails every pending call.
     *
     * @param cause the failure to complete them with
     * @return the number of calls failed
     */
    public int failAll(RuntimeException cause) {
        return failMatching(e -> true, cause);
    }

    /**
     * Returns the number of pending calls.
     *
     * @return pending count
     */
    public int size() {
        return pending.size();
    }

    /**
     * Checks if a call is pending.
     *
     * @param id the request id
     * @return true if pending
     */
    public boolean isPending(RequestId id) {
        return pending.containsKey(id);
    }

    private int failMatching(Predicate<Entry> filter, RuntimeException cause) {
        int failed = 0;
        for (Entry entry : snapshot(filter)) {
            if (pending.remove(entry.id, entry)) {
                entry.reply.completeExceptionally(cause);
                failed++;
            }
        }
        return failed;
    }

    private List<Entry> snapshot(Predicate<Entry> filter) {
        List<Entry> matching = new ArrayList<>();
        for (Entry entry : pending.values()) {
            if (filter.test(entry)) {
                matching.add(entry);
            }
        }
        return matching;
    }
}
