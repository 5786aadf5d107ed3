package express.mvp.mcpr.transport.connection;

import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.TransportHealth;
import express.mvp.mcpr.transport.codec.DecodeException;
import express.mvp.mcpr.transport.codec.MessageCodec;
import express.mvp.mcpr.transport.config.HeartbeatConfig;
import express.mvp.mcpr.transport.config.TransportConfig;
import express.mvp.mcpr.transport.error.CallTimeoutException;
import express.mvp.mcpr.transport.error.ConnectionClosedException;
import express.mvp.mcpr.transport.error.ConnectionResetException;
import express.mvp.mcpr.transport.error.ErrorClassifier;
import express.mvp.mcpr.transport.error.FrameRejectedException;
import express.mvp.mcpr.transport.error.ReconnectExhaustedException;
import express.mvp.mcpr.transport.error.ReconnectPolicy;
import express.mvp.mcpr.transport.error.RetryContext;
import express.mvp.mcpr.transport.lifecycle.ConnectionState;
import express.mvp.mcpr.transport.lifecycle.ConnectionStateListener;
import express.mvp.mcpr.transport.lifecycle.ConnectionStateMachine;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Request;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one transport and keeps it usable: opens it, reads from it, probes it, and re-opens it
 * after faults.
 *
 * <h2>Threads</h2>
 *
 * <ul>
 *   <li><b>control</b>: a single thread that performs every open, probe and state change, so
 *       lifecycle decisions never race each other;
 *   <li><b>reader</b>: the sole caller of {@link Transport#receive()}; decodes and hands each
 *       message to the {@link MessageHandler};
 *   <li><b>sweeper</b>: expires pending calls past their deadline, whatever the state.
 * </ul>
 *
 * <p>Senders are serialized by a send lock, so at most one {@code send} is in flight per
 * transport.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 * start() ─▶ INITIALIZING ──open ok──▶ ACTIVE ──fault──▶ DEGRADED ──probe ok──▶ ACTIVE
 *                 │                      ▲                   │
 *                 └──open failed──▶ RECONNECTING ◀──probes failed
 *                                        │
 *                                        └──budget exhausted──▶ FAILED
 * </pre>
 *
 * <p>Only a missed heartbeat is confirmed with probes before reconnecting. A failed read or write
 * goes from {@code DEGRADED} straight to {@code RECONNECTING}.
 *
 * <p>Each activation starts a new <em>epoch</em>. Calls written during an earlier epoch are failed
 * with {@link ConnectionResetException} when a re-opened channel is activated; they are never
 * replayed. Calls still waiting to be written are sent on the new channel.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConnectionManager connection =
 *     new ConnectionManager("tools", TransportFactory.create(endpoint), codec, config);
 * connection.setMessageHandler((source, message) -> inbox.add(message));
 * connection.start();
 * connection.awaitSettled(Duration.ofSeconds(5));
 * }</pre>
 */
public final class ConnectionManager {

    private static final Logger LOGGER = Logger.getLogger(ConnectionManager.class.getName());

    private static final int LOG_PREVIEW = 200;

    private final String name;
    private final Transport transport;
    private final MessageCodec codec;
    private final ReconnectPolicy reconnectPolicy;
    private final HeartbeatConfig heartbeat;
    private final Duration sweepInterval;

    private final ConnectionStateMachine stateMachine;
    private final CorrelationTable correlations;
    private final RetryContext retry;

    private final ScheduledExecutorService control;
    private final ScheduledExecutorService sweeper;
    private final Object sendLock = new Object();
    private final Object readerGate = new Object();

    private final AtomicLong epoch = new AtomicLong();
    private final AtomicLong activations = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean();

    private volatile MessageHandler handler;
    private volatile Thread reader;
    private volatile Throwable lastFault;
    private volatile ReconnectExhaustedException failure;

    /**
     * Creates a connection manager. Nothing happens until {@link #start()}.
     *
     * @param name connection name, used in thread names and logs
     * @param transport the transport to manage; owned from now on
     * @param codec the message codec
     * @param config source of reconnect, heartbeat and sweep settings
     */
    public ConnectionManager(
            String name, Transport transport, MessageCodec codec, TransportConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.handler =
                (source, message) ->
                        LOGGER.log(
                                Level.FINE,
                                "[{0}] no handler for {1}",
                                new Object[] {source.name(), message});
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.reconnectPolicy = config.reconnectPolicy();
        this.heartbeat = config.heartbeat();
        this.sweepInterval = config.sweepInterval();
        this.stateMachine = new ConnectionStateMachine(name);
        this.correlations = new CorrelationTable(name);
        this.retry = new RetryContext("open " + name, reconnectPolicy.getMaxAttempts());
        this.control =
                Executors.newSingleThreadScheduledExecutor(daemon("mcpr-" + name + "-control"));
        this.sweeper =
                Executors.newSingleThreadScheduledExecutor(daemon("mcpr-" + name + "-sweep"));
        this.stateMachine.addListener(
                (previous, current, cause) -> {
                    if (current == ConnectionState.ACTIVE) {
                        activations.incrementAndGet();
                    }
                    synchronized (readerGate) {
                        readerGate.notifyAll();
                    }
                });
    }

    /**
     * Starts the first open attempt and the background tasks. Returns without waiting for the
     * outcome; sends issued meanwhile wait for it.
     *
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("connection " + name + " already started");
        }
        long sweepMillis = sweepInterval.toMillis();
        sweeper.scheduleWithFixedDelay(
                this::sweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
        if (heartbeat.isEnabled()) {
            long beatMillis = heartbeat.interval().toMillis();
            control.scheduleWithFixedDelay(
                    this::heartbeatTick, beatMillis, beatMillis, TimeUnit.MILLISECONDS);
        }
        Thread thread = new Thread(this::readLoop, "mcpr-" + name + "-reader");
        thread.setDaemon(true);
        reader = thread;
        thread.start();
        LOGGER.log(Level.INFO, "[{0}] starting", name);
        control.execute(this::attemptOpen);
    }

    /**
     * Writes one message.
     *
     * <p>While the connection is {@code INITIALIZING} or {@code RECONNECTING} the caller waits,
     * bounded by the deadline. A request registered in {@link #correlations()} is stamped with the
     * epoch it was written in.
     *
     * @param message the message
     * @param deadlineNanos absolute {@link System#nanoTime()} deadline for the wait
     * @throws ConnectionClosedException if the connection has been shut down
     * @throws ReconnectExhaustedException if the connection has failed
     * @throws CallTimeoutException if the connection did not become usable before the deadline
     * @throws FrameRejectedException if the transport refuses the message before writing it;
     *     the connection stays as it is
     * @throws TransportException if the write fails; the fault is also reported to the lifecycle
     */
    public void send(Message message, long deadlineNanos) {
        byte[] payload = codec.encode(message);
        while (true) {
            ConnectionState state = stateMachine.getState();
            if (state == ConnectionState.CLOSED) {
                throw new ConnectionClosedException("connection " + name + " is closed");
            }
            if (state == ConnectionState.FAILED) {
                throw failedSend();
            }
            if (state.isTransitional()) {
                ConnectionState settled;
                try {
                    settled = stateMachine.awaitSettled(deadlineNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransportException("interrupted waiting for connection " + name, e);
                }
                if (settled.isTransitional()) {
                    throw new CallTimeoutException(
                            "connection " + name + " still " + settled + " at the call deadline");
                }
                continue;
            }
            synchronized (sendLock) {
                if (!stateMachine.getState().isUsable()) {
                    continue;
                }
                long sendEpoch = epoch.get();
                if (message instanceof Request) {
                    correlations.markSent(message.id(), sendEpoch);
                }
                try {
                    transport.send(payload);
                } catch (FrameRejectedException e) {
                    throw e;
                } catch (TransportException e) {
                    reportFault(sendEpoch, e, false);
                    throw e;
                }
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.log(Level.FINE, "[{0}] -> {1}", new Object[] {name, preview(payload)});
                }
                return;
            }
        }
    }

    /**
     * Shuts the connection down: pending calls fail with {@link ConnectionClosedException}, the
     * transport is closed and the background threads stop. Idempotent; a {@code FAILED}
     * connection stays {@code FAILED} but its threads are stopped.
     */
    public void shutdown() {
        boolean closedNow = stateMachine.transitionTo(ConnectionState.CLOSED, null);
        if (closedNow) {
            int failed =
                    correlations.failAll(
                            new ConnectionClosedException("connection " + name + " closed"));
            if (failed > 0) {
                LOGGER.log(
                        Level.INFO,
                        "[{0}] failed {1} pending call(s) on shutdown",
                        new Object[] {name, failed});
            }
        }
        control.shutdownNow();
        sweeper.shutdownNow();
        transport.close();
        Thread thread = reader;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Blocks while the connection is {@code INITIALIZING} or {@code RECONNECTING}.
     *
     * @param timeout maximum wait
     * @return the state when waiting stopped
     * @throws InterruptedException if interrupted
     */
    public ConnectionState awaitSettled(Duration timeout) throws InterruptedException {
        return stateMachine.awaitSettled(System.nanoTime() + timeout.toNanos());
    }

    /**
     * Returns the connection name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Returns the current lifecycle state.
     *
     * @return the state
     */
    public ConnectionState state() {
        return stateMachine.getState();
    }

    /**
     * Returns the pending calls of this connection.
     *
     * @return the correlation table
     */
    public CorrelationTable correlations() {
        return correlations;
    }

    /**
     * Returns the managed transport.
     *
     * @return the transport
     */
    public Transport transport() {
        return transport;
    }

    /**
     * Returns a health snapshot combining transport counters with lifecycle data.
     *
     * @return the snapshot
     */
    public TransportHealth health() {
        ConnectionState state = stateMachine.getState();
        return transport
                .health()
                .toBuilder()
                .healthy(state == ConnectionState.ACTIVE)
                .pendingCalls(correlations.size())
                .reconnects(reconnects.get())
                .build();
    }

    /**
     * Registers a lifecycle listener.
     *
     * @param listener the listener
     */
    public void addStateListener(ConnectionStateListener listener) {
        stateMachine.addListener(listener);
    }

    /**
     * Sets the receiver of decoded inbound messages.
     *
     * @param handler the handler
     */
    public void setMessageHandler(MessageHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    // ---- control thread ----

    private void attemptOpen() {
        ConnectionState state = stateMachine.getState();
        if (state != ConnectionState.INITIALIZING && state != ConnectionState.RECONNECTING) {
            return;
        }
        int attempt = retry.startAttempt();
        try {
            transport.close();
            transport.open();
        } catch (RuntimeException e) {
            retry.recordFailure(e);
            LOGGER.log(
                    Level.INFO,
                    "[{0}] open attempt {1}/{2} failed: {3}",
                    new Object[] {
                        name, attempt, retry.getMaxAttempts(), ErrorClassifier.describeError(e)
                    });
            if (!reconnectPolicy.shouldRetry(retry)) {
                fail(e);
                return;
            }
            stateMachine.transitionFrom(
                    ConnectionState.INITIALIZING, ConnectionState.RECONNECTING, e);
            scheduleOpen();
            return;
        }
        activate();
    }

    private void scheduleOpen() {
        long delay = reconnectPolicy.calculateDelay(retry);
        retry.recordDelay(delay);
        LOGGER.log(
                Level.INFO,
                "[{0}] reconnect attempt {1} in {2} ms",
                new Object[] {name, retry.getAttemptCount() + 1, delay});
        try {
            control.schedule(this::attemptOpen, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "[{0}] reconnect not scheduled, shutting down", name);
        }
    }

    private void activate() {
        synchronized (sendLock) {
            boolean reconnect = epoch.get() > 0;
            long newEpoch = epoch.incrementAndGet();
            if (reconnect) {
                reconnects.incrementAndGet();
                int reset =
                        correlations.failSentBefore(
                                newEpoch,
                                new ConnectionResetException(
                                        "connection " + name + " was reset", lastFault));
                if (reset > 0) {
                    LOGGER.log(
                            Level.INFO,
                            "[{0}] failed {1} call(s) pending at the fault",
                            new Object[] {name, reset});
                }
            }
            retry.reset();
            if (!stateMachine.transitionTo(ConnectionState.ACTIVE, null)) {
                // shut down while opening
                transport.close();
            }
        }
    }

    private void fail(Throwable cause) {
        ReconnectExhaustedException exhausted =
                new ReconnectExhaustedException(
                        "connection "
                                + name
                                + " failed after "
                                + retry.getAttemptCount()
                                + " open attempt(s)",
                        retry.getAttemptCount(),
                        retry.getLastError());
        failure = exhausted;
        if (!stateMachine.transitionTo(ConnectionState.FAILED, cause)) {
            return;
        }
        correlations.failAll(exhausted);
        transport.close();
        control.shutdown();
    }

    /** Built on the caller's thread from the snapshot taken by {@link #fail}. */
    private ReconnectExhaustedException failedSend() {
        ReconnectExhaustedException snapshot = failure;
        if (snapshot == null) {
            return new ReconnectExhaustedException("connection " + name + " failed", 0, null);
        }
        return new ReconnectExhaustedException(
                snapshot.getMessage(), snapshot.attempts(), snapshot.getCause());
    }

    private void reportFault(long faultEpoch, Throwable cause, boolean confirm) {
        try {
            control.execute(() -> onFault(faultEpoch, cause, confirm));
        } catch (RejectedExecutionException e) {
            LOGGER.log(
                    Level.FINE,
                    "[{0}] fault after shutdown ignored: {1}",
                    new Object[] {name, cause});
        }
    }

    /**
     * Handles a fault seen in {@code faultEpoch}. A missed heartbeat may be a slow peer, so it is
     * confirmed with probes first; a failed read or write means the channel is gone.
     */
    private void onFault(long faultEpoch, Throwable cause, boolean confirm) {
        if (faultEpoch != epoch.get()) {
            return;
        }
        if (!stateMachine.transitionFrom(ConnectionState.ACTIVE, ConnectionState.DEGRADED, cause)) {
            return;
        }
        lastFault = cause;
        int probes = confirm ? heartbeat.confirmationProbes() : 0;
        for (int probe = 1; probe <= probes; probe++) {
            if (stateMachine.getState() != ConnectionState.DEGRADED) {
                return;
            }
            if (transport.probe(heartbeat.deadline())) {
                LOGGER.log(
                        Level.INFO,
                        "[{0}] probe {1} answered, recovering",
                        new Object[] {name, probe});
                stateMachine.transitionFrom(ConnectionState.DEGRADED, ConnectionState.ACTIVE, null);
                return;
            }
        }
        if (!stateMachine.transitionFrom(
                ConnectionState.DEGRADED, ConnectionState.RECONNECTING, cause)) {
            return;
        }
        transport.close();
        retry.reset();
        scheduleOpen();
    }

    private void heartbeatTick() {
        if (stateMachine.getState() != ConnectionState.ACTIVE) {
            return;
        }
        long beatEpoch = epoch.get();
        if (!transport.probe(heartbeat.deadline())) {
            LOGGER.log(
                    Level.WARNING,
                    "[{0}] heartbeat missed (no answer within {1} ms)",
                    new Object[] {name, heartbeat.deadline().toMillis()});
            onFault(beatEpoch, new TransportException("heartbeat missed on " + name), true);
        }
    }

    // ---- sweeper thread ----

    private void sweep() {
        try {
            correlations.expire(System.nanoTime());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[" + name + "] deadline sweep failed", e);
        }
    }

    // ---- reader thread ----

    private void readLoop() {
        while (!stateMachine.getState().isTerminal()) {
            if (!awaitReadable()) {
                return;
            }
            long readEpoch = epoch.get();
            long seenActivations = activations.get();
            byte[] payload;
            try {
                payload = transport.receive();
            } catch (TransportException e) {
                if (stateMachine.getState().isTerminal()) {
                    return;
                }
                LOGGER.log(
                        Level.FINE,
                        "[{0}] receive failed: {1}",
                        new Object[] {name, e.getMessage()});
                reportFault(readEpoch, e, false);
                if (!awaitReactivation(seenActivations)) {
                    return;
                }
                continue;
            }
            deliver(payload);
        }
    }

    private void deliver(byte[] payload) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "[{0}] <- {1}", new Object[] {name, preview(payload)});
        }
        Message message;
        try {
            message = codec.decode(payload);
        } catch (DecodeException e) {
            LOGGER.log(
                    Level.WARNING,
                    "[{0}] dropped undecodable message ({1}): {2}",
                    new Object[] {name, e.kind(), e.getMessage()});
            return;
        }
        try {
            handler.onMessage(this, message);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[" + name + "] message handler failed", e);
        }
    }

    /** Waits until the transport may be read. Returns false once terminal or interrupted. */
    private boolean awaitReadable() {
        synchronized (readerGate) {
            while (true) {
                ConnectionState state = stateMachine.getState();
                if (state.isTerminal()) {
                    return false;
                }
                if (state.isUsable()) {
                    return true;
                }
                try {
                    readerGate.wait(500);
                } catch (InterruptedException e) {
                    return false;
                }
            }
        }
    }

    /** Waits for the next activation after a read fault. Returns false once terminal. */
    private boolean awaitReactivation(long seenActivations) {
        synchronized (readerGate) {
            while (true) {
                ConnectionState state = stateMachine.getState();
                if (state.isTerminal()) {
                    return false;
                }
                // a recovery in place counts as an activation too
                if (activations.get() > seenActivations && state == ConnectionState.ACTIVE) {
                    return true;
                }
                try {
                    readerGate.wait(500);
                } catch (InterruptedException e) {
                    return false;
                }
            }
        }
    }

    private static String preview(byte[] payload) {
        String text = new String(payload, StandardCharsets.UTF_8);
        return text.length() <= LOG_PREVIEW ? text : text.substring(0, LOG_PREVIEW) + "...";
    }

    private static ThreadFactory daemon(String threadName) {
        return runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public String toString() {
        return "ConnectionManager[" + name + ":" + stateMachine.getState() + "]";
    }
}
