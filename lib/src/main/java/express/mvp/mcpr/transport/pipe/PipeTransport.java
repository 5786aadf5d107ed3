package express.mvp.mcpr.transport.pipe;

import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportCounters;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.TransportHealth;
import express.mvp.mcpr.transport.TransportKind;
import express.mvp.mcpr.transport.config.EndpointConfig;
import express.mvp.mcpr.transport.error.FrameRejectedException;
import express.mvp.mcpr.transport.framing.FramingException;
import express.mvp.mcpr.transport.framing.FramingHandler;
import express.mvp.mcpr.transport.framing.LineFramingHandler;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport over the standard streams of a subordinate process.
 *
 * <p>Each message is one line of encoded text: written to the process's standard input, read
 * from its standard output. Standard error is drained by a daemon thread and logged, so a chatty
 * peer never blocks on a full stderr pipe.
 *
 * <h2>Modes</h2>
 *
 * <ul>
 *   <li><b>Spawn</b> ({@link #PipeTransport(EndpointConfig)}): every {@link #open()} starts a
 *       fresh process from the endpoint's command line; {@link #close()} closes its stdin, waits
 *       for the grace timeout and then kills it.
 *   <li><b>Attach</b> ({@link #PipeTransport(InputStream, OutputStream)}): runs over streams
 *       supplied by the caller, for example {@code System.in}/{@code System.out} on the server
 *       side. Attached streams can be opened once.
 * </ul>
 *
 * <h2>Liveness</h2>
 *
 * <p>{@link #probe(Duration)} reports whether the process is still running. A process that exits
 * makes the pending {@link #receive()} fail with a {@link TransportException} naming the exit
 * code.
 */
public final class PipeTransport implements Transport {

    private static final Logger LOGGER = Logger.getLogger(PipeTransport.class.getName());

    private final EndpointConfig endpoint;
    private final FramingHandler framing;
    private final TransportCounters counters = new TransportCounters();

    private InputStream attachedIn;
    private OutputStream attachedOut;

    private volatile Process process;
    private volatile InputStream in;
    private volatile OutputStream out;
    private volatile boolean open;
    private volatile boolean closing;
    private volatile Thread stderrDrain;

    /**
     * Creates a spawning pipe transport.
     *
     * @param endpoint a {@code PIPE} endpoint
     */
    public PipeTransport(EndpointConfig endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.framing = new LineFramingHandler(endpoint.maxFrameSize());
    }

    /**
     * Creates a pipe transport over existing streams.
     *
     * @param in stream carrying inbound lines
     * @param out stream receiving outbound lines
     */
    public PipeTransport(InputStream in, OutputStream out) {
        this.endpoint = null;
        this.framing = new LineFramingHandler();
        this.attachedIn = Objects.requireNonNull(in, "in");
        this.attachedOut = Objects.requireNonNull(out, "out");
    }

    @Override
    public synchronized void open() {
        if (open) {
            throw new IllegalStateException("pipe transport already open");
        }
        closing = false;
        if (endpoint == null) {
            if (attachedIn == null) {
                throw new TransportException("attached pipe streams cannot be re-opened");
            }
            in = new BufferedInputStream(attachedIn);
            out = new BufferedOutputStream(attachedOut);
            attachedIn = null;
            attachedOut = null;
            open = true;
            counters.clearError();
            LOGGER.fine("Pipe transport attached to caller streams");
            return;
        }

        ProcessBuilder builder = new ProcessBuilder(endpoint.command());
        if (endpoint.workingDirectory() != null) {
            builder.directory(endpoint.workingDirectory().toFile());
        }
        builder.environment().putAll(endpoint.environment());
        Process started;
        try {
            started = builder.start();
        } catch (IOException e) {
            counters.recordError(e);
            throw new TransportException("Cannot run program " + endpoint.command().get(0), e);
        }
        process = started;
        in = new BufferedInputStream(started.getInputStream());
        out = new BufferedOutputStream(started.getOutputStream());
        stderrDrain = startStderrDrain(started);
        open = true;
        counters.clearError();
        LOGGER.log(
                Level.INFO,
                "Started {0} (pid {1})",
                new Object[] {endpoint.describe(), started.pid()});
    }

    @Override
    public void send(byte[] payload) {
        OutputStream target = out;
        if (!open || target == null) {
            throw new TransportException("pipe transport is not open");
        }
        try {
            framing.writeFrame(target, payload);
            target.flush();
            counters.recordSent(payload.length);
        } catch (IOException e) {
            counters.recordError(e);
            throw new TransportException("pipe write failed: " + e.getMessage(), e);
        } catch (FramingException e) {
            counters.recordError(e);
            throw new FrameRejectedException("pipe frame rejected: " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] receive() {
        InputStream source = in;
        if (!open || source == null) {
            throw new TransportException("pipe transport is not open");
        }
        byte[] frame;
        try {
            frame = framing.readFrame(source);
        } catch (FramingException e) {
            counters.recordError(e);
            throw new TransportException("invalid inbound frame: " + e.getMessage(), e);
        } catch (IOException e) {
            open = false;
            counters.recordError(e);
            throw new TransportException(
                    closing ? "pipe transport closed" : "pipe read failed: " + e.getMessage(), e);
        }
        if (frame == null) {
            open = false;
            TransportException eof = new TransportException(endOfStreamMessage());
            counters.recordError(eof);
            throw eof;
        }
        counters.recordReceived(frame.length);
        return frame;
    }

    private String endOfStreamMessage() {
        if (closing) {
            return "pipe transport closed";
        }
        Process current = process;
        if (current == null) {
            return "pipe stream ended";
        }
        try {
            if (current.waitFor(200, TimeUnit.MILLISECONDS)) {
                return "subordinate process exited with code " + current.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return "subordinate process closed its output";
    }

    @Override
    public boolean probe(Duration deadline) {
        Process current = process;
        if (current != null) {
            return open && current.isAlive();
        }
        return open;
    }

    @Override
    public synchronized void close() {
        if (in == null && out == null) {
            return;
        }
        closing = true;
        open = false;
        closeQuietly(out, "stdin");
        Process current = process;
        if (current != null) {
            long graceMillis = endpoint.closeGrace().toMillis();
            try {
                if (!current.waitFor(graceMillis, TimeUnit.MILLISECONDS)) {
                    LOGGER.log(
                            Level.INFO,
                            "Process {0} still running after {1} ms, killing it",
                            new Object[] {current.pid(), graceMillis});
                    current.destroyForcibly();
                    current.waitFor(graceMillis + 1000, TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                current.destroyForcibly();
                Thread.currentThread().interrupt();
            }
        }
        closeQuietly(in, "stdout");
        Thread drain = stderrDrain;
        if (drain != null) {
            drain.interrupt();
        }
        process = null;
        in = null;
        out = null;
        stderrDrain = null;
        LOGGER.fine("Pipe transport closed");
    }

    @Override
    public TransportKind kind() {
        return TransportKind.PIPE;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public TransportHealth health() {
        return counters.snapshot(open);
    }

    /**
     * Returns the process id of the running subordinate.
     *
     * @return the pid, or -1 when attached or not running
     */
    public long pid() {
        Process current = process;
        return current != null ? current.pid() : -1;
    }

    private Thread startStderrDrain(Process started) {
        String name = "mcpr-pipe-stderr-" + started.pid();
        Thread thread =
                new Thread(
                        () -> {
                            try (BufferedReader reader =
                                    new BufferedReader(
                                            new InputStreamReader(
                                                    started.getErrorStream(),
                                                    StandardCharsets.UTF_8))) {
                                String line;
                                while ((line = reader.readLine()) != null) {
                                    logStderr(started.pid(), line);
                                }
                            } catch (IOException e) {
                                LOGGER.log(Level.FINE, "stderr drain ended", e);
                            }
                        },
                        name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void logStderr(long pid, String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        Level level =
                lower.contains("error") || lower.contains("exception") || lower.contains("panic")
                        ? Level.WARNING
                        : Level.INFO;
        LOGGER.log(level, "[pid {0} stderr] {1}", new Object[] {pid, line});
    }

    private static void closeQuietly(AutoCloseable closeable, String what) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            LOGGER.log(Level.FINE, "Closing pipe " + what + " failed", e);
        }
    }
}
