package express.mvp.mcpr.transport.socket;

import express.mvp.mcpr.transport.InboundQueue;
import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportCounters;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.TransportHealth;
import express.mvp.mcpr.transport.TransportKind;
import express.mvp.mcpr.transport.config.AuthTokenProvider;
import express.mvp.mcpr.transport.config.EndpointConfig;
import express.mvp.mcpr.transport.error.AuthRejectedException;
import express.mvp.mcpr.transport.error.FrameRejectedException;
import express.mvp.mcpr.transport.framing.FramingException;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bidirectional transport over a TCP socket with typed, length-prefixed frames.
 *
 * <p>After connecting, a pump thread owns the socket's input: {@link FrameType#DATA} frames are
 * queued for {@link #receive()}, {@link FrameType#PING} frames are answered with a
 * {@link FrameType#PONG} at once, and PONG frames complete a waiting {@link #probe(Duration)}.
 * Probing therefore works while another thread is blocked in {@code receive()}.
 *
 * <h2>Authentication</h2>
 *
 * <p>When an {@link AuthTokenProvider} yields a token, an {@link FrameType#AUTH} frame carrying it
 * is the first frame after connect, and {@link #open()} waits (bounded by the connect timeout)
 * for {@link FrameType#AUTH_OK}. {@link FrameType#AUTH_REJECTED} fails the open with
 * {@link AuthRejectedException}.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Writes (DATA, PING and PONG) are serialized on an internal lock so a PONG can never split a
 * DATA frame.
 *
 * @see SocketFrameCodec
 */
public final class SocketTransport implements Transport {

    private static final Logger LOGGER = Logger.getLogger(SocketTransport.class.getName());

    private final EndpointConfig endpoint;
    private final AuthTokenProvider tokenProvider;
    private final SocketFrameCodec frames;
    private final TransportCounters counters = new TransportCounters();

    private final Object writeLock = new Object();
    private final Object pongMonitor = new Object();
    private final AtomicLong pingSequence = new AtomicLong();
    private long lastPong = -1;

    private volatile Socket socket;
    private volatile InputStream in;
    private volatile OutputStream out;
    private volatile InboundQueue inbound = new InboundQueue();
    private volatile Thread pump;
    private volatile boolean open;

    /**
     * Creates a socket transport.
     *
     * @param endpoint a {@code SOCKET} endpoint
     * @param tokenProvider credential source, or null
     */
    public SocketTransport(EndpointConfig endpoint, AuthTokenProvider tokenProvider) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.tokenProvider = tokenProvider;
        this.frames = new SocketFrameCodec(endpoint.maxFrameSize());
    }

    @Override
    public synchronized void open() {
        if (open) {
            throw new IllegalStateException("socket transport already open");
        }
        Socket s = new Socket();
        try {
            s.connect(
                    new InetSocketAddress(endpoint.host(), endpoint.port()),
                    (int) endpoint.connectTimeout().toMillis());
            s.setTcpNoDelay(true);
            InputStream sin = new BufferedInputStream(s.getInputStream());
            OutputStream sout = new BufferedOutputStream(s.getOutputStream());
            authenticate(s, sin, sout);
            socket = s;
            in = sin;
            out = sout;
        } catch (IOException e) {
            closeSocket(s);
            counters.recordError(e);
            throw new TransportException(
                    "connect to " + endpoint.describe() + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            closeSocket(s);
            counters.recordError(e);
            throw e;
        }

        InboundQueue queue = new InboundQueue();
        inbound = queue;
        open = true;
        counters.clearError();
        InputStream source = in;
        Thread thread =
                new Thread(() -> pumpLoop(s, source, queue), "mcpr-socket-" + endpoint.port());
        thread.setDaemon(true);
        pump = thread;
        thread.start();
        LOGGER.log(Level.INFO, "Connected {0}", endpoint.describe());
    }

    private void authenticate(Socket s, InputStream sin, OutputStream sout) throws IOException {
        Optional<String> token =
                tokenProvider != null ? tokenProvider.currentToken() : Optional.empty();
        if (token.isEmpty()) {
            return;
        }
        frames.write(sout, FrameType.AUTH, token.get().getBytes(StandardCharsets.UTF_8));
        s.setSoTimeout((int) endpoint.connectTimeout().toMillis());
        SocketFrame answer;
        try {
            answer = frames.read(sin);
        } catch (SocketTimeoutException e) {
            throw new TransportException("no authentication answer from " + endpoint.describe(), e);
        }
        s.setSoTimeout(0);
        if (answer == null) {
            throw new AuthRejectedException("peer closed the connection during authentication");
        }
        if (answer.type() == FrameType.AUTH_REJECTED) {
            throw new AuthRejectedException(
                    "authentication rejected: " + new String(answer.body(), StandardCharsets.UTF_8));
        }
        if (answer.type() != FrameType.AUTH_OK) {
            throw new FramingException("expected AUTH_OK, got " + answer.type());
        }
    }

    private void pumpLoop(Socket s, InputStream sin, InboundQueue queue) {
        try {
            while (true) {
                SocketFrame frame = frames.read(sin);
                if (frame == null) {
                    queue.fail(new TransportException("socket closed by peer"));
                    return;
                }
                switch (frame.type()) {
                    case DATA -> {
                        counters.recordReceived(frame.body().length);
                        queue.offer(frame.body());
                    }
                    case PING -> writeFrame(FrameType.PONG, frame.body());
                    case PONG -> onPong(frame.body());
                    default -> LOGGER.log(
                            Level.WARNING, "Ignoring unexpected {0} frame", frame.type());
                }
            }
        } catch (IOException | FramingException e) {
            counters.recordError(e);
            queue.fail(
                    new TransportException(
                            s.isClosed()
                                    ? "socket transport closed"
                                    : "socket read failed: " + e.getMessage(),
                            e));
        } catch (TransportException e) {
            counters.recordError(e);
            queue.fail(e);
        } finally {
            if (inbound == queue) {
                open = false;
            }
        }
    }

    private void onPong(byte[] body) {
        if (body.length != Long.BYTES) {
            return;
        }
        long sequence = ByteBuffer.wrap(body).getLong();
        synchronized (pongMonitor) {
            if (sequence > lastPong) {
                lastPong = sequence;
            }
            pongMonitor.notifyAll();
        }
    }

    @Override
    public void send(byte[] payload) {
        if (!open) {
            throw new TransportException("socket transport is not open");
        }
        writeFrame(FrameType.DATA, payload);
        counters.recordSent(payload.length);
    }

    private void writeFrame(FrameType type, byte[] body) {
        OutputStream target = out;
        if (target == null) {
            throw new TransportException("socket transport is not open");
        }
        synchronized (writeLock) {
            try {
                frames.write(target, type, body);
            } catch (IOException e) {
                counters.recordError(e);
                throw new TransportException("socket write failed: " + e.getMessage(), e);
            } catch (FramingException e) {
                counters.recordError(e);
                throw new FrameRejectedException("socket frame rejected: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public byte[] receive() {
        return inbound.take();
    }

    @Override
    public boolean probe(Duration deadline) {
        if (!open) {
            return false;
        }
        long sequence = pingSequence.incrementAndGet();
        try {
            writeFrame(FrameType.PING, ByteBuffer.allocate(Long.BYTES).putLong(sequence).array());
        } catch (TransportException e) {
            LOGGER.log(Level.FINE, "PING write failed", e);
            return false;
        }
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        synchronized (pongMonitor) {
            while (lastPong < sequence) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0 || !open) {
                    return false;
                }
                try {
                    pongMonitor.wait(Math.max(1, remaining / 1_000_000L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    @Override
    public synchronized void close() {
        Socket s = socket;
        if (s == null) {
            return;
        }
        open = false;
        closeSocket(s);
        inbound.fail(new TransportException("socket transport closed"));
        Thread thread = pump;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        synchronized (pongMonitor) {
            pongMonitor.notifyAll();
        }
        socket = null;
        in = null;
        out = null;
        pump = null;
        LOGGER.log(Level.FINE, "Closed {0}", endpoint.describe());
    }

    @Override
    public TransportKind kind() {
        return TransportKind.SOCKET;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public TransportHealth health() {
        return counters.snapshot(open);
    }

    private static void closeSocket(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Socket close failed", e);
        }
    }
}
