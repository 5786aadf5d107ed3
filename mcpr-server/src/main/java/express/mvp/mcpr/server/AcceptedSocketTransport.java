package express.mvp.mcpr.server;

import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportCounters;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.TransportHealth;
import express.mvp.mcpr.transport.TransportKind;
import express.mvp.mcpr.transport.error.FrameRejectedException;
import express.mvp.mcpr.transport.framing.FramingException;
import express.mvp.mcpr.transport.socket.FrameType;
import express.mvp.mcpr.transport.socket.SocketFrame;
import express.mvp.mcpr.transport.socket.SocketFrameCodec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Server half of a socket connection, already authenticated by {@link McprServer}.
 *
 * <p>The session thread is the only reader, so {@link #receive()} reads frames directly: PINGs
 * are answered inline and only DATA bodies are returned. A DATA or PING frame consumed during
 * the handshake is handed in as {@code first} and processed before the socket is read.
 */
final class AcceptedSocketTransport implements Transport {

    private static final Logger LOGGER = Logger.getLogger(AcceptedSocketTransport.class.getName());

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final SocketFrameCodec frames;
    private final TransportCounters counters = new TransportCounters();
    private final Object writeLock = new Object();
    private SocketFrame pending;
    private volatile boolean open = true;

    AcceptedSocketTransport(
            Socket socket,
            InputStream in,
            OutputStream out,
            SocketFrameCodec frames,
            SocketFrame first) {
        this.socket = socket;
        this.in = in;
        this.out = out;
        this.frames = frames;
        this.pending = first;
    }

    @Override
    public void open() {
        throw new IllegalStateException("accepted socket is already open");
    }

    @Override
    public void send(byte[] payload) {
        if (!open) {
            throw new TransportException("client socket is closed");
        }
        write(FrameType.DATA, payload);
        counters.recordSent(payload.length);
    }

    private void write(FrameType type, byte[] body) {
        synchronized (writeLock) {
            try {
                frames.write(out, type, body);
            } catch (FramingException e) {
                throw new FrameRejectedException("client frame rejected: " + e.getMessage(), e);
            } catch (IOException e) {
                counters.recordError(e);
                throw new TransportException("client write failed: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public byte[] receive() {
        while (true) {
            SocketFrame frame = nextFrame();
            switch (frame.type()) {
                case DATA -> {
                    counters.recordReceived(frame.body().length);
                    return frame.body();
                }
                case PING -> write(FrameType.PONG, frame.body());
                case PONG -> LOGGER.finest("Unsolicited PONG");
                default -> throw new TransportException(
                        "unexpected " + frame.type() + " frame from client");
            }
        }
    }

    private SocketFrame nextFrame() {
        SocketFrame frame = pending;
        if (frame != null) {
            pending = null;
            return frame;
        }
        try {
            frame = frames.read(in);
        } catch (IOException | FramingException e) {
            open = false;
            counters.recordError(e);
            String reason =
                    socket.isClosed()
                            ? "client socket closed"
                            : "client read failed: " + e.getMessage();
            throw new TransportException(reason, e);
        }
        if (frame == null) {
            open = false;
            throw new TransportException("client disconnected");
        }
        return frame;
    }

    @Override
    public boolean probe(Duration deadline) {
        return open && !socket.isClosed();
    }

    @Override
    public void close() {
        open = false;
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Client socket close failed", e);
        }
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
}
