package express.mvp.mcpr.server;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.mcpr.transport.Transport;
import express.mvp.mcpr.transport.TransportException;
import express.mvp.mcpr.transport.codec.DecodeException;
import express.mvp.mcpr.transport.codec.MessageCodec;
import express.mvp.mcpr.transport.message.ErrorObject;
import express.mvp.mcpr.transport.message.ErrorResponse;
import express.mvp.mcpr.transport.message.Message;
import express.mvp.mcpr.transport.message.Notification;
import express.mvp.mcpr.transport.message.Request;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves one client over one open {@link Transport}.
 *
 * <p>{@link #run()} reads until the transport ends:
 *
 * <ul>
 *   <li>requests go to the {@link MethodTable} and the reply is written back at once;
 *   <li>notifications go to the {@link NotificationListener}, if any;
 *   <li>replies are logged and dropped (the server issues no requests of its own);
 *   <li>an undecodable payload is answered with {@link ErrorObject#PARSE_ERROR} and no id.
 * </ul>
 *
 * <p>Writes, from {@code run()} or from {@link #notify(String, JsonNode)} on other threads, are
 * serialized on the session.
 */
public final class ServerSession implements Runnable, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ServerSession.class.getName());

    private static final int LOG_LIMIT = 200;

    private final String name;
    private final Transport transport;
    private final MethodTable methods;
    private final MessageCodec codec;
    private final NotificationListener listener;
    private final Object sendLock = new Object();
    private volatile boolean closed;

    /**
     * Creates a session over an open transport.
     *
     * @param name session name used in logs
     * @param transport the open transport; the session closes it when done
     * @param methods the method table
     * @param codec the message codec
     * @param listener notification listener, or null to log and drop notifications
     */
    public ServerSession(
            String name,
            Transport transport,
            MethodTable methods,
            MessageCodec codec,
            NotificationListener listener) {
        this.name = Objects.requireNonNull(name, "name");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.methods = Objects.requireNonNull(methods, "methods");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.listener = listener;
    }

    /** Serves requests until the transport ends or the session is closed. */
    @Override
    public void run() {
        LOGGER.log(Level.INFO, "[{0}] session started", name);
        try {
            while (!closed) {
                try {
                    handle(transport.receive());
                } catch (TransportException e) {
                    if (!closed) {
                        LOGGER.log(
                                Level.INFO,
                                "[{0}] session ended: {1}",
                                new Object[] {name, e.getMessage()});
                    }
                    return;
                }
            }
        } finally {
            close();
        }
    }

    private void handle(byte[] payload) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "[{0}] <- {1}", new Object[] {name, preview(payload)});
        }
        Message message;
        try {
            message = codec.decode(payload);
        } catch (DecodeException e) {
            LOGGER.log(
                    Level.WARNING,
                    "[{0}] undecodable message: {1}",
                    new Object[] {name, e.getMessage()});
            send(
                    new ErrorResponse(
                            null,
                            new ErrorObject(
                                    ErrorObject.PARSE_ERROR, "Parse error: " + e.getMessage())));
            return;
        }
        switch (message.kind()) {
            case REQUEST -> send(methods.dispatch((Request) message));
            case NOTIFICATION -> onNotification((Notification) message);
            default -> LOGGER.log(
                    Level.FINE, "[{0}] ignoring reply {1}", new Object[] {name, message});
        }
    }

    private void onNotification(Notification notification) {
        if (listener == null) {
            LOGGER.log(Level.FINE, "[{0}] no listener for {1}", new Object[] {name, notification});
            return;
        }
        try {
            listener.onNotification(this, notification);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "[" + name + "] notification listener failed", e);
        }
    }

    /**
     * Pushes a notification to the client.
     *
     * @param method the notification method
     * @param params the params, or null
     * @throws TransportException if the write fails
     */
    public void notify(String method, JsonNode params) {
        send(new Notification(method, params));
    }

    private void send(Message message) {
        byte[] payload = codec.encode(message);
        synchronized (sendLock) {
            if (closed) {
                throw new TransportException("session " + name + " is closed");
            }
            transport.send(payload);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "[{0}] -> {1}", new Object[] {name, preview(payload)});
        }
    }

    private static String preview(byte[] payload) {
        String text = new String(payload, StandardCharsets.UTF_8);
        return text.length() <= LOG_LIMIT ? text : text.substring(0, LOG_LIMIT) + "...";
    }

    /**
     * Returns the session name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Checks whether the session has ended.
     *
     * @return true once closed
     */
    public boolean isClosed() {
        return closed;
    }

    /** Ends the session and closes its transport. Idempotent. */
    @Override
    public void close() {
        synchronized (sendLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        try {
            transport.close();
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "[" + name + "] transport close failed", e);
        }
    }
}
