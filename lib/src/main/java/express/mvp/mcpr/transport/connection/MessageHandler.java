package express.mvp.mcpr.transport.connection;

import express.mvp.mcpr.transport.message.Message;

/**
 * Receives every decoded inbound message of a connection, on its reader thread.
 *
 * <p>Implementations must not block for long: the next message is not read until this returns.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles one inbound message.
     *
     * @param connection the connection it arrived on
     * @param message the decoded message
     */
    void onMessage(ConnectionManager connection, Message message);
}
