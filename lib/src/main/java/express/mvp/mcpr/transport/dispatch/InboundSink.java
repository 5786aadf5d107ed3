package express.mvp.mcpr.transport.dispatch;

import express.mvp.mcpr.transport.message.Message;

/**
 * Receives inbound messages the dispatcher could not match to a pending call.
 *
 * <p>That covers every notification, every request initiated by the peer, and late or stray
 * replies. The dispatcher does not interpret method names; this sink does.
 */
@FunctionalInterface
public interface InboundSink {

    /**
     * Handles one unmatched message. Runs on the connection's reader thread.
     *
     * @param connection name of the connection the message arrived on
     * @param message the message
     */
    void onInbound(String connection, Message message);
}
