package express.mvp.mcpr.server;

import express.mvp.mcpr.transport.message.Notification;

/** Receives notifications clients send to a session. Called on the session thread. */
@FunctionalInterface
public interface NotificationListener {

    /**
     * Handles one notification.
     *
     * @param session the session that read it
     * @param notification the notification
     */
    void onNotification(ServerSession session, Notification notification);
}
