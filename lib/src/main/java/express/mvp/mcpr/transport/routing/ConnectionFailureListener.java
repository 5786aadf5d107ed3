package express.mvp.mcpr.transport.routing;

import express.mvp.mcpr.transport.connection.ConnectionManager;

/**
 * Told when a routed connection exhausts its reconnect budget and becomes {@code FAILED}.
 *
 * <p>The owner decides what a failed connection means: tear down the whole session, or carry on
 * with the capabilities whose connections are still up.
 */
@FunctionalInterface
public interface ConnectionFailureListener {

    /**
     * Called once per failed connection, on that connection's control thread.
     *
     * @param connection the failed connection
     * @param cause the last open failure (may be null)
     */
    void onConnectionFailed(ConnectionManager connection, Throwable cause);
}
