/**
 * Endpoint and transport configuration.
 *
 * <p>{@link express.mvp.mcpr.transport.config.TransportConfig} names endpoints, binds capability
 * kinds to them, and carries the reconnect, heartbeat and timeout settings shared by every
 * connection. Validation runs when a router is built, so a missing socket port or pipe command
 * fails at startup.
 */
package express.mvp.mcpr.transport.config;
