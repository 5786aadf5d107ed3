/** Capability-kind routing onto shared connections. */
package express.mvp.mcpr.transport.routing;
