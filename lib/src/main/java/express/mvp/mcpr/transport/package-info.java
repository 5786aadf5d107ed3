/**
 * Transport-agnostic JSON-RPC message exchange.
 *
 * <p>The layers, bottom up:
 *
 * <ul>
 *   <li>{@link express.mvp.mcpr.transport.Transport} - moves opaque payloads over one substrate
 *       (subprocess pipe, HTTP event stream, or TCP socket)
 *   <li>{@link express.mvp.mcpr.transport.connection.ConnectionManager} - owns one transport and
 *       drives its lifecycle, heartbeat, and reconnects
 *   <li>{@link express.mvp.mcpr.transport.routing.TransportRouter} - maps capability kinds to
 *       connections
 *   <li>{@link express.mvp.mcpr.transport.dispatch.MessageDispatcher} - correlates requests with
 *       replies and hands everything else to an inbound sink
 * </ul>
 *
 * <h2>Quick Start</h2>
 *
 * <pre>{@code
 * TransportConfig config = TransportConfig.builder()
 *     .endpoint("tools", EndpointConfig.socket("localhost", 7070).build())
 *     .endpoint("local", EndpointConfig.pipe("./resource-server").build())
 *     .bind(CapabilityKind.TOOL, "tools")
 *     .bind(CapabilityKind.DEFAULT, "local")
 *     .build();
 *
 * try (TransportRouter router = new TransportRouter(config)) {
 *     MessageDispatcher dispatcher = new MessageDispatcher(router);
 *     JsonNode sum = dispatcher.call(CapabilityKind.TOOL, "add",
 *         Map.of("a", 2, "b", 3), Duration.ofSeconds(5));
 * }
 * }</pre>
 */
package express.mvp.mcpr.transport;
