/**
 * Server side of the message exchange.
 *
 * <p>{@link express.mvp.mcpr.server.McprServer} accepts clients on a framed socket, on an HTTP
 * event stream, or over its own standard input and output, and runs one {@link
 * express.mvp.mcpr.server.ServerSession} per client. Each session decodes requests with the shared
 * codec and answers them from a {@link express.mvp.mcpr.server.MethodTable}.
 *
 * <h2>Admission</h2>
 *
 * <p>Socket clients present a token in an AUTH frame; event-stream clients send it as a bearer
 * header. Both are checked by the configured {@link express.mvp.mcpr.server.AuthGate}.
 */
package express.mvp.mcpr.server;
