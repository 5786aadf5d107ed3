/**
 * Message boundaries on byte streams: newline-delimited for pipes, length-prefixed for sockets,
 * and Server-Sent Events for event streams.
 */
package express.mvp.mcpr.transport.framing;
