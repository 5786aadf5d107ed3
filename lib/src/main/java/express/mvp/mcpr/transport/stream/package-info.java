/**
 * Transport over HTTP: inbound messages on a Server-Sent Events stream, outbound messages as
 * POST requests to the endpoint the stream announces.
 */
package express.mvp.mcpr.transport.stream;
