/**
 * Transport over a TCP socket with typed, length-prefixed frames.
 *
 * <pre>
 * ┌────────────────┬──────────┬─────────────────┐
 * │ length (4, BE) │ type (1) │ body (length-1) │
 * └────────────────┴──────────┴─────────────────┘
 * </pre>
 *
 * <p>Besides data frames the socket carries heartbeat pings and pongs and a one-shot
 * authentication exchange right after connect.
 */
package express.mvp.mcpr.transport.socket;
