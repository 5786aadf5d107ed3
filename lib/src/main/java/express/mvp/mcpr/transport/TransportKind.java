package express.mvp.mcpr.transport;

/** The substrate a {@link Transport} runs over. */
public enum TransportKind {
    /** Newline-delimited messages on a subordinate process's standard streams. */
    PIPE,
    /** Server-sent event stream inbound, HTTP POST outbound. */
    EVENT_STREAM,
    /** Length-prefixed frames on a TCP socket. */
    SOCKET
}
