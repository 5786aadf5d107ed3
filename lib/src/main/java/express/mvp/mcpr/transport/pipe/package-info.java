/**
 * Transport over the standard streams of a subordinate process, one JSON message per line.
 *
 * <p>The process's stderr is drained into the log. Process exit is a transport fault.
 */
package express.mvp.mcpr.transport.pipe;
