/** JSON-RPC 2.0 encoding of {@link express.mvp.mcpr.transport.message.Message} values. */
package express.mvp.mcpr.transport.codec;
