/** Immutable wire messages: requests, responses, error responses and notifications. */
package express.mvp.mcpr.transport.message;
