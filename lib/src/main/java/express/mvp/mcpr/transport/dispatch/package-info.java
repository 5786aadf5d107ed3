/**
 * Calls, notifications and inbound delivery.
 *
 * @see express.mvp.mcpr.transport.dispatch.MessageDispatcher
 */
package express.mvp.mcpr.transport.dispatch;
