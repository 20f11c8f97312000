/**
 * Per-subscription delivery: bounded mailboxes, the interceptor pipeline around handler
 * invocation, and failure isolation.
 *
 * @see relaykit.dispatch.SubscriberMailbox
 * @see relaykit.dispatch.DeliveryInterceptor
 */
package relaykit.dispatch;
