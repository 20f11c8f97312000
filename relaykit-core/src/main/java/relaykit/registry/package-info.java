/**
 * Subscription lookup by exact event class.
 *
 * @see relaykit.registry.SubscriberRegistry
 * @see relaykit.registry.DefaultSubscriberRegistry
 */
package relaykit.registry;
