package relaykit.registry;

import relaykit.dispatch.SubscriberMailbox;

import java.util.List;

/**
 * Registry for looking up active subscriptions by exact event class.
 *
 * <p>The relay consults this registry on every publish. Lookups match the runtime class
 * of the event exactly: a subscription to {@code BaseEvent} does not receive a
 * {@code TabEvent} even if {@code TabEvent extends BaseEvent}.
 *
 * @see DefaultSubscriberRegistry
 */
public interface SubscriberRegistry {

  void add(SubscriberMailbox<?> subscriber);

  /**
   * Removes a subscription.
   *
   * @param subscriber the subscription to remove
   * @return {@code true} if it was registered
   */
  boolean remove(SubscriberMailbox<?> subscriber);

  /**
   * Returns all subscriptions registered for exactly the given event class.
   *
   * @param eventType the runtime class of a published event
   * @return immutable snapshot of matching subscriptions, may be empty
   */
  List<SubscriberMailbox<?>> subscribersFor(Class<?> eventType);

  /**
   * Removes every subscription and returns what was registered.
   *
   * @return immutable snapshot of the removed subscriptions
   */
  List<SubscriberMailbox<?>> clear();

  /**
   * Returns the number of registered subscriptions across all event classes.
   */
  int size();
}
