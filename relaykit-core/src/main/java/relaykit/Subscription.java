package relaykit;

/**
 * Handle for one registered {@code (eventType, handler)} pair.
 *
 * <p>A subscription ends when its {@linkplain #scope() scope} is cancelled, when
 * {@link #cancel()} is called, or when the relay is closed. Ended subscriptions never
 * become active again.
 *
 * @param <T> the event type
 */
public interface Subscription<T> {

  /**
   * Returns the unique, time-ordered (ULID) identifier of this subscription.
   *
   * @return the subscription id
   */
  String id();

  Class<T> eventType();

  Scope scope();

  boolean isActive();

  /**
   * Ends this subscription. Events still queued for it are discarded. Idempotent.
   */
  void cancel();
}
