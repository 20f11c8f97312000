package relaykit;

/**
 * Handler that reacts to events of one exact runtime type.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run on the executor of the {@link Scope} they were subscribed with, never on
 * the publishing thread. Invocations for a single subscription are serial and follow the
 * publish order; different subscriptions run independently of each other.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown by a handler is logged and counted. It does not cancel the
 * subscription, does not reach the publisher and does not affect other subscribers.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * relay.subscribe(scope, LoginEvent.class, event ->
 *     session.start(event.userId()));
 * }</pre>
 *
 * @param <T> the event type
 * @see EventRelay#subscribe(Scope, Class, EventHandler)
 */
@FunctionalInterface
public interface EventHandler<T> {

  /**
   * Processes one event.
   *
   * @param event the published event, never {@code null}
   * @throws Exception if processing fails; the failure is isolated to this subscription
   */
  void onEvent(T event) throws Exception;
}
