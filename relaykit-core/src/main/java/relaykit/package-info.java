/**
 * Root API for relaykit: an in-process event relay with sticky delivery, plus typed
 * preference and argument helpers built on top of it.
 *
 * <h2>Core Design</h2>
 * <p>{@link relaykit.EventRelay} routes each published event to the subscriptions registered
 * for its exact runtime class. Every subscription owns a bounded
 * {@linkplain relaykit.dispatch.SubscriberMailbox mailbox} drained serially on the executor of
 * its {@link relaykit.Scope}, so publishers never run handler code and a slow handler only
 * backs up its own mailbox. Sticky events are kept per class in a
 * {@linkplain relaykit.sticky.StickyEventCache cache} and replayed to
 * {@linkplain relaykit.EventRelay#subscribeSticky sticky subscribers}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>relaykit-core</b>: relay, scopes, registry, sticky cache, preferences, arguments</li>
 *   <li><b>relaykit-micrometer</b>: {@linkplain relaykit.spi.MetricsExporter metrics} bridge</li>
 *   <li><b>relaykit-spring-boot-starter</b>: auto-configuration and annotated subscribers</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (EventRelay relay = EventRelay.builder().workerCount(2).build()) {
 *   Scope session = relay.newScope("session");
 *
 *   relay.publishSticky(new LoginEvent(1));
 *
 *   // late subscriber still sees LoginEvent(1)
 *   relay.subscribeSticky(session, LoginEvent.class, event ->
 *       System.out.println("Logged in: " + event.userId()));
 *
 *   relay.subscribe(session, TabEvent.class, event ->
 *       System.out.println("Tab: " + event.position()));
 *   relay.publish(new TabEvent(0));
 *
 *   session.cancel(); // both subscriptions end
 * }
 * }</pre>
 *
 * @see relaykit.EventRelay
 * @see relaykit.Scope
 * @see relaykit.EventHandler
 * @see relaykit.Subscription
 */
package relaykit;
