/**
 * Spring Boot auto-configuration for relaykit.
 *
 * <p>{@link relaykit.spring.boot.RelaykitAutoConfiguration} exposes an
 * {@link relaykit.EventRelay}, an application-lifetime {@link relaykit.Scope} and a
 * {@link relaykit.prefs.PreferenceStore}; beans annotated with
 * {@link relaykit.spring.boot.RelaySubscriber} are subscribed automatically. Settings live
 * under the {@code relaykit} prefix, see {@link relaykit.spring.boot.RelaykitProperties}.
 */
package relaykit.spring.boot;
