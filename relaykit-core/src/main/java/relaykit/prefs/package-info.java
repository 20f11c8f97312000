/**
 * Typed key-value preferences with optional JSON file persistence and change streams.
 *
 * <p>Values are one of the kinds in {@link relaykit.prefs.PrefValue.Kind}; keys are typed
 * through {@link relaykit.prefs.PrefKey}. Changes are published as
 * {@link relaykit.prefs.PreferenceChanged} events on an {@link relaykit.EventRelay}, which is
 * also what {@link relaykit.prefs.PreferenceStore#observe observe} subscribes to.
 *
 * @see relaykit.prefs.DefaultPreferenceStore
 */
package relaykit.prefs;
