package relaykit.prefs;

import relaykit.EventHandler;
import relaykit.Scope;
import relaykit.Subscription;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed key-value preferences.
 *
 * <p>Every mutating call is applied atomically: readers see either the whole change or
 * none of it. Reads through a key whose kind differs from the stored entry behave as if
 * the entry were absent.
 *
 * @see DefaultPreferenceStore
 * @see PrefKey
 */
public interface PreferenceStore {

  <T> void put(PrefKey<T> key, T value);

  /**
   * Stores several entries in one atomic update.
   *
   * @param values entries by name
   */
  void putAll(Map<String, PrefValue> values);

  /**
   * Returns the stored value for {@code key}, or {@code defaultValue} when it is absent or
   * stored with another kind.
   */
  <T> T get(PrefKey<T> key, T defaultValue);

  <T> Optional<T> find(PrefKey<T> key);

  /**
   * Removes the entry named {@code name}, whatever its kind.
   *
   * @return {@code true} if an entry was removed
   */
  boolean remove(String name);

  void removeAll(Collection<String> names);

  void clear();

  boolean contains(String name);

  Set<String> keys();

  /**
   * Returns an immutable copy of all entries.
   */
  Map<String, PrefValue> snapshot();

  /**
   * Streams the value of {@code key} to {@code handler}: the current value first, then the
   * value after every change that affects it. Removal emits {@code defaultValue}.
   * Consecutive equal values are emitted once.
   *
   * @param scope lifetime and executor of the observation
   * @param key the observed key
   * @param defaultValue emitted while the entry is absent or of another kind
   * @param handler receives the values serially
   * @return the underlying subscription
   */
  <T> Subscription<PreferenceChanged> observe(Scope scope, PrefKey<T> key, T defaultValue,
      EventHandler<? super T> handler);
}
