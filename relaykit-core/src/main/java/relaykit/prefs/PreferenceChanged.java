package relaykit.prefs;

import java.util.Objects;

/**
 * Event published on the store's relay whenever one entry changes.
 *
 * @param name the preference name
 * @param previous the value before the change, {@code null} if the entry was absent
 * @param current the value after the change, {@code null} if the entry was removed
 */
public record PreferenceChanged(String name, PrefValue previous, PrefValue current) {
  public PreferenceChanged {
    Objects.requireNonNull(name, "name");
  }

  public boolean removed() {
    return current == null;
  }
}
