package relaykit.prefs;

import relaykit.EventHandler;
import relaykit.EventRelay;
import relaykit.Scope;
import relaykit.Subscription;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PreferenceStore} holding entries in memory, optionally persisted to a
 * {@link PreferenceFile} and announcing changes as {@link PreferenceChanged} events on an
 * {@link EventRelay}.
 *
 * <p>Reads are lock-free against an immutable snapshot. Writes are serialized; each one
 * builds the next snapshot, persists it (when a file is configured) and only then makes it
 * visible, so a failed write leaves the store unchanged and surfaces as
 * {@link PreferenceStoreException}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultPreferenceStore prefs = DefaultPreferenceStore.builder()
 *     .file(Path.of("app_preferences.json"))
 *     .relay(relay)
 *     .build();
 *
 * prefs.observe(scope, DARK_MODE, false, enabled -> theme.apply(enabled));
 * prefs.put(DARK_MODE, true);
 * }</pre>
 */
public final class DefaultPreferenceStore implements PreferenceStore {
  private static final Logger logger = Logger.getLogger(DefaultPreferenceStore.class.getName());

  private final PreferenceFile file;
  private final EventRelay relay;
  private final Object writeLock = new Object();
  private volatile Map<String, PrefValue> values;

  private DefaultPreferenceStore(Builder builder) {
    this.file = builder.file;
    this.relay = builder.relay;
    this.values = file != null
        ? Collections.unmodifiableMap(new LinkedHashMap<>(file.load()))
        : Collections.emptyMap();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public <T> void put(PrefKey<T> key, T value) {
    Objects.requireNonNull(key, "key");
    PrefValue wrapped = key.wrap(value);
    mutate(next -> next.put(key.name(), wrapped));
  }

  @Override
  public void putAll(Map<String, PrefValue> entries) {
    Objects.requireNonNull(entries, "entries");
    Map<String, PrefValue> copy = new LinkedHashMap<>(entries);
    copy.forEach((name, value) -> {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
    });
    mutate(next -> next.putAll(copy));
  }

  @Override
  public <T> T get(PrefKey<T> key, T defaultValue) {
    return find(key).orElse(defaultValue);
  }

  @Override
  public <T> Optional<T> find(PrefKey<T> key) {
    Objects.requireNonNull(key, "key");
    return key.unwrap(values.get(key.name()));
  }

  @Override
  public boolean remove(String name) {
    Objects.requireNonNull(name, "name");
    return mutate(next -> next.remove(name));
  }

  @Override
  public void removeAll(Collection<String> names) {
    Objects.requireNonNull(names, "names");
    List<String> copy = List.copyOf(names);
    mutate(next -> copy.forEach(next::remove));
  }

  @Override
  public void clear() {
    mutate(Map::clear);
  }

  @Override
  public boolean contains(String name) {
    return values.containsKey(name);
  }

  @Override
  public Set<String> keys() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(values.keySet()));
  }

  @Override
  public Map<String, PrefValue> snapshot() {
    return values;
  }

  @Override
  public <T> Subscription<PreferenceChanged> observe(Scope scope, PrefKey<T> key, T defaultValue,
      EventHandler<? super T> handler) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(handler, "handler");
    if (relay == null) {
      throw new IllegalStateException("observe requires a store built with an EventRelay");
    }
    Observer<T> observer = new Observer<>(key, defaultValue, handler);
    Subscription<PreferenceChanged> subscription = relay.subscribe(scope, PreferenceChanged.class, observer);
    scope.executor().execute(() -> {
      if (!subscription.isActive()) {
        return;
      }
      try {
        observer.emitLatest();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Preference observer failed for " + key, e);
      }
    });
    return subscription;
  }

  private boolean mutate(Consumer<Map<String, PrefValue>> change) {
    Map<String, PrefValue> previous;
    Map<String, PrefValue> next;
    synchronized (writeLock) {
      previous = values;
      Map<String, PrefValue> working = new LinkedHashMap<>(previous);
      change.accept(working);
      if (working.equals(previous)) {
        return false;
      }
      if (file != null) {
        file.write(working);
      }
      next = Collections.unmodifiableMap(working);
      values = next;
    }
    announce(previous, next);
    return true;
  }

  private void announce(Map<String, PrefValue> previous, Map<String, PrefValue> next) {
    if (relay == null) {
      return;
    }
    Set<String> names = new LinkedHashSet<>(previous.keySet());
    names.addAll(next.keySet());
    List<PreferenceChanged> changes = new ArrayList<>();
    for (String name : names) {
      PrefValue before = previous.get(name);
      PrefValue after = next.get(name);
      if (!Objects.equals(before, after)) {
        changes.add(new PreferenceChanged(name, before, after));
      }
    }
    try {
      changes.forEach(relay::publish);
    } catch (IllegalStateException e) {
      logger.log(Level.FINE, "Relay closed; preference change notification skipped", e);
    }
  }

  private final class Observer<T> implements EventHandler<PreferenceChanged> {
    private final PrefKey<T> key;
    private final T defaultValue;
    private final EventHandler<? super T> handler;
    private boolean emitted;
    private T last;

    private Observer(PrefKey<T> key, T defaultValue, EventHandler<? super T> handler) {
      this.key = key;
      this.defaultValue = defaultValue;
      this.handler = handler;
    }

    @Override
    public void onEvent(PreferenceChanged event) throws Exception {
      if (event.name().equals(key.name())) {
        emitLatest();
      }
    }

    // runs from both the initial task and the mailbox, which may be on different threads
    synchronized void emitLatest() throws Exception {
      T value = get(key, defaultValue);
      if (emitted && Objects.equals(value, last)) {
        return;
      }
      emitted = true;
      last = value;
      handler.onEvent(value);
    }
  }

  /** Builder for {@link DefaultPreferenceStore}. */
  public static final class Builder {
    private PreferenceFile file;
    private EventRelay relay;

    private Builder() {}

    /**
     * Persists entries to the given file, loading it on build.
     *
     * <p>Optional. Without a file the store is memory-only.
     *
     * @param file the backing file
     * @return this builder
     */
    public Builder file(PreferenceFile file) {
      this.file = file;
      return this;
    }

    public Builder file(Path path) {
      return file(new PreferenceFile(path));
    }

    /**
     * Sets the relay used for {@link PreferenceChanged} notifications and
     * {@link DefaultPreferenceStore#observe observation}.
     *
     * <p>Optional. Without a relay, {@code observe} throws {@link IllegalStateException}.
     *
     * @param relay the event relay
     * @return this builder
     */
    public Builder relay(EventRelay relay) {
      this.relay = relay;
      return this;
    }

    public DefaultPreferenceStore build() {
      return new DefaultPreferenceStore(this);
    }
  }
}
