package relaykit.args;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable bundle of named, typed arguments handed to a component when it is created.
 *
 * <p>Each entry remembers the {@link ArgKind} it was stored with. A lookup succeeds only
 * when the key's kind matches and the value is an instance of the key's type, so callers
 * never see a {@link ClassCastException}. Array values are copied on the way in and out.
 *
 * <pre>{@code
 * Arguments args = Arguments.builder()
 *     .put(USER_ID, "123")
 *     .put(USER_AGE, 30)
 *     .build();
 * }</pre>
 *
 * @see Argument
 */
public final class Arguments {
  private static final Arguments EMPTY = new Arguments(Collections.emptyMap());

  private final Map<String, Entry> entries;

  private Arguments(Map<String, Entry> entries) {
    this.entries = entries;
  }

  public static Arguments empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the value stored under {@code key}, or empty when the name is absent or was
   * stored with another kind or type.
   */
  public <T> Optional<T> get(ArgKey<T> key) {
    Objects.requireNonNull(key, "key");
    Entry entry = entries.get(key.name());
    if (entry == null || entry.kind != key.kind() || !key.accepts(entry.value)) {
      return Optional.empty();
    }
    return Optional.of(key.cast(copy(entry.kind, entry.value)));
  }

  public boolean containsKey(String name) {
    return entries.containsKey(name);
  }

  public int size() {
    return entries.size();
  }

  private static Object copy(ArgKind kind, Object value) {
    return switch (kind) {
      case BYTE_ARRAY -> ((byte[]) value).clone();
      case CHAR_ARRAY -> ((char[]) value).clone();
      case BOOLEAN_ARRAY -> ((boolean[]) value).clone();
      case INT_ARRAY -> ((int[]) value).clone();
      case LONG_ARRAY -> ((long[]) value).clone();
      case FLOAT_ARRAY -> ((float[]) value).clone();
      case DOUBLE_ARRAY -> ((double[]) value).clone();
      case STRING_LIST -> List.copyOf((List<?>) value);
      case STRING, INT, LONG, FLOAT, DOUBLE, BOOLEAN, SERIALIZABLE -> value;
    };
  }

  private static final class Entry {
    private final ArgKind kind;
    private final Object value;

    private Entry(ArgKind kind, Object value) {
      this.kind = kind;
      this.value = value;
    }
  }

  /** Builder for {@link Arguments}. Later puts under the same name replace earlier ones. */
  public static final class Builder {
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private Builder() {}

    public <T> Builder put(ArgKey<T> key, T value) {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
      if (!key.accepts(value)) {
        throw new IllegalArgumentException("Value for '" + key.name() + "' is not a " + key.type().getName());
      }
      if (key.kind() == ArgKind.STRING_LIST) {
        for (Object element : (List<?>) value) {
          if (!(element instanceof String)) {
            throw new IllegalArgumentException("Value for '" + key.name() + "' must contain only strings");
          }
        }
      }
      entries.put(key.name(), new Entry(key.kind(), copy(key.kind(), value)));
      return this;
    }

    public Arguments build() {
      if (entries.isEmpty()) {
        return EMPTY;
      }
      return new Arguments(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }
  }
}
