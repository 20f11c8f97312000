package relaykit.prefs;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Typed preference key: a name bound to one {@link PrefValue.Kind}.
 *
 * <p>Keys with the same name but different kinds address the same stored entry; reading
 * an entry through a key of another kind yields nothing.
 *
 * <pre>{@code
 * static final PrefKey<String> USER_NAME = PrefKey.stringKey("user_name");
 * static final PrefKey<Integer> LAUNCH_COUNT = PrefKey.intKey("launch_count");
 *
 * int launches = store.get(LAUNCH_COUNT, 0);
 * store.put(LAUNCH_COUNT, launches + 1);
 * }</pre>
 *
 * @param <T> the Java type of the value
 */
public final class PrefKey<T> {
  private final String name;
  private final PrefValue.Kind kind;
  private final Class<T> type;

  private PrefKey(String name, PrefValue.Kind kind, Class<T> type) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
    this.kind = kind;
    this.type = type;
  }

  public static PrefKey<String> stringKey(String name) {
    return new PrefKey<>(name, PrefValue.Kind.STRING, String.class);
  }

  public static PrefKey<Integer> intKey(String name) {
    return new PrefKey<>(name, PrefValue.Kind.INT, Integer.class);
  }

  public static PrefKey<Long> longKey(String name) {
    return new PrefKey<>(name, PrefValue.Kind.LONG, Long.class);
  }

  public static PrefKey<Float> floatKey(String name) {
    return new PrefKey<>(name, PrefValue.Kind.FLOAT, Float.class);
  }

  public static PrefKey<Double> doubleKey(String name) {
    return new PrefKey<>(name, PrefValue.Kind.DOUBLE, Double.class);
  }

  public static PrefKey<Boolean> booleanKey(String name) {
    return new PrefKey<>(name, PrefValue.Kind.BOOLEAN, Boolean.class);
  }

  @SuppressWarnings("unchecked")
  public static PrefKey<Set<String>> stringSetKey(String name) {
    return new PrefKey<>(name, PrefValue.Kind.STRING_SET, (Class<Set<String>>) (Class<?>) Set.class);
  }

  public String name() {
    return name;
  }

  public PrefValue.Kind kind() {
    return kind;
  }

  /**
   * Wraps a value of this key's type.
   *
   * @param value the value, not null
   * @return the stored representation
   */
  @SuppressWarnings("unchecked")
  PrefValue wrap(T value) {
    Objects.requireNonNull(value, "value");
    return switch (kind) {
      case STRING -> new PrefValue.StringValue((String) value);
      case INT -> new PrefValue.IntValue((Integer) value);
      case LONG -> new PrefValue.LongValue((Long) value);
      case FLOAT -> new PrefValue.FloatValue((Float) value);
      case DOUBLE -> new PrefValue.DoubleValue((Double) value);
      case BOOLEAN -> new PrefValue.BooleanValue((Boolean) value);
      case STRING_SET -> new PrefValue.StringSetValue((Set<String>) value);
    };
  }

  /**
   * Unwraps a stored value if it has this key's kind.
   *
   * @param value stored value, may be null
   * @return the typed value, or empty when absent or of another kind
   */
  Optional<T> unwrap(PrefValue value) {
    if (value == null || value.kind() != kind) {
      return Optional.empty();
    }
    return Optional.of(type.cast(value.raw()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PrefKey<?> other)) return false;
    return name.equals(other.name) && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, kind);
  }

  @Override
  public String toString() {
    return name + ":" + kind;
  }
}
