package relaykit.args;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Typed argument key: a name, an {@link ArgKind}, and the Java type values of that kind have.
 *
 * <pre>{@code
 * static final ArgKey<String> USER_ID = ArgKey.stringKey("userId");
 * static final ArgKey<Address> ADDRESS = ArgKey.serializableKey("address", Address.class);
 * }</pre>
 *
 * @param <T> the Java type of the value
 */
public final class ArgKey<T> {
  private final String name;
  private final ArgKind kind;
  private final Class<T> type;

  private ArgKey(String name, ArgKind kind, Class<T> type) {
    this.name = Objects.requireNonNull(name, "name");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.type = Objects.requireNonNull(type, "type");
  }

  public static ArgKey<String> stringKey(String name) {
    return new ArgKey<>(name, ArgKind.STRING, String.class);
  }

  public static ArgKey<Integer> intKey(String name) {
    return new ArgKey<>(name, ArgKind.INT, Integer.class);
  }

  public static ArgKey<Long> longKey(String name) {
    return new ArgKey<>(name, ArgKind.LONG, Long.class);
  }

  public static ArgKey<Float> floatKey(String name) {
    return new ArgKey<>(name, ArgKind.FLOAT, Float.class);
  }

  public static ArgKey<Double> doubleKey(String name) {
    return new ArgKey<>(name, ArgKind.DOUBLE, Double.class);
  }

  public static ArgKey<Boolean> booleanKey(String name) {
    return new ArgKey<>(name, ArgKind.BOOLEAN, Boolean.class);
  }

  public static ArgKey<byte[]> byteArrayKey(String name) {
    return new ArgKey<>(name, ArgKind.BYTE_ARRAY, byte[].class);
  }

  public static ArgKey<char[]> charArrayKey(String name) {
    return new ArgKey<>(name, ArgKind.CHAR_ARRAY, char[].class);
  }

  public static ArgKey<boolean[]> booleanArrayKey(String name) {
    return new ArgKey<>(name, ArgKind.BOOLEAN_ARRAY, boolean[].class);
  }

  public static ArgKey<int[]> intArrayKey(String name) {
    return new ArgKey<>(name, ArgKind.INT_ARRAY, int[].class);
  }

  public static ArgKey<long[]> longArrayKey(String name) {
    return new ArgKey<>(name, ArgKind.LONG_ARRAY, long[].class);
  }

  public static ArgKey<float[]> floatArrayKey(String name) {
    return new ArgKey<>(name, ArgKind.FLOAT_ARRAY, float[].class);
  }

  public static ArgKey<double[]> doubleArrayKey(String name) {
    return new ArgKey<>(name, ArgKind.DOUBLE_ARRAY, double[].class);
  }

  @SuppressWarnings("unchecked")
  public static ArgKey<List<String>> stringListKey(String name) {
    return new ArgKey<>(name, ArgKind.STRING_LIST, (Class<List<String>>) (Class<?>) List.class);
  }

  /**
   * Key for any {@link Serializable} value; lookups succeed only for instances of
   * {@code type}.
   */
  public static <T extends Serializable> ArgKey<T> serializableKey(String name, Class<T> type) {
    return new ArgKey<>(name, ArgKind.SERIALIZABLE, type);
  }

  public String name() {
    return name;
  }

  public ArgKind kind() {
    return kind;
  }

  public Class<T> type() {
    return type;
  }

  boolean accepts(Object value) {
    return type.isInstance(value);
  }

  T cast(Object value) {
    return type.cast(value);
  }

  @Override
  public String toString() {
    return name + ":" + kind;
  }
}
