package relaykit.prefs;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A stored preference value: one of a fixed set of kinds.
 *
 * <ul>
 *   <li>{@link StringValue}, {@link IntValue}, {@link LongValue}, {@link FloatValue},
 *       {@link DoubleValue}, {@link BooleanValue}: scalar values</li>
 *   <li>{@link StringSetValue}: an insertion-ordered, immutable set of strings</li>
 * </ul>
 *
 * <p>Code that needs to treat kinds differently switches on {@link #kind()}; a
 * {@code switch} expression over {@link Kind} without a {@code default} branch is checked
 * for exhaustiveness by the compiler.
 */
public sealed interface PrefValue permits PrefValue.StringValue, PrefValue.IntValue,
    PrefValue.LongValue, PrefValue.FloatValue, PrefValue.DoubleValue, PrefValue.BooleanValue,
    PrefValue.StringSetValue {

  /** The supported value kinds. */
  enum Kind {
    STRING,
    INT,
    LONG,
    FLOAT,
    DOUBLE,
    BOOLEAN,
    STRING_SET
  }

  Kind kind();

  /**
   * Returns the wrapped Java value ({@code String}, {@code Integer}, ..., {@code Set<String>}).
   */
  Object raw();

  /**
   * Wraps a plain Java value.
   *
   * @param value a {@code String}, {@code Integer}, {@code Long}, {@code Float}, {@code Double},
   *     {@code Boolean}, or a {@code Set} of strings
   * @return the matching {@link PrefValue}
   * @throws IllegalArgumentException if the value's type is not supported
   */
  static PrefValue of(Object value) {
    Objects.requireNonNull(value, "value");
    if (value instanceof PrefValue prefValue) {
      return prefValue;
    }
    if (value instanceof String s) {
      return new StringValue(s);
    }
    if (value instanceof Integer i) {
      return new IntValue(i);
    }
    if (value instanceof Long l) {
      return new LongValue(l);
    }
    if (value instanceof Float f) {
      return new FloatValue(f);
    }
    if (value instanceof Double d) {
      return new DoubleValue(d);
    }
    if (value instanceof Boolean b) {
      return new BooleanValue(b);
    }
    if (value instanceof Set<?> set) {
      Set<String> strings = new LinkedHashSet<>();
      for (Object element : set) {
        if (!(element instanceof String s)) {
          throw new IllegalArgumentException("Unsupported set element type: "
              + (element == null ? "null" : element.getClass().getName()));
        }
        strings.add(s);
      }
      return new StringSetValue(strings);
    }
    throw new IllegalArgumentException("Unsupported type: " + value.getClass().getName());
  }

  record StringValue(String value) implements PrefValue {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }

    @Override
    public Object raw() {
      return value;
    }
  }

  record IntValue(int value) implements PrefValue {
    @Override
    public Kind kind() {
      return Kind.INT;
    }

    @Override
    public Object raw() {
      return value;
    }
  }

  record LongValue(long value) implements PrefValue {
    @Override
    public Kind kind() {
      return Kind.LONG;
    }

    @Override
    public Object raw() {
      return value;
    }
  }

  record FloatValue(float value) implements PrefValue {
    @Override
    public Kind kind() {
      return Kind.FLOAT;
    }

    @Override
    public Object raw() {
      return value;
    }
  }

  record DoubleValue(double value) implements PrefValue {
    @Override
    public Kind kind() {
      return Kind.DOUBLE;
    }

    @Override
    public Object raw() {
      return value;
    }
  }

  record BooleanValue(boolean value) implements PrefValue {
    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }

    @Override
    public Object raw() {
      return value;
    }
  }

  record StringSetValue(Set<String> value) implements PrefValue {
    public StringSetValue {
      Objects.requireNonNull(value, "value");
      value = Collections.unmodifiableSet(new LinkedHashSet<>(value));
      if (value.contains(null)) {
        throw new IllegalArgumentException("string set cannot contain null");
      }
    }

    public static StringSetValue of(Collection<String> values) {
      return new StringSetValue(new LinkedHashSet<>(values));
    }

    @Override
    public Kind kind() {
      return Kind.STRING_SET;
    }

    @Override
    public Object raw() {
      return value;
    }
  }
}
