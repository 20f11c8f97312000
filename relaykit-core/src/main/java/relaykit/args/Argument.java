package relaykit.args;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lazily resolved argument of a component, read from whatever {@link Arguments} the
 * component currently holds.
 *
 * <p>The bundle provider is consulted on every {@link #get()}, so an argument can be
 * declared as a field before the bundle is attached.
 *
 * <pre>{@code
 * class ProfileView {
 *   private Arguments arguments;
 *   private final Argument<String> userId = Argument.required(USER_ID, () -> arguments);
 *   private final Argument<String> userName = Argument.optional(USER_NAME, "Guest", () -> arguments);
 * }
 * }</pre>
 *
 * @param <T> the value type
 */
public final class Argument<T> implements Supplier<T> {
  private final ArgKey<T> key;
  private final T defaultValue;
  private final boolean required;
  private final Supplier<Arguments> provider;

  private Argument(ArgKey<T> key, T defaultValue, boolean required, Supplier<Arguments> provider) {
    this.key = Objects.requireNonNull(key, "key");
    this.defaultValue = defaultValue;
    this.required = required;
    this.provider = Objects.requireNonNull(provider, "provider");
  }

  /**
   * Argument that falls back to {@code defaultValue} when the bundle is missing, the name
   * is absent, or the stored value has another type.
   */
  public static <T> Argument<T> optional(ArgKey<T> key, T defaultValue, Supplier<Arguments> provider) {
    return new Argument<>(key, defaultValue, false, provider);
  }

  /**
   * Argument that must be present with the right type.
   */
  public static <T> Argument<T> required(ArgKey<T> key, Supplier<Arguments> provider) {
    return new Argument<>(key, null, true, provider);
  }

  public ArgKey<T> key() {
    return key;
  }

  /**
   * Resolves the argument.
   *
   * @return the stored value, or the default for optional arguments
   * @throws IllegalStateException for a required argument that is missing or has the
   *     wrong type
   */
  @Override
  public T get() {
    Arguments arguments = provider.get();
    if (arguments == null || !arguments.containsKey(key.name())) {
      if (required) {
        throw new IllegalStateException("Required argument '" + key.name() + "' not found");
      }
      return defaultValue;
    }
    Optional<T> value = arguments.get(key);
    if (value.isPresent()) {
      return value.get();
    }
    if (required) {
      throw new IllegalStateException("Argument '" + key.name() + "' has wrong type");
    }
    return defaultValue;
  }
}
