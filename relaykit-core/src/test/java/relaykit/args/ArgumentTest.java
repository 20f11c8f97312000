package relaykit.args;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentTest {

  private static final ArgKey<String> USER_ID = ArgKey.stringKey("userId");
  private static final ArgKey<String> USER_NAME = ArgKey.stringKey("userName");

  @Test
  void optionalFallsBackToDefault() {
    Argument<String> userName = Argument.optional(USER_NAME, "Guest", Arguments::empty);

    assertEquals("Guest", userName.get());
  }

  @Test
  void optionalFallsBackWhenBundleMissing() {
    Argument<String> userName = Argument.optional(USER_NAME, "Guest", () -> null);

    assertEquals("Guest", userName.get());
  }

  @Test
  void optionalFallsBackOnWrongType() {
    Arguments args = Arguments.builder().put(ArgKey.intKey("userName"), 5).build();

    assertEquals("Guest", Argument.optional(USER_NAME, "Guest", () -> args).get());
  }

  @Test
  void requiredReturnsStoredValue() {
    Arguments args = Arguments.builder().put(USER_ID, "123").build();

    assertEquals("123", Argument.required(USER_ID, () -> args).get());
  }

  @Test
  void requiredMissingFailsWithName() {
    Argument<String> userId = Argument.required(USER_ID, Arguments::empty);

    IllegalStateException ex = assertThrows(IllegalStateException.class, userId::get);
    assertEquals("Required argument 'userId' not found", ex.getMessage());
  }

  @Test
  void requiredWrongTypeFails() {
    Arguments args = Arguments.builder().put(ArgKey.intKey("userId"), 5).build();

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> Argument.required(USER_ID, () -> args).get());
    assertEquals("Argument 'userId' has wrong type", ex.getMessage());
  }

  @Test
  void resolvesLazilyFromCurrentBundle() {
    AtomicReference<Arguments> holder = new AtomicReference<>();
    Argument<String> userId = Argument.required(USER_ID, holder::get);

    holder.set(Arguments.builder().put(USER_ID, "first").build());
    assertEquals("first", userId.get());

    holder.set(Arguments.builder().put(USER_ID, "second").build());
    assertEquals("second", userId.get());
  }
}
