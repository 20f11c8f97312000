package relaykit.args;

import org.junit.jupiter.api.Test;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentsTest {

  static final ArgKey<String> USER_ID = ArgKey.stringKey("userId");
  static final ArgKey<Integer> USER_AGE = ArgKey.intKey("userAge");
  static final ArgKey<int[]> SCORES = ArgKey.intArrayKey("scores");
  static final ArgKey<List<String>> NAMES = ArgKey.stringListKey("names");
  static final ArgKey<Address> ADDRESS = ArgKey.serializableKey("address", Address.class);

  record Address(String city) implements Serializable {
  }

  record Other(String value) implements Serializable {
  }

  @Test
  void readsStoredValues() {
    Arguments args = Arguments.builder()
        .put(USER_ID, "123")
        .put(USER_AGE, 30)
        .put(ADDRESS, new Address("Oslo"))
        .build();

    assertEquals(Optional.of("123"), args.get(USER_ID));
    assertEquals(Optional.of(30), args.get(USER_AGE));
    assertEquals(Optional.of(new Address("Oslo")), args.get(ADDRESS));
    assertEquals(3, args.size());
  }

  @Test
  void kindMismatchReadsAsAbsent() {
    Arguments args = Arguments.builder().put(USER_ID, "123").build();

    assertTrue(args.containsKey("userId"));
    assertTrue(args.get(ArgKey.intKey("userId")).isEmpty());
    assertTrue(args.get(ArgKey.longKey("userId")).isEmpty());
  }

  @Test
  void serializableTypeMismatchReadsAsAbsent() {
    Arguments args = Arguments.builder().put(ADDRESS, new Address("Oslo")).build();

    assertTrue(args.get(ArgKey.serializableKey("address", Other.class)).isEmpty());
  }

  @Test
  void arraysAreCopiedInAndOut() {
    int[] scores = {1, 2, 3};
    Arguments args = Arguments.builder().put(SCORES, scores).build();

    scores[0] = 99;
    int[] read = args.get(SCORES).orElseThrow();
    read[1] = 99;

    assertArrayEquals(new int[] {1, 2, 3}, args.get(SCORES).orElseThrow());
  }

  @Test
  void everyArrayKindRoundTrips() {
    Arguments args = Arguments.builder()
        .put(ArgKey.byteArrayKey("b"), new byte[] {1})
        .put(ArgKey.charArrayKey("c"), new char[] {'x'})
        .put(ArgKey.booleanArrayKey("z"), new boolean[] {true})
        .put(ArgKey.longArrayKey("l"), new long[] {2L})
        .put(ArgKey.floatArrayKey("f"), new float[] {1.5f})
        .put(ArgKey.doubleArrayKey("d"), new double[] {2.5})
        .build();

    assertArrayEquals(new byte[] {1}, args.get(ArgKey.byteArrayKey("b")).orElseThrow());
    assertArrayEquals(new char[] {'x'}, args.get(ArgKey.charArrayKey("c")).orElseThrow());
    assertArrayEquals(new boolean[] {true}, args.get(ArgKey.booleanArrayKey("z")).orElseThrow());
    assertArrayEquals(new long[] {2L}, args.get(ArgKey.longArrayKey("l")).orElseThrow());
    assertArrayEquals(new float[] {1.5f}, args.get(ArgKey.floatArrayKey("f")).orElseThrow());
    assertArrayEquals(new double[] {2.5}, args.get(ArgKey.doubleArrayKey("d")).orElseThrow());
    assertTrue(args.get(ArgKey.intArrayKey("b")).isEmpty());
  }

  @Test
  void stringListIsImmutableCopy() {
    List<String> names = new ArrayList<>(List.of("a", "b"));
    Arguments args = Arguments.builder().put(NAMES, names).build();

    names.add("c");

    List<String> read = args.get(NAMES).orElseThrow();
    assertEquals(List.of("a", "b"), read);
    assertThrows(UnsupportedOperationException.class, () -> read.add("d"));
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void rejectsNonStringListElements() {
    List raw = new ArrayList<>(List.of(1));

    assertThrows(IllegalArgumentException.class, () -> Arguments.builder().put(NAMES, raw));
  }

  @Test
  void laterPutReplacesEarlier() {
    Arguments args = Arguments.builder()
        .put(USER_ID, "1")
        .put(ArgKey.intKey("userId"), 2)
        .build();

    assertTrue(args.get(USER_ID).isEmpty());
    assertEquals(Optional.of(2), args.get(ArgKey.intKey("userId")));
  }

  @Test
  void emptyBundle() {
    assertSame(Arguments.empty(), Arguments.builder().build());
    assertEquals(0, Arguments.empty().size());
    assertFalse(Arguments.empty().containsKey("userId"));
  }

  @Test
  void rejectsNulls() {
    assertThrows(NullPointerException.class, () -> Arguments.builder().put(USER_ID, null));
    assertThrows(NullPointerException.class, () -> Arguments.builder().put(null, "x"));
  }
}
