package relaykit;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ScopeTest {

  private static final Executor DIRECT = Runnable::run;

  @Test
  void newScopeIsActive() {
    Scope scope = Scope.of("screen", DIRECT);

    assertTrue(scope.isActive());
    assertEquals("screen", scope.name());
    assertSame(DIRECT, scope.executor());
  }

  @Test
  void cancelRunsCallbacksInRegistrationOrder() {
    Scope scope = Scope.of("screen", DIRECT);
    List<String> calls = new ArrayList<>();
    scope.onCancel(() -> calls.add("first"));
    scope.onCancel(() -> calls.add("second"));

    scope.cancel();

    assertFalse(scope.isActive());
    assertEquals(List.of("first", "second"), calls);
  }

  @Test
  void cancelIsIdempotent() {
    Scope scope = Scope.of("screen", DIRECT);
    AtomicInteger calls = new AtomicInteger();
    scope.onCancel(calls::incrementAndGet);

    scope.cancel();
    scope.cancel();
    scope.close();

    assertEquals(1, calls.get());
  }

  @Test
  void callbackOnCancelledScopeRunsImmediately() {
    Scope scope = Scope.of("screen", DIRECT);
    scope.cancel();
    AtomicInteger calls = new AtomicInteger();

    scope.onCancel(calls::incrementAndGet);

    assertEquals(1, calls.get());
  }

  @Test
  void unregisteredCallbackDoesNotRun() {
    Scope scope = Scope.of("screen", DIRECT);
    AtomicInteger calls = new AtomicInteger();
    Runnable unregister = scope.onCancel(calls::incrementAndGet);

    unregister.run();
    scope.cancel();

    assertEquals(0, calls.get());
  }

  @Test
  void failingCallbackDoesNotStopOthers() {
    Scope scope = Scope.of("screen", DIRECT);
    AtomicInteger calls = new AtomicInteger();
    scope.onCancel(() -> {
      throw new IllegalStateException("boom");
    });
    scope.onCancel(calls::incrementAndGet);

    assertDoesNotThrow(scope::cancel);
    assertEquals(1, calls.get());
  }

  @Test
  void cancellingParentCancelsChildren() {
    Scope parent = Scope.of("app", DIRECT);
    Scope child = parent.child("screen");
    Scope grandChild = child.child("dialog");

    parent.cancel();

    assertFalse(child.isActive());
    assertFalse(grandChild.isActive());
  }

  @Test
  void cancellingChildLeavesParentActive() {
    Scope parent = Scope.of("app", DIRECT);
    Scope child = parent.child("screen");
    Scope sibling = parent.child("other");

    child.cancel();

    assertTrue(parent.isActive());
    assertTrue(sibling.isActive());
  }

  @Test
  void childSharesParentExecutor() {
    Scope parent = Scope.of("app", DIRECT);

    assertSame(DIRECT, parent.child("screen").executor());
  }

  @Test
  void childOfCancelledScopeIsCancelled() {
    Scope parent = Scope.of("app", DIRECT);
    parent.cancel();

    assertFalse(parent.child("late").isActive());
  }

  @Test
  void tryWithResourcesCancels() {
    Scope scope;
    try (Scope s = Scope.of("screen", DIRECT)) {
      scope = s;
      assertTrue(s.isActive());
    }
    assertFalse(scope.isActive());
  }

  @Test
  void rejectsNulls() {
    assertThrows(NullPointerException.class, () -> Scope.of(null, DIRECT));
    assertThrows(NullPointerException.class, () -> Scope.of("screen", null));
    assertThrows(NullPointerException.class, () -> Scope.of("screen", DIRECT).onCancel(null));
  }
}
