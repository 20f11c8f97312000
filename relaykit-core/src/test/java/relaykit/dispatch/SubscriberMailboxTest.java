package relaykit.dispatch;

import org.junit.jupiter.api.Test;
import relaykit.Scope;
import relaykit.spi.MetricsExporter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SubscriberMailboxTest {

  private final DeliveryPipeline pipeline = new DeliveryPipeline(List.of(), MetricsExporter.NOOP);

  @Test
  void deliversQueuedEventsInOrder() {
    ManualExecutor executor = new ManualExecutor();
    Scope scope = Scope.of("test", executor);
    List<String> received = new ArrayList<>();
    SubscriberMailbox<String> mailbox = newMailbox(scope, received::add, 8, m -> {});

    assertTrue(mailbox.offer("a", 0));
    assertTrue(mailbox.offer("b", 0));
    assertEquals(1, executor.pending(), "only one drain task per mailbox");

    executor.runAll();

    assertEquals(List.of("a", "b"), received);
    assertEquals(0, mailbox.queuedCount());
  }

  @Test
  void rejectsOfferWhenFull() {
    ManualExecutor executor = new ManualExecutor();
    SubscriberMailbox<String> mailbox = newMailbox(Scope.of("test", executor), e -> {}, 1, m -> {});

    assertTrue(mailbox.offer("a", 0));
    assertFalse(mailbox.offer("b", 0));
    assertEquals(1, mailbox.queuedCount());
  }

  @Test
  void drainYieldsAfterBatch() {
    ManualExecutor executor = new ManualExecutor();
    AtomicInteger received = new AtomicInteger();
    SubscriberMailbox<String> mailbox = newMailbox(
        Scope.of("test", executor), e -> received.incrementAndGet(), 256, m -> {});
    for (int i = 0; i < SubscriberMailbox.MAX_BATCH + 10; i++) {
      mailbox.offer("e" + i, 0);
    }

    executor.runNext();

    assertEquals(SubscriberMailbox.MAX_BATCH, received.get());
    assertEquals(1, executor.pending());

    executor.runAll();
    assertEquals(SubscriberMailbox.MAX_BATCH + 10, received.get());
  }

  @Test
  void offerFirstJumpsQueueAndSkipsDuplicateInstance() {
    ManualExecutor executor = new ManualExecutor();
    List<String> received = new ArrayList<>();
    SubscriberMailbox<String> mailbox = newMailbox(Scope.of("test", executor), received::add, 8, m -> {});
    String sticky = new String("sticky");

    mailbox.offer("later", 0);
    assertTrue(mailbox.offerFirst(sticky));
    assertTrue(mailbox.offerFirst(sticky));
    executor.runAll();

    assertEquals(List.of("sticky", "later"), received);
  }

  @Test
  void offerFirstFailsWhenFull() {
    ManualExecutor executor = new ManualExecutor();
    SubscriberMailbox<String> mailbox = newMailbox(Scope.of("test", executor), e -> {}, 1, m -> {});

    assertTrue(mailbox.offer("a", 0));
    assertFalse(mailbox.offerFirst("sticky"));
    assertEquals(1, mailbox.queuedCount());
  }

  @Test
  void offerSucceedsFromInterruptedThreadWhenRoomRemains() {
    ManualExecutor executor = new ManualExecutor();
    SubscriberMailbox<String> mailbox = newMailbox(Scope.of("test", executor), e -> {}, 2, m -> {});

    Thread.currentThread().interrupt();
    try {
      assertTrue(mailbox.offer("a", 1000));
      assertTrue(mailbox.offer("b", 1000));
      assertFalse(mailbox.offer("c", 1000), "interrupted wait gives up");
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
    assertEquals(2, mailbox.queuedCount());
  }

  @Test
  void handlerErrorReschedulesRemainingEvents() {
    ManualExecutor executor = new ManualExecutor();
    List<String> received = new ArrayList<>();
    SubscriberMailbox<String> mailbox = newMailbox(Scope.of("test", executor), e -> {
      if (e.equals("a")) {
        throw new AssertionError("handler bug");
      }
      received.add(e);
    }, 8, m -> {});
    mailbox.offer("a", 0);
    mailbox.offer("b", 0);

    assertThrows(AssertionError.class, executor::runNext);
    assertEquals(1, executor.pending());

    executor.runAll();
    assertEquals(List.of("b"), received);
    assertTrue(mailbox.isActive());
  }

  @Test
  void cancelDiscardsQueueAndNotifiesOnce() {
    ManualExecutor executor = new ManualExecutor();
    List<String> received = new ArrayList<>();
    AtomicInteger deregistrations = new AtomicInteger();
    SubscriberMailbox<String> mailbox = newMailbox(
        Scope.of("test", executor), received::add, 8, m -> deregistrations.incrementAndGet());
    mailbox.offer("a", 0);

    mailbox.cancel();
    mailbox.cancel();
    executor.runAll();

    assertFalse(mailbox.isActive());
    assertTrue(received.isEmpty());
    assertEquals(1, deregistrations.get());
    assertFalse(mailbox.offer("b", 0));
  }

  @Test
  void scopeCancellationCancelsBoundMailbox() {
    Scope scope = Scope.of("test", Runnable::run);
    AtomicInteger deregistrations = new AtomicInteger();
    SubscriberMailbox<String> mailbox = newMailbox(scope, e -> {}, 8, m -> deregistrations.incrementAndGet());
    mailbox.bindToScope();

    scope.cancel();

    assertFalse(mailbox.isActive());
    assertEquals(1, deregistrations.get());
  }

  @Test
  void rejectedExecutionCancelsSubscription() {
    Executor rejecting = task -> {
      throw new RejectedExecutionException("shut down");
    };
    AtomicInteger deregistrations = new AtomicInteger();
    SubscriberMailbox<String> mailbox = newMailbox(
        Scope.of("test", rejecting), e -> {}, 8, m -> deregistrations.incrementAndGet());

    mailbox.offer("a", 0);

    assertFalse(mailbox.isActive());
    assertEquals(1, deregistrations.get());
  }

  @Test
  void idsAreUlids() {
    Scope scope = Scope.of("test", Runnable::run);
    SubscriberMailbox<String> first = newMailbox(scope, e -> {}, 1, m -> {});
    SubscriberMailbox<String> second = newMailbox(scope, e -> {}, 1, m -> {});

    assertEquals(26, first.id().length());
    assertTrue(first.id().compareTo(second.id()) < 0);
  }

  @Test
  void rejectsNonPositiveCapacity() {
    Scope scope = Scope.of("test", Runnable::run);

    assertThrows(IllegalArgumentException.class, () -> newMailbox(scope, e -> {}, 0, m -> {}));
  }

  private SubscriberMailbox<String> newMailbox(Scope scope, relaykit.EventHandler<? super String> handler,
      int capacity, java.util.function.Consumer<SubscriberMailbox<?>> onCancel) {
    return new SubscriberMailbox<>(String.class, handler, scope, pipeline, capacity, onCancel);
  }

  private static final class ManualExecutor implements Executor {
    private final Queue<Runnable> tasks = new ArrayDeque<>();

    @Override
    public void execute(Runnable command) {
      tasks.add(command);
    }

    int pending() {
      return tasks.size();
    }

    void runNext() {
      tasks.remove().run();
    }

    void runAll() {
      while (!tasks.isEmpty()) {
        runNext();
      }
    }
  }
}
