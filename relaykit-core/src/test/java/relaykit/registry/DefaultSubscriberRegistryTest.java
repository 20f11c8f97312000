package relaykit.registry;

import org.junit.jupiter.api.Test;
import relaykit.Scope;
import relaykit.dispatch.DeliveryPipeline;
import relaykit.dispatch.SubscriberMailbox;
import relaykit.spi.MetricsExporter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultSubscriberRegistryTest {

  private final Scope scope = Scope.of("test", Runnable::run);
  private final DeliveryPipeline pipeline = new DeliveryPipeline(List.of(), MetricsExporter.NOOP);

  @Test
  void returnsEmptyListForUnregisteredType() {
    DefaultSubscriberRegistry registry = new DefaultSubscriberRegistry();

    assertTrue(registry.subscribersFor(String.class).isEmpty());
    assertEquals(0, registry.size());
  }

  @Test
  void keysByExactClass() {
    DefaultSubscriberRegistry registry = new DefaultSubscriberRegistry();
    SubscriberMailbox<Number> numbers = mailbox(Number.class);
    registry.add(numbers);

    assertEquals(List.of(numbers), registry.subscribersFor(Number.class));
    assertTrue(registry.subscribersFor(Integer.class).isEmpty());
  }

  @Test
  void keepsRegistrationOrder() {
    DefaultSubscriberRegistry registry = new DefaultSubscriberRegistry();
    SubscriberMailbox<String> first = mailbox(String.class);
    SubscriberMailbox<String> second = mailbox(String.class);
    registry.add(first);
    registry.add(second);

    assertEquals(List.of(first, second), registry.subscribersFor(String.class));
    assertEquals(2, registry.size());
  }

  @Test
  void removeReportsWhetherPresent() {
    DefaultSubscriberRegistry registry = new DefaultSubscriberRegistry();
    SubscriberMailbox<String> subscriber = mailbox(String.class);
    registry.add(subscriber);

    assertTrue(registry.remove(subscriber));
    assertFalse(registry.remove(subscriber));
    assertEquals(0, registry.size());
    assertTrue(registry.subscribersFor(String.class).isEmpty());
  }

  @Test
  void lookupIsSnapshot() {
    DefaultSubscriberRegistry registry = new DefaultSubscriberRegistry();
    registry.add(mailbox(String.class));
    List<SubscriberMailbox<?>> snapshot = registry.subscribersFor(String.class);

    registry.add(mailbox(String.class));

    assertEquals(1, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(mailbox(String.class)));
  }

  @Test
  void clearReturnsEverything() {
    DefaultSubscriberRegistry registry = new DefaultSubscriberRegistry();
    registry.add(mailbox(String.class));
    registry.add(mailbox(Integer.class));

    List<SubscriberMailbox<?>> removed = registry.clear();

    assertEquals(2, removed.size());
    assertEquals(0, registry.size());
    assertTrue(registry.subscribersFor(String.class).isEmpty());
  }

  private <T> SubscriberMailbox<T> mailbox(Class<T> type) {
    return new SubscriberMailbox<>(type, e -> {}, scope, pipeline, 4, m -> {});
  }
}
