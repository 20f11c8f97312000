package relaykit.registry;

import relaykit.dispatch.SubscriberMailbox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe registry keyed by event class identity.
 *
 * <h2>Thread Safety</h2>
 * <p>Registrations and removals can happen concurrently with lookups. Each lookup
 * returns a consistent snapshot; a subscription added while a publish is iterating may
 * or may not see that publish.
 *
 * @see SubscriberRegistry
 */
public final class DefaultSubscriberRegistry implements SubscriberRegistry {

  private final Map<Class<?>, CopyOnWriteArrayList<SubscriberMailbox<?>>> subscribers = new ConcurrentHashMap<>();
  private final AtomicInteger size = new AtomicInteger();

  @Override
  public void add(SubscriberMailbox<?> subscriber) {
    subscribers.compute(subscriber.eventType(), (type, list) -> {
      CopyOnWriteArrayList<SubscriberMailbox<?>> target = list != null ? list : new CopyOnWriteArrayList<>();
      target.add(subscriber);
      return target;
    });
    size.incrementAndGet();
  }

  @Override
  public boolean remove(SubscriberMailbox<?> subscriber) {
    boolean[] removed = new boolean[1];
    subscribers.computeIfPresent(subscriber.eventType(), (type, list) -> {
      removed[0] = list.remove(subscriber);
      return list.isEmpty() ? null : list;
    });
    if (removed[0]) {
      size.decrementAndGet();
    }
    return removed[0];
  }

  @Override
  public List<SubscriberMailbox<?>> subscribersFor(Class<?> eventType) {
    CopyOnWriteArrayList<SubscriberMailbox<?>> specific = subscribers.get(eventType);
    if (specific == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(specific));
  }

  @Override
  public List<SubscriberMailbox<?>> clear() {
    List<SubscriberMailbox<?>> removed = new ArrayList<>();
    for (Class<?> type : new ArrayList<>(subscribers.keySet())) {
      CopyOnWriteArrayList<SubscriberMailbox<?>> list = subscribers.remove(type);
      if (list != null) {
        removed.addAll(list);
        size.addAndGet(-list.size());
      }
    }
    return Collections.unmodifiableList(removed);
  }

  @Override
  public int size() {
    return size.get();
  }
}
