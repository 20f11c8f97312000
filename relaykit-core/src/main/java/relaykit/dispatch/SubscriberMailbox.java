package relaykit.dispatch;

import com.github.f4b6a3.ulid.UlidCreator;
import relaykit.EventHandler;
import relaykit.Scope;
import relaykit.Subscription;

import java.util.Objects;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded channel plus a single consumer task for one subscription.
 *
 * <p>Publishers {@linkplain #offer(Object, long) offer} events into the mailbox. The
 * first offer into an idle mailbox schedules a drain task on the scope's executor; the
 * task delivers queued events one at a time through the {@link DeliveryPipeline} and
 * reschedules itself after {@value #MAX_BATCH} events so one busy subscription cannot
 * monopolize a shared executor. At most one drain task runs per mailbox, so delivery to a
 * subscription is serial and in offer order.
 *
 * <p>Cancelling the mailbox discards queued events and invokes the deregistration
 * callback exactly once.
 *
 * @param <T> the event type
 */
public final class SubscriberMailbox<T> implements Subscription<T> {
  private static final Logger logger = Logger.getLogger(SubscriberMailbox.class.getName());

  static final int MAX_BATCH = 64;

  private final String id;
  private final Class<T> eventType;
  private final EventHandler<? super T> handler;
  private final Scope scope;
  private final DeliveryPipeline pipeline;
  private final LinkedBlockingDeque<T> queue;
  private final AtomicBoolean draining = new AtomicBoolean();
  private final AtomicBoolean active = new AtomicBoolean(true);
  private final Consumer<SubscriberMailbox<?>> onCancel;
  private volatile Runnable scopeRegistration = () -> {
  };

  public SubscriberMailbox(Class<T> eventType, EventHandler<? super T> handler, Scope scope,
      DeliveryPipeline pipeline, int capacity, Consumer<SubscriberMailbox<?>> onCancel) {
    this.id = UlidCreator.getMonotonicUlid().toString();
    this.eventType = Objects.requireNonNull(eventType, "eventType");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.onCancel = Objects.requireNonNull(onCancel, "onCancel");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.queue = new LinkedBlockingDeque<>(capacity);
  }

  /**
   * Ties this mailbox to its scope: cancelling the scope cancels the mailbox, and
   * cancelling the mailbox first releases the scope callback.
   */
  public void bindToScope() {
    this.scopeRegistration = scope.onCancel(this::cancel);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public Class<T> eventType() {
    return eventType;
  }

  @Override
  public Scope scope() {
    return scope;
  }

  @Override
  public boolean isActive() {
    return active.get() && scope.isActive();
  }

  /**
   * Queues an event, waiting up to {@code timeoutMs} for space when the mailbox is full.
   * The wait is only entered when the mailbox is full, so a publisher whose interrupt flag
   * is set still reaches mailboxes with room.
   *
   * @param event an event whose runtime class is exactly {@link #eventType()}
   * @param timeoutMs maximum wait for space, {@code 0} to fail fast
   * @return {@code true} if the event was queued
   */
  public boolean offer(Object event, long timeoutMs) {
    if (!isActive()) {
      return false;
    }
    T typed = eventType.cast(event);
    boolean queued = queue.offer(typed);
    if (!queued && timeoutMs > 0) {
      try {
        queued = queue.offer(typed, timeoutMs, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    if (queued) {
      schedule();
    }
    return queued;
  }

  /**
   * Places a replayed sticky event at the head of the mailbox, unless that same instance
   * is already queued.
   *
   * @param event the sticky snapshot
   * @return {@code true} if the event is queued, {@code false} if the mailbox is inactive
   *     or full
   */
  public boolean offerFirst(T event) {
    if (!isActive()) {
      return false;
    }
    for (T queued : queue) {
      if (queued == event) {
        return true;
      }
    }
    boolean queued = queue.offerFirst(event);
    if (queued) {
      schedule();
    }
    return queued;
  }

  public int queuedCount() {
    return queue.size();
  }

  private void schedule() {
    if (!active.get() || !draining.compareAndSet(false, true)) {
      return;
    }
    try {
      scope.executor().execute(this::drain);
    } catch (RejectedExecutionException e) {
      draining.set(false);
      logger.log(Level.WARNING, "Executor of " + scope + " rejected delivery; cancelling subscription " + id, e);
      cancel();
    }
  }

  private void drain() {
    try {
      int delivered = 0;
      T event;
      while (delivered < MAX_BATCH && isActive() && (event = queue.poll()) != null) {
        pipeline.deliver(this, handler, event);
        delivered++;
      }
    } finally {
      // runs even when a handler throws an Error, so queued events are not stranded
      draining.set(false);
      if (isActive() && !queue.isEmpty()) {
        schedule();
      }
    }
  }

  @Override
  public void cancel() {
    if (!active.compareAndSet(true, false)) {
      return;
    }
    queue.clear();
    scopeRegistration.run();
    onCancel.accept(this);
  }

  @Override
  public String toString() {
    return "Subscription[" + id + ", " + eventType.getName() + ", " + scope.name() + "]";
  }
}
