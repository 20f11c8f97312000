package relaykit;

import relaykit.dispatch.DeliveryInterceptor;
import relaykit.dispatch.DeliveryPipeline;
import relaykit.dispatch.SubscriberMailbox;
import relaykit.registry.DefaultSubscriberRegistry;
import relaykit.registry.SubscriberRegistry;
import relaykit.spi.MetricsExporter;
import relaykit.sticky.StickyEventCache;
import relaykit.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe relay with optional sticky (replay-latest) delivery.
 *
 * <p>Events are routed by their exact runtime class. Each subscription owns a bounded
 * mailbox drained serially on its {@link Scope}'s executor, so {@code publish} only
 * enqueues and returns; it never runs handlers on the calling thread. When a mailbox is
 * full, {@code publish} waits up to {@code publishTimeoutMs} for space and then drops the
 * event for that one subscriber.
 *
 * <p>{@linkplain #publishSticky(Object) Sticky} events are additionally retained per
 * class so that {@link #subscribeSticky(Scope, Class, EventHandler)} can replay the latest
 * value to late subscribers.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable}; closing cancels every subscription and stops the relay-owned
 * worker threads.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventRelay relay = EventRelay.builder().build()) {
 *   Scope screen = relay.newScope("home");
 *   relay.subscribeSticky(screen, TabEvent.class, tab -> select(tab.position()));
 *   relay.publishSticky(new TabEvent(1));
 * }
 * }</pre>
 *
 * @see EventRelay.Builder
 * @see Scope
 */
public final class EventRelay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventRelay.class.getName());

  private final SubscriberRegistry registry;
  private final StickyEventCache stickyCache = new StickyEventCache();
  private final DeliveryPipeline pipeline;
  private final MetricsExporter metrics;
  private final ExecutorService workers;
  private final Scope rootScope;
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final int mailboxCapacity;
  private final long publishTimeoutMs;
  private final long drainTimeoutMs;

  private EventRelay(Builder builder) {
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (builder.mailboxCapacity <= 0) {
      throw new IllegalArgumentException("mailboxCapacity must be > 0");
    }
    if (builder.publishTimeoutMs < 0) {
      throw new IllegalArgumentException("publishTimeoutMs must be >= 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.registry = builder.subscriberRegistry != null
        ? builder.subscriberRegistry : new DefaultSubscriberRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.pipeline = new DeliveryPipeline(builder.interceptors, metrics);
    this.mailboxCapacity = builder.mailboxCapacity;
    this.publishTimeoutMs = builder.publishTimeoutMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("relaykit-worker-"));
    this.rootScope = Scope.of("relay", workers);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a scope whose handlers run on the relay's worker threads. The scope is
   * cancelled when the relay is closed, or earlier by the caller.
   *
   * @param name descriptive scope name
   * @return a new active scope
   * @throws IllegalStateException if the relay is closed
   */
  public Scope newScope(String name) {
    ensureOpen();
    return rootScope.child(name);
  }

  /**
   * Delivers {@code event} to every subscription registered for its exact runtime class.
   * Publishing with no subscribers is a no-op.
   *
   * @param event the event
   * @return number of subscriptions that accepted the event
   * @throws IllegalStateException if the relay is closed
   */
  public int publish(Object event) {
    Objects.requireNonNull(event, "event");
    ensureOpen();
    metrics.incrementPublished();
    int accepted = 0;
    for (SubscriberMailbox<?> subscriber : registry.subscribersFor(event.getClass())) {
      if (subscriber.offer(event, publishTimeoutMs)) {
        accepted++;
      } else if (subscriber.isActive()) {
        metrics.incrementDropped();
        logger.log(Level.WARNING, "Mailbox full after " + publishTimeoutMs + "ms; dropped "
            + event.getClass().getName() + " for subscription " + subscriber.id());
      }
    }
    return accepted;
  }

  /**
   * Retains {@code event} as the sticky value for its runtime class, replacing any prior
   * value, then publishes it.
   *
   * @param event the event
   * @return number of subscriptions that accepted the event
   * @throws IllegalStateException if the relay is closed
   */
  public int publishSticky(Object event) {
    Objects.requireNonNull(event, "event");
    ensureOpen();
    stickyCache.put(event);
    metrics.recordStickyCount(stickyCache.size());
    return publish(event);
  }

  /**
   * Registers {@code handler} for every future publish of exactly {@code eventType} until
   * {@code scope} ends. Past events are never replayed.
   *
   * @param scope lifetime and executor of the subscription
   * @param eventType exact event class to receive
   * @param handler the handler
   * @return the subscription handle; already inactive if {@code scope} was cancelled
   * @throws IllegalStateException if the relay is closed
   */
  public <T> Subscription<T> subscribe(Scope scope, Class<T> eventType, EventHandler<? super T> handler) {
    return register(scope, eventType, handler);
  }

  /**
   * Like {@link #subscribe(Scope, Class, EventHandler)}, but first hands the current sticky
   * value for {@code eventType}, if any, to the handler.
   *
   * <p>The sticky value is placed ahead of anything published after registration, so the
   * handler never ends on a stale value. A sticky publish racing with this call may be
   * observed twice.
   *
   * @param scope lifetime and executor of the subscription
   * @param eventType exact event class to receive
   * @param handler the handler
   * @return the subscription handle
   * @throws IllegalStateException if the relay is closed
   */
  public <T> Subscription<T> subscribeSticky(Scope scope, Class<T> eventType, EventHandler<? super T> handler) {
    SubscriberMailbox<T> mailbox = register(scope, eventType, handler);
    Optional<T> sticky = stickyCache.get(eventType);
    if (sticky.isPresent() && !mailbox.offerFirst(sticky.get()) && mailbox.isActive()) {
      metrics.incrementDropped();
      logger.log(Level.WARNING, "Mailbox full; dropped sticky replay of " + eventType.getName()
          + " for subscription " + mailbox.id());
    }
    return mailbox;
  }

  private <T> SubscriberMailbox<T> register(Scope scope, Class<T> eventType, EventHandler<? super T> handler) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    ensureOpen();
    SubscriberMailbox<T> mailbox = new SubscriberMailbox<>(
        eventType, handler, scope, pipeline, mailboxCapacity, this::unregister);
    registry.add(mailbox);
    mailbox.bindToScope();
    metrics.recordSubscriberCount(registry.size());
    return mailbox;
  }

  private void unregister(SubscriberMailbox<?> mailbox) {
    if (registry.remove(mailbox)) {
      metrics.recordSubscriberCount(registry.size());
    }
  }

  /**
   * Returns the current sticky value for {@code eventType}.
   */
  public <T> Optional<T> getSticky(Class<T> eventType) {
    return stickyCache.get(eventType);
  }

  /**
   * Clears the sticky value for {@code eventType}. Active subscriptions are unaffected.
   *
   * @return {@code true} if a value was present
   */
  public boolean removeSticky(Class<?> eventType) {
    boolean removed = stickyCache.remove(eventType);
    metrics.recordStickyCount(stickyCache.size());
    return removed;
  }

  /**
   * Clears every sticky value. Active subscriptions are unaffected.
   */
  public void removeAllSticky() {
    stickyCache.clear();
    metrics.recordStickyCount(0);
  }

  public int subscriberCount(Class<?> eventType) {
    return registry.subscribersFor(eventType).size();
  }

  public boolean hasSubscribers(Class<?> eventType) {
    return subscriberCount(eventType) > 0;
  }

  private void ensureOpen() {
    if (!accepting.get()) {
      throw new IllegalStateException("EventRelay is closed");
    }
  }

  /**
   * Stops accepting publishes and subscriptions, cancels every subscription, then waits up
   * to the configured drain timeout for running handlers to finish. Idempotent.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    rootScope.cancel();
    for (SubscriberMailbox<?> mailbox : registry.clear()) {
      mailbox.cancel();
    }
    metrics.recordSubscriberCount(0);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting running handlers");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EventRelay}. */
  public static final class Builder {
    private SubscriberRegistry subscriberRegistry;
    private MetricsExporter metrics;
    private final List<DeliveryInterceptor> interceptors = new ArrayList<>();
    private int workerCount = 4;
    private int mailboxCapacity = 1024;
    private long publishTimeoutMs = 1000;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the number of relay-owned worker threads that run handlers of scopes created
     * with {@link EventRelay#newScope(String)}.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the bounded capacity of each subscription's mailbox.
     *
     * <p>Optional. Defaults to {@code 1024}. Must be &gt; 0.
     *
     * @param mailboxCapacity maximum queued events per subscription
     * @return this builder
     */
    public Builder mailboxCapacity(int mailboxCapacity) {
      this.mailboxCapacity = mailboxCapacity;
      return this;
    }

    /**
     * Sets how long {@code publish} waits for space in a full mailbox before dropping the
     * event for that subscriber.
     *
     * <p>Optional. Defaults to {@code 1000} ms. {@code 0} drops immediately.
     *
     * @param publishTimeoutMs wait per full mailbox in milliseconds
     * @return this builder
     */
    public Builder publishTimeoutMs(long publishTimeoutMs) {
      this.publishTimeoutMs = publishTimeoutMs;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds to wait for running handlers during close.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Replaces the subscriber registry.
     *
     * <p>Optional. Defaults to {@link DefaultSubscriberRegistry}.
     *
     * @param subscriberRegistry the registry
     * @return this builder
     */
    public Builder subscriberRegistry(SubscriberRegistry subscriberRegistry) {
      this.subscriberRegistry = subscriberRegistry;
      return this;
    }

    /**
     * Appends a delivery interceptor. Interceptors run before delivery in registration
     * order and after delivery in reverse order.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(DeliveryInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Appends multiple delivery interceptors.
     *
     * @param interceptors the interceptors to add
     * @return this builder
     */
    public Builder interceptors(List<DeliveryInterceptor> interceptors) {
      Objects.requireNonNull(interceptors, "interceptors");
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Builds the relay and starts its worker threads.
     *
     * @return a new {@link EventRelay}
     * @throws IllegalArgumentException if {@code workerCount < 1}, {@code mailboxCapacity <= 0},
     *     or a timeout is negative
     */
    public EventRelay build() {
      return new EventRelay(this);
    }
  }
}
