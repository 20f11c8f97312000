package relaykit.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import relaykit.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relaykit.publish}: events passed to publish or publishSticky</li>
 *   <li>{@code relaykit.deliver.success}: handler invocations that completed</li>
 *   <li>{@code relaykit.deliver.failure}: handler invocations that threw</li>
 *   <li>{@code relaykit.deliver.dropped}: events dropped for a subscriber with a full mailbox</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relaykit.subscribers}: active subscriptions</li>
 *   <li>{@code relaykit.sticky.size}: retained sticky events</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter published;
  private final Counter delivered;
  private final Counter failed;
  private final Counter dropped;
  private final Gauge subscribersGauge;
  private final Gauge stickyGauge;

  private final AtomicInteger subscribers = new AtomicInteger();
  private final AtomicInteger sticky = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relaykit"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relaykit");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for applications running
   * several relays.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "ui.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.published = Counter.builder(namePrefix + ".publish")
        .description("Events published")
        .register(registry);
    this.delivered = Counter.builder(namePrefix + ".deliver.success")
        .description("Handler invocations that completed")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".deliver.failure")
        .description("Handler invocations that threw")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".deliver.dropped")
        .description("Events dropped because a subscriber mailbox stayed full")
        .register(registry);

    this.subscribersGauge = Gauge.builder(namePrefix + ".subscribers", subscribers, AtomicInteger::get)
        .register(registry);
    this.stickyGauge = Gauge.builder(namePrefix + ".sticky.size", sticky, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void recordSubscriberCount(int count) {
    if (closed) return;
    subscribers.set(count);
  }

  @Override
  public void recordStickyCount(int count) {
    if (closed) return;
    sticky.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this once the {@link relaykit.EventRelay} using the exporter is closed, to
   * prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(published, delivered, failed, dropped, subscribersGauge, stickyGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
