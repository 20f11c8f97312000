package relaykit.spi;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events passed to {@code publish} or {@code publishSticky}.
     */
    void incrementPublished();

    /**
     * Increments the count of handler invocations that completed normally.
     */
    void incrementDelivered();

    /**
     * Increments the count of handler invocations that threw.
     */
    void incrementHandlerFailure();

    /**
     * Increments the count of events dropped for one subscriber because its mailbox
     * stayed full for longer than the publish timeout.
     */
    void incrementDropped();

    /**
     * Records the number of active subscriptions across all event types.
     *
     * @param count active subscriptions
     */
    void recordSubscriberCount(int count);

    /**
     * Records the number of entries in the sticky cache.
     *
     * @param count sticky entries
     */
    default void recordStickyCount(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementHandlerFailure() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void recordSubscriberCount(int count) {
        }
    }
}
