package relaykit.dispatch;

import relaykit.EventHandler;
import relaykit.Subscription;
import relaykit.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes a handler for one event, wrapped by the configured interceptors.
 *
 * <p>Failures are isolated: any exception from an interceptor or the handler is logged,
 * counted through {@link MetricsExporter#incrementHandlerFailure()} and swallowed so the
 * mailbox keeps draining.
 */
public final class DeliveryPipeline {
  private static final Logger logger = Logger.getLogger(DeliveryPipeline.class.getName());

  private final List<DeliveryInterceptor> interceptors;
  private final MetricsExporter metrics;

  public DeliveryPipeline(List<DeliveryInterceptor> interceptors, MetricsExporter metrics) {
    this.interceptors = Collections.unmodifiableList(
        new ArrayList<>(Objects.requireNonNull(interceptors, "interceptors")));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  <T> void deliver(Subscription<T> subscription, EventHandler<? super T> handler, T event) {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDelivery(event, subscription);
        completedBefore = i + 1;
      }
      handler.onEvent(event);
      runAfterDelivery(event, subscription, null, completedBefore);
      metrics.incrementDelivered();
    } catch (Exception e) {
      runAfterDelivery(event, subscription, e, completedBefore);
      metrics.incrementHandlerFailure();
      logger.log(Level.WARNING, "Handler failed for " + event.getClass().getName()
          + " on subscription " + subscription.id(), e);
    }
  }

  private void runAfterDelivery(Object event, Subscription<?> subscription, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDelivery(event, subscription, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDelivery failed", ex);
      }
    }
  }
}
