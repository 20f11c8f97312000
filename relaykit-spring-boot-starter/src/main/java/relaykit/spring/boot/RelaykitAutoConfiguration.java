package relaykit.spring.boot;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import relaykit.EventRelay;
import relaykit.Scope;
import relaykit.dispatch.DeliveryInterceptor;
import relaykit.prefs.DefaultPreferenceStore;
import relaykit.prefs.PreferenceStore;
import relaykit.registry.SubscriberRegistry;
import relaykit.spi.MetricsExporter;

import java.nio.file.Path;

/**
 * Auto-configuration for relaykit.
 *
 * <p>Creates an {@link EventRelay} from {@link RelaykitProperties}, an application-lifetime
 * {@link Scope} for annotated subscribers, and a {@link PreferenceStore} announcing its
 * changes on the relay.
 *
 * @see RelaykitProperties
 * @see RelaykitMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(EventRelay.class)
@EnableConfigurationProperties(RelaykitProperties.class)
public class RelaykitAutoConfiguration {

  /** Name of the application-lifetime scope bean. */
  public static final String APPLICATION_SCOPE = "relaykitApplicationScope";

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventRelay eventRelay(RelaykitProperties props,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DeliveryInterceptor> interceptorProvider,
      ObjectProvider<SubscriberRegistry> registryProvider) {
    RelaykitProperties.Relay relay = props.getRelay();
    EventRelay.Builder builder = EventRelay.builder()
        .workerCount(relay.getWorkerCount())
        .mailboxCapacity(relay.getMailboxCapacity())
        .publishTimeoutMs(relay.getPublishTimeoutMs())
        .drainTimeoutMs(relay.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    SubscriberRegistry registry = registryProvider.getIfAvailable();
    if (registry != null) {
      builder.subscriberRegistry(registry);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Bean(name = APPLICATION_SCOPE, destroyMethod = "cancel")
  @ConditionalOnMissingBean(name = APPLICATION_SCOPE)
  public Scope relaykitApplicationScope(EventRelay eventRelay) {
    return eventRelay.newScope("application");
  }

  @Bean
  @ConditionalOnMissingBean(PreferenceStore.class)
  @ConditionalOnProperty(prefix = "relaykit.preferences", name = "enabled", matchIfMissing = true)
  public DefaultPreferenceStore preferenceStore(RelaykitProperties props, EventRelay eventRelay) {
    DefaultPreferenceStore.Builder builder = DefaultPreferenceStore.builder().relay(eventRelay);
    String file = props.getPreferences().getFile();
    if (file != null && !file.isBlank()) {
      builder.file(Path.of(file));
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public RelaySubscriberRegistrar relaySubscriberRegistrar(ListableBeanFactory beanFactory,
      EventRelay eventRelay) {
    return new RelaySubscriberRegistrar(beanFactory, eventRelay, APPLICATION_SCOPE);
  }
}
