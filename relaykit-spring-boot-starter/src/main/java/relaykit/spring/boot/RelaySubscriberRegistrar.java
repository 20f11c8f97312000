package relaykit.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import relaykit.EventHandler;
import relaykit.EventRelay;
import relaykit.Scope;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link RelaySubscriber} and subscribes them on the
 * application scope.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see RelaySubscriber
 */
public class RelaySubscriberRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(RelaySubscriberRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final EventRelay relay;
    private final String scopeBeanName;

    public RelaySubscriberRegistrar(ListableBeanFactory beanFactory, EventRelay relay, String scopeBeanName) {
        this.beanFactory = beanFactory;
        this.relay = relay;
        this.scopeBeanName = scopeBeanName;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(RelaySubscriber.class);
        if (beans.isEmpty()) {
            return;
        }
        Scope scope = beanFactory.getBean(scopeBeanName, Scope.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler<?> handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @RelaySubscriber must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            RelaySubscriber annotation = beanFactory.findAnnotationOnBean(beanName, RelaySubscriber.class);
            if (annotation == null) {
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), RelaySubscriber.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @RelaySubscriber annotation on " + bean.getClass().getName());
            }

            Class<?> eventType = annotation.eventType();
            boolean sticky = annotation.sticky();
            subscribe(scope, eventType, handler, sticky);
            logger.fine(() -> "Subscribed bean '" + beanName + "' to " + eventType.getName()
                    + (sticky ? " (sticky)" : ""));
        }
    }

    // The handler's type argument is erased; the annotation is the only source of the event type.
    @SuppressWarnings("unchecked")
    private <T> void subscribe(Scope scope, Class<T> eventType, EventHandler<?> handler, boolean sticky) {
        EventHandler<? super T> typed = (EventHandler<? super T>) handler;
        if (sticky) {
            relay.subscribeSticky(scope, eventType, typed);
        } else {
            relay.subscribe(scope, eventType, typed);
        }
    }
}
