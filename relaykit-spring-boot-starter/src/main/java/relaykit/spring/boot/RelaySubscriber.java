package relaykit.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a relay subscriber.
 *
 * <p>The annotated bean must implement {@link relaykit.EventHandler}. It is subscribed on
 * the application scope once all singletons are created and stays subscribed until the
 * context closes.
 *
 * <pre>{@code
 * @Component
 * @RelaySubscriber(eventType = LoginEvent.class, sticky = true)
 * public class LoginBanner implements EventHandler<LoginEvent> {
 *   public void onEvent(LoginEvent event) { ... }
 * }
 * }</pre>
 *
 * @see RelaySubscriberRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RelaySubscriber {

    /**
     * Exact event class the handler receives.
     */
    Class<?> eventType();

    /**
     * Whether to replay the current sticky value on registration.
     */
    boolean sticky() default false;
}
