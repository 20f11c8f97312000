package relaykit.dispatch;

import relaykit.Subscription;

/**
 * Cross-cutting hook for observing event delivery to individual subscriptions.
 *
 * <p>Interceptors run around every handler invocation:
 * <ol>
 *   <li>{@link #beforeDelivery} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterDelivery} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDelivery} throws, the handler is skipped and the failure is counted
 * like a handler failure. {@code afterDelivery} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventRelay.builder()
 *     .interceptor(DeliveryInterceptor.before((event, subscription) ->
 *         audit.log(event.getClass().getSimpleName(), subscription.id())))
 *     .interceptor(DeliveryInterceptor.after((event, subscription, error) -> {
 *         if (error != null) alerts.raise(error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface DeliveryInterceptor {

    /**
     * Called before the subscription's handler is invoked.
     *
     * @param event the event about to be delivered
     * @param subscription the receiving subscription
     * @throws Exception to skip this delivery
     */
    default void beforeDelivery(Object event, Subscription<?> subscription) throws Exception {
    }

    /**
     * Called after handler invocation (or after a beforeDelivery failure).
     *
     * @param event the delivered event
     * @param subscription the receiving subscription
     * @param error null on success, the exception on failure
     */
    default void afterDelivery(Object event, Subscription<?> subscription, Exception error) {
    }

    /**
     * Creates an interceptor with only a beforeDelivery hook.
     */
    static DeliveryInterceptor before(BeforeHook hook) {
        return new DeliveryInterceptor() {
            @Override
            public void beforeDelivery(Object event, Subscription<?> subscription) throws Exception {
                hook.accept(event, subscription);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDelivery hook.
     */
    static DeliveryInterceptor after(AfterHook hook) {
        return new DeliveryInterceptor() {
            @Override
            public void afterDelivery(Object event, Subscription<?> subscription, Exception error) {
                hook.accept(event, subscription, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Object event, Subscription<?> subscription) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Object event, Subscription<?> subscription, Exception error);
    }
}
