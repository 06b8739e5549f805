package orion.domain;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine-wide event bus for lifecycle events that are not part of the published status view,
 * currently the {@link orion.domain.status.ConnectionStateEvent} posted on every channel change.
 * <p>
 * Events are delivered synchronously on the posting thread, which for the engine is always the
 * engine thread. A subscriber that throws is logged and does not stop delivery to the others,
 * nor does the exception reach the poster.
 *
 * @author Orion team
 * @since 15/10/2026
 */
public class EngineEventBus {
    private static final Logger logger = LoggerFactory.getLogger(EngineEventBus.class);

    private final EventBus eventBus;

    public EngineEventBus() {
        this(new EventBus(EngineEventBus::logSubscriberFailure));
    }

    /**
     * Wrap an existing Guava bus, keeping its own exception handling
     */
    public EngineEventBus(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * Register every {@code @Subscribe} method of the given object
     */
    public void register(Object object) {
        eventBus.register(object);
    }

    public void unregister(Object object) {
        eventBus.unregister(object);
    }

    public void post(Object event) {
        eventBus.post(event);
    }

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        logger.error("Event subscriber {}.{} failed on {}",
                context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(),
                context.getEvent().getClass().getSimpleName(),
                exception);
    }
}
