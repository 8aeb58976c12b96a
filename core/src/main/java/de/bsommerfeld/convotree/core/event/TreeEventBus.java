package de.bsommerfeld.convotree.core.event;

import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Synchronous bus for {@link TreeEvent}s so that UI and sync layers can follow
 * tree changes without the engine knowing about them.
 *
 * <p>
 * Listener failures are logged and never reach the poster; the mutation that
 * produced the event is already committed. Events nobody subscribes to are
 * counted and logged at debug level.
 */
@Singleton
public class TreeEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(TreeEventBus.class);

    private final EventBus eventBus;
    private final AtomicLong undelivered = new AtomicLong();

    public TreeEventBus() {
        this.eventBus = new EventBus(TreeEventBus::logListenerFailure);
        this.eventBus.register(new DeadEventListener());
    }

    public void post(TreeEvent event) {
        LOG.debug("Posting {} for topic {}", event.getClass().getSimpleName(), event.topicId());
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    /** Number of posted events that had no matching listener. */
    public long undeliveredCount() {
        return undelivered.get();
    }

    private static void logListenerFailure(Throwable failure, SubscriberExceptionContext context) {
        LOG.error("Listener {}#{} failed on {}", context.getSubscriber().getClass().getName(),
                context.getSubscriberMethod().getName(), context.getEvent().getClass().getSimpleName(), failure);
    }

    private final class DeadEventListener {

        @Subscribe
        public void onDeadEvent(DeadEvent deadEvent) {
            undelivered.incrementAndGet();
            LOG.debug("No listener for {}", deadEvent.getEvent());
        }
    }
}
