package de.bsommerfeld.convotree.core.event;

import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TreeEventBusTest {

    @Test
    void post_shouldDeliverEventToRegisteredListener() {
        var eventBus = new TreeEventBus();
        var received = new AtomicReference<TreeEvents.MessageCreatedEvent>();

        Object listener = new Object() {
            @Subscribe
            public void onCreated(TreeEvents.MessageCreatedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        var event = new TreeEvents.MessageCreatedEvent("t", "m", null);
        eventBus.post(event);

        assertEquals(event, received.get());
    }

    @Test
    void post_shouldOnlyDeliverMatchingEventTypes() {
        var eventBus = new TreeEventBus();
        var received = new AtomicReference<Object>();

        Object listener = new Object() {
            @Subscribe
            public void onDeleted(TreeEvents.MessagesDeletedEvent event) {
                received.set(event);
            }
        };

        eventBus.register(listener);
        eventBus.post(new TreeEvents.ActiveNodeChangedEvent("t", "a", "b"));
        assertNull(received.get());

        eventBus.post(new TreeEvents.MessagesDeletedEvent("t", List.of("a"), List.of()));
        assertNotNull(received.get());
    }

    @Test
    void unregister_shouldStopDeliveringEvents() {
        var eventBus = new TreeEventBus();
        var received = new AtomicReference<String>();

        Object listener = new Object() {
            @Subscribe
            public void onEvent(TreeEvents.TopicDeletedEvent event) {
                received.set(event.topicId());
            }
        };

        eventBus.register(listener);
        eventBus.post(new TreeEvents.TopicDeletedEvent("first", 0));
        assertEquals("first", received.get());

        eventBus.unregister(listener);
        eventBus.post(new TreeEvents.TopicDeletedEvent("second", 0));
        assertEquals("first", received.get());
    }

    @Test
    void post_unhandledEvent_shouldBeCountedAsUndelivered() {
        var eventBus = new TreeEventBus();

        assertDoesNotThrow(() -> eventBus.post(new TreeEvents.MessageUpdatedEvent("t", "m", List.of())));

        assertEquals(1, eventBus.undeliveredCount());
    }

    @Test
    void post_handledEvent_shouldNotBeCountedAsUndelivered() {
        var eventBus = new TreeEventBus();
        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(TreeEvent event) {
            }
        });

        eventBus.post(new TreeEvents.TopicDeletedEvent("t", 0));
        eventBus.post(new TreeEvents.MessageCreatedEvent("t", "m", null));

        assertEquals(0, eventBus.undeliveredCount());
    }

    @Test
    void post_failingListener_shouldNotReachPosterOrOtherListeners() {
        var eventBus = new TreeEventBus();
        var received = new AtomicReference<String>();

        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(TreeEvents.TopicDeletedEvent event) {
                throw new IllegalStateException("listener broke");
            }
        });
        eventBus.register(new Object() {
            @Subscribe
            public void onEvent(TreeEvents.TopicDeletedEvent event) {
                received.set(event.topicId());
            }
        });

        assertDoesNotThrow(() -> eventBus.post(new TreeEvents.TopicDeletedEvent("t", 0)));
        assertEquals("t", received.get());
    }

    @Test
    void allEvents_shouldExposeTheirTopic() {
        List<TreeEvent> events = List.of(
                new TreeEvents.MessageCreatedEvent("t", "m", null),
                new TreeEvents.MessageUpdatedEvent("t", "m", List.of("status")),
                new TreeEvents.MessagesDeletedEvent("t", List.of("m"), List.of()),
                new TreeEvents.ActiveNodeChangedEvent("t", null, "m"),
                new TreeEvents.TopicDeletedEvent("t", 1));

        assertTrue(events.stream().allMatch(event -> event.topicId().equals("t")));
    }
}
