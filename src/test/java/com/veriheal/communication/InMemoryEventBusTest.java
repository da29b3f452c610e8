package com.veriheal.communication;

import com.veriheal.core.event.Event;
import com.veriheal.core.event.EventType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventBusTest {

    @Test
    void testFailingListenerDoesNotStopOthers() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<Event> received = new ArrayList<>();
        bus.subscribe(event -> { throw new IllegalStateException("listener broke"); });
        bus.subscribe(received::add);

        Event event = new Event(EventType.RUN_STARTED, "test", "run-1", null);
        assertDoesNotThrow(() -> bus.publish(event));

        assertEquals(List.of(event), received);
    }

    @Test
    void testSameListenerIsSubscribedOnce() {
        InMemoryEventBus bus = new InMemoryEventBus();
        List<Event> received = new ArrayList<>();
        HealEventListener listener = received::add;

        bus.subscribe(listener);
        bus.subscribe(listener);
        bus.publish(new Event(EventType.RUN_FINISHED, "test", "run-1", null));

        assertEquals(1, bus.listenerCount());
        assertEquals(1, received.size());
    }
}
