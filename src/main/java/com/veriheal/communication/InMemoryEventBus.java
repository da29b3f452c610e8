package com.veriheal.communication;

import com.veriheal.core.event.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous bus: listeners run on the publishing worker thread. A listener
 * that throws is logged and skipped so the audit side never aborts a case.
 */
@Component
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final List<HealEventListener> listeners =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(Event event) {
        for (HealEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[EventBus] Listener {} failed on {}",
                        listener.getClass().getSimpleName(), event, e);
            }
        }
    }

    @Override
    public void subscribe(HealEventListener listener) {
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    @Override
    public int listenerCount() {
        return listeners.size();
    }
}
