package com.veriheal.communication;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Subscribes every {@link HealEventListener} bean once the context is up,
 * so no run can publish before the audit trail and the learning recorder
 * are listening.
 */
@Component
public class EventListenerRegistrar {

    private static final Logger log = LoggerFactory.getLogger(EventListenerRegistrar.class);

    private final EventBus                eventBus;
    private final List<HealEventListener> listeners;

    public EventListenerRegistrar(EventBus eventBus, List<HealEventListener> listeners) {
        this.eventBus  = eventBus;
        this.listeners = listeners;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerListeners() {
        listeners.forEach(eventBus::subscribe);
        log.info("[EventBus] {} listeners registered: {}", eventBus.listenerCount(),
                listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
    }
}
