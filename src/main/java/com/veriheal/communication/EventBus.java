package com.veriheal.communication;

import com.veriheal.core.event.Event;

/**
 * Fan-out of engine events to audit and learning listeners.
 *
 * Publishing must never fail the publisher: a case transition is already
 * committed by the time its event goes out.
 */
public interface EventBus {

    void publish(Event event);

    /** Subscribing the same listener twice has no effect. */
    void subscribe(HealEventListener listener);

    int listenerCount();
}
