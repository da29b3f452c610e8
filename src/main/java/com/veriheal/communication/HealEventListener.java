package com.veriheal.communication;

import com.veriheal.core.event.Event;

public interface HealEventListener {

    void onEvent(Event event);
}
