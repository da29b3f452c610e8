package com.veriheal.core.event;

import java.time.Instant;
import java.util.UUID;

public class Event {

    private final String eventId;
    private final EventType type;
    private final String source;
    private final String runId;

    // payload type depends on the event type: CaseTransition, AppliedPatch,
    // EscalationTicket, TestCase or RunSummary
    private final Object payload;

    private final Instant timestamp;

    public Event(EventType type, String source, String runId, Object payload) {
        this.eventId = UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.runId = runId;
        this.payload = payload;
        this.timestamp = Instant.now();
    }

    public String getEventId() {
        return eventId;
    }

    public EventType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public String getRunId() {
        return runId;
    }

    public Object getPayload() {
        return payload;
    }

    public <T> T getPayload(Class<T> type) {
        return type.isInstance(payload) ? type.cast(payload) : null;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Event{" + type + ", source=" + source + ", run=" + runId + "}";
    }
}
