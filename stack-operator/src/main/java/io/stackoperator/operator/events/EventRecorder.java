/*
 * Copyright Stack Operator authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.stackoperator.operator.events;

import java.util.ArrayList;
import java.util.List;

/**
 * Queues the events produced during one reconciliation. The events are emitted together, in the order they were
 * added, once the reconciliation completes.
 */
public class EventRecorder {
    private final List<Event> events = new ArrayList<>();

    /**
     * Queues an event
     *
     * @param type      Type of the event
     * @param reason    Reason of the event
     * @param message   Message of the event
     */
    public void addEvent(String type, String reason, String message) {
        events.add(new Event(type, reason, message));
    }

    /**
     * @return  Copy of the queued events
     */
    public List<Event> events() {
        return List.copyOf(events);
    }
}
