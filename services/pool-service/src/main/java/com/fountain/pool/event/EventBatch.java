package com.fountain.pool.event;

import com.fountain.common.event.DomainEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Events of one ledger operation, appended as each state change commits and
 * published once the ledger lock is released.
 */
public class EventBatch {

    private final List<DomainEvent> events = new ArrayList<>();

    public void add(DomainEvent event) {
        events.add(event);
    }

    public List<DomainEvent> drain() {
        List<DomainEvent> drained = List.copyOf(events);
        events.clear();
        return drained;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
