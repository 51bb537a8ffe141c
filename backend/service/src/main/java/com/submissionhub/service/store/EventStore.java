package com.submissionhub.service.store;

import com.submissionhub.core.events.Event;

import java.util.List;

public interface EventStore {
    void append(Event event);

    // Newest matches, returned oldest first.
    List<Event> query(EventQuery query);
}
