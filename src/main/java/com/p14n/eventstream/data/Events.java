package com.p14n.eventstream.data;

import java.util.List;

/**
 * A batch of events committed at the same index.
 */
public record Events(long index, List<Event> events) {

    public Events {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
    }

    public static Events of(long index, Event... events) {
        return new Events(index, List.of(events));
    }
}
