package com.p14n.eventstream.data;

import java.util.List;

/**
 * Record representing a single event held in the event buffer.
 *
 * <p>
 * {@code filterKeys} lists additional keys the event answers to when a
 * subscription filters by key, for example the job id of an allocation event.
 * </p>
 */
public record Event(String topic,
                    String type,
                    String key,
                    String namespace,
                    List<String> filterKeys,
                    long index,
                    byte[] payload) {

    public Event {
        filterKeys = filterKeys == null ? List.of() : List.copyOf(filterKeys);
    }

    public static Event create(String topic, String type, String key) {
        return create(topic, type, key, "", List.of(), 0L, null);
    }

    public static Event create(String topic, String type, String key, String namespace) {
        return create(topic, type, key, namespace, List.of(), 0L, null);
    }

    /**
     * Creates a new Event instance with validation of required fields.
     *
     * @throws IllegalArgumentException if the topic is null or empty
     */
    public static Event create(String topic, String type, String key, String namespace,
            List<String> filterKeys, long index, byte[] payload) {
        if (topic == null || topic.trim().isEmpty()) {
            throw new IllegalArgumentException("topic cannot be null or empty");
        }
        return new Event(topic,
                type,
                key == null ? "" : key,
                namespace == null ? "" : namespace,
                filterKeys,
                index,
                payload);
    }

    /**
     * Returns a copy of this event stamped with the given index.
     *
     * @param index the index the event was committed at
     * @return the re-indexed event
     */
    public Event withIndex(long index) {
        return new Event(topic, type, key, namespace, filterKeys, index, payload);
    }
}
