package com.p14n.eventstream.data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes which events a subscriber wants and where its stream starts.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code token}: credential of the subscriber, used by the broker to find
 * subscriptions to close when the token is revoked</li>
 * <li>{@code startIndex}: index to resume from, 0 for live events only</li>
 * <li>{@code namespace}: namespace filter, empty for all namespaces</li>
 * <li>{@code topics}: topic to ordered key list; {@link #WILDCARD_TOPIC} and
 * {@link #WILDCARD_KEY} match any topic and any key</li>
 * <li>{@code exactStart}: when true the stream must start exactly at
 * {@code startIndex}, otherwise the closest later index is used</li>
 * </ul>
 */
public record SubscribeRequest(String token,
                               long startIndex,
                               String namespace,
                               Map<String, List<String>> topics,
                               boolean exactStart) {

    public static final String WILDCARD_TOPIC = "*";
    public static final String WILDCARD_KEY = "*";

    public SubscribeRequest {
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("topics cannot be null or empty");
        }
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex cannot be negative");
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        topics.forEach((topic, keys) -> copy.put(topic, keys == null ? List.of() : List.copyOf(keys)));
        topics = Map.copyOf(copy);
        namespace = namespace == null ? "" : namespace;
        token = token == null ? "" : token;
    }

    public static SubscribeRequest create(String token, Map<String, List<String>> topics) {
        return new SubscribeRequest(token, 0L, "", topics, false);
    }

    public static SubscribeRequest create(String token, String namespace, Map<String, List<String>> topics) {
        return new SubscribeRequest(token, 0L, namespace, topics, false);
    }

    /**
     * Subscribes to every topic and key.
     */
    public static SubscribeRequest all(String token) {
        return create(token, Map.of(WILDCARD_TOPIC, List.of(WILDCARD_KEY)));
    }

    public SubscribeRequest startingAt(long index, boolean exact) {
        return new SubscribeRequest(token, index, namespace, topics, exact);
    }
}
