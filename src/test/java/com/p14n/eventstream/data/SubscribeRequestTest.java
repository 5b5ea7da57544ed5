package com.p14n.eventstream.data;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubscribeRequestTest {

    @Test
    void shouldCopyTopicsDefensively() {
        List<String> keys = new ArrayList<>(List.of("web"));
        Map<String, List<String>> topics = new HashMap<>();
        topics.put("Job", keys);

        SubscribeRequest request = SubscribeRequest.create("token", topics);
        keys.add("api");
        topics.put("Node", List.of("*"));

        assertEquals(Map.of("Job", List.of("web")), request.topics());
        assertThrows(UnsupportedOperationException.class, () -> request.topics().put("Node", List.of()));
    }

    @Test
    void shouldDefaultNullsToEmpty() {
        Map<String, List<String>> topics = new HashMap<>();
        topics.put("Job", null);

        SubscribeRequest request = new SubscribeRequest(null, 0L, null, topics, false);

        assertEquals("", request.token());
        assertEquals("", request.namespace());
        assertEquals(List.of(), request.topics().get("Job"));
    }

    @Test
    void shouldRejectInvalidRequests() {
        assertThrows(IllegalArgumentException.class, () -> SubscribeRequest.create("token", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> SubscribeRequest.create("token", null));
        assertThrows(IllegalArgumentException.class,
                () -> SubscribeRequest.all("token").startingAt(-1, false));
    }

    @Test
    void shouldSubscribeToEverythingWithWildcards() {
        SubscribeRequest request = SubscribeRequest.all("token").startingAt(42, true);

        assertEquals(List.of(SubscribeRequest.WILDCARD_KEY), request.topics().get(SubscribeRequest.WILDCARD_TOPIC));
        assertEquals(42, request.startIndex());
        assertTrue(request.exactStart());
    }

    @Test
    void eventShouldRequireTopicAndNormaliseOptionalFields() {
        assertThrows(IllegalArgumentException.class, () -> Event.create(" ", "JobRegistered", "web"));

        Event event = Event.create("Job", "JobRegistered", null, null, null, 0L, null);

        assertEquals("", event.key());
        assertEquals("", event.namespace());
        assertEquals(List.of(), event.filterKeys());
        assertEquals(9, event.withIndex(9).index());
    }

    @Test
    void configShouldValidateAndDefault() {
        ConfigData config = new ConfigData("broker");

        assertEquals(5000, config.shutdownTimeoutMillis());
        assertThrows(IllegalArgumentException.class, () -> new ConfigData("", 1000));
        assertThrows(IllegalArgumentException.class, () -> new ConfigData("broker", -1));
    }
}
