package com.p14n.eventstream.subscription;

import java.util.ArrayList;
import java.util.List;

import com.p14n.eventstream.data.Event;
import com.p14n.eventstream.data.SubscribeRequest;

import static com.p14n.eventstream.data.SubscribeRequest.WILDCARD_KEY;
import static com.p14n.eventstream.data.SubscribeRequest.WILDCARD_TOPIC;

/**
 * Selects the events of a batch that match a subscription's topics, keys and
 * namespace.
 *
 * <p>
 * Runs on every delivered batch, so it avoids allocating where it can: a first
 * pass counts the matches, and only a partial match allocates a new list.
 * </p>
 *
 * <p>
 * An event that matches several of the requested keys is emitted once, so the
 * result is never longer than the batch. Keep it that way: the identity return
 * and the counting pass both rely on it.
 * </p>
 */
public final class SubscriptionFilter {

    private SubscriptionFilter() {
    }

    /**
     * Filters a batch for a subscription.
     *
     * @param request the subscription request
     * @param events  the batch, never modified
     * @return {@code events} itself when every event matches, an immutable
     *         empty list when none do, otherwise a new list of the matching
     *         events in their original order
     */
    public static List<Event> filter(SubscribeRequest request, List<Event> events) {
        if (events.isEmpty()) {
            return events;
        }

        int count = 0;
        for (Event e : events) {
            if (matches(request, e)) {
                count++;
            }
        }

        if (count == 0) {
            return List.of();
        }
        if (count == events.size()) {
            return events;
        }

        List<Event> result = new ArrayList<>(count);
        for (Event e : events) {
            if (matches(request, e)) {
                result.add(e);
            }
        }
        return result;
    }

    static boolean matches(SubscribeRequest request, Event event) {
        List<String> keys = request.topics().get(WILDCARD_TOPIC);
        if (keys == null) {
            keys = request.topics().get(event.topic());
            if (keys == null) {
                return false;
            }
        }

        // namespace exclusion wins over any key match
        if (!request.namespace().isEmpty() && !event.namespace().isEmpty()
                && !event.namespace().equals(request.namespace())) {
            return false;
        }

        for (String k : keys) {
            if (k.equals(event.key()) || WILDCARD_KEY.equals(k) || event.filterKeys().contains(k)) {
                return true;
            }
        }
        return false;
    }
}
