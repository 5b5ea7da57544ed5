package com.p14n.eventstream.buffer;

import java.util.List;

import com.p14n.eventstream.data.Events;

/**
 * Append-only linked sequence of event batches shared by all subscriptions.
 *
 * <p>
 * The buffer starts with an empty sentinel item at index 0, so a subscription
 * can be positioned before the first real batch. Readers never lock: they
 * follow item links. Appends are serialised and indexes must strictly
 * increase.
 * </p>
 */
public class EventBuffer {

    private final BufferItem head;
    private volatile BufferItem tail;

    public EventBuffer() {
        this.head = new BufferItem(new Events(0L, List.of()));
        this.tail = head;
    }

    /**
     * Appends a batch and wakes every subscription waiting on the current tail.
     *
     * @param events the batch to append
     * @return the appended item
     * @throws IllegalArgumentException if the batch index does not follow the
     *                                  current tail
     */
    public synchronized BufferItem append(Events events) {
        if (events == null) {
            throw new IllegalArgumentException("Events cannot be null");
        }
        if (events.index() <= tail.index()) {
            throw new IllegalArgumentException("Index " + events.index()
                    + " must be greater than the current tail index " + tail.index());
        }
        BufferItem item = new BufferItem(events);
        BufferItem previous = tail;
        tail = item;
        previous.link(item);
        return item;
    }

    public BufferItem head() {
        return head;
    }

    public BufferItem tail() {
        return tail;
    }

    /**
     * Finds the position a subscription starting at {@code index} should read
     * from: the item before the first item whose index is at least
     * {@code index}. An index of 0 starts at the tail, so only batches appended
     * afterwards are read.
     *
     * @param index the requested start index
     * @param exact whether a batch with exactly that index must exist
     * @return the item to read forward from
     * @throws IllegalArgumentException if {@code exact} is set and no batch has
     *                                  the requested index
     */
    public BufferItem startAt(long index, boolean exact) {
        if (index == 0) {
            return tail;
        }
        BufferItem previous = head;
        BufferItem current = head.nextNoBlock();
        while (current != null) {
            if (current.index() >= index) {
                if (exact && current.index() != index) {
                    break;
                }
                return previous;
            }
            previous = current;
            current = current.nextNoBlock();
        }
        if (exact) {
            throw new IllegalArgumentException("Requested index " + index + " not in buffer");
        }
        return previous;
    }
}
