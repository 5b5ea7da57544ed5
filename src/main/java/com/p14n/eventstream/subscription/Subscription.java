package com.p14n.eventstream.subscription;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventstream.buffer.BufferItem;
import com.p14n.eventstream.buffer.CloseSignal;
import com.p14n.eventstream.data.Event;
import com.p14n.eventstream.data.Events;
import com.p14n.eventstream.data.SubscribeRequest;

import io.grpc.Context;

/**
 * A consumer's cursor into the event buffer.
 *
 * <p>
 * A subscription is read by a single consumer thread through {@link #next} or
 * {@link #nextNoBlock}. Any other thread may call {@link #forceClose} or
 * {@link #unsubscribe} at any time.
 * </p>
 */
public class Subscription {
    private static final Logger logger = LoggerFactory.getLogger(Subscription.class);

    static final int STATE_OPEN = 0;

    // closed by the server, the subscriber must subscribe again
    static final int STATE_CLOSED = 1;

    private final AtomicInteger state = new AtomicInteger(STATE_OPEN);
    private final SubscribeRequest request;
    private final CloseSignal forceClosed = new CloseSignal();
    private final Runnable unsub;

    // only touched by the consumer thread
    private BufferItem currentItem;

    /**
     * @param request the filter this subscription applies
     * @param item    the item to read forward from
     * @param unsub   releases broker resources, must be idempotent and safe to
     *                call from any thread
     */
    public Subscription(SubscribeRequest request, BufferItem item, Runnable unsub) {
        if (request == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }
        if (item == null) {
            throw new IllegalArgumentException("Start item cannot be null");
        }
        if (unsub == null) {
            throw new IllegalArgumentException("Unsubscribe callback cannot be null");
        }
        this.request = request;
        this.currentItem = item;
        this.unsub = unsub;
    }

    /**
     * Blocks until the next batch with at least one matching event.
     *
     * @param ctx caller context, cancel it to stop waiting
     * @return the matching events and the index they were committed at
     * @throws SubscriptionClosedException    if the subscription is or becomes
     *                                        closed
     * @throws io.grpc.StatusRuntimeException if {@code ctx} was cancelled or its
     *                                        deadline passed
     * @throws InterruptedException           if the thread was interrupted
     */
    public Events next(Context ctx) throws InterruptedException {
        for (;;) {
            if (isClosed()) {
                throw new SubscriptionClosedException();
            }

            BufferItem next;
            try {
                next = currentItem.next(ctx, forceClosed);
            } catch (RuntimeException | InterruptedException e) {
                if (isClosed()) {
                    throw new SubscriptionClosedException(e);
                }
                throw e;
            }
            currentItem = next;

            List<Event> events = SubscriptionFilter.filter(request, next.events().events());
            if (events.isEmpty()) {
                continue;
            }
            return new Events(next.index(), events);
        }
    }

    /**
     * Returns the next batch with at least one matching event without waiting.
     *
     * @return the matching events, or empty if the buffer holds nothing further
     *         for this subscription
     * @throws SubscriptionClosedException if the subscription is closed
     */
    public Optional<Events> nextNoBlock() {
        for (;;) {
            if (isClosed()) {
                throw new SubscriptionClosedException();
            }

            BufferItem next = currentItem.nextNoBlock();
            if (next == null) {
                return Optional.empty();
            }
            currentItem = next;

            List<Event> events = SubscriptionFilter.filter(request, next.events().events());
            if (events.isEmpty()) {
                continue;
            }
            return Optional.of(new Events(next.index(), events));
        }
    }

    /**
     * Closes the subscription from the server side and wakes a blocked
     * {@link #next}. Safe to call repeatedly and from several threads; only the
     * first call has an effect.
     *
     * @return true if this call closed the subscription
     */
    public boolean forceClose() {
        if (state.compareAndSet(STATE_OPEN, STATE_CLOSED)) {
            forceClosed.fire();
            logger.atDebug().log("Subscription to topics {} force closed", request.topics().keySet());
            return true;
        }
        return false;
    }

    /**
     * Releases the subscription's broker resources. Does not close it.
     */
    public void unsubscribe() {
        unsub.run();
    }

    public boolean isClosed() {
        return state.get() == STATE_CLOSED;
    }

    public SubscribeRequest request() {
        return request;
    }

    /**
     * Index of the last batch this subscription moved past. Only meaningful on
     * the consumer thread.
     */
    public long currentIndex() {
        return currentItem.index();
    }

    CloseSignal closeSignal() {
        return forceClosed;
    }
}
