package com.p14n.eventstream.broker;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventstream.buffer.BufferItem;
import com.p14n.eventstream.buffer.EventBuffer;
import com.p14n.eventstream.data.Event;
import com.p14n.eventstream.data.EventBrokerConfig;
import com.p14n.eventstream.data.Events;
import com.p14n.eventstream.data.SubscribeRequest;
import com.p14n.eventstream.subscription.Subscription;
import com.p14n.eventstream.telemetry.BrokerMetrics;

import static com.p14n.eventstream.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * Publishes event batches into a shared buffer and hands out subscriptions that
 * read from it.
 *
 * <p>
 * Subscriptions are tracked by the token in their request so they can be
 * closed when that token is revoked. Whether a token may read a topic is
 * decided elsewhere; the broker only closes what it is told to.
 * </p>
 */
public class EventBroker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventBroker.class);

    protected final ConcurrentHashMap<String, Set<Subscription>> subscriptionsByToken = new ConcurrentHashMap<>();
    protected final AtomicBoolean closed = new AtomicBoolean(false);
    private final EventBuffer buffer;
    protected final BrokerMetrics metrics;
    protected final Tracer tracer;

    public EventBroker(EventBrokerConfig config, OpenTelemetry ot) {
        this(new EventBuffer(), config, ot);
    }

    public EventBroker(EventBuffer buffer, EventBrokerConfig config, OpenTelemetry ot) {
        this.buffer = buffer;
        this.metrics = new BrokerMetrics(ot.getMeter(config.scopeName()));
        this.tracer = ot.getTracer(config.scopeName());
    }

    /**
     * Appends a batch to the buffer, stamping each event with the batch index.
     *
     * @param events the batch to publish
     * @throws IllegalStateException    if the broker is closed
     * @throws IllegalArgumentException if the batch index does not increase
     */
    public void publish(Events events) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
        if (events == null) {
            throw new IllegalArgumentException("Events cannot be null");
        }

        List<Event> stamped = events.events().stream()
                .map(e -> e.withIndex(events.index()))
                .collect(Collectors.toUnmodifiableList());
        Events batch = new Events(events.index(), stamped);

        processWithTelemetry(tracer, batch, "publish_events", () -> buffer.append(batch));
        for (Event e : stamped) {
            metrics.recordPublished(e.topic());
        }
        logger.atDebug().log("Published {} events at index {}", stamped.size(), batch.index());
    }

    /**
     * Creates a subscription positioned according to the request's start index.
     *
     * @param request what to read and where to start
     * @return an open subscription, registered under the request token
     * @throws IllegalStateException    if the broker is closed
     * @throws IllegalArgumentException if an exact start index is not in the
     *                                  buffer
     */
    public Subscription subscribe(SubscribeRequest request) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
        if (request == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }

        BufferItem start = buffer.startAt(request.startIndex(), request.exactStart());

        AtomicReference<Subscription> self = new AtomicReference<>();
        AtomicBoolean released = new AtomicBoolean(false);
        Subscription subscription = new Subscription(request, start, () -> {
            if (released.compareAndSet(false, true)) {
                release(request.token(), self.get());
            }
        });
        self.set(subscription);

        subscriptionsByToken.compute(request.token(), (token, subs) -> {
            Set<Subscription> s = subs == null ? ConcurrentHashMap.newKeySet() : subs;
            s.add(subscription);
            return s;
        });
        metrics.recordSubscriptionAdded();

        // close() may have swept the registry before this subscription was added
        if (closed.get()) {
            subscription.forceClose();
            logger.atDebug().log("Broker closed while subscribing, subscription closed");
            return subscription;
        }

        logger.atInfo().log("Subscribed to topics {} from index {}", request.topics().keySet(), start.index());
        return subscription;
    }

    private void release(String token, Subscription subscription) {
        subscriptionsByToken.computeIfPresent(token, (t, subs) -> {
            subs.remove(subscription);
            return subs.isEmpty() ? null : subs;
        });
        metrics.recordSubscriptionRemoved();
        logger.atDebug().log("Released subscription to topics {}", subscription.request().topics().keySet());
    }

    /**
     * Force closes every subscription created with one of the given tokens.
     * Used when those tokens are revoked or their permissions change.
     *
     * @param tokens the tokens whose subscriptions to close
     * @return the number of subscriptions this call closed
     */
    public int closeSubscriptionsForTokens(Collection<String> tokens) {
        int count = 0;
        for (String token : tokens) {
            Set<Subscription> subs = subscriptionsByToken.get(token);
            if (subs == null) {
                continue;
            }
            count += forceClose(subs);
        }
        if (count > 0) {
            logger.atInfo().log("Closed {} subscriptions for {} tokens", count, tokens.size());
        }
        return count;
    }

    /**
     * Force closes every registered subscription.
     *
     * @return the number of subscriptions this call closed
     */
    public int closeAll() {
        int count = 0;
        for (Set<Subscription> subs : subscriptionsByToken.values()) {
            count += forceClose(subs);
        }
        logger.atInfo().log("Closed {} subscriptions", count);
        return count;
    }

    private int forceClose(Set<Subscription> subs) {
        int count = 0;
        for (Subscription s : subs) {
            if (s.forceClose()) {
                metrics.recordForceClosed();
                count++;
            }
        }
        return count;
    }

    /**
     * Number of subscriptions that have not been released.
     */
    public int subscriptionCount() {
        return subscriptionsByToken.values().stream().mapToInt(Set::size).sum();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            closeAll();
        }
    }
}
