package com.p14n.eventstream.broker;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventstream.data.Event;
import com.p14n.eventstream.data.EventBrokerConfig;
import com.p14n.eventstream.data.Events;
import com.p14n.eventstream.subscription.Subscription;
import com.p14n.eventstream.subscription.SubscriptionClosedException;
import com.p14n.eventstream.telemetry.BrokerMetrics;

import static com.p14n.eventstream.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import io.grpc.Context;
import io.grpc.StatusRuntimeException;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * Drives subscriptions on background threads and pushes every matching batch to
 * a {@link MessageSubscriber}.
 *
 * <p>
 * Each dispatched subscription occupies its own executor thread while it
 * waits, so the default executor grows with the number of dispatches.
 * Dispatch stops when the returned context is cancelled, when the subscription
 * is closed by the server, or when the subscriber throws. The subscription is
 * always unsubscribed once dispatch stops.
 * </p>
 */
public class SubscriptionDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionDispatcher.class);

    private final AsyncExecutor asyncExecutor;
    private final EventBrokerConfig config;
    private final BrokerMetrics metrics;
    private final Tracer tracer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SubscriptionDispatcher(EventBrokerConfig config, OpenTelemetry ot) {
        this(new DefaultExecutor(), config, ot);
    }

    public SubscriptionDispatcher(AsyncExecutor asyncExecutor, EventBrokerConfig config, OpenTelemetry ot) {
        this.asyncExecutor = asyncExecutor;
        this.config = config;
        this.metrics = new BrokerMetrics(ot.getMeter(config.scopeName()));
        this.tracer = ot.getTracer(config.scopeName());
    }

    /**
     * Starts pushing the subscription's events to the subscriber.
     *
     * @param subscription the subscription to read
     * @param subscriber   receives each batch, and the error that ended dispatch
     * @return a context to cancel to stop dispatching
     */
    public Context.CancellableContext dispatch(Subscription subscription, MessageSubscriber<Events> subscriber) {
        if (closed.get()) {
            throw new IllegalStateException("Dispatcher is closed");
        }
        if (subscription == null) {
            throw new IllegalArgumentException("Subscription cannot be null");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        Context.CancellableContext ctx = Context.current().withCancellation();
        asyncExecutor.submit(() -> {
            deliver(ctx, subscription, subscriber);
            return null;
        });
        return ctx;
    }

    private void deliver(Context.CancellableContext ctx, Subscription subscription,
            MessageSubscriber<Events> subscriber) {
        try {
            for (;;) {
                Events events = subscription.next(ctx);
                processWithTelemetry(tracer, events, "deliver_events", () -> {
                    subscriber.onMessage(events);
                    return true;
                });
                for (Event e : events.events()) {
                    metrics.recordDelivered(e.topic());
                }
            }
        } catch (SubscriptionClosedException e) {
            logger.atInfo().log("Subscription closed by server, stopping dispatch");
            notifyError(subscriber, e);
        } catch (StatusRuntimeException e) {
            if (ctx.isCancelled()) {
                logger.atDebug().log("Dispatch cancelled: {}", e.getStatus());
            } else {
                logger.atError().setCause(e).log("Error delivering events");
                notifyError(subscriber, e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.atDebug().log("Dispatch interrupted");
        } catch (RuntimeException e) {
            logger.atError().setCause(e).log("Error delivering events");
            notifyError(subscriber, e);
        } finally {
            subscription.unsubscribe();
            ctx.cancel(null);
        }
    }

    private void notifyError(MessageSubscriber<Events> subscriber, Throwable error) {
        try {
            subscriber.onError(error);
        } catch (RuntimeException e) {
            logger.atWarn().setCause(e).log("Subscriber failed to handle error");
        }
    }

    /**
     * Stops every running dispatch and waits for the threads to finish.
     */
    @Override
    public void close() throws InterruptedException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        asyncExecutor.shutdownNow();
        if (!asyncExecutor.awaitTermination(config.shutdownTimeoutMillis(), TimeUnit.MILLISECONDS)) {
            logger.atWarn().log("Dispatcher threads did not stop within {} ms", config.shutdownTimeoutMillis());
        }
    }
}
