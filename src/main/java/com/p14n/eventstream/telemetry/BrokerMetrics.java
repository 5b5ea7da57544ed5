package com.p14n.eventstream.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for the event broker.
 *
 * <p>
 * This class provides four metrics:
 * </p>
 * <ul>
 * <li>events_published: Counter for events appended to the buffer per
 * topic</li>
 * <li>events_delivered: Counter for events pushed to dispatched subscribers
 * per topic</li>
 * <li>active_subscriptions: Up/down counter for registered subscriptions</li>
 * <li>subscriptions_force_closed: Counter for subscriptions closed by the
 * server</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");

        private final LongCounter publishedEvents;
        private final LongCounter deliveredEvents;
        private final LongUpDownCounter activeSubscriptions;
        private final LongCounter forceClosedSubscriptions;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events appended to the buffer")
                                .build();

                deliveredEvents = meter.counterBuilder("events_delivered")
                                .setDescription("Number of events delivered to dispatched subscribers")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of registered subscriptions")
                                .build();

                forceClosedSubscriptions = meter.counterBuilder("subscriptions_force_closed")
                                .setDescription("Number of subscriptions closed by the server")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedEvents.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDelivered(String topic) {
                deliveredEvents.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriptionAdded() {
                activeSubscriptions.add(1);
        }

        public void recordSubscriptionRemoved() {
                activeSubscriptions.add(-1);
        }

        public void recordForceClosed() {
                forceClosedSubscriptions.add(1);
        }
}
