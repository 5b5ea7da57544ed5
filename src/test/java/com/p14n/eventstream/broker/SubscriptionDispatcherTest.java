package com.p14n.eventstream.broker;

import com.p14n.eventstream.data.ConfigData;
import com.p14n.eventstream.data.Event;
import com.p14n.eventstream.data.Events;
import com.p14n.eventstream.data.SubscribeRequest;
import com.p14n.eventstream.subscription.Subscription;
import com.p14n.eventstream.subscription.SubscriptionClosedException;

import io.grpc.Context;
import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class SubscriptionDispatcherTest {

    private EventBroker broker;
    private SubscriptionDispatcher dispatcher;
    private MessageSubscriber<Events> subscriber;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        var config = new ConfigData("test", 1000);
        broker = new EventBroker(config, OpenTelemetry.noop());
        dispatcher = new SubscriptionDispatcher(config, OpenTelemetry.noop());
        subscriber = Mockito.mock(MessageSubscriber.class);
    }

    @AfterEach
    void tearDown() throws Exception {
        dispatcher.close();
        broker.close();
    }

    private void awaitReleased() throws InterruptedException {
        while (broker.subscriptionCount() > 0) {
            Thread.sleep(10);
        }
    }

    @Test
    void shouldPushMatchingBatchesInOrder() {
        Subscription sub = broker.subscribe(SubscribeRequest.create("token", Map.of("Job", List.of("web"))));
        dispatcher.dispatch(sub, subscriber);

        Event first = Event.create("Job", "JobRegistered", "web");
        Event second = Event.create("Job", "JobDeregistered", "web");
        broker.publish(Events.of(1, first));
        broker.publish(Events.of(2, Event.create("Job", "JobRegistered", "api")));
        broker.publish(Events.of(3, second));

        InOrder inOrder = inOrder(subscriber);
        inOrder.verify(subscriber, timeout(1000)).onMessage(new Events(1, List.of(first.withIndex(1))));
        inOrder.verify(subscriber, timeout(1000)).onMessage(new Events(3, List.of(second.withIndex(3))));
        verify(subscriber, never()).onError(any());
    }

    @Test
    void shouldReportServerCloseAndUnsubscribe() throws Exception {
        Subscription sub = broker.subscribe(SubscribeRequest.all("revoked"));
        dispatcher.dispatch(sub, subscriber);

        broker.closeSubscriptionsForTokens(List.of("revoked"));

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(subscriber, timeout(1000)).onError(error.capture());
        assertInstanceOf(SubscriptionClosedException.class, error.getValue());
        awaitReleased();
        assertEquals(0, broker.subscriptionCount());
    }

    @Test
    void shouldStopQuietlyWhenCancelled() throws Exception {
        Subscription sub = broker.subscribe(SubscribeRequest.all("token"));
        Context.CancellableContext ctx = dispatcher.dispatch(sub, subscriber);

        ctx.cancel(null);

        awaitReleased();
        assertFalse(sub.isClosed());
        verify(subscriber, never()).onError(any());
    }

    @Test
    void shouldReportSubscriberFailure() throws Exception {
        RuntimeException failure = new RuntimeException("test error");
        doThrow(failure).when(subscriber).onMessage(any());

        Subscription sub = broker.subscribe(SubscribeRequest.all("token"));
        dispatcher.dispatch(sub, subscriber);
        broker.publish(Events.of(1, Event.create("Job", "JobRegistered", "web")));

        verify(subscriber, timeout(1000)).onError(failure);
        awaitReleased();
        assertEquals(0, broker.subscriptionCount());
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldDeliverToEveryDispatchedSubscription() {
        int count = 12;
        MessageSubscriber<Events>[] subscribers = new MessageSubscriber[count];
        for (int i = 0; i < count; i++) {
            subscribers[i] = Mockito.mock(MessageSubscriber.class);
            dispatcher.dispatch(broker.subscribe(SubscribeRequest.all("token-" + i)), subscribers[i]);
        }

        Event event = Event.create("Job", "JobRegistered", "web");
        broker.publish(Events.of(1, event));

        for (MessageSubscriber<Events> s : subscribers) {
            verify(s, timeout(2000)).onMessage(new Events(1, List.of(event.withIndex(1))));
        }
    }

    @Test
    void shouldUnsubscribeRunningDispatchOnClose() throws Exception {
        Subscription sub = broker.subscribe(SubscribeRequest.all("token"));
        dispatcher.dispatch(sub, subscriber);
        Thread.sleep(50);

        dispatcher.close();

        awaitReleased();
        assertThrows(IllegalStateException.class, () -> dispatcher.dispatch(sub, subscriber));
    }
}
