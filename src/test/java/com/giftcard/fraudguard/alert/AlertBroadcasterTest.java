package com.giftcard.fraudguard.alert;

import com.giftcard.fraudguard.MutableClock;
import com.giftcard.fraudguard.domain.FraudLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for AlertBroadcaster using a same-thread dispatcher.
 */
class AlertBroadcasterTest {

    private MutableClock clock;
    private AlertBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        broadcaster = new AlertBroadcaster(Runnable::run, clock);
    }

    @Test
    void subscribeRegistersEmitter() {
        SseEmitter emitter = broadcaster.subscribe();

        assertThat(emitter).isNotNull();
        assertThat(broadcaster.subscriberCount()).isEqualTo(1);
    }

    @Test
    void completedSubscriberIsDroppedOnNextPublish() {
        SseEmitter gone = broadcaster.subscribe();
        broadcaster.subscribe();
        gone.complete();

        broadcaster.publish(AlertEventType.FRAUD_ALERT, FraudLog.builder().id("log-1").build());

        assertThat(broadcaster.subscriberCount()).isEqualTo(1);
    }

    @Test
    void forwardsEventsToKafkaWhenProducerPresent() {
        FraudEventProducer producer = mock(FraudEventProducer.class);
        ReflectionTestUtils.setField(broadcaster, "fraudEventProducer", producer);

        broadcaster.publish(AlertEventType.TRANSACTION_FEED, TransactionFeedItem.builder().code("****0001").build());

        ArgumentCaptor<AlertEvent> captor = ArgumentCaptor.forClass(AlertEvent.class);
        verify(producer).send(captor.capture());
        AlertEvent event = captor.getValue();
        assertThat(event.getType()).isEqualTo(AlertEventType.TRANSACTION_FEED);
        assertThat(event.getTimestamp()).isEqualTo(clock.instant());
        assertThat(event.getEventId()).isNotBlank();
    }

    @Test
    void rejectedDispatchDoesNotPropagate() {
        AlertBroadcaster rejecting = new AlertBroadcaster(task -> {
            throw new RejectedExecutionException("shut down");
        }, clock);

        assertThatCode(() -> rejecting.publish(AlertEventType.FRAUD_CLUSTER, "payload")).doesNotThrowAnyException();
    }

    @Test
    void eventNamesMatchStreamContract() {
        assertThat(AlertEventType.FRAUD_ALERT.getEventName()).isEqualTo("fraud-alert");
        assertThat(AlertEventType.FRAUD_CLUSTER.getEventName()).isEqualTo("fraud-cluster");
        assertThat(AlertEventType.TRANSACTION_FEED.getEventName()).isEqualTo("transaction-feed");
    }
}
