package com.giftcard.fraudguard.alert;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes fraud events and cluster updates to Kafka for downstream consumers
 * (case management, SIEM, auto-block). Keyed by event type so each type stays ordered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fraudguard.kafka.enabled", havingValue = "true")
public class FraudEventProducer {

    private final KafkaTemplate<String, AlertEvent> fraudEventKafkaTemplate;

    @Value("${fraudguard.kafka.topic:fraud-events}")
    private String topic;

    public void send(AlertEvent event) {
        String key = event.getType().getEventName();
        try {
            CompletableFuture<SendResult<String, AlertEvent>> future = fraudEventKafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) log.error("Failed to publish fraud event {} type={}", event.getEventId(), key, ex);
                else log.debug("Published fraud event {} partition={}", event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null);
            });
        } catch (Exception e) {
            log.error("Kafka send rejected for fraud event {} type={}", event.getEventId(), key, e);
        }
    }
}
