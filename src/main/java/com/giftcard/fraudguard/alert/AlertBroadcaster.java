package com.giftcard.fraudguard.alert;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fans fraud events out to connected monitoring sessions over server-sent events.
 * Best effort and at most once per subscriber: there is no replay buffer, and a
 * subscriber whose send fails is dropped. Delivery happens on a dedicated thread so a
 * slow dashboard never holds up a redemption.
 */
@Slf4j
@Component
public class AlertBroadcaster {

    private final List<SseEmitter> subscribers = new CopyOnWriteArrayList<>();
    private final Executor dispatcher;
    private final Clock clock;

    @Autowired(required = false)
    private FraudEventProducer fraudEventProducer;

    @Autowired
    public AlertBroadcaster(Clock clock) {
        this(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "alert-broadcaster");
            t.setDaemon(true);
            return t;
        }), clock);
    }

    AlertBroadcaster(Executor dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitter.onCompletion(() -> subscribers.remove(emitter));
        emitter.onTimeout(() -> subscribers.remove(emitter));
        emitter.onError(e -> subscribers.remove(emitter));
        subscribers.add(emitter);
        log.info("Alert stream subscriber connected ({} active)", subscribers.size());
        return emitter;
    }

    public void publish(AlertEventType type, Object payload) {
        publish(AlertEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .payload(payload)
                .timestamp(clock.instant())
                .build());
    }

    public void publish(AlertEvent event) {
        try {
            dispatcher.execute(() -> deliver(event));
        } catch (Exception e) {
            log.warn("Alert dispatch rejected for event type={}: {}", event.getType(), e.getMessage());
        }
    }

    private void deliver(AlertEvent event) {
        for (SseEmitter emitter : subscribers) {
            try {
                emitter.send(SseEmitter.event()
                        .id(event.getEventId())
                        .name(event.getType().getEventName())
                        .data(event));
            } catch (IOException | IllegalStateException e) {
                subscribers.remove(emitter);
                log.debug("Dropped alert subscriber after failed send: {}", e.getMessage());
            }
        }
        if (fraudEventProducer != null) {
            fraudEventProducer.send(event);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @PreDestroy
    void shutdown() {
        subscribers.forEach(SseEmitter::complete);
        subscribers.clear();
        if (dispatcher instanceof ExecutorService) {
            ((ExecutorService) dispatcher).shutdown();
        }
    }
}
