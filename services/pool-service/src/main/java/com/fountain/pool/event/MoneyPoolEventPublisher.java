package com.fountain.pool.event;

import com.fountain.common.event.DomainEvent;
import com.fountain.common.event.EventPublisher;
import com.fountain.pool.config.FountainProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Notification sink for committed ledger changes.
 *
 * Events go to in-process listeners through Spring's application events and,
 * when enabled, to Kafka. A failing listener or broker never undoes the
 * operation that produced the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MoneyPoolEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final ObjectProvider<EventPublisher> kafkaEventPublisher;
    private final FountainProperties properties;

    public void publishAll(List<DomainEvent> events) {
        events.forEach(this::publish);
    }

    public void publish(DomainEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Listener failed for event: type={}, eventId={}", event.getEventType(), event.getEventId(), e);
        }

        if (properties.getEvents().isKafkaEnabled()) {
            EventPublisher publisher = kafkaEventPublisher.getIfAvailable();
            if (publisher == null) {
                log.warn("Kafka forwarding enabled but no EventPublisher is available, dropping {}", event.getEventType());
                return;
            }
            publisher.publishDomainEvent(properties.getEvents().getTopic(), event);
        }
    }
}
