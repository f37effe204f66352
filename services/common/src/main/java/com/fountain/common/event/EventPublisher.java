package com.fountain.common.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Forwards domain events to Kafka as JSON.
 *
 * Publishing is fire-and-forget: a serialization or broker failure is logged and
 * reported through the return value, it never propagates to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventPublisher {
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Publishes a domain event to Kafka, keyed by its aggregate id
     *
     * @return true if the event was handed to the producer
     */
    public boolean publishDomainEvent(String topic, DomainEvent event) {
        try {
            String eventJson = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(topic, event.getAggregateId(), eventJson);

            log.info("Published domain event: topic={}, type={}, eventId={}",
                    topic, event.getEventType(), event.getEventId());
            return true;
        } catch (Exception e) {
            log.error("Failed to publish domain event: topic={}, type={}",
                    topic, event.getEventType(), e);
            return false;
        }
    }
}
