package com.fountain.common.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventPublisher Tests")
class EventPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private ObjectMapper objectMapper;

    private EventPublisher eventPublisher;

    static class SampleEvent extends AbstractDomainEvent {
        SampleEvent() {
            super(Instant.ofEpochSecond(1000));
        }

        @Override
        public String getAggregateId() {
            return "alice";
        }
    }

    @BeforeEach
    void setUp() {
        eventPublisher = new EventPublisher(kafkaTemplate, objectMapper);
    }

    @Test
    @DisplayName("Should send the serialized event keyed by its aggregate")
    void shouldSendKeyedJson() throws Exception {
        // Arrange
        SampleEvent event = new SampleEvent();
        when(objectMapper.writeValueAsString(event)).thenReturn("{\"eventType\":\"SampleEvent\"}");

        // Act
        boolean published = eventPublisher.publishDomainEvent("fountain-pool-events", event);

        // Assert
        assertThat(published).isTrue();
        assertThat(event.getEventType()).isEqualTo("SampleEvent");
        verify(kafkaTemplate).send("fountain-pool-events", "alice", "{\"eventType\":\"SampleEvent\"}");
    }

    @Test
    @DisplayName("Should report serialization failures without throwing")
    void shouldSwallowSerializationFailure() throws Exception {
        // Arrange
        SampleEvent event = new SampleEvent();
        when(objectMapper.writeValueAsString(event)).thenThrow(new JsonProcessingException("unserializable") {
        });

        // Act
        boolean published = eventPublisher.publishDomainEvent("fountain-pool-events", event);

        // Assert
        assertThat(published).isFalse();
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
