package com.fountain.pool.event;

import com.fountain.common.event.DomainEvent;
import com.fountain.common.event.EventPublisher;
import com.fountain.pool.config.FountainProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MoneyPoolEventPublisher Tests")
class MoneyPoolEventPublisherTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    @Mock
    private ObjectProvider<EventPublisher> kafkaEventPublisherProvider;

    @Mock
    private EventPublisher kafkaEventPublisher;

    private FountainProperties properties;
    private MoneyPoolEventPublisher publisher;

    private final DomainEvent tapped = new FundsTappedEvent(Instant.ofEpochSecond(1000), 1, "alice",
            new BigDecimal("10"), new BigDecimal("10"));
    private final DomainEvent recorded = new ContributionRecordedEvent(Instant.ofEpochSecond(1000), 1, "alice",
            "bob", "bob", new BigDecimal("10"), new BigDecimal("10"));

    @BeforeEach
    void setUp() {
        properties = new FountainProperties();
        publisher = new MoneyPoolEventPublisher(applicationEventPublisher, kafkaEventPublisherProvider, properties);
    }

    @Test
    @DisplayName("Should publish in-process only while Kafka forwarding is off")
    void shouldPublishInProcessOnly() {
        publisher.publishAll(List.of(tapped, recorded));

        verify(applicationEventPublisher).publishEvent(tapped);
        verify(applicationEventPublisher).publishEvent(recorded);
        verifyNoInteractions(kafkaEventPublisherProvider);
    }

    @Test
    @DisplayName("Should forward to the configured topic when Kafka is enabled")
    void shouldForwardToKafka() {
        // Arrange
        properties.getEvents().setKafkaEnabled(true);
        properties.getEvents().setTopic("pools");
        when(kafkaEventPublisherProvider.getIfAvailable()).thenReturn(kafkaEventPublisher);

        // Act
        publisher.publish(tapped);

        // Assert
        verify(kafkaEventPublisher).publishDomainEvent("pools", tapped);
    }

    @Test
    @DisplayName("Should keep publishing after a listener fails")
    void shouldContinueAfterListenerFailure() {
        // Arrange
        doThrow(new IllegalStateException("listener down")).when(applicationEventPublisher).publishEvent(tapped);

        // Act
        publisher.publishAll(List.of(tapped, recorded));

        // Assert
        verify(applicationEventPublisher).publishEvent(recorded);
    }

    @Test
    @DisplayName("Should drop Kafka forwarding when no publisher bean exists")
    void shouldTolerateMissingKafkaPublisher() {
        properties.getEvents().setKafkaEnabled(true);
        when(kafkaEventPublisherProvider.getIfAvailable()).thenReturn(null);

        publisher.publish(recorded);

        verify(applicationEventPublisher).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("Should key pool events by owner")
    void shouldKeyByOwner() {
        assertThat(tapped.getAggregateId()).isEqualTo("alice");
        assertThat(tapped.getEventType()).isEqualTo("FundsTappedEvent");
    }
}
