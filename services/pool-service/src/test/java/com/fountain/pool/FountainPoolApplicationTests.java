package com.fountain.pool;

import com.fountain.pool.config.FountainProperties;
import com.fountain.pool.dto.MoneyPoolDto;
import com.fountain.pool.event.ContributionRecordedEvent;
import com.fountain.pool.event.MoneyPoolActivatedEvent;
import com.fountain.pool.integration.InMemoryAssetCustody;
import com.fountain.pool.service.FountainService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@RecordApplicationEvents
@DisplayName("Pool Service Application Tests")
class FountainPoolApplicationTests {

    @Autowired
    private FountainService fountainService;

    @Autowired
    private InMemoryAssetCustody custody;

    @Autowired
    private FountainProperties properties;

    @Autowired
    private ApplicationEvents applicationEvents;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private void actAs(String account) {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(account, "n/a", List.of()));
    }

    @Test
    @DisplayName("Should bind test properties")
    void shouldBindProperties() {
        assertThat(properties.getLockTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(properties.getEvents().isKafkaEnabled()).isFalse();
        assertThat(properties.getEvents().getTopic()).isEqualTo("fountain-pool-events");
    }

    @Test
    @DisplayName("Should run a funding round through the wired context")
    void shouldFundAndTapThroughContext() {
        // Arrange
        custody.deposit("DAI", "wired-sustainer", new BigDecimal("500"));
        actAs("wired-owner");
        MoneyPoolDto pool = fountainService.configure(new BigDecimal("100"), 3600, "DAI");

        // Act
        actAs("wired-sustainer");
        long number = fountainService.contribute("wired-owner", new BigDecimal("120"));
        actAs("wired-owner");
        MoneyPoolDto tapped = fountainService.tap(number, new BigDecimal("100"));

        // Assert
        assertThat(number).isEqualTo(pool.getNumber());
        assertThat(tapped.getSurplus()).isEqualByComparingTo("20");
        assertThat(tapped.getTappableAmount()).isEqualByComparingTo("0");
        assertThat(custody.balanceOf("DAI", "wired-owner")).isEqualByComparingTo("100");
        assertThat(fountainService.getUnclaimedShare(number, "wired-sustainer")).isEqualByComparingTo("20");
        assertThat(applicationEvents.stream(MoneyPoolActivatedEvent.class)).hasSize(1);
        assertThat(applicationEvents.stream(ContributionRecordedEvent.class)).hasSize(1);
    }
}
