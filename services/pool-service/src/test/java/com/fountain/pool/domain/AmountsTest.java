package com.fountain.pool.domain;

import com.fountain.pool.exception.InvalidAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Amounts Tests")
class AmountsTest {

    @Test
    @DisplayName("Should normalize whole amounts to scale zero")
    void shouldNormalizeScale() {
        assertThat(Amounts.requirePositiveUnits(new BigDecimal("25.00")).scale()).isZero();
        assertThat(Amounts.requirePositiveUnits(new BigDecimal("1E+2"))).isEqualTo(new BigDecimal("100"));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"0", "-5", "2.5", "0.01"})
    @DisplayName("Should reject null, non-positive and fractional amounts")
    void shouldRejectInvalidAmounts(BigDecimal amount) {
        assertThat(Amounts.isPositiveUnits(amount)).isFalse();
        assertThatThrownBy(() -> Amounts.requirePositiveUnits(amount))
                .isInstanceOf(InvalidAmountException.class);
    }
}
