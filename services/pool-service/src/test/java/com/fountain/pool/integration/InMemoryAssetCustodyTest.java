package com.fountain.pool.integration;

import com.fountain.pool.exception.TransferFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryAssetCustody Tests")
class InMemoryAssetCustodyTest {

    private InMemoryAssetCustody custody;

    @BeforeEach
    void setUp() {
        custody = new InMemoryAssetCustody();
        custody.deposit("DAI", "bob", new BigDecimal("100"));
    }

    @Test
    @DisplayName("Should move funds into custody and back out")
    void shouldMoveFunds() {
        custody.transferIn("DAI", "bob", new BigDecimal("40"));
        custody.transferOut("DAI", "alice", new BigDecimal("15"));

        assertThat(custody.balanceOf("DAI", "bob")).isEqualByComparingTo("60");
        assertThat(custody.balanceOf("DAI", "alice")).isEqualByComparingTo("15");
        assertThat(custody.custodyBalance("DAI")).isEqualByComparingTo("25");
    }

    @Test
    @DisplayName("Should reject transfers the balances cannot cover")
    void shouldRejectUncoveredTransfers() {
        assertThatThrownBy(() -> custody.transferIn("DAI", "bob", new BigDecimal("101")))
                .isInstanceOf(TransferFailedException.class);
        assertThatThrownBy(() -> custody.transferIn("USDC", "bob", BigDecimal.ONE))
                .isInstanceOf(TransferFailedException.class);
        assertThatThrownBy(() -> custody.transferOut("DAI", "alice", BigDecimal.ONE))
                .isInstanceOf(TransferFailedException.class);

        assertThat(custody.balanceOf("DAI", "bob")).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Should refuse non-positive deposits")
    void shouldRefuseNonPositiveDeposit() {
        assertThatThrownBy(() -> custody.deposit("DAI", "bob", BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
