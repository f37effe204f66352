package com.fountain.common.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConcurrencyUtils Tests")
class ConcurrencyUtilsTest {

    @Test
    @DisplayName("Should run the action under the lock and release it afterwards")
    void shouldRunUnderLock() {
        ReentrantLock lock = new ReentrantLock();

        Boolean heldInside = ConcurrencyUtils.withLock(lock, "test", Duration.ofSeconds(1), lock::isHeldByCurrentThread);

        assertThat(heldInside).isTrue();
        assertThat(lock.isLocked()).isFalse();
    }

    @Test
    @DisplayName("Should release the lock when the action fails")
    void shouldReleaseOnFailure() {
        ReentrantLock lock = new ReentrantLock();

        assertThatThrownBy(() -> ConcurrencyUtils.withLock(lock, "test", Duration.ofSeconds(1), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(lock.isLocked()).isFalse();
    }

    @Test
    @DisplayName("Should time out while another thread holds the lock")
    void shouldTimeOut() throws Exception {
        // Given
        ReentrantLock lock = new ReentrantLock();
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            executor.submit(() -> {
                lock.lock();
                try {
                    locked.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } finally {
                    lock.unlock();
                }
                return null;
            });
            assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

            // When / Then
            assertThatThrownBy(() -> ConcurrencyUtils.withLock(lock, "ledger", Duration.ofMillis(50), () -> "never"))
                    .isInstanceOf(LockTimeoutException.class)
                    .satisfies(e -> {
                        LockTimeoutException timeout = (LockTimeoutException) e;
                        assertThat(timeout.getLockName()).isEqualTo("ledger");
                        assertThat(timeout.getWaitTime()).isEqualTo(Duration.ofMillis(50));
                    });
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }
}
