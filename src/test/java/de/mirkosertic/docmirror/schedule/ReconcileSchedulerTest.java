package de.mirkosertic.docmirror.schedule;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReconcileScheduler Tests")
class ReconcileSchedulerTest {

    private static final Duration INTERVAL = Duration.ofMillis(20);

    private ReconcileScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ReconcileScheduler();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Should run a registered task repeatedly")
    void shouldRunRepeatedly() throws InterruptedException {
        final CountDownLatch latch = new CountDownLatch(3);

        scheduler.register("reconcile", latch::countDown, Duration.ZERO, INTERVAL);

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.registeredNames()).containsExactly("reconcile");
    }

    @Test
    @DisplayName("Should replace an existing registration with the same name")
    void shouldReplaceRegistration() throws InterruptedException {
        // Given
        final AtomicInteger oldRuns = new AtomicInteger();
        scheduler.register("reconcile", oldRuns::incrementAndGet, Duration.ofHours(1), Duration.ofHours(1));
        final CountDownLatch latch = new CountDownLatch(2);

        // When
        scheduler.register("reconcile", latch::countDown, Duration.ZERO, INTERVAL);

        // Then
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(oldRuns.get()).isZero();
        assertThat(scheduler.registeredNames()).hasSize(1);
    }

    @Test
    @DisplayName("Should keep running after a task throws")
    void shouldSurviveFailingTask() throws InterruptedException {
        final AtomicInteger attempts = new AtomicInteger();
        final CountDownLatch latch = new CountDownLatch(3);

        scheduler.register("reconcile", () -> {
            latch.countDown();
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        }, Duration.ZERO, INTERVAL);

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(attempts.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    @DisplayName("Should cancel a registration")
    void shouldCancel() {
        scheduler.register("reconcile", () -> { }, Duration.ofHours(1));

        assertThat(scheduler.cancel("reconcile")).isTrue();
        assertThat(scheduler.cancel("reconcile")).isFalse();
        assertThat(scheduler.registeredNames()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive interval")
    void shouldRejectInvalidInterval() {
        assertThatThrownBy(() -> scheduler.register("reconcile", () -> { }, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should terminate after shutdown")
    void shouldTerminate() throws InterruptedException {
        scheduler.register("reconcile", () -> { }, Duration.ZERO, INTERVAL);

        scheduler.shutdown();

        assertThat(scheduler.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(scheduler.registeredNames()).isEmpty();
    }
}
