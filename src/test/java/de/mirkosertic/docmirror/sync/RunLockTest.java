package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.testsupport.InMemoryPropertyStore;
import de.mirkosertic.docmirror.testsupport.MutableClock;
import de.mirkosertic.docmirror.testsupport.RecordingAuditSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RunLock Tests")
class RunLockTest {

    private InMemoryPropertyStore properties;
    private MutableClock clock;
    private RecordingAuditSink audit;
    private RunLock lock;

    @BeforeEach
    void setUp() {
        properties = new InMemoryPropertyStore();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        audit = new RecordingAuditSink();
        lock = new RunLock(properties, Duration.ofMinutes(9), clock, audit);
    }

    @Test
    @DisplayName("Should acquire a free lock and store the current time")
    void shouldAcquireFreeLock() {
        assertThat(lock.acquire()).isTrue();
        assertThat(properties.getProperty(RunLock.LOCK_KEY)).isEqualTo(Long.toString(clock.millis()));
        assertThat(lock.isHeld()).isTrue();
        assertThat(audit.getEntries()).isEmpty();
    }

    @Test
    @DisplayName("Should refuse a second acquisition while the lock is live")
    void shouldBeExclusive() {
        assertThat(lock.acquire()).isTrue();
        clock.advance(Duration.ofMinutes(8));

        assertThat(lock.acquire()).isFalse();
    }

    @Test
    @DisplayName("Should take over a lock older than the timeout")
    void shouldTakeOverStaleLock() {
        // Given
        assertThat(lock.acquire()).isTrue();
        clock.advance(Duration.ofMinutes(9).plusMillis(1));

        // When
        final boolean acquired = lock.acquire();

        // Then
        assertThat(acquired).isTrue();
        assertThat(properties.getProperty(RunLock.LOCK_KEY)).isEqualTo(Long.toString(clock.millis()));
        assertThat(audit.getEntries()).containsExactly(
                new RecordingAuditSink.Entry("System", "Stale lock detected. Taking over.", "Warning"));
    }

    @Test
    @DisplayName("Should treat an unreadable lock value as stale")
    void shouldTakeOverUnreadableLock() {
        properties.setProperty(RunLock.LOCK_KEY, "yesterday");

        assertThat(lock.acquire()).isTrue();
        assertThat(audit.getEntries()).hasSize(1);
    }

    @Test
    @DisplayName("Should allow acquisition again after release")
    void shouldReleaseLock() {
        assertThat(lock.acquire()).isTrue();

        lock.release();

        assertThat(properties.getProperty(RunLock.LOCK_KEY)).isNull();
        assertThat(lock.isHeld()).isFalse();
        assertThat(lock.acquire()).isTrue();
    }
}
