package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.audit.AuditSink;
import de.mirkosertic.docmirror.store.PropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Advisory mutex against overlapping runs, stored as a timestamp in the {@link PropertyStore}.
 * <p>
 * A lock younger than the timeout is live and makes {@link #acquire()} fail. An older one is
 * assumed to belong to a run that was killed before it could release it, and is taken over.
 * The timeout therefore has to exceed the longest possible run by a safety margin.
 */
public class RunLock {

    private static final Logger logger = LoggerFactory.getLogger(RunLock.class);

    public static final String LOCK_KEY = "run_lock";

    private final PropertyStore propertyStore;
    private final Duration timeout;
    private final Clock clock;
    private final AuditSink auditSink;

    public RunLock(final PropertyStore propertyStore, final Duration timeout, final Clock clock, final AuditSink auditSink) {
        this.propertyStore = propertyStore;
        this.timeout = timeout;
        this.clock = clock;
        this.auditSink = auditSink;
    }

    /**
     * @return {@code true} if the lock is now held by the caller, {@code false} if a live lock exists
     */
    public boolean acquire() {
        final long now = clock.millis();
        final String lockValue = propertyStore.getProperty(LOCK_KEY);

        if (lockValue != null) {
            final long lockTime = parseTimestamp(lockValue);
            final long age = now - lockTime;
            if (lockTime > 0 && age < timeout.toMillis()) {
                logger.debug("Live lock found (age {} ms, timeout {} ms)", age, timeout.toMillis());
                return false;
            }
            logger.warn("Stale lock detected (value '{}'). Taking over.", lockValue);
            auditSink.record("System", "Stale lock detected. Taking over.", "Warning");
        }

        propertyStore.setProperty(LOCK_KEY, Long.toString(now));
        return true;
    }

    public void release() {
        propertyStore.deleteProperty(LOCK_KEY);
    }

    public boolean isHeld() {
        final String lockValue = propertyStore.getProperty(LOCK_KEY);
        return lockValue != null && clock.millis() - parseTimestamp(lockValue) < timeout.toMillis();
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static long parseTimestamp(final String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            return 0L;
        }
    }
}
