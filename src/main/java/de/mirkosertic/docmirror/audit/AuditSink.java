package de.mirkosertic.docmirror.audit;

/**
 * Append-only, best-effort record of what a reconciliation run did.
 * <p>
 * Implementations must not throw: audit failures never affect a run.
 */
public interface AuditSink {

    /** Discards every entry. Used when no audit file is configured. */
    AuditSink NONE = (type, message, status) -> {
    };

    /**
     * @param type    action category such as {@code System}, {@code Cleanup}, {@code Info} or {@code Error}
     * @param message human readable description
     * @param status  outcome such as {@code Success}, {@code Warning} or {@code Failed}
     */
    void record(String type, String message, String status);
}
