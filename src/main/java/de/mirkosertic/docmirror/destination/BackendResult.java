package de.mirkosertic.docmirror.destination;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Outcome of a single destination backend call.
 * <p>
 * Backends report failures through this type instead of throwing, so that every call site
 * decides explicitly how to treat a vanished item or a transient error.
 */
public record BackendResult<T>(
        Status status,
        /** Payload of a successful call; null for {@code Void} results and for failures. */
        @Nullable T value,
        /** Failure description; null on success. */
        @Nullable String message
) {

    public enum Status {
        /** The call succeeded. */
        OK,
        /** The referenced item does not exist (deleted, trashed or never created). */
        NOT_FOUND,
        /** The call failed for a reason that may go away on a later attempt. */
        TRANSIENT_ERROR
    }

    public BackendResult {
        Objects.requireNonNull(status, "status");
    }

    public static <T> BackendResult<T> ok(final T value) {
        return new BackendResult<>(Status.OK, value, null);
    }

    public static BackendResult<Void> ok() {
        return new BackendResult<>(Status.OK, null, null);
    }

    public static <T> BackendResult<T> notFound(final String message) {
        return new BackendResult<>(Status.NOT_FOUND, null, message);
    }

    public static <T> BackendResult<T> transientError(final String message) {
        return new BackendResult<>(Status.TRANSIENT_ERROR, null, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isNotFound() {
        return status == Status.NOT_FOUND;
    }

    public boolean isTransientError() {
        return status == Status.TRANSIENT_ERROR;
    }

    /** Re-types a failed result; must not be called on a successful one. */
    public <U> BackendResult<U> propagate() {
        if (status == Status.OK) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new BackendResult<>(status, null, message);
    }
}
