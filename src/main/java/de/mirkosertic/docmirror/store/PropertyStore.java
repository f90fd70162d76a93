package de.mirkosertic.docmirror.store;

import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * Flat, durable key/value store holding everything a reconciliation run needs to remember
 * between invocations: the run lock, the serialized sync state, per-node content fingerprints
 * and the last-run timestamp.
 * <p>
 * Implementations must make each mutation durable before returning and must never leave a
 * partially written record behind. Access is serialized by the run lock, so implementations
 * need not coordinate between processes.
 */
public interface PropertyStore {

    @Nullable
    String getProperty(String key);

    void setProperty(String key, String value);

    void deleteProperty(String key);

    void deleteAllProperties();

    Set<String> keys();
}
