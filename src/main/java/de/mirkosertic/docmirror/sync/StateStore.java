package de.mirkosertic.docmirror.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.docmirror.store.PropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Loads and saves the {@link SyncState} as a single JSON blob in the {@link PropertyStore}.
 * <p>
 * Saves are expected after every mutation of an entry, so that a run killed midway loses at
 * most the update of the node it was working on. A blob that fails to parse is treated as
 * "no previous state": the run starts fresh and re-exports instead of aborting.
 */
public class StateStore {

    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    public static final String STATE_KEY = "sync_state";
    public static final String LAST_RUN_KEY = "last_run_at";

    private static final TypeReference<LinkedHashMap<String, TrackedEntry>> STATE_TYPE = new TypeReference<>() {
    };

    private final PropertyStore propertyStore;
    private final ObjectMapper objectMapper;

    public StateStore(final PropertyStore propertyStore) {
        this.propertyStore = propertyStore;
        this.objectMapper = new ObjectMapper();
    }

    public SyncState load() {
        final String json = propertyStore.getProperty(STATE_KEY);
        if (json == null || json.isBlank()) {
            logger.debug("No stored sync state, starting empty");
            return new SyncState();
        }
        try {
            final LinkedHashMap<String, TrackedEntry> entries = objectMapper.readValue(json, STATE_TYPE);
            if (entries == null) {
                return new SyncState();
            }
            entries.values().removeIf(entry -> entry == null);
            logger.debug("Loaded sync state with {} tracked nodes", entries.size());
            return new SyncState(entries);
        } catch (final JsonProcessingException e) {
            logger.warn("Stored sync state is unreadable, starting fresh: {}", e.getOriginalMessage());
            return new SyncState();
        }
    }

    public void save(final SyncState state) {
        try {
            propertyStore.setProperty(STATE_KEY, objectMapper.writeValueAsString(state.asMap()));
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sync state", e);
        }
    }

    public void recordRun(final Instant completedAt) {
        propertyStore.setProperty(LAST_RUN_KEY, Long.toString(completedAt.toEpochMilli()));
    }

    public Optional<Instant> lastRunAt() {
        final String value = propertyStore.getProperty(LAST_RUN_KEY);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value.trim())));
        } catch (final NumberFormatException e) {
            logger.debug("Ignoring malformed last-run timestamp '{}'", value);
            return Optional.empty();
        }
    }
}
