package de.mirkosertic.docmirror.store;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link PropertyStore} backed by a single YAML file, e.g. {@code ~/.docmirror/state.yaml}.
 * <p>
 * The whole map is kept in memory and rewritten on every mutation. Writes go to a sibling
 * temp file which is then moved over the target, so a crash during a write leaves the
 * previous version intact. An unreadable file is logged and treated as empty.
 * <p>
 * Changes written by another process are picked up on the next access, detected through the
 * file's modification time, so the run lock is visible across processes sharing the file.
 */
public class FilePropertyStore implements PropertyStore {

    private static final Logger logger = LoggerFactory.getLogger(FilePropertyStore.class);

    private final Path file;
    private final Yaml yaml;
    private final Map<String, String> properties;
    private @Nullable FileTime loadedModified;

    public FilePropertyStore(final Path file) {
        this.file = file;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
        this.properties = new LinkedHashMap<>();
        reloadIfChanged();
    }

    @Override
    public synchronized @Nullable String getProperty(final String key) {
        reloadIfChanged();
        return properties.get(key);
    }

    @Override
    public synchronized void setProperty(final String key, final String value) {
        reloadIfChanged();
        properties.put(key, value);
        persist();
    }

    @Override
    public synchronized void deleteProperty(final String key) {
        reloadIfChanged();
        if (properties.remove(key) != null) {
            persist();
        }
    }

    @Override
    public synchronized void deleteAllProperties() {
        properties.clear();
        persist();
        logger.info("Cleared all properties in {}", file);
    }

    @Override
    public synchronized Set<String> keys() {
        reloadIfChanged();
        return new TreeSet<>(properties.keySet());
    }

    public Path getFile() {
        return file;
    }

    private void reloadIfChanged() {
        final FileTime modified = modificationTime();
        if (modified == null || modified.equals(loadedModified)) {
            return;
        }
        properties.clear();
        properties.putAll(load());
        loadedModified = modified;
    }

    private @Nullable FileTime modificationTime() {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file) : null;
        } catch (final IOException e) {
            logger.debug("Could not read modification time of {}", file, e);
            return null;
        }
    }

    private Map<String, String> load() {
        final Map<String, String> result = new LinkedHashMap<>();

        try (final Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            final Object loaded = yaml.load(reader);
            if (loaded instanceof Map<?, ?> map) {
                for (final Map.Entry<?, ?> entry : map.entrySet()) {
                    if (entry.getKey() != null && entry.getValue() != null) {
                        result.put(entry.getKey().toString(), entry.getValue().toString());
                    }
                }
            } else if (loaded != null) {
                logger.warn("Property file {} does not contain a map, starting empty", file);
            }
            logger.debug("Loaded {} properties from {}", result.size(), file);
        } catch (final IOException | YAMLException e) {
            logger.warn("Failed to read property file {}, starting empty", file, e);
        }
        return result;
    }

    private void persist() {
        try {
            final Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (final Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                yaml.dump(new LinkedHashMap<>(properties), writer);
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            loadedModified = modificationTime();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to write property file " + file, e);
        }
    }
}
