package de.mirkosertic.docmirror.testsupport;

import de.mirkosertic.docmirror.store.PropertyStore;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Map-backed property store for tests.
 */
public class InMemoryPropertyStore implements PropertyStore {

    private final Map<String, String> properties = new LinkedHashMap<>();
    private int writes;

    @Override
    public synchronized @Nullable String getProperty(final String key) {
        return properties.get(key);
    }

    @Override
    public synchronized void setProperty(final String key, final String value) {
        properties.put(key, value);
        writes++;
    }

    @Override
    public synchronized void deleteProperty(final String key) {
        properties.remove(key);
        writes++;
    }

    @Override
    public synchronized void deleteAllProperties() {
        properties.clear();
        writes++;
    }

    @Override
    public synchronized Set<String> keys() {
        return new TreeSet<>(properties.keySet());
    }

    public synchronized int getWrites() {
        return writes;
    }
}
