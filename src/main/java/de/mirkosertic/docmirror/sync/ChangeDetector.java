package de.mirkosertic.docmirror.sync;

import de.mirkosertic.docmirror.source.SourceNode;
import de.mirkosertic.docmirror.store.PropertyStore;
import de.mirkosertic.docmirror.util.ContentNormalizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprints per node, stored under {@code hash_<nodeId>} next to the sync state.
 * <p>
 * The fingerprint is the MD5 of the normalized UTF-8 body text, so it is stable across runs,
 * platforms and line-ending conventions. Equal fingerprints mean "content unchanged".
 */
public class ChangeDetector {

    public static final String FINGERPRINT_PREFIX = "hash_";

    private final PropertyStore propertyStore;

    public ChangeDetector(final PropertyStore propertyStore) {
        this.propertyStore = propertyStore;
    }

    public String fingerprint(final SourceNode node) {
        return fingerprint(node.content());
    }

    public String fingerprint(final String content) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("MD5");
            final byte[] hash = digest.digest(ContentNormalizer.normalize(content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }

    /** A node without a stored fingerprint counts as changed. */
    public boolean hasChanged(final String nodeId, final String fingerprint) {
        return !fingerprint.equals(propertyStore.getProperty(key(nodeId)));
    }

    public void remember(final String nodeId, final String fingerprint) {
        propertyStore.setProperty(key(nodeId), fingerprint);
    }

    public void forget(final String nodeId) {
        propertyStore.deleteProperty(key(nodeId));
    }

    static String key(final String nodeId) {
        return FINGERPRINT_PREFIX + nodeId;
    }
}
