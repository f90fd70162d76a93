package de.mirkosertic.docmirror.destination;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * {@link DestinationBackend} on a local directory tree.
 * <p>
 * Items get a random id the first time they are created or listed. The id to path mapping is
 * kept in {@code .docmirror-index.yaml} inside the root directory and follows renames and moves
 * performed through this backend. Items changed behind its back (deleted or renamed by hand)
 * resolve to {@link BackendResult.Status#NOT_FOUND}.
 * <p>
 * A local item has exactly one parent: {@link #removeFromParent} parks the item below
 * {@code .detached/} and {@link #addToParent} moves it into the target folder. Trashed items
 * are moved below {@code .trash/} and are no longer resolvable.
 * <p>
 * A directory cannot hold two entries with the same name. When a rename or move targets a
 * name that is already taken, the occupant is renamed to {@code <name> (displaced N)} first,
 * keeping its id. Its own rename later in the same run usually frees the name again.
 * <p>
 * The bookkeeping entries ({@code .trash}, {@code .detached}, the index) are hidden only in the
 * root directory. In-flight writes use the {@value #TEMP_PREFIX} prefix and are hidden everywhere.
 */
public class LocalFolderBackend implements DestinationBackend {

    private static final Logger logger = LoggerFactory.getLogger(LocalFolderBackend.class);

    static final String ROOT_ID = "root";
    static final String INDEX_FILE = ".docmirror-index.yaml";
    static final String TRASH_DIR = ".trash";
    static final String DETACHED_DIR = ".detached";

    static final String TEMP_PREFIX = ".docmirror-tmp-";

    private static final Set<String> RESERVED_NAMES = Set.of(INDEX_FILE, INDEX_FILE + ".tmp", TRASH_DIR, DETACHED_DIR);

    private final Path root;
    private final Path indexFile;
    private final Yaml yaml;

    /** Item id -> path relative to the root, '/' separated. */
    private final Map<String, String> index;

    public LocalFolderBackend(final Path root) throws IOException {
        this.root = root.toAbsolutePath().normalize();
        this.indexFile = this.root.resolve(INDEX_FILE);
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        this.yaml = new Yaml(options);

        Files.createDirectories(this.root);
        this.index = loadIndex();
        logger.info("Local destination initialized at {} ({} known items)", this.root, index.size());
    }

    @Override
    public String rootFolderId() {
        return ROOT_ID;
    }

    @Override
    public synchronized BackendResult<ItemRef> getFile(final String fileId) {
        return resolveItem(fileId, ItemType.FILE);
    }

    @Override
    public synchronized BackendResult<ItemRef> getFolder(final String folderId) {
        return resolveItem(folderId, ItemType.FOLDER);
    }

    @Override
    public synchronized BackendResult<ItemRef> createFolder(final String parentId, final String name) {
        final BackendResult<Path> parent = resolveFolderPath(parentId);
        if (!parent.isOk()) {
            return parent.propagate();
        }
        final Path target = parent.value().resolve(name);
        try {
            if (Files.isRegularFile(target)) {
                return BackendResult.transientError("A file named '" + name + "' already occupies " + target);
            }
            Files.createDirectories(target);
            return BackendResult.ok(new ItemRef(idFor(target), name, ItemType.FOLDER));
        } catch (final IOException e) {
            return ioFailure("create folder " + target, e);
        }
    }

    @Override
    public synchronized BackendResult<ItemRef> createFile(final String parentId, final String name, final byte[] content) {
        final BackendResult<Path> parent = resolveFolderPath(parentId);
        if (!parent.isOk()) {
            return parent.propagate();
        }
        final Path target = parent.value().resolve(name);
        try {
            if (Files.isDirectory(target)) {
                return BackendResult.transientError("A folder named '" + name + "' already occupies " + target);
            }
            final Path temp = target.resolveSibling(TEMP_PREFIX + name);
            Files.write(temp, content);
            moveReplacing(temp, target);

            // A file written over an existing one is a new item
            final String relative = relativize(target);
            index.values().removeIf(relative::equals);
            final String id = newId();
            index.put(id, relative);
            saveIndex();
            return BackendResult.ok(new ItemRef(id, name, ItemType.FILE));
        } catch (final IOException e) {
            return ioFailure("create file " + target, e);
        }
    }

    @Override
    public synchronized BackendResult<Void> rename(final String itemId, final String newName) {
        if (ROOT_ID.equals(itemId)) {
            return BackendResult.transientError("The root folder cannot be renamed");
        }
        final BackendResult<Path> current = resolvePath(itemId);
        if (!current.isOk()) {
            return current.propagate();
        }
        final Path source = current.value();
        final Path target = source.resolveSibling(newName);
        if (source.equals(target)) {
            return BackendResult.ok();
        }
        try {
            displaceOccupant(source, target);
            Files.move(source, target);
            rebase(relativize(source), relativize(target));
            return BackendResult.ok();
        } catch (final IOException e) {
            return ioFailure("rename " + source + " to " + newName, e);
        }
    }

    @Override
    public synchronized BackendResult<Void> trash(final String itemId) {
        if (ROOT_ID.equals(itemId)) {
            return BackendResult.transientError("The root folder cannot be trashed");
        }
        final BackendResult<Path> current = resolvePath(itemId);
        if (!current.isOk()) {
            return current.propagate();
        }
        final Path source = current.value();
        final Path target = root.resolve(TRASH_DIR).resolve(itemId).resolve(source.getFileName());
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target);
            forgetSubtree(relativize(source));
            logger.debug("Trashed {}", source);
            return BackendResult.ok();
        } catch (final IOException e) {
            return ioFailure("trash " + source, e);
        }
    }

    @Override
    public synchronized BackendResult<List<ItemRef>> listChildren(final String folderId) {
        final BackendResult<Path> folder = resolveFolderPath(folderId);
        if (!folder.isOk()) {
            return folder.propagate();
        }
        final List<ItemRef> children = new ArrayList<>();
        try (final Stream<Path> entries = Files.list(folder.value())) {
            final List<Path> sorted = entries
                    .filter(path -> !isReserved(path))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
            for (final Path path : sorted) {
                final ItemType type = Files.isDirectory(path) ? ItemType.FOLDER : ItemType.FILE;
                children.add(new ItemRef(idFor(path), path.getFileName().toString(), type));
            }
            return BackendResult.ok(children);
        } catch (final IOException e) {
            return ioFailure("list " + folder.value(), e);
        }
    }

    @Override
    public synchronized BackendResult<List<String>> listParents(final String itemId) {
        final BackendResult<Path> current = resolvePath(itemId);
        if (!current.isOk()) {
            return current.propagate();
        }
        final Path path = current.value();
        if (ROOT_ID.equals(itemId) || path.startsWith(root.resolve(DETACHED_DIR))) {
            return BackendResult.ok(List.of());
        }
        try {
            return BackendResult.ok(List.of(idFor(path.getParent())));
        } catch (final IOException e) {
            return ioFailure("resolve parent of " + path, e);
        }
    }

    @Override
    public synchronized BackendResult<Void> addToParent(final String itemId, final String parentId) {
        final BackendResult<Path> current = resolvePath(itemId);
        if (!current.isOk()) {
            return current.propagate();
        }
        final BackendResult<Path> parent = resolveFolderPath(parentId);
        if (!parent.isOk()) {
            return parent.propagate();
        }
        final Path source = current.value();
        final Path target = parent.value().resolve(source.getFileName());
        if (source.equals(target)) {
            return BackendResult.ok();
        }
        if (target.startsWith(source)) {
            return BackendResult.transientError("Cannot move " + source + " into itself");
        }
        try {
            displaceOccupant(source, target);
            Files.move(source, target);
            rebase(relativize(source), relativize(target));
            cleanupDetached(source);
            return BackendResult.ok();
        } catch (final IOException e) {
            return ioFailure("move " + source + " to " + target, e);
        }
    }

    @Override
    public synchronized BackendResult<Void> removeFromParent(final String itemId, final String parentId) {
        final BackendResult<Path> current = resolvePath(itemId);
        if (!current.isOk()) {
            return current.propagate();
        }
        final BackendResult<Path> parent = resolveFolderPath(parentId);
        if (!parent.isOk()) {
            return parent.propagate();
        }
        final Path source = current.value();
        if (!parent.value().equals(source.getParent())) {
            // Not a member of that parent, nothing to remove
            return BackendResult.ok();
        }
        final Path target = root.resolve(DETACHED_DIR).resolve(itemId).resolve(source.getFileName());
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target);
            rebase(relativize(source), relativize(target));
            return BackendResult.ok();
        } catch (final IOException e) {
            return ioFailure("detach " + source, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    private BackendResult<ItemRef> resolveItem(final String itemId, final ItemType expectedType) {
        final BackendResult<Path> resolved = resolvePath(itemId);
        if (!resolved.isOk()) {
            return resolved.propagate();
        }
        final Path path = resolved.value();
        final boolean isFolder = Files.isDirectory(path);
        if (isFolder != (expectedType == ItemType.FOLDER)) {
            return BackendResult.notFound("Item " + itemId + " is not a " + expectedType.name().toLowerCase());
        }
        final String name = ROOT_ID.equals(itemId) ? "" : path.getFileName().toString();
        return BackendResult.ok(new ItemRef(itemId, name, expectedType));
    }

    private BackendResult<Path> resolveFolderPath(final String folderId) {
        final BackendResult<Path> resolved = resolvePath(folderId);
        if (resolved.isOk() && !Files.isDirectory(resolved.value())) {
            return BackendResult.notFound("Item " + folderId + " is not a folder");
        }
        return resolved;
    }

    private BackendResult<Path> resolvePath(final String itemId) {
        if (ROOT_ID.equals(itemId)) {
            return BackendResult.ok(root);
        }
        final String relative = index.get(itemId);
        if (relative == null) {
            return BackendResult.notFound("Unknown item id " + itemId);
        }
        final Path path = root.resolve(relative);
        if (!Files.exists(path)) {
            return BackendResult.notFound("Item " + itemId + " no longer exists at " + path);
        }
        return BackendResult.ok(path);
    }

    private String idFor(final Path path) throws IOException {
        if (path.equals(root)) {
            return ROOT_ID;
        }
        final String relative = relativize(path);
        for (final Map.Entry<String, String> entry : index.entrySet()) {
            if (entry.getValue().equals(relative)) {
                return entry.getKey();
            }
        }
        final String id = newId();
        index.put(id, relative);
        saveIndex();
        return id;
    }

    /**
     * Frees {@code target} for {@code source} by renaming whatever occupies it. A case-only
     * rename on a case-insensitive file system leaves the target alone.
     */
    private void displaceOccupant(final Path source, final Path target) throws IOException {
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS) || Files.isSameFile(source, target)) {
            return;
        }
        final Path aside = displacedName(target);
        Files.move(target, aside);
        rebase(relativize(target), relativize(aside));
        logger.info("Renamed {} to {} to make room", target, aside.getFileName());
    }

    private static Path displacedName(final Path target) {
        final String name = target.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        final boolean splitExtension = dot > 0 && Files.isRegularFile(target);
        final String stem = splitExtension ? name.substring(0, dot) : name;
        final String extension = splitExtension ? name.substring(dot) : "";
        int counter = 1;
        Path candidate;
        do {
            candidate = target.resolveSibling(stem + " (displaced " + counter + ")" + extension);
            counter++;
        } while (Files.exists(candidate, LinkOption.NOFOLLOW_LINKS));
        return candidate;
    }

    private void rebase(final String oldRelative, final String newRelative) throws IOException {
        final String prefix = oldRelative + "/";
        for (final Map.Entry<String, String> entry : index.entrySet()) {
            final String value = entry.getValue();
            if (value.equals(oldRelative)) {
                entry.setValue(newRelative);
            } else if (value.startsWith(prefix)) {
                entry.setValue(newRelative + "/" + value.substring(prefix.length()));
            }
        }
        saveIndex();
    }

    private void forgetSubtree(final String relative) throws IOException {
        final String prefix = relative + "/";
        index.values().removeIf(value -> value.equals(relative) || value.startsWith(prefix));
        saveIndex();
    }

    private void cleanupDetached(final Path formerLocation) {
        final Path detached = root.resolve(DETACHED_DIR);
        final Path holder = formerLocation.getParent();
        if (holder != null && holder.getParent() != null && holder.getParent().equals(detached)) {
            try {
                Files.deleteIfExists(holder);
            } catch (final IOException e) {
                logger.debug("Could not remove empty detach holder {}: {}", holder, e.getMessage());
            }
        }
    }

    private boolean isReserved(final Path path) {
        final String name = path.getFileName().toString();
        if (name.startsWith(TEMP_PREFIX)) {
            return true;
        }
        return root.equals(path.getParent()) && RESERVED_NAMES.contains(name);
    }

    private String relativize(final Path path) {
        final Path relative = root.relativize(path.toAbsolutePath().normalize());
        final List<String> segments = new ArrayList<>();
        for (final Path segment : relative) {
            segments.add(segment.toString());
        }
        return String.join("/", segments);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    private static void moveReplacing(final Path source, final Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private <T> BackendResult<T> ioFailure(final String action, final IOException e) {
        logger.warn("Failed to {}: {}", action, e.getMessage());
        return BackendResult.transientError("Failed to " + action + ": " + e.getMessage());
    }

    private Map<String, String> loadIndex() {
        final Map<String, String> result = new HashMap<>();
        if (!Files.exists(indexFile)) {
            return result;
        }
        try (final Reader reader = Files.newBufferedReader(indexFile, StandardCharsets.UTF_8)) {
            final Object loaded = yaml.load(reader);
            if (loaded instanceof final Map<?, ?> map) {
                for (final Map.Entry<?, ?> entry : map.entrySet()) {
                    if (entry.getKey() != null && entry.getValue() != null) {
                        result.put(entry.getKey().toString(), entry.getValue().toString());
                    }
                }
            }
        } catch (final IOException | YAMLException e) {
            logger.warn("Failed to read destination index {}, item ids will be reassigned", indexFile, e);
        }
        return result;
    }

    private void saveIndex() throws IOException {
        final Path temp = indexFile.resolveSibling(INDEX_FILE + ".tmp");
        try (final Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            yaml.dump(new LinkedHashMap<>(index), writer);
        }
        moveReplacing(temp, indexFile);
    }

    @Nullable
    String pathOf(final String itemId) {
        return index.get(itemId);
    }
}
