package de.mirkosertic.docmirror.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a document tree from a YAML file.
 * <p>
 * Expected layout:
 * <pre>
 * document:
 *   id: handbook
 *   nodes:
 *     - id: t.intro
 *       title: Introduction
 *       content: |
 *         Some text
 *       children:
 *         - id: t.scope
 *           title: Scope
 *           content: ...
 *     - id: t.sketch
 *       kind: other        # ignored
 * </pre>
 * The file is re-read on every call so that edits between runs are picked up.
 */
public class YamlSourceTreeReader implements SourceTreeReader {

    private static final Logger logger = LoggerFactory.getLogger(YamlSourceTreeReader.class);

    private final Path sourceFile;

    public YamlSourceTreeReader(final Path sourceFile) {
        this.sourceFile = sourceFile;
    }

    @Override
    public String documentId() throws IOException {
        final Object id = loadDocument().get("id");
        if (id == null || id.toString().isBlank()) {
            throw new IOException("Source file " + sourceFile + " has no document.id");
        }
        return id.toString();
    }

    @Override
    public List<SourceNode> listTopLevelNodes() throws IOException {
        final List<SourceNode> nodes = parseNodes(loadDocument().get("nodes"), "document.nodes");
        logger.debug("Read {} top-level nodes from {}", nodes.size(), sourceFile);
        return nodes;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> loadDocument() throws IOException {
        if (!Files.exists(sourceFile)) {
            throw new IOException("Source file does not exist: " + sourceFile);
        }
        try (final Reader reader = Files.newBufferedReader(sourceFile, StandardCharsets.UTF_8)) {
            final Object root = new Yaml().load(reader);
            if (!(root instanceof Map<?, ?> rootMap) || !(rootMap.get("document") instanceof Map<?, ?> document)) {
                throw new IOException("Source file " + sourceFile + " has no top-level 'document' mapping");
            }
            return (Map<String, Object>) document;
        } catch (final YAMLException e) {
            throw new IOException("Failed to parse source file " + sourceFile, e);
        }
    }

    private List<SourceNode> parseNodes(final Object raw, final String location) throws IOException {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new IOException("Expected a list at " + location + " in " + sourceFile);
        }

        final List<SourceNode> result = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            final String itemLocation = location + "[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> item)) {
                throw new IOException("Expected a mapping at " + itemLocation + " in " + sourceFile);
            }

            final NodeKind kind = NodeKind.parse(asString(item.get("kind")));
            if (kind != NodeKind.DOCUMENT) {
                logger.debug("Ignoring node of kind '{}' at {}", item.get("kind"), itemLocation);
                continue;
            }

            final String id = asString(item.get("id"));
            if (id == null || id.isBlank()) {
                throw new IOException("Node at " + itemLocation + " in " + sourceFile + " has no id");
            }

            result.add(new SourceNode(
                    id,
                    asString(item.get("title")),
                    asString(item.get("content")),
                    kind,
                    parseNodes(item.get("children"), itemLocation + ".children")));
        }
        return result;
    }

    private static String asString(final Object value) {
        return value == null ? null : value.toString();
    }
}
