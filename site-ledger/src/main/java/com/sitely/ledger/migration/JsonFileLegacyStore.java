package com.sitely.ledger.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Legacy key-value blobs exported to a single JSON object file, e.g.
 * <pre>
 * { "@sites": "[{...}]", "@workers": "[{...}]", "@language": "hi" }
 * </pre>
 * Values are normally JSON-encoded strings; a value stored as raw JSON is
 * handed back re-serialised. A missing file is an empty store.
 *
 * Writes go to a sibling temp file that is then moved over the original.
 */
public class JsonFileLegacyStore implements LegacyStore {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileLegacyStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        JsonNode value = read().get(key);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.isTextual() ? value.asText() : value.toString());
    }

    @Override
    public synchronized Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        Iterator<String> names = read().fieldNames();
        names.forEachRemaining(keys::add);
        return keys;
    }

    @Override
    public synchronized void put(String key, String value) {
        ObjectNode root = read();
        root.put(key, value);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), root);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write legacy store " + path, e);
        }
    }

    private ObjectNode read() {
        if (!Files.exists(path)) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root == null || root.isMissingNode()) {
                return objectMapper.createObjectNode();
            }
            if (!root.isObject()) {
                throw new IOException("Expected a JSON object at the top level of " + path);
            }
            return (ObjectNode) root;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read legacy store " + path, e);
        }
    }
}
