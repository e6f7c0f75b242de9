package io.logictree.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.logictree.core.exception.LogicTreeFormatException;
import io.logictree.core.storage.BranchRecord;
import io.logictree.core.storage.DatasetStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// File-backed dataset store holding every slot in one JSON document.
///
/// ### File layout
/// {@snippet lang=json :
/// {
///   "records": { "lt/branches": [ ["bs1", "b1", "A", 0.3], ["bs1", "b2", "B", 0.7] ] },
///   "blobs":   { "lt/branchsets": "{\"bs1\":{\"uncertaintyType\":\"gmpeModel\"}}" }
/// }
/// }
///
/// The file is read once when the store is opened and rewritten in full after every put.
/// Each rewrite goes to a sibling temporary file that is then moved over the document, so
/// readers see either the old or the new content. A failed write leaves the store's slots as
/// they were before the put.
///
/// @implNote Thread-safe. Mutations and file writes are serialized on the store instance.
///
/// @see LogicTreeCodec for what goes into the slots
public final class JsonFileDatasetStore implements DatasetStore {

    private static final Logger logger = Logger.getLogger(JsonFileDatasetStore.class.getName());

    private static final String RECORDS = "records";
    private static final String BLOBS = "blobs";

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<String, List<BranchRecord>> records = new LinkedHashMap<>();
    private final Map<String, String> blobs = new LinkedHashMap<>();

    private JsonFileDatasetStore(Path file) {
        this.file = file;
        this.mapper = LogicTreeCodec.createMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /// Opens a store, loading the file if it exists.
    ///
    /// @param file path of the JSON document, not null
    /// @return opened store, never null
    /// @throws UncheckedIOException if an existing file cannot be read
    /// @throws LogicTreeFormatException if an existing file is not a store document
    public static JsonFileDatasetStore open(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        JsonFileDatasetStore store = new JsonFileDatasetStore(file);
        if (Files.exists(file)) {
            store.load();
        }
        return store;
    }

    /// Returns the backing file.
    ///
    /// @return path, never null
    public Path getFile() {
        return file;
    }

    @Override
    public synchronized void putRecords(String slot, List<BranchRecord> values) {
        Objects.requireNonNull(slot, "slot must not be null");
        Objects.requireNonNull(values, "records must not be null");
        putAll(Map.of(slot, values), Map.of());
    }

    @Override
    public synchronized Optional<List<BranchRecord>> getRecords(String slot) {
        Objects.requireNonNull(slot, "slot must not be null");
        return Optional.ofNullable(records.get(slot));
    }

    @Override
    public synchronized void putBlob(String slot, String blob) {
        Objects.requireNonNull(slot, "slot must not be null");
        Objects.requireNonNull(blob, "blob must not be null");
        putAll(Map.of(), Map.of(slot, blob));
    }

    @Override
    public synchronized Optional<String> getBlob(String slot) {
        Objects.requireNonNull(slot, "slot must not be null");
        return Optional.ofNullable(blobs.get(slot));
    }

    /// Writes every given slot and rewrites the file once.
    ///
    /// @throws UncheckedIOException if the file cannot be written; no slot is changed then
    @Override
    public synchronized void putAll(
            Map<String, List<BranchRecord>> recordSlots, Map<String, String> blobSlots) {
        Objects.requireNonNull(recordSlots, "records must not be null");
        Objects.requireNonNull(blobSlots, "blobs must not be null");
        Map<String, List<BranchRecord>> previousRecords = new LinkedHashMap<>(records);
        Map<String, String> previousBlobs = new LinkedHashMap<>(blobs);

        recordSlots.forEach((slot, values) -> records.put(slot, List.copyOf(values)));
        blobs.putAll(blobSlots);
        try {
            flush();
        } catch (UncheckedIOException e) {
            records.clear();
            records.putAll(previousRecords);
            blobs.clear();
            blobs.putAll(previousBlobs);
            throw e;
        }
    }

    @Override
    public synchronized boolean contains(String slot) {
        return records.containsKey(slot) || blobs.containsKey(slot);
    }

    private void load() {
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset file " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new LogicTreeFormatException("Dataset file " + file + " is not a JSON object");
        }

        JsonNode recordSlots = root.path(RECORDS);
        Iterator<Map.Entry<String, JsonNode>> slots = recordSlots.fields();
        while (slots.hasNext()) {
            Map.Entry<String, JsonNode> slot = slots.next();
            List<BranchRecord> rows = new ArrayList<>();
            for (JsonNode row : slot.getValue()) {
                try {
                    rows.add(mapper.treeToValue(row, BranchRecord.class));
                } catch (JsonProcessingException e) {
                    throw new LogicTreeFormatException(
                            "Invalid record in slot '" + slot.getKey() + "' of " + file, e);
                }
            }
            records.put(slot.getKey(), List.copyOf(rows));
        }

        Iterator<Map.Entry<String, JsonNode>> blobSlots = root.path(BLOBS).fields();
        while (blobSlots.hasNext()) {
            Map.Entry<String, JsonNode> slot = blobSlots.next();
            blobs.put(slot.getKey(), slot.getValue().asText());
        }
        logger.fine("Loaded " + (records.size() + blobs.size()) + " slots from " + file);
    }

    private void flush() {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode recordSlots = root.putObject(RECORDS);
        for (Map.Entry<String, List<BranchRecord>> slot : records.entrySet()) {
            ArrayNode rows = recordSlots.putArray(slot.getKey());
            for (BranchRecord record : slot.getValue()) {
                JsonNode row = mapper.valueToTree(record);
                rows.add(row);
            }
        }
        ObjectNode blobSlots = root.putObject(BLOBS);
        blobs.forEach(blobSlots::put);

        Path target = file.toAbsolutePath();
        Path temp = null;
        try {
            Path parent = target.getParent();
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, target.getFileName() + ".", ".tmp");
            mapper.writeValue(temp.toFile(), root);
            replace(temp, target);
        } catch (IOException e) {
            UncheckedIOException failure =
                    new UncheckedIOException("Failed to write dataset file " + file, e);
            deleteQuietly(temp, failure);
            throw failure;
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move not supported for " + target + ", replacing in place");
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, Exception failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
