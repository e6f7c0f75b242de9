package io.logictree.core.storage;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory dataset store (default implementation).
///
/// Thread-safe, no external dependencies. Record slots and blob slots live in separate maps
/// keyed by slot name.
///
/// @see DatasetStore for contract
public final class InMemoryDatasetStore implements DatasetStore {

    private final Map<String, List<BranchRecord>> records = new ConcurrentHashMap<>();
    private final Map<String, String> blobs = new ConcurrentHashMap<>();

    @Override
    public void putRecords(String slot, List<BranchRecord> values) {
        Objects.requireNonNull(slot, "slot must not be null");
        Objects.requireNonNull(values, "records must not be null");
        records.put(slot, List.copyOf(values));
    }

    @Override
    public Optional<List<BranchRecord>> getRecords(String slot) {
        Objects.requireNonNull(slot, "slot must not be null");
        return Optional.ofNullable(records.get(slot));
    }

    @Override
    public void putBlob(String slot, String blob) {
        Objects.requireNonNull(slot, "slot must not be null");
        Objects.requireNonNull(blob, "blob must not be null");
        blobs.put(slot, blob);
    }

    @Override
    public Optional<String> getBlob(String slot) {
        Objects.requireNonNull(slot, "slot must not be null");
        return Optional.ofNullable(blobs.get(slot));
    }

    @Override
    public boolean contains(String slot) {
        return records.containsKey(slot) || blobs.containsKey(slot);
    }

    /// Clears all slots (useful for testing).
    public void clear() {
        records.clear();
        blobs.clear();
    }

    /// Returns the number of written slots of both kinds (useful for testing).
    public int size() {
        return records.size() + blobs.size();
    }
}
