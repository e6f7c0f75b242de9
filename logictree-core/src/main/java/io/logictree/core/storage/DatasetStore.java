package io.logictree.core.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Columnar storage seam for persisted logic trees.
///
/// A store keeps two kinds of named slots: ordered sequences of {@link BranchRecord}s and
/// single string blobs. Writing a slot replaces its previous content. No indexing or
/// partial reads are required.
///
/// ### Usage
/// {@snippet :
/// store.putRecords("lt/branches", records);
/// store.putBlob("lt/branchsets", attributesJson);
///
/// List<BranchRecord> restored = store.getRecords("lt/branches").orElseThrow();
/// }
///
/// @see InMemoryDatasetStore for the in-memory implementation
public interface DatasetStore {

    /// Writes a record slot.
    ///
    /// @param slot slot name, not null
    /// @param records records in order, not null
    /// @throws NullPointerException if slot or records is null
    void putRecords(String slot, List<BranchRecord> records);

    /// Reads a record slot.
    ///
    /// @param slot slot name, not null
    /// @return the records in write order, or empty if the slot was never written
    Optional<List<BranchRecord>> getRecords(String slot);

    /// Writes a blob slot.
    ///
    /// @param slot slot name, not null
    /// @param blob serialized content, not null
    /// @throws NullPointerException if slot or blob is null
    void putBlob(String slot, String blob);

    /// Reads a blob slot.
    ///
    /// @param slot slot name, not null
    /// @return the blob, or empty if the slot was never written
    Optional<String> getBlob(String slot);

    /// Writes several slots of both kinds as one unit.
    ///
    /// The default writes the slots one by one. Stores that can write them together
    /// override it so a failure leaves either all or none of the slots updated.
    ///
    /// @param records record slots by name, not null
    /// @param blobs blob slots by name, not null
    default void putAll(Map<String, List<BranchRecord>> records, Map<String, String> blobs) {
        records.forEach(this::putRecords);
        blobs.forEach(this::putBlob);
    }

    /// Returns whether a slot of either kind exists.
    ///
    /// @param slot slot name, not null
    /// @return `true` if the slot was written
    boolean contains(String slot);
}
