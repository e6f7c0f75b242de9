package io.logictree.core.storage;

import io.logictree.core.tree.Branch;
import java.util.Objects;

/// Fixed-schema row persisted for every branch of a logic tree.
///
/// @param bsid id of the owning branch-set, not null
/// @param brid branch id, not null
/// @param uncertainty encoded modeling choice, not null
/// @param weight probability weight
public record BranchRecord(String bsid, String brid, String uncertainty, double weight) {

    public BranchRecord {
        Objects.requireNonNull(bsid, "bsid must not be null");
        Objects.requireNonNull(brid, "brid must not be null");
        Objects.requireNonNull(uncertainty, "uncertainty must not be null");
    }

    /// Creates the record of a branch.
    ///
    /// @param branch source branch, not null
    /// @return new record, never null
    public static BranchRecord of(Branch branch) {
        return new BranchRecord(
                branch.getBranchSetId(),
                branch.getBranchId(),
                branch.getUncertainty(),
                branch.getWeight());
    }
}
