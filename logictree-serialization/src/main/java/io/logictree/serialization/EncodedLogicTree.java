package io.logictree.serialization;

import io.logictree.core.storage.BranchRecord;
import java.util.List;
import java.util.Objects;

/// The persisted form of a logic tree.
///
/// @param branches every branch, concatenated in branch-set then branch order, not null
/// @param branchSets JSON object mapping each `bsid` to its remaining attributes, not null
public record EncodedLogicTree(List<BranchRecord> branches, String branchSets) {

    public EncodedLogicTree {
        branches = List.copyOf(Objects.requireNonNull(branches, "branches must not be null"));
        Objects.requireNonNull(branchSets, "branchSets must not be null");
    }
}
