package io.logictree.core.tree;

import java.util.Objects;

/// One weighted alternative within a {@link BranchSet}.
///
/// A branch carries the id of its branch-set, its own id (unique within that branch-set),
/// the encoded modeling choice (`uncertainty`) and its probability weight. The four value
/// fields are immutable; the child branch-set link is assigned exactly once by the owning
/// {@link LogicTree} during linking.
///
/// ### Ownership
/// A branch never owns its child branch-set. The child reference is a non-owning link into
/// the tree's branch-set map, used only for linked traversal
/// (see {@link LinkedTraversal}).
///
/// ### Equality
/// Two branches are equal when their branch-set id, branch id, uncertainty and weight
/// match. The child link is not compared.
///
/// @implNote Safe to share across threads once the owning tree has been constructed.
public final class Branch {

    private final String branchSetId;
    private final String branchId;
    private final String uncertainty;
    private final double weight;
    private BranchSet childBranchSet;

    /// Creates an unlinked branch.
    ///
    /// @param branchSetId id of the owning branch-set, not null
    /// @param branchId id of this branch, unique within its branch-set, not null
    /// @param uncertainty encoded modeling choice, not null
    /// @param weight probability weight in `[0, 1]`
    /// @throws NullPointerException if any id or the uncertainty is null
    /// @throws IllegalArgumentException if the weight is outside `[0, 1]` or NaN
    public Branch(String branchSetId, String branchId, String uncertainty, double weight) {
        this.branchSetId = Objects.requireNonNull(branchSetId, "branchSetId must not be null");
        this.branchId = Objects.requireNonNull(branchId, "branchId must not be null");
        this.uncertainty = Objects.requireNonNull(uncertainty, "uncertainty must not be null");
        if (!(weight >= 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException(
                    "Branch '" + branchId + "' has weight " + weight + " outside [0, 1]");
        }
        this.weight = weight;
    }

    /// Returns the id of the branch-set this branch belongs to.
    ///
    /// @return branch-set id, never null
    public String getBranchSetId() {
        return branchSetId;
    }

    /// Returns the branch id.
    ///
    /// @return branch id, never null
    public String getBranchId() {
        return branchId;
    }

    /// Returns the encoded modeling choice of this branch.
    ///
    /// @return uncertainty value, never null
    public String getUncertainty() {
        return uncertainty;
    }

    /// Returns the probability weight.
    ///
    /// @return weight in `[0, 1]`
    public double getWeight() {
        return weight;
    }

    /// Returns the branch-set this branch descends into.
    ///
    /// @return linked child branch-set, or null when this branch terminates its path
    public BranchSet getChildBranchSet() {
        return childBranchSet;
    }

    /// Returns whether this branch terminates a linked path.
    ///
    /// @return `true` when no child branch-set is linked
    public boolean isLeaf() {
        return childBranchSet == null;
    }

    void linkTo(BranchSet child) {
        if (childBranchSet != null) {
            throw new IllegalStateException(
                    "Branch '"
                            + branchId
                            + "' is already linked to branch-set '"
                            + childBranchSet.getId()
                            + "'");
        }
        this.childBranchSet = child;
    }

    /// Returns a copy of this branch without a child link.
    Branch unlinkedCopy() {
        return new Branch(branchSetId, branchId, uncertainty, weight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Branch other)) return false;
        return Double.compare(weight, other.weight) == 0
                && branchSetId.equals(other.branchSetId)
                && branchId.equals(other.branchId)
                && uncertainty.equals(other.uncertainty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(branchSetId, branchId, uncertainty, weight);
    }

    @Override
    public String toString() {
        return branchId;
    }
}
