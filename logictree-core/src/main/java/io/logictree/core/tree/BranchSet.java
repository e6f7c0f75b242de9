package io.logictree.core.tree;

import io.logictree.core.exception.InvalidLogicTreeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// An ordered group of mutually exclusive, weighted branches sharing one set of attributes.
///
/// Branch order is significant: it defines enumeration order. The attribute map always holds
/// the canonical `bsid` key and passes every other source attribute through unchanged
/// (`uncertaintyType`, `applyToBranches`, `applyToTectonicRegionType`, ...).
///
/// ### Validation
/// The builder rejects an empty branch list and duplicate branch ids. Weights are not
/// required to sum to one here; that is checked when sampling.
///
/// @implNote Immutable apart from the one-time child links on its branches, which the
/// owning {@link LogicTree} assigns.
///
/// @see Branch
/// @see LogicTree
public final class BranchSet {

    public static final String BSID = "bsid";
    public static final String UNCERTAINTY_TYPE = "uncertaintyType";
    public static final String APPLY_TO_BRANCHES = "applyToBranches";
    public static final String APPLY_TO_TECTONIC_REGION_TYPE = "applyToTectonicRegionType";

    private final String id;
    private final List<Branch> branches;
    private final Map<String, String> attributes;

    private BranchSet(String id, List<Branch> branches, Map<String, String> attributes) {
        this.id = id;
        this.branches = Collections.unmodifiableList(branches);
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    /// Returns the branch-set id (the `bsid` attribute).
    ///
    /// @return id, never null
    public String getId() {
        return id;
    }

    /// Returns the branches in source order.
    ///
    /// @return unmodifiable, non-empty list of branches
    public List<Branch> getBranches() {
        return branches;
    }

    /// Returns the number of branches.
    ///
    /// @return branch count, at least one
    public int size() {
        return branches.size();
    }

    /// Returns all attributes, including `bsid`.
    ///
    /// @return unmodifiable attribute map in source order, never null
    public Map<String, String> getAttributes() {
        return attributes;
    }

    /// Returns a single attribute value.
    ///
    /// @param name attribute name, not null
    /// @return the value, or null if absent
    public String getAttribute(String name) {
        return attributes.get(name);
    }

    /// Returns the `uncertaintyType` attribute.
    ///
    /// @return uncertainty type, or null if the source did not declare one
    public String getUncertaintyType() {
        return attributes.get(UNCERTAINTY_TYPE);
    }

    /// Returns the parent branch ids this branch-set attaches under.
    ///
    /// The `applyToBranches` attribute is a whitespace-separated id list. An absent or blank
    /// attribute means the branch-set applies to every parent branch.
    ///
    /// @return set of parent branch ids in declaration order, or empty when unfiltered
    public Optional<Set<String>> getApplyToBranches() {
        String raw = attributes.get(APPLY_TO_BRANCHES);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Set<String> ids = new LinkedHashSet<>(Arrays.asList(raw.trim().split("\\s+")));
        return Optional.of(Collections.unmodifiableSet(ids));
    }

    /// Finds a branch by id.
    ///
    /// @param branchId branch id, not null
    /// @return the branch, or empty if no branch has this id
    public Optional<Branch> findBranch(String branchId) {
        for (Branch branch : branches) {
            if (branch.getBranchId().equals(branchId)) {
                return Optional.of(branch);
            }
        }
        return Optional.empty();
    }

    /// Returns the sum of all branch weights.
    ///
    /// @return total weight, one for a well-formed branch-set
    public double getTotalWeight() {
        double total = 0.0;
        for (Branch branch : branches) {
            total += branch.getWeight();
        }
        return total;
    }

    /// Returns a structurally equal branch-set whose branches carry no child links.
    BranchSet unlinkedCopy() {
        List<Branch> copies = new ArrayList<>(branches.size());
        for (Branch branch : branches) {
            copies.add(branch.unlinkedCopy());
        }
        return new BranchSet(id, copies, new LinkedHashMap<>(attributes));
    }

    /// Creates a builder for a branch-set with the given id.
    ///
    /// @param id branch-set id, not null
    /// @return new builder instance, never null
    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BranchSet other)) return false;
        return id.equals(other.id)
                && branches.equals(other.branches)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, branches, attributes);
    }

    @Override
    public String toString() {
        return "BranchSet{" + id + ", branches=" + branches + "}";
    }

    /// Builder for {@link BranchSet}.
    ///
    /// Branches are appended in call order and receive the builder's id as their
    /// branch-set id.
    public static final class Builder {
        private final String id;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<Branch> branches = new ArrayList<>();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "Branch-set ID required");
            attributes.put(BSID, id);
        }

        /// Adds or replaces an attribute.
        ///
        /// @param name attribute name, not null
        /// @param value attribute value, not null
        /// @return this builder for chaining
        /// @throws InvalidLogicTreeException if `name` is `bsid` with a different value
        public Builder attribute(String name, String value) {
            Objects.requireNonNull(name, "attribute name must not be null");
            Objects.requireNonNull(value, "attribute '" + name + "' must not be null");
            if (BSID.equals(name) && !id.equals(value)) {
                throw new InvalidLogicTreeException(
                        "Branch-set '" + id + "' cannot carry bsid attribute '" + value + "'");
            }
            attributes.put(name, value);
            return this;
        }

        /// Adds every entry of the given map as an attribute.
        ///
        /// @param values attributes to add, not null
        /// @return this builder for chaining
        public Builder attributes(Map<String, String> values) {
            values.forEach(this::attribute);
            return this;
        }

        /// Appends a branch.
        ///
        /// @param branchId branch id, unique within this branch-set
        /// @param uncertainty encoded modeling choice
        /// @param weight probability weight in `[0, 1]`
        /// @return this builder for chaining
        public Builder branch(String branchId, String uncertainty, double weight) {
            branches.add(new Branch(id, branchId, uncertainty, weight));
            return this;
        }

        /// Builds the branch-set.
        ///
        /// @return new branch-set, never null
        /// @throws InvalidLogicTreeException if there are no branches or a branch id repeats
        public BranchSet build() {
            if (branches.isEmpty()) {
                throw new InvalidLogicTreeException("Branch-set '" + id + "' has no branches");
            }
            Set<String> seen = new HashSet<>();
            for (Branch branch : branches) {
                if (!seen.add(branch.getBranchId())) {
                    throw new InvalidLogicTreeException(
                            "Branch-set '"
                                    + id
                                    + "' has duplicate branch id '"
                                    + branch.getBranchId()
                                    + "'");
                }
            }
            return new BranchSet(id, new ArrayList<>(branches), new LinkedHashMap<>(attributes));
        }
    }
}
