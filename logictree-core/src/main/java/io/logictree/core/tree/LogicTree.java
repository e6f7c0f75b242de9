package io.logictree.core.tree;

import io.logictree.core.LogicTreeConfig;
import io.logictree.core.exception.InvalidLogicTreeException;
import io.logictree.core.realization.Realization;
import io.logictree.core.realization.RealizationGenerator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// A logic tree built over an ordered list of branch-sets.
///
/// The tree owns every branch-set, keyed by id in source order; the first branch-set is the
/// root level. Construction is two-phase: the branch-sets are copied into the map, then a
/// linking pass assigns each branch's child branch-set.
///
/// ### Linking
/// For the branch-set at index `i + 1`, every branch of branch-set `i` whose id is listed in
/// `applyToBranches` (or every branch, when the attribute is absent) is linked to it.
/// Unselected branches stay unlinked and terminate their path. A filter naming an id that
/// branch-set `i` does not contain fails the build.
///
/// ### Two views
/// - **Flat**: {@link #getBranchSets()}, used by full enumeration and sampling, which
///   combine every branch-set regardless of `applyToBranches`.
/// - **Linked**: branches reachable through {@link Branch#getChildBranchSet()}, used by
///   {@link LinkedTraversal}. The two agree on the realization count only when every
///   filter covers all parent branches.
///
/// @implNote Immutable and thread-safe after construction. The configuration is copied on
/// the way in and on the way out.
///
/// @see RealizationGenerator for enumeration and sampling
/// @see LinkedTraversal for counting and leaf enumeration
public final class LogicTree {

    private static final Logger logger = Logger.getLogger(LogicTree.class.getName());

    private final Map<String, BranchSet> branchSets;
    private final LogicTreeConfig config;

    /// Builds a tree with the default configuration.
    ///
    /// @param branchSets branch-sets in source order, not null, not empty
    /// @throws InvalidLogicTreeException if the list is empty, an id repeats, or a filter
    /// names a branch missing from its parent
    public LogicTree(List<BranchSet> branchSets) {
        this(branchSets, LogicTreeConfig.defaults());
    }

    /// Builds a tree.
    ///
    /// The given branch-sets are copied, so their branches are never linked in place and
    /// the same definitions can feed several trees.
    ///
    /// @param branchSets branch-sets in source order, not null, not empty
    /// @param config build and sampling configuration, not null
    /// @throws InvalidLogicTreeException if the list is empty, an id repeats, or a filter
    /// names a branch missing from its parent
    public LogicTree(List<BranchSet> branchSets, LogicTreeConfig config) {
        Objects.requireNonNull(branchSets, "branchSets must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null").copy();
        if (branchSets.isEmpty()) {
            throw new InvalidLogicTreeException("A logic tree needs at least one branch-set");
        }

        List<BranchSet> copies = new ArrayList<>(branchSets.size());
        Map<String, BranchSet> byId = new LinkedHashMap<>();
        for (BranchSet branchSet : branchSets) {
            BranchSet copy = branchSet.unlinkedCopy();
            if (byId.putIfAbsent(copy.getId(), copy) != null) {
                throw new InvalidLogicTreeException(
                        "Duplicate branch-set id '" + copy.getId() + "'");
            }
            copies.add(copy);
        }
        link(copies);
        this.branchSets = Collections.unmodifiableMap(byId);
        logger.fine("Built " + this);
    }

    /// Builds a tree with the default configuration.
    ///
    /// @param branchSets branch-sets in source order
    /// @return new tree, never null
    public static LogicTree of(BranchSet... branchSets) {
        return new LogicTree(Arrays.asList(branchSets));
    }

    private void link(List<BranchSet> ordered) {
        for (int i = 0; i + 1 < ordered.size(); i++) {
            BranchSet parent = ordered.get(i);
            BranchSet child = ordered.get(i + 1);
            Optional<Set<String>> applyTo = child.getApplyToBranches();

            if (applyTo.isPresent()) {
                List<String> missing =
                        applyTo.get().stream()
                                .filter(id -> parent.findBranch(id).isEmpty())
                                .collect(Collectors.toList());
                if (!missing.isEmpty()) {
                    String message =
                            "Branch-set '"
                                    + child.getId()
                                    + "' applies to branches "
                                    + missing
                                    + " which are not in parent branch-set '"
                                    + parent.getId()
                                    + "'";
                    if (config.isStrictApplyToBranches()) {
                        throw new InvalidLogicTreeException(message);
                    }
                    logger.warning(message);
                }
            }

            int linked = 0;
            for (Branch branch : parent.getBranches()) {
                if (applyTo.isEmpty() || applyTo.get().contains(branch.getBranchId())) {
                    branch.linkTo(child);
                    linked++;
                }
            }
            logger.fine(
                    "Linked "
                            + linked
                            + " of "
                            + parent.size()
                            + " branches of '"
                            + parent.getId()
                            + "' to '"
                            + child.getId()
                            + "'");
        }
    }

    /// Returns the branch-sets keyed by id, in source order.
    ///
    /// @return unmodifiable map, never empty
    public Map<String, BranchSet> getBranchSets() {
        return branchSets;
    }

    /// Returns the branch-set ids in source order.
    ///
    /// @return list of ids, never empty
    public List<String> getBranchSetIds() {
        return List.copyOf(branchSets.keySet());
    }

    /// Returns a branch-set by id.
    ///
    /// @param id branch-set id, not null
    /// @return the branch-set, or empty if the tree has no such id
    public Optional<BranchSet> getBranchSet(String id) {
        return Optional.ofNullable(branchSets.get(id));
    }

    /// Returns a copy of the build and sampling configuration.
    ///
    /// @return config copy, never null
    public LogicTreeConfig getConfig() {
        return config.copy();
    }

    /// Returns the branches of the first branch-set.
    ///
    /// @return root branches, never empty
    public List<Branch> rootBranches() {
        return branchSets.values().iterator().next().getBranches();
    }

    /// Restricts the tree to the named branch-sets, in the given order, and re-links them.
    ///
    /// The source tree is left untouched.
    ///
    /// @param branchSetIds ids of the branch-sets to keep, not null
    /// @return new reduced tree, never null
    /// @throws IllegalArgumentException if an id is not part of this tree
    /// @throws InvalidLogicTreeException if the ids are empty or the re-linked subsequence is
    /// malformed
    public LogicTree reduce(List<String> branchSetIds) {
        List<BranchSet> selected = new ArrayList<>(branchSetIds.size());
        for (String id : branchSetIds) {
            BranchSet branchSet = branchSets.get(id);
            if (branchSet == null) {
                throw new IllegalArgumentException(
                        "Unknown branch-set '" + id + "', expected one of " + branchSets.keySet());
            }
            selected.add(branchSet);
        }
        return new LogicTree(selected, config);
    }

    /// Returns the number of flat paths: the product of the branch counts.
    ///
    /// @return number of realizations produced by full enumeration
    /// @throws ArithmeticException if the product overflows a `long`
    public long flatPathCount() {
        long count = 1;
        for (BranchSet branchSet : branchSets.values()) {
            count = Math.multiplyExact(count, branchSet.size());
        }
        return count;
    }

    /// Returns the number of linked paths: the sum of {@link LinkedTraversal#countRealizations}
    /// over the root branches.
    ///
    /// @return number of root-to-leaf paths in the linked view
    public long countLinkedRealizations() {
        long count = 0;
        for (Branch root : rootBranches()) {
            count = Math.addExact(count, LinkedTraversal.countRealizations(root));
        }
        return count;
    }

    /// Generates realizations: full enumeration when `numSamples` is zero, weighted sampling
    /// otherwise.
    ///
    /// @param numSamples zero for full enumeration, the number of samples otherwise
    /// @param seed seed of the first branch-set, ignored for full enumeration
    /// @return lazy stream of realizations in ordinal order, never null
    /// @see RealizationGenerator#generate(LogicTree, int, long)
    public Stream<Realization> generateRealizations(int numSamples, long seed) {
        return new RealizationGenerator(config).generate(this, numSamples, seed);
    }

    /// Generates realizations using the configured default seed.
    ///
    /// @param numSamples zero for full enumeration, the number of samples otherwise
    /// @return lazy stream of realizations in ordinal order, never null
    public Stream<Realization> generateRealizations(int numSamples) {
        return generateRealizations(numSamples, config.getDefaultSeed());
    }

    /// Exporting a tree back to source markup is not supported.
    ///
    /// @param out destination, ignored
    /// @throws UnsupportedOperationException always
    public void writeMarkup(Appendable out) {
        throw new UnsupportedOperationException(
                "Exporting a logic tree to markup is not supported");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicTree other)) return false;
        return getBranchSetIds().equals(other.getBranchSetIds())
                && List.copyOf(branchSets.values()).equals(List.copyOf(other.branchSets.values()));
    }

    @Override
    public int hashCode() {
        return List.copyOf(branchSets.values()).hashCode();
    }

    @Override
    public String toString() {
        return "<LogicTree" + branchSets.keySet() + ">";
    }
}
