package io.logictree.core.realization;

import io.logictree.core.LogicTreeConfig;
import io.logictree.core.exception.SamplingException;
import io.logictree.core.tree.Branch;
import io.logictree.core.tree.BranchSet;
import io.logictree.core.tree.LogicTree;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// Generates the realizations of a {@link LogicTree}.
///
/// Two mutually exclusive modes, selected by `numSamples`:
/// - **Full enumeration** (`numSamples == 0`): the Cartesian product of every branch-set's
///   branch list in tree order. The weight of a realization is the product of its branch
///   weights. `applyToBranches` linking is not consulted.
/// - **Weighted sampling** (`numSamples > 0`): the `i`-th branch-set draws `numSamples`
///   branches with replacement using seed `seed + i`; realization `k` zips the `k`-th draw
///   of every branch-set and has weight `1 / numSamples`.
///
/// Both modes return lazy, finite streams. Each call re-runs the algorithm from scratch,
/// so a fresh call is the way to restart a sequence.
///
/// @implNote Stateless apart from its configuration; safe to share across threads.
///
/// @see WeightedSampler for the draw primitive
public class RealizationGenerator {

    private static final Logger logger = Logger.getLogger(RealizationGenerator.class.getName());

    private final WeightedSampler sampler;

    /// Creates a generator with the default configuration.
    public RealizationGenerator() {
        this(LogicTreeConfig.defaults());
    }

    /// Creates a generator.
    ///
    /// @param config supplies the weight-sum tolerance used by sampling, not null
    public RealizationGenerator(LogicTreeConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.sampler = new WeightedSampler(config.getWeightTolerance());
    }

    /// Dispatches to {@link #fullEnumeration} or {@link #sample}.
    ///
    /// @param tree tree to generate from, not null
    /// @param numSamples zero for full enumeration, the number of samples otherwise
    /// @param seed seed of the first branch-set, ignored for full enumeration
    /// @return lazy stream of realizations in ordinal order, never null
    /// @throws SamplingException if `numSamples` is negative, or sampling is undefined
    public Stream<Realization> generate(LogicTree tree, int numSamples, long seed) {
        if (numSamples < 0) {
            throw new SamplingException(
                    "Number of samples must not be negative, got " + numSamples);
        }
        return numSamples == 0 ? fullEnumeration(tree) : sample(tree, numSamples, seed);
    }

    /// Enumerates every combination of one branch per branch-set.
    ///
    /// Combinations are produced in odometer order: the last branch-set varies fastest.
    ///
    /// @param tree tree to enumerate, not null
    /// @return lazy stream of `tree.flatPathCount()` realizations, never null
    /// @throws SamplingException if the number of combinations does not fit in a `long`
    public Stream<Realization> fullEnumeration(LogicTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        try {
            tree.flatPathCount();
        } catch (ArithmeticException e) {
            throw new SamplingException(
                    "Too many combinations to enumerate " + tree + ", sample instead", e);
        }
        List<List<Branch>> groups = new ArrayList<>();
        for (BranchSet branchSet : tree.getBranchSets().values()) {
            groups.add(branchSet.getBranches());
        }
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(
                        new ProductIterator(groups),
                        Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
                false);
    }

    /// Samples `n` realizations.
    ///
    /// All draws are made, and every branch-set validated, before this method returns, so a
    /// failure never yields partial results.
    ///
    /// @param tree tree to sample, not null
    /// @param n number of realizations, positive
    /// @param seed seed of the first branch-set; branch-set `i` uses `seed + i`
    /// @return lazy stream of `n` realizations of weight `1 / n`, never null
    /// @throws SamplingException if `n` is not positive or a branch-set's weights are
    /// negative or do not sum to one
    public Stream<Realization> sample(LogicTree tree, int n, long seed) {
        Objects.requireNonNull(tree, "tree must not be null");
        List<BranchSet> branchSets = List.copyOf(tree.getBranchSets().values());
        int[][] draws = new int[branchSets.size()][];
        for (int i = 0; i < branchSets.size(); i++) {
            BranchSet branchSet = branchSets.get(i);
            double[] weights =
                    branchSet.getBranches().stream().mapToDouble(Branch::getWeight).toArray();
            draws[i] = sampler.sample(branchSet.getId(), weights, n, seed + i);
        }
        logger.info("Sampled " + n + " realizations of " + tree + " with seed " + seed);

        double weight = 1.0 / n;
        return IntStream.range(0, n)
                .mapToObj(
                        k -> {
                            List<String> value = new ArrayList<>(branchSets.size());
                            List<String> path = new ArrayList<>(branchSets.size());
                            for (int i = 0; i < branchSets.size(); i++) {
                                Branch branch = branchSets.get(i).getBranches().get(draws[i][k]);
                                value.add(branch.getUncertainty());
                                path.add(branch.getBranchId());
                            }
                            return new Realization(value, weight, path, k);
                        });
    }

    private static final class ProductIterator implements Iterator<Realization> {
        private final List<List<Branch>> groups;
        private final int[] indices;
        private boolean exhausted;
        private long ordinal;

        ProductIterator(List<List<Branch>> groups) {
            this.groups = groups;
            this.indices = new int[groups.size()];
            this.exhausted = groups.isEmpty() || groups.stream().anyMatch(List::isEmpty);
        }

        @Override
        public boolean hasNext() {
            return !exhausted;
        }

        @Override
        public Realization next() {
            if (exhausted) {
                throw new NoSuchElementException();
            }
            double weight = 1.0;
            List<String> value = new ArrayList<>(groups.size());
            List<String> path = new ArrayList<>(groups.size());
            for (int i = 0; i < groups.size(); i++) {
                Branch branch = groups.get(i).get(indices[i]);
                weight *= branch.getWeight();
                value.add(branch.getUncertainty());
                path.add(branch.getBranchId());
            }
            Realization realization = new Realization(value, weight, path, ordinal++);
            increment();
            return realization;
        }

        private void increment() {
            for (int i = indices.length - 1; i >= 0; i--) {
                if (++indices[i] < groups.get(i).size()) {
                    return;
                }
                indices[i] = 0;
            }
            exhausted = true;
        }
    }
}
