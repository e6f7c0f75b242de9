package io.logictree.core;

/// Configuration options for logic tree building and realization generation.
///
/// Controls the default sampling seed, the tolerance used when checking that a
/// branch-set's weights sum to one, and how strictly `applyToBranches` filters are
/// validated against their parent branch-set. Use the {@link Builder} for fluent
/// configuration or construct directly with setters for mutable configuration.
///
/// ### Default Values
/// - `defaultSeed`: `42`
/// - `weightTolerance`: `1e-8`
/// - `strictApplyToBranches`: `true`
///
/// @implNote **Not thread-safe**. This is a mutable configuration object. A
/// {@link io.logictree.core.tree.LogicTree} keeps its own {@link #copy()}, so changes made
/// after the tree is built do not reach it.
///
/// @see Builder
public class LogicTreeConfig {

    public static final long DEFAULT_SEED = 42L;
    public static final double DEFAULT_WEIGHT_TOLERANCE = 1e-8;

    private long defaultSeed = DEFAULT_SEED;
    private double weightTolerance = DEFAULT_WEIGHT_TOLERANCE;
    private boolean strictApplyToBranches = true;

    /// Creates a configuration with default values.
    public LogicTreeConfig() {}

    /// Returns a fresh configuration holding the default values.
    ///
    /// @return new default configuration, never null
    public static LogicTreeConfig defaults() {
        return new LogicTreeConfig();
    }

    /// Returns the seed used when a caller samples without supplying one.
    ///
    /// @return the default seed
    public long getDefaultSeed() {
        return defaultSeed;
    }

    /// Sets the seed used when a caller samples without supplying one.
    ///
    /// @param defaultSeed the seed of the first branch-set; later branch-sets use
    ///        `defaultSeed + i`
    public void setDefaultSeed(long defaultSeed) {
        this.defaultSeed = defaultSeed;
    }

    /// Returns the absolute tolerance applied to `|sum(weights) - 1|` before sampling.
    ///
    /// @return non-negative tolerance
    public double getWeightTolerance() {
        return weightTolerance;
    }

    /// Sets the absolute tolerance applied to `|sum(weights) - 1|` before sampling.
    ///
    /// ### Contracts
    /// - **Precondition**: `weightTolerance` must be non-negative
    ///
    /// @param weightTolerance the tolerance, must be non-negative
    /// @throws IllegalArgumentException if the tolerance is negative or NaN
    public void setWeightTolerance(double weightTolerance) {
        if (!(weightTolerance >= 0.0)) {
            throw new IllegalArgumentException(
                    "weightTolerance must be non-negative, got " + weightTolerance);
        }
        this.weightTolerance = weightTolerance;
    }

    /// Returns whether an `applyToBranches` id missing from the parent branch-set fails
    /// the build.
    ///
    /// @return `true` to reject such trees, `false` to link only the ids that exist
    public boolean isStrictApplyToBranches() {
        return strictApplyToBranches;
    }

    /// Enables or disables the parent-completeness check on `applyToBranches`.
    ///
    /// @param strictApplyToBranches `true` to reject filters naming unknown parent branches
    public void setStrictApplyToBranches(boolean strictApplyToBranches) {
        this.strictApplyToBranches = strictApplyToBranches;
    }

    /// Returns an independent copy of this configuration.
    ///
    /// @return new configuration holding the same values, never null
    public LogicTreeConfig copy() {
        LogicTreeConfig copy = new LogicTreeConfig();
        copy.defaultSeed = defaultSeed;
        copy.weightTolerance = weightTolerance;
        copy.strictApplyToBranches = strictApplyToBranches;
        return copy;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "LogicTreeConfig{defaultSeed="
                + defaultSeed
                + ", weightTolerance="
                + weightTolerance
                + ", strictApplyToBranches="
                + strictApplyToBranches
                + "}";
    }

    /// Fluent builder for constructing {@link LogicTreeConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final LogicTreeConfig config = new LogicTreeConfig();

        /// Sets the default sampling seed.
        ///
        /// @param defaultSeed the seed
        /// @return this builder for chaining, never null
        public Builder defaultSeed(long defaultSeed) {
            config.setDefaultSeed(defaultSeed);
            return this;
        }

        /// Sets the weight-sum tolerance.
        ///
        /// @param weightTolerance non-negative tolerance
        /// @return this builder for chaining, never null
        public Builder weightTolerance(double weightTolerance) {
            config.setWeightTolerance(weightTolerance);
            return this;
        }

        /// Enables or disables the `applyToBranches` completeness check.
        ///
        /// @param strictApplyToBranches `true` to reject incomplete parents
        /// @return this builder for chaining, never null
        public Builder strictApplyToBranches(boolean strictApplyToBranches) {
            config.setStrictApplyToBranches(strictApplyToBranches);
            return this;
        }

        /// Builds and returns the configured {@link LogicTreeConfig} instance.
        ///
        /// @return the configured instance, never null
        public LogicTreeConfig build() {
            return config;
        }
    }
}
