package io.logictree.core.realization;

import io.logictree.core.exception.SamplingException;
import java.util.Arrays;
import java.util.Random;

/// Draws indices with replacement from a discrete distribution.
///
/// The weights must be non-negative and sum to one within the configured tolerance.
/// A fixed seed always reproduces the same draws.
public final class WeightedSampler {

    private final double tolerance;

    /// @param tolerance allowed absolute deviation of the weight sum from one
    public WeightedSampler(double tolerance) {
        this.tolerance = tolerance;
    }

    /// Draws `n` indices into `weights`.
    ///
    /// @param label name used in error messages, typically the branch-set id
    /// @param weights selection probabilities, not null, not empty
    /// @param n number of draws, positive
    /// @param seed random seed
    /// @return array of `n` indices in `[0, weights.length)`
    /// @throws SamplingException if a weight is negative or the weights do not sum to one
    public int[] sample(String label, double[] weights, int n, long seed) {
        if (n <= 0) {
            throw new SamplingException("Number of samples must be positive, got " + n);
        }
        double[] cumulative = cumulative(label, weights);

        Random random = new Random(seed);
        int[] draws = new int[n];
        for (int i = 0; i < n; i++) {
            draws[i] = pick(cumulative, random.nextDouble());
        }
        return draws;
    }

    private double[] cumulative(String label, double[] weights) {
        if (weights.length == 0) {
            throw new SamplingException("Cannot sample from '" + label + "': no weights");
        }
        double[] cumulative = new double[weights.length];
        double total = 0.0;
        for (int i = 0; i < weights.length; i++) {
            if (!(weights[i] >= 0.0)) {
                throw new SamplingException(
                        "Cannot sample from '" + label + "': negative weight " + weights[i]);
            }
            total += weights[i];
            cumulative[i] = total;
        }
        if (Math.abs(total - 1.0) > tolerance) {
            throw new SamplingException(
                    "Cannot sample from '"
                            + label
                            + "': weights "
                            + Arrays.toString(weights)
                            + " sum to "
                            + total
                            + ", expected 1");
        }
        return cumulative;
    }

    // first index whose cumulative weight exceeds u; the last index absorbs rounding
    private static int pick(double[] cumulative, double u) {
        int lo = 0;
        int hi = cumulative.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cumulative[mid] > u) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
