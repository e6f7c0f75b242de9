package io.logictree.core.realization;

import java.util.List;
import java.util.Objects;

/// One fully resolved combination of branch choices across all branch-sets.
///
/// @param value uncertainty values chosen, one per branch-set in tree order, not null
/// @param weight combined weight: the product of branch weights for full enumeration,
///        `1 / n` for sampling
/// @param ltPath branch ids chosen, one per branch-set in tree order, not null
/// @param ordinal zero-based index in generation order, the stable identity of this
///        realization within one generation call
public record Realization(
        List<String> value, double weight, List<String> ltPath, long ordinal) {

    public Realization {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must not be negative, got " + ordinal);
        }
        value = List.copyOf(Objects.requireNonNull(value, "value must not be null"));
        ltPath = List.copyOf(Objects.requireNonNull(ltPath, "ltPath must not be null"));
        if (value.size() != ltPath.size()) {
            throw new IllegalArgumentException(
                    "value and ltPath differ in length: " + value.size() + " vs " + ltPath.size());
        }
    }

    /// Returns the logic tree path as a single `~`-joined string, e.g. `b1~c2`.
    ///
    /// @return path key, never null
    public String pathKey() {
        return String.join("~", ltPath);
    }
}
