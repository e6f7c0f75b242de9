package io.logictree.core.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.logictree.core.LogicTreeConfig;
import io.logictree.core.exception.InvalidLogicTreeException;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LogicTree")
class LogicTreeTest {

    private static BranchSet gmpe() {
        return BranchSet.builder("bs1")
                .attribute(BranchSet.UNCERTAINTY_TYPE, "gmpeModel")
                .branch("b1", "A", 0.3)
                .branch("b2", "B", 0.7)
                .build();
    }

    private static BranchSet maxMag(String applyTo) {
        BranchSet.Builder builder =
                BranchSet.builder("bs2").attribute(BranchSet.UNCERTAINTY_TYPE, "maxMagGRRelative");
        if (applyTo != null) {
            builder.attribute(BranchSet.APPLY_TO_BRANCHES, applyTo);
        }
        return builder.branch("c1", "X", 0.5).branch("c2", "Y", 0.5).build();
    }

    private static BranchSet bValue(String applyTo) {
        BranchSet.Builder builder =
                BranchSet.builder("bs3").attribute(BranchSet.UNCERTAINTY_TYPE, "bGRRelative");
        if (applyTo != null) {
            builder.attribute(BranchSet.APPLY_TO_BRANCHES, applyTo);
        }
        return builder.branch("d1", "-0.1", 0.2)
                .branch("d2", "0.0", 0.6)
                .branch("d3", "0.1", 0.2)
                .build();
    }

    private static Branch branch(LogicTree tree, String bsid, String brid) {
        return tree.getBranchSet(bsid).orElseThrow().findBranch(brid).orElseThrow();
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("keeps branch-sets in source order")
        void shouldKeepSourceOrder() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag(null), bValue(null));

            assertThat(tree.getBranchSetIds()).containsExactly("bs1", "bs2", "bs3");
            assertThat(tree.rootBranches())
                    .extracting(Branch::getBranchId)
                    .containsExactly("b1", "b2");
            assertThat(tree.getConfig().isStrictApplyToBranches()).isTrue();
        }

        @Test
        @DisplayName("is not affected by later changes to its configuration")
        void shouldSnapshotConfig() {
            LogicTreeConfig config = LogicTreeConfig.builder().defaultSeed(7L).build();
            LogicTree tree = new LogicTree(List.of(gmpe(), maxMag(null)), config);

            config.setDefaultSeed(8L);
            config.setWeightTolerance(0.5);
            tree.getConfig().setDefaultSeed(99L);

            assertThat(tree.getConfig().getDefaultSeed()).isEqualTo(7L);
            assertThat(tree.getConfig().getWeightTolerance())
                    .isEqualTo(LogicTreeConfig.DEFAULT_WEIGHT_TOLERANCE);
            assertThat(tree.generateRealizations(20).toList())
                    .isEqualTo(tree.generateRealizations(20, 7L).toList());
        }

        @Test
        @DisplayName("rejects an empty branch-set list")
        void shouldRejectEmptyTree() {
            assertThatThrownBy(() -> new LogicTree(List.of()))
                    .isInstanceOf(InvalidLogicTreeException.class)
                    .hasMessageContaining("at least one branch-set");
        }

        @Test
        @DisplayName("rejects duplicate branch-set ids")
        void shouldRejectDuplicateIds() {
            assertThatThrownBy(() -> LogicTree.of(gmpe(), gmpe()))
                    .isInstanceOf(InvalidLogicTreeException.class)
                    .hasMessageContaining("Duplicate branch-set id 'bs1'");
        }

        @Test
        @DisplayName("never links the given branch-sets in place")
        void shouldNotMutateInput() {
            BranchSet root = gmpe();

            LogicTree tree = LogicTree.of(root, maxMag(null));

            assertThat(root.getBranches()).allMatch(Branch::isLeaf);
            assertThat(tree.getBranchSet("bs1").orElseThrow()).isEqualTo(root);
            assertThat(tree.rootBranches()).noneMatch(Branch::isLeaf);
        }

        @Test
        @DisplayName("builds several trees from the same definitions")
        void shouldReuseDefinitions() {
            BranchSet root = gmpe();
            BranchSet child = maxMag(null);

            LogicTree first = LogicTree.of(root, child);
            LogicTree second = LogicTree.of(root, child);

            assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        }
    }

    @Nested
    @DisplayName("linking")
    class Linking {

        @Test
        @DisplayName("links every parent branch when applyToBranches is absent")
        void shouldLinkAllBranches() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag(null));
            BranchSet bs2 = tree.getBranchSet("bs2").orElseThrow();

            assertThat(branch(tree, "bs1", "b1").getChildBranchSet()).isSameAs(bs2);
            assertThat(branch(tree, "bs1", "b2").getChildBranchSet()).isSameAs(bs2);
            assertThat(bs2.getBranches()).allMatch(Branch::isLeaf);
        }

        @Test
        @DisplayName("links only the selected parent branches")
        void shouldLinkSelectedBranches() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag("b1"));

            assertThat(branch(tree, "bs1", "b1").getChildBranchSet())
                    .isSameAs(tree.getBranchSet("bs2").orElseThrow());
            assertThat(branch(tree, "bs1", "b2").isLeaf()).isTrue();
        }

        @Test
        @DisplayName("links each level only to its immediate predecessor")
        void shouldLinkConsecutiveLevels() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag("b2"), bValue(null));
            BranchSet bs3 = tree.getBranchSet("bs3").orElseThrow();

            assertThat(branch(tree, "bs1", "b1").isLeaf()).isTrue();
            assertThat(branch(tree, "bs2", "c1").getChildBranchSet()).isSameAs(bs3);
            assertThat(branch(tree, "bs2", "c2").getChildBranchSet()).isSameAs(bs3);
        }

        @Test
        @DisplayName("fails when applyToBranches names a branch missing from the parent")
        void shouldRejectUnknownApplyToBranch() {
            assertThatThrownBy(() -> LogicTree.of(gmpe(), maxMag("b1 b9")))
                    .isInstanceOf(InvalidLogicTreeException.class)
                    .hasMessageContaining("[b9]")
                    .hasMessageContaining("'bs1'");
        }

        @Test
        @DisplayName("treats ids as whole tokens")
        void shouldNotMatchSubstrings() {
            BranchSet parent =
                    BranchSet.builder("bs1").branch("b1", "A", 0.5).branch("b10", "B", 0.5).build();

            LogicTree tree = LogicTree.of(parent, maxMag("b10"));

            assertThat(branch(tree, "bs1", "b1").isLeaf()).isTrue();
            assertThat(branch(tree, "bs1", "b10").isLeaf()).isFalse();
        }

        @Test
        @DisplayName("links the known ids when lenient")
        void shouldWarnWhenLenient() {
            LogicTreeConfig lenient =
                    LogicTreeConfig.builder().strictApplyToBranches(false).build();

            LogicTree tree = new LogicTree(List.of(gmpe(), maxMag("b1 b9")), lenient);

            assertThat(branch(tree, "bs1", "b1").isLeaf()).isFalse();
            assertThat(branch(tree, "bs1", "b2").isLeaf()).isTrue();
        }
    }

    @Nested
    @DisplayName("reduce")
    class Reduce {

        @Test
        @DisplayName("re-links the kept branch-sets")
        void shouldRelinkSubsequence() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag("b1"), bValue(null));

            LogicTree reduced = tree.reduce(List.of("bs1", "bs3"));

            assertThat(reduced.getBranchSetIds()).containsExactly("bs1", "bs3");
            BranchSet bs3 = reduced.getBranchSet("bs3").orElseThrow();
            assertThat(branch(reduced, "bs1", "b1").getChildBranchSet()).isSameAs(bs3);
            assertThat(branch(reduced, "bs1", "b2").getChildBranchSet()).isSameAs(bs3);
        }

        @Test
        @DisplayName("leaves the source tree untouched")
        void shouldNotMutateSource() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag("b1"), bValue(null));

            tree.reduce(List.of("bs1", "bs3"));

            assertThat(branch(tree, "bs1", "b1").getChildBranchSet())
                    .isSameAs(tree.getBranchSet("bs2").orElseThrow());
            assertThat(branch(tree, "bs1", "b2").isLeaf()).isTrue();
        }

        @Test
        @DisplayName("follows the requested order")
        void shouldFollowRequestedOrder() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag(null), bValue(null));

            LogicTree reduced = tree.reduce(List.of("bs3", "bs1"));

            assertThat(reduced.getBranchSetIds()).containsExactly("bs3", "bs1");
            assertThat(reduced.rootBranches())
                    .extracting(Branch::getBranchId)
                    .containsExactly("d1", "d2", "d3");
        }

        @Test
        @DisplayName("fails when a kept filter no longer matches its new parent")
        void shouldRejectStaleFilter() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag(null), bValue("c1"));

            assertThatThrownBy(() -> tree.reduce(List.of("bs1", "bs3")))
                    .isInstanceOf(InvalidLogicTreeException.class)
                    .hasMessageContaining("[c1]");
        }

        @Test
        @DisplayName("rejects unknown ids")
        void shouldRejectUnknownId() {
            LogicTree tree = LogicTree.of(gmpe());

            assertThatThrownBy(() -> tree.reduce(List.of("bs1", "nope")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("rejects an empty selection")
        void shouldRejectEmptySelection() {
            LogicTree tree = LogicTree.of(gmpe());

            assertThatThrownBy(() -> tree.reduce(List.of()))
                    .isInstanceOf(InvalidLogicTreeException.class);
        }
    }

    @Nested
    @DisplayName("counts")
    class Counts {

        @Test
        @DisplayName("agree when no filter is present")
        void shouldAgreeWithoutFilters() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag(null), bValue(null));

            assertThat(tree.flatPathCount()).isEqualTo(12);
            assertThat(tree.countLinkedRealizations()).isEqualTo(12);
        }

        @Test
        @DisplayName("diverge when a filter skips parent branches")
        void shouldDivergeWithFilters() {
            LogicTree tree = LogicTree.of(gmpe(), maxMag("b1"), bValue(null));

            assertThat(tree.flatPathCount()).isEqualTo(12);
            // b1 -> c1, c2 -> d1..d3 gives 6, b2 is a leaf
            assertThat(tree.countLinkedRealizations()).isEqualTo(7);
        }
    }

    @Test
    void shouldRefuseMarkupExport() {
        LogicTree tree = LogicTree.of(gmpe());

        assertThatThrownBy(() -> tree.writeMarkup(new StringWriter()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldPrintBranchSetIds() {
        assertThat(LogicTree.of(gmpe(), maxMag(null))).hasToString("<LogicTree[bs1, bs2]>");
    }
}
