package io.logictree.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class LogicTreeConfigTest {

    @Test
    void shouldUseDefaults() {
        LogicTreeConfig config = LogicTreeConfig.defaults();

        assertThat(config.getDefaultSeed()).isEqualTo(42L);
        assertThat(config.getWeightTolerance()).isEqualTo(1e-8);
        assertThat(config.isStrictApplyToBranches()).isTrue();
    }

    @Test
    void shouldBuildWithCustomValues() {
        LogicTreeConfig config =
                LogicTreeConfig.builder()
                        .defaultSeed(7L)
                        .weightTolerance(1e-3)
                        .strictApplyToBranches(false)
                        .build();

        assertThat(config.getDefaultSeed()).isEqualTo(7L);
        assertThat(config.getWeightTolerance()).isEqualTo(1e-3);
        assertThat(config.isStrictApplyToBranches()).isFalse();
    }

    @Test
    void shouldRejectNegativeTolerance() {
        assertThatThrownBy(() -> LogicTreeConfig.builder().weightTolerance(-0.1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNaNTolerance() {
        LogicTreeConfig config = new LogicTreeConfig();

        assertThatThrownBy(() -> config.setWeightTolerance(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCopyIndependently() {
        LogicTreeConfig config =
                LogicTreeConfig.builder()
                        .defaultSeed(7L)
                        .weightTolerance(1e-3)
                        .strictApplyToBranches(false)
                        .build();

        LogicTreeConfig copy = config.copy();
        config.setDefaultSeed(1L);
        config.setStrictApplyToBranches(true);

        assertThat(copy.getDefaultSeed()).isEqualTo(7L);
        assertThat(copy.getWeightTolerance()).isEqualTo(1e-3);
        assertThat(copy.isStrictApplyToBranches()).isFalse();
    }
}
