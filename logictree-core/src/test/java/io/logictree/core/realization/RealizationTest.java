package io.logictree.core.realization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RealizationTest {

    @Test
    void shouldJoinPathWithTilde() {
        Realization rlz = new Realization(List.of("A", "X"), 0.15, List.of("b1", "c1"), 0);

        assertThat(rlz.pathKey()).isEqualTo("b1~c1");
    }

    @Test
    void shouldCopyLists() {
        List<String> path = new ArrayList<>(List.of("b1"));
        Realization rlz = new Realization(List.of("A"), 1.0, path, 0);

        path.add("c1");

        assertThat(rlz.ltPath()).containsExactly("b1");
        assertThatThrownBy(() -> rlz.value().add("B"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectMismatchedLengths() {
        assertThatThrownBy(() -> new Realization(List.of("A", "X"), 1.0, List.of("b1"), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("differ in length");
    }

    @Test
    void shouldKeepOrdinalBeyondIntRange() {
        Realization rlz = new Realization(List.of("A"), 1.0, List.of("b1"), 3_000_000_000L);

        assertThat(rlz.ordinal()).isEqualTo(3_000_000_000L);
    }

    @Test
    void shouldRejectNegativeOrdinal() {
        assertThatThrownBy(() -> new Realization(List.of("A"), 1.0, List.of("b1"), -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ordinal");
    }
}
