package com.rtidy.plugins.r;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BlankRunsTest {

    @Test
    void countsNewlinesAtBothEnds() {
        BlankRuns runs = BlankRuns.record(List.of("", "", "x", "y", "", ""));

        assertThat(runs.getLeading()).isEqualTo(2);
        assertThat(runs.getTrailing()).isEqualTo(2);
    }

    @Test
    void restoreSurroundsTheLines() {
        BlankRuns runs = BlankRuns.record(List.of("", "x", "", "", ""));

        assertThat(runs.restore(List.of("x <- 1"))).containsExactly("", "x <- 1", "", "", "");
    }

    @Test
    void noBlankLines() {
        BlankRuns runs = BlankRuns.record(List.of("x"));

        assertThat(runs.getLeading()).isZero();
        assertThat(runs.getTrailing()).isZero();
        assertThat(runs.restore(List.of("x"))).containsExactly("x");
    }

    @Test
    void interiorBlankLinesAreNotCounted() {
        BlankRuns runs = BlankRuns.record(List.of("x", "", "y"));

        assertThat(runs.getLeading()).isZero();
        assertThat(runs.getTrailing()).isZero();
    }
}
