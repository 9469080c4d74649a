package com.chambua.qualifiers.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RunStatusTest {

    @Test
    void statusFollowsFailureCounts() {
        assertThat(RunStatus.fromCounts(10, 0)).isEqualTo(RunStatus.SUCCESS);
        assertThat(RunStatus.fromCounts(10, 1)).isEqualTo(RunStatus.PARTIAL);
        assertThat(RunStatus.fromCounts(10, 9)).isEqualTo(RunStatus.PARTIAL);
        assertThat(RunStatus.fromCounts(10, 10)).isEqualTo(RunStatus.FAILED);
        assertThat(RunStatus.fromCounts(0, 0)).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void onlyRunningIsOpen() {
        assertThat(RunStatus.RUNNING.isTerminal()).isFalse();
        assertThat(RunStatus.SUCCESS.isTerminal()).isTrue();
        assertThat(RunStatus.PARTIAL.isTerminal()).isTrue();
        assertThat(RunStatus.FAILED.isTerminal()).isTrue();
    }
}
