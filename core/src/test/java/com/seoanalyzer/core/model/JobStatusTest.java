package com.seoanalyzer.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTest {

    @Test
    void only_forward_single_steps_are_allowed() {
        assertThat(JobStatus.PENDING.canAdvanceTo(JobStatus.ANALYZING)).isTrue();
        assertThat(JobStatus.PENDING.canAdvanceTo(JobStatus.COMPLETED)).isFalse();
        assertThat(JobStatus.ANALYZING.canAdvanceTo(JobStatus.PARTIAL)).isTrue();
        assertThat(JobStatus.ANALYZING.canAdvanceTo(JobStatus.PENDING)).isFalse();
        for (JobStatus terminal : new JobStatus[]{JobStatus.COMPLETED, JobStatus.PARTIAL, JobStatus.FAILED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (JobStatus next : JobStatus.values()) {
                assertThat(terminal.canAdvanceTo(next)).isFalse();
            }
        }
        assertThat(JobStatus.ANALYZING.canAdvanceTo(null)).isFalse();
    }

    @Test
    void wire_names_are_lowercase_and_parse_back() {
        assertThat(JobStatus.PARTIAL.wireName()).isEqualTo("partial");
        assertThat(JobStatus.fromWire(" Completed ")).isEqualTo(JobStatus.COMPLETED);
        assertThat(JobStatus.fromWire(null)).isEqualTo(JobStatus.PENDING);
        assertThatThrownBy(() -> JobStatus.fromWire("done")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void worker_result_failure_never_has_blank_error() {
        WorkerResult r = WorkerResult.failure("w", " ", -5);
        assertThat(r.getError()).isEqualTo("unknown error");
        assertThat(r.getDurationMs()).isZero();
        assertThat(OutputFragment.join(java.util.List.of(new OutputFragment("a"), new OutputFragment(null))))
                .isEqualTo("a");
    }
}
