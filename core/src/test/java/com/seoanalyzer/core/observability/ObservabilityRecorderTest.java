package com.seoanalyzer.core.observability;

import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.JobStatus;
import com.seoanalyzer.core.store.AnalysisStoreException;
import com.seoanalyzer.core.store.FlakyStore;
import com.seoanalyzer.core.store.InMemoryAnalysisStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObservabilityRecorderTest {

    @Test
    void analysis_lifecycle_updates_counters_histograms_and_trace() {
        ObservabilityRecorder rec = new ObservabilityRecorder(new InMemoryAnalysisStore());

        String traceId = rec.startAnalysis("https://example.com", "job-1");
        rec.agentStart("security_agent", "https://example.com", "job-1");
        rec.agentComplete("security_agent", 120, true, "job-1");
        rec.agentStart("onpage_agent", "https://example.com", "job-1");
        rec.agentComplete("onpage_agent", 30, false, "job-1");
        rec.batchDuration(125);
        rec.endAnalysis(traceId, 300, "completed");

        MetricsCollector m = rec.metrics();
        assertThat(m.counterValue(ObservabilityRecorder.ANALYSIS_STARTS, Map.of())).isEqualTo(1d);
        assertThat(m.counterValue(ObservabilityRecorder.ANALYSIS_COMPLETIONS, Map.of("status", "completed"))).isEqualTo(1d);
        assertThat(m.counterValue(ObservabilityRecorder.AGENT_STARTS, Map.of("agent", "security_agent"))).isEqualTo(1d);
        assertThat(m.counterValue(ObservabilityRecorder.AGENT_COMPLETIONS,
                Map.of("agent", "onpage_agent", "status", "error"))).isEqualTo(1d);
        assertThat(m.histograms()).containsKeys("agent_duration{agent=security_agent}", "parallel_batch_duration",
                "analysis_duration");
        assertThat(rec.tracer().openTraceCount()).isZero();

        ObservabilitySnapshot snap = rec.snapshot();
        assertThat(snap.tracesOpened()).isEqualTo(1);
        assertThat(snap.tracesClosed()).isEqualTo(1);
        assertThat(snap.counters()).containsKey("agent_completions{agent=security_agent,status=success}");
    }

    @Test
    void action_log_goes_through_the_store_in_order() {
        ObservabilityRecorder rec = new ObservabilityRecorder(new InMemoryAnalysisStore());

        rec.logAction("job-1", "orchestrator", "parallel_analysis_start", Map.of("url", "https://example.com"), null);
        rec.logAction("job-2", "security_agent", "analysis_complete", Map.of("result_length", 10), 5L);
        rec.logAction("job-1", "security_agent", "analysis_error", null, 7L);

        List<ActionLogEntry> logs = rec.actionsFor("job-1");
        assertThat(logs).extracting(ActionLogEntry::action).containsExactly("parallel_analysis_start", "analysis_error");
        assertThat(logs.get(1).detail()).isEmpty();
        assertThat(logs.get(1).durationMs()).isEqualTo(7L);
        assertThat(rec.actionsFor("job-3")).isEmpty();
    }

    @Test
    void store_failure_while_logging_propagates() {
        ObservabilityRecorder rec = new ObservabilityRecorder(new FlakyStore().failAction("analysis_complete"));

        assertThatThrownBy(() -> rec.logAction("job-1", "w", "analysis_complete", Map.of(), 1L))
                .isInstanceOf(AnalysisStoreException.class);
    }

    @Test
    void replay_rebuilds_counters_from_stored_jobs_and_actions() {
        InMemoryAnalysisStore store = new InMemoryAnalysisStore();
        String done = store.createJob("https://a.example").getId();
        store.updateStatus(done, JobStatus.ANALYZING, null, null, null, null);
        store.updateStatus(done, JobStatus.COMPLETED, null, "r", null, 80);
        store.appendLog(done, "orchestrator", "parallel_analysis_start", Map.of(), null);
        store.appendLog(done, "security_agent", "analysis_complete", Map.of(), 120L);
        store.appendLog(done, "onpage_agent", "analysis_error", Map.of("error", "boom"), 40L);
        store.createJob("https://b.example");

        // 새 프로세스: 인메모리 지표는 비어 있다
        ObservabilityRecorder fresh = new ObservabilityRecorder(store);
        assertThat(fresh.snapshot().counters()).isEmpty();

        ObservabilitySnapshot replay = fresh.replayFromStore(50);

        assertThat(replay.counters())
                .containsEntry("analysis_starts", 2d)
                .containsEntry("analysis_completions{status=completed}", 1d)
                .containsEntry("agent_completions{agent=security_agent,status=success}", 1d)
                .containsEntry("agent_completions{agent=onpage_agent,status=error}", 1d)
                .doesNotContainKey("agent_completions{agent=orchestrator,status=success}");
        assertThat(replay.histograms().get("agent_duration{agent=security_agent}").max()).isEqualTo(120d);
        assertThat(replay.histograms()).containsKey("analysis_duration");
        assertThat(replay.recentTraces()).isEmpty();
        assertThat(fresh.replayFromStore(0).counters()).isEmpty();
    }

    @Test
    void metrics_keys_sort_labels() {
        MetricsCollector m = new MetricsCollector();
        m.counter("c", Map.of("z", "1", "a", "2"));
        m.counter("c", 2, Map.of("a", "2", "z", "1"));

        assertThat(m.counters()).containsEntry("c{a=2,z=1}", 3d);
        assertThat(m.recent()).hasSize(2);
        m.clear();
        assertThat(m.counters()).isEmpty();
    }
}
