package com.seoanalyzer.core.orchestrator;

import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.WorkerResult;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.model.WorkerState;
import com.seoanalyzer.core.observability.MetricsCollector;
import com.seoanalyzer.core.observability.ObservabilityRecorder;
import com.seoanalyzer.core.observability.Span;
import com.seoanalyzer.core.observability.SpanRef;
import com.seoanalyzer.core.observability.Tracer;
import com.seoanalyzer.core.session.SessionRegistry;
import com.seoanalyzer.core.store.FlakyStore;
import com.seoanalyzer.core.store.InMemoryAnalysisStore;
import com.seoanalyzer.core.util.WorkerProgressListener;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelCoordinatorTest {

    private static final String URL = "https://example.com";

    private final Tracer tracer = new Tracer();
    private final SessionRegistry sessions = new SessionRegistry();

    private ObservabilityRecorder recorderOn(com.seoanalyzer.core.api.AnalysisStore store) {
        return new ObservabilityRecorder(tracer, new MetricsCollector(), store);
    }

    @Test
    void all_workers_run_concurrently_and_results_keep_worker_order() {
        ScriptedCapability cap = new ScriptedCapability().delay(300);
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(new InMemoryAnalysisStore()));

        String traceId = tracer.startTrace("t");
        Map<String, WorkerResult> results = pc.runAll(URL, "job-1", SeoWorkers.analysisWorkers(),
                SpanRef.root(traceId), WorkerProgressListener.NONE);

        List<String> expected = SeoWorkers.analysisWorkers().stream().map(WorkerSpec::name).collect(Collectors.toList());
        assertThat(results.keySet()).containsExactlyElementsOf(expected);
        assertThat(results.values()).allMatch(WorkerResult::isSuccess);
        // 5개가 순차가 아니라 동시에 떠 있어야 한다
        assertThat(cap.maxInFlight()).isEqualTo(5);
    }

    @Test
    void one_failing_worker_does_not_affect_the_others() {
        ScriptedCapability cap = new ScriptedCapability().fail("onpage_agent");
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(new InMemoryAnalysisStore()));

        Map<String, WorkerResult> results = pc.runAll(URL, "job-2", SeoWorkers.analysisWorkers(),
                SpanRef.root("trace-x"), WorkerProgressListener.NONE);

        assertThat(results).hasSize(5);
        WorkerResult failed = results.get("onpage_agent");
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getError()).isEqualTo("boom from onpage_agent");
        assertThat(failed.getOutput()).isEmpty();
        assertThat(results.values().stream().filter(WorkerResult::isSuccess).count()).isEqualTo(4);
        assertThat(results.get("security_agent").getOutput()).isEqualTo("Score: 80/100");
    }

    @Test
    void every_worker_gets_its_own_session_and_target_bound_instruction() {
        ScriptedCapability cap = new ScriptedCapability();
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(new InMemoryAnalysisStore()));

        pc.runAll(URL, "job-3", SeoWorkers.analysisWorkers(), SpanRef.root("t"), WorkerProgressListener.NONE);

        assertThat(sessions.size()).isEqualTo(5);
        for (WorkerSpec w : SeoWorkers.analysisWorkers()) {
            assertThat(cap.sessionIdOf(w.name())).isEqualTo("seo_analyzer_job-3_" + w.name());
            assertThat(cap.instructionOf(w.name())).contains(URL);
        }
    }

    @Test
    void same_job_cannot_reuse_sessions() {
        ScriptedCapability cap = new ScriptedCapability();
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(new InMemoryAnalysisStore()));
        pc.runAll(URL, "job-4", SeoWorkers.analysisWorkers(), SpanRef.root("t"), WorkerProgressListener.NONE);

        assertThatThrownBy(() -> pc.runAll(URL, "job-4", SeoWorkers.analysisWorkers(),
                SpanRef.root("t"), WorkerProgressListener.NONE))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("job-4");
    }

    @Test
    void duplicate_worker_names_are_rejected_before_dispatch() {
        ScriptedCapability cap = new ScriptedCapability();
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(new InMemoryAnalysisStore()));
        List<WorkerSpec> dup = List.of(SeoWorkers.SECURITY, SeoWorkers.SECURITY);

        assertThatThrownBy(() -> pc.runAll(URL, "job-5", dup, SpanRef.root("t"), WorkerProgressListener.NONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(cap.calls()).isZero();
        assertThat(sessions.size()).isZero();
    }

    @Test
    void empty_worker_list_returns_empty_map() {
        ParallelCoordinator pc = new ParallelCoordinator(new ScriptedCapability(), sessions,
                recorderOn(new InMemoryAnalysisStore()));
        assertThat(pc.runAll(URL, "job-6", List.of(), SpanRef.root("t"), WorkerProgressListener.NONE)).isEmpty();
    }

    @Test
    void action_log_and_spans_are_recorded_per_worker() {
        InMemoryAnalysisStore store = new InMemoryAnalysisStore();
        ScriptedCapability cap = new ScriptedCapability().fail("content_agent");
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(store));

        String traceId = tracer.startTrace("t");
        pc.runAll(URL, "job-7", SeoWorkers.analysisWorkers(), SpanRef.root(traceId), WorkerProgressListener.NONE);

        List<ActionLogEntry> logs = store.logsFor("job-7");
        assertThat(logs).hasSize(5);
        assertThat(logs).filteredOn(e -> e.action().equals("analysis_error"))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.worker()).isEqualTo("content_agent");
                    assertThat(e.detail()).containsEntry("error", "boom from content_agent");
                });

        List<Span> spans = tracer.spans(traceId);
        assertThat(spans).extracting(Span::getName)
                .containsExactlyInAnyOrder("agent_security_agent", "agent_onpage_agent", "agent_content_agent",
                        "agent_performance_agent", "agent_indexability_agent");
        assertThat(spans).filteredOn(s -> s.getName().equals("agent_content_agent"))
                .singleElement()
                .satisfies(s -> assertThat(s.getStatus()).isEqualTo(Span.Status.ERROR));
    }

    @Test
    void worker_whose_failure_cannot_be_recorded_is_left_out() {
        // 로그 기록 자체가 죽으면 그 워커는 결과 맵에서 빠진다 (나머지는 영향 없음)
        FlakyStore store = new FlakyStore().failLogsOf("performance_agent");
        ParallelCoordinator pc = new ParallelCoordinator(new ScriptedCapability(), sessions, recorderOn(store));

        List<String> events = Collections.synchronizedList(new ArrayList<>());
        Map<String, WorkerResult> results = pc.runAll(URL, "job-8", SeoWorkers.analysisWorkers(), SpanRef.root("t"),
                (j, w, s, d) -> events.add(w + ":" + s));

        assertThat(results).hasSize(4).doesNotContainKey("performance_agent");
        assertThat(events).contains("performance_agent:" + WorkerState.FAILED);
    }

    @Test
    void listener_sees_running_then_terminal_state_and_its_errors_are_ignored() {
        List<String> events = Collections.synchronizedList(new ArrayList<>());
        ScriptedCapability cap = new ScriptedCapability().fail("security_agent");
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(new InMemoryAnalysisStore()));

        Map<String, WorkerResult> results = pc.runAll(URL, "job-9", SeoWorkers.analysisWorkers(), SpanRef.root("t"),
                (j, w, s, d) -> {
                    events.add(w + ":" + s);
                    throw new RuntimeException("listener bug");
                });

        assertThat(results).hasSize(5);
        assertThat(events).contains("security_agent:RUNNING", "security_agent:FAILED",
                "onpage_agent:RUNNING", "onpage_agent:COMPLETED");
    }

    @Test
    void interrupt_during_fan_in_still_settles_every_worker() {
        ScriptedCapability cap = new ScriptedCapability().delay(1_000);
        InMemoryAnalysisStore store = new InMemoryAnalysisStore();
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(store));

        Thread caller = Thread.currentThread();
        Thread interrupter = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException ignored) {
                return;
            }
            caller.interrupt();
        });
        interrupter.start();

        long t0 = System.nanoTime();
        Map<String, WorkerResult> results = pc.runAll(URL, "job-int", SeoWorkers.analysisWorkers(),
                SpanRef.root("t"), WorkerProgressListener.NONE);
        long ms = (System.nanoTime() - t0) / 1_000_000;

        // 인터럽트 플래그는 복구되어 있어야 한다 (interrupted()가 플래그를 지움)
        assertThat(Thread.interrupted()).isTrue();
        assertThat(results).hasSize(5);
        assertThat(results.values()).noneMatch(WorkerResult::isSuccess);
        assertThat(results.values()).allMatch(r -> r.getDurationMs() >= 0);
        assertThat(ms).isLessThan(1_000);
        // 실패 기록도 워커마다 남는다
        for (WorkerSpec w : SeoWorkers.analysisWorkers()) {
            assertThat(store.logsFor("job-int"))
                    .anyMatch(e -> e.worker().equals(w.name()) && e.action().equals("analysis_error"));
        }
    }

    @Test
    void workers_that_ignore_interrupt_are_recorded_as_interrupted() {
        ScriptedCapability cap = new ScriptedCapability().delay(1_500).ignoreInterrupts();
        ParallelCoordinator pc = new ParallelCoordinator(cap, sessions, recorderOn(new InMemoryAnalysisStore()), 100);

        Thread caller = Thread.currentThread();
        Thread interrupter = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException ignored) {
                return;
            }
            caller.interrupt();
        });
        interrupter.start();

        Map<String, WorkerResult> results = pc.runAll(URL, "job-stuck", SeoWorkers.analysisWorkers(),
                SpanRef.root("t"), WorkerProgressListener.NONE);

        assertThat(Thread.interrupted()).isTrue();
        assertThat(results).hasSize(5);
        assertThat(results.values()).allSatisfy(r -> {
            assertThat(r.isSuccess()).isFalse();
            assertThat(r.getError()).isEqualTo(ParallelCoordinator.INTERRUPTED);
        });
    }
}
