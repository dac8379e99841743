package com.seoanalyzer.app;

import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.api.AnalysisStore;
import com.seoanalyzer.core.api.ArtifactGenerator;
import com.seoanalyzer.core.capability.GeminiCapability;
import com.seoanalyzer.core.export.PdfArtifactGenerator;
import com.seoanalyzer.core.job.AnalysisJobService;
import com.seoanalyzer.core.job.RequestTracker;
import com.seoanalyzer.core.model.AnalyzerConfig;
import com.seoanalyzer.core.observability.ObservabilityRecorder;
import com.seoanalyzer.core.orchestrator.AnalysisOrchestrator;
import com.seoanalyzer.core.session.SessionRegistry;
import com.seoanalyzer.core.store.JsonFileAnalysisStore;

import java.util.Objects;
import java.util.function.Function;

/** 프로세스 시작 시 한 번 조립하는 구성 루트 (전역 싱글톤 없음) */
final class AnalyzerRuntime implements AutoCloseable {

    final AnalyzerConfig config;
    final AnalysisStore store;
    final RequestTracker tracker;
    final ObservabilityRecorder recorder;
    final AnalysisOrchestrator orchestrator;
    final AnalysisJobService jobs;

    AnalyzerRuntime(AnalyzerConfig config, Function<AnalyzerConfig, AnalysisCapability> capabilityFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = new JsonFileAnalysisStore(config.getDataDir());
        this.tracker = new RequestTracker(store);
        this.recorder = new ObservabilityRecorder(store);
        AnalysisCapability capability = (capabilityFactory != null)
                ? capabilityFactory.apply(config)
                : new GeminiCapability(config.capability());
        ArtifactGenerator artifacts = config.isArtifactsEnabled()
                ? new PdfArtifactGenerator(config.getOutputDir())
                : ArtifactGenerator.NONE;
        this.orchestrator = new AnalysisOrchestrator(tracker, capability, new SessionRegistry(), recorder, artifacts);
        this.jobs = new AnalysisJobService(orchestrator, tracker, config.getMaxQueuedJobs());
    }

    @Override
    public void close() {
        jobs.close();
    }
}
