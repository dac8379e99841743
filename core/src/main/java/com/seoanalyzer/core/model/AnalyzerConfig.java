package com.seoanalyzer.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 분석기 설정 (seo-analyzer.yml 매핑 대상). 순수 설정 보관용.
 * 시스템 프로퍼티 오버라이드는 YamlConfigLoader 쪽에서 적용.
 */
public final class AnalyzerConfig {

    /** 분석 capability(원격 모델) 호출 설정: YAML의 `capability:` 섹션 */
    public static final class CapabilityCfg {
        private String endpoint = "https://generativelanguage.googleapis.com/v1beta";
        private String model = "gemini-2.5-flash";
        /** API 키를 꺼낼 환경변수 이름 (키 자체는 설정 파일에 두지 않음) */
        private String apiKeyEnv = "GOOGLE_API_KEY";
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 2;
        private long retryBaseMs = 500;

        public String getEndpoint() { return endpoint; }
        public CapabilityCfg setEndpoint(String v) { if (v != null && !v.isBlank()) this.endpoint = v.trim(); return this; }

        public String getModel() { return model; }
        public CapabilityCfg setModel(String v) { if (v != null && !v.isBlank()) this.model = v.trim(); return this; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public CapabilityCfg setApiKeyEnv(String v) { if (v != null && !v.isBlank()) this.apiKeyEnv = v.trim(); return this; }

        public Duration getTimeout() { return timeout; }
        public CapabilityCfg setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }

        public int getMaxRetries() { return maxRetries; }
        public CapabilityCfg setMaxRetries(int v) { this.maxRetries = Math.max(0, v); return this; }

        public long getRetryBaseMs() { return retryBaseMs; }
        public CapabilityCfg setRetryBaseMs(long v) { this.retryBaseMs = Math.max(1, v); return this; }
    }

    private Path dataDir = Path.of("data");
    private Path outputDir = Path.of("out");
    private String logLevel = "INFO";
    private int historyLimit = 20;
    private boolean artifactsEnabled = true;
    private int maxQueuedJobs = 16;
    private final CapabilityCfg capability = new CapabilityCfg();

    // ---------- getters ----------
    public Path getDataDir() { return dataDir; }
    public Path getOutputDir() { return outputDir; }
    public String getLogLevel() { return logLevel; }
    public int getHistoryLimit() { return historyLimit; }
    public boolean isArtifactsEnabled() { return artifactsEnabled; }
    public int getMaxQueuedJobs() { return maxQueuedJobs; }
    public CapabilityCfg capability() { return capability; }

    // ---------- fluent setters ----------
    public AnalyzerConfig setDataDir(Path dataDir) { this.dataDir = dataDir; return this; }
    public AnalyzerConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public AnalyzerConfig setLogLevel(String logLevel) { this.logLevel = logLevel; return this; }
    public AnalyzerConfig setHistoryLimit(int historyLimit) { this.historyLimit = Math.max(1, historyLimit); return this; }
    public AnalyzerConfig setArtifactsEnabled(boolean v) { this.artifactsEnabled = v; return this; }
    public AnalyzerConfig setMaxQueuedJobs(int v) { this.maxQueuedJobs = Math.max(1, v); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(outputDir, "outputDir");
        if (historyLimit < 1) throw new IllegalArgumentException("historyLimit must be >= 1");
        if (maxQueuedJobs < 1) throw new IllegalArgumentException("jobs.maxQueued must be >= 1");
        if (capability.getTimeout() == null || capability.getTimeout().isZero() || capability.getTimeout().isNegative())
            throw new IllegalArgumentException("capability.timeoutMs must be > 0");
    }

    public static AnalyzerConfig defaults() { return new AnalyzerConfig(); }
}
