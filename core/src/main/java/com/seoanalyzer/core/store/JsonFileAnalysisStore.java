package com.seoanalyzer.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seoanalyzer.core.api.AnalysisStore;
import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.AnalysisJob;
import com.seoanalyzer.core.model.JobStatus;
import com.seoanalyzer.core.model.JobSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 파일 기반 내구성 저장소.
 *  - 잡: {@code <dir>/jobs/<id>.json} (임시파일 → 원자적 이동)
 *  - 액션 로그: {@code <dir>/actions.jsonl} (append-only, 한 줄 = 한 엔트리)
 * 같은 디렉터리로 다시 열면 이전 잡/로그가 그대로 보인다.
 */
public final class JsonFileAnalysisStore implements AnalysisStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileAnalysisStore.class);

    /** jobs/<id>.json 파일 포맷 (v=1) */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class JobDocument {
        public String v = "1";
        public String id;
        public String target;
        public String status;
        public Instant createdAt;
        public Instant updatedAt;
        public Instant completedAt;     // 종결 시에만
        public int overallScore;
        public Map<String, Object> analysisResult;
        public String reportMarkdown;
        public String errorMessage;
    }

    /** actions.jsonl 한 줄 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ActionLine {
        public String jobId;
        public String worker;
        public String action;
        public Map<String, Object> detail;
        public Long durationMs;
        public Instant createdAt;
    }

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path jobsDir;
    private final Path actionsFile;
    private final Map<String, Object> jobLocks = new ConcurrentHashMap<>();
    private final Object actionsLock = new Object();

    public JsonFileAnalysisStore(Path dataDir) {
        Objects.requireNonNull(dataDir, "dataDir");
        this.jobsDir = dataDir.resolve("jobs");
        this.actionsFile = dataDir.resolve("actions.jsonl");
        try {
            Files.createDirectories(jobsDir);
        } catch (IOException e) {
            throw new AnalysisStoreException("Cannot create data directory: " + jobsDir.toAbsolutePath(), e);
        }
        LOG.info("Analysis store initialized at: {}", dataDir.toAbsolutePath());
    }

    @Override
    public AnalysisJob createJob(String target) {
        Objects.requireNonNull(target, "target");
        String id;
        do { id = JobIds.next(); } while (Files.exists(jobFile(id)));

        JobDocument doc = new JobDocument();
        doc.id = id;
        doc.target = target;
        doc.status = JobStatus.PENDING.wireName();
        doc.createdAt = Instant.now();
        doc.updatedAt = doc.createdAt;
        synchronized (lockFor(id)) {
            write(doc);
        }
        LOG.info("Created analysis request: {} for {}", id, target);
        return toJob(doc);
    }

    @Override
    public AnalysisJob updateStatus(String jobId, JobStatus status, Map<String, Object> resultSummary,
                                    String report, String error, Integer overallScore) {
        Objects.requireNonNull(status, "status");
        synchronized (lockFor(jobId)) {
            JobDocument doc = read(jobId)
                    .orElseThrow(() -> new AnalysisStoreException("Unknown job: " + jobId));
            doc.status = status.wireName();
            doc.updatedAt = Instant.now();
            if (status.isTerminal()) doc.completedAt = doc.updatedAt;
            if (resultSummary != null) doc.analysisResult = new LinkedHashMap<>(resultSummary);
            if (report != null) doc.reportMarkdown = report;
            if (error != null) doc.errorMessage = error;
            if (overallScore != null) doc.overallScore = overallScore;
            write(doc);
            LOG.debug("Updated request {} status to: {}", jobId, doc.status);
            return toJob(doc);
        }
    }

    @Override
    public void appendLog(String jobId, String worker, String action, Map<String, Object> detail, Long durationMs) {
        ActionLine line = new ActionLine();
        line.jobId = jobId;
        line.worker = worker;
        line.action = action;
        line.detail = (detail == null ? null : new LinkedHashMap<>(detail));
        line.durationMs = durationMs;
        line.createdAt = Instant.now();

        String json;
        try {
            json = om.writeValueAsString(line) + "\n";
        } catch (JsonProcessingException e) {
            throw new AnalysisStoreException("Cannot serialize action log entry: " + action, e);
        }
        // 한 줄을 한 번의 write로 추가
        synchronized (actionsLock) {
            try {
                Files.writeString(actionsFile, json, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new AnalysisStoreException("Cannot append action log: " + actionsFile, e);
            }
        }
    }

    /** 읽을 수 없는 문서는 경고만 남기고 건너뛴다 */
    @Override
    public List<JobSummary> listJobs(int limit) {
        try (Stream<Path> files = Files.list(jobsDir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .map(this::readListed)
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(AnalysisJob::getCreatedAt).reversed())
                    .limit(Math.max(0, limit))
                    .map(JobSummary::of)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new AnalysisStoreException("Cannot list jobs in " + jobsDir, e);
        }
    }

    @Override
    public Optional<AnalysisJob> findJob(String jobId) {
        if (jobId == null || jobId.isBlank()) return Optional.empty();
        return read(jobId).map(this::toJob);
    }

    /** 저장된 결과 요약(워커별 성공/소요시간 등) */
    public Optional<Map<String, Object>> resultSummaryOf(String jobId) {
        return read(jobId).map(d -> d.analysisResult);
    }

    @Override
    public List<ActionLogEntry> logsFor(String jobId) {
        if (!Files.exists(actionsFile)) return List.of();
        List<ActionLogEntry> out = new ArrayList<>();
        synchronized (actionsLock) {
            try (BufferedReader r = Files.newBufferedReader(actionsFile, StandardCharsets.UTF_8)) {
                String s;
                while ((s = r.readLine()) != null) {
                    if (s.isBlank()) continue;
                    ActionLine line;
                    try {
                        line = om.readValue(s, ActionLine.class);
                    } catch (JsonProcessingException e) {
                        LOG.warn("Skipping malformed action log line: {}", e.getOriginalMessage());
                        continue;
                    }
                    if (Objects.equals(line.jobId, jobId)) {
                        out.add(new ActionLogEntry(line.jobId, line.worker, line.action,
                                line.detail, line.durationMs, line.createdAt));
                    }
                }
            } catch (IOException e) {
                throw new AnalysisStoreException("Cannot read action log: " + actionsFile, e);
            }
        }
        return out;
    }

    // ------------ helpers ------------

    private Object lockFor(String jobId) {
        return jobLocks.computeIfAbsent(String.valueOf(jobId), k -> new Object());
    }

    private Path jobFile(String jobId) {
        return jobsDir.resolve(jobId + ".json");
    }

    /** 형식이 틀린 id 는 경로로 풀지 않고 없는 잡으로 본다 */
    private Optional<JobDocument> read(String jobId) {
        if (!JobIds.isValid(jobId)) {
            LOG.debug("Rejected malformed job id: {}", jobId);
            return Optional.empty();
        }
        Path p = jobFile(jobId);
        if (!Files.exists(p)) return Optional.empty();
        return readFile(p);
    }

    private Optional<JobDocument> readFile(Path p) {
        try {
            return Optional.of(om.readValue(p.toFile(), JobDocument.class));
        } catch (IOException e) {
            throw new AnalysisStoreException("Cannot read job document: " + p, e);
        }
    }

    private Optional<AnalysisJob> readListed(Path p) {
        try {
            return readFile(p).map(this::toJob);
        } catch (AnalysisStoreException | IllegalArgumentException e) {
            LOG.warn("Skipping unreadable job document {}: {}", p.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /** 임시파일에 쓰고 원자적으로 교체 */
    private void write(JobDocument doc) {
        Path target = jobFile(doc.id);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), doc);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try { Files.deleteIfExists(tmp); } catch (IOException suppressed) { e.addSuppressed(suppressed); }
            throw new AnalysisStoreException("Cannot write job document: " + target, e);
        }
    }

    private AnalysisJob toJob(JobDocument d) {
        return AnalysisJob.builder()
                .id(d.id)
                .target(d.target)
                .status(JobStatus.fromWire(d.status))
                .createdAt(d.createdAt)
                .completedAt(d.completedAt)
                .overallScore(d.overallScore)
                .finalReport(d.reportMarkdown)
                .errorMessage(d.errorMessage)
                .build();
    }
}
