package com.seoanalyzer.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.job.JobNotFoundException;
import com.seoanalyzer.core.model.ActionLogEntry;
import com.seoanalyzer.core.model.AnalysisOutcome;
import com.seoanalyzer.core.model.AnalyzerConfig;
import com.seoanalyzer.core.model.JobProgress;
import com.seoanalyzer.core.model.JobStatus;
import com.seoanalyzer.core.model.JobSummary;
import com.seoanalyzer.core.model.WorkerResult;
import com.seoanalyzer.core.util.LoggingConfigurator;
import com.seoanalyzer.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * 명령행 진입점.
 *   analyze <url> [-o report.md] [-v]
 *   history [-n N]
 *   logs <jobId>
 *   metrics [-n N]
 * 공통 옵션: -c/--config <seo-analyzer.yml>
 * 종료 코드: 0 정상, 1 잡 실패, 2 사용법/설정 오류
 */
public final class SeoAnalyzerCli {

    private static final Logger LOG = LoggerFactory.getLogger(SeoAnalyzerCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Duration JOB_TIMEOUT = Duration.ofMinutes(15);
    private static final long POLL_MS = 500;
    private static final int METRICS_JOB_LIMIT = 1000;

    private final PrintStream out;
    private final PrintStream err;
    private final Function<AnalyzerConfig, AnalysisCapability> capabilityFactory;
    private final boolean configureLogging;
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public SeoAnalyzerCli(PrintStream out, PrintStream err) {
        this(out, err, null, true);
    }

    /** 테스트용: capability 주입, 로깅 설정 생략 */
    SeoAnalyzerCli(PrintStream out, PrintStream err,
                   Function<AnalyzerConfig, AnalysisCapability> capabilityFactory,
                   boolean configureLogging) {
        this.out = out;
        this.err = err;
        this.capabilityFactory = capabilityFactory;
        this.configureLogging = configureLogging;
    }

    public static void main(String[] args) {
        int code = new SeoAnalyzerCli(System.out, System.err).run(args);
        System.exit(code);
    }

    public int run(String[] args) {
        Deque<String> rest = new ArrayDeque<>(List.of(args == null ? new String[0] : args));
        Map<String, String> opts = new HashMap<>();
        Deque<String> positional = new ArrayDeque<>();
        boolean verbose = false;

        while (!rest.isEmpty()) {
            String a = rest.poll();
            switch (a) {
                case "-c": case "--config":
                case "-o": case "--output":
                case "-n": case "--limit":
                    if (rest.isEmpty()) return usage("missing value for " + a);
                    opts.put(canonical(a), rest.poll());
                    break;
                case "-v": case "--verbose":
                    verbose = true;
                    break;
                case "-h": case "--help":
                    printUsage(out);
                    return EXIT_OK;
                default:
                    positional.add(a);
            }
        }
        if (positional.isEmpty()) return usage("missing command");
        String command = positional.poll();

        AnalyzerConfig cfg;
        try {
            cfg = loadConfig(opts.get("config"));
        } catch (IOException | RuntimeException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (configureLogging) {
            LoggingConfigurator.init(cfg.getOutputDir().resolve("logs"),
                    LoggingConfigurator.levelOf(cfg.getLogLevel(), Level.INFO), 2 * 1024 * 1024, 5);
        }

        try (AnalyzerRuntime rt = new AnalyzerRuntime(cfg, capabilityFactory)) {
            switch (command) {
                case "analyze":
                    if (positional.isEmpty()) return usage("analyze needs a <url>");
                    return analyze(rt, positional.poll(), opts.get("output"), verbose);
                case "history":
                    return history(rt, parseLimit(opts.get("limit"), cfg.getHistoryLimit()));
                case "logs":
                    if (positional.isEmpty()) return usage("logs needs a <jobId>");
                    return logs(rt, positional.poll());
                case "metrics":
                    return metrics(rt, parseLimit(opts.get("limit"), METRICS_JOB_LIMIT));
                default:
                    return usage("unknown command: " + command);
            }
        } catch (IOException | RuntimeException e) {
            LOG.error("Command {} failed: {}", command, e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    /* =========================
       commands
       ========================= */

    private int analyze(AnalyzerRuntime rt, String target, String outputFile, boolean verbose) throws IOException {
        final String jobId;
        try {
            jobId = rt.jobs.submit(target);
        } catch (IllegalArgumentException | RejectedExecutionException e) {
            err.println("Cannot start analysis: " + e.getMessage());
            return EXIT_USAGE;
        }
        out.println("Job " + jobId + " submitted for " + target);

        AnalysisOutcome outcome;
        try {
            outcome = waitFor(rt, jobId, verbose);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            err.println("Interrupted while waiting for job " + jobId);
            return EXIT_FAILED;
        } catch (TimeoutException | ExecutionException e) {
            err.println("Job " + jobId + " did not finish: " + e.getMessage());
            return EXIT_FAILED;
        }

        printOutcome(outcome);
        if (outputFile != null && outcome.getFinalReport() != null) {
            Path p = Path.of(outputFile);
            if (p.getParent() != null) Files.createDirectories(p.getParent());
            Files.writeString(p, outcome.getFinalReport(), StandardCharsets.UTF_8);
            out.println("Report written to " + p.toAbsolutePath());
        }
        return outcome.getStatus() == JobStatus.FAILED ? EXIT_FAILED : EXIT_OK;
    }

    private AnalysisOutcome waitFor(AnalyzerRuntime rt, String jobId, boolean verbose)
            throws InterruptedException, TimeoutException, ExecutionException {
        if (!verbose) return rt.jobs.await(jobId, JOB_TIMEOUT);

        long deadline = System.nanoTime() + JOB_TIMEOUT.toNanos();
        String last = "";
        while (true) {
            String line = progressLine(rt.jobs.progress(jobId));
            if (!line.equals(last)) {
                out.println(line);
                last = line;
            }
            try {
                return rt.jobs.await(jobId, Duration.ofMillis(POLL_MS));
            } catch (TimeoutException e) {
                // 아직 실행 중이면 다시 폴링
                if (System.nanoTime() > deadline) throw e;
            }
        }
    }

    private int history(AnalyzerRuntime rt, int limit) {
        List<JobSummary> jobs = rt.tracker.list(limit);
        if (jobs.isEmpty()) {
            out.println("No analyses yet.");
            return EXIT_OK;
        }
        out.printf("%-10s %-10s %-25s %s%n", "ID", "STATUS", "CREATED", "TARGET");
        for (JobSummary j : jobs) {
            out.printf("%-10s %-10s %-25s %s%n", j.id(), j.status().wireName(), j.createdAt(), j.target());
        }
        return EXIT_OK;
    }

    /** stored: 저장소(잡 문서 + actions.jsonl) 재집계, live: 이 프로세스의 인메모리 지표 */
    private int metrics(AnalyzerRuntime rt, int jobLimit) throws IOException {
        ObjectNode n = om.createObjectNode();
        n.set("stored", om.valueToTree(rt.recorder.replayFromStore(jobLimit)));
        n.set("live", om.valueToTree(rt.recorder.snapshot()));
        out.println(om.writeValueAsString(n));
        return EXIT_OK;
    }

    private int logs(AnalyzerRuntime rt, String jobId) {
        try {
            rt.tracker.get(jobId);
        } catch (JobNotFoundException e) {
            err.println("No such job: " + jobId);
            return EXIT_FAILED;
        }
        List<ActionLogEntry> entries = rt.recorder.actionsFor(jobId);
        for (ActionLogEntry e : entries) {
            out.printf("%s %-20s %-26s %s%s%n",
                    e.createdAt(), e.worker(), e.action(),
                    e.detail() == null ? "{}" : e.detail(),
                    e.durationMs() == null ? "" : " (" + e.durationMs() + "ms)");
        }
        if (entries.isEmpty()) out.println("No actions logged for " + jobId);
        return EXIT_OK;
    }

    /* =========================
       helpers
       ========================= */

    private void printOutcome(AnalysisOutcome o) {
        out.println();
        out.println("Status:        " + o.getStatus().wireName());
        if (o.getErrorMessage() != null) out.println("Error:         " + o.getErrorMessage());
        out.println("Overall score: " + o.getOverallScore() + "/100");
        out.println("Duration:      " + o.getTotalDurationMs() + "ms");
        out.println();
        out.println("Workers:");
        for (WorkerResult r : o.getWorkerResults().values()) {
            out.printf("  %-20s %-8s %6dms%s%n", r.getWorkerName(), r.isSuccess() ? "ok" : "failed",
                    r.getDurationMs(), r.isSuccess() ? "" : "  " + r.getError());
        }
        if (!o.getCategoryScores().isEmpty()) {
            out.println();
            out.println("Category scores:");
            o.getCategoryScores().forEach((k, v) -> out.printf("  %-14s %3d%n", k, v));
        }
        if (o.getReportStats() != null) {
            out.printf("Issues: %d, warnings: %d, passed: %d%n",
                    o.getReportStats().issues(), o.getReportStats().warnings(), o.getReportStats().passed());
        }
        o.getArtifactPath().ifPresent(p -> out.println("PDF report:    " + p.toAbsolutePath()));
        if (o.getFinalReport() != null) {
            out.println();
            out.println(o.getFinalReport());
        }
    }

    static String progressLine(JobProgress p) {
        StringBuilder sb = new StringBuilder("[").append(p.jobId()).append("] ").append(p.status().wireName());
        for (JobProgress.WorkerProgress w : p.perWorkerStatus()) {
            sb.append(' ').append(w.name()).append('=').append(w.status().wireName());
        }
        return sb.toString();
    }

    private static AnalyzerConfig loadConfig(String explicit) throws IOException {
        if (explicit != null) return YamlConfigLoader.load(Path.of(explicit));
        Path def = Path.of(YamlConfigLoader.DEFAULT_FILE);
        if (Files.exists(def)) return YamlConfigLoader.load(def);
        return YamlConfigLoader.applySystemOverrides(AnalyzerConfig.defaults());
    }

    private static String canonical(String opt) {
        switch (opt) {
            case "-c": case "--config": return "config";
            case "-o": case "--output": return "output";
            default: return "limit";
        }
    }

    private static int parseLimit(String s, int def) {
        if (s == null) return def;
        try {
            return Math.max(1, Integer.parseInt(s.trim()));
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private int usage(String problem) {
        err.println(problem);
        printUsage(err);
        return EXIT_USAGE;
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: seo-analyzer [-c seo-analyzer.yml] <command>");
        ps.println("  analyze <url> [-o report.md] [-v]   run a full analysis");
        ps.println("  history [-n N]                       list recent analyses");
        ps.println("  logs <jobId>                         show the action log of one analysis");
        ps.println("  metrics [-n N]                       print stored (last N jobs) and live metrics (JSON)");
    }
}
