package com.seoanalyzer.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.model.OutputFragment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class SeoAnalyzerCliTest {

    private static final Pattern SUBMITTED = Pattern.compile("Job (\\S+) submitted");

    @TempDir Path dir;
    private Path config;
    private ByteArrayOutputStream outBuf;
    private ByteArrayOutputStream errBuf;

    @BeforeEach
    void writeConfig() throws Exception {
        config = dir.resolve("seo-analyzer.yml");
        Files.writeString(config, String.join("\n",
                "dataDir: '" + dir.resolve("data").toAbsolutePath() + "'",
                "outputDir: '" + dir.resolve("out").toAbsolutePath() + "'",
                "artifacts:",
                "  enabled: false",
                "jobs:",
                "  maxQueued: 2",
                ""));
    }

    private int run(AnalysisCapability capability, String... args) {
        outBuf = new ByteArrayOutputStream();
        errBuf = new ByteArrayOutputStream();
        SeoAnalyzerCli cli = new SeoAnalyzerCli(
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8),
                cfg -> capability,
                false);
        return cli.run(args);
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    private static AnalysisCapability fixed(String text) {
        return (worker, instruction, session) -> List.of(new OutputFragment(text));
    }

    @Test
    void history_on_empty_store() {
        int code = run(fixed("x"), "-c", config.toString(), "history");

        assertThat(code).isEqualTo(SeoAnalyzerCli.EXIT_OK);
        assertThat(out()).contains("No analyses yet.");
    }

    @Test
    void logs_for_unknown_job_is_an_error() {
        int code = run(fixed("x"), "-c", config.toString(), "logs", "deadbeef");

        assertThat(code).isEqualTo(SeoAnalyzerCli.EXIT_FAILED);
        assertThat(err()).contains("No such job: deadbeef");
    }

    @Test
    void analyze_then_history_and_logs_from_a_fresh_process() throws Exception {
        Path report = dir.resolve("reports/report.md");

        int code = run(fixed("Score: 77/100"), "-c", config.toString(), "analyze", "example.com", "-o", report.toString());

        assertThat(code).isEqualTo(SeoAnalyzerCli.EXIT_OK);
        String printed = out();
        assertThat(printed).contains("Status:        completed").contains("Overall score: 77/100");
        assertThat(report).exists();
        assertThat(Files.readString(report)).isEqualTo("Score: 77/100");

        Matcher m = SUBMITTED.matcher(printed);
        assertThat(m.find()).isTrue();
        String jobId = m.group(1);

        // 새 런타임(같은 data 디렉터리)에서도 이력이 보인다
        assertThat(run(fixed("x"), "-c", config.toString(), "history")).isEqualTo(SeoAnalyzerCli.EXIT_OK);
        assertThat(out()).contains(jobId).contains("completed").contains("https://example.com");

        assertThat(run(fixed("x"), "-c", config.toString(), "logs", jobId)).isEqualTo(SeoAnalyzerCli.EXIT_OK);
        assertThat(out()).contains("parallel_analysis_start")
                .contains("report_generation_start")
                .contains("analysis_complete")
                .contains("security_agent");
    }

    @Test
    void failing_synthesis_is_reported_as_partial_with_success_exit() {
        AnalysisCapability cap = (worker, instruction, session) -> {
            if (worker.name().equals("report_agent")) throw new IllegalStateException("quota exceeded");
            return List.of(new OutputFragment("Score: 60/100"));
        };

        int code = run(cap, "-c", config.toString(), "analyze", "https://example.com", "-v");

        assertThat(code).isEqualTo(SeoAnalyzerCli.EXIT_OK);
        assertThat(out()).contains("Status:        partial")
                .contains("Report generation failed")
                .contains("Overall score: 60/100");
    }

    @Test
    void metrics_on_empty_store_prints_empty_json() throws Exception {
        int code = run(fixed("x"), "-c", config.toString(), "metrics");

        assertThat(code).isEqualTo(SeoAnalyzerCli.EXIT_OK);
        JsonNode n = new ObjectMapper().readTree(out());
        assertThat(n.path("stored").path("counters").size()).isZero();
        assertThat(n.path("live").path("tracesOpened").asLong()).isZero();
    }

    @Test
    void metrics_in_a_fresh_process_are_rebuilt_from_stored_runs() throws Exception {
        assertThat(run(fixed("Score: 70/100"), "-c", config.toString(), "analyze", "example.com"))
                .isEqualTo(SeoAnalyzerCli.EXIT_OK);

        int code = run(fixed("x"), "-c", config.toString(), "metrics");

        assertThat(code).isEqualTo(SeoAnalyzerCli.EXIT_OK);
        JsonNode n = new ObjectMapper().readTree(out());
        JsonNode counters = n.path("stored").path("counters");
        assertThat(counters.path("analysis_starts").asDouble()).isEqualTo(1d);
        assertThat(counters.path("analysis_completions{status=completed}").asDouble()).isEqualTo(1d);
        assertThat(counters.path("agent_completions{agent=security_agent,status=success}").asDouble()).isEqualTo(1d);
        assertThat(n.path("stored").path("histograms").has("agent_duration{agent=security_agent}")).isTrue();
        // 이 프로세스에서는 아무 분석도 돌지 않았다
        assertThat(n.path("live").path("counters").size()).isZero();
    }

    @Test
    void usage_errors_exit_with_2() {
        assertThat(run(fixed("x"))).isEqualTo(SeoAnalyzerCli.EXIT_USAGE);
        assertThat(run(fixed("x"), "-c", config.toString(), "bogus")).isEqualTo(SeoAnalyzerCli.EXIT_USAGE);
        assertThat(err()).contains("unknown command: bogus");
        assertThat(run(fixed("x"), "-c", config.toString(), "analyze")).isEqualTo(SeoAnalyzerCli.EXIT_USAGE);
        assertThat(run(fixed("x"), "-c", config.toString(), "analyze", "   ")).isEqualTo(SeoAnalyzerCli.EXIT_USAGE);
        assertThat(run(fixed("x"), "-c")).isEqualTo(SeoAnalyzerCli.EXIT_USAGE);
    }

    @Test
    void missing_config_file_is_a_usage_error() {
        int code = run(fixed("x"), "-c", dir.resolve("nope.yml").toString(), "history");

        assertThat(code).isEqualTo(SeoAnalyzerCli.EXIT_USAGE);
        assertThat(err()).contains("Config error");
    }
}
