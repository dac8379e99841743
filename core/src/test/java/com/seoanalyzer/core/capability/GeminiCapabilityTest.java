package com.seoanalyzer.core.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.seoanalyzer.core.http.HttpSender;
import com.seoanalyzer.core.model.AnalyzerConfig;
import com.seoanalyzer.core.model.OutputFragment;
import com.seoanalyzer.core.orchestrator.SeoWorkers;
import com.seoanalyzer.core.session.SessionHandle;
import com.seoanalyzer.core.session.SessionRegistry;
import com.seoanalyzer.core.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiCapabilityTest {

    private static final String OK_BODY = """
            {"candidates":[
              {"content":{"role":"model","parts":[{"text":"Score: "},{"text":"88/100"}]}},
              {"content":{"parts":[{"inlineData":{}},{"text":" extra"}]}}
            ]}""";

    /** 테스트용 Sleeper: sleep(Duration) 호출 기록 */
    static class TestSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code; final Map<String, List<String>> headers; final String body;
        Resp(int code, Map<String, List<String>> headers, String body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://generativelanguage.googleapis.com"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private final AnalyzerConfig.CapabilityCfg cfg = AnalyzerConfig.defaults().capability()
            .setMaxRetries(2)
            .setRetryBaseMs(100);
    private final SessionRegistry sessions = new SessionRegistry();

    @Test
    void fragments_are_collected_from_every_candidate_part_and_turns_recorded() throws Exception {
        List<HttpRequest> seen = new ArrayList<>();
        HttpSender sender = req -> {
            seen.add(req);
            return new Resp(200, Map.of(), OK_BODY);
        };
        GeminiCapability cap = new GeminiCapability(cfg, "k-123", sender, new TestSleeper());
        SessionHandle session = sessions.createSession("job-1", "security_agent");

        List<OutputFragment> out = cap.invoke(SeoWorkers.SECURITY, "Analyze https://example.com", session);

        assertThat(out).extracting(OutputFragment::text).containsExactly("Score: ", "88/100", " extra");
        assertThat(OutputFragment.join(out)).isEqualTo("Score: 88/100 extra");
        assertThat(session.turns()).extracting(SessionHandle.Turn::role).containsExactly("user", "model");

        HttpRequest req = seen.get(0);
        assertThat(req.method()).isEqualTo("POST");
        assertThat(req.uri().toString())
                .isEqualTo("https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash:generateContent");
        assertThat(req.headers().firstValue("x-goog-api-key")).contains("k-123");
    }

    @Test
    void request_carries_system_instruction_history_and_new_instruction() {
        GeminiCapability cap = new GeminiCapability(cfg, "k", req -> new Resp(200, Map.of(), OK_BODY), new TestSleeper());
        SessionHandle session = sessions.createSession("job-2", "onpage_agent");
        session.appendTurn("user", "earlier question");
        session.appendTurn("model", "earlier answer");

        JsonNode body = cap.buildRequest(SeoWorkers.ONPAGE, "new question", session);

        assertThat(body.path("systemInstruction").path("parts").get(0).path("text").asText())
                .isEqualTo(SeoWorkers.ONPAGE.systemInstruction());
        JsonNode contents = body.path("contents");
        assertThat(contents.size()).isEqualTo(3);
        assertThat(contents.get(0).path("role").asText()).isEqualTo("user");
        assertThat(contents.get(1).path("role").asText()).isEqualTo("model");
        assertThat(contents.get(2).path("parts").get(0).path("text").asText()).isEqualTo("new question");
    }

    @Test
    void retry_after_is_honored_on_429_and_succeeds_on_second_attempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HttpSender sender = req -> {
            if (calls.incrementAndGet() == 1) {
                return new Resp(429, Map.of("Retry-After", List.of("1")), "slow down");
            }
            return new Resp(200, Map.of(), OK_BODY);
        };
        TestSleeper sleeper = new TestSleeper();
        GeminiCapability cap = new GeminiCapability(cfg, "k", sender, sleeper);

        List<OutputFragment> out = cap.invoke(SeoWorkers.CONTENT, "go", sessions.createSession("job-3", "content_agent"));

        assertThat(out).isNotEmpty();
        assertThat(calls).hasValue(2);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void retry_after_beyond_30_seconds_is_capped() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HttpSender sender = req -> calls.incrementAndGet() == 1
                ? new Resp(503, Map.of("Retry-After", List.of("120")), "busy")
                : new Resp(200, Map.of(), OK_BODY);
        TestSleeper sleeper = new TestSleeper();
        GeminiCapability cap = new GeminiCapability(cfg, "k", sender, sleeper);

        cap.invoke(SeoWorkers.CONTENT, "go", sessions.createSession("job-8", "content_agent"));

        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(30));
    }

    @Test
    void retry_after_accepts_http_dates() {
        GeminiCapability cap = new GeminiCapability(cfg, "k", req -> new Resp(200, Map.of(), OK_BODY), new TestSleeper());

        assertThat(cap.retryAfterOf(new Resp(429, Map.of("Retry-After", List.of("Thu, 01 Jan 2015 00:00:00 GMT")), "")))
                .isEqualTo(Duration.ZERO);
        assertThat(cap.retryAfterOf(new Resp(429, Map.of("Retry-After", List.of("Fri, 01 Jan 2100 00:00:00 GMT")), "")))
                .isGreaterThan(Duration.ofDays(1));
        assertThat(cap.retryAfterOf(new Resp(429, Map.of("Retry-After", List.of("soon")), ""))).isNull();
        assertThat(cap.retryAfterOf(new Resp(429, Map.of(), ""))).isNull();
    }

    @Test
    void server_errors_exhaust_retries_then_fail_with_status() {
        AtomicInteger calls = new AtomicInteger();
        HttpSender sender = req -> {
            calls.incrementAndGet();
            return new Resp(503, Map.of(), "unavailable");
        };
        TestSleeper sleeper = new TestSleeper();
        GeminiCapability cap = new GeminiCapability(cfg, "k", sender, sleeper);
        SessionHandle session = sessions.createSession("job-4", "performance_agent");

        assertThatThrownBy(() -> cap.invoke(SeoWorkers.PERFORMANCE, "go", session))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("HTTP 503")
                .satisfies(e -> assertThat(((CapabilityException) e).getStatusCode()).isEqualTo(503));

        // maxRetries=2 → 총 3회 시도, 대기 2회 (100ms, 200ms ±10%)
        assertThat(calls).hasValue(3);
        assertThat(sleeper.sleeps).hasSize(2);
        assertThat(sleeper.sleeps.get(0).toMillis()).isBetween(90L, 110L);
        assertThat(sleeper.sleeps.get(1).toMillis()).isBetween(180L, 220L);
        // 실패한 호출은 세션에 흔적을 남기지 않는다
        assertThat(session.turns()).isEmpty();
    }

    @Test
    void client_errors_are_not_retried() {
        AtomicInteger calls = new AtomicInteger();
        GeminiCapability cap = new GeminiCapability(cfg, "k", req -> {
            calls.incrementAndGet();
            return new Resp(400, Map.of(), "{\"error\":\"bad key\"}");
        }, new TestSleeper());

        assertThatThrownBy(() -> cap.invoke(SeoWorkers.SECURITY, "go", sessions.createSession("job-5", "security_agent")))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("HTTP 400");
        assertThat(calls).hasValue(1);
    }

    @Test
    void transport_failures_are_retried_as_minus_one() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        GeminiCapability cap = new GeminiCapability(cfg, "k", req -> {
            if (calls.incrementAndGet() < 3) throw new IOException("connection reset");
            return new Resp(200, Map.of(), OK_BODY);
        }, new TestSleeper());

        assertThat(cap.invoke(SeoWorkers.SECURITY, "go", sessions.createSession("job-6", "security_agent"))).isNotEmpty();
        assertThat(calls).hasValue(3);
    }

    @Test
    void responses_without_candidates_are_errors() {
        GeminiCapability cap = new GeminiCapability(cfg, "k", req -> new Resp(200, Map.of(), "{}"), new TestSleeper());

        assertThatThrownBy(() -> cap.parseResponse("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}"))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("SAFETY");
        assertThatThrownBy(() -> cap.parseResponse("not json"))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> cap.invoke(SeoWorkers.SECURITY, "go", sessions.createSession("job-7", "security_agent")))
                .isInstanceOf(CapabilityException.class)
                .hasMessageContaining("no candidates");
    }
}
