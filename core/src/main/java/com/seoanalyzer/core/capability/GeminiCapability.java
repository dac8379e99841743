package com.seoanalyzer.core.capability;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.http.DefaultRetryPolicy;
import com.seoanalyzer.core.http.HttpSender;
import com.seoanalyzer.core.http.RetryPolicy;
import com.seoanalyzer.core.model.AnalyzerConfig;
import com.seoanalyzer.core.model.OutputFragment;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.session.SessionHandle;
import com.seoanalyzer.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Gemini generateContent 호출 구현.
 *  - 워커의 고정 지시문(systemInstruction) + 세션 이전 턴 + 새 지시문을 한 요청으로 보낸다
 *  - 429/5xx/전송 실패는 RetryPolicy 로 재시도. Retry-After(초 또는 HTTP-date)는 정책에 넘긴다
 *  - 모든 후보의 모든 text part 를 OutputFragment 로 돌려준다
 *  - 성공한 경우에만 세션에 user/model 턴을 남긴다
 */
public final class GeminiCapability implements AnalysisCapability {

    private static final Logger LOG = LoggerFactory.getLogger(GeminiCapability.class);

    private final AnalyzerConfig.CapabilityCfg cfg;
    private final String apiKey;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)
    private final Supplier<RetryPolicy> retryPolicies;
    private final Sleeper sleeper;
    private final Clock clock = Clock.systemUTC();
    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public GeminiCapability(AnalyzerConfig.CapabilityCfg cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.apiKey = System.getenv(cfg.getApiKeyEnv());
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(cfg.getTimeout())
                .build();
        this.sender = null; // 기본은 HttpClient 사용
        this.retryPolicies = () -> DefaultRetryPolicy.ofRetries(cfg.getMaxRetries(), cfg.getRetryBaseMs());
        this.sleeper = Sleeper.THREAD;
        warnIfNoKey();
    }

    /** 테스트용 생성자(송신 훅 + 키 + 대기 주입) */
    public GeminiCapability(AnalyzerConfig.CapabilityCfg cfg, String apiKey, HttpSender testSender, Sleeper sleeper) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.apiKey = apiKey;
        this.client = null; // 테스트에선 사용 안 함
        this.sender = Objects.requireNonNull(testSender, "testSender");
        this.retryPolicies = () -> DefaultRetryPolicy.ofRetries(cfg.getMaxRetries(), cfg.getRetryBaseMs());
        this.sleeper = (sleeper != null) ? sleeper : Sleeper.THREAD;
        warnIfNoKey();
    }

    private void warnIfNoKey() {
        if (apiKey == null || apiKey.isBlank()) {
            LOG.warn("{} is not set. Capability calls will be rejected by the remote service.", cfg.getApiKeyEnv());
        }
    }

    @Override
    public List<OutputFragment> invoke(WorkerSpec worker, String instruction, SessionHandle session) throws Exception {
        Objects.requireNonNull(worker, "worker");
        Objects.requireNonNull(session, "session");
        String body = om.writeValueAsString(buildRequest(worker, instruction, session));
        HttpRequest req = HttpRequest.newBuilder(endpointUri())
                .timeout(cfg.getTimeout())
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", apiKey == null ? "" : apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> resp = sendWithRetry(req, retryPolicies.get(), session.getJobId(), worker.name());

        List<OutputFragment> fragments = parseResponse(resp.body());
        session.appendTurn("user", instruction);
        session.appendTurn("model", OutputFragment.join(fragments));
        return fragments;
    }

    URI endpointUri() {
        String base = cfg.getEndpoint().endsWith("/")
                ? cfg.getEndpoint().substring(0, cfg.getEndpoint().length() - 1)
                : cfg.getEndpoint();
        String model = URLEncoder.encode(cfg.getModel(), StandardCharsets.UTF_8);
        return URI.create(base + "/models/" + model + ":generateContent");
    }

    ObjectNode buildRequest(WorkerSpec worker, String instruction, SessionHandle session) {
        ObjectNode root = om.createObjectNode();
        if (!worker.systemInstruction().isBlank()) {
            root.putObject("systemInstruction").putArray("parts").addObject().put("text", worker.systemInstruction());
        }
        ArrayNode contents = root.putArray("contents");
        for (SessionHandle.Turn t : session.turns()) {
            addContent(contents, t.role(), t.text());
        }
        addContent(contents, "user", instruction == null ? "" : instruction);
        return root;
    }

    private static void addContent(ArrayNode contents, String role, String text) {
        ObjectNode c = contents.addObject();
        c.put("role", role);
        c.putArray("parts").addObject().put("text", text);
    }

    /** candidates[].content.parts[].text 를 순서대로 */
    List<OutputFragment> parseResponse(String body) throws CapabilityException {
        JsonNode root;
        try {
            root = om.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new CapabilityException("Malformed capability response: " + e.getMessage(), -1, e);
        }
        if (root == null || !root.path("candidates").isArray()) {
            String blocked = root == null ? "" : root.path("promptFeedback").path("blockReason").asText("");
            throw new CapabilityException(blocked.isEmpty()
                    ? "Capability response has no candidates"
                    : "Capability blocked the prompt: " + blocked, -1);
        }
        List<OutputFragment> out = new ArrayList<>();
        for (JsonNode cand : root.path("candidates")) {
            for (JsonNode part : cand.path("content").path("parts")) {
                JsonNode text = part.get("text");
                if (text != null && text.isTextual()) out.add(new OutputFragment(text.asText()));
            }
        }
        return out;
    }

    /** 재시도 포함 송신. 어떤 실패를 얼마나 기다렸다 다시 보낼지는 policy 가 정한다 */
    private HttpResponse<String> sendWithRetry(HttpRequest req, RetryPolicy policy, String jobId, String worker)
            throws Exception {
        int attempt = 1;
        while (true) {
            HttpResponse<String> resp = null;
            Exception transport = null;
            try {
                resp = (sender != null)
                        ? sender.send(req)
                        : client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                transport = e;
            }
            int status = (resp == null) ? RetryPolicy.TRANSPORT_FAILURE : resp.statusCode();
            if (status >= 200 && status < 300) {
                if (attempt > 1) LOG.debug("[{}] {} succeeded after {} retries", jobId, worker, attempt - 1);
                return resp;
            }

            Optional<Duration> wait = policy.backoff(attempt, status, retryAfterOf(resp));
            if (wait.isEmpty()) {
                if (transport != null) {
                    throw new CapabilityException("Capability request failed: " + transport.getMessage(),
                            RetryPolicy.TRANSPORT_FAILURE, transport);
                }
                throw new CapabilityException("Capability returned HTTP " + status + ": " + abbreviate(resp.body()), status);
            }
            LOG.debug("[{}] Retrying {} (attempt {}, status {}) in {}ms",
                    jobId, worker, attempt, status, wait.get().toMillis());
            sleeper.sleep(wait.get());
            attempt++;
        }
    }

    /** Retry-After: 정수 초 또는 HTTP-date. 없거나 읽을 수 없으면 null */
    Duration retryAfterOf(HttpResponse<String> resp) {
        if (resp == null) return null;
        String v = resp.headers().firstValue("Retry-After").orElse(null);
        if (v == null || v.isBlank()) return null;
        String t = v.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(t)));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(t, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration d = Duration.between(clock.instant(), at.toInstant());
                return d.isNegative() ? Duration.ZERO : d;
            } catch (DateTimeParseException e) {
                LOG.debug("Ignoring unparseable Retry-After: {}", t);
                return null;
            }
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        String t = s.replaceAll("\\s+", " ").trim();
        return t.length() > 300 ? t.substring(0, 300) + "..." : t;
    }
}
