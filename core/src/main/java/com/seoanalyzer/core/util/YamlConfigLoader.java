package com.seoanalyzer.core.util;

import com.seoanalyzer.core.model.AnalyzerConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * 루트 seo-analyzer.yml을 읽어 AnalyzerConfig로 변환.
 *
 * 예상 YAML 키:
 * dataDir: "data"
 * outputDir: "out"
 * logLevel: INFO
 * historyLimit: 20
 * capability:
 *   endpoint: "https://generativelanguage.googleapis.com/v1beta"
 *   model: "gemini-2.5-flash"
 *   apiKeyEnv: "GOOGLE_API_KEY"
 *   timeoutMs: 60000
 *   maxRetries: 2
 *   retryBaseMs: 500
 * artifacts:
 *   enabled: true
 * jobs:
 *   maxQueued: 16
 *
 * 우선순위: 시스템 프로퍼티 > yaml > 기본값
 *  -Dseo.capability.model=...
 *  -Dseo.log.level=...
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "seo-analyzer.yml";

    private YamlConfigLoader() {}

    public static AnalyzerConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static AnalyzerConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            AnalyzerConfig cfg = AnalyzerConfig.defaults();

            if (root instanceof Map<?, ?> map) {
                // 1) 평면 키
                setPath(map, "dataDir", cfg::setDataDir);
                setPath(map, "outputDir", cfg::setOutputDir);
                setString(map, "logLevel", cfg::setLogLevel);
                setInt(map, "historyLimit", cfg::setHistoryLimit);

                // 2) capability.*
                Map<String, Object> cap = getMap(map, "capability");
                if (cap != null) {
                    var c = cfg.capability();
                    setString(cap, "endpoint", c::setEndpoint);
                    setString(cap, "model", c::setModel);
                    setString(cap, "apiKeyEnv", c::setApiKeyEnv);
                    setLong(cap, "timeoutMs", c::setTimeoutMs);
                    setInt(cap, "maxRetries", c::setMaxRetries);
                    setLong(cap, "retryBaseMs", c::setRetryBaseMs);
                }

                // 3) artifacts.enabled
                Map<String, Object> art = getMap(map, "artifacts");
                if (art != null) {
                    setBoolean(art, "enabled", cfg::setArtifactsEnabled);
                }

                // 4) jobs.maxQueued
                Map<String, Object> jobs = getMap(map, "jobs");
                if (jobs != null) {
                    setInt(jobs, "maxQueued", cfg::setMaxQueuedJobs);
                }
            }
            // 비어있거나 단순 스칼라면 defaults 유지

            applySystemOverrides(cfg);
            cfg.validate();
            return cfg;
        }
    }

    /** 시스템 프로퍼티 오버라이드 (파일 없이 defaults()에 적용할 때도 사용) */
    public static AnalyzerConfig applySystemOverrides(AnalyzerConfig cfg) {
        String model = System.getProperty("seo.capability.model");
        if (model != null && !model.isBlank()) cfg.capability().setModel(model);
        String lvl = System.getProperty("seo.log.level");
        if (lvl != null && !lvl.isBlank()) cfg.setLogLevel(lvl.trim());
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
