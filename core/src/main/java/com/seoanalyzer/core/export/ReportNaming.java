package com.seoanalyzer.core.export;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 산출물 경로 규칙: <outputDir>/reports/<host>/seo-<slug>-<jobId 앞 8자>-<timestamp>.pdf */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    public record ReportContext(Path baseDir, String host, String slug, String jobTag, Instant startedAt) {}

    public static ReportContext context(Path baseDir, String target, String jobId, Instant startedAt) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return new ReportContext(out, extractHost(target), makeSlug(target), jobTag(jobId),
                startedAt == null ? Instant.now() : startedAt);
    }

    public static String timestamp(ReportContext ctx) { return TS_FMT.format(ctx.startedAt()); }
    public static Path reportsDir(ReportContext ctx) { return ctx.baseDir().resolve("reports").resolve(ctx.host()); }
    public static Path pdfPath(ReportContext ctx) { return reportsDir(ctx).resolve(filePrefix(ctx) + ".pdf"); }

    public static String filePrefix(ReportContext ctx) {
        return "seo-" + ctx.slug() + "-" + ctx.jobTag() + "-" + timestamp(ctx);
    }

    // ===== helpers =====
    /** 파일명에 들어갈 잡 식별자 (영숫자만, 최대 8자) */
    static String jobTag(String jobId) {
        if (jobId == null) return "nojob";
        String t = jobId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (t.length() > 8) t = t.substring(0, 8);
        return t.isEmpty() ? "nojob" : t;
    }

    static String extractHost(String target) {
        try {
            String h = URI.create(target).getHost();
            return (h == null ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException | NullPointerException e) {
            return "unknown-host";
        }
    }

    static String makeSlug(String url) {
        if (url == null || url.isBlank()) return "no-url";
        String s = url.toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replace('/', '-').replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
