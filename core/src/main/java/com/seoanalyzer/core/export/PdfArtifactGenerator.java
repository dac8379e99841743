package com.seoanalyzer.core.export;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import com.seoanalyzer.core.api.ArtifactGenerator;
import com.seoanalyzer.core.util.StructuredLog;
import org.jsoup.helper.W3CDom;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 리포트 → HTML(jsoup) → PDF(openhtmltopdf).
 *  - 임시 파일에 쓰고 %PDF- 시그니처 확인 후 원자적 이동
 *  - 실패하면 empty (잡 결과는 그대로)
 * 출력: <outputDir>/reports/<host>/seo-<slug>-<jobId>-<timestamp>.pdf
 * 같은 이름의 파일이 이미 있으면 덮어쓰지 않고 실패한다 (산출물은 잡 하나에만 속함).
 */
public final class PdfArtifactGenerator implements ArtifactGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(PdfArtifactGenerator.class);
    private static final StructuredLog SLOG = StructuredLog.get(PdfArtifactGenerator.class);

    private final Path outputDir;
    private final ReportHtmlRenderer renderer;
    private final Clock clock;

    public PdfArtifactGenerator(Path outputDir) {
        this(outputDir, new ReportHtmlRenderer(), Clock.systemDefaultZone());
    }

    public PdfArtifactGenerator(Path outputDir, ReportHtmlRenderer renderer, Clock clock) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<Path> render(String report, String target, String jobId, int score) {
        Instant now = clock.instant();
        var ctx = ReportNaming.context(outputDir, target, jobId, now);
        Path pdf = ReportNaming.pdfPath(ctx);
        try {
            Document doc = renderer.render(report, target, jobId, score, now);
            writePdf(doc, pdf);
            LOG.info("[{}] PDF written: {}", jobId, pdf);
            return Optional.of(pdf);
        } catch (IOException | RuntimeException e) {
            LOG.warn("[{}] Failed to generate PDF report: {}", jobId, e.getMessage());
            SLOG.error("artifact-failed", e, "jobId", jobId, "path", pdf.toString());
            return Optional.empty();
        }
    }

    static void writePdf(Document jdoc, Path pdfPath) throws IOException {
        Files.createDirectories(pdfPath.getParent());
        String baseUri = pdfPath.getParent().toUri().toString();
        org.w3c.dom.Document w3cDoc = new W3CDom().fromJsoup(jdoc);

        Path tmp = pdfPath.resolveSibling(pdfPath.getFileName().toString() + ".tmp");
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(
                tmp, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))) {
            PdfRendererBuilder builder = new PdfRendererBuilder();
            builder.withW3cDocument(w3cDoc, baseUri);
            builder.toStream(os);
            builder.run();
            os.flush();
        } catch (IOException | RuntimeException ex) {
            Files.deleteIfExists(tmp);
            throw new IOException("openhtmltopdf failed: " + ex.getMessage(), ex);
        }

        if (!isValidPdf(tmp)) {
            Files.deleteIfExists(tmp);
            throw new IOException("Produced PDF seems invalid (size/signature).");
        }
        if (Files.exists(pdfPath)) {
            Files.deleteIfExists(tmp);
            throw new FileAlreadyExistsException(pdfPath.toString(), null, "artifact already exists");
        }
        try {
            Files.move(tmp, pdfPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw new IOException("Failed to move temp PDF to final path: " + pdfPath, e);
        }
    }

    static boolean isValidPdf(Path p) throws IOException {
        if (p == null || !Files.exists(p)) return false;
        if (Files.size(p) < 100) return false;
        byte[] sig = new byte[5];
        try (InputStream in = Files.newInputStream(p)) {
            if (in.readNBytes(sig, 0, 5) < 5) return false;
        }
        return new String(sig, StandardCharsets.US_ASCII).startsWith("%PDF-");
    }
}
