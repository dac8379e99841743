package com.seoanalyzer.core.export;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 마크다운 비슷한 리포트 텍스트를 PDF용 단순 HTML로 변환.
 * 지원: #/##/### 헤딩, -/* 목록, 1. 번호 목록, **굵게**, 빈 줄 단락. 나머지는 텍스트 그대로.
 * 텍스트는 jsoup 노드로만 넣기 때문에 리포트 안의 HTML은 이스케이프된다.
 */
public final class ReportHtmlRenderer {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*)$");
    private static final Pattern BULLET = Pattern.compile("^\\s*[-*•]\\s+(.*)$");
    private static final Pattern ORDERED = Pattern.compile("^\\s*\\d+[.)]\\s+(.*)$");
    private static final DateTimeFormatter GENERATED_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ROOT).withZone(ZoneId.systemDefault());

    private static final String CSS = """
            body { font-family: sans-serif; font-size: 11pt; color: #1f2933; margin: 24px; }
            h1 { font-size: 20pt; color: #1a365d; margin-bottom: 4px; }
            h2 { font-size: 15pt; color: #2c5282; border-bottom: 1px solid #cbd5e0; padding-bottom: 2px; }
            h3 { font-size: 12pt; color: #2d3748; }
            .meta { color: #4a5568; font-size: 9pt; margin-bottom: 16px; }
            .score { font-size: 28pt; font-weight: bold; color: #2b6cb0; }
            li { margin-bottom: 3px; }
            """;

    public Document render(String report, String target, String jobId, int score, Instant generatedAt) {
        Document doc = Jsoup.parse("<!DOCTYPE html><html><head></head><body></body></html>");
        doc.head().appendElement("meta").attr("charset", "UTF-8");
        doc.head().appendElement("title").text("SEO Report - " + target);
        doc.head().appendElement("style").appendText(CSS);

        Element body = doc.body();
        body.appendElement("h1").text("SEO Analysis Report");
        body.appendElement("div").addClass("meta")
                .text("Target: " + target + " | Job: " + jobId + " | Generated: " + GENERATED_FMT.format(generatedAt));
        body.appendElement("div").addClass("score").text("Overall score: " + Math.max(0, Math.min(100, score)) + "/100");

        appendMarkdown(body, report == null ? "" : report);
        return doc;
    }

    void appendMarkdown(Element body, String text) {
        Element list = null;
        String listTag = null;
        StringBuilder para = new StringBuilder();

        for (String raw : text.replace("\r\n", "\n").split("\n", -1)) {
            String line = raw.stripTrailing();
            Matcher h = HEADING.matcher(line);
            Matcher b = BULLET.matcher(line);
            Matcher o = ORDERED.matcher(line);

            if (line.isBlank()) {
                flushParagraph(body, para);
                list = null;
            } else if (h.matches()) {
                flushParagraph(body, para);
                list = null;
                int level = Math.min(3, h.group(1).length());
                inline(body.appendElement("h" + level), h.group(2));
            } else if (b.matches() || o.matches()) {
                flushParagraph(body, para);
                String tag = b.matches() ? "ul" : "ol";
                if (list == null || !tag.equals(listTag)) {
                    list = body.appendElement(tag);
                    listTag = tag;
                }
                inline(list.appendElement("li"), b.matches() ? b.group(1) : o.group(1));
            } else {
                list = null;
                if (para.length() > 0) para.append(' ');
                para.append(line.trim());
            }
        }
        flushParagraph(body, para);
    }

    private void flushParagraph(Element body, StringBuilder para) {
        if (para.length() == 0) return;
        inline(body.appendElement("p"), para.toString());
        para.setLength(0);
    }

    /** **굵게** 만 처리 */
    private static void inline(Element target, String text) {
        String[] parts = text.split("\\*\\*", -1);
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].isEmpty()) continue;
            // 짝이 맞지 않는 마지막 ** 뒤 조각은 일반 텍스트
            boolean bold = (i % 2 == 1) && (i < parts.length - 1);
            if (bold) target.appendElement("strong").text(parts[i]);
            else target.appendText(parts[i]);
        }
    }
}
