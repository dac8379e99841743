package com.seoanalyzer.core.score;

import com.seoanalyzer.core.model.WorkerResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 자유 텍스트에서 점수를 뽑는 best-effort 파서.
 * 리포트 형식은 고정 계약이 아니므로 추출이 빗나갈 수 있다. 카테고리 점수는 실패해도
 * 항상 값(DEFAULT_CATEGORY_SCORE)을 돌려 잡 완료를 막지 않는다.
 */
public final class ScoreAggregator {

    public static final int DEFAULT_CATEGORY_SCORE = 75;

    private static final Pattern SCORE = Pattern.compile(
            "\\b(?:score|rating)\\b[\\s:*_\\-]*(\\d+)(?:\\s*/\\s*100)?", Pattern.CASE_INSENSITIVE);

    private static final Pattern ISSUE = Pattern.compile(
            "❌|🔴|issue|fail|error|critical", Pattern.CASE_INSENSITIVE);
    private static final Pattern WARNING = Pattern.compile(
            "⚠️|⚠|🟡|warning|caution|needs?\\s+improvement", Pattern.CASE_INSENSITIVE);
    private static final Pattern PASSED = Pattern.compile(
            "✅|✓|🟢|pass|good|excellent|correct", Pattern.CASE_INSENSITIVE);

    /** 첫 score/rating 숫자 (0..100 클램프). 없으면 empty */
    public OptionalInt parseScore(String text) {
        if (text == null || text.isEmpty()) return OptionalInt.empty();
        Matcher m = SCORE.matcher(text);
        if (!m.find()) return OptionalInt.empty();
        return OptionalInt.of(clamp(m.group(1)));
    }

    /** 성공 워커 출력에서 파싱된 점수들의 평균(내림). 하나도 없으면 0 */
    public int aggregateOverall(Collection<WorkerResult> results) {
        List<Integer> scores = new ArrayList<>();
        if (results != null) {
            for (WorkerResult r : results) {
                if (r == null || !r.isSuccess()) continue;
                parseScore(r.getOutput()).ifPresent(scores::add);
            }
        }
        return meanFloor(scores);
    }

    public int meanFloor(List<Integer> scores) {
        if (scores == null || scores.isEmpty()) return 0;
        long sum = 0;
        for (int s : scores) sum += s;
        return (int) Math.floorDiv(sum, (long) scores.size());
    }

    /** 카테고리 5종 모두 값이 채워진 맵 (키: Category.key()) */
    public Map<String, Integer> categoryScores(String report) {
        Map<String, Integer> out = new LinkedHashMap<>();
        String text = report == null ? "" : report;
        for (Category c : Category.values()) {
            Matcher m = c.keywordPattern().matcher(text);
            if (m.find()) {
                out.put(c.key(), clamp(m.group(1)));
                continue;
            }
            m = c.headingPattern().matcher(text);
            out.put(c.key(), m.find() ? clamp(m.group(1)) : DEFAULT_CATEGORY_SCORE);
        }
        return out;
    }

    /** 이슈/경고/통과 마커 개수. 셋 다 0이면 ReportStats.DEFAULT */
    public ReportStats reportStats(String report) {
        if (report == null || report.isEmpty()) return ReportStats.DEFAULT;
        ReportStats s = new ReportStats(count(ISSUE, report), count(WARNING, report), count(PASSED, report));
        return s.isEmpty() ? ReportStats.DEFAULT : s;
    }

    private static int count(Pattern p, String text) {
        Matcher m = p.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static int clamp(String digits) {
        String d = digits.replaceFirst("^0+(?=\\d)", "");
        // 아주 긴 숫자열은 int 범위를 넘으므로 100으로 본다
        if (d.length() > 3) return 100;
        int v = Integer.parseInt(d);
        return Math.max(0, Math.min(100, v));
    }
}
