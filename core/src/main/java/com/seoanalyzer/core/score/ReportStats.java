package com.seoanalyzer.core.score;

/** 리포트 본문에서 센 이슈/경고/통과 표시 개수 */
public record ReportStats(int issues, int warnings, int passed) {

    /** 마커가 하나도 없을 때 쓰는 기본값 */
    public static final ReportStats DEFAULT = new ReportStats(3, 5, 15);

    public ReportStats {
        if (issues < 0 || warnings < 0 || passed < 0)
            throw new IllegalArgumentException("counts must be >= 0");
    }

    public boolean isEmpty() { return issues == 0 && warnings == 0 && passed == 0; }
}
