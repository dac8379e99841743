package com.seoanalyzer.core.util;

import java.util.Locale;

/** 분석 타깃 정규화 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - 앞뒤 공백 제거
     * - http:// 또는 https:// 로 시작하지 않으면 "https://" 를 붙인다
     * - 그 외(경로/쿼리/대소문자)는 건드리지 않는다
     */
    public static String normalizeTarget(String raw) {
        if (raw == null) throw new IllegalArgumentException("target is null");
        String s = raw.trim();
        if (s.isEmpty()) throw new IllegalArgumentException("target is blank");
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return s;
        return "https://" + s;
    }
}
