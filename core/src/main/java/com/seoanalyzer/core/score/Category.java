package com.seoanalyzer.core.score;

import java.util.Locale;
import java.util.regex.Pattern;

/** 리포트 점수 카테고리 5종 (분석 워커 1:1 대응) */
public enum Category {
    SECURITY("security", "security|ssl|https"),
    ONPAGE("onpage", "on-?page|meta|seo"),
    CONTENT("content", "content|text|quality"),
    PERFORMANCE("performance", "performance|speed|loading"),
    INDEXABILITY("indexability", "indexability|crawl|robot");

    private final String key;
    private final String keywords;

    Category(String key, String keywords) {
        this.key = key;
        this.keywords = keywords;
    }

    public String key() { return key; }

    /** 1차: 카테고리 키워드 뒤 처음 나오는 score/rating 숫자 */
    Pattern keywordPattern() {
        return Pattern.compile("(?:" + keywords + ").*?\\b(?:score|rating)\\b[\\s:*_\\-]*(\\d+)(?:\\s*/\\s*100)?",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    /** 2차: "## Security ... 80/100" 형태의 헤딩 */
    Pattern headingPattern() {
        return Pattern.compile("#{1,3}\\s*" + Pattern.quote(key.toLowerCase(Locale.ROOT)) + ".*?(\\d+)\\s*/\\s*100",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
