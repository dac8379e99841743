package com.seoanalyzer.core.model;

import java.util.List;

/** 캐퍼빌리티가 돌려주는 텍스트 조각. 워커 최종 출력은 조각들을 순서대로 이어붙인 것 */
public record OutputFragment(String text) {
    public OutputFragment {
        text = (text == null ? "" : text);
    }

    public static String join(List<OutputFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (OutputFragment f : fragments) {
            if (f != null) sb.append(f.text());
        }
        return sb.toString();
    }
}
