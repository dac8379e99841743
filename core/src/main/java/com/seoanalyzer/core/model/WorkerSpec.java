package com.seoanalyzer.core.model;

import java.util.Objects;

/**
 * 워커 정의.
 * @param name              실행 내 유일한 이름 (예: "security_agent")
 * @param category          카테고리 키 (예: "security"). 리포트 워커는 "report"
 * @param systemInstruction 캐퍼빌리티에 고정으로 전달되는 역할 지시문
 * @param promptTemplate    "%s" 자리에 타깃 URL이 들어가는 요청 템플릿
 */
public record WorkerSpec(String name, String category, String systemInstruction, String promptTemplate) {

    public WorkerSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        systemInstruction = (systemInstruction == null ? "" : systemInstruction);
        promptTemplate = (promptTemplate == null || promptTemplate.isBlank())
                ? "Analyze this website: %s" : promptTemplate;
    }

    /** 타깃에 바인딩된 워커별 지시문 */
    public String instructionFor(String target) {
        return String.format(promptTemplate, target);
    }
}
