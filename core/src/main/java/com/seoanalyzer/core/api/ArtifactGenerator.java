package com.seoanalyzer.core.api;

import java.nio.file.Path;
import java.util.Optional;

/** 최종 리포트 산출물(PDF 등) 생성기. 실패하면 empty (잡 결과에는 영향 없음) */
@FunctionalInterface
public interface ArtifactGenerator {
    Optional<Path> render(String report, String target, String jobId, int score);

    ArtifactGenerator NONE = (report, target, jobId, score) -> Optional.empty();
}
