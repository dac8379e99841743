package com.seoanalyzer.core.orchestrator;

/** 두 단계(분석/합성) 밖에서 난 예상치 못한 실패 (예: 저장소 장애). 잡은 FAILED. */
public class PipelineFatalException extends RuntimeException {
    public PipelineFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
