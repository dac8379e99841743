package com.seoanalyzer.core.store;

/** 저장소 I/O 실패 (unchecked). 파이프라인에서는 치명 오류로 취급된다. */
public class AnalysisStoreException extends RuntimeException {
    public AnalysisStoreException(String message) { super(message); }
    public AnalysisStoreException(String message, Throwable cause) { super(message, cause); }
}
