package com.seoanalyzer.core.orchestrator;

/** 리포트 합성 단계 실패. 잡은 PARTIAL 로 강등되고 호출자에게 던져지지 않는다. */
public class SynthesisException extends WorkerInvocationException {
    public SynthesisException(String workerName, Throwable cause) {
        super(workerName, cause);
    }
}
