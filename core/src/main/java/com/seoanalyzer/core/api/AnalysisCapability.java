package com.seoanalyzer.core.api;

import com.seoanalyzer.core.model.OutputFragment;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.session.SessionHandle;

import java.util.List;

/**
 * 외부 추론/생성 엔진 최소 계약.
 * 워커 1회 호출 = invoke 1회. 실패는 예외로 올라오고 호출자(코디네이터)가 격리한다.
 */
@FunctionalInterface
public interface AnalysisCapability {
    List<OutputFragment> invoke(WorkerSpec worker, String instruction, SessionHandle session) throws Exception;
}
