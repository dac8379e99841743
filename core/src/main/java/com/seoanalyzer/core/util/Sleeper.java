package com.seoanalyzer.core.util;

import java.time.Duration;

/** 재시도 대기. 테스트는 기록만 하는 구현을 넣는다 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration d) throws InterruptedException;

    /** 현재 스레드를 실제로 재운다 (0 이하는 즉시 반환) */
    Sleeper THREAD = d -> {
        if (d != null && d.toMillis() > 0) Thread.sleep(d.toMillis());
    };
}
