package com.seoanalyzer.core.orchestrator;

import com.seoanalyzer.core.api.AnalysisCapability;
import com.seoanalyzer.core.model.OutputFragment;
import com.seoanalyzer.core.model.WorkerSpec;
import com.seoanalyzer.core.session.SessionHandle;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** 워커 이름별로 고정 응답/실패를 돌려주는 테스트용 capability */
final class ScriptedCapability implements AnalysisCapability {

    private final Map<String, String> outputs = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Map<String, String> instructions = new ConcurrentHashMap<>();
    private final Map<String, String> sessionIds = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile long delayMs = 0;
    private volatile boolean ignoreInterrupts = false;
    private volatile String defaultOutput = "Score: 80/100";

    ScriptedCapability answer(String worker, String text) {
        outputs.put(worker, text);
        return this;
    }

    ScriptedCapability fail(String worker) {
        failing.add(worker);
        return this;
    }

    ScriptedCapability delay(long ms) {
        this.delayMs = ms;
        return this;
    }

    /** 인터럽트를 받아도 delay 를 끝까지 채우는 워커 */
    ScriptedCapability ignoreInterrupts() {
        this.ignoreInterrupts = true;
        return this;
    }

    ScriptedCapability defaultOutput(String text) {
        this.defaultOutput = text;
        return this;
    }

    @Override
    public List<OutputFragment> invoke(WorkerSpec worker, String instruction, SessionHandle session) throws Exception {
        instructions.put(worker.name(), instruction);
        sessionIds.put(worker.name(), session.getSessionId());
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            if (delayMs > 0) pause(delayMs);
            if (failing.contains(worker.name())) {
                throw new IllegalStateException("boom from " + worker.name());
            }
            String text = outputs.getOrDefault(worker.name(), defaultOutput);
            // 두 조각으로 나눠 join 경로도 함께 통과시킨다
            int mid = text.length() / 2;
            return List.of(new OutputFragment(text.substring(0, mid)), new OutputFragment(text.substring(mid)));
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void pause(long ms) throws InterruptedException {
        if (!ignoreInterrupts) {
            Thread.sleep(ms);
            return;
        }
        long deadline = System.nanoTime() + ms * 1_000_000;
        boolean interrupted = false;
        while (System.nanoTime() < deadline) {
            try {
                Thread.sleep(Math.max(1, (deadline - System.nanoTime()) / 1_000_000));
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    String instructionOf(String worker) { return instructions.get(worker); }
    String sessionIdOf(String worker) { return sessionIds.get(worker); }
    int calls() { return instructions.size(); }
    int maxInFlight() { return maxInFlight.get(); }
}
