package com.seoanalyzer.core.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 인메모리 span 트리 기록기.
 * 부모 좌표는 SpanRef로 명시적으로 넘긴다 (스레드 간 공유되는 "현재 span" 상태 없음).
 */
public final class Tracer {
    private static final Logger log = LoggerFactory.getLogger(Tracer.class);
    private static final DateTimeFormatter TRACE_TS = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /** span 본문. 예외는 span을 ERROR로 닫은 뒤 그대로 다시 던진다. */
    @FunctionalInterface
    public interface SpanBody<T> {
        T run(Span span) throws Exception;
    }

    private final int maxSpans;
    private final AtomicLong spanSeq = new AtomicLong();
    private final AtomicLong traceSeq = new AtomicLong();
    private final AtomicLong opened = new AtomicLong();
    private final AtomicLong closed = new AtomicLong();
    private final Set<String> openTraces = ConcurrentHashMap.newKeySet();
    private final List<Span> finished = new ArrayList<>(); // guarded by this

    public Tracer() { this(5_000); }

    public Tracer(int maxSpans) {
        this.maxSpans = Math.max(16, maxSpans);
    }

    public String startTrace(String name) {
        long n = traceSeq.incrementAndGet();
        String traceId = String.format("trace_%s_%04d", LocalDateTime.now().format(TRACE_TS), n);
        openTraces.add(traceId);
        opened.incrementAndGet();
        log.info("Starting trace: {} ({})", name, traceId);
        return traceId;
    }

    /** @return 열린 trace를 실제로 닫았으면 true (중복 호출은 무시) */
    public boolean endTrace(String traceId) {
        if (traceId == null || !openTraces.remove(traceId)) return false;
        closed.incrementAndGet();
        log.info("Ending trace: {}", traceId);
        return true;
    }

    public <T> T inSpan(SpanRef parent, String name, Map<String, Object> attributes, SpanBody<T> body) throws Exception {
        Span span = new Span(name, parent.traceId(), nextSpanId(), parent.spanId(), attributes);
        log.debug("Starting span: {}", name);
        try {
            T out = body.run(span);
            span.end(Span.Status.COMPLETED);
            return out;
        } catch (Exception | Error e) {
            span.setAttribute("error", String.valueOf(e.getMessage()));
            span.end(Span.Status.ERROR);
            throw e;
        } finally {
            record(span);
            log.debug("Ended span: {} ({}ms)", name, span.getDurationMs());
        }
    }

    private String nextSpanId() {
        return String.format("span_%08d", spanSeq.incrementAndGet());
    }

    private synchronized void record(Span span) {
        finished.add(span);
        if (finished.size() > maxSpans) {
            // 가장 오래된 것부터 버림
            Iterator<Span> it = finished.iterator();
            int drop = finished.size() - maxSpans;
            while (drop-- > 0 && it.hasNext()) { it.next(); it.remove(); }
        }
    }

    public synchronized List<Span> spans(String traceId) {
        List<Span> out = new ArrayList<>();
        for (Span s : finished) {
            if (traceId == null || traceId.equals(s.getTraceId())) out.add(s);
        }
        return out;
    }

    /** 마지막 n개 trace에 속한 span (기록 순서) */
    public synchronized List<Span> recentTraces(int n) {
        LinkedHashSet<String> order = new LinkedHashSet<>();
        for (Span s : finished) { order.remove(s.getTraceId()); order.add(s.getTraceId()); }
        List<String> ids = new ArrayList<>(order);
        Set<String> keep = new LinkedHashSet<>(ids.subList(Math.max(0, ids.size() - Math.max(0, n)), ids.size()));
        List<Span> out = new ArrayList<>();
        for (Span s : finished) if (keep.contains(s.getTraceId())) out.add(s);
        return out;
    }

    public long tracesOpened() { return opened.get(); }
    public long tracesClosed() { return closed.get(); }
    public int openTraceCount() { return openTraces.size(); }

    public synchronized void clear() {
        finished.clear();
    }
}
