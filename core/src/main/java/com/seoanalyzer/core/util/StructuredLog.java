package com.seoanalyzer.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seoanalyzer.core.observability.TraceContext;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 이벤트 한 건 = JSON 한 줄.
 * 고정 키: ts, lvl, comp, thread, traceId, event. 나머지는 key/value 쌍으로 넘긴다.
 * 트레이스 밖에서 찍히면 traceId 는 "no-trace".
 */
public final class StructuredLog {

    private static final ObjectMapper OM = new ObjectMapper();
    static final String NO_TRACE = "no-trace";

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { emit(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs) { emit(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs) { emit(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { emit(Level.SEVERE, event, t, kvs); }

    private void emit(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = buildJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line);
        else jul.log(lvl, line, t);
    }

    String buildJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = OM.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("traceId", TraceContext.currentTraceId().orElse(NO_TRACE));
        n.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return OM.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            // ObjectNode 직렬화는 사실상 실패하지 않음
            return "{\"event\":\"" + event + "\",\"_serialization_error\":true}";
        }
    }

    private static void put(ObjectNode n, String key, Object v) {
        if (v == null) n.putNull(key);
        else if (v instanceof Integer i) n.put(key, i);
        else if (v instanceof Long l) n.put(key, l);
        else if (v instanceof Double d) n.put(key, d);
        else if (v instanceof Boolean b) n.put(key, b);
        else n.put(key, String.valueOf(v));
    }
}
