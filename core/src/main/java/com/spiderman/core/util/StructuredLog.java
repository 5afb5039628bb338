package com.spiderman.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 크롤 이벤트 로거: 이벤트 1개 = JSON 한 줄 (JUL로 출력, LoggingConfigurator 핸들러를 탄다).
 * 키/값은 번갈아 넘긴다: SLOG.info("page-crawled", "url", u, "links", 3)
 * 예외를 넘기면 error/message 키를 붙이고 LogRecord에도 실어 스택이 핸들러까지 간다.
 */
public final class StructuredLog {

    private static final ObjectMapper OM = new ObjectMapper();

    private final Logger jul;
    private final String component;

    private StructuredLog(Class<?> owner) {
        this.jul = Logger.getLogger(owner.getName());
        this.component = owner.getSimpleName();
    }

    public static StructuredLog get(Class<?> owner) {
        return new StructuredLog(owner);
    }

    public void debug(String event, Object... kvs) { emit(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs) { emit(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs) { emit(Level.WARNING, event, null, kvs); }
    public void warn(String event, Throwable t, Object... kvs) { emit(Level.WARNING, event, t, kvs); }
    public void error(String event, Throwable t, Object... kvs) { emit(Level.SEVERE, event, t, kvs); }

    private void emit(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        jul.log(lvl, toJson(lvl, event, t, kvs), t);
    }

    /** 고정 헤더(ts, lvl, comp, event) 뒤에 키/값, 짝이 안 맞으면 _kv_mismatch */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode line = OM.createObjectNode();
        line.put("ts", Instant.now().toString());
        line.put("lvl", lvl.getName());
        line.put("comp", component);
        line.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(line, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) line.put("_kv_mismatch", true);
        }
        if (t != null) {
            line.put("error", t.getClass().getSimpleName());
            line.put("message", t.getMessage());
        }
        return line.toString();
    }

    private static void put(ObjectNode line, String key, Object value) {
        if (value == null) {
            line.putNull(key);
        } else if (value instanceof Number || value instanceof Boolean) {
            line.set(key, OM.valueToTree(value));
        } else {
            line.put(key, String.valueOf(value));
        }
    }
}
