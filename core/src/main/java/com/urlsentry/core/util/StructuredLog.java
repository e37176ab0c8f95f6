package com.urlsentry.core.util;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * LogSetup(콘솔/파일 핸들러) 세팅 후 여기서 호출하면 한 줄짜리 JSON으로 찍힘.
 * kvs는 "key", value, "key", value ... 순서.
 */
public final class StructuredLog {
    private static final JsonFactory JSON = new JsonFactory();

    /** JUL 로거 이름 접두사. 핸들러가 사람용 로그와 구분할 때 쓴다. */
    public static final String LOGGER_PREFIX = "slog.";

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(LOGGER_PREFIX + cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    public boolean isDebugEnabled() { return jul.isLoggable(Level.FINE); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringWriter w = new StringWriter(128);
        try (JsonGenerator g = JSON.createGenerator(w)) {
            g.writeStartObject();
            g.writeStringField("ts", Instant.now().toString());
            g.writeStringField("lvl", lvl.getName());
            g.writeStringField("comp", comp);
            g.writeStringField("thread", Thread.currentThread().getName());
            g.writeStringField("event", event);
            if (kvs != null) {
                for (int i = 0; i + 1 < kvs.length; i += 2) {
                    writeValue(g, String.valueOf(kvs[i]), kvs[i + 1]);
                }
                if (kvs.length % 2 == 1) g.writeBooleanField("_kv_mismatch", true);
            }
            if (t != null) {
                g.writeStringField("error", t.getClass().getSimpleName());
                g.writeStringField("message", String.valueOf(t.getMessage()));
            }
            g.writeEndObject();
        } catch (IOException e) {
            // StringWriter 대상이라 실제로는 발생하지 않음
            return "{\"event\":\"" + event + "\",\"_json_error\":true}";
        }
        return w.toString();
    }

    private static void writeValue(JsonGenerator g, String k, Object v) throws IOException {
        if (v == null) {
            g.writeNullField(k);
        } else if (v instanceof Integer || v instanceof Long || v instanceof Short) {
            g.writeNumberField(k, ((Number) v).longValue());
        } else if (v instanceof Number n) {
            g.writeNumberField(k, n.doubleValue());
        } else if (v instanceof Boolean b) {
            g.writeBooleanField(k, b);
        } else {
            g.writeStringField(k, String.valueOf(v));
        }
    }
}
