package com.sitemapper.core.util;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 크롤 이벤트(crawl-start, page-fetched, termination-declared ...)를 JSON 한 줄로 남긴다.
 * java.util.logging 로 내보내며 직렬화는 Jackson.
 * 사람이 읽는 로그는 SLF4J 쪽을 쓴다.
 */
public final class CrawlEventLog {
    private final Logger jul;
    private final String source;

    private CrawlEventLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.source = cls.getSimpleName();
    }

    public static CrawlEventLog of(Class<?> cls) {
        return new CrawlEventLog(cls);
    }

    public void debug(String event, Object... fields) { emit(Level.FINE, event, null, fields); }
    public void info(String event, Object... fields) { emit(Level.INFO, event, null, fields); }
    public void warn(String event, Object... fields) { emit(Level.WARNING, event, null, fields); }
    public void error(String event, Throwable t, Object... fields) { emit(Level.SEVERE, event, t, fields); }

    private void emit(Level lvl, String event, Throwable t, Object... fields) {
        if (!jul.isLoggable(lvl)) return;
        String line = line(lvl, event, t, fields);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /**
     * fields 는 "key", value 쌍. 짝이 없는 마지막 key 는 null 값으로 기록한다.
     * Number/Boolean 은 JSON 숫자/불리언, 그 외는 문자열.
     */
    String line(Level lvl, String event, Throwable t, Object... fields) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("ts", Instant.now().toString());
        n.put("level", lvl.getName());
        n.put("source", source);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        if (fields != null) {
            for (int i = 0; i < fields.length; i += 2) {
                String key = String.valueOf(fields[i]);
                put(n, key, i + 1 < fields.length ? fields[i + 1] : null);
            }
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        return n.toString(); // JsonNode.toString 은 유효한 JSON
    }

    private static void put(ObjectNode n, String key, Object v) {
        if (v == null) n.putNull(key);
        else if (v instanceof Integer) n.put(key, (Integer) v);
        else if (v instanceof Long) n.put(key, (Long) v);
        else if (v instanceof Number) n.put(key, ((Number) v).doubleValue());
        else if (v instanceof Boolean) n.put(key, (Boolean) v);
        else n.put(key, v.toString());
    }
}
