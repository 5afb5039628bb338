package com.spiderman.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StructuredLogTest {

    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    void json_hasFixedHeaderThenPairs() {
        String json = slog.toJson(Level.INFO, "page-crawled", null, "url", "http://a.com", "links", 3, "ok", true);

        assertThat(json).startsWith("{\"ts\":\"")
                .contains("\"lvl\":\"INFO\",\"comp\":\"StructuredLogTest\",\"event\":\"page-crawled\"")
                .endsWith(",\"url\":\"http://a.com\",\"links\":3,\"ok\":true}");
    }

    @Test
    void oddPairs_areFlagged() {
        String json = slog.toJson(Level.WARNING, "e", null, "dangling");
        assertThat(json).endsWith("\"_kv_mismatch\":true}").doesNotContain("dangling");
    }

    @Test
    void throwable_addsErrorFields() {
        String json = slog.toJson(Level.SEVERE, "export-failed", new IOException("disk \"full\""), "url", null);
        assertThat(json).contains("\"url\":null")
                .contains("\"error\":\"IOException\"")
                .endsWith("\"message\":\"disk \\\"full\\\"\"}");
    }

    @Test
    void controlCharacters_stayValidJson() throws Exception {
        String json = slog.toJson(Level.INFO, "e", null, "text", "a\nb\tc\\d\u0001");

        assertThat(json).contains("a\\nb\\tc\\\\d\\u0001");
        JsonNode parsed = new ObjectMapper().readTree(json);
        assertEquals("a\nb\tc\\d\u0001", parsed.get("text").asText());
    }

    @Test
    void throwable_reachesLogRecord() {
        Logger jul = Logger.getLogger(StructuredLogTest.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler capture = new Handler() {
            @Override public void publish(LogRecord r) { records.add(r); }
            @Override public void flush() {}
            @Override public void close() {}
        };
        Level prevLevel = jul.getLevel();
        boolean prevParents = jul.getUseParentHandlers();
        jul.addHandler(capture);
        jul.setLevel(Level.ALL);
        jul.setUseParentHandlers(false);
        try {
            IOException boom = new IOException("disk full");
            slog.warn("export-failed", boom, "url", "http://a.com");
            slog.info("page-crawled", "url", "http://a.com");

            assertEquals(2, records.size());
            assertEquals(Level.WARNING, records.get(0).getLevel());
            assertSame(boom, records.get(0).getThrown());
            assertThat(records.get(0).getMessage()).contains("\"event\":\"export-failed\"");
            assertNull(records.get(1).getThrown());
        } finally {
            jul.removeHandler(capture);
            jul.setLevel(prevLevel);
            jul.setUseParentHandlers(prevParents);
        }
    }
}
