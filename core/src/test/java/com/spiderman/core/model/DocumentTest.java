package com.spiderman.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DocumentTest {

    @Test
    void builder_defaults() {
        Document d = Document.builder("http://example.com").build();

        assertEquals("http://example.com", d.url());
        assertEquals("", d.title());
        assertEquals("", d.content());
        assertTrue(d.description().isEmpty());
        assertTrue(d.rawHtml().isEmpty());
        assertTrue(d.links().isEmpty());
        assertTrue(d.metadata().isEmpty());
        assertNotNull(d.crawledAt());
    }

    @Test
    void builder_allFields() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        Document d = Document.builder("http://example.com")
                .title("Test Title")
                .description("Test Description")
                .content("# Content")
                .rawHtml("<h1>Content</h1>")
                .links(List.of("http://example.com/a", "http://example.com/b"))
                .crawledAt(at)
                .metadata("author", "John Doe")
                .metadata(Map.of("keywords", "rust, crawler"))
                .metadata("ignored", null)
                .build();

        assertEquals("Test Title", d.title());
        assertThat(d.description()).contains("Test Description");
        assertThat(d.rawHtml()).contains("<h1>Content</h1>");
        assertEquals(2, d.linkCount());
        assertEquals(9, d.contentLength());
        assertEquals(at, d.crawledAt());
        assertThat(d.metadata("author")).contains("John Doe");
        assertThat(d.metadata("keywords")).contains("rust, crawler");
        assertThat(d.metadata("missing")).isEmpty();
        assertThat(d.metadata()).doesNotContainKey("ignored");
    }

    @Test
    void isImmutable_afterBuild() {
        List<String> links = new ArrayList<>(List.of("http://a.com"));
        Document d = Document.builder("http://example.com").links(links).metadata("k", "v").build();

        links.add("http://b.com");
        assertEquals(1, d.linkCount());
        assertThrows(UnsupportedOperationException.class, () -> d.links().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> d.metadata().put("x", "y"));
    }

    @Test
    void url_isRequired() {
        assertThrows(NullPointerException.class, () -> Document.builder(null).build());
    }
}
