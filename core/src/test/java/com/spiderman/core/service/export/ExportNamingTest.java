package com.spiderman.core.service.export;

import com.spiderman.core.model.CrawlConfig.OutputFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExportNamingTest {

    private static final Instant T = Instant.parse("2024-03-05T07:08:00Z");

    @Test
    void fileName_hostSlugAndTimestamp() {
        String name = ExportNaming.fileName("https://Docs.Example.com:8443/a/b?q=1", T, OutputFormat.JSONL);

        assertThat(name).startsWith("crawl-docs-example-com-");
        assertThat(name).matches("crawl-docs-example-com-\\d{8}-\\d{4}\\.jsonl");
        assertThat(name).contains(ExportNaming.TS_FMT.format(T));
    }

    @Test
    void fileName_jsonExtension() {
        assertThat(ExportNaming.fileName("http://a.com", T, OutputFormat.JSON)).endsWith(".json");
    }

    @Test
    void path_resolvesUnderBaseDir() {
        Path p = ExportNaming.path(Path.of("out"), "http://a.com", T, OutputFormat.JSONL);
        assertThat(p.getParent()).isEqualTo(Path.of("out"));
        assertThat(ExportNaming.path(null, "http://a.com", T, OutputFormat.JSONL).getParent())
                .isEqualTo(Path.of("output"));
    }

    @Test
    void hostSlug_fallbacks() {
        assertThat(ExportNaming.hostSlug(null)).isEqualTo("unknown-host");
        assertThat(ExportNaming.hostSlug("not a url")).isEqualTo("unknown-host");
        assertThat(ExportNaming.hostSlug("/relative")).isEqualTo("unknown-host");
        assertThat(ExportNaming.hostSlug("http://sub_domain.a.org")).isEqualTo("unknown-host");
    }
}
