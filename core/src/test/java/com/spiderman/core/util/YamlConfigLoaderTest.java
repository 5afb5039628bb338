package com.spiderman.core.util;

import com.spiderman.core.model.CrawlConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class YamlConfigLoaderTest {

    @TempDir Path tmp;

    private static Path sample() throws URISyntaxException {
        return Path.of(YamlConfigLoaderTest.class.getResource("/crawl-sample.yml").toURI());
    }

    private Path write(String yaml) throws IOException {
        Path p = tmp.resolve("crawl.yml");
        Files.writeString(p, yaml, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void load_mapsEveryKey() throws Exception {
        CrawlConfig c = YamlConfigLoader.load(sample());

        assertEquals("https://docs.example.com/guide/", c.getSeed());
        assertEquals(25, c.getMaxPages().getAsInt());
        assertThat(c.getAllowedDomains()).contains(List.of("docs.example.com", "example.com"));
        assertEquals(Duration.ofMillis(3000), c.getTimeout());
        assertEquals("SpidermanTest/1.0", c.getUserAgent());
        assertTrue(c.isIncludeRawHtml());
        assertEquals(CrawlConfig.LinkExtractorKind.JSOUP, c.getLinkExtractor());
        assertEquals(Path.of("build/crawl", "docs.json"), c.getOutputPath());
        assertEquals(CrawlConfig.OutputFormat.JSON, c.getOutputFormat());
    }

    @Test
    void allowedDomains_commaString() throws Exception {
        CrawlConfig c = YamlConfigLoader.load(write("""
                seed: http://a.com
                allowedDomains: "a.com, b.com ,c.com"
                """));
        assertThat(c.getAllowedDomains()).contains(List.of("a.com", "b.com", "c.com"));
    }

    @Test
    void missingKeys_keepDefaults() throws Exception {
        CrawlConfig c = YamlConfigLoader.load(write("seed: http://a.com\n"));

        assertTrue(c.getMaxPages().isEmpty());
        assertTrue(c.getAllowedDomains().isEmpty());
        assertEquals(CrawlConfig.OutputFormat.JSONL, c.getOutputFormat());
        assertEquals(CrawlConfig.LinkExtractorKind.REGEX, c.getLinkExtractor());
        assertEquals(CrawlConfig.DEFAULT_USER_AGENT, c.getUserAgent());
    }

    @Test
    void missingFile_isIOException() {
        IOException e = assertThrows(IOException.class, () -> YamlConfigLoader.load(tmp.resolve("nope.yml")));
        assertThat(e.getMessage()).startsWith("config file not found at: ").endsWith("nope.yml");
    }

    @Test
    void brokenYaml_isIOException() throws Exception {
        Path p = write("seed: [unclosed\n  maxPages: 3\n");
        IOException e = assertThrows(IOException.class, () -> YamlConfigLoader.loadBuilder(p));
        assertThat(e.getMessage()).startsWith("invalid YAML");
    }

    @Test
    void badValues_areRejected() throws Exception {
        Path badInt = write("seed: http://a.com\nmaxPages: lots\n");
        IllegalArgumentException e1 = assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(badInt));
        assertThat(e1.getMessage()).contains("maxPages");

        Path badEnum = write("seed: http://a.com\nlinkExtractor: xpath\n");
        IllegalArgumentException e2 = assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(badEnum));
        assertThat(e2.getMessage()).contains("unknown linkExtractor: xpath");
    }

    @Test
    void emptyFile_leavesSeedUnset() throws Exception {
        Path p = write("");
        assertNull(YamlConfigLoader.loadBuilder(p).getSeed());
        assertThrows(NullPointerException.class, () -> YamlConfigLoader.load(p));
    }

    @Test
    void apply_overlaysOnExistingBuilder() {
        CrawlConfig.Builder b = CrawlConfig.builder().seed("http://keep.me").maxPages(7);
        YamlConfigLoader.apply(Map.of("output", Map.of("format", "JSON")), b);

        CrawlConfig c = b.build();
        assertEquals("http://keep.me", c.getSeed());
        assertEquals(7, c.getMaxPages().getAsInt());
        assertEquals(CrawlConfig.OutputFormat.JSON, c.getOutputFormat());
    }
}
