package com.spiderman.core.service.export;

import com.spiderman.core.model.CrawlConfig.OutputFormat;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 자동 출력 파일명: crawl-&lt;host-slug&gt;-&lt;yyyyMMdd-HHmm&gt;.jsonl|.json */
public final class ExportNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    private ExportNaming() {}

    public static String fileName(String seed, Instant startedAt, OutputFormat format) {
        String ext = (format == OutputFormat.JSON) ? ".json" : ".jsonl";
        return "crawl-" + hostSlug(seed) + "-" + TS_FMT.format(startedAt) + ext;
    }

    public static Path path(Path baseDir, String seed, Instant startedAt, OutputFormat format) {
        Path out = (baseDir == null ? Path.of("output") : baseDir);
        return out.resolve(fileName(seed, startedAt, format));
    }

    static String hostSlug(String url) {
        if (url == null || url.isBlank()) return "unknown-host";
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            host = null;
        }
        if (host == null) return "unknown-host";
        String s = host.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9.-]", "-")
                .replace('.', '-')
                .replaceAll("-{2,}", "-")
                .replaceAll("^-+|-+$", "");
        if (s.length() > 60) s = s.substring(0, 60);
        return s.isEmpty() ? "unknown-host" : s;
    }
}
