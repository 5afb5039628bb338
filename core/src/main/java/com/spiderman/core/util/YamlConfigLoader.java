package com.spiderman.core.util;

import com.spiderman.core.model.CrawlConfig;
import com.spiderman.core.model.CrawlConfig.LinkExtractorKind;
import com.spiderman.core.model.CrawlConfig.OutputFormat;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * seed: "https://example.com"
 * maxPages: 50
 * allowedDomains: ["example.com", "docs.example.com"]   # 또는 "a.com, b.com"
 * timeoutMs: 10000
 * userAgent: "Spiderman/0.1.0 (Java Web Crawler)"
 * includeRawHtml: false
 * linkExtractor: regex | jsoup
 * output:
 *   dir: "output"
 *   file: "crawl.jsonl"
 *   format: jsonl | json
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    /** 읽고 바로 검증까지. seed가 없으면 IllegalArgumentException/NullPointerException */
    public static CrawlConfig load(Path yamlPath) throws IOException {
        return loadBuilder(yamlPath).build();
    }

    /**
     * 검증 전 빌더 반환 (CLI가 값을 덮어쓴 뒤 build 하는 용도).
     * 파일이 없거나 YAML 문법 오류면 IOException, 값 형식 오류면 IllegalArgumentException.
     */
    public static CrawlConfig.Builder loadBuilder(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config file not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root;
            try {
                root = yaml.load(in);
            } catch (YAMLException e) {
                throw new IOException("invalid YAML in " + yamlPath + ": " + e.getMessage(), e);
            }
            return apply(root, CrawlConfig.builder());
        }
    }

    static CrawlConfig.Builder apply(Object root, CrawlConfig.Builder b) {
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 기본값 유지
            return b;
        }

        // 1) 평면 키
        setString(map, "seed", b::seed);
        setInt(map, "maxPages", b::maxPages);
        setStringList(map, "allowedDomains", b::allowedDomains);
        setLong(map, "timeoutMs", b::timeoutMs);
        setString(map, "userAgent", b::userAgent);
        setBoolean(map, "includeRawHtml", b::includeRawHtml);
        setEnum(map, "linkExtractor", LinkExtractorKind.class, b::linkExtractor);

        // 2) output.dir / output.file / output.format
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> b.outputDir(Path.of(s)));
            setString(output, "file", b::outputFile);
            setEnum(output, "format", OutputFormat.class, b::outputFormat);
        }
        return b;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean bool) setter.accept(bool);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(v instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(v instanceof Number n ? n.longValue() : Long.parseLong(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("unknown " + key + ": " + s
                + " (expected one of " + List.of(type.getEnumConstants()).toString().toLowerCase(Locale.ROOT) + ")");
    }
}
