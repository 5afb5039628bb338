package com.spiderman.core.model;

import com.spiderman.core.util.UrlUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * 크롤 설정 (crawl.yml / CLI 매핑 대상).
 * 빌더로만 생성되며 build() 시점에 검증 → 이후 불변. 크롤 1회 동안 바뀌지 않는다.
 */
public final class CrawlConfig {

    /** 출력 형식: JSONL(레코드마다 한 줄 append) / JSON(종료 시 배열 한 번에) */
    public enum OutputFormat { JSONL, JSON }

    /** 링크 추출 전략 */
    public enum LinkExtractorKind { REGEX, JSOUP }

    public static final String DEFAULT_USER_AGENT = "Spiderman/0.1.0 (Java Web Crawler)";

    // ---------- 필드 ----------
    private final String seed;                    // 시작 URL (필수)
    private final Integer maxPages;               // null = 무제한
    private final List<String> allowedDomains;    // null = 전체 허용, 소문자
    private final Duration timeout;
    private final String userAgent;
    private final Path outputDir;
    private final String outputFile;
    private final OutputFormat outputFormat;
    private final boolean includeRawHtml;
    private final LinkExtractorKind linkExtractor;

    private CrawlConfig(Builder b) {
        this.seed = b.seed.trim();
        this.maxPages = b.maxPages;
        this.allowedDomains = (b.allowedDomains == null) ? null : List.copyOf(b.allowedDomains);
        this.timeout = b.timeout;
        this.userAgent = b.userAgent;
        this.outputDir = b.outputDir;
        this.outputFile = b.outputFile;
        this.outputFormat = b.outputFormat;
        this.includeRawHtml = b.includeRawHtml;
        this.linkExtractor = b.linkExtractor;
    }

    // ---------- getters ----------
    public String getSeed() { return seed; }

    public OptionalInt getMaxPages() {
        return maxPages == null ? OptionalInt.empty() : OptionalInt.of(maxPages);
    }

    public Optional<List<String>> getAllowedDomains() { return Optional.ofNullable(allowedDomains); }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public Path getOutputDir() { return outputDir; }
    public String getOutputFile() { return outputFile; }
    public Path getOutputPath() { return outputDir.resolve(outputFile); }
    public OutputFormat getOutputFormat() { return outputFormat; }
    public boolean isIncludeRawHtml() { return includeRawHtml; }
    public LinkExtractorKind getLinkExtractor() { return linkExtractor; }

    /** 값 복사 후 일부만 바꿀 때 (CLI 오버라이드 등) */
    public Builder toBuilder() {
        Builder b = new Builder().seed(seed)
                .timeout(timeout)
                .userAgent(userAgent)
                .outputDir(outputDir)
                .outputFile(outputFile)
                .outputFormat(outputFormat)
                .includeRawHtml(includeRawHtml)
                .linkExtractor(linkExtractor);
        b.maxPages = maxPages;
        b.allowedDomains = (allowedDomains == null) ? null : new ArrayList<>(allowedDomains);
        return b;
    }

    @Override
    public String toString() {
        return "CrawlConfig{seed=" + seed + ", maxPages=" + maxPages + ", allowedDomains=" + allowedDomains
                + ", timeout=" + timeout + ", output=" + getOutputPath() + " (" + outputFormat + ")"
                + ", rawHtml=" + includeRawHtml + ", extractor=" + linkExtractor + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String seed;
        private Integer maxPages;
        private List<String> allowedDomains;
        private Duration timeout = Duration.ofSeconds(10);
        private String userAgent = DEFAULT_USER_AGENT;
        private Path outputDir = Path.of("output");
        private String outputFile = "crawl.jsonl";
        private OutputFormat outputFormat = OutputFormat.JSONL;
        private boolean includeRawHtml = false;
        private LinkExtractorKind linkExtractor = LinkExtractorKind.REGEX;

        private Builder() {}

        public Builder seed(String seed) { this.seed = seed; return this; }
        public Builder maxPages(int maxPages) { this.maxPages = maxPages; return this; }
        public Builder unlimitedPages() { this.maxPages = null; return this; }

        /** 허용 호스트 목록. 대소문자 무시를 위해 소문자로 저장, 빈 항목은 버림 */
        public Builder allowedDomains(List<String> domains) {
            if (domains == null) {
                this.allowedDomains = null;
                return this;
            }
            List<String> out = new ArrayList<>();
            for (String d : domains) {
                if (d != null && !d.isBlank()) out.add(d.trim().toLowerCase(Locale.ROOT));
            }
            this.allowedDomains = out;
            return this;
        }

        public Builder allowDomain(String domain) {
            if (domain == null || domain.isBlank()) return this;
            if (allowedDomains == null) allowedDomains = new ArrayList<>();
            allowedDomains.add(domain.trim().toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder timeoutMs(long ms) { this.timeout = Duration.ofMillis(ms); return this; }
        public Builder userAgent(String userAgent) { this.userAgent = userAgent; return this; }
        public Builder outputDir(Path outputDir) { this.outputDir = outputDir; return this; }
        public Builder outputFile(String outputFile) { this.outputFile = outputFile; return this; }
        public Builder outputFormat(OutputFormat outputFormat) { this.outputFormat = outputFormat; return this; }
        public Builder includeRawHtml(boolean v) { this.includeRawHtml = v; return this; }
        public Builder linkExtractor(LinkExtractorKind kind) { this.linkExtractor = kind; return this; }

        public String getSeed() { return seed; }
        public OutputFormat getOutputFormat() { return outputFormat; }

        /** 검증 후 불변 설정 생성. 설정 오류는 크롤 시작(첫 fetch) 전에 여기서 터진다. */
        public CrawlConfig build() {
            Objects.requireNonNull(seed, "seed");
            if (seed.isBlank()) throw new IllegalArgumentException("seed must not be empty");
            if (!UrlUtils.isHttpUrl(seed))
                throw new IllegalArgumentException("seed must be an absolute http(s) URL: " + seed);
            if (maxPages != null && maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
            if (allowedDomains != null && allowedDomains.isEmpty())
                throw new IllegalArgumentException("allowedDomains must not be empty when set");
            if (timeout == null || timeout.isNegative() || timeout.isZero())
                throw new IllegalArgumentException("timeout must be > 0");
            if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
            Objects.requireNonNull(outputDir, "outputDir");
            Objects.requireNonNull(outputFile, "outputFile");
            if (outputFile.isBlank()) throw new IllegalArgumentException("outputFile must not be empty");
            Objects.requireNonNull(outputFormat, "outputFormat");
            Objects.requireNonNull(linkExtractor, "linkExtractor");
            return new CrawlConfig(this);
        }
    }
}
