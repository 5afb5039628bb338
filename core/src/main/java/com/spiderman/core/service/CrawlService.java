package com.spiderman.core.service;

import com.spiderman.core.api.IContentConverter;
import com.spiderman.core.api.IMetadataExtractor;
import com.spiderman.core.api.IPageFetcher;
import com.spiderman.core.crawler.Frontier;
import com.spiderman.core.crawler.JsoupLinkExtractor;
import com.spiderman.core.crawler.LinkExtractor;
import com.spiderman.core.crawler.RegexLinkExtractor;
import com.spiderman.core.document.HtmlToMarkdownConverter;
import com.spiderman.core.document.JsoupMetadataExtractor;
import com.spiderman.core.http.FetchException;
import com.spiderman.core.http.HttpPageFetcher;
import com.spiderman.core.model.CrawlConfig;
import com.spiderman.core.model.CrawlPhase;
import com.spiderman.core.model.CrawlResult;
import com.spiderman.core.model.CrawlStats;
import com.spiderman.core.model.Document;
import com.spiderman.core.model.FetchedPage;
import com.spiderman.core.model.PageMetadata;
import com.spiderman.core.service.export.DocumentExporter;
import com.spiderman.core.service.export.JsonArrayExporter;
import com.spiderman.core.service.export.JsonLinesExporter;
import com.spiderman.core.util.ProgressListener;
import com.spiderman.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 크롤 오케스트레이터:
 *  - IDLE → FETCHING → LINKING → RECORDING → IDLE ... → DONE
 *  - 프론티어에서 하나 꺼내 fetch → 링크 추출/승인 → 레코드 생성/export
 *  - fetch 실패: 실패 카운트만 올리고 다음 URL (재시도/재승인 없음)
 *  - export 실패: 경고 로그, 레코드는 crawled로 집계하고 계속 진행
 *  - 기본 구현체는 설정에서 결정, DI 생성자는 테스트/대체 구현 주입용
 *
 * 단일 스레드, 인스턴스 1개 = 크롤 1회 (프론티어를 생성 시점에 만들고 소유).
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final Frontier frontier;
    private final CrawlStats stats = new CrawlStats();
    private final List<Document> documents = new ArrayList<>();

    private final IPageFetcher fetcher;
    private final LinkExtractor linkExtractor;
    private final IContentConverter converter;
    private final IMetadataExtractor metadataExtractor;
    private final DocumentExporter exporter;

    private ProgressListener listener = ProgressListener.NONE;

    /** 기본 구현 (HTTP fetch + 설정에 맞는 추출기/싱크) */
    public CrawlService(CrawlConfig config) {
        this(config, new HttpPageFetcher(config), defaultExporter(config));
    }

    /** fetcher/exporter만 바꿔 끼우는 경우 */
    public CrawlService(CrawlConfig config, IPageFetcher fetcher, DocumentExporter exporter) {
        this(config, fetcher, defaultLinkExtractor(config),
                new HtmlToMarkdownConverter(), new JsoupMetadataExtractor(), exporter);
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config,
                        IPageFetcher fetcher,
                        LinkExtractor linkExtractor,
                        IContentConverter converter,
                        IMetadataExtractor metadataExtractor,
                        DocumentExporter exporter) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.linkExtractor = Objects.requireNonNull(linkExtractor, "linkExtractor");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.metadataExtractor = Objects.requireNonNull(metadataExtractor, "metadataExtractor");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        this.frontier = Frontier.of(config);
    }

    static LinkExtractor defaultLinkExtractor(CrawlConfig cfg) {
        return (cfg.getLinkExtractor() == CrawlConfig.LinkExtractorKind.JSOUP)
                ? new JsoupLinkExtractor()
                : new RegexLinkExtractor();
    }

    static DocumentExporter defaultExporter(CrawlConfig cfg) {
        return (cfg.getOutputFormat() == CrawlConfig.OutputFormat.JSON)
                ? new JsonArrayExporter(cfg.getOutputPath())
                : new JsonLinesExporter(cfg.getOutputPath());
    }

    /* =========================
       실행 API
       ========================= */

    public CrawlResult run() {
        return run(ProgressListener.NONE, null);
    }

    public CrawlResult run(ProgressListener listener) {
        return run(listener, null);
    }

    /**
     * 프론티어가 빌 때까지(또는 상한/취소) 반복.
     * 취소 플래그는 반복 사이에만 확인하며, 취소되면 그 시점까지의 부분 결과를 cancelled=true로 반환.
     */
    public CrawlResult run(ProgressListener listener, AtomicBoolean cancelFlag) {
        this.listener = (listener != null) ? listener : ProgressListener.NONE;

        LOG.info("Crawl start: seed={}, maxPages={}, allowedDomains={}, output={}",
                config.getSeed(),
                config.getMaxPages().isPresent() ? config.getMaxPages().getAsInt() : "unlimited",
                config.getAllowedDomains().map(Object::toString).orElse("any"),
                exporter.target());
        SLOG.info("crawl-start",
                "seed", config.getSeed(),
                "maxPages", config.getMaxPages().isPresent() ? config.getMaxPages().getAsInt() : -1,
                "extractor", config.getLinkExtractor().name(),
                "output", String.valueOf(exporter.target()));

        boolean cancelled = false;
        try {
            while (true) {
                if (isCancelled(cancelFlag)) {
                    cancelled = true;
                    LOG.info("Crawl cancelled: crawled={}, pending={}", stats.pagesCrawled(), frontier.queueSize());
                    SLOG.info("crawl-cancelled",
                            "pagesCrawled", stats.pagesCrawled(),
                            "pending", frontier.queueSize());
                    break;
                }
                if (!step()) break;
            }
        } finally {
            closeCollaborators();
        }

        CrawlResult result = result(cancelled);
        LOG.info("Crawl done. crawled={}, failed={}, discovered={}, exportFailures={}",
                result.getPagesCrawled(), result.getPagesFailed(), result.getUrlsDiscovered(),
                result.getStats().exportFailures);
        SLOG.info("crawl-done",
                "pagesCrawled", result.getPagesCrawled(),
                "pagesFailed", result.getPagesFailed(),
                "urlsDiscovered", result.getUrlsDiscovered(),
                "linksFound", result.getStats().linksFound,
                "exportFailures", result.getStats().exportFailures,
                "cancelled", cancelled);
        return result;
    }

    /**
     * 루프 1회 (IDLE에서 시작해 IDLE 또는 DONE으로 끝남).
     * @return 더 진행할 수 있으면 true, 프론티어가 끝났으면(DONE) false
     */
    public boolean step() {
        notify(CrawlPhase.IDLE, null);
        Optional<String> next = frontier.next();
        if (next.isEmpty()) {
            notify(CrawlPhase.DONE, null);
            return false;
        }
        String url = next.get();

        // FETCHING
        notify(CrawlPhase.FETCHING, url);
        FetchedPage page;
        try {
            page = fetcher.fetch(url);
        } catch (FetchException e) {
            stats.pageFailed();
            LOG.warn("Fetch failed [{}] {}: {}", e.getKind(), url, e.getMessage());
            SLOG.warn("page-fetch-failed",
                    "url", url,
                    "kind", e.getKind().name(),
                    "status", e.getStatusCode(),
                    "message", e.getMessage());
            return true;
        } catch (RuntimeException e) {
            // fetcher 구현 버그도 해당 URL 실패로만 처리
            stats.pageFailed();
            LOG.warn("Fetch failed (unexpected) {}: {}", url, e.toString());
            SLOG.error("page-fetch-failed", e, "url", url, "kind", "UNEXPECTED");
            return true;
        }
        String html = (page.getBody() == null) ? "" : page.getBody();

        // LINKING
        notify(CrawlPhase.LINKING, url);
        Set<String> links = linkExtractor.extract(html, url);
        int admitted = 0;
        for (String link : links) {
            if (frontier.add(link)) admitted++;
        }
        stats.addLinks(links.size(), admitted);
        LOG.debug("Links on {}: found={}, admitted={}", url, links.size(), admitted);

        // RECORDING
        notify(CrawlPhase.RECORDING, url);
        Document doc = buildDocument(url, html, links);
        documents.add(doc);
        try {
            exporter.append(doc);
        } catch (IOException | RuntimeException e) {
            stats.exportFailed();
            LOG.warn("Export failed for {}: {}", url, e.toString());
            SLOG.warn("export-failed", e, "url", url);
        }
        stats.pageCrawled();

        LOG.info("Crawled {} (page #{}) -> links={}, new={}", url, stats.pagesCrawled(), links.size(), admitted);
        SLOG.info("page-crawled",
                "url", url,
                "pageNo", stats.pagesCrawled(),
                "status", page.getStatusCode(),
                "links", links.size(),
                "admitted", admitted,
                "contentLength", doc.contentLength());
        return true;
    }

    private Document buildDocument(String url, String html, Set<String> links) {
        String content = converter.convert(html);
        PageMetadata meta = metadataExtractor.extract(html);
        if (meta == null) meta = PageMetadata.empty();

        Document.Builder b = Document.builder(url)
                .title(meta.getTitle().orElse(""))
                .description(meta.getDescription().orElse(null))
                .content(content)
                .links(new ArrayList<>(links))
                .metadata(meta.getOther());
        meta.getKeywords().ifPresent(k -> b.metadata("keywords", k));
        meta.getAuthor().ifPresent(a -> b.metadata("author", a));
        if (config.isIncludeRawHtml()) b.rawHtml(html);
        return b.build();
    }

    private void notify(CrawlPhase phase, String url) {
        try {
            listener.onProgress(phase, url, stats.pagesCrawled(), frontier.seenCount());
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed at {}: {}", phase, e.toString());
        }
    }

    private void closeCollaborators() {
        try {
            exporter.close();
        } catch (IOException | RuntimeException e) {
            stats.exportFailed();
            LOG.warn("Export close failed for {}: {}", exporter.target(), e.toString());
            SLOG.warn("export-failed", e, "target", String.valueOf(exporter.target()));
        }
        try {
            fetcher.close();
        } catch (Exception e) {
            LOG.debug("Fetcher close failed: {}", e.toString());
        }
    }

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || (flag != null && flag.get());
    }

    /* =========================
       게터
       ========================= */

    /** 현재까지의 결과 (run 중간이나 step 단위 호출 후 확인용) */
    public CrawlResult result(boolean cancelled) {
        return new CrawlResult(stats.snapshot(), frontier.seenCount(), documents, cancelled);
    }

    public CrawlConfig getConfig() { return config; }
    public Frontier frontier() { return frontier; }
    public CrawlStats.Snapshot getStats() { return stats.snapshot(); }
    public List<Document> getDocuments() { return List.copyOf(documents); }
}
