package com.spiderman.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 크롤 종료 시 최종 통계.
 * urlsDiscovered = 종료 시점 프론티어의 totalSeen (seed 포함).
 */
public final class CrawlResult {
    private final CrawlStats.Snapshot stats;
    private final int urlsDiscovered;
    private final List<Document> documents;
    private final boolean cancelled;

    public CrawlResult(CrawlStats.Snapshot stats, int urlsDiscovered, List<Document> documents, boolean cancelled) {
        this.stats = Objects.requireNonNull(stats, "stats");
        this.urlsDiscovered = urlsDiscovered;
        this.documents = List.copyOf(documents);
        this.cancelled = cancelled;
    }

    public long getPagesCrawled() { return stats.pagesCrawled; }
    public long getPagesFailed() { return stats.pagesFailed; }
    public int getUrlsDiscovered() { return urlsDiscovered; }
    public List<Document> getDocuments() { return documents; }
    public CrawlStats.Snapshot getStats() { return stats; }
    /** 취소 플래그로 중간에 멈췄으면 true (documents는 그 시점까지의 부분 결과) */
    public boolean isCancelled() { return cancelled; }

    @Override
    public String toString() {
        return "CrawlResult{pagesCrawled=" + stats.pagesCrawled + ", pagesFailed=" + stats.pagesFailed
                + ", urlsDiscovered=" + urlsDiscovered + ", documents=" + documents.size()
                + (cancelled ? ", cancelled" : "") + "}";
    }
}
