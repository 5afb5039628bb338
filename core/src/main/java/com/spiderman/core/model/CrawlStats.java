package com.spiderman.core.model;

import java.util.concurrent.atomic.AtomicLong;

/** 크롤 진행 카운터 누적기. */
public final class CrawlStats {
    private final AtomicLong pagesCrawled   = new AtomicLong(0); // fetch 성공 + 레코드 생성
    private final AtomicLong pagesFailed    = new AtomicLong(0); // fetch 실패
    private final AtomicLong linksFound     = new AtomicLong(0); // 페이지들에서 추출된 링크 합
    private final AtomicLong linksAdmitted  = new AtomicLong(0); // 그중 프론티어에 새로 들어간 수
    private final AtomicLong exportFailures = new AtomicLong(0);

    public void pageCrawled() { pagesCrawled.incrementAndGet(); }
    public void pageFailed() { pagesFailed.incrementAndGet(); }
    public void exportFailed() { exportFailures.incrementAndGet(); }

    public void addLinks(long found, long admitted) {
        linksFound.addAndGet(found);
        linksAdmitted.addAndGet(admitted);
    }

    public long pagesCrawled() { return pagesCrawled.get(); }
    public long pagesFailed() { return pagesFailed.get(); }

    public Snapshot snapshot() {
        return new Snapshot(pagesCrawled.get(), pagesFailed.get(), linksFound.get(),
                linksAdmitted.get(), exportFailures.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long pagesCrawled;
        public final long pagesFailed;
        public final long linksFound;
        public final long linksAdmitted;
        public final long exportFailures;
        public Snapshot(long crawled, long failed, long found, long admitted, long exportFailures) {
            this.pagesCrawled = crawled;
            this.pagesFailed = failed;
            this.linksFound = found;
            this.linksAdmitted = admitted;
            this.exportFailures = exportFailures;
        }
    }
}
