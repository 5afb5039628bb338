package com.spiderman.core.util;

import com.spiderman.core.model.CrawlPhase;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param phase   오케스트레이터 현재 상태
     * @param url     처리 중인 URL (IDLE/DONE이면 null)
     * @param crawled 지금까지 레코드가 만들어진 페이지 수
     * @param seen    프론티어에 승인된 URL 수 (seed 포함)
     */
    void onProgress(CrawlPhase phase, String url, long crawled, long seen);

    ProgressListener NONE = (phase, url, c, s) -> {};
}
