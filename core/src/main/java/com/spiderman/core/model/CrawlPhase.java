package com.spiderman.core.model;

/** 오케스트레이터 루프 상태 */
public enum CrawlPhase {
    IDLE,
    FETCHING,
    LINKING,
    RECORDING,
    DONE
}
