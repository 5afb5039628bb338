package com.spiderman.core.model;

/**
 * 프론티어 현황 스냅샷.
 * @param totalSeen 지금까지 승인된 URL 수 (대기 + 처리)
 * @param queued    큐에 남은 수
 * @param processed totalSeen - queued
 */
public record FrontierStats(int totalSeen, int queued, int processed) {}
