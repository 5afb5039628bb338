package com.spiderman.core.crawler;

import com.spiderman.core.model.CrawlConfig;
import com.spiderman.core.model.FrontierStats;
import com.spiderman.core.util.UrlUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 크롤 프론티어: FIFO 대기 큐 + 승인(seen) 집합 + 도메인/페이지 상한 정책.
 *
 * 불변식
 * - 한 정규화 URL은 seen에 최대 한 번만 들어간다 (한 번 승인되면 다시 큐에 못 들어감)
 * - 큐의 모든 원소는 seen에 있고, 큐에 중복은 없다
 * - 상한 규칙: seen 크기(승인 수)로 add()에서 자른다. next()의 processed 검사는
 *   processed <= seen <= maxPages 이므로 같은 상한을 다시 확인하는 역할만 한다.
 *
 * 크롤 1회 전용, 오케스트레이터 단일 스레드가 소유 → 동기화 없음.
 */
public final class Frontier {

    private final Deque<String> queue = new ArrayDeque<>();
    private final Set<String> seen = new HashSet<>();
    private final Integer maxPages;             // null = 무제한
    private final List<String> allowedDomains;  // null = 전체 허용

    /**
     * @param seed           시작 URL. 도메인/상한 검사 없이 첫 번째로 승인된다.
     * @param maxPages       승인 상한 (null이면 무제한)
     * @param allowedDomains 허용 호스트 (null이면 전체)
     */
    public Frontier(String seed, Integer maxPages, List<String> allowedDomains) {
        Objects.requireNonNull(seed, "seed");
        if (maxPages != null && maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        this.maxPages = maxPages;
        // null/빈 항목은 버리고 소문자로 (CrawlConfig.Builder와 같은 규칙)
        this.allowedDomains = (allowedDomains == null)
                ? null
                : allowedDomains.stream()
                        .filter(d -> d != null && !d.isBlank())
                        .map(d -> d.trim().toLowerCase(Locale.ROOT))
                        .toList();

        admit(UrlUtils.normalize(seed));
    }

    public Frontier(String seed) {
        this(seed, null, null);
    }

    public static Frontier of(CrawlConfig cfg) {
        Integer cap = cfg.getMaxPages().isPresent() ? cfg.getMaxPages().getAsInt() : null;
        return new Frontier(cfg.getSeed(), cap, cfg.getAllowedDomains().orElse(null));
    }

    /**
     * URL 승인 시도. 검사 순서: 중복 → 도메인 → 상한.
     * @return 새로 큐에 들어갔으면 true
     */
    public boolean add(String url) {
        if (url == null) return false;
        String n = UrlUtils.normalize(url);

        if (seen.contains(n)) return false;

        if (allowedDomains != null) {
            Optional<String> host = UrlUtils.extractDomain(n);
            if (host.isEmpty() || !allowedDomains.contains(host.get())) return false;
        }

        if (maxPages != null && seen.size() >= maxPages) return false;

        admit(n);
        return true;
    }

    /**
     * 다음 방문 대상 (엄격한 FIFO → BFS).
     * 처리 수가 상한에 닿았거나 큐가 비면 empty, 이때 큐는 건드리지 않는다.
     */
    public Optional<String> next() {
        if (maxPages != null) {
            int processed = seen.size() - queue.size();
            if (processed >= maxPages) return Optional.empty();
        }
        return Optional.ofNullable(queue.pollFirst());
    }

    public boolean hasPending() { return !queue.isEmpty(); }

    public boolean isSeen(String url) { return seen.contains(UrlUtils.normalize(url)); }

    public int seenCount() { return seen.size(); }

    public int queueSize() { return queue.size(); }

    public FrontierStats stats() {
        int total = seen.size();
        int queued = queue.size();
        return new FrontierStats(total, queued, total - queued);
    }

    private void admit(String canonical) {
        queue.addLast(canonical);
        seen.add(canonical);
    }
}
