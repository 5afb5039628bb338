package com.spiderman.core.crawler;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 링크 해석기 (순수 함수 모음).
 * - 마크업에서 a[href] 값 추출 (정규식 기반의 관대한 스캔, 완전한 파서 아님)
 * - 크롤 불가 참조 필터링 (#, javascript:, mailto:, tel:, data:)
 * - base 기준 상대 → 절대 URL 변환 + 경로(., ..) 정리 + fragment 제거
 *
 * 네트워크/프론티어 상태와 무관하므로 문자열 리터럴만으로 테스트 가능.
 */
public final class LinkResolver {
    private LinkResolver() {}

    /** &lt;a ... href="..."&gt; / href='...' (대소문자 무시) */
    private static final Pattern ANCHOR_HREF = Pattern.compile(
            "<a\\s+[^>]*href\\s*=\\s*[\"']([^\"']+)[\"'][^>]*>",
            Pattern.CASE_INSENSITIVE);

    private static final List<String> BLOCKED_SCHEMES = List.of("javascript:", "mailto:", "tel:", "data:");

    /** base URL 구성요소: scheme, host[:port], path("/"로 시작) */
    public record BaseUrl(String scheme, String host, String path) {}

    /**
     * html 안의 앵커 참조를 모두 절대 URL로 바꿔 반환.
     * 결과는 중복 제거 + 문서 내 등장 순서 유지. 해석 실패한 참조는 조용히 버림.
     */
    public static Set<String> extractLinks(String html, String baseUrl) {
        Set<String> out = new LinkedHashSet<>();
        if (html == null || html.isEmpty()) return out;

        Matcher m = ANCHOR_HREF.matcher(html);
        while (m.find()) {
            String href = m.group(1);
            if (!isValidUrl(href)) continue;
            resolve(href, baseUrl).ifPresent(out::add);
        }
        return out;
    }

    /** 크롤 후보 여부: 빈 값, fragment 전용, 비탐색 scheme 거부 */
    public static boolean isValidUrl(String ref) {
        if (ref == null) return false;
        String s = ref.trim();
        if (s.isEmpty()) return false;
        if (s.startsWith("#")) return false;

        String lower = s.toLowerCase(Locale.ROOT);
        for (String scheme : BLOCKED_SCHEMES) {
            if (lower.startsWith(scheme)) return false;
        }
        return true;
    }

    /**
     * 참조를 base 기준 절대 URL로 해석.
     * @return 해석 불가(base에 scheme:// 없음 등)면 empty
     */
    public static Optional<String> resolve(String ref, String baseUrl) {
        if (ref == null || baseUrl == null) return Optional.empty();
        String url = ref.trim();
        String base = baseUrl.trim();

        // 이미 절대 URL
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return Optional.of(cleanUrl(url));
        }

        // protocol-relative (//cdn.example.com/x)
        if (url.startsWith("//")) {
            String scheme = base.toLowerCase(Locale.ROOT).startsWith("https://") ? "https:" : "http:";
            return Optional.of(cleanUrl(scheme + url));
        }

        Optional<BaseUrl> parsed = parseBase(base);
        if (parsed.isEmpty()) return Optional.empty();
        BaseUrl b = parsed.get();

        // 절대 경로
        if (url.startsWith("/")) {
            return Optional.of(cleanUrl(b.scheme() + "://" + b.host() + url));
        }

        // 상대 경로: base path의 디렉터리 기준
        String dir;
        if (b.path().endsWith("/")) {
            dir = b.path();
        } else {
            int slash = b.path().lastIndexOf('/');
            dir = (slash >= 0) ? b.path().substring(0, slash + 1) : "/";
        }

        String combined = b.scheme() + "://" + b.host() + dir + url;
        return Optional.of(cleanUrl(resolvePath(combined)));
    }

    /** "scheme://host[:port]/path" 분해. path가 없으면 "/" */
    public static Optional<BaseUrl> parseBase(String baseUrl) {
        if (baseUrl == null) return Optional.empty();
        int p = baseUrl.indexOf("://");
        if (p < 0) return Optional.empty();

        String scheme = baseUrl.substring(0, p);
        String rest = baseUrl.substring(p + 3);

        int slash = rest.indexOf('/');
        String host = (slash >= 0) ? rest.substring(0, slash) : rest;
        String path = (slash >= 0) ? rest.substring(slash) : "/";
        return Optional.of(new BaseUrl(scheme, host, path));
    }

    /**
     * 절대 URL의 경로 부분에서 "."/빈 세그먼트 제거, ".."는 직전 세그먼트 pop.
     * 루트 위로는 올라가지 않는다.
     */
    public static String resolvePath(String url) {
        if (url == null) return "";
        int p = url.indexOf("://");
        if (p < 0) return url;
        int slash = url.indexOf('/', p + 3);
        if (slash < 0) return url;

        String base = url.substring(0, slash);
        String path = url.substring(slash);

        List<String> resolved = new ArrayList<>();
        for (String part : path.split("/", -1)) {
            switch (part) {
                case ".", "" -> {
                    if (resolved.isEmpty()) resolved.add(""); // 루트 마커
                }
                case ".." -> {
                    if (resolved.size() > 1) resolved.remove(resolved.size() - 1);
                }
                default -> resolved.add(part);
            }
        }
        return base + String.join("/", resolved);
    }

    /** 첫 '#'부터 잘라내고 앞뒤 공백 제거 */
    public static String cleanUrl(String url) {
        if (url == null) return "";
        String s = url.trim();
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        return s.trim();
    }
}
