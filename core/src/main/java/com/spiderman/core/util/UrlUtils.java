package com.spiderman.core.util;

import java.util.Locale;
import java.util.Optional;

/** URL 정규화(중복 판정 키) + 호스트 추출 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    private static final String SCHEME_SEP = "://";

    /**
     * 정규화 규칙 (문자열 기준, 파싱 실패 없음):
     * - 앞뒤 공백 제거 + 전체 소문자
     * - fragment 제거(#... 제거)
     * - authority 끝의 기본 포트(:80, :443) 제거
     * - 끝 슬래시 제거 (루트 "/" 포함 → "http://example.com")
     *
     * 각 단계가 다시 다른 단계를 드러낼 수 있으므로(예: "//" 끝, ":80:80") 고정점까지 반복한다.
     * 따라서 normalize(normalize(x)) == normalize(x) 가 항상 성립.
     */
    public static String normalize(String url) {
        if (url == null) return "";
        String s = url.toLowerCase(Locale.ROOT);
        String prev;
        do {
            prev = s;
            s = step(s);
        } while (!s.equals(prev));
        return s;
    }

    private static String step(String in) {
        String s = in.trim();

        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);

        s = stripDefaultPort(s);

        // 끝 슬래시: scheme 구분자 뒤에 '/'가 있을 때만 ("http://" 자체는 건드리지 않음)
        if (s.endsWith("/")) {
            int p = s.indexOf(SCHEME_SEP);
            if (p >= 0 && s.indexOf('/', p + SCHEME_SEP.length()) >= 0) {
                s = s.substring(0, s.length() - 1);
            }
        }
        return s;
    }

    private static String stripDefaultPort(String s) {
        int p = s.indexOf(SCHEME_SEP);
        int authStart = (p >= 0) ? p + SCHEME_SEP.length() : 0;
        int authEnd = s.indexOf('/', authStart);
        if (authEnd < 0) authEnd = s.length();

        String authority = s.substring(authStart, authEnd);
        String stripped = authority;
        if (authority.endsWith(":80")) stripped = authority.substring(0, authority.length() - 3);
        else if (authority.endsWith(":443")) stripped = authority.substring(0, authority.length() - 4);

        if (stripped.equals(authority)) return s;
        return s.substring(0, authStart) + stripped + s.substring(authEnd);
    }

    /**
     * host 추출: scheme 제거 → 첫 '/', '?', '#' 전까지 → ':port' 제거.
     * 빈 host면 empty. 대소문자는 그대로 (호출자가 정규화된 URL을 넘긴다고 가정).
     */
    public static Optional<String> extractDomain(String url) {
        if (url == null) return Optional.empty();
        int p = url.indexOf(SCHEME_SEP);
        String rest = (p >= 0) ? url.substring(p + SCHEME_SEP.length()) : url;

        int end = rest.length();
        for (char c : new char[] {'/', '?', '#'}) {
            int i = rest.indexOf(c);
            if (i >= 0 && i < end) end = i;
        }
        String hostPort = rest.substring(0, end);

        int colon = hostPort.indexOf(':');
        String host = (colon >= 0) ? hostPort.substring(0, colon) : hostPort;
        return host.isEmpty() ? Optional.empty() : Optional.of(host);
    }

    /** http/https 절대 URL 여부 (대소문자 무시) */
    public static boolean isHttpUrl(String url) {
        if (url == null) return false;
        String s = url.trim().toLowerCase(Locale.ROOT);
        return (s.startsWith("http://") && s.length() > 7) || (s.startsWith("https://") && s.length() > 8);
    }
}
