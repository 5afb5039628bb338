package com.spiderman.core.crawler;

import java.util.Set;

/** 페이지 마크업에서 절대 URL을 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * html을 baseUrl 기준으로 해석해 절대 URL 집합으로 반환 (중복 없음, 등장 순서 유지).
     * 해석할 수 없는 참조는 결과에서 빠질 뿐 예외를 던지지 않는다.
     */
    Set<String> extract(String html, String baseUrl);
}
