package com.spiderman.core.crawler;

import java.util.Set;

/** 기본 추출기: 정규식 태그 스캔 → LinkResolver 필터/해석 */
public class RegexLinkExtractor implements LinkExtractor {

    @Override
    public Set<String> extract(String html, String baseUrl) {
        return LinkResolver.extractLinks(html, baseUrl);
    }
}
