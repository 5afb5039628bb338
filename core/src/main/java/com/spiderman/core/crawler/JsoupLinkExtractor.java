package com.spiderman.core.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JSoup 기반 추출기: a[href] 원본 값 수집.
 * 절대화는 jsoup의 abs:href가 아니라 LinkResolver로 처리 → 정규식 추출기와 같은 필터/해석 규칙 유지.
 */
public class JsoupLinkExtractor implements LinkExtractor {

    @Override
    public Set<String> extract(String html, String baseUrl) {
        Set<String> out = new LinkedHashSet<>();
        if (html == null || html.isEmpty()) return out;

        Document doc = Jsoup.parse(html);
        for (Element a : doc.select("a[href]")) {
            String href = a.attr("href");
            if (!LinkResolver.isValidUrl(href)) continue;
            LinkResolver.resolve(href, baseUrl).ifPresent(out::add);
        }
        return out;
    }
}
