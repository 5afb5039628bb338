package com.spiderman.core.document;

import com.spiderman.core.api.IMetadataExtractor;
import com.spiderman.core.model.PageMetadata;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * title / meta[name][content] 기반 메타 추출기.
 * 엔티티(&amp;amp; &amp;lt; &amp;#39; 등) 디코딩은 JSoup 파서가 처리한다.
 */
public class JsoupMetadataExtractor implements IMetadataExtractor {

    @Override
    public PageMetadata extract(String html) {
        if (html == null || html.isBlank()) return PageMetadata.empty();
        org.jsoup.nodes.Document doc = Jsoup.parse(html);

        String title = null;
        Element t = doc.selectFirst("title");
        if (t != null) {
            String s = t.text().trim();
            if (!s.isEmpty()) title = s;
        }

        String description = null, keywords = null, author = null;
        Map<String, String> other = new LinkedHashMap<>();
        for (Element meta : doc.select("meta[name][content]")) {
            String name = meta.attr("name").trim();
            if (name.isEmpty()) continue;
            String content = meta.attr("content");

            switch (name.toLowerCase(Locale.ROOT)) {
                case "description" -> description = content;
                case "keywords" -> keywords = content;
                case "author" -> author = content;
                default -> other.put(name, content);
            }
        }
        return new PageMetadata(title, description, keywords, author, other);
    }
}
