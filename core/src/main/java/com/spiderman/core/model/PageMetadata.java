package com.spiderman.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** head 영역에서 뽑은 페이지 메타. 태그가 없으면 필드가 비어 있을 뿐 오류가 아니다. */
public final class PageMetadata {
    private final String title;
    private final String description;
    private final String keywords;
    private final String author;
    private final Map<String, String> other;

    public PageMetadata(String title, String description, String keywords, String author, Map<String, String> other) {
        this.title = title;
        this.description = description;
        this.keywords = keywords;
        this.author = author;
        this.other = (other == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(other));
    }

    public static PageMetadata empty() {
        return new PageMetadata(null, null, null, null, Map.of());
    }

    public Optional<String> getTitle() { return Optional.ofNullable(title); }
    public Optional<String> getDescription() { return Optional.ofNullable(description); }
    public Optional<String> getKeywords() { return Optional.ofNullable(keywords); }
    public Optional<String> getAuthor() { return Optional.ofNullable(author); }
    /** description/keywords/author 이외의 meta name → content */
    public Map<String, String> getOther() { return other; }
}
