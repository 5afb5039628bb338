package com.spiderman.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 크롤된 페이지 1건의 레코드 (JSONL 한 줄 = Document 1개).
 * fetch 성공 페이지마다 한 번 생성되고 export에 넘긴 뒤로는 변경되지 않는다.
 *
 * JSON 키: url, title, description?, content, raw_html?, links, crawled_at, metadata?
 */
@JsonPropertyOrder({"url", "title", "description", "content", "raw_html", "links", "crawled_at", "metadata"})
public final class Document {

    @JsonProperty("url")
    private final String url;

    @JsonProperty("title")
    private final String title;

    @JsonProperty("description")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String description;

    @JsonProperty("content")
    private final String content;

    @JsonProperty("raw_html")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String rawHtml;

    @JsonProperty("links")
    private final List<String> links;

    @JsonProperty("crawled_at")
    private final Instant crawledAt;

    @JsonProperty("metadata")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final Map<String, String> metadata;

    @JsonCreator
    Document(@JsonProperty("url") String url,
             @JsonProperty("title") String title,
             @JsonProperty("description") String description,
             @JsonProperty("content") String content,
             @JsonProperty("raw_html") String rawHtml,
             @JsonProperty("links") List<String> links,
             @JsonProperty("crawled_at") Instant crawledAt,
             @JsonProperty("metadata") Map<String, String> metadata) {
        this.url = Objects.requireNonNull(url, "url");
        this.title = (title == null) ? "" : title;
        this.description = description;
        this.content = (content == null) ? "" : content;
        this.rawHtml = rawHtml;
        this.links = (links == null) ? List.of() : List.copyOf(links);
        this.crawledAt = (crawledAt == null) ? Instant.now() : crawledAt;
        this.metadata = (metadata == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    // ----- 접근자 -----
    public String url() { return url; }
    public String title() { return title; }
    public Optional<String> description() { return Optional.ofNullable(description); }
    public String content() { return content; }
    public Optional<String> rawHtml() { return Optional.ofNullable(rawHtml); }
    public List<String> links() { return links; }
    public Instant crawledAt() { return crawledAt; }
    public Map<String, String> metadata() { return metadata; }
    public Optional<String> metadata(String key) { return Optional.ofNullable(metadata.get(key)); }

    public int linkCount() { return links.size(); }
    public int contentLength() { return content.length(); }

    @Override
    public String toString() {
        return "Document{url=" + url + ", title=" + title + ", links=" + links.size()
                + ", contentLength=" + content.length() + ", crawledAt=" + crawledAt + "}";
    }

    // ----- 빌더 -----
    public static Builder builder(String url) { return new Builder(url); }

    public static final class Builder {
        private final String url;
        private String title = "";
        private String description;
        private String content = "";
        private String rawHtml;
        private List<String> links = List.of();
        private Instant crawledAt;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder(String url) { this.url = url; }

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder rawHtml(String rawHtml) { this.rawHtml = rawHtml; return this; }
        public Builder links(List<String> links) { this.links = links; return this; }
        public Builder crawledAt(Instant crawledAt) { this.crawledAt = crawledAt; return this; }

        public Builder metadata(String key, String value) {
            if (key != null && value != null) metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> entries) {
            if (entries != null) entries.forEach(this::metadata);
            return this;
        }

        public Document build() {
            return new Document(url, title, description, content, rawHtml, links, crawledAt, metadata);
        }
    }
}
