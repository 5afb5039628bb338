package com.spiderman.core.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LinkResolverTest {

    @Test
    @DisplayName("절대 경로 참조는 base의 scheme+host에 붙는다")
    void resolve_absolutePath() {
        assertThat(LinkResolver.resolve("/about", "http://example.com/some/path"))
                .contains("http://example.com/about");
    }

    @Test
    @DisplayName("상대 참조는 base 디렉터리 기준")
    void resolve_relativeToDirectory() {
        assertThat(LinkResolver.resolve("contact.html", "http://example.com/blog/"))
                .contains("http://example.com/blog/contact.html");
        // 마지막 세그먼트는 파일로 보고 떼어낸다
        assertThat(LinkResolver.resolve("contact.html", "http://example.com/blog/index.html"))
                .contains("http://example.com/blog/contact.html");
        assertThat(LinkResolver.resolve("x.html", "http://example.com"))
                .contains("http://example.com/x.html");
    }

    @Test
    @DisplayName("..은 한 단계 위로, 루트 위로는 못 올라감")
    void resolve_dotDot() {
        assertThat(LinkResolver.resolve("../page.html", "http://example.com/a/b/c/"))
                .contains("http://example.com/a/b/page.html");
        assertThat(LinkResolver.resolve("../../../x", "http://example.com/a/"))
                .contains("http://example.com/x");
        assertThat(LinkResolver.resolve("./y/./z", "http://example.com/a/"))
                .contains("http://example.com/a/y/z");
    }

    @Test
    @DisplayName("protocol-relative는 base scheme 상속")
    void resolve_protocolRelative() {
        assertThat(LinkResolver.resolve("//cdn.example.com/f.js", "https://example.com"))
                .contains("https://cdn.example.com/f.js");
        assertThat(LinkResolver.resolve("//cdn.example.com/f.js", "http://example.com"))
                .contains("http://cdn.example.com/f.js");
    }

    @Test
    void resolve_absoluteUrl_isCleanedOnly() {
        assertThat(LinkResolver.resolve("  https://other.com/P?q=1#frag ", "http://example.com"))
                .contains("https://other.com/P?q=1");
    }

    @Test
    void resolve_stripsFragmentOfRelative() {
        assertThat(LinkResolver.resolve("page.html#top", "http://example.com/dir/index.html"))
                .contains("http://example.com/dir/page.html");
    }

    @Test
    @DisplayName("base에 scheme:// 이 없으면 해석 실패")
    void resolve_unparseableBase_isEmpty() {
        assertThat(LinkResolver.resolve("x.html", "example.com/a")).isEmpty();
        assertThat(LinkResolver.resolve("/x", "not a url")).isEmpty();
        assertThat(LinkResolver.resolve(null, "http://example.com")).isEmpty();
    }

    @Test
    void isValidUrl_filtersNonNavigable() {
        assertTrue(LinkResolver.isValidUrl("/a"));
        assertTrue(LinkResolver.isValidUrl("page.html"));
        assertTrue(LinkResolver.isValidUrl("https://example.com"));

        assertFalse(LinkResolver.isValidUrl(""));
        assertFalse(LinkResolver.isValidUrl("   "));
        assertFalse(LinkResolver.isValidUrl(null));
        assertFalse(LinkResolver.isValidUrl("#section"));
        assertFalse(LinkResolver.isValidUrl("javascript:void(0)"));
        assertFalse(LinkResolver.isValidUrl("JavaScript:alert(1)"));
        assertFalse(LinkResolver.isValidUrl("mailto:a@b.com"));
        assertFalse(LinkResolver.isValidUrl("tel:+123"));
        assertFalse(LinkResolver.isValidUrl("data:text/html,hi"));
    }

    @Test
    @DisplayName("유효 1 + fragment 1 + javascript 1 → 1개")
    void extractLinks_filtersFragmentAndJavascript() {
        String html = "<a href=\"http://example.com/page1\">Page 1</a>"
                + "<a href=\"#section\">Section</a>"
                + "<a href=\"javascript:void(0)\">JS</a>";

        Set<String> links = LinkResolver.extractLinks(html, "http://example.com");

        assertThat(links).containsExactly("http://example.com/page1");
    }

    @Test
    void extractLinks_dedupsAndKeepsOrder() {
        String html = "<A HREF='/b'>b</A> <a class=\"x\" href=\"/a\">a</a> <a href=\"/b\">b again</a>"
                + "<a href=\"/a#frag\">a with fragment</a>";

        Set<String> links = LinkResolver.extractLinks(html, "http://example.com/");

        assertThat(links).containsExactly("http://example.com/b", "http://example.com/a");
    }

    @Test
    void extractLinks_emptyOrNull() {
        assertThat(LinkResolver.extractLinks("", "http://example.com")).isEmpty();
        assertThat(LinkResolver.extractLinks(null, "http://example.com")).isEmpty();
        assertThat(LinkResolver.extractLinks("<p>no links</p>", "http://example.com")).isEmpty();
    }

    @Test
    void parseBase_splitsSchemeHostPath() {
        var b = LinkResolver.parseBase("https://example.com:8443/a/b").orElseThrow();
        assertEquals("https", b.scheme());
        assertEquals("example.com:8443", b.host());
        assertEquals("/a/b", b.path());

        assertEquals("/", LinkResolver.parseBase("http://example.com").orElseThrow().path());
        assertTrue(LinkResolver.parseBase("example.com").isEmpty());
    }
}
