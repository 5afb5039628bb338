package com.spiderman.core.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlToMarkdownConverterTest {

    private final HtmlToMarkdownConverter conv = new HtmlToMarkdownConverter();

    @Test
    @DisplayName("빈 입력 → 빈 문자열")
    void emptyInput() {
        assertThat(conv.convert("")).isEmpty();
        assertThat(conv.convert("   \n ")).isEmpty();
        assertThat(conv.convert(null)).isEmpty();
    }

    @Test
    void headingsParagraphsEmphasis() {
        String md = conv.convert("<h1>Title</h1><p>Hello <strong>world</strong> and <em>you</em></p><h3>Sub</h3>");

        assertThat(md).startsWith("# Title");
        assertThat(md).contains("Hello **world** and *you*");
        assertThat(md).endsWith("### Sub");
    }

    @Test
    @DisplayName("script/style/head 본문에서 제거")
    void dropsNonContent() {
        String md = conv.convert("<head><title>T</title><style>p{}</style></head>"
                + "<body><p>Keep</p><script>var x = 1;</script><noscript>enable js</noscript></body>");

        assertThat(md).isEqualTo("Keep");
    }

    @Test
    void links_andLists() {
        String md = conv.convert("<p><a href=\"/x\">Go</a> <a href=\"#top\">Top</a></p><ul><li>One</li><li>Two</li></ul>");

        assertThat(md).contains("[Go](/x)");
        assertThat(md).contains("Top").doesNotContain("(#top)");
        assertThat(md).contains("* One\n* Two");
    }

    @Test
    void pre_keepsWhitespace() {
        String md = conv.convert("<pre>line1\n  line2</pre>");
        assertThat(md).isEqualTo("```\nline1\n  line2\n```");
    }

    @Test
    @DisplayName("연속 빈 줄은 최대 2줄, 앞뒤 공백 제거")
    void clean_collapsesBlankRuns() {
        assertThat(HtmlToMarkdownConverter.clean("a\n\n\n\n\nb")).isEqualTo("a\n\n\nb");
        assertThat(HtmlToMarkdownConverter.clean("\n\n  x  \n \t \n\n\n\ny\n\n")).isEqualTo("x\n\n\ny");
        assertThat(HtmlToMarkdownConverter.clean("")).isEmpty();
    }

    @Test
    void fixturePage() {
        String md = conv.convert(Fixtures.read("/pages/article.html"));

        assertThat(md).contains("# Orb Weavers");
        assertThat(md).contains("## Common species");
        assertThat(md).contains("**spiral**");
        assertThat(md).contains("[silk guide](/guide/silk.html)");
        assertThat(md).contains("* Garden spider");
        assertThat(md).contains("A dewy web");
        assertThat(md).contains("web.spin();");
        assertThat(md).doesNotContain("tracker", "body script", "font-family");
        assertThat(md).doesNotContain("\n\n\n\n");
    }
}
