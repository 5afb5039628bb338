package com.spiderman.core.document;

import com.spiderman.core.api.IContentConverter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.Locale;
import java.util.Set;

/**
 * HTML → 마크다운 풍 텍스트 변환기 (JSoup DOM 순회).
 * - h1~h6 → "#" 접두, li → "* ", a → [text](href), pre → 원문 유지
 * - script/style/head 등 비본문 태그 제거
 * - 연속 빈 줄은 최대 2줄로 축소, 앞뒤 공백 제거 (줄바꿈 없음, 폭 제한 없음)
 */
public class HtmlToMarkdownConverter implements IContentConverter {

    private static final Set<String> SKIP = Set.of("script", "style", "head", "noscript", "template", "iframe", "svg");
    private static final Set<String> BLOCK = Set.of(
            "p", "div", "section", "article", "header", "footer", "nav", "main", "aside",
            "ul", "ol", "table", "tr", "blockquote", "form", "figure", "dl", "dt", "dd", "hr");

    @Override
    public String convert(String html) {
        if (html == null || html.isBlank()) return "";
        Element body = Jsoup.parse(html).body();
        StringBuilder sb = new StringBuilder(html.length() / 2);
        renderChildren(body, sb);
        return clean(sb.toString());
    }

    private void renderChildren(Node parent, StringBuilder sb) {
        for (Node child : parent.childNodes()) {
            render(child, sb);
        }
    }

    private void render(Node node, StringBuilder sb) {
        if (node instanceof TextNode t) {
            String text = t.text();
            if (!text.isBlank()) sb.append(text);
            else if (!text.isEmpty() && !endsWithWhitespace(sb)) sb.append(' ');
            return;
        }
        if (!(node instanceof Element el)) return;

        String tag = el.normalName().toLowerCase(Locale.ROOT);
        if (SKIP.contains(tag)) return;

        switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                int level = tag.charAt(1) - '0';
                blankLine(sb);
                sb.append("#".repeat(level)).append(' ').append(el.text().trim());
                blankLine(sb);
            }
            case "br" -> sb.append('\n');
            case "li" -> {
                newLine(sb);
                sb.append("* ");
                renderChildren(el, sb);
                newLine(sb);
            }
            case "pre" -> {
                blankLine(sb);
                sb.append("```\n").append(el.wholeText()).append("\n```");
                blankLine(sb);
            }
            case "a" -> {
                String text = el.text().trim();
                String href = el.attr("href").trim();
                if (text.isEmpty()) return;
                if (href.isEmpty() || href.startsWith("#") || href.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
                    sb.append(text);
                } else {
                    sb.append('[').append(text).append("](").append(href).append(')');
                }
            }
            case "strong", "b" -> wrap(el, sb, "**");
            case "em", "i" -> wrap(el, sb, "*");
            case "td", "th" -> {
                renderChildren(el, sb);
                sb.append(' ');
            }
            case "img" -> {
                String alt = el.attr("alt").trim();
                if (!alt.isEmpty()) sb.append(alt);
            }
            default -> {
                if (BLOCK.contains(tag)) {
                    blankLine(sb);
                    renderChildren(el, sb);
                    blankLine(sb);
                } else {
                    renderChildren(el, sb);
                }
            }
        }
    }

    private static void wrap(Element el, StringBuilder sb, String mark) {
        String text = el.text().trim();
        if (text.isEmpty()) return;
        sb.append(mark).append(text).append(mark);
    }

    private static boolean endsWithWhitespace(StringBuilder sb) {
        return sb.length() == 0 || Character.isWhitespace(sb.charAt(sb.length() - 1));
    }

    private static void newLine(StringBuilder sb) {
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '\n') sb.append('\n');
    }

    private static void blankLine(StringBuilder sb) {
        newLine(sb);
        sb.append('\n');
    }

    /**
     * 후처리: 줄 끝 공백 제거, 공백뿐인 줄은 빈 줄로 보고 연속 빈 줄은 최대 2줄만 남긴 뒤 전체 trim.
     */
    public static String clean(String markdown) {
        if (markdown == null || markdown.isEmpty()) return "";
        StringBuilder result = new StringBuilder(markdown.length());
        int blankCount = 0;

        for (String line : markdown.split("\\R", -1)) {
            if (line.isBlank()) {
                blankCount++;
                if (blankCount <= 2) result.append('\n');
            } else {
                blankCount = 0;
                result.append(line.stripTrailing()).append('\n');
            }
        }
        return result.toString().trim();
    }
}
