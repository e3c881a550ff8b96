package work.mkly.core;

import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

/**
 * Markdown body rendering for text-like blocks. Raw HTML in the source is escaped and unsafe link schemes dropped.
 */
public final class MarkdownRenderer {
    private static final Parser PARSER = Parser.builder().build();
    private static final HtmlRenderer RENDERER = HtmlRenderer.builder()
        .escapeHtml(true)
        .sanitizeUrls(true)
        .build();

    private MarkdownRenderer() {}

    public static String render(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return "";
        }
        return RENDERER.render(PARSER.parse(markdown)).strip();
    }
}
