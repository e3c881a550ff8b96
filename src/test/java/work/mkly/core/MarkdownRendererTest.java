package work.mkly.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MarkdownRendererTest {
    @Test
    void rendersParagraphsAndEmphasis() {
        assertEquals("<p>Hello <strong>world</strong></p>", MarkdownRenderer.render("Hello **world**"));
    }

    @Test
    void blankInputRendersNothing() {
        assertEquals("", MarkdownRenderer.render("  \n "));
        assertEquals("", MarkdownRenderer.render(null));
    }

    @Test
    void rawHtmlIsEscaped() {
        String html = MarkdownRenderer.render("a <script>x</script> b");
        assertFalse(html.contains("<script>"));
        assertTrue(html.contains("&lt;script&gt;"));
    }

    @Test
    void scriptLinksAreDropped() {
        String html = MarkdownRenderer.render("[click](javascript:alert(1))");
        assertFalse(html.contains("javascript:"));
        assertTrue(html.contains(">click</a>"));
    }

    @Test
    void listsBecomeListMarkup() {
        assertEquals("<ul>\n<li>one</li>\n<li>two</li>\n</ul>", MarkdownRenderer.render("- one\n- two"));
    }
}
