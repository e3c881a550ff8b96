package work.mkly.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HtmlTest {
    @Test
    void escapesMarkupButKeepsEntities() {
        assertEquals("&lt;b&gt; &amp; &copy; &#169; &quot;", Html.escape("<b> & &copy; &#169; \""));
    }

    @Test
    void tildeEscapeBecomesNonBreakingSpace() {
        assertEquals("a&nbsp;b", Html.escape("a\\~b"));
    }

    @Test
    void attributeEscapesEveryAmpersand() {
        assertEquals("&amp;copy; &quot;x&quot;", Html.attribute("&copy; \"x\""));
    }

    @Test
    void rejectsScriptSchemes() {
        assertFalse(Html.isSafeUrl("javascript:alert(1)"));
        assertFalse(Html.isSafeUrl(" JavaScript:alert(1)"));
        assertFalse(Html.isSafeUrl("java\tscript:alert(1)"));
        assertFalse(Html.isSafeUrl("data:text/html,x"));
        assertTrue(Html.isSafeUrl("https://example.com/a?b=c"));
        assertTrue(Html.isSafeUrl("/relative"));
        assertEquals("#", Html.safeUrl("vbscript:msgbox"));
    }

    @Test
    void errorBoxEscapesMessage() {
        assertEquals(
            "<div class=\"mkly-error\" data-mkly-error data-line=\"4\">bad &lt;x&gt; <span>(line 4)</span></div>",
            Html.errorBox("bad <x>", 4)
        );
    }
}
