package work.mkly.style;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EmailStylesTest {
    private static final Map<String, String> VARIABLES = Map.of(
        "accent", "#e2725b",
        "bg", "#ffffff",
        "bgSubtle", "#f0f0f0"
    );

    @Test
    void resolvesDollarReferences() {
        assertEquals("1px solid #e2725b", EmailStyles.resolveForEmail("1px solid $accent", VARIABLES));
    }

    @Test
    void resolvesCustomProperties() {
        assertEquals("#e2725b", EmailStyles.resolveForEmail("var(--mkly-accent)", VARIABLES));
        assertEquals("#f0f0f0", EmailStyles.resolveForEmail("var(--mkly-bg-subtle, #eee)", VARIABLES));
    }

    @Test
    void nestedFallbacksResolveInsideOut() {
        assertEquals("#ffffff", EmailStyles.resolveForEmail("var(--mkly-missing, var(--mkly-bg))", VARIABLES));
        assertEquals("red", EmailStyles.resolveForEmail("var(--mkly-missing, var(--mkly-other, red))", VARIABLES));
    }

    @Test
    void unresolvableReferencesStay() {
        assertEquals("$unknown", EmailStyles.resolveForEmail("$unknown", VARIABLES));
        assertEquals("var(--mkly-missing)", EmailStyles.resolveForEmail("var(--mkly-missing)", VARIABLES));
    }

    @Test
    void buildsInlineStyleMapForRule() {
        StyleGraph graph = StyleGraphParser.parse("core/button\n  .link\n    bg: $accent\n    padding: 8px");
        Map<String, String> styles = EmailStyles.emailStyleMap(graph, "core/button", "link", null, VARIABLES);
        assertEquals(Map.of("background", "#e2725b", "padding", "8px"), styles);
        assertTrue(EmailStyles.emailStyleMap(graph, "core/card", "self", null, VARIABLES).isEmpty());
    }
}
