package work.mkly.style;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StyleGraphTest {
    private final StyleGraph base = StyleGraphParser.parse("accent: red\ncore/card\n  padding: 8px\n  margin: 0");

    @Test
    void mergeRuleAddsOrReplacesProperty() {
        StyleGraph updated = base.mergeRule("core/card", "self", null, "padding", "16px")
            .mergeRule("core/card", "img", null, "maxWidth", "100%");
        assertEquals("16px", updated.styleValue("core/card", "self", null, "padding").orElseThrow());
        assertEquals("100%", updated.styleValue("core/card", "img", null, "max-width").orElseThrow());
        assertEquals("8px", base.styleValue("core/card", "self", null, "padding").orElseThrow());
    }

    @Test
    void removeRuleDropsEmptiedRules() {
        StyleGraph updated = base.removeRule("core/card", "self", null, "padding");
        assertEquals(Map.of("margin", "0"), updated.rule("core/card", "self", null).orElseThrow().properties());
        StyleGraph emptied = updated.removeRule("core/card", "self", null, "margin");
        assertTrue(emptied.rules().isEmpty());
        assertEquals(base.variables(), emptied.variables());
    }

    @Test
    void laterGraphsWinOnMerge() {
        StyleGraph override = StyleGraphParser.parse("accent: blue\ncore/card\n  padding: 4px\n  border: none");
        StyleGraph merged = StyleGraph.merge(base, override);
        assertEquals(Map.of("accent", "blue"), merged.variableMap());
        assertEquals(1, merged.rules().size());
        assertEquals(Map.of("padding", "4px", "margin", "0", "border", "none"), merged.rules().get(0).properties());
    }

    @Test
    void labelRequiresQualifiedType() {
        assertThrows(IllegalArgumentException.class, () -> new StyleRule("card", "self", "hero", Map.of("color", "red")));
        assertThrows(IllegalArgumentException.class, () -> new StyleRule("core/card", "self", null, Map.of()));
    }

    @Test
    void emptyGraph() {
        assertTrue(StyleGraph.EMPTY.isEmpty());
        assertTrue(StyleGraph.merge(List.of()).isEmpty());
    }
}
