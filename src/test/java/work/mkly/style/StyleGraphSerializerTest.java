package work.mkly.style;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StyleGraphSerializerTest {
    @Test
    void writesCanonicalIndentedSyntax() {
        String expected = String.join("\n",
            "accent: #e2725b",
            "fontBody: Georgia",
            "",
            "core/card",
            "  padding: 16px",
            "  bg: $accent",
            "  .img",
            "    rounded: 8px",
            "  :hover",
            "    opacity: 0.9",
            "  >p",
            "    color: red",
            "",
            "core/card:hero",
            "  padding: 32px",
            "",
            ".custom-class",
            "  color: blue"
        );
        assertEquals(expected, StyleGraphSerializer.serialize(StyleGraphParser.parse(StyleGraphParserTest.SAMPLE)));
    }

    @Test
    void reparsingSerializedGraphKeepsRulesAndVariables() {
        StyleGraph original = StyleGraphParser.parse(StyleGraphParserTest.SAMPLE);
        StyleGraph reparsed = StyleGraphParser.parse(StyleGraphSerializer.serialize(original));
        assertEquals(original.variables(), reparsed.variables());
        assertEquals(original.rules(), reparsed.rules());
    }

    @Test
    void rulesSharingKeyAreMerged() {
        var graph = new StyleGraph(List.of(), List.of(
            new StyleRule("core/text", "self", null, Map.of("color", "red")),
            new StyleRule("core/text", "self", null, Map.of("margin", "0"))
        ));
        assertEquals("core/text\n  color: red\n  margin: 0", StyleGraphSerializer.serialize(graph));
    }

    @Test
    void sectionHeadersForTargets() {
        assertEquals(":hover", StyleGraphSerializer.targetLine("self:hover"));
        assertEquals(">p", StyleGraphSerializer.targetLine(">p"));
        assertEquals(".img:hover", StyleGraphSerializer.targetLine("img:hover"));
    }

    @Test
    void emptyGraphSerializesToEmptyText() {
        assertEquals("", StyleGraphSerializer.serialize(StyleGraph.EMPTY));
    }

    private static void assertRoundTrip(StyleGraph graph) {
        String text = StyleGraphSerializer.serialize(graph);
        StyleGraph reparsed = StyleGraphParser.parse(text);
        assertEquals(graph.variables(), reparsed.variables(), text);
        assertEquals(Set.copyOf(graph.rules()), Set.copyOf(reparsed.rules()), text);
        assertTrue(reparsed.warnings().isEmpty(), text);
    }

    @Test
    void parsedTargetsSurviveRoundTrip() {
        List<String> sources = List.of(
            "card:nth-child(2)\n  color: red",
            "card.img:nth-child(2)\n  color: red",
            "core/card:hero\n  padding: 4px\n  :hover\n    opacity: 0.5",
            "core/card:hero\n  .img:first-child\n    margin: 0",
            "core/text\n  >a:not(.plain)\n    color: blue\n  ::before\n    content: '>'",
            "core/list\n  :nth-of-type(2n+1)\n    bg: $muted"
        );
        for (String source : sources) {
            StyleGraph graph = StyleGraphParser.parse(source);
            assertFalse(graph.rules().isEmpty(), source);
            assertRoundTrip(graph);
        }
        assertEquals("self:nth-child(2)", StyleGraphParser.parse(sources.get(0)).rules().get(0).target());
        assertEquals("img:nth-child(2)", StyleGraphParser.parse(sources.get(1)).rules().get(0).target());
    }

    @Test
    void editedGraphsSurviveRoundTrip() {
        StyleGraph graph = StyleGraph.EMPTY
            .mergeRule("core/card", "self", null, "padding", "  16px ")
            .mergeRule("core/card", "self:nth-child(odd)", null, "bg", "#eee")
            .mergeRule("core/card", "self:hover", "hero", "opacity", "0.8")
            .mergeRule("core/card", "img:hover", "hero", "borderRadius", "4px")
            .mergeRule("core/card", ">p", null, "lineHeight", "1.4")
            .mergeRule(StyleRule.RAW, ".brand a:hover", null, "color", "url(https://example.com/x.png)");
        assertEquals("16px", graph.styleValue("core/card", "self", null, "padding").orElseThrow());
        assertRoundTrip(graph);
    }

    @Test
    void blankEditRemovesProperty() {
        StyleGraph graph = StyleGraph.EMPTY
            .mergeRule("core/card", "self", null, "padding", "16px")
            .mergeRule("core/card", "self", null, "margin", "0")
            .mergeRule("core/card", "self", null, "padding", "");
        assertEquals(Map.of("margin", "0"), graph.rules().get(0).properties());
        assertTrue(StyleGraph.EMPTY.mergeRule("core/card", "self", null, "padding", " ").rules().isEmpty());
        assertRoundTrip(graph);
    }

    @Test
    void valuesThatReadBackDifferentlyAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> StyleGraph.EMPTY.mergeRule("core/card", "self", null, "content", "a // b"));
        assertThrows(IllegalArgumentException.class,
            () -> StyleGraph.EMPTY.mergeRule("core/card", "self", null, "content", "a\nb"));
        assertThrows(IllegalArgumentException.class,
            () -> new StyleRule("core/card", "self", null, Map.of("color", "")));
    }
}
