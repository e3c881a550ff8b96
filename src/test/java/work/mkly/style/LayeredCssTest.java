package work.mkly.style;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LayeredCssTest {
    @Test
    void declaresLayerOrderFirst() {
        String css = new LayeredCss().compile(StyleGraph.EMPTY);
        assertEquals(LayeredCss.LAYER_ORDER, css);
    }

    @Test
    void placesEachSourceInItsLayer() {
        String css = new LayeredCss()
            .diagnosticCss(".mkly-error{}")
            .kitCss(".kit{}")
            .keyframes(Map.of("fade", "0%{opacity:0}100%{opacity:1}"))
            .themeCss(".theme{}")
            .presetCss(".preset{}")
            .apiThemeCss(".mkly-document{--mkly-accent:red}")
            .blockCss(List.of(".block{}"))
            .compile(StyleGraphParser.parse("core/text\n  color: red"));

        String expected = String.join("\n\n",
            "@layer kit, theme, preset, user;",
            "@layer kit {\n.mkly-error{}\n.kit{}\n@keyframes fade{0%{opacity:0}100%{opacity:1}}\n}",
            "@layer theme {\n.theme{}\n}",
            "@layer preset {\n.preset{}\n.mkly-document{--mkly-accent:red}\n.block{}\n}",
            "@layer user {\n.mkly-core-text {\n  color: red;\n}\n}"
        );
        assertEquals(expected, css);
    }

    @Test
    void blankContributionsAreSkipped() {
        String css = new LayeredCss().kitCss("  ").themeCss(null).compile(StyleGraph.EMPTY);
        assertFalse(css.contains("@layer kit {"));
        assertTrue(css.startsWith(LayeredCss.LAYER_ORDER));
    }
}
