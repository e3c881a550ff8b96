package work.mkly.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.mkly.support.MklyTestSupport.compile;
import static work.mkly.support.MklyTestSupport.withLabKit;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.mkly.api.CompileConfiguration;
import work.mkly.api.CompileResult;
import work.mkly.kit.Plugin;
import work.mkly.parse.Diagnostic;
import work.mkly.parse.DiagnosticKind;
import work.mkly.parse.Document;
import work.mkly.parse.Severity;

class DocumentCompilerTest {
    @Test
    void compilesMinimalDocument() {
        CompileResult result = compile("--- core/text\nHello");
        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
        assertEquals(1, result.version());
        assertTrue(result.html().contains("<div class=\"mkly-core-text\"><p>Hello</p></div>"));
        assertTrue(result.html().contains("<main class=\"mkly-document\" style=\"max-width:600px;margin:0 auto;\">"));
        assertTrue(result.html().startsWith("<style>@layer kit, theme, preset, user;"));
    }

    @Test
    void unknownBlockFallsBackToEscapedContent() {
        CompileResult result = compile("--- foo/bar\nraw <b>text</b>");
        assertTrue(result.html().contains("<div data-block=\"foo/bar\" class=\"mkly-unknown\">raw &lt;b&gt;text&lt;/b&gt;</div>"));
        Diagnostic warning = result.warnings().get(0);
        assertEquals("Unknown block type \"foo/bar\"", warning.message());
        assertEquals(DiagnosticKind.CONTENT, warning.kind());
        assertFalse(result.hasErrors());
    }

    @Test
    void unsupportedVersionIsFatal() {
        CompileResult result = compile("--- meta\nversion: 2\n--- core/text\nHi");
        assertEquals("", result.html());
        assertTrue(result.hasFatal());
        Diagnostic fatal = result.errors().get(0);
        assertEquals(DiagnosticKind.VERSION, fatal.kind());
        assertEquals("Unsupported version: 2. Supported: 1", fatal.message());
        assertEquals(1, result.exitCode());
    }

    @Test
    void fatalParseShortCircuits() {
        Document doc = Document.builder()
            .diagnostic(Diagnostic.fatal(DiagnosticKind.LIMIT, "Document exceeds maximum size (10 MB)", 1))
            .build();
        CompileResult result = DocumentCompiler.compile(doc, CompileConfiguration.defaults());
        assertEquals("", result.html());
        assertEquals(1, result.diagnostics().size());
    }

    @Test
    void unknownKitThemeAndPresetAreWarnings() {
        CompileResult result = compile("--- use: nope\n--- theme: neon\n--- preset: core/fancy\n--- core/text\nHi");
        List<String> messages = result.warnings().stream().map(Diagnostic::message).toList();
        assertEquals(List.of(
            "Unknown kit \"nope\": not available. Available kits: core",
            "Unknown theme \"neon\": not found in any kit or inline definition",
            "Unknown preset \"core/fancy\": not found in any kit"
        ), messages);
        assertTrue(result.warnings().stream().allMatch(d -> d.kind() == DiagnosticKind.REFERENCE));
        assertFalse(result.html().isEmpty());
    }

    @Test
    void variableCascadeKitThenThemeThenStyleThenCaller() {
        String kitOnly = "--- use: lab\n--- lab/accent";
        String withTheme = "--- use: lab\n--- theme: warm\n--- lab/accent";
        String withStyle = "--- use: lab\n--- theme: warm\n--- style\naccent: style\n--- lab/accent";

        assertTrue(compile(withLabKit().build(), kitOnly).html().contains("<p>kit</p>"));
        assertTrue(compile(withLabKit().build(), withTheme).html().contains("<p>theme</p>"));
        assertTrue(compile(withLabKit().build(), withStyle).html().contains("<p>style</p>"));
        assertTrue(compile(withLabKit().variable("accent", "caller").build(), withStyle).html().contains("<p>caller</p>"));
    }

    @Test
    void kitBlocksRequireUse() {
        CompileResult result = compile(withLabKit().build(), "--- lab/accent");
        assertTrue(result.html().contains("class=\"mkly-unknown\""));
    }

    @Test
    void blocksNewerThanDocumentVersionAreNotRegistered() {
        CompileResult result = compile(withLabKit().build(), "--- use: lab\n--- lab/future\nx");
        assertTrue(result.html().contains("<div data-block=\"lab/future\" class=\"mkly-unknown\">x</div>"));
    }

    @Test
    void failingRendererBecomesErrorBoxAndSiblingsRender() {
        CompileResult result = compile(withLabKit().build(), "--- use: lab\n--- lab/boom\n--- core/text\nStill here");
        assertTrue(result.html().contains("class=\"mkly-error\""));
        assertTrue(result.html().contains("<p>Still here</p>"));
        Diagnostic error = result.errors().get(0);
        assertEquals("Failed to render \"lab/boom\": kaput", error.message());
        assertEquals(DiagnosticKind.CONTENT, error.kind());
        assertEquals(2, error.line());
        assertEquals(1, result.exitCode());
    }

    @Test
    void containerRendersChildrenInPlace() {
        CompileResult result = compile("--- core/section\ntitle: Top\n\n--- core/text\nInner\n--- /core/section");
        assertTrue(result.html().contains(
            "<section class=\"mkly-core-section\"><h2 class=\"mkly-core-section__title\">Top</h2>"
                + "<div class=\"mkly-core-text\"><p>Inner</p></div></section>"
        ));
    }

    @Test
    void childrenOfNonContainerAreDroppedWithWarning() {
        CompileResult result = compile("--- core/card\n--- core/text\nNested\n--- /core/card");
        assertFalse(result.html().contains("Nested"));
        assertEquals("\"core/card\" is not a container; nested blocks are not rendered", result.warnings().get(0).message());
    }

    @Test
    void nestingBeyondCeilingIsCut() {
        int depth = DocumentCompiler.MAX_DEPTH + 2;
        var source = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            source.append("--- core/section\n");
        }
        for (int i = 0; i < depth; i++) {
            source.append("--- /core/section\n");
        }
        CompileResult result = compile(source.toString());
        assertTrue(result.html().contains(DocumentCompiler.DEPTH_EXCEEDED));
    }

    @Test
    void contentModeMismatchesWarn() {
        CompileResult result = compile("--- core/divider\n\nBody text\n--- core/list\nstyle: x\n\n- one");
        List<String> messages = result.warnings().stream().map(Diagnostic::message).toList();
        assertTrue(messages.contains("\"core/divider\" does not support body content; text below properties will be ignored"));
        assertTrue(messages.contains("\"core/list\" is a text block; properties are not supported and will be ignored"));
    }

    @Test
    void commentsAreEmittedBetweenBlocks() {
        CompileResult result = compile("// note -- here\n--- core/divider");
        assertTrue(result.html().contains("<!-- mkly-c: note \u2014 here -->\n<hr class=\"mkly-core-divider\">"));
    }

    @Test
    void sourceMapAnnotatesBlocksAndRecordsOffsets() {
        var configuration = CompileConfiguration.builder().sourceMap(true).build();
        CompileResult result = compile(configuration, "--- core/text\nHi\n\n--- core/divider");
        assertTrue(result.html().contains("<div data-mkly-line=\"1\" data-mkly-id=\"core/text:1\" class=\"mkly-core-text\">"));
        assertTrue(result.html().contains("<hr data-mkly-line=\"4\" data-mkly-id=\"core/divider:4\" class=\"mkly-core-divider\">"));
        assertTrue(result.html().contains(WebOutputWrapper.ACTIVE_OUTLINE));

        List<SourceMapEntry> entries = result.sourceMap().orElseThrow();
        assertEquals(2, entries.size());
        SourceMapEntry first = entries.get(0);
        assertEquals(1, first.sourceLine());
        assertEquals(3, first.sourceEndLine());
        assertEquals(0, first.htmlOffset());
        assertEquals(first.htmlLength() + 1, entries.get(1).htmlOffset());
    }

    @Test
    void sourceMapIsAbsentByDefault() {
        assertTrue(compile("--- core/divider").sourceMap().isEmpty());
    }

    @Test
    void pluginsOverrideRenderersWrapAndPostProcess() {
        var plugin = Plugin.builder("test")
            .renderer("core/text", (block, ctx) -> "<p>override</p>")
            .outputWrapper((page, ctx) -> page.content())
            .afterCompile((result, ctx) -> result.withHtml(result.html() + "<!-- done -->"))
            .build();
        CompileResult result = compile(CompileConfiguration.builder().plugin(plugin).build(), "--- core/text\nHi");
        assertEquals("<p>override</p><!-- done -->", result.html());
    }

    @Test
    void pluginTransformsRunBeforeRendering() {
        var plugin = Plugin.builder("upper")
            .transform(doc -> doc.withBlocks(doc.blocks().stream().map(b -> b.withContent(b.content().toUpperCase())).toList()))
            .build();
        CompileResult result = compile(CompileConfiguration.builder().plugin(plugin).build(), "--- core/text\nshout");
        assertTrue(result.html().contains("<p>SHOUT</p>"));
    }

    @Test
    void themesAddedByTransformsAreResolved() {
        var plugin = Plugin.builder("themer")
            .transform(doc -> doc.toBuilder().theme("light").build())
            .build();
        CompileResult result = compile(CompileConfiguration.builder().plugin(plugin).build(), "--- core/text\nHi");
        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
        assertTrue(result.html().contains("--mkly-accent: #000000;"));
        assertTrue(result.html().contains("<meta name=\"mkly:theme\" content=\"light\">"));
    }

    @Test
    void sourceMapSkipsLeadingWhitespace() {
        var plugin = Plugin.builder("indented")
            .renderer("core/text", (block, ctx) -> "  <p>x</p>")
            .build();
        var configuration = CompileConfiguration.builder().sourceMap(true).plugin(plugin).build();
        CompileResult result = compile(configuration, "--- core/text\nHi");
        assertTrue(result.html().contains("  <p data-mkly-line=\"1\" data-mkly-id=\"core/text:1\">x</p>"), result.html());
    }

    @Test
    void inlineThemeIsResolvedAndRoundTripped() {
        CompileResult result = compile("--- define-theme: brand\naccent: #123456\n--- theme: brand\n--- core/text\nHi");
        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().toString());
        assertTrue(result.html().contains("@layer theme {\n.mkly-document {\n  --mkly-accent: #123456;\n}\n}"));
        assertTrue(result.html().contains("<script type=\"text/mkly-defines\">--- define-theme: brand\naccent: #123456</script>"));
        assertTrue(result.html().contains("<meta name=\"mkly:theme\" content=\"brand\">"));
    }

    @Test
    void kitThemesAndPresetsFillTheirLayers() {
        CompileResult result = compile("--- theme: light\n--- preset: default\n--- core/text\nHi");
        assertTrue(result.html().contains("--mkly-accent: #000000;"));
        assertTrue(result.html().contains("@layer preset {"));
        assertTrue(result.html().contains(".mkly-core-heading {"));
    }

    @Test
    void styleWarningsMapToSourceLines() {
        CompileResult result = compile("--- style\ncore/text\n  color: darken(red, 5%)\n--- core/text\nHi");
        Diagnostic warning = result.warnings().get(0);
        assertEquals(DiagnosticKind.STYLE, warning.kind());
        assertEquals(Severity.WARNING, warning.severity());
        assertEquals(3, warning.line());
        assertTrue(warning.message().startsWith("Style: "));
    }

    @Test
    void userStylesLandInUserLayerAndRoundTripScript() {
        CompileResult result = compile("--- style\ncore/text\n  color: red\n--- core/text\nHi");
        assertTrue(result.html().contains("@layer user {\n.mkly-core-text {\n  color: red;\n}\n}"));
        assertTrue(result.html().contains("<script type=\"text/mkly-style\">core/text\n  color: red</script>"));
        assertEquals("red", result.styleGraph().styleValue("core/text", "self", null, "color").orElseThrow());
    }

    @Test
    void themeOverridesGoToPresetLayer() {
        var configuration = CompileConfiguration.builder().themeOverride("accent", "pink").build();
        CompileResult result = compile(configuration, "--- core/divider");
        assertTrue(result.html().contains("@layer preset {\n.mkly-document {\n  --mkly-accent: pink;\n}\n}"));
    }

    @Test
    void metaBecomesEscapedMetaTags() {
        CompileResult result = compile("--- use: core\n--- meta\ntitle: Hi & bye\n--- core/divider");
        assertTrue(result.html().contains("<meta name=\"mkly:use\" content=\"core\">"));
        assertTrue(result.html().contains("<meta name=\"mkly:title\" content=\"Hi &amp; bye\">"));
    }

    @Test
    void parseDiagnosticsComeFirst() {
        CompileResult result = compile("--- core/text\nHi\n--- meta\ntitle: late\n--- foo/bar");
        assertEquals(DiagnosticKind.ORDERING, result.diagnostics().get(0).kind());
        assertEquals(DiagnosticKind.CONTENT, result.diagnostics().get(1).kind());
    }
}
