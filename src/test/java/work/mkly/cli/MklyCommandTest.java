package work.mkly.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.mkly.support.MklyTestSupport.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.mkly.core.CoreKit;

class MklyCommandTest {
    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        return Main.commandLine()
            .setOut(new PrintWriter(out))
            .setErr(new PrintWriter(err))
            .execute(args);
    }

    private Path source(String text) throws Exception {
        Path file = tempDir.resolve("doc.mkly");
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void versionListsSupportedDocumentVersions() {
        assertEquals(0, run("--version"));
        String printed = out.toString();
        assertTrue(printed.startsWith("mkly "), printed);
        assertTrue(printed.contains("document versions: 1 (current 1)"), printed);
        assertTrue(printed.contains("core kit: " + CoreKit.kit().blocks().size() + " blocks"), printed);
    }

    @Test
    void printsHtmlToStdout() throws Exception {
        int code = run(source("--- core/text\nHello").toString());
        assertEquals(0, code);
        assertTrue(out.toString().contains("<div class=\"mkly-core-text\"><p>Hello</p></div>"));
        assertEquals("", err.toString());
    }

    @Test
    void writesOutputFile() throws Exception {
        Path target = tempDir.resolve("out/page.html");
        int code = run(source("--- core/divider").toString(), "-o", target.toString());
        assertEquals(0, code);
        assertTrue(Files.readString(target).contains("<hr class=\"mkly-core-divider\">"));
        assertEquals("", out.toString());
    }

    @Test
    void errorsSetExitCodeAndGoToStderr() throws Exception {
        int code = run(source("--- core/image\nalt: x").toString());
        assertEquals(1, code);
        assertTrue(err.toString().contains("line 1: error: Missing required property \"src\""));
    }

    @Test
    void jsonOutputWithVariablesAndSourceMap() throws Exception {
        Path kit = tempDir.resolve("lab.toml");
        Files.writeString(kit, "name = \"lab\"\n");
        int code = run(
            source("--- use: lab\n--- core/text\nHi").toString(),
            "--json", "--source-map", "--kit", kit.toString(), "--var", "accent=#111111"
        );
        assertEquals(0, code);
        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertTrue(root.get("html").asText().contains("<meta name=\"mkly:use\" content=\"lab\">"));
        assertTrue(root.get("html").asText().contains("data-mkly-line=\"2\""));
        assertEquals("core/text", root.get("sourceMap").get(0).get("blockType").asText());
    }

    @Test
    void configFileIsApplied() throws Exception {
        int code = run(source("--- core/divider").toString(), "--config", resource("config", "mkly.toml").toString());
        assertEquals(0, code);
        assertTrue(out.toString().contains("max-width:720px"));
        assertTrue(out.toString().contains("data-mkly-line=\"1\""));
    }

    @Test
    void missingSourceIsUsageError() {
        int code = run(tempDir.resolve("nope.mkly").toString());
        assertEquals(2, code);
        assertTrue(err.toString().contains("Source file not found"));
    }

    @Test
    void brokenKitFailsShortly() throws Exception {
        int code = run(source("--- core/divider").toString(), "--kit", resource("kits", "broken.toml").toString());
        assertEquals(1, code);
        assertTrue(err.toString().contains("broken.toml"));
    }
}
