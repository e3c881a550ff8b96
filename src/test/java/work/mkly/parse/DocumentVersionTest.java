package work.mkly.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentVersionTest {
    @Test
    void absentVersionIsDefault() {
        var resolution = DocumentVersion.resolve(Map.of());
        assertEquals(1, resolution.version());
        assertFalse(resolution.declared());
        assertTrue(resolution.error().isEmpty());
    }

    @Test
    void numericVersionIsTakenAsIs() {
        var resolution = DocumentVersion.resolve(Map.of("version", " 7 "));
        assertEquals(7, resolution.version());
        assertTrue(resolution.declared());
    }

    @Test
    void nonNumericVersionReportsError() {
        var resolution = DocumentVersion.resolve(Map.of("version", "1.5"));
        assertEquals(1, resolution.version());
        assertEquals("Invalid version: \"1.5\"", resolution.error().orElseThrow());
    }
}
