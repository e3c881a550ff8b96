package work.mkly.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.mkly.support.MklyTestSupport.resource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.mkly.api.CompileConfiguration;

class MklyConfigTest {
    @Test
    void loadsFixture() {
        MklyConfig config = MklyConfig.load(resource("config", "mkly.toml"));
        assertEquals(720, config.maxWidth());
        assertTrue(config.sourceMap());
        assertEquals(Map.of("accent", "#0f766e", "gapScale", "1.25"), config.variables());
        assertEquals(
            List.of(resource("kits", "brand.toml").normalize(), resource("kits", "missing.toml").normalize()),
            config.kitPaths()
        );
    }

    @Test
    void applyToLoadsReadableKitsOnly() {
        CompileConfiguration configuration = MklyConfig.load(resource("config", "mkly.toml"))
            .applyTo(CompileConfiguration.builder())
            .build();
        assertEquals(List.of("core", "brand"), List.copyOf(configuration.kits().keySet()));
        assertEquals(720, configuration.maxWidth());
        assertTrue(configuration.sourceMap());
        assertEquals("#0f766e", configuration.variables().get("accent"));
    }

    @Test
    void applyToSkipsKitWithMistypedVersions() {
        MklyConfig config = MklyConfig.parse(
            "[kits]\npaths = [\"bad-versions.toml\", \"brand.toml\"]\n",
            resource("kits"),
            "inline.toml"
        );
        CompileConfiguration configuration = config.applyTo(CompileConfiguration.builder()).build();
        assertEquals(List.of("core", "brand"), List.copyOf(configuration.kits().keySet()));
    }

    @Test
    void missingFileMeansDefaults() {
        assertEquals(MklyConfig.defaults(), MklyConfig.load(resource("config", "absent.toml")));
        assertEquals(MklyConfig.defaults(), MklyConfig.load(null));
    }

    @Test
    void malformedFileIsRejected() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> MklyConfig.parse("[compile\nmax_width = 1", Path.of("."), "inline.toml"));
        assertTrue(ex.getMessage().startsWith("Invalid inline.toml: "));
    }

    @Test
    void ignoresNonPositiveWidthAndUnsupportedValues() {
        MklyConfig config = MklyConfig.parse(
            "[compile]\nmax_width = -5\n[variables]\nflag = true\nlist = [1, 2]\n",
            Path.of("/base"),
            "inline.toml"
        );
        assertEquals(CompileConfiguration.DEFAULT_MAX_WIDTH, config.maxWidth());
        assertFalse(config.sourceMap());
        assertEquals(Map.of("flag", "true"), config.variables());
        assertTrue(config.kitPaths().isEmpty());
    }
}
