package work.mkly.kit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads data-only kits from TOML manifests.
 *
 * <pre>
 * name = "brand"
 * styles = ".mkly-brand-banner { padding: 1rem; }"
 * [versions]
 * supported = [1]
 * current = 1
 * [variables]
 * accent = "#e2725b"
 * [keyframes]
 * fade = "0%{opacity:0}100%{opacity:1}"
 * [[themes]]
 * name = "sunset"
 * [themes.variables]
 * bg = "#fff7f0"
 * [[presets]]
 * name = "soft"
 * css = "..."
 * </pre>
 */
public final class KitManifestLoader {
    private static final Logger LOG = LoggerFactory.getLogger(KitManifestLoader.class);

    private KitManifestLoader() {}

    public static Kit load(Path manifest) {
        if (manifest == null || !Files.isRegularFile(manifest)) {
            throw new KitManifestException(manifest, "kit manifest not found");
        }
        try {
            return parse(Files.readString(manifest, StandardCharsets.UTF_8), manifest);
        } catch (IOException ex) {
            throw new KitManifestException(manifest, "unable to read kit manifest: " + ex.getMessage(), ex);
        }
    }

    /** Loads a manifest bundled on the classpath. */
    public static Kit loadResource(String resource) {
        Path origin = Path.of(resource);
        try (InputStream stream = KitManifestLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (stream == null) {
                throw new KitManifestException(origin, "kit manifest resource missing");
            }
            return parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8), origin);
        } catch (IOException ex) {
            throw new KitManifestException(origin, "unable to read kit manifest: " + ex.getMessage(), ex);
        }
    }

    static Kit parse(String content, Path origin) {
        TomlParseResult toml = Toml.parse(content);
        if (toml.hasErrors()) {
            throw new KitManifestException(origin, toml.errors().get(0).toString());
        }
        Kit kit = fromToml(toml, origin);
        LOG.debug("Loaded kit '{}' from {} ({} themes, {} presets)", kit.name(), origin, kit.themes().size(), kit.presets().size());
        return kit;
    }

    public static Kit fromToml(TomlTable toml, Path origin) {
        try {
            return readKit(toml, origin);
        } catch (TomlInvalidTypeException ex) {
            throw new KitManifestException(origin, ex.getMessage(), ex);
        }
    }

    private static Kit readKit(TomlTable toml, Path origin) {
        String name = toml.getString("name");
        if (name == null || name.isBlank()) {
            throw new KitManifestException(origin, "kit manifest requires a name");
        }
        var builder = Kit.builder(name.trim())
            .displayName(toml.getString("display_name"))
            .description(toml.getString("description"))
            .styles(toml.getString("styles"))
            .defaultTheme(toml.getString("default_theme"))
            .defaultPreset(toml.getString("default_preset"));

        TomlTable versions = toml.getTable("versions");
        if (versions != null) {
            builder.versions(readVersions(versions, origin));
        }
        readStrings(toml.getTable("keyframes")).forEach(builder::keyframe);
        readStrings(toml.getTable("variables")).forEach(builder::variable);
        for (TomlTable table : tables(toml.getArray("themes"), origin, "themes")) {
            builder.theme(new Theme(
                required(table, "name", origin, "theme"),
                table.getString("display_name"),
                table.getString("description"),
                readStrings(table.getTable("variables")),
                table.getString("raw_css"),
                table.getString("css")
            ));
        }
        for (TomlTable table : tables(toml.getArray("presets"), origin, "presets")) {
            builder.preset(new Preset(
                required(table, "name", origin, "preset"),
                table.getString("display_name"),
                table.getString("description"),
                table.getString("default_theme"),
                table.getString("css"),
                table.getString("raw_css"),
                readStrings(table.getTable("keyframes"))
            ));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new KitManifestException(origin, ex.getMessage(), ex);
        }
    }

    private static KitVersions readVersions(TomlTable table, Path origin) {
        if (table.get(List.of("current")) == null) {
            throw new KitManifestException(origin, "[versions] requires 'current'");
        }
        int current = version(table.get(List.of("current")), origin, "versions.current");
        List<Integer> supported = new ArrayList<>();
        Object raw = table.get(List.of("supported"));
        if (raw != null && !(raw instanceof TomlArray)) {
            throw new KitManifestException(origin, "'versions.supported' must be an array of integers");
        }
        if (raw instanceof TomlArray array) {
            for (int i = 0; i < array.size(); i++) {
                supported.add(version(array.get(i), origin, "versions.supported[" + i + "]"));
            }
        }
        return new KitVersions(supported, current);
    }

    private static int version(Object value, Path origin, String key) {
        if (!(value instanceof Long number)) {
            throw new KitManifestException(origin, "'" + key + "' must be an integer, got " + value);
        }
        if (number < 1 || number > Integer.MAX_VALUE) {
            throw new KitManifestException(origin, "'" + key + "' is out of range: " + number);
        }
        return number.intValue();
    }

    private static List<TomlTable> tables(TomlArray array, Path origin, String key) {
        if (array == null) {
            return List.of();
        }
        if (!array.isEmpty() && !array.containsTables()) {
            throw new KitManifestException(origin, "'" + key + "' must be an array of tables");
        }
        List<TomlTable> tables = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            tables.add(array.getTable(i));
        }
        return tables;
    }

    private static String required(TomlTable table, String key, Path origin, String kind) {
        String value = table.getString(key);
        if (value == null || value.isBlank()) {
            throw new KitManifestException(origin, kind + " entry requires '" + key + "'");
        }
        return value.trim();
    }

    private static Map<String, String> readStrings(TomlTable table) {
        if (table == null || table.isEmpty()) {
            return Map.of();
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            // single-segment path: keys may contain dots
            if (table.get(List.of(key)) instanceof String value) {
                values.put(key, value);
            }
        }
        return values;
    }
}
