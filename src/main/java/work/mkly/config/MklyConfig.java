package work.mkly.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.mkly.api.CompileConfiguration;
import work.mkly.kit.KitManifestException;
import work.mkly.kit.KitManifestLoader;

/**
 * Project settings read from {@code mkly.toml}.
 *
 * <pre>
 * [compile]
 * max_width = 640
 * source_map = false
 * [variables]
 * accent = "#e2725b"
 * [kits]
 * paths = ["kits/brand.toml"]
 * </pre>
 *
 * @param maxWidth  page width for the default wrapper
 * @param sourceMap whether source maps are on unless the command line says otherwise
 * @param variables caller variables applied to every document
 * @param kitPaths  kit manifests, resolved against the directory of the config file
 */
public record MklyConfig(int maxWidth, boolean sourceMap, Map<String, String> variables, List<Path> kitPaths) {
    private static final Logger LOG = LoggerFactory.getLogger(MklyConfig.class);
    public static final String FILE_NAME = "mkly.toml";

    public MklyConfig {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        kitPaths = List.copyOf(kitPaths);
    }

    public static MklyConfig defaults() {
        return new MklyConfig(CompileConfiguration.DEFAULT_MAX_WIDTH, false, Map.of(), List.of());
    }

    /** Missing file yields the defaults; a malformed one is rejected. */
    public static MklyConfig load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return defaults();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read " + file + ": " + ex.getMessage(), ex);
        }
        Path base = file.toAbsolutePath().getParent();
        return parse(content, base != null ? base : Path.of("").toAbsolutePath(), file.toString());
    }

    static MklyConfig parse(String content, Path baseDirectory, String origin) {
        TomlParseResult toml = Toml.parse(content);
        if (toml.hasErrors()) {
            throw new IllegalArgumentException("Invalid " + origin + ": " + toml.errors().get(0));
        }
        int maxWidth = CompileConfiguration.DEFAULT_MAX_WIDTH;
        boolean sourceMap = false;
        TomlTable compile = toml.getTable("compile");
        if (compile != null) {
            Long width = compile.getLong("max_width");
            if (width != null && width > 0 && width <= Integer.MAX_VALUE) {
                maxWidth = width.intValue();
            }
            sourceMap = Boolean.TRUE.equals(compile.getBoolean("source_map"));
        }

        Map<String, String> variables = new LinkedHashMap<>();
        TomlTable vars = toml.getTable("variables");
        if (vars != null) {
            for (String key : vars.keySet()) {
                Object value = vars.get(List.of(key));
                if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                    variables.put(key, String.valueOf(value));
                }
            }
        }

        List<Path> kitPaths = new ArrayList<>();
        TomlArray paths = toml.getArray("kits.paths");
        if (paths != null) {
            for (int i = 0; i < paths.size(); i++) {
                if (paths.get(i) instanceof String path && !path.isBlank()) {
                    kitPaths.add(baseDirectory.resolve(path).normalize());
                }
            }
        }
        return new MklyConfig(maxWidth, sourceMap, variables, kitPaths);
    }

    /** Copies these settings onto a compile configuration, loading every readable kit manifest. */
    public CompileConfiguration.Builder applyTo(CompileConfiguration.Builder builder) {
        builder.maxWidth(maxWidth).variables(variables);
        if (sourceMap) {
            builder.sourceMap(true);
        }
        for (Path path : kitPaths) {
            try {
                builder.kit(KitManifestLoader.load(path));
            } catch (KitManifestException ex) {
                LOG.warn("Skipping kit: {}", ex.getMessage());
            }
        }
        return builder;
    }
}
