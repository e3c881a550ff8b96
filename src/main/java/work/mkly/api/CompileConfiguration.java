package work.mkly.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.mkly.core.CoreKit;
import work.mkly.kit.Kit;
import work.mkly.kit.Plugin;

/**
 * Immutable configuration of a compile call.
 *
 * @param kits           kits a document may activate, by name
 * @param plugins        plugins applied in order
 * @param variables      caller variables, overriding everything from the document
 * @param themeOverrides variables emitted as custom properties in the preset layer
 * @param maxWidth       page width in pixels for the default output wrapper
 * @param sourceMap      record block positions and annotate rendered elements
 * @param implicitKits   kits active without a {@code --- use} declaration
 */
public record CompileConfiguration(
    Map<String, Kit> kits,
    List<Plugin> plugins,
    Map<String, String> variables,
    Map<String, String> themeOverrides,
    int maxWidth,
    boolean sourceMap,
    List<String> implicitKits
) {
    public static final int DEFAULT_MAX_WIDTH = 600;

    public CompileConfiguration {
        kits = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(kits, "kits")));
        plugins = List.copyOf(Objects.requireNonNull(plugins, "plugins"));
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(variables, "variables")));
        themeOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(themeOverrides, "themeOverrides")));
        implicitKits = List.copyOf(Objects.requireNonNull(implicitKits, "implicitKits"));
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
        }
    }

    public static CompileConfiguration defaults() {
        return builder().build();
    }

    /** Builder pre-loaded with the built-in core kit. */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.kits.clear();
        builder.kits.putAll(kits);
        builder.plugins.addAll(plugins);
        builder.variables.putAll(variables);
        builder.themeOverrides.putAll(themeOverrides);
        builder.maxWidth = maxWidth;
        builder.sourceMap = sourceMap;
        builder.implicitKits = implicitKits;
        return builder;
    }

    public static final class Builder {
        private final Map<String, Kit> kits = new LinkedHashMap<>();
        private final List<Plugin> plugins = new ArrayList<>();
        private final Map<String, String> variables = new LinkedHashMap<>();
        private final Map<String, String> themeOverrides = new LinkedHashMap<>();
        private int maxWidth = DEFAULT_MAX_WIDTH;
        private boolean sourceMap;
        private List<String> implicitKits = List.of(CoreKit.NAME);

        private Builder() {
            Kit core = CoreKit.kit();
            kits.put(core.name(), core);
        }

        /** Makes a kit available; a kit with the same name is replaced. */
        public Builder kit(Kit kit) {
            kits.put(kit.name(), kit);
            return this;
        }

        public Builder plugin(Plugin plugin) {
            plugins.add(plugin);
            return this;
        }

        public Builder variable(String key, String value) {
            variables.put(key, value);
            return this;
        }

        public Builder variables(Map<String, String> values) {
            variables.putAll(values);
            return this;
        }

        public Builder themeOverride(String key, String value) {
            themeOverrides.put(key, value);
            return this;
        }

        public Builder maxWidth(int maxWidth) {
            this.maxWidth = maxWidth;
            return this;
        }

        public Builder sourceMap(boolean sourceMap) {
            this.sourceMap = sourceMap;
            return this;
        }

        public Builder implicitKits(List<String> implicitKits) {
            this.implicitKits = implicitKits;
            return this;
        }

        public CompileConfiguration build() {
            return new CompileConfiguration(kits, plugins, variables, themeOverrides, maxWidth, sourceMap, implicitKits);
        }
    }
}
