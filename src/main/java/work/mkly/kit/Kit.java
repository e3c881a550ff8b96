package work.mkly.kit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import work.mkly.parse.Document;

/**
 * Namespace of block types, styles, themes and presets activated with {@code --- use: name}.
 */
public record Kit(
    String name,
    String displayName,
    String description,
    Optional<KitVersions> versions,
    List<BlockDefinition> blocks,
    String styles,
    Map<String, String> keyframes,
    Map<String, String> variables,
    List<Theme> themes,
    String defaultTheme,
    List<Preset> presets,
    String defaultPreset,
    Optional<UnaryOperator<Document>> transform,
    Optional<AfterCompileHook> afterCompile
) {
    public Kit {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(versions, "versions");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(afterCompile, "afterCompile");
        if (name.isBlank() || name.contains("/")) {
            throw new IllegalArgumentException("Invalid kit name: " + name);
        }
        blocks = List.copyOf(blocks);
        keyframes = Collections.unmodifiableMap(new LinkedHashMap<>(keyframes));
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        themes = List.copyOf(themes);
        presets = List.copyOf(presets);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        var builder = new Builder(name)
            .displayName(displayName)
            .description(description)
            .styles(styles)
            .defaultTheme(defaultTheme)
            .defaultPreset(defaultPreset);
        versions.ifPresent(builder::versions);
        blocks.forEach(builder::block);
        builder.keyframes.putAll(keyframes);
        builder.variables.putAll(variables);
        themes.forEach(builder::theme);
        presets.forEach(builder::preset);
        transform.ifPresent(builder::transform);
        afterCompile.ifPresent(builder::afterCompile);
        return builder;
    }

    public static final class Builder {
        private final String name;
        private String displayName;
        private String description;
        private KitVersions versions;
        private final List<BlockDefinition> blocks = new ArrayList<>();
        private String styles;
        private final Map<String, String> keyframes = new LinkedHashMap<>();
        private final Map<String, String> variables = new LinkedHashMap<>();
        private final List<Theme> themes = new ArrayList<>();
        private String defaultTheme;
        private final List<Preset> presets = new ArrayList<>();
        private String defaultPreset;
        private UnaryOperator<Document> transform;
        private AfterCompileHook afterCompile;

        private Builder(String name) {
            this.name = name;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder versions(KitVersions versions) {
            this.versions = versions;
            return this;
        }

        public Builder block(BlockDefinition block) {
            blocks.add(block);
            return this;
        }

        public Builder styles(String styles) {
            this.styles = styles;
            return this;
        }

        public Builder keyframe(String animation, String body) {
            keyframes.put(animation, body);
            return this;
        }

        public Builder variable(String key, String value) {
            variables.put(key, value);
            return this;
        }

        public Builder theme(Theme theme) {
            themes.add(theme);
            return this;
        }

        public Builder defaultTheme(String defaultTheme) {
            this.defaultTheme = defaultTheme;
            return this;
        }

        public Builder preset(Preset preset) {
            presets.add(preset);
            return this;
        }

        public Builder defaultPreset(String defaultPreset) {
            this.defaultPreset = defaultPreset;
            return this;
        }

        public Builder transform(UnaryOperator<Document> transform) {
            this.transform = transform;
            return this;
        }

        public Builder afterCompile(AfterCompileHook afterCompile) {
            this.afterCompile = afterCompile;
            return this;
        }

        public Kit build() {
            return new Kit(
                name,
                displayName,
                description,
                Optional.ofNullable(versions),
                blocks,
                styles,
                keyframes,
                variables,
                themes,
                defaultTheme,
                presets,
                defaultPreset,
                Optional.ofNullable(transform),
                Optional.ofNullable(afterCompile)
            );
        }
    }
}
