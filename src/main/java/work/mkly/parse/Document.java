package work.mkly.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import work.mkly.kit.Preset;
import work.mkly.kit.Theme;

/**
 * Parsed mkly source. Produced once by {@link DocumentParser}; transforms return new instances.
 *
 * @param version         declared version, or {@link DocumentVersion#DEFAULT} when absent or invalid
 * @param versionDeclared whether {@code meta} carried a numeric {@code version}
 * @param blocks          top-level blocks in source order
 * @param meta            {@code --- meta} properties
 * @param styleSections   raw text of each {@code --- style} section
 * @param uses            kit names from {@code --- use}
 * @param themes          theme names from {@code --- theme}
 * @param presets         preset names from {@code --- preset}
 * @param inlineThemes    {@code --- define-theme} definitions
 * @param inlinePresets   {@code --- define-preset} definitions
 * @param comments        comments outside style sections
 * @param diagnostics     parse-time problems
 */
public record Document(
    int version,
    boolean versionDeclared,
    List<Block> blocks,
    Map<String, String> meta,
    List<StyleSection> styleSections,
    List<String> uses,
    List<String> themes,
    List<String> presets,
    List<Theme> inlineThemes,
    List<Preset> inlinePresets,
    List<Comment> comments,
    List<Diagnostic> diagnostics
) {
    public Document {
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        styleSections = styleSections == null ? List.of() : List.copyOf(styleSections);
        uses = uses == null ? List.of() : List.copyOf(uses);
        themes = themes == null ? List.of() : List.copyOf(themes);
        presets = presets == null ? List.of() : List.copyOf(presets);
        inlineThemes = inlineThemes == null ? List.of() : List.copyOf(inlineThemes);
        inlinePresets = inlinePresets == null ? List.of() : List.copyOf(inlinePresets);
        comments = comments == null ? List.of() : List.copyOf(comments);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /** Raw style section texts without line information. */
    public List<String> styles() {
        return styleSections.stream().map(StyleSection::source).collect(Collectors.toList());
    }

    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::fatal);
    }

    public Document withBlocks(List<Block> newBlocks) {
        return toBuilder().blocks(newBlocks).build();
    }

    public Document withDiagnostic(Diagnostic diagnostic) {
        return toBuilder().diagnostic(diagnostic).build();
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.version = version;
        builder.versionDeclared = versionDeclared;
        builder.blocks.addAll(blocks);
        builder.meta.putAll(meta);
        builder.styleSections.addAll(styleSections);
        builder.uses.addAll(uses);
        builder.themes.addAll(themes);
        builder.presets.addAll(presets);
        builder.inlineThemes.addAll(inlineThemes);
        builder.inlinePresets.addAll(inlinePresets);
        builder.comments.addAll(comments);
        builder.diagnostics.addAll(diagnostics);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int version = DocumentVersion.DEFAULT;
        private boolean versionDeclared;
        private final List<Block> blocks = new ArrayList<>();
        private final Map<String, String> meta = new LinkedHashMap<>();
        private final List<StyleSection> styleSections = new ArrayList<>();
        private final List<String> uses = new ArrayList<>();
        private final List<String> themes = new ArrayList<>();
        private final List<String> presets = new ArrayList<>();
        private final List<Theme> inlineThemes = new ArrayList<>();
        private final List<Preset> inlinePresets = new ArrayList<>();
        private final List<Comment> comments = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private Builder() {}

        public Builder version(int value, boolean declared) {
            this.version = value;
            this.versionDeclared = declared;
            return this;
        }

        public Builder blocks(List<Block> values) {
            blocks.clear();
            blocks.addAll(values);
            return this;
        }

        public Builder block(Block block) {
            blocks.add(block);
            return this;
        }

        public Builder meta(String key, String value) {
            meta.put(key, value);
            return this;
        }

        public Builder styleSection(StyleSection section) {
            styleSections.add(section);
            return this;
        }

        public Builder use(String name) {
            uses.add(name);
            return this;
        }

        public Builder theme(String name) {
            themes.add(name);
            return this;
        }

        public Builder preset(String name) {
            presets.add(name);
            return this;
        }

        public Builder inlineTheme(Theme theme) {
            inlineThemes.add(theme);
            return this;
        }

        public Builder inlinePreset(Preset preset) {
            inlinePresets.add(preset);
            return this;
        }

        public Builder comment(Comment comment) {
            comments.add(comment);
            return this;
        }

        public Builder diagnostic(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
            return this;
        }

        Map<String, String> meta() {
            return meta;
        }

        public Document build() {
            return new Document(
                version,
                versionDeclared,
                blocks,
                meta,
                styleSections,
                uses,
                themes,
                presets,
                inlineThemes,
                inlinePresets,
                comments,
                diagnostics
            );
        }
    }
}
