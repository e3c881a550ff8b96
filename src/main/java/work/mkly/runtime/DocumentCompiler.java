package work.mkly.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mkly.api.CompileConfiguration;
import work.mkly.api.CompileResult;
import work.mkly.kit.AfterCompileHook;
import work.mkly.kit.BlockDefinition;
import work.mkly.kit.BlockRenderer;
import work.mkly.kit.Kit;
import work.mkly.kit.KitVersions;
import work.mkly.kit.OutputWrapper;
import work.mkly.kit.Plugin;
import work.mkly.kit.Preset;
import work.mkly.kit.Theme;
import work.mkly.parse.Block;
import work.mkly.parse.Comment;
import work.mkly.parse.Diagnostic;
import work.mkly.parse.DiagnosticKind;
import work.mkly.parse.Document;
import work.mkly.parse.StyleSection;
import work.mkly.style.LayeredCss;
import work.mkly.style.StyleCss;
import work.mkly.style.StyleGraph;
import work.mkly.style.StyleGraphParser;
import work.mkly.style.StyleWarning;

/**
 * Compiles a parsed {@link Document} to HTML and layered CSS: resolves kits, themes and presets,
 * gates the document version, cascades variables and renders the block tree depth first.
 */
public final class DocumentCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentCompiler.class);

    public static final int MAX_DEPTH = 50;
    public static final String CORE_KIT = "core";
    static final String INLINE_NAMESPACE = "inline/";
    static final String DEPTH_EXCEEDED = "<!-- mkly: max nesting depth exceeded -->";
    static final String DIAGNOSTIC_CSS = String.join("\n",
        ".mkly-error {",
        "  padding: 0.5rem 0.75rem;",
        "  margin: 0.25rem 0;",
        "  background: #fff0f0;",
        "  border-left: 0.1875rem solid #e53935;",
        "  color: #c62828;",
        "  font: 0.8125rem/1.4 monospace;",
        "}",
        ".mkly-unknown {",
        "  padding: 0.75rem;",
        "  margin: 0.25rem 0;",
        "  background: #fffde7;",
        "  border: 0.0625rem dashed #fbc02d;",
        "  font-size: 0.9em;",
        "  color: #795548;",
        "}"
    );
    private static final Pattern FIRST_ELEMENT = Pattern.compile("^(\\s*)<(\\w+)");

    private DocumentCompiler() {}

    public static CompileResult compile(Document document, CompileConfiguration configuration) {
        return new Run(configuration).compile(document);
    }

    /** Result of rendering one block: its HTML and its source-map entry. */
    private record Rendered(String html, SourceMapEntry entry) {}

    private static final class Run {
        private final CompileConfiguration configuration;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final BlockRegistry registry = new BlockRegistry();
        private final Map<String, BlockRenderer> overrides = new LinkedHashMap<>();
        private final List<Kit> activeKits = new ArrayList<>();
        private final List<String> usedKits = new ArrayList<>();
        private final Map<String, Theme> themes = new LinkedHashMap<>();
        private final Map<String, Preset> presets = new LinkedHashMap<>();
        private final List<UnaryOperator<Document>> transforms = new ArrayList<>();
        private final List<AfterCompileHook> hooks = new ArrayList<>();
        private final List<String> kitCss = new ArrayList<>();
        private final Map<String, String> keyframes = new LinkedHashMap<>();
        private final Map<String, String> kitVariables = new LinkedHashMap<>();
        private OutputWrapper wrapper = new WebOutputWrapper();
        private CompileContext context;

        Run(CompileConfiguration configuration) {
            this.configuration = configuration;
        }

        CompileResult compile(Document document) {
            if (document.hasFatal()) {
                return CompileResult.fatal(document.diagnostics(), document.version());
            }
            resolveKits(document);

            KitVersions versions = activeKits.stream()
                .filter(kit -> CORE_KIT.equals(kit.name()))
                .findFirst()
                .flatMap(Kit::versions)
                .orElse(KitVersions.DEFAULT);
            int version = document.versionDeclared() ? document.version() : versions.current();
            if (!versions.supports(version)) {
                String supported = versions.supported().stream().map(String::valueOf).collect(Collectors.joining(", "));
                List<Diagnostic> all = new ArrayList<>(document.diagnostics());
                all.addAll(diagnostics);
                all.add(Diagnostic.fatal(DiagnosticKind.VERSION, "Unsupported version: " + version + ". Supported: " + supported, 1));
                return CompileResult.fatal(all, version);
            }

            applyKits(version);
            applyPlugins();
            Document transformed = document;
            for (UnaryOperator<Document> transform : transforms) {
                transformed = transform.apply(transformed);
            }

            transformed.inlineThemes().forEach(theme -> themes.put(INLINE_NAMESPACE + theme.name(), theme));
            transformed.inlinePresets().forEach(preset -> presets.put(INLINE_NAMESPACE + preset.name(), preset));
            List<Theme> resolvedThemes = resolve(transformed.themes(), themes, "theme");
            List<Preset> resolvedPresets = resolve(transformed.presets(), presets, "preset");

            StyleGraph styleGraph = parseStyles(transformed.styleSections());
            Map<String, String> variables = new LinkedHashMap<>(kitVariables);
            resolvedThemes.forEach(theme -> variables.putAll(theme.variables()));
            variables.putAll(styleGraph.variableMap());
            variables.putAll(configuration.variables());
            context = new CompileContext(variables, styleGraph, version);

            List<SourceMapEntry> entries = new ArrayList<>();
            String content = renderDocument(transformed, entries);
            String css = layeredCss(styleGraph, resolvedThemes, resolvedPresets);

            var page = new OutputWrapper.Page(
                content,
                css,
                transformed.meta(),
                usedKits,
                activeNames(transformed.themes(), themes),
                activeNames(transformed.presets(), presets),
                transformed.styles(),
                transformed.inlineThemes(),
                transformed.inlinePresets(),
                configuration.maxWidth(),
                configuration.sourceMap()
            );
            String html = wrapper.wrap(page, context);

            List<Diagnostic> all = new ArrayList<>(transformed.diagnostics());
            all.addAll(diagnostics);
            all.addAll(context.diagnostics());
            var result = new CompileResult(
                html,
                all,
                configuration.sourceMap() ? Optional.of(entries) : Optional.empty(),
                styleGraph,
                version
            );
            for (AfterCompileHook hook : hooks) {
                result = hook.apply(result, context);
            }
            LOG.debug("Compiled document v{} with kits {}: {} blocks, {} diagnostics",
                version, activeKits.stream().map(Kit::name).collect(Collectors.toList()),
                transformed.blocks().size(), result.diagnostics().size());
            return result;
        }

        private void resolveKits(Document document) {
            Map<String, Kit> available = configuration.kits();
            Set<String> seen = new LinkedHashSet<>();
            for (String name : configuration.implicitKits()) {
                Kit kit = available.get(name);
                if (kit == null) {
                    LOG.debug("Implicit kit '{}' is not available", name);
                } else if (seen.add(name)) {
                    activeKits.add(kit);
                }
            }
            for (String name : document.uses()) {
                Kit kit = available.get(name);
                if (kit == null) {
                    String names = available.isEmpty() ? "none" : String.join(", ", available.keySet());
                    diagnostics.add(Diagnostic.warning(
                        DiagnosticKind.REFERENCE,
                        "Unknown kit \"" + name + "\": not available. Available kits: " + names,
                        1
                    ));
                    continue;
                }
                usedKits.add(name);
                if (seen.add(name)) {
                    activeKits.add(kit);
                }
            }
            LOG.debug("Active kits: {}", seen);
        }

        private void applyKits(int version) {
            for (Kit kit : activeKits) {
                for (BlockDefinition block : kit.blocks()) {
                    if (block.since() <= version) {
                        registry.register(block.qualified(kit.name()));
                    }
                }
                if (kit.styles() != null && !kit.styles().isBlank()) {
                    kitCss.add(kit.styles());
                }
                keyframes.putAll(kit.keyframes());
                kitVariables.putAll(kit.variables());
                for (Theme theme : kit.themes()) {
                    themes.put(kit.name() + "/" + theme.name(), theme);
                    themes.putIfAbsent(theme.name(), theme);
                }
                for (Preset preset : kit.presets()) {
                    presets.put(kit.name() + "/" + preset.name(), preset);
                    presets.putIfAbsent(preset.name(), preset);
                }
                kit.transform().ifPresent(transforms::add);
                kit.afterCompile().ifPresent(hooks::add);
            }
        }

        private void applyPlugins() {
            List<UnaryOperator<Document>> pluginTransforms = new ArrayList<>();
            List<AfterCompileHook> pluginHooks = new ArrayList<>();
            for (Plugin plugin : configuration.plugins()) {
                overrides.putAll(plugin.renderers());
                plugin.transform().ifPresent(pluginTransforms::add);
                plugin.afterCompile().ifPresent(pluginHooks::add);
                plugin.outputWrapper().ifPresent(custom -> wrapper = custom);
            }
            transforms.addAll(pluginTransforms);
            hooks.addAll(pluginHooks);
        }

        /**
         * Qualified names match exactly. Bare names match {@code kit/name} in every active kit and fall
         * back to the inline definition.
         */
        private <T> List<T> resolve(List<String> names, Map<String, T> known, String kind) {
            List<T> resolved = new ArrayList<>();
            for (String name : names) {
                if (name.contains("/")) {
                    T value = known.get(name);
                    if (value != null) {
                        resolved.add(value);
                    } else {
                        unknown(kind, name, "not found in any kit");
                    }
                    continue;
                }
                boolean found = false;
                for (Kit kit : activeKits) {
                    T value = known.get(kit.name() + "/" + name);
                    if (value != null) {
                        resolved.add(value);
                        found = true;
                    }
                }
                if (!found) {
                    T inline = known.get(INLINE_NAMESPACE + name);
                    if (inline != null) {
                        resolved.add(inline);
                        found = true;
                    }
                }
                if (!found) {
                    unknown(kind, name, "not found in any kit or inline definition");
                }
            }
            return resolved;
        }

        private void unknown(String kind, String name, String detail) {
            diagnostics.add(Diagnostic.warning(DiagnosticKind.REFERENCE, "Unknown " + kind + " \"" + name + "\": " + detail, 1));
        }

        private List<String> activeNames(List<String> declared, Map<String, ?> known) {
            return declared.stream()
                .filter(name -> known.containsKey(name) || known.containsKey(INLINE_NAMESPACE + name))
                .collect(Collectors.toList());
        }

        private StyleGraph parseStyles(List<StyleSection> sections) {
            List<StyleGraph> graphs = new ArrayList<>();
            for (StyleSection section : sections) {
                StyleGraph graph = StyleGraphParser.parse(section.source());
                for (StyleWarning warning : graph.warnings()) {
                    diagnostics.add(Diagnostic.warning(
                        DiagnosticKind.STYLE,
                        "Style: " + warning.message(),
                        section.line() + warning.line() - 1
                    ));
                }
                graphs.add(graph);
            }
            LOG.debug("Parsed {} style sections", sections.size());
            return graphs.isEmpty() ? StyleGraph.EMPTY : StyleGraph.merge(graphs);
        }

        private String renderDocument(Document document, List<SourceMapEntry> entries) {
            List<Comment> comments = new ArrayList<>(document.comments());
            comments.sort(Comparator.comparingInt(Comment::line));
            int next = 0;
            int offset = 0;
            List<String> parts = new ArrayList<>();
            for (Block block : document.blocks()) {
                while (next < comments.size() && comments.get(next).line() < block.range().startLine()) {
                    String comment = commentHtml(comments.get(next++));
                    parts.add(comment);
                    offset += comment.length() + 1;
                }
                Rendered rendered = render(block, 0, offset);
                entries.add(rendered.entry());
                parts.add(rendered.html());
                offset += rendered.html().length() + 1;
            }
            while (next < comments.size()) {
                parts.add(commentHtml(comments.get(next++)));
            }
            return String.join("\n", parts);
        }

        private Rendered render(Block block, int depth, int offset) {
            if (depth > MAX_DEPTH) {
                return new Rendered(DEPTH_EXCEEDED, entry(block, offset, DEPTH_EXCEEDED, List.of()));
            }
            String html;
            try {
                BlockRenderer override = overrides.get(block.blockType());
                html = override != null ? override.render(block, context) : registry.render(block, context);
                if (html == null) {
                    html = "";
                }
            } catch (Exception ex) {
                String message = "Failed to render \"" + block.blockType() + "\": "
                    + (ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
                LOG.debug(message, ex);
                context.error(block, message);
                html = Html.errorBox(message, block.range().startLine());
            }

            if (configuration.sourceMap()) {
                int line = block.range().startLine();
                html = FIRST_ELEMENT.matcher(html)
                    .replaceFirst("$1<$2 data-mkly-line=\"" + line + "\" data-mkly-id=\"" + block.blockType() + ":" + line + "\"");
            }

            int placeholder = html.indexOf(BlockDefinition.CHILDREN);
            List<SourceMapEntry> childEntries = new ArrayList<>();
            if (placeholder < 0) {
                if (block.hasChildren()) {
                    context.warn(block, "\"" + block.blockType() + "\" is not a container; nested blocks are not rendered");
                }
                return new Rendered(html, entry(block, offset, html, childEntries));
            }
            List<String> children = new ArrayList<>();
            int childOffset = offset + placeholder;
            for (Block child : block.children()) {
                Rendered rendered = render(child, depth + 1, childOffset);
                children.add(rendered.html());
                childEntries.add(rendered.entry());
                childOffset += rendered.html().length() + 1;
            }
            html = html.substring(0, placeholder)
                + String.join("\n", children)
                + html.substring(placeholder + BlockDefinition.CHILDREN.length());
            return new Rendered(html, entry(block, offset, html, childEntries));
        }

        private SourceMapEntry entry(Block block, int offset, String html, List<SourceMapEntry> children) {
            return new SourceMapEntry(
                block.range().startLine(),
                block.range().endLine(),
                block.blockType(),
                offset,
                html.length(),
                children
            );
        }

        private String layeredCss(StyleGraph styleGraph, List<Theme> resolvedThemes, List<Preset> resolvedPresets) {
            var css = new LayeredCss().diagnosticCss(DIAGNOSTIC_CSS).keyframes(keyframes);
            kitCss.forEach(css::kitCss);
            for (Theme theme : resolvedThemes) {
                css.themeCss(StyleCss.variablesToCss(theme.variables()));
                css.themeCss(theme.rawCss());
                css.themeCss(compileDsl(theme.css()));
            }
            for (Preset preset : resolvedPresets) {
                css.presetCss(preset.rawCss());
                css.presetCss(compileDsl(preset.css()));
                css.presetCss(preset.keyframes().entrySet().stream()
                    .map(frame -> "@keyframes " + frame.getKey() + "{" + frame.getValue() + "}")
                    .collect(Collectors.joining("\n")));
            }
            css.apiThemeCss(StyleCss.variablesToCss(configuration.themeOverrides()));
            css.blockCss(context.extraStyles());
            return css.compile(styleGraph);
        }

        private static String compileDsl(String source) {
            return source == null || source.isBlank() ? null : StyleCss.compile(StyleGraphParser.parse(source));
        }

        private static String commentHtml(Comment comment) {
            return "<!-- mkly-c: " + comment.content().replace("--", "\u2014") + " -->";
        }
    }
}
