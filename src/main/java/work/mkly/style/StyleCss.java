package work.mkly.style;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a {@link StyleGraph} into the CSS of the {@code user} layer.
 */
public final class StyleCss {
    /** Built-in variables and their custom properties. */
    public static final Map<String, String> VARIABLE_TO_CSS;

    static {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("accent", "--mkly-accent");
        map.put("accentHover", "--mkly-accent-hover");
        map.put("bg", "--mkly-bg");
        map.put("text", "--mkly-text");
        map.put("muted", "--mkly-muted");
        map.put("border", "--mkly-border");
        map.put("textAlign", "--mkly-text-align");
        map.put("fontSize", "--mkly-font-size");
        map.put("lineHeight", "--mkly-line-height");
        map.put("fontBody", "--mkly-font-body");
        map.put("fontHeading", "--mkly-font-heading");
        map.put("fontMono", "--mkly-font-mono");
        map.put("radius", "--mkly-radius");
        map.put("spacing", "--mkly-spacing");
        map.put("bgSubtle", "--mkly-bg-subtle");
        map.put("gapScale", "--mkly-gap-scale");
        map.put("lineHeightScale", "--mkly-line-height-scale");
        VARIABLE_TO_CSS = Collections.unmodifiableMap(map);
    }

    private static final Map<String, String> ALIASES = Map.of(
        "bg", "background",
        "fg", "color",
        "rounded", "border-radius"
    );

    /** Properties that inherit into text children of a sub-element. */
    private static final Set<String> INHERITED = Set.of(
        "color", "font-family", "font-size", "font-weight", "font-style",
        "line-height", "letter-spacing", "text-align", "text-transform",
        "text-indent", "word-spacing"
    );
    private static final String TEXT_TAGS = ":is(p, li, h1, h2, h3, h4, h5, h6, blockquote)";
    private static final Pattern VARIABLE_REF = Pattern.compile("\\$(\\w+)");
    private static final Pattern UPPER = Pattern.compile("[A-Z]");

    private StyleCss() {}

    public static String toKebab(String value) {
        Matcher matcher = UPPER.matcher(value);
        var out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, "-" + matcher.group().toLowerCase(Locale.ROOT));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /** Property key as stored in rules: kebab-case unless it already contains a dash. */
    public static String normalizeKey(String key) {
        return key.contains("-") ? key : toKebab(key);
    }

    /** CSS property for a rule key, applying the short aliases. */
    public static String cssProperty(String key) {
        String alias = ALIASES.get(key);
        return alias != null ? alias : normalizeKey(key);
    }

    public static String variableName(String name) {
        String known = VARIABLE_TO_CSS.get(name);
        return known != null ? known : "--mkly-" + toKebab(name);
    }

    public static String blockClass(String blockType) {
        return "mkly-" + blockType.replace('/', '-');
    }

    /** Replaces {@code $name} with {@code var(--mkly-...)} and neutralises {@code </}. */
    public static String resolveValue(String value) {
        Matcher matcher = VARIABLE_REF.matcher(value);
        var out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement("var(" + variableName(matcher.group(1)) + ")"));
        }
        matcher.appendTail(out);
        return escapeClosingTag(out.toString());
    }

    static String escapeClosingTag(String value) {
        return value.replace("</", "<\\/");
    }

    /**
     * Concrete selector for a rule target.
     *
     * <pre>
     * ("self", "core/card", null)      .mkly-core-card
     * ("self:hover", "core/card", "a") .mkly-core-card--a:hover
     * ("img", "core/card", null)       .mkly-core-card__img
     * (">p", "core/card", null)        .mkly-core-card p
     * </pre>
     */
    public static String resolveSelector(String target, String blockType, String label) {
        String base = "." + blockClass(blockType) + (label != null ? "--" + label : "");
        if (StyleRule.SELF.equals(target)) {
            return base;
        }
        if (target.startsWith("self:")) {
            return base + target.substring(4);
        }
        if (target.startsWith(">")) {
            return base + " " + target.substring(1);
        }
        int colon = target.indexOf(':');
        if (colon >= 0) {
            return base + "__" + target.substring(0, colon) + target.substring(colon);
        }
        return base + "__" + target;
    }

    /** {@code .mkly-document} rule declaring the given variables as custom properties. */
    public static String variablesToCss(Map<String, String> variables) {
        List<String> lines = new ArrayList<>();
        variables.forEach((name, value) -> {
            if (value != null && !value.isEmpty()) {
                lines.add("  " + variableName(name) + ": " + escapeClosingTag(value) + ";");
            }
        });
        return lines.isEmpty() ? "" : ".mkly-document {\n" + String.join("\n", lines) + "\n}";
    }

    public static String compile(StyleGraph graph) {
        List<String> blocks = new ArrayList<>();
        if (!graph.variables().isEmpty()) {
            List<String> lines = new ArrayList<>();
            for (StyleVariable variable : graph.variables()) {
                String known = VARIABLE_TO_CSS.get(variable.name());
                if (known != null) {
                    lines.add("  " + known + ": " + escapeClosingTag(variable.value()) + ";");
                } else {
                    lines.add("  " + cssProperty(variable.name()) + ": " + resolveValue(variable.value()) + ";");
                }
            }
            blocks.add(".mkly-document {\n" + String.join("\n", lines) + "\n}");
        }

        for (StyleRule rule : graph.rules()) {
            String declarations = declarations(rule.properties(), false);
            if (declarations.isEmpty()) {
                continue;
            }
            if (rule.isRaw()) {
                blocks.add(rule.target() + " {\n" + declarations + "\n}");
                continue;
            }
            String selector = resolveSelector(rule.target(), rule.blockType(), rule.label());
            blocks.add(selector + " {\n" + declarations + "\n}");

            boolean subElement = !StyleRule.SELF.equals(rule.target()) && !rule.target().startsWith("self:");
            if (subElement && !rule.target().startsWith(">")) {
                String inherited = declarations(rule.properties(), true);
                if (!inherited.isEmpty()) {
                    blocks.add(selector + " " + TEXT_TAGS + " {\n" + inherited + "\n}");
                }
            }
        }
        return String.join("\n\n", blocks);
    }

    private static String declarations(Map<String, String> properties, boolean inheritedOnly) {
        List<String> lines = new ArrayList<>();
        properties.forEach((key, value) -> {
            String property = cssProperty(key);
            if (!inheritedOnly || INHERITED.contains(property)) {
                lines.add("  " + property + ": " + resolveValue(value) + ";");
            }
        });
        return String.join("\n", lines);
    }
}
