package work.mkly.style;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link StyleGraph} back to the indented style syntax.
 *
 * <p>Output is canonical: variables first, then one section per block type and label holding the
 * {@code self} properties followed by each sub-target, then raw selectors. Rules sharing a key are
 * merged, so {@code parse(serialize(g))} reproduces the rule keys and properties of {@code g}.
 */
public final class StyleGraphSerializer {
    private StyleGraphSerializer() {}

    public static String serialize(StyleGraph graph) {
        List<String> lines = new ArrayList<>();
        for (StyleVariable variable : graph.variables()) {
            lines.add(variable.name() + ": " + variable.value());
        }

        Map<String, List<StyleRule>> groups = new LinkedHashMap<>();
        List<StyleRule> raw = new ArrayList<>();
        for (StyleRule rule : graph.rules()) {
            if (rule.isRaw()) {
                StyleGraph.mergeInto(raw, rule);
                continue;
            }
            String header = rule.label() != null ? rule.blockType() + ":" + rule.label() : rule.blockType();
            StyleGraph.mergeInto(groups.computeIfAbsent(header, key -> new ArrayList<>()), rule);
        }

        groups.forEach((header, rules) -> {
            separate(lines);
            lines.add(header);
            rules.stream()
                .filter(rule -> StyleRule.SELF.equals(rule.target()))
                .forEach(rule -> properties(lines, rule, "  "));
            for (StyleRule rule : rules) {
                if (StyleRule.SELF.equals(rule.target())) {
                    continue;
                }
                lines.add("  " + targetLine(rule.target()));
                properties(lines, rule, "    ");
            }
        });

        for (StyleRule rule : raw) {
            separate(lines);
            lines.add(rule.target());
            properties(lines, rule, "  ");
        }
        return String.join("\n", lines);
    }

    /** Sub-target header for a non-self target. */
    static String targetLine(String target) {
        if (target.startsWith("self:")) {
            return target.substring(4);
        }
        if (target.startsWith(">")) {
            return target;
        }
        return "." + target;
    }

    private static void separate(List<String> lines) {
        if (!lines.isEmpty()) {
            lines.add("");
        }
    }

    private static void properties(List<String> lines, StyleRule rule, String indent) {
        rule.properties().forEach((key, value) -> lines.add(indent + key + ": " + value));
    }
}
