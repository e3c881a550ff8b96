package work.mkly.style;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves style values to literals for mail clients without custom-property support.
 */
public final class EmailStyles {
    private static final Pattern VARIABLE_REF = Pattern.compile("\\$(\\w+)");
    private static final Pattern VAR_CALL = Pattern.compile("var\\(([^()]+)\\)");
    private static final Pattern DASH_LETTER = Pattern.compile("-([a-z])");
    private static final Map<String, String> CSS_TO_VARIABLE = new HashMap<>();

    static {
        StyleCss.VARIABLE_TO_CSS.forEach((name, css) -> CSS_TO_VARIABLE.put(css, name));
    }

    private EmailStyles() {}

    /**
     * Replaces {@code $name} and {@code var(--mkly-*)} references (nested, with fallbacks) by the
     * values in {@code variables}. Unresolvable references are left untouched.
     */
    public static String resolveForEmail(String value, Map<String, String> variables) {
        Matcher refs = VARIABLE_REF.matcher(value);
        var out = new StringBuilder();
        while (refs.find()) {
            String replacement = variables.getOrDefault(refs.group(1), refs.group());
            refs.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        refs.appendTail(out);
        String resolved = out.toString();

        String previous = null;
        while (!resolved.equals(previous) && resolved.contains("var(")) {
            previous = resolved;
            Matcher calls = VAR_CALL.matcher(resolved);
            var next = new StringBuilder();
            while (calls.find()) {
                String replacement = resolveVar(calls.group(1), variables).orElse(calls.group());
                calls.appendReplacement(next, Matcher.quoteReplacement(replacement));
            }
            calls.appendTail(next);
            resolved = next.toString();
        }
        return resolved;
    }

    private static Optional<String> resolveVar(String expression, Map<String, String> variables) {
        int comma = expression.indexOf(',');
        String name = (comma >= 0 ? expression.substring(0, comma) : expression).strip();
        String fallback = comma >= 0 ? expression.substring(comma + 1).strip() : null;

        String key = CSS_TO_VARIABLE.get(name);
        if (key != null && variables.containsKey(key)) {
            return Optional.of(variables.get(key));
        }
        Matcher dashes = DASH_LETTER.matcher(name.replaceFirst("^--mkly-", ""));
        var camel = new StringBuilder();
        while (dashes.find()) {
            dashes.appendReplacement(camel, dashes.group(1).toUpperCase(Locale.ROOT));
        }
        dashes.appendTail(camel);
        if (variables.containsKey(camel.toString())) {
            return Optional.of(variables.get(camel.toString()));
        }
        return Optional.ofNullable(fallback);
    }

    /** CSS properties of one rule with every reference resolved; empty when the rule does not exist. */
    public static Map<String, String> emailStyleMap(
        StyleGraph graph,
        String blockType,
        String target,
        String label,
        Map<String, String> variables
    ) {
        Map<String, String> result = new LinkedHashMap<>();
        graph.rule(blockType, target, label).ifPresent(rule ->
            rule.properties().forEach((key, value) ->
                result.put(StyleCss.cssProperty(key), resolveForEmail(value, variables))
            )
        );
        return result;
    }
}
