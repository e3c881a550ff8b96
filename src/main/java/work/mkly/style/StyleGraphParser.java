package work.mkly.style;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the body of a {@code --- style} section. Brace syntax is detected automatically; both
 * dialects produce the same graph shape.
 */
public final class StyleGraphParser {
    private static final Pattern COMMENT = Pattern.compile("^\\s*//");
    private static final Pattern INLINE_COMMENT = Pattern.compile("\\s+//\\s.*$");
    private static final Pattern PROPERTY = Pattern.compile("^([\\w-]+)\\s*:\\s*(.+)$");
    private static final Pattern VARIABLE = Pattern.compile("^([\\w-]+)\\s*:\\s+(.+)$");
    private static final Pattern SELECTOR = Pattern.compile("^[\\w]+(?:/[\\w]+)?$");
    private static final Pattern LABEL_SELECTOR = Pattern.compile("^([\\w]+/[\\w]+):(\\w+)$");
    private static final Pattern SUB_ELEMENT = Pattern.compile("^\\.([\\w][\\w-]*)$");
    private static final Pattern SUB_PSEUDO = Pattern.compile("^\\.([\\w][\\w-]*)(::?\\w[\\w-]*(?:\\([^)]*\\))?)$");
    private static final Pattern PSEUDO = Pattern.compile("^(::?\\w[\\w-]*(?:\\([^)]*\\))?)$");
    private static final Pattern TAG = Pattern.compile("^>(\\.?[\\w][\\w-]*)$");
    private static final Pattern TAG_PSEUDO = Pattern.compile("^>(\\.?[\\w][\\w-]*)(::?[\\w-]+(?:\\([^)]*\\))?)$");
    private static final Pattern LEGACY_RULE_OPEN = Pattern.compile("^([\\w]+(?:/[\\w]+)?(?::\\w+)?(?:[.:]\\w[\\w-]*)?)\\s*\\{$");
    private static final Pattern SASS_FUNCTION = Pattern.compile("\\b(darken|lighten|saturate|desaturate|mix|adjust-hue|rgba)\\s*\\(");
    private static final Pattern WORD_START = Pattern.compile("^\\w.*");

    private static final Set<String> HTML_ELEMENTS = Set.of(
        "body", "div", "span", "main", "section", "article", "aside", "nav",
        "header", "footer", "p", "a", "img", "ul", "ol", "li", "table", "tr", "td",
        "h1", "h2", "h3", "h4", "h5", "h6", "form", "input", "button", "label"
    );

    private StyleGraphParser() {}

    public static StyleGraph parse(String source) {
        if (source == null || source.isBlank()) {
            return StyleGraph.EMPTY;
        }
        String[] lines = source.split("\n", -1);
        return usesBraces(lines) ? new Legacy().parse(lines) : new Indented().parse(lines);
    }

    static boolean usesBraces(String[] lines) {
        for (String line : lines) {
            String trimmed = line.strip();
            if (!COMMENT.matcher(trimmed).find() && (trimmed.endsWith("{") || trimmed.equals("}"))) {
                return true;
            }
        }
        return false;
    }

    static int indentOf(String line) {
        int count = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                count++;
            } else if (ch == '\t') {
                count += 2;
            } else {
                break;
            }
        }
        return count;
    }

    static String stripComment(String value) {
        return INLINE_COMMENT.matcher(value).replaceAll("").strip();
    }

    /** Splits {@code card.img}, {@code card:hover} or {@code core/card:hero} into type, target and label. */
    static Selector decompose(String selector) {
        int dot = selector.indexOf('.');
        int colon = selector.indexOf(':');
        if (dot >= 0) {
            String block = selector.substring(0, dot);
            String sub = selector.substring(dot + 1);
            Matcher labelled = LABEL_SELECTOR.matcher(block);
            if (labelled.matches()) {
                return new Selector(labelled.group(1), sub, labelled.group(2));
            }
            return new Selector(block, sub, null);
        }
        if (colon >= 0) {
            String block = selector.substring(0, colon);
            String rest = selector.substring(colon + 1);
            if (rest.matches("\\w+") && block.contains("/")) {
                return new Selector(block, StyleRule.SELF, rest);
            }
            return new Selector(block, StyleRule.SELF + selector.substring(colon), null);
        }
        return new Selector(selector, StyleRule.SELF, null);
    }

    record Selector(String blockType, String target, String label) {}

    /** Mutable state shared by both dialects while collecting one rule. */
    private abstract static class Collector {
        final List<StyleVariable> variables = new ArrayList<>();
        final List<StyleRule> rules = new ArrayList<>();
        final List<StyleWarning> warnings = new ArrayList<>();
        String blockType;
        String target = StyleRule.SELF;
        String label;
        Map<String, String> properties = new LinkedHashMap<>();

        void flushRule() {
            if (blockType != null && !properties.isEmpty()) {
                rules.add(new StyleRule(blockType, target, label, properties));
            }
            properties = new LinkedHashMap<>();
        }

        void property(String key, String value) {
            properties.put(StyleCss.normalizeKey(key), value);
        }

        void checkValue(String value, int line) {
            Matcher sass = SASS_FUNCTION.matcher(value);
            if (sass.find()) {
                warnings.add(new StyleWarning(
                    "\"" + sass.group(1) + "()\" is a Sass function, not valid CSS; browsers will ignore the value",
                    line
                ));
            }
        }

        StyleGraph graph() {
            flushRule();
            return new StyleGraph(variables, rules, warnings);
        }
    }

    private static final class Indented extends Collector {
        private boolean rawContext;
        private boolean targetFromSubElement;
        private int baseIndent = -1;

        StyleGraph parse(String[] lines) {
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                String trimmed = line.strip();
                if (trimmed.isEmpty() || COMMENT.matcher(trimmed).find()) {
                    continue;
                }
                int indent = indentOf(line);
                if (indent == 0) {
                    topLevel(trimmed, i + 1);
                } else {
                    nested(trimmed, indent, i + 1);
                }
            }
            return graph();
        }

        private void topLevel(String trimmed, int line) {
            flushRule();
            target = StyleRule.SELF;
            label = null;
            rawContext = false;
            baseIndent = -1;
            targetFromSubElement = false;

            Matcher variable = VARIABLE.matcher(trimmed);
            if (variable.matches()) {
                String value = stripComment(variable.group(2));
                checkValue(value, line);
                variables.add(new StyleVariable(variable.group(1), value));
                blockType = null;
                return;
            }

            Matcher labelled = LABEL_SELECTOR.matcher(trimmed);
            if (labelled.matches()) {
                blockType = labelled.group(1);
                label = labelled.group(2);
                return;
            }

            if (SELECTOR.matcher(trimmed).matches()) {
                if (HTML_ELEMENTS.contains(trimmed)) {
                    warnings.add(new StyleWarning(
                        "\"" + trimmed + "\" looks like an HTML element, not a mkly block; use document-level variables "
                            + "for page styles (e.g. \"bg: #fff\" at indent 0)",
                        line
                    ));
                }
                blockType = trimmed;
                return;
            }

            if (WORD_START.matcher(trimmed).matches()) {
                Selector selector = decompose(trimmed);
                blockType = selector.blockType();
                target = selector.target();
                label = selector.label();
                return;
            }

            blockType = StyleRule.RAW;
            target = trimmed;
            rawContext = true;
        }

        private void nested(String trimmed, int indent, int line) {
            if (blockType == null) {
                Matcher property = PROPERTY.matcher(trimmed);
                if (property.matches()) {
                    variables.add(new StyleVariable(property.group(1), stripComment(property.group(2))));
                }
                return;
            }
            if (rawContext) {
                Matcher property = PROPERTY.matcher(trimmed);
                if (property.matches()) {
                    property(property.group(1), stripComment(property.group(2)));
                }
                return;
            }
            if (baseIndent == -1) {
                baseIndent = indent;
            }
            if (switchTarget(trimmed)) {
                return;
            }
            if (indent <= baseIndent && targetFromSubElement && !StyleRule.SELF.equals(target)) {
                flushRule();
                target = StyleRule.SELF;
                targetFromSubElement = false;
            }
            Matcher property = PROPERTY.matcher(trimmed);
            if (property.matches()) {
                String value = stripComment(property.group(2));
                checkValue(value, line);
                property(property.group(1), value);
            }
        }

        private boolean switchTarget(String trimmed) {
            String next = null;
            Matcher matcher;
            if ((matcher = TAG_PSEUDO.matcher(trimmed)).matches()) {
                next = ">" + matcher.group(1) + matcher.group(2);
            } else if ((matcher = TAG.matcher(trimmed)).matches()) {
                next = ">" + matcher.group(1);
            } else if ((matcher = SUB_PSEUDO.matcher(trimmed)).matches()) {
                next = matcher.group(1) + matcher.group(2);
            } else if ((matcher = SUB_ELEMENT.matcher(trimmed)).matches()) {
                next = matcher.group(1);
            } else if ((matcher = PSEUDO.matcher(trimmed)).matches()) {
                next = StyleRule.SELF + matcher.group(1);
            }
            if (next == null) {
                return false;
            }
            flushRule();
            target = next;
            targetFromSubElement = true;
            return true;
        }
    }

    private static final class Legacy extends Collector {
        StyleGraph parse(String[] lines) {
            for (String line : lines) {
                String trimmed = line.strip();
                if (trimmed.isEmpty() || COMMENT.matcher(trimmed).find()) {
                    continue;
                }
                if (trimmed.equals("}")) {
                    flushRule();
                    blockType = null;
                    target = StyleRule.SELF;
                    label = null;
                    continue;
                }
                Matcher property = PROPERTY.matcher(trimmed);
                if (blockType != null) {
                    if (property.matches()) {
                        property(property.group(1), stripComment(property.group(2)));
                    }
                    continue;
                }
                Matcher open = LEGACY_RULE_OPEN.matcher(trimmed);
                if (open.matches()) {
                    Selector selector = decompose(open.group(1));
                    blockType = selector.blockType();
                    target = selector.target();
                    label = selector.label();
                    continue;
                }
                if (property.matches()) {
                    variables.add(new StyleVariable(property.group(1), stripComment(property.group(2))));
                }
            }
            return graph();
        }
    }
}
