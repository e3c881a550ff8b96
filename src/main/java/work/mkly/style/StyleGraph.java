package work.mkly.style;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical style model of a document: variables plus targeted rules. Every mutation returns a new graph.
 */
public record StyleGraph(List<StyleVariable> variables, List<StyleRule> rules, List<StyleWarning> warnings) {
    public static final StyleGraph EMPTY = new StyleGraph(List.of(), List.of(), List.of());

    public StyleGraph {
        variables = variables == null ? List.of() : List.copyOf(variables);
        rules = rules == null ? List.of() : List.copyOf(rules);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public StyleGraph(List<StyleVariable> variables, List<StyleRule> rules) {
        this(variables, rules, List.of());
    }

    public boolean isEmpty() {
        return variables.isEmpty() && rules.isEmpty();
    }

    /** Variables by name, later declarations winning. */
    public Map<String, String> variableMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (StyleVariable variable : variables) {
            map.put(variable.name(), variable.value());
        }
        return map;
    }

    public Optional<StyleRule> rule(String blockType, String target, String label) {
        return rules.stream().filter(rule -> rule.matches(blockType, target, label)).findFirst();
    }

    /** Adds or replaces one property. A blank value removes the property. */
    public StyleGraph mergeRule(String blockType, String target, String label, String property, String value) {
        if (value == null || value.isBlank()) {
            return removeRule(blockType, target, label, property);
        }
        value = value.strip();
        List<StyleRule> updated = new ArrayList<>(rules);
        for (int i = 0; i < updated.size(); i++) {
            StyleRule rule = updated.get(i);
            if (rule.matches(blockType, target, label)) {
                Map<String, String> props = new LinkedHashMap<>(rule.properties());
                props.put(StyleCss.normalizeKey(property), value);
                updated.set(i, rule.withProperties(props));
                return new StyleGraph(variables, updated);
            }
        }
        updated.add(new StyleRule(blockType, target, label, Map.of(property, value)));
        return new StyleGraph(variables, updated);
    }

    /** Removes one property; a rule left without properties is dropped. */
    public StyleGraph removeRule(String blockType, String target, String label, String property) {
        String key = StyleCss.normalizeKey(property);
        List<StyleRule> updated = new ArrayList<>(rules.size());
        for (StyleRule rule : rules) {
            if (!rule.matches(blockType, target, label) || !rule.properties().containsKey(key)) {
                updated.add(rule);
                continue;
            }
            Map<String, String> props = new LinkedHashMap<>(rule.properties());
            props.remove(key);
            if (!props.isEmpty()) {
                updated.add(rule.withProperties(props));
            }
        }
        return new StyleGraph(variables, updated);
    }

    public Optional<String> styleValue(String blockType, String target, String label, String property) {
        return rule(blockType, target, label).map(rule -> rule.properties().get(StyleCss.normalizeKey(property)));
    }

    /**
     * Combines graphs left to right. Variables are replaced by name, rules with the same key get
     * their properties unioned with later values winning. Warnings are kept.
     */
    public static StyleGraph merge(List<StyleGraph> graphs) {
        List<StyleVariable> variables = new ArrayList<>();
        Map<String, Integer> variableIndex = new LinkedHashMap<>();
        List<StyleRule> rules = new ArrayList<>();
        List<StyleWarning> warnings = new ArrayList<>();
        for (StyleGraph graph : graphs) {
            for (StyleVariable variable : graph.variables()) {
                Integer existing = variableIndex.get(variable.name());
                if (existing != null) {
                    variables.set(existing, variable);
                } else {
                    variableIndex.put(variable.name(), variables.size());
                    variables.add(variable);
                }
            }
            for (StyleRule rule : graph.rules()) {
                mergeInto(rules, rule);
            }
            warnings.addAll(graph.warnings());
        }
        return new StyleGraph(variables, rules, warnings);
    }

    public static StyleGraph merge(StyleGraph... graphs) {
        return merge(List.of(graphs));
    }

    /** Appends {@code rule} or unions its properties into the rule with the same key. */
    static void mergeInto(List<StyleRule> rules, StyleRule rule) {
        for (int i = 0; i < rules.size(); i++) {
            StyleRule existing = rules.get(i);
            if (existing.sameKey(rule)) {
                Map<String, String> props = new LinkedHashMap<>(existing.properties());
                props.putAll(rule.properties());
                rules.set(i, existing.withProperties(props));
                return;
            }
        }
        rules.add(rule);
    }
}
