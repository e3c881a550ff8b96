package work.mkly.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Properties applied to one target of a block type.
 *
 * <p>Targets: {@code self}, {@code self:hover}, {@code img}, {@code img:hover}, {@code >p}, {@code >p:hover}.
 * Raw CSS rules use {@link #RAW} as block type and the selector text as target. Values are single-line,
 * trimmed and free of {@code " // "} so that serializing and re-parsing yields the same rule.
 */
public record StyleRule(String blockType, String target, String label, Map<String, String> properties) {
    public static final String RAW = "__raw";
    public static final String SELF = "self";

    public StyleRule {
        Objects.requireNonNull(blockType, "blockType");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(properties, "properties");
        if (properties.isEmpty()) {
            throw new IllegalArgumentException("Style rule for " + blockType + " has no properties");
        }
        if (label != null && (label.isEmpty() || !blockType.contains("/"))) {
            throw new IllegalArgumentException("Labels require a kit-qualified block type: " + blockType + ":" + label);
        }
        Map<String, String> normalized = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            Objects.requireNonNull(value, key);
            if (value.isBlank() || value.indexOf('\n') >= 0 || !value.equals(StyleGraphParser.stripComment(value))) {
                throw new IllegalArgumentException("Style value for " + key + " cannot be written back: \"" + value + "\"");
            }
            normalized.put(StyleCss.normalizeKey(key), value);
        });
        properties = Collections.unmodifiableMap(normalized);
    }

    public static StyleRule raw(String selector, Map<String, String> properties) {
        return new StyleRule(RAW, selector, null, properties);
    }

    public boolean isRaw() {
        return RAW.equals(blockType);
    }

    public boolean matches(String type, String targetName, String labelName) {
        return blockType.equals(type) && target.equals(targetName) && Objects.equals(label, labelName);
    }

    public boolean sameKey(StyleRule other) {
        return matches(other.blockType, other.target, other.label);
    }

    StyleRule withProperties(Map<String, String> replacement) {
        return new StyleRule(blockType, target, label, replacement);
    }
}
