package work.mkly.kit;

import java.util.Locale;

/**
 * What an author may write inside a block.
 */
public enum ContentMode {
    /** {@code key: value} lines only; body text is ignored. */
    PROPERTIES,
    /** Body text only; properties are ignored. */
    TEXT,
    /** Properties followed by body text. */
    MIXED,
    /** Raw lines up to the matching close directive, nested directives included. */
    VERBATIM;

    public static ContentMode from(String value) {
        if (value == null || value.isBlank()) {
            return MIXED;
        }
        try {
            return ContentMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported content mode: " + value);
        }
    }

    public boolean acceptsBody() {
        return this != PROPERTIES;
    }

    public boolean acceptsProperties() {
        return this != TEXT;
    }
}
