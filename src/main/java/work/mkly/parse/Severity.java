package work.mkly.parse;

import java.util.Locale;

/**
 * Severity of a {@link Diagnostic}.
 */
public enum Severity {
    ERROR,
    WARNING;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
