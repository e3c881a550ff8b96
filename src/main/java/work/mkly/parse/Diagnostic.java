package work.mkly.parse;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A problem found while parsing or compiling a document. Lines are 1-based.
 */
public record Diagnostic(
    String message,
    Severity severity,
    int line,
    DiagnosticKind kind,
    String blockType,
    String property,
    boolean fatal
) {
    public Diagnostic {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(kind, "kind");
        if (line < 1) {
            line = 1;
        }
        if (fatal && severity != Severity.ERROR) {
            throw new IllegalArgumentException("Fatal diagnostics must have ERROR severity");
        }
    }

    public static Diagnostic error(DiagnosticKind kind, String message, int line) {
        return new Diagnostic(message, Severity.ERROR, line, kind, null, null, false);
    }

    public static Diagnostic warning(DiagnosticKind kind, String message, int line) {
        return new Diagnostic(message, Severity.WARNING, line, kind, null, null, false);
    }

    public static Diagnostic fatal(DiagnosticKind kind, String message, int line) {
        return new Diagnostic(message, Severity.ERROR, line, kind, null, null, true);
    }

    public Diagnostic forBlock(String type, String prop) {
        return new Diagnostic(message, severity, line, kind, type, prop, fatal);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("message", message);
        map.put("severity", severity.label());
        map.put("line", line);
        map.put("kind", kind.name().toLowerCase(Locale.ROOT));
        if (blockType != null) {
            map.put("blockType", blockType);
        }
        if (property != null) {
            map.put("property", property);
        }
        if (fatal) {
            map.put("fatal", true);
        }
        return map;
    }

    @Override
    public String toString() {
        return "line " + line + ": " + severity.label() + ": " + message;
    }
}
