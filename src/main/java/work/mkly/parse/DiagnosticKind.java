package work.mkly.parse;

/**
 * Broad category of a diagnostic, used by callers to filter without matching message text.
 */
public enum DiagnosticKind {
    LIMIT,
    VERSION,
    ORDERING,
    REFERENCE,
    CONTENT,
    PROPERTY,
    STYLE,
    DEFINITION,
    STRUCTURE
}
