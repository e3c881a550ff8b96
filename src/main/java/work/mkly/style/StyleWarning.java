package work.mkly.style;

/**
 * Recoverable style-DSL problem.
 *
 * @param line 1-based line inside the parsed section
 */
public record StyleWarning(String message, int line) {}
