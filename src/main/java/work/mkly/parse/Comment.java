package work.mkly.parse;

/**
 * A {@code //} comment preserved for round-trip output.
 */
public record Comment(String content, int line) {}
