package work.mkly.parse;

/**
 * Classification of a single source line.
 */
public enum TokenType {
    BLANK,
    COMMENT,
    BLOCK_END,
    BLOCK_START,
    PROPERTY,
    TEXT
}
