package work.mkly.parse;

import java.util.Objects;

/**
 * One classified physical line. Fields that do not apply to the token type are {@code null}.
 *
 * @param type      line classification
 * @param line      1-based line number
 * @param raw       the line exactly as written
 * @param blockType directive name for block start/end lines
 * @param label     optional label of a block start ({@code --- core/card: hero})
 * @param key       property key
 * @param value     property value or comment text
 */
public record Token(TokenType type, int line, String raw, String blockType, String label, String key, String value) {
    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(raw, "raw");
    }

    static Token blank(int line, String raw) {
        return new Token(TokenType.BLANK, line, raw, null, null, null, null);
    }

    static Token comment(int line, String raw, String content) {
        return new Token(TokenType.COMMENT, line, raw, null, null, null, content);
    }

    static Token blockEnd(int line, String raw, String blockType) {
        return new Token(TokenType.BLOCK_END, line, raw, blockType, null, null, null);
    }

    static Token blockStart(int line, String raw, String blockType, String label) {
        return new Token(TokenType.BLOCK_START, line, raw, blockType, label, null, null);
    }

    static Token property(int line, String raw, String key, String value) {
        return new Token(TokenType.PROPERTY, line, raw, null, null, key, value);
    }

    static Token text(int line, String raw) {
        return new Token(TokenType.TEXT, line, raw, null, null, null, null);
    }

    public boolean is(TokenType candidate) {
        return type == candidate;
    }
}
