package work.mkly.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line classifier. Each physical line becomes exactly one {@link Token}; no state crosses lines.
 */
public final class Tokenizer {
    private static final Pattern BLOCK_END = Pattern.compile("^---\\s+/([\\w-]+(?:/[\\w-]+)?)\\s*$");
    private static final Pattern BLOCK_START = Pattern.compile("^---\\s+([\\w-]+(?:/[\\w-]+)?)(?::\\s*(.+))?\\s*$");
    private static final Pattern PROPERTY = Pattern.compile("^(@[\\w.#:,/-]+|\\w+):\\s+(.*)$");

    private Tokenizer() {}

    public static List<Token> tokenize(String source) {
        String text = source == null ? "" : source;
        String[] lines = text.split("\n", -1);
        List<Token> tokens = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            tokens.add(classify(lines[i], i + 1));
        }
        return tokens;
    }

    static Token classify(String line, int lineNumber) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return Token.blank(lineNumber, line);
        }
        if (trimmed.startsWith("//")) {
            return Token.comment(lineNumber, line, trimmed.substring(2).strip());
        }

        // close before open
        Matcher end = BLOCK_END.matcher(trimmed);
        if (end.matches()) {
            return Token.blockEnd(lineNumber, line, end.group(1));
        }

        Matcher start = BLOCK_START.matcher(trimmed);
        if (start.matches()) {
            String label = start.group(2) == null ? null : start.group(2).strip();
            return Token.blockStart(lineNumber, line, start.group(1), label == null || label.isEmpty() ? null : label);
        }

        Matcher property = PROPERTY.matcher(trimmed);
        if (property.matches()) {
            String value = property.group(2);
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            return Token.property(lineNumber, line, property.group(1), value);
        }

        return Token.text(lineNumber, line);
    }
}
