package work.mkly.parse;

/**
 * Inclusive 1-based line span of a block in the source.
 */
public record SourceRange(int startLine, int endLine) {
    public SourceRange {
        if (startLine < 1) {
            startLine = 1;
        }
        if (endLine < startLine) {
            endLine = startLine;
        }
    }

    public static SourceRange at(int line) {
        return new SourceRange(line, line);
    }

    public SourceRange withEnd(int line) {
        return new SourceRange(startLine, line);
    }
}
