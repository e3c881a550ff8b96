package work.mkly.parse;

import java.util.Objects;

/**
 * Raw text of one {@code --- style} section.
 *
 * @param source verbatim section body, blank edges trimmed
 * @param line   source line of the first body line
 */
public record StyleSection(String source, int line) {
    public StyleSection {
        Objects.requireNonNull(source, "source");
    }
}
