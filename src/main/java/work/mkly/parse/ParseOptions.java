package work.mkly.parse;

import java.util.Set;

/**
 * @param verbatimTypes block types whose body is captured raw until the matching close
 * @param sourceMap     record property and content line numbers on each block
 */
public record ParseOptions(Set<String> verbatimTypes, boolean sourceMap) {
    public static final ParseOptions DEFAULT = new ParseOptions(Set.of(), false);

    public ParseOptions {
        verbatimTypes = verbatimTypes == null ? Set.of() : Set.copyOf(verbatimTypes);
    }

    public ParseOptions withSourceMap(boolean enabled) {
        return new ParseOptions(verbatimTypes, enabled);
    }
}
