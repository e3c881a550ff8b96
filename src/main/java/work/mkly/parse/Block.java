package work.mkly.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed content unit. Immutable once produced by the parser.
 *
 * @param blockType     kit-qualified type ({@code core/card}) or bare name
 * @param properties    {@code key: value} lines in declaration order
 * @param content       body text with indentation preserved
 * @param children      nested blocks collected by a matching close directive
 * @param range         source span
 * @param label         optional instance label
 * @param propertyLines property key to line (only populated in source-map mode)
 * @param contentLines  line number of each content line (only populated in source-map mode)
 */
public record Block(
    String blockType,
    Map<String, String> properties,
    String content,
    List<Block> children,
    SourceRange range,
    String label,
    Map<String, Integer> propertyLines,
    List<Integer> contentLines
) {
    public Block {
        Objects.requireNonNull(blockType, "blockType");
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        content = content == null ? "" : content;
        children = children == null ? List.of() : List.copyOf(children);
        range = range == null ? SourceRange.at(1) : range;
        propertyLines = propertyLines == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(propertyLines));
        contentLines = contentLines == null ? List.of() : List.copyOf(contentLines);
    }

    public static Block of(String blockType, Map<String, String> properties, String content) {
        return new Block(blockType, properties, content, List.of(), null, null, null, null);
    }

    public String property(String key) {
        return properties.get(key);
    }

    public String property(String key, String fallback) {
        return properties.getOrDefault(key, fallback);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Block withChildren(List<Block> newChildren) {
        return new Block(blockType, properties, content, newChildren, range, label, propertyLines, contentLines);
    }

    public Block withContent(String newContent) {
        return new Block(blockType, properties, newContent, children, range, label, propertyLines, contentLines);
    }

    public Block withProperty(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(properties);
        copy.put(key, value);
        return new Block(blockType, copy, content, children, range, label, propertyLines, contentLines);
    }

    /**
     * Mutable form used while a block is still open in the parser.
     */
    static final class Builder {
        private final String blockType;
        private final String label;
        private final int startLine;
        private final boolean trackLines;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final Map<String, Integer> propertyLines = new LinkedHashMap<>();
        private final List<String> contentLines = new ArrayList<>();
        private final List<Integer> contentLineNumbers = new ArrayList<>();
        private int endLine;

        Builder(String blockType, String label, int startLine, boolean trackLines) {
            this.blockType = blockType;
            this.label = label;
            this.startLine = startLine;
            this.endLine = startLine;
            this.trackLines = trackLines;
        }

        String blockType() {
            return blockType;
        }

        int startLine() {
            return startLine;
        }

        boolean hasProperty(String key) {
            return properties.containsKey(key);
        }

        void property(String key, String value, int line) {
            properties.put(key, value);
            if (trackLines) {
                propertyLines.put(key, line);
            }
        }

        void contentLine(String text, int line) {
            contentLines.add(text);
            contentLineNumbers.add(line);
        }

        void end(int line) {
            endLine = Math.max(startLine, line);
        }

        Block build(List<Block> children) {
            int from = 0;
            int to = contentLines.size();
            while (from < to && contentLines.get(from).isEmpty()) {
                from++;
            }
            while (to > from && contentLines.get(to - 1).isEmpty()) {
                to--;
            }
            String content = String.join("\n", contentLines.subList(from, to));
            List<Integer> lines = trackLines ? contentLineNumbers.subList(from, to) : List.of();
            return new Block(
                blockType,
                properties,
                content,
                children,
                new SourceRange(startLine, endLine),
                label,
                trackLines ? propertyLines : Map.of(),
                lines
            );
        }
    }
}
