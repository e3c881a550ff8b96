package work.mkly.runtime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Position of a rendered block inside the block HTML (before page wrapping).
 */
public record SourceMapEntry(
    int sourceLine,
    int sourceEndLine,
    String blockType,
    int htmlOffset,
    int htmlLength,
    List<SourceMapEntry> children
) {
    public SourceMapEntry {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sourceLine", sourceLine);
        map.put("sourceEndLine", sourceEndLine);
        map.put("blockType", blockType);
        map.put("htmlOffset", htmlOffset);
        map.put("htmlLength", htmlLength);
        map.put("children", children.stream().map(SourceMapEntry::toSerializableMap).collect(Collectors.toList()));
        return map;
    }
}
