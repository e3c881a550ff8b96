package work.mkly.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.mkly.kit.BlockDefinition;
import work.mkly.kit.ContentMode;
import work.mkly.parse.Block;

/**
 * Block definitions by qualified type. Each compile works on its own copy.
 */
public final class BlockRegistry {
    private final Map<String, BlockDefinition> definitions = new LinkedHashMap<>();

    public BlockRegistry register(BlockDefinition definition) {
        definitions.put(definition.name(), definition);
        return this;
    }

    public Optional<BlockDefinition> get(String type) {
        return Optional.ofNullable(definitions.get(type));
    }

    public boolean has(String type) {
        return definitions.containsKey(type);
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(definitions.keySet());
    }

    public Set<String> verbatimTypes() {
        return definitions.values().stream()
            .filter(BlockDefinition::verbatim)
            .map(BlockDefinition::name)
            .collect(Collectors.toSet());
    }

    public BlockRegistry copy() {
        var copy = new BlockRegistry();
        copy.definitions.putAll(definitions);
        return copy;
    }

    /**
     * Renders {@code block} with its registered definition after checking the author's input against the
     * content mode. Unknown types render an inert placeholder that keeps the raw content visible.
     */
    public String render(Block block, CompileContext context) throws Exception {
        BlockDefinition definition = definitions.get(block.blockType());
        if (definition == null) {
            context.warn(block, "Unknown block type \"" + block.blockType() + "\"");
            return "<div data-block=\"" + Html.escape(block.blockType()) + "\" class=\"mkly-unknown\">"
                + Html.escape(block.content()) + "</div>";
        }
        ContentMode mode = definition.contentMode();
        if (!mode.acceptsBody() && !block.content().isBlank()) {
            context.warn(block, "\"" + block.blockType() + "\" does not support body content; text below properties will be ignored");
        }
        if (!mode.acceptsProperties() && !block.properties().isEmpty()) {
            context.warn(block, "\"" + block.blockType() + "\" is a text block; properties are not supported and will be ignored");
        }
        return definition.renderer().render(block, context);
    }
}
