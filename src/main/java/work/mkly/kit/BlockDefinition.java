package work.mkly.kit;

import java.util.Objects;

/**
 * A block type contributed by a kit.
 *
 * @param name        unqualified name inside the kit, qualified as {@code kit/name} once registered
 * @param contentMode what the author may write in the block
 * @param container   whether rendered children replace {@link #CHILDREN}
 * @param since       first document version exposing the block
 */
public record BlockDefinition(String name, ContentMode contentMode, boolean container, int since, BlockRenderer renderer) {
    public static final String CHILDREN = "{{children}}";

    public BlockDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(contentMode, "contentMode");
        Objects.requireNonNull(renderer, "renderer");
        if (since < 1) {
            throw new IllegalArgumentException("since must be >= 1 for block " + name);
        }
    }

    public static BlockDefinition of(String name, ContentMode contentMode, BlockRenderer renderer) {
        return new BlockDefinition(name, contentMode, false, 1, renderer);
    }

    public static BlockDefinition container(String name, ContentMode contentMode, BlockRenderer renderer) {
        return new BlockDefinition(name, contentMode, true, 1, renderer);
    }

    public BlockDefinition since(int version) {
        return new BlockDefinition(name, contentMode, container, version, renderer);
    }

    public BlockDefinition qualified(String kitName) {
        return new BlockDefinition(kitName + "/" + name, contentMode, container, since, renderer);
    }

    public boolean verbatim() {
        return contentMode == ContentMode.VERBATIM;
    }
}
