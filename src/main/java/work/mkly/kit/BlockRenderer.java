package work.mkly.kit;

import work.mkly.parse.Block;
import work.mkly.runtime.CompileContext;

/**
 * Renders one block to HTML. Containers return markup holding {@link BlockDefinition#CHILDREN}.
 */
@FunctionalInterface
public interface BlockRenderer {
    String render(Block block, CompileContext context) throws Exception;
}
