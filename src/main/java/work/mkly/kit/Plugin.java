package work.mkly.kit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import work.mkly.parse.Document;

/**
 * Compile-time extension: renderer overrides checked before the registry, a document transform,
 * a post-compile hook and an output wrapper replacing the default page.
 */
public record Plugin(
    String name,
    Map<String, BlockRenderer> renderers,
    Optional<UnaryOperator<Document>> transform,
    Optional<AfterCompileHook> afterCompile,
    Optional<OutputWrapper> outputWrapper
) {
    public Plugin {
        Objects.requireNonNull(name, "name");
        renderers = Collections.unmodifiableMap(new LinkedHashMap<>(renderers));
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(afterCompile, "afterCompile");
        Objects.requireNonNull(outputWrapper, "outputWrapper");
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, BlockRenderer> renderers = new LinkedHashMap<>();
        private UnaryOperator<Document> transform;
        private AfterCompileHook afterCompile;
        private OutputWrapper outputWrapper;

        private Builder(String name) {
            this.name = name;
        }

        public Builder renderer(String blockType, BlockRenderer renderer) {
            renderers.put(blockType, renderer);
            return this;
        }

        public Builder transform(UnaryOperator<Document> transform) {
            this.transform = transform;
            return this;
        }

        public Builder afterCompile(AfterCompileHook afterCompile) {
            this.afterCompile = afterCompile;
            return this;
        }

        public Builder outputWrapper(OutputWrapper outputWrapper) {
            this.outputWrapper = outputWrapper;
            return this;
        }

        public Plugin build() {
            return new Plugin(
                name,
                renderers,
                Optional.ofNullable(transform),
                Optional.ofNullable(afterCompile),
                Optional.ofNullable(outputWrapper)
            );
        }
    }
}
