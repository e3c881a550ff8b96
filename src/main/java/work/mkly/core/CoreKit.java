package work.mkly.core;

import java.util.List;
import work.mkly.kit.Kit;
import work.mkly.kit.KitManifestLoader;
import work.mkly.kit.KitVersions;

/**
 * The built-in {@code core} kit: data from the bundled manifest plus the Java block renderers.
 */
public final class CoreKit {
    public static final String NAME = "core";
    static final String MANIFEST = "work/mkly/core/core-kit.toml";

    private static volatile Kit kit;

    private CoreKit() {}

    public static Kit kit() {
        Kit loaded = kit;
        if (loaded == null) {
            synchronized (CoreKit.class) {
                loaded = kit;
                if (loaded == null) {
                    loaded = create();
                    kit = loaded;
                }
            }
        }
        return loaded;
    }

    private static Kit create() {
        var builder = KitManifestLoader.loadResource(MANIFEST).toBuilder();
        CoreBlocks.definitions().forEach(builder::block);
        return builder.versions(new KitVersions(List.of(1), 1)).build();
    }
}
