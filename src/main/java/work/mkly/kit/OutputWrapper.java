package work.mkly.kit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.mkly.runtime.CompileContext;

/**
 * Turns rendered block HTML into the final document markup.
 */
@FunctionalInterface
public interface OutputWrapper {
    String wrap(Page page, CompileContext context);

    /**
     * Everything assembled for one document.
     *
     * @param content       rendered blocks and comments
     * @param css           layered document CSS
     * @param meta          {@code --- meta} properties
     * @param uses          resolved kit names
     * @param themes        resolved theme names
     * @param presets       resolved preset names
     * @param styleSources  verbatim style sections
     * @param inlineThemes  inline theme definitions
     * @param inlinePresets inline preset definitions
     */
    record Page(
        String content,
        String css,
        Map<String, String> meta,
        List<String> uses,
        List<String> themes,
        List<String> presets,
        List<String> styleSources,
        List<Theme> inlineThemes,
        List<Preset> inlinePresets,
        int maxWidth,
        boolean sourceMap
    ) {
        public Page {
            meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
            uses = List.copyOf(uses);
            themes = List.copyOf(themes);
            presets = List.copyOf(presets);
            styleSources = List.copyOf(styleSources);
            inlineThemes = List.copyOf(inlineThemes);
            inlinePresets = List.copyOf(inlinePresets);
        }
    }
}
