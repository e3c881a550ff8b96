package work.mkly.kit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structural visual treatment layered between themes and user styles.
 *
 * @param keyframes animation name to keyframe body ({@code 0%{opacity:0}100%{opacity:1}})
 */
public record Preset(
    String name,
    String displayName,
    String description,
    String defaultTheme,
    String css,
    String rawCss,
    Map<String, String> keyframes
) {
    public Preset {
        Objects.requireNonNull(name, "name");
        keyframes = keyframes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(keyframes));
    }

    public static Preset of(String name, String css) {
        return new Preset(name, null, null, null, css, null, Map.of());
    }
}
