package work.mkly.style;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles document CSS into the fixed cascade layers {@code kit, theme, preset, user}.
 * User rules always win regardless of selector specificity.
 */
public final class LayeredCss {
    public static final String LAYER_ORDER = "@layer kit, theme, preset, user;";

    private String diagnosticCss;
    private final List<String> kitCss = new ArrayList<>();
    private final Map<String, String> keyframes = new LinkedHashMap<>();
    private final List<String> themeCss = new ArrayList<>();
    private final List<String> presetCss = new ArrayList<>();
    private String apiThemeCss;
    private final List<String> blockCss = new ArrayList<>();

    public LayeredCss diagnosticCss(String css) {
        this.diagnosticCss = css;
        return this;
    }

    public LayeredCss kitCss(String css) {
        addIfPresent(kitCss, css);
        return this;
    }

    public LayeredCss keyframes(Map<String, String> frames) {
        keyframes.putAll(frames);
        return this;
    }

    public LayeredCss themeCss(String css) {
        addIfPresent(themeCss, css);
        return this;
    }

    public LayeredCss presetCss(String css) {
        addIfPresent(presetCss, css);
        return this;
    }

    public LayeredCss apiThemeCss(String css) {
        this.apiThemeCss = css;
        return this;
    }

    public LayeredCss blockCss(Iterable<String> css) {
        css.forEach(entry -> addIfPresent(blockCss, entry));
        return this;
    }

    public String compile(StyleGraph userGraph) {
        List<String> parts = new ArrayList<>();
        parts.add(LAYER_ORDER);

        List<String> kit = new ArrayList<>();
        addIfPresent(kit, diagnosticCss);
        if (!kitCss.isEmpty()) {
            kit.add(String.join("\n", kitCss));
        }
        if (!keyframes.isEmpty()) {
            List<String> frames = new ArrayList<>();
            keyframes.forEach((name, body) -> frames.add("@keyframes " + name + "{" + body + "}"));
            kit.add(String.join("\n", frames));
        }
        layer(parts, "kit", kit);
        layer(parts, "theme", themeCss);

        List<String> preset = new ArrayList<>(presetCss);
        addIfPresent(preset, apiThemeCss);
        preset.addAll(blockCss);
        layer(parts, "preset", preset);

        String user = StyleCss.compile(userGraph);
        if (!user.isEmpty()) {
            parts.add("@layer user {\n" + user + "\n}");
        }
        return String.join("\n\n", parts);
    }

    private static void layer(List<String> parts, String name, List<String> content) {
        if (!content.isEmpty()) {
            parts.add("@layer " + name + " {\n" + String.join("\n", content) + "\n}");
        }
    }

    private static void addIfPresent(List<String> target, String css) {
        if (css != null && !css.isBlank()) {
            target.add(css);
        }
    }
}
