package work.mkly.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.mkly.kit.OutputWrapper;
import work.mkly.kit.Preset;
import work.mkly.kit.Theme;

/**
 * Default page: layered CSS, round-trip metadata and a centred {@code main.mkly-document}.
 */
public final class WebOutputWrapper implements OutputWrapper {
    static final String ACTIVE_OUTLINE =
        "[data-mkly-active]{outline:2px solid rgba(59,130,246,0.5);outline-offset:2px;transition:outline 0.15s}";

    @Override
    public String wrap(Page page, CompileContext context) {
        var html = new StringBuilder();
        String css = page.sourceMap() ? page.css() + "\n" + ACTIVE_OUTLINE : page.css();
        if (!css.isEmpty()) {
            html.append("<style>").append(css).append("</style>\n");
        }
        if (!page.styleSources().isEmpty()) {
            html.append("<script type=\"text/mkly-style\">")
                .append(scriptSafe(String.join("\n---\n", page.styleSources())))
                .append("</script>\n");
        }
        if (!page.inlineThemes().isEmpty() || !page.inlinePresets().isEmpty()) {
            html.append("<script type=\"text/mkly-defines\">")
                .append(scriptSafe(serializeDefines(page.inlineThemes(), page.inlinePresets())))
                .append("</script>\n");
        }
        html.append(metaTags(page));
        html.append("<main class=\"mkly-document\" style=\"max-width:").append(page.maxWidth()).append("px;margin:0 auto;\">");
        html.append(page.content());
        html.append("</main>");
        return html.toString();
    }

    private static String metaTags(Page page) {
        List<String> tags = new ArrayList<>();
        page.uses().forEach(name -> tags.add(meta("mkly:use", name)));
        page.themes().forEach(name -> tags.add(meta("mkly:theme", name)));
        page.presets().forEach(name -> tags.add(meta("mkly:preset", name)));
        for (Map.Entry<String, String> entry : page.meta().entrySet()) {
            tags.add(meta("mkly:" + entry.getKey(), entry.getValue()));
        }
        return tags.isEmpty() ? "" : String.join("\n", tags) + "\n";
    }

    private static String meta(String name, String content) {
        return "<meta name=\"" + Html.attribute(name) + "\" content=\"" + Html.attribute(content) + "\">";
    }

    /** Re-creates the {@code define-theme} and {@code define-preset} directives. */
    static String serializeDefines(List<Theme> themes, List<Preset> presets) {
        List<String> parts = new ArrayList<>();
        for (Theme theme : themes) {
            List<String> lines = new ArrayList<>();
            lines.add("--- define-theme: " + theme.name());
            theme.variables().forEach((key, value) -> lines.add(key + ": " + value));
            if (theme.css() != null) {
                if (theme.hasVariables()) {
                    lines.add("");
                }
                lines.add(theme.css());
            }
            parts.add(String.join("\n", lines));
        }
        for (Preset preset : presets) {
            List<String> lines = new ArrayList<>();
            lines.add("--- define-preset: " + preset.name());
            if (preset.css() != null) {
                lines.add(preset.css());
            }
            parts.add(String.join("\n", lines));
        }
        return String.join("\n---\n", parts);
    }

    private static String scriptSafe(String text) {
        return text.replace("</", "<\\/");
    }
}
