package work.mkly.kit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Named set of design variables and CSS contributed by a kit or an inline {@code define-theme}.
 *
 * @param variables variable defaults ({@code accent}, {@code bg}, ...)
 * @param rawCss    CSS injected as-is
 * @param css       style-DSL source compiled through the StyleGraph engine
 */
public record Theme(String name, String displayName, String description, Map<String, String> variables, String rawCss, String css) {
    public Theme {
        Objects.requireNonNull(name, "name");
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static Theme of(String name, Map<String, String> variables, String css) {
        return new Theme(name, null, null, variables, null, css);
    }

    public boolean hasVariables() {
        return !variables.isEmpty();
    }
}
