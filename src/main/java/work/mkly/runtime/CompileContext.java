package work.mkly.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.mkly.parse.Block;
import work.mkly.parse.Diagnostic;
import work.mkly.parse.DiagnosticKind;
import work.mkly.style.StyleGraph;

/**
 * State of one compile call, handed to every block renderer. Not shared between calls.
 */
public final class CompileContext {
    private final Map<String, String> variables;
    private final StyleGraph styleGraph;
    private final int version;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<String> extraStyles = new LinkedHashSet<>();

    public CompileContext(Map<String, String> variables, StyleGraph styleGraph, int version) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(variables, "variables")));
        this.styleGraph = Objects.requireNonNull(styleGraph, "styleGraph");
        this.version = version;
    }

    /** Cascaded variables: kit and theme defaults, then style sections, then caller overrides. */
    public Map<String, String> variables() {
        return variables;
    }

    public Optional<String> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public StyleGraph styleGraph() {
        return styleGraph;
    }

    public int version() {
        return version;
    }

    /** Adds CSS to the preset layer once, however many blocks contribute it. */
    public void addStyle(String css) {
        if (css != null && !css.isBlank()) {
            extraStyles.add(css);
        }
    }

    public Set<String> extraStyles() {
        return Collections.unmodifiableSet(extraStyles);
    }

    public void warn(Block block, String message) {
        report(Diagnostic.warning(DiagnosticKind.CONTENT, message, block.range().startLine()).forBlock(block.blockType(), null));
    }

    public void error(Block block, String message) {
        report(Diagnostic.error(DiagnosticKind.CONTENT, message, block.range().startLine()).forBlock(block.blockType(), null));
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic"));
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
