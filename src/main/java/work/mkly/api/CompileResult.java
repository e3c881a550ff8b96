package work.mkly.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import work.mkly.parse.Diagnostic;
import work.mkly.parse.Severity;
import work.mkly.runtime.SourceMapEntry;
import work.mkly.style.StyleGraph;
import work.mkly.style.StyleGraphSerializer;

/**
 * Outcome of compiling one document (usable by the CLI and embedding apps).
 *
 * @param html        final markup, empty after a fatal diagnostic
 * @param diagnostics parse and compile problems in discovery order
 * @param sourceMap   top-level block positions when source maps were requested
 * @param styleGraph  merged graph of the document's style sections
 * @param version     effective document version
 */
public record CompileResult(
    String html,
    List<Diagnostic> diagnostics,
    Optional<List<SourceMapEntry>> sourceMap,
    StyleGraph styleGraph,
    int version
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public CompileResult {
        Objects.requireNonNull(html, "html");
        diagnostics = List.copyOf(diagnostics);
        sourceMap = sourceMap.map(List::copyOf);
        Objects.requireNonNull(styleGraph, "styleGraph");
    }

    public static CompileResult fatal(List<Diagnostic> diagnostics, int version) {
        return new CompileResult("", diagnostics, Optional.empty(), StyleGraph.EMPTY, version);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::fatal);
    }

    public List<Diagnostic> errors() {
        return filter(Severity.ERROR);
    }

    public List<Diagnostic> warnings() {
        return filter(Severity.WARNING);
    }

    private List<Diagnostic> filter(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).collect(Collectors.toList());
    }

    public CompileResult withHtml(String replacement) {
        return new CompileResult(replacement, diagnostics, sourceMap, styleGraph, version);
    }

    public CompileResult withDiagnostic(Diagnostic diagnostic) {
        var updated = new ArrayList<>(diagnostics);
        updated.add(diagnostic);
        return new CompileResult(html, updated, sourceMap, styleGraph, version);
    }

    public int exitCode() {
        return hasErrors() ? 1 : 0;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("version", version);
        serializable.put("html", html);
        serializable.put("diagnostics", diagnostics.stream().map(Diagnostic::toSerializableMap).collect(Collectors.toList()));
        sourceMap.ifPresent(entries ->
            serializable.put("sourceMap", entries.stream().map(SourceMapEntry::toSerializableMap).collect(Collectors.toList()))
        );
        serializable.put("style", StyleGraphSerializer.serialize(styleGraph));
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }
}
