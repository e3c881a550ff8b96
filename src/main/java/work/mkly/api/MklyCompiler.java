package work.mkly.api;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mkly.kit.BlockDefinition;
import work.mkly.kit.Kit;
import work.mkly.parse.Document;
import work.mkly.parse.DocumentParser;
import work.mkly.parse.ParseOptions;
import work.mkly.runtime.DocumentCompiler;

/**
 * Public entry point for embedding the compiler: source text in, HTML and diagnostics out.
 * Instances are immutable and may be shared; every call works on its own state.
 */
public final class MklyCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(MklyCompiler.class);

    private final CompileConfiguration configuration;
    private final ParseOptions parseOptions;

    public MklyCompiler() {
        this(CompileConfiguration.defaults());
    }

    public MklyCompiler(CompileConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.parseOptions = new ParseOptions(verbatimTypes(configuration), configuration.sourceMap());
    }

    public CompileConfiguration configuration() {
        return configuration;
    }

    public Document parse(String source) {
        return DocumentParser.parse(Objects.requireNonNull(source, "source"), parseOptions);
    }

    public CompileResult compile(String source) {
        Document document = parse(source);
        LOG.debug("Parsed {} top-level blocks, {} diagnostics", document.blocks().size(), document.diagnostics().size());
        return DocumentCompiler.compile(document, configuration);
    }

    public CompileResult compile(Document document) {
        return DocumentCompiler.compile(Objects.requireNonNull(document, "document"), configuration);
    }

    public String compileToJson(String source) {
        return compile(source).toPrettyJson();
    }

    private static Set<String> verbatimTypes(CompileConfiguration configuration) {
        Set<String> types = new LinkedHashSet<>();
        for (Kit kit : configuration.kits().values()) {
            for (BlockDefinition block : kit.blocks()) {
                if (block.verbatim()) {
                    types.add(kit.name() + "/" + block.name());
                }
            }
        }
        return types;
    }
}
