package work.mkly.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.mkly.api.CompileConfiguration;
import work.mkly.api.CompileResult;
import work.mkly.api.LogLevel;
import work.mkly.api.MklyCompiler;
import work.mkly.config.MklyConfig;
import work.mkly.kit.KitManifestLoader;
import work.mkly.parse.Diagnostic;

@CommandLine.Command(
    name = "mkly",
    description = "Compile mkly markup to HTML with layered CSS.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class MklyCommand implements Callable<Integer> {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "SOURCE|-",
        description = "Source file; use '-' to read from stdin."
    )
    private String source;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "Write the result to FILE instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(
        names = "--json",
        description = "Print the JSON projection (html, diagnostics, source map, style) instead of HTML."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--source-map",
        description = "Annotate rendered blocks with source lines and emit the source map."
    )
    private boolean sourceMap;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "Project configuration (default: ./mkly.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--kit",
        paramLabel = "FILE",
        description = "Additional kit manifest (repeatable)."
    )
    private List<Path> kits = new ArrayList<>();

    @CommandLine.Option(
        names = "--var",
        paramLabel = "KEY=VALUE",
        description = "Variable override (repeatable); wins over the document and the config file."
    )
    private Map<String, String> variables = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        // must run before the first logger is created
        System.setProperty(LOG_LEVEL_PROPERTY, LogLevel.from(logLevelRaw).simpleLoggerName());

        String text = readSource();
        CompileConfiguration.Builder builder = loadConfig().applyTo(CompileConfiguration.builder());
        for (Path kit : kits) {
            builder.kit(KitManifestLoader.load(kit.toAbsolutePath().normalize()));
        }
        if (sourceMap) {
            builder.sourceMap(true);
        }
        builder.variables(variables);

        CompileResult result = new MklyCompiler(builder.build()).compile(text);
        PrintWriter err = spec.commandLine().getErr();
        for (Diagnostic diagnostic : result.diagnostics()) {
            err.println(diagnostic);
        }
        err.flush();

        String rendered = json ? result.toPrettyJson() : result.html();
        if (output != null) {
            Path target = output.toAbsolutePath().normalize();
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, rendered + System.lineSeparator(), StandardCharsets.UTF_8);
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.println(rendered);
            out.flush();
        }
        return result.exitCode();
    }

    private String readSource() throws IOException {
        if ("-".equals(source)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(source).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Source file not found: " + path);
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private MklyConfig loadConfig() {
        if (config != null) {
            Path path = config.toAbsolutePath().normalize();
            if (!Files.isRegularFile(path)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + path);
            }
            return MklyConfig.load(path);
        }
        return MklyConfig.load(Paths.get(MklyConfig.FILE_NAME).toAbsolutePath());
    }
}
