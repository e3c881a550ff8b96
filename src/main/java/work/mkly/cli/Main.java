package work.mkly.cli;

import picocli.CommandLine;

/**
 * Launches the {@code mkly} command; the jar manifest points here.
 */
public final class Main {
    private Main() {}

    /** The configured {@code mkly} command line, shared by the launcher and tests. */
    static CommandLine commandLine() {
        return new CommandLine(new MklyCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
