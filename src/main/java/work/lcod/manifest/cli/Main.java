package work.lcod.manifest.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 * <p>
 * Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_RESOLUTION_FAILURE} when a manifest fails to
 * resolve, {@value #EXIT_USAGE} for invalid arguments and {@value #EXIT_CONFIGURATION} when the
 * configuration file is missing or invalid.
 */
public final class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_RESOLUTION_FAILURE = 1;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;
    static final int EXIT_CONFIGURATION = 3;

    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new ManifestResolveCommand())
            .setExecutionExceptionHandler(new ResolutionErrorHandler());
    }
}
