package work.lcod.manifest.cli;

import picocli.CommandLine;
import work.lcod.manifest.error.Failures;
import work.lcod.manifest.error.ResolutionException;

/**
 * Reports exceptions escaping a subcommand in the same {@code kind: message} form as failed
 * resolutions, and maps them to the exit codes documented on {@link Main}.
 */
final class ResolutionErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String CONFIGURATION = "configuration";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable cause = Failures.unwrap(ex);
        int exitCode;
        String line;
        if (cause instanceof ResolutionException resolution) {
            line = describe(resolution.kind().code(), resolution.getMessage());
            exitCode = Main.EXIT_RESOLUTION_FAILURE;
        } else if (cause instanceof IllegalArgumentException) {
            line = describe(CONFIGURATION, cause.getMessage());
            exitCode = Main.EXIT_CONFIGURATION;
        } else {
            line = describe("error", cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
            exitCode = commandLine.getCommandSpec().exitCodeOnExecutionException();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(line));
        if (Boolean.getBoolean("manifest.debug")) {
            cause.printStackTrace(commandLine.getErr());
        }
        return exitCode;
    }

    static String describe(String kind, String message) {
        return kind + ": " + message;
    }
}
