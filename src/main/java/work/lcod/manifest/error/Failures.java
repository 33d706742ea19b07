package work.lcod.manifest.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for failures that travel through {@link java.util.concurrent.CompletableFuture} chains.
 */
public final class Failures {
    private Failures() {}

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Unwraps {@code error} and converts anything that is not already a {@link ResolutionException}
     * into a {@link LoadException} for {@code locator}.
     */
    public static ResolutionException asResolutionException(Throwable error, String locator) {
        Throwable cause = unwrap(error);
        if (cause instanceof ResolutionException resolution) {
            return resolution;
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new LoadException(locator, "Failed to load " + locator + ": " + message, cause);
    }
}
