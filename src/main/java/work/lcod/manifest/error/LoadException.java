package work.lcod.manifest.error;

/**
 * The reference loader could not fetch a locator.
 */
public final class LoadException extends ResolutionException {
    public LoadException(String locator, String message) {
        super(ErrorKind.LOAD, locator, message);
    }

    public LoadException(String locator, String message, Throwable cause) {
        super(ErrorKind.LOAD, locator, message, cause);
    }
}
