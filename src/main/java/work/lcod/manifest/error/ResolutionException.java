package work.lcod.manifest.error;

/**
 * Base failure of a manifest resolution. Carries the error kind and the reference
 * (locator, alias, style or slot name) that caused it.
 */
public class ResolutionException extends RuntimeException {
    private final ErrorKind kind;
    private final String reference;

    protected ResolutionException(ErrorKind kind, String reference, String message) {
        super(message);
        this.kind = kind;
        this.reference = reference;
    }

    protected ResolutionException(ErrorKind kind, String reference, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.reference = reference;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String reference() {
        return reference;
    }
}
