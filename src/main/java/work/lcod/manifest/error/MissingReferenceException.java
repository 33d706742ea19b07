package work.lcod.manifest.error;

/**
 * A style, module alias, slot placeholder or template ancestor could not be found.
 */
public final class MissingReferenceException extends ResolutionException {
    public MissingReferenceException(String reference, String message) {
        super(ErrorKind.MISSING_REFERENCE, reference, message);
    }
}
