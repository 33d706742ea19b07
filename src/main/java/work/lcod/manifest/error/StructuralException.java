package work.lcod.manifest.error;

/**
 * The manifest is not a well-formed object, exceeds the depth limit, or declares an unsupported version.
 */
public final class StructuralException extends ResolutionException {
    public StructuralException(String reference, String message) {
        super(ErrorKind.STRUCTURAL, reference, message);
    }

    public StructuralException(String reference, String message, Throwable cause) {
        super(ErrorKind.STRUCTURAL, reference, message, cause);
    }
}
