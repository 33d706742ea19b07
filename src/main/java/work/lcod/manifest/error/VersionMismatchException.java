package work.lcod.manifest.error;

public final class VersionMismatchException extends ResolutionException {
    public VersionMismatchException(String reference, String required, String actual) {
        super(
            ErrorKind.VERSION_MISMATCH,
            reference,
            "Version mismatch for " + reference + ": required " + required + ", got " + actual
        );
    }
}
