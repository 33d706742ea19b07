package work.lcod.manifest.error;

import java.util.Locale;

/**
 * Categories of resolution failures reported to callers.
 */
public enum ErrorKind {
    STRUCTURAL,
    CIRCULAR_REFERENCE,
    MISSING_REFERENCE,
    VERSION_MISMATCH,
    LOAD;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
