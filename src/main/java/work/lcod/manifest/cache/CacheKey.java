package work.lcod.manifest.cache;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies one cached resolution.
 *
 * @param locator     canonical locator, or {@code inline:<sha256>} for manifests supplied in memory
 * @param fingerprint digest of the resolution options that influence the result
 * @param stage       how far the manifest was resolved
 */
public record CacheKey(String locator, String fingerprint, Stage stage) {
    public CacheKey {
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(stage, "stage");
    }

    public enum Stage {
        /** Template chain merged, nothing expanded; what a descendant template builds upon. */
        MERGED,
        /** Fully resolved and ready for emitters. */
        RESOLVED
    }

    @Override
    public String toString() {
        return locator + "#" + stage.name().toLowerCase(Locale.ROOT) + "@" + fingerprint;
    }
}
