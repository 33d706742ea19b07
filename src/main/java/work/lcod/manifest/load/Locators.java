package work.lcod.manifest.load;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Canonical form of manifest locators. Remote locators are normalized URLs; local locators are
 * normalized paths using {@code /}, either absolute or relative to the resolver base directory.
 * References found inside a manifest are resolved against the locator of that manifest.
 */
public final class Locators {
    private Locators() {}

    public static boolean isRemote(String locator) {
        if (locator == null) {
            return false;
        }
        String lower = locator.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    public static String canonical(String locator) {
        return resolve(locator, null);
    }

    /**
     * @param reference locator as written in a manifest
     * @param parent    canonical locator of the manifest holding the reference, or {@code null} for top-level requests
     */
    public static String resolve(String reference, String parent) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Locator must not be blank");
        }
        String trimmed = reference.trim();
        if (isRemote(trimmed)) {
            return normalizeUri(trimmed);
        }
        if (parent != null && isRemote(parent)) {
            try {
                return new URI(parent).resolve(new URI(null, null, trimmed, null)).normalize().toString();
            } catch (URISyntaxException ex) {
                throw new IllegalArgumentException("Invalid locator '" + trimmed + "' relative to " + parent, ex);
            }
        }
        Path path = Path.of(trimmed);
        if (!path.isAbsolute() && parent != null) {
            Path parentDir = Path.of(parent).getParent();
            if (parentDir != null) {
                path = parentDir.resolve(path);
            }
        }
        String normalized = path.normalize().toString().replace('\\', '/');
        return normalized.isEmpty() ? trimmed : normalized;
    }

    private static String normalizeUri(String raw) {
        try {
            return new URI(raw).normalize().toString();
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid manifest URL: " + raw, ex);
        }
    }
}
