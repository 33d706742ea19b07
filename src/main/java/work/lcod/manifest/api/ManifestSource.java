package work.lcod.manifest.api;

import java.util.Objects;
import java.util.Optional;
import work.lcod.manifest.model.Manifest;

/**
 * What to resolve: a locator (local path or URL), manifest text, or an in-memory manifest.
 *
 * @param name display name of inline text, used in error messages
 */
public record ManifestSource(Optional<String> locator, Optional<String> text, Optional<Manifest> manifest, String name) {
    public ManifestSource {
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(manifest, "manifest");
        int present = (locator.isPresent() ? 1 : 0) + (text.isPresent() ? 1 : 0) + (manifest.isPresent() ? 1 : 0);
        if (present != 1) {
            throw new IllegalArgumentException("Exactly one of locator, text or manifest must be present.");
        }
        name = name == null ? "inline" : name;
    }

    public static ManifestSource forLocator(String locator) {
        return new ManifestSource(Optional.of(locator), Optional.empty(), Optional.empty(), locator);
    }

    public static ManifestSource forText(String name, String text) {
        return new ManifestSource(Optional.empty(), Optional.of(text), Optional.empty(), name);
    }

    public static ManifestSource forManifest(Manifest manifest) {
        return new ManifestSource(Optional.empty(), Optional.empty(), Optional.of(manifest), "inline");
    }

    public String display() {
        return locator.orElse(name);
    }
}
