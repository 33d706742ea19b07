package work.lcod.manifest.emit;

import java.util.Locale;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.model.Manifest;

/**
 * Turns a fully resolved manifest into target text. Implementations only print; they never resolve.
 */
public interface ManifestEmitter {
    /**
     * Short format name, e.g. {@code json}.
     */
    String format();

    EmittedFile emit(Manifest resolved);

    /**
     * @throws StructuralException when {@code manifest} still names a template ancestor
     */
    static void requireResolved(Manifest manifest) {
        if (manifest.metadata().hasAncestor()) {
            throw new StructuralException(
                manifest.metadata().extendsLocator(),
                "Manifest still extends " + manifest.metadata().extendsLocator() + "; resolve it before emitting"
            );
        }
    }

    /**
     * File name stem derived from the manifest title, {@code manifest} when untitled.
     */
    static String baseName(Manifest manifest) {
        String title = manifest.metadata().title();
        if (title == null || title.isBlank()) {
            return "manifest";
        }
        String slug = title.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "manifest" : slug;
    }
}
