package work.lcod.manifest.resolve;

import java.util.ArrayList;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.load.Locators;
import work.lcod.manifest.model.ImportDeclaration;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ManifestMetadata;
import work.lcod.manifest.model.ModuleDescriptor;

/**
 * Rewrites every locator a freshly parsed manifest mentions into canonical form, relative to the
 * manifest's own locator. After this pass references stay valid when merged into other manifests.
 */
final class ReferenceCanonicalizer {
    private ReferenceCanonicalizer() {}

    /**
     * @param source name used in error reports
     * @param parent canonical locator of {@code manifest}, or {@code null} when it was supplied inline
     * @throws StructuralException when a locator is blank or malformed
     */
    static Manifest canonicalize(Manifest manifest, String source, String parent) {
        var builder = manifest.toBuilder();
        ManifestMetadata metadata = manifest.metadata();
        if (metadata.hasAncestor()) {
            builder.metadata(new ManifestMetadata(
                metadata.title(),
                metadata.description(),
                metadata.version(),
                resolve(metadata.extendsLocator(), source, parent),
                metadata.inheritance(),
                metadata.attributes()
            ));
        }
        var modules = new ArrayList<ModuleDescriptor>(manifest.modules().size());
        for (var module : manifest.modules()) {
            modules.add(new ModuleDescriptor(
                module.alias(),
                resolve(module.locator(), source, parent),
                module.version(),
                module.optional()
            ));
        }
        builder.modules(modules);
        var imports = new ArrayList<ImportDeclaration>(manifest.imports().size());
        for (var declaration : manifest.imports()) {
            imports.add(declaration.locator() == null
                ? declaration
                : declaration.withLocator(resolve(declaration.locator(), source, parent)));
        }
        builder.imports(imports);
        return builder.build();
    }

    private static String resolve(String locator, String source, String parent) {
        try {
            return Locators.resolve(locator, parent);
        } catch (IllegalArgumentException ex) {
            throw new StructuralException(source, "Invalid manifest " + source + ": " + ex.getMessage(), ex);
        }
    }
}
