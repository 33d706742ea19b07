package work.lcod.manifest.tooling;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import work.lcod.manifest.model.ImportDeclaration;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ManifestMetadata;
import work.lcod.manifest.model.Node;
import work.lcod.manifest.model.PropertyBag;
import work.lcod.manifest.model.StyleEntry;

/**
 * Combines several resolved manifests into one page. Styles and map-valued extra sections (such as
 * {@code interactions}) are prefixed with {@code <name>-}; structures become the children of a root
 * {@code div}; stylesheet, script and font imports are concatenated without duplicates.
 */
public final class ManifestBundler {
    public static final String BUNDLE_VERSION = "2.0";

    /**
     * @param manifests resolved manifests keyed by the name used as prefix, in bundle order
     */
    public Manifest bundle(String bundleName, Map<String, Manifest> manifests) {
        if (manifests.isEmpty()) {
            throw new IllegalArgumentException("Nothing to bundle");
        }
        String name = bundleName == null || bundleName.isBlank() ? "bundled-manifest" : bundleName;

        var styles = new LinkedHashMap<String, StyleEntry>();
        var children = new ArrayList<Node>();
        var extras = new LinkedHashMap<String, Object>();
        var imports = new LinkedHashSet<ImportDeclaration>();
        manifests.forEach((prefix, manifest) -> {
            manifest.styles().forEach((style, entry) -> styles.put(prefix + "-" + style, entry));
            if (manifest.structure() != null) {
                children.add(manifest.structure());
            }
            manifest.extras().forEach((section, value) -> {
                if (value instanceof Map<?, ?> entries) {
                    @SuppressWarnings("unchecked")
                    var merged = (Map<String, Object>) extras.computeIfAbsent(section, key -> new LinkedHashMap<String, Object>());
                    entries.forEach((key, item) -> merged.put(prefix + "-" + key, item));
                }
            });
            for (var declaration : manifest.imports()) {
                if (!declaration.isSlotImport()) {
                    imports.add(declaration);
                }
            }
        });

        var attributes = new LinkedHashMap<String, Object>();
        attributes.put("name", name);
        attributes.put("bundledFrom", List.copyOf(manifests.keySet()));
        var metadata = new ManifestMetadata(
            name,
            "Bundled from multiple manifests",
            BUNDLE_VERSION,
            null,
            null,
            attributes
        );
        var root = new Node("div", PropertyBag.empty().withChildren(children, false));
        return Manifest.builder()
            .metadata(metadata)
            .styles(styles)
            .structure(root)
            .imports(new ArrayList<>(imports))
            .extras(extras)
            .build();
    }
}
