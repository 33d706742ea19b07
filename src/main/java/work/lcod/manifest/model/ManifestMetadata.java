package work.lcod.manifest.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Manifest header. Known fields are typed; any other metadata key lands in {@code attributes}.
 *
 * @param extendsLocator locator of the template ancestor, or {@code null}
 * @param inheritance    merge policy applied when this manifest is merged onto its ancestor, or {@code null}
 */
public record ManifestMetadata(
    String title,
    String description,
    String version,
    String extendsLocator,
    InheritancePolicy inheritance,
    Map<String, Object> attributes
) {
    public static final ManifestMetadata EMPTY = new ManifestMetadata(null, null, null, null, null, Map.of());

    public ManifestMetadata {
        attributes = Values.freezeMap(attributes);
    }

    public InheritancePolicy policy() {
        return inheritance == null ? InheritancePolicy.DEFAULT : inheritance;
    }

    public boolean hasAncestor() {
        return extendsLocator != null && !extendsLocator.isBlank();
    }

    public ManifestMetadata withoutAncestor() {
        return new ManifestMetadata(title, description, version, null, null, attributes);
    }

    /**
     * Shallow field-by-field overlay: non-null child fields win. The child's {@code extends} is dropped
     * because the ancestor it points to has been merged in.
     */
    public ManifestMetadata overlay(ManifestMetadata child) {
        var mergedAttributes = new LinkedHashMap<>(attributes);
        mergedAttributes.putAll(child.attributes());
        return new ManifestMetadata(
            child.title() != null ? child.title() : title,
            child.description() != null ? child.description() : description,
            child.version() != null ? child.version() : version,
            null,
            null,
            mergedAttributes
        );
    }
}
