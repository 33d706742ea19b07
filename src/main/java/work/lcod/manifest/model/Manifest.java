package work.lcod.manifest.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory manifest. Instances are immutable; pipeline stages derive new manifests through the
 * {@code with*} methods or {@link #toBuilder()}, so cached ancestors are never modified.
 *
 * @param exports         components a module offers to importers, keyed by tag/component name
 * @param resolvedModules module table produced by resolution (empty on parsed manifests)
 * @param extras          top-level sections the resolver does not interpret (e.g. {@code interactions})
 */
public record Manifest(
    ManifestMetadata metadata,
    Map<String, StyleEntry> styles,
    Node structure,
    List<ModuleDescriptor> modules,
    List<ImportDeclaration> imports,
    Map<String, TemplateSlot> templateSlots,
    Map<String, Node> exports,
    Map<String, ResolvedModule> resolvedModules,
    Map<String, Object> extras
) {
    public Manifest {
        metadata = metadata == null ? ManifestMetadata.EMPTY : metadata;
        styles = Values.freezeOrdered(styles);
        modules = Values.freezeList(modules);
        imports = Values.freezeList(imports);
        templateSlots = Values.freezeOrdered(templateSlots);
        exports = Values.freezeOrdered(exports);
        resolvedModules = Values.freezeOrdered(resolvedModules);
        extras = Values.freezeMap(extras);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .metadata(metadata)
            .styles(styles)
            .structure(structure)
            .modules(modules)
            .imports(imports)
            .templateSlots(templateSlots)
            .exports(exports)
            .resolvedModules(resolvedModules)
            .extras(extras);
    }

    public String versionOrDefault() {
        return metadata.version() == null ? "1.0.0" : metadata.version();
    }

    public static final class Builder {
        private ManifestMetadata metadata = ManifestMetadata.EMPTY;
        private Map<String, StyleEntry> styles = new LinkedHashMap<>();
        private Node structure;
        private List<ModuleDescriptor> modules = new ArrayList<>();
        private List<ImportDeclaration> imports = new ArrayList<>();
        private Map<String, TemplateSlot> templateSlots = new LinkedHashMap<>();
        private Map<String, Node> exports = new LinkedHashMap<>();
        private Map<String, ResolvedModule> resolvedModules = new LinkedHashMap<>();
        private Map<String, Object> extras = new LinkedHashMap<>();

        public Builder metadata(ManifestMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder styles(Map<String, StyleEntry> styles) {
            this.styles = new LinkedHashMap<>(styles);
            return this;
        }

        public Builder style(String name, StyleEntry entry) {
            this.styles.put(name, entry);
            return this;
        }

        public Builder structure(Node structure) {
            this.structure = structure;
            return this;
        }

        public Builder modules(List<ModuleDescriptor> modules) {
            this.modules = new ArrayList<>(modules);
            return this;
        }

        public Builder imports(List<ImportDeclaration> imports) {
            this.imports = new ArrayList<>(imports);
            return this;
        }

        public Builder templateSlots(Map<String, TemplateSlot> templateSlots) {
            this.templateSlots = new LinkedHashMap<>(templateSlots);
            return this;
        }

        public Builder exports(Map<String, Node> exports) {
            this.exports = new LinkedHashMap<>(exports);
            return this;
        }

        public Builder resolvedModules(Map<String, ResolvedModule> resolvedModules) {
            this.resolvedModules = new LinkedHashMap<>(resolvedModules);
            return this;
        }

        public Builder extras(Map<String, Object> extras) {
            this.extras = new LinkedHashMap<>(extras);
            return this;
        }

        public Manifest build() {
            return new Manifest(
                metadata,
                styles,
                structure,
                modules,
                imports,
                templateSlots,
                exports,
                resolvedModules,
                extras
            );
        }
    }
}
