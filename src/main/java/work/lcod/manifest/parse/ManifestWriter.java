package work.lcod.manifest.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.manifest.model.ImportDeclaration;
import work.lcod.manifest.model.ImportType;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ManifestMetadata;
import work.lcod.manifest.model.Node;
import work.lcod.manifest.model.PropertyBag;
import work.lcod.manifest.model.ResolvedModule;
import work.lcod.manifest.model.StyleEntry;
import work.lcod.manifest.model.TemplateSlot;
import work.lcod.manifest.model.Values;

/**
 * Turns a {@link Manifest} back into plain maps/lists in the authoring shape, and into JSON or YAML text.
 * Output of {@link #toMap(Manifest)} parses back to an equivalent manifest.
 */
public final class ManifestWriter {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    );

    private ManifestWriter() {}

    public static String toJson(Manifest manifest) {
        try {
            return JSON_WRITER.writeValueAsString(toMap(manifest));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize manifest: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String toYaml(Manifest manifest) {
        try {
            return YAML_MAPPER.writeValueAsString(toMap(manifest));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize manifest: " + ex.getOriginalMessage(), ex);
        }
    }

    public static Map<String, Object> toMap(Manifest manifest) {
        var document = new LinkedHashMap<String, Object>();
        document.put(ManifestParser.METADATA, metadataMap(manifest.metadata()));
        if (!manifest.styles().isEmpty()) {
            var styles = new LinkedHashMap<String, Object>();
            manifest.styles().forEach((name, entry) -> styles.put(name, styleValue(entry)));
            document.put(ManifestParser.STYLES, styles);
        }
        if (manifest.structure() != null) {
            document.put(ManifestParser.STRUCTURE, nodeMap(manifest.structure()));
        }
        if (!manifest.modules().isEmpty()) {
            var modules = new ArrayList<Object>();
            for (var module : manifest.modules()) {
                var fields = new LinkedHashMap<String, Object>();
                fields.put("alias", module.alias());
                fields.put("url", module.locator());
                if (module.version() != null) {
                    fields.put("version", module.version());
                }
                if (module.optional()) {
                    fields.put("optional", true);
                }
                modules.add(fields);
            }
            document.put(ManifestParser.MODULES, modules);
        }
        if (!manifest.imports().isEmpty()) {
            document.put(ManifestParser.IMPORTS, importsMap(manifest.imports()));
        }
        if (!manifest.templateSlots().isEmpty()) {
            var slots = new LinkedHashMap<String, Object>();
            manifest.templateSlots().forEach((name, slot) -> slots.put(name, slotMap(slot)));
            document.put(ManifestParser.TEMPLATE_SLOTS, slots);
        }
        if (!manifest.exports().isEmpty()) {
            var exports = new LinkedHashMap<String, Object>();
            manifest.exports().forEach((name, node) -> exports.put(name, nodeMap(node)));
            document.put(ManifestParser.EXPORTS, exports);
        }
        if (!manifest.resolvedModules().isEmpty()) {
            var resolved = new LinkedHashMap<String, Object>();
            manifest.resolvedModules().forEach((alias, module) -> resolved.put(alias, resolvedModuleMap(module)));
            document.put(ManifestParser.RESOLVED_MODULES, resolved);
        }
        manifest.extras().forEach((key, value) -> document.put(key, Values.thaw(value)));
        return document;
    }

    public static Map<String, Object> nodeMap(Node node) {
        var props = new LinkedHashMap<String, Object>();
        PropertyBag bag = node.props();
        for (var entry : bag.attributes().entrySet()) {
            props.put(entry.getKey(), Values.thaw(entry.getValue()));
        }
        if (bag.module() != null) {
            props.put(PropertyBag.MODULE, bag.module());
        }
        if (bag.text() != null) {
            props.put(PropertyBag.TEXT, bag.text());
        }
        if (!bag.children().isEmpty()) {
            if (bag.singleChild()) {
                props.put(PropertyBag.CHILDREN, nodeMap(bag.children().get(0)));
            } else {
                var children = new ArrayList<Object>(bag.children().size());
                for (var child : bag.children()) {
                    children.add(nodeMap(child));
                }
                props.put(PropertyBag.CHILDREN, children);
            }
        }
        var wrapper = new LinkedHashMap<String, Object>();
        wrapper.put(node.tag(), props);
        return wrapper;
    }

    private static Map<String, Object> metadataMap(ManifestMetadata metadata) {
        var map = new LinkedHashMap<String, Object>();
        if (metadata.title() != null) {
            map.put("title", metadata.title());
        }
        if (metadata.description() != null) {
            map.put("description", metadata.description());
        }
        if (metadata.version() != null) {
            map.put("version", metadata.version());
        }
        if (metadata.extendsLocator() != null) {
            map.put("extends", metadata.extendsLocator());
        }
        if (metadata.inheritance() != null) {
            var policy = new LinkedHashMap<String, Object>();
            policy.put("mergeStyles", metadata.inheritance().mergeStyles());
            policy.put("overrideStructure", metadata.inheritance().overrideStructure());
            policy.put("preserveSlots", new ArrayList<>(metadata.inheritance().preserveSlots()));
            map.put(ManifestParser.INHERITANCE, policy);
        }
        metadata.attributes().forEach((key, value) -> map.put(key, Values.thaw(value)));
        return map;
    }

    private static Object styleValue(StyleEntry entry) {
        if (entry.isDeclaration()) {
            return entry.declaration();
        }
        var map = new LinkedHashMap<String, Object>();
        if (entry.hasParent()) {
            map.put(StyleEntry.EXTENDS, entry.parent());
        }
        entry.properties().forEach((key, value) -> map.put(key, Values.thaw(value)));
        return map;
    }

    private static Map<String, Object> importsMap(List<ImportDeclaration> imports) {
        var grouped = new LinkedHashMap<String, Object>();
        for (var declaration : imports) {
            if (declaration.type() == ImportType.MODULE_FOR_SLOT) {
                @SuppressWarnings("unchecked")
                var slots = (Map<String, Object>) grouped.computeIfAbsent(
                    ImportType.MODULE_FOR_SLOT.sectionKey(),
                    key -> new LinkedHashMap<String, Object>()
                );
                var fields = new LinkedHashMap<String, Object>();
                if (declaration.locator() != null) {
                    fields.put("url", declaration.locator());
                }
                if (declaration.optional()) {
                    fields.put("optional", true);
                }
                if (declaration.content() != null) {
                    fields.put("content", nodeMap(declaration.content()));
                }
                slots.put(declaration.slot(), fields);
            } else {
                @SuppressWarnings("unchecked")
                var locators = (List<Object>) grouped.computeIfAbsent(
                    declaration.type().sectionKey(),
                    key -> new ArrayList<Object>()
                );
                locators.add(declaration.locator());
            }
        }
        return grouped;
    }

    private static Map<String, Object> slotMap(TemplateSlot slot) {
        var map = new LinkedHashMap<String, Object>();
        map.put("target", slot.target());
        map.put("required", slot.required());
        if (slot.defaultContent() != null) {
            map.put("default", nodeMap(slot.defaultContent()));
        }
        return map;
    }

    private static Map<String, Object> resolvedModuleMap(ResolvedModule module) {
        var map = new LinkedHashMap<String, Object>();
        map.put("url", module.locator());
        map.put("state", module.state().name().toLowerCase(Locale.ROOT));
        map.put("version", module.descriptor().version() == null ? "latest" : module.descriptor().version());
        if (module.manifest() != null) {
            map.put("resolvedVersion", module.manifest().versionOrDefault());
            map.put("exports", new ArrayList<>(module.exports().keySet()));
        }
        if (module.failure() != null) {
            map.put("error", module.failure());
        }
        return map;
    }
}
