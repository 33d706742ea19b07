package work.lcod.manifest.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.model.ImportDeclaration;
import work.lcod.manifest.model.ImportType;
import work.lcod.manifest.model.InheritancePolicy;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ManifestMetadata;
import work.lcod.manifest.model.ModuleDescriptor;
import work.lcod.manifest.model.Node;
import work.lcod.manifest.model.PropertyBag;
import work.lcod.manifest.model.StyleEntry;
import work.lcod.manifest.model.TemplateSlot;
import work.lcod.manifest.shared.SemanticVersion;

/**
 * Parses manifest text (YAML or JSON) or an already-decoded map into a {@link Manifest}.
 * Only structure is validated here: well-formed sections, supported version tag and tree depth.
 */
public final class ManifestParser {
    static final String METADATA = "metadata";
    static final String LEGACY_METADATA = "manifest";
    static final String STYLES = "styles";
    static final String STRUCTURE = "structure";
    static final String MODULES = "modules";
    static final String IMPORTS = "imports";
    static final String TEMPLATE_SLOTS = "templateSlots";
    static final String EXPORTS = "exports";
    static final String RESOLVED_MODULES = "resolvedModules";
    static final String INHERITANCE = "inheritance";
    static final Set<String> SECTIONS = Set.of(
        METADATA, LEGACY_METADATA, STYLES, STRUCTURE, MODULES, IMPORTS, TEMPLATE_SLOTS, EXPORTS, RESOLVED_MODULES
    );

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final List<String> supportedVersions;
    private final int maxDepth;

    public ManifestParser(List<String> supportedVersions, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.supportedVersions = List.copyOf(supportedVersions);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public Manifest parse(String source, String text) {
        if (text == null || text.isBlank()) {
            throw new StructuralException(source, "Invalid manifest " + source + ": document is empty");
        }
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new StructuralException(source, "Invalid manifest " + source + ": " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new StructuralException(source, "Invalid manifest " + source + ": must be an object");
        }
        return parse(source, asObject(source, convertNode(root), "document"));
    }

    public Manifest parse(String source, Map<String, Object> document) {
        if (document == null) {
            throw new StructuralException(source, "Invalid manifest " + source + ": must be an object");
        }
        var builder = Manifest.builder();
        var metadata = parseMetadata(source, document);
        checkVersion(source, metadata.version());
        builder.metadata(metadata);

        Object styles = document.get(STYLES);
        if (styles != null) {
            builder.styles(parseStyles(source, asObject(source, styles, STYLES)));
        }
        Object structure = document.get(STRUCTURE);
        if (structure != null) {
            builder.structure(parseRootNode(source, structure, STRUCTURE));
        }
        Object modules = document.get(MODULES);
        if (modules != null) {
            builder.modules(parseModules(source, modules));
        }
        Object imports = document.get(IMPORTS);
        if (imports != null) {
            builder.imports(parseImports(source, imports));
        }
        Object slots = document.get(TEMPLATE_SLOTS);
        if (slots != null) {
            builder.templateSlots(parseSlots(source, asObject(source, slots, TEMPLATE_SLOTS)));
        }
        Object exports = document.get(EXPORTS);
        if (exports != null) {
            var parsed = new LinkedHashMap<String, Node>();
            for (var entry : asObject(source, exports, EXPORTS).entrySet()) {
                parsed.put(entry.getKey(), parseRootNode(source, entry.getValue(), EXPORTS + "." + entry.getKey()));
            }
            builder.exports(parsed);
        }

        var extras = new LinkedHashMap<String, Object>();
        for (var entry : document.entrySet()) {
            if (!SECTIONS.contains(entry.getKey())) {
                extras.put(entry.getKey(), entry.getValue());
            }
        }
        builder.extras(extras);
        return builder.build();
    }

    /**
     * Supported tags match on major.minor: with {@code 2.0} supported, {@code 2.0.3} is accepted and {@code 2.1} is not.
     */
    public boolean isVersionSupported(String version) {
        if (version == null) {
            return true;
        }
        SemanticVersion parsed;
        try {
            parsed = SemanticVersion.parse(version);
        } catch (IllegalArgumentException ex) {
            return false;
        }
        for (String supported : supportedVersions) {
            var candidate = SemanticVersion.parse(supported);
            if (candidate.major() == parsed.major() && candidate.minor() == parsed.minor()) {
                return true;
            }
        }
        return false;
    }

    private void checkVersion(String source, String version) {
        if (!isVersionSupported(version)) {
            throw new StructuralException(source, "Unsupported manifest version: " + version + " in " + source);
        }
    }

    private ManifestMetadata parseMetadata(String source, Map<String, Object> document) {
        Object raw = document.containsKey(METADATA) ? document.get(METADATA) : document.get(LEGACY_METADATA);
        if (raw == null) {
            return ManifestMetadata.EMPTY;
        }
        var section = new LinkedHashMap<>(asObject(source, raw, METADATA));
        String title = asText(section.remove("title"));
        String description = asText(section.remove("description"));
        String version = asText(section.remove("version"));
        String extendsLocator = asText(section.remove("extends"));

        InheritancePolicy policy = null;
        Object inheritance = section.remove(INHERITANCE);
        Map<String, Object> policySource = inheritance == null
            ? new LinkedHashMap<>()
            : new LinkedHashMap<>(asObject(source, inheritance, METADATA + "." + INHERITANCE));
        for (String key : List.of("mergeStyles", "overrideStructure", "preserveSlots")) {
            if (section.containsKey(key)) {
                policySource.putIfAbsent(key, section.remove(key));
            }
        }
        if (!policySource.isEmpty()) {
            policy = new InheritancePolicy(
                asBoolean(policySource.get("mergeStyles"), true),
                asBoolean(policySource.get("overrideStructure"), false),
                asStringList(source, policySource.get("preserveSlots"), "preserveSlots")
            );
        }
        return new ManifestMetadata(title, description, version, extendsLocator, policy, section);
    }

    private Map<String, StyleEntry> parseStyles(String source, Map<String, Object> section) {
        var styles = new LinkedHashMap<String, StyleEntry>();
        for (var entry : section.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String css) {
                styles.put(entry.getKey(), StyleEntry.declaration(css));
                continue;
            }
            var properties = new LinkedHashMap<>(asObject(source, value, STYLES + "." + entry.getKey()));
            String parent = asText(properties.remove(StyleEntry.EXTENDS));
            styles.put(entry.getKey(), StyleEntry.extending(parent, properties));
        }
        return styles;
    }

    private Node parseRootNode(String source, Object raw, String path) {
        var object = asObject(source, raw, path);
        if (object.size() != 1) {
            throw new StructuralException(
                source,
                "Invalid manifest " + source + ": " + path + " must be a single-key node, found " + object.keySet()
            );
        }
        var entry = object.entrySet().iterator().next();
        return parseNode(source, entry.getKey(), entry.getValue(), path + "." + entry.getKey(), 1);
    }

    private Node parseNode(String source, String tag, Object raw, String path, int depth) {
        if (depth > maxDepth) {
            throw new StructuralException(
                source,
                "Structure of " + source + " exceeds the maximum depth of " + maxDepth + " at " + path
            );
        }
        if (tag == null || tag.isBlank()) {
            throw new StructuralException(source, "Invalid manifest " + source + ": empty tag at " + path);
        }
        if (raw == null) {
            return Node.of(tag);
        }
        if (!(raw instanceof Map<?, ?>)) {
            if (raw instanceof List<?>) {
                throw new StructuralException(source, "Invalid manifest " + source + ": node " + path + " must be an object");
            }
            return new Node(tag, PropertyBag.empty().withText(String.valueOf(raw)));
        }
        var props = new LinkedHashMap<>(asObject(source, raw, path));
        String text = asText(props.remove(PropertyBag.TEXT));
        String module = asText(props.remove(PropertyBag.MODULE));
        Object rawChildren = props.remove(PropertyBag.CHILDREN);

        List<Node> children = new ArrayList<>();
        boolean single = false;
        if (rawChildren instanceof List<?> list) {
            int index = 0;
            for (var item : list) {
                children.add(parseChild(source, item, path + ".children[" + index + "]", depth + 1));
                index++;
            }
        } else if (rawChildren != null) {
            children.add(parseChild(source, rawChildren, path + ".children", depth + 1));
            single = true;
        }
        return new Node(tag, new PropertyBag(text, children, single, module, props));
    }

    private Node parseChild(String source, Object raw, String path, int depth) {
        if (raw instanceof String text) {
            // bare strings inside a children list are text runs
            return new Node("span", PropertyBag.empty().withText(text));
        }
        var object = asObject(source, raw, path);
        if (object.size() != 1) {
            throw new StructuralException(
                source,
                "Invalid manifest " + source + ": child " + path + " must be a single-key node, found " + object.keySet()
            );
        }
        var entry = object.entrySet().iterator().next();
        return parseNode(source, entry.getKey(), entry.getValue(), path + "." + entry.getKey(), depth);
    }

    private List<ModuleDescriptor> parseModules(String source, Object raw) {
        var modules = new ArrayList<ModuleDescriptor>();
        if (raw instanceof Map<?, ?>) {
            for (var entry : asObject(source, raw, MODULES).entrySet()) {
                if (entry.getValue() instanceof String locator) {
                    modules.add(new ModuleDescriptor(entry.getKey(), locator, null, false));
                } else {
                    var fields = new LinkedHashMap<>(asObject(source, entry.getValue(), MODULES + "." + entry.getKey()));
                    fields.putIfAbsent("alias", entry.getKey());
                    modules.add(parseModule(source, fields, MODULES + "." + entry.getKey()));
                }
            }
        } else if (raw instanceof List<?> list) {
            int index = 0;
            for (var item : list) {
                modules.add(parseModule(source, asObject(source, item, MODULES + "[" + index + "]"), MODULES + "[" + index + "]"));
                index++;
            }
        } else {
            throw new StructuralException(source, "Invalid manifest " + source + ": modules must be a list");
        }
        var aliases = new HashSet<String>();
        for (var module : modules) {
            if (!aliases.add(module.alias())) {
                throw new StructuralException(source, "Duplicate module alias '" + module.alias() + "' in " + source);
            }
        }
        return modules;
    }

    private ModuleDescriptor parseModule(String source, Map<String, Object> fields, String path) {
        String alias = asText(fields.get("alias"));
        String locator = asText(fields.containsKey("url") ? fields.get("url") : fields.get("locator"));
        if (alias == null || alias.isBlank() || locator == null || locator.isBlank()) {
            throw new StructuralException(source, "Invalid manifest " + source + ": " + path + " needs alias and url");
        }
        String version = asText(fields.get("version"));
        if (version != null && ("latest".equalsIgnoreCase(version) || version.isBlank())) {
            version = null;
        }
        return new ModuleDescriptor(alias, locator, version, asBoolean(fields.get("optional"), false));
    }

    private List<ImportDeclaration> parseImports(String source, Object raw) {
        var imports = new ArrayList<ImportDeclaration>();
        if (raw instanceof List<?> list) {
            int index = 0;
            for (var item : list) {
                var fields = asObject(source, item, IMPORTS + "[" + index + "]");
                var type = ImportType.from(asText(fields.get("type")))
                    .orElseThrow(() -> new StructuralException(source, "Unknown import type in " + source + ": " + fields.get("type")));
                imports.add(parseImport(source, type, asText(fields.get("slot")), fields, IMPORTS));
                index++;
            }
            return imports;
        }
        for (var entry : asObject(source, raw, IMPORTS).entrySet()) {
            var type = ImportType.from(entry.getKey())
                .orElseThrow(() -> new StructuralException(source, "Unknown import type in " + source + ": " + entry.getKey()));
            String path = IMPORTS + "." + entry.getKey();
            if (type == ImportType.MODULE_FOR_SLOT) {
                for (var slot : asObject(source, entry.getValue(), path).entrySet()) {
                    Object value = slot.getValue();
                    Map<String, Object> fields = value instanceof String locator
                        ? Map.of("url", locator)
                        : asObject(source, value, path + "." + slot.getKey());
                    imports.add(parseImport(source, type, slot.getKey(), fields, path));
                }
            } else {
                for (String locator : asStringList(source, entry.getValue(), path)) {
                    imports.add(ImportDeclaration.asset(type, locator));
                }
            }
        }
        return imports;
    }

    private ImportDeclaration parseImport(String source, ImportType type, String slot, Map<String, Object> fields, String path) {
        String locator = asText(fields.containsKey("url") ? fields.get("url") : fields.get("locator"));
        Node content = fields.get("content") == null ? null : parseRootNode(source, fields.get("content"), path + ".content");
        try {
            return new ImportDeclaration(type, locator, slot, asBoolean(fields.get("optional"), false), content);
        } catch (IllegalArgumentException ex) {
            throw new StructuralException(source, "Invalid import in " + source + ": " + ex.getMessage(), ex);
        }
    }

    private Map<String, TemplateSlot> parseSlots(String source, Map<String, Object> section) {
        var slots = new LinkedHashMap<String, TemplateSlot>();
        var targets = new HashMap<String, String>();
        for (var entry : section.entrySet()) {
            String path = TEMPLATE_SLOTS + "." + entry.getKey();
            var fields = asObject(source, entry.getValue(), path);
            String target = asText(fields.containsKey("target") ? fields.get("target") : fields.get("id"));
            if (target == null || target.isBlank()) {
                throw new StructuralException(source, "Invalid manifest " + source + ": " + path + " needs a target id");
            }
            String claimedBy = targets.putIfAbsent(target, entry.getKey());
            if (claimedBy != null) {
                throw new StructuralException(
                    source,
                    "Invalid manifest " + source + ": slots '" + claimedBy + "' and '" + entry.getKey()
                        + "' both target '" + target + "'"
                );
            }
            Object rawDefault = fields.containsKey("default") ? fields.get("default") : fields.get("defaultContent");
            Node defaultContent = rawDefault == null ? null : parseRootNode(source, rawDefault, path + ".default");
            slots.put(entry.getKey(), new TemplateSlot(
                entry.getKey(),
                target,
                asBoolean(fields.get("required"), false),
                defaultContent
            ));
        }
        return slots;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(String source, Object value, String path) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new StructuralException(source, "Invalid manifest " + source + ": " + path + " must be an object");
    }

    private static List<String> asStringList(String source, Object value, String path) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String single) {
            return List.of(single);
        }
        if (value instanceof List<?> list) {
            var result = new ArrayList<String>(list.size());
            for (var item : list) {
                if (item == null) {
                    continue;
                }
                result.add(String.valueOf(item));
            }
            return result;
        }
        throw new StructuralException(source, "Invalid manifest " + source + ": " + path + " must be a list");
    }

    private static String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static boolean asBoolean(Object value, boolean fallback) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String str && !str.isBlank()) {
            return Boolean.parseBoolean(str.trim());
        }
        return fallback;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
