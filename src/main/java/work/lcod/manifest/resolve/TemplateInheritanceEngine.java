package work.lcod.manifest.resolve;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.manifest.model.ImportDeclaration;
import work.lcod.manifest.model.InheritancePolicy;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ModuleDescriptor;
import work.lcod.manifest.model.Node;
import work.lcod.manifest.model.PropertyBag;
import work.lcod.manifest.model.StyleEntry;
import work.lcod.manifest.model.TemplateSlot;

/**
 * Merges a child manifest onto its already merged template ancestor.
 * <p>
 * Values present on one side only survive; values present on both sides are merged recursively
 * when both are maps and otherwise taken from the child, unless their dotted path is listed in
 * {@link InheritancePolicy#preserveSlots()}. The structure root lives at {@code structure.<tag>},
 * node properties at {@code <node>.<key>} and a single child node at {@code <node>.children.<tag>}.
 */
public final class TemplateInheritanceEngine {
    static final String STRUCTURE = "structure";
    static final String STYLES = "styles";
    static final String TEMPLATE_SLOTS = "templateSlots";

    /**
     * Merges {@code child} onto {@code ancestor} with the child's own inheritance policy.
     */
    public Manifest merge(Manifest ancestor, Manifest child) {
        return merge(ancestor, child, child.metadata().policy());
    }

    public Manifest merge(Manifest ancestor, Manifest child, InheritancePolicy policy) {
        return Manifest.builder()
            .metadata(ancestor.metadata().overlay(child.metadata()))
            .styles(mergeStyles(ancestor.styles(), child.styles(), policy))
            .structure(mergeStructure(ancestor.structure(), child.structure(), policy))
            .modules(mergeModules(ancestor.modules(), child.modules()))
            .imports(mergeImports(ancestor.imports(), child.imports()))
            .templateSlots(mergeSlots(ancestor.templateSlots(), child.templateSlots(), policy))
            .exports(overlay(ancestor.exports(), child.exports()))
            .extras(mergeMaps(ancestor.extras(), child.extras(), null, policy))
            .build();
    }

    /**
     * Flattens a template chain given root ancestor first. The first manifest is taken as is (its
     * {@code extends}, if any, is dropped), then each descendant is merged onto the running result.
     */
    public Manifest mergeChain(List<Manifest> rootFirst) {
        if (rootFirst.isEmpty()) {
            throw new IllegalArgumentException("Template chain must not be empty");
        }
        Manifest first = rootFirst.get(0);
        Manifest merged = first.toBuilder().metadata(first.metadata().withoutAncestor()).build();
        for (Manifest child : rootFirst.subList(1, rootFirst.size())) {
            merged = merge(merged, child);
        }
        return merged;
    }

    private static Map<String, StyleEntry> mergeStyles(
        Map<String, StyleEntry> ancestor,
        Map<String, StyleEntry> child,
        InheritancePolicy policy
    ) {
        var merged = new LinkedHashMap<String, StyleEntry>();
        if (policy.mergeStyles()) {
            merged.putAll(ancestor);
        }
        child.forEach((name, entry) -> {
            if (!(policy.preserves(STYLES + "." + name) && ancestor.containsKey(name))) {
                merged.put(name, entry);
            }
        });
        ancestor.forEach((name, entry) -> {
            if (policy.preserves(STYLES + "." + name)) {
                merged.put(name, entry);
            }
        });
        return merged;
    }

    Node mergeStructure(Node ancestor, Node child, InheritancePolicy policy) {
        if (child == null) {
            return ancestor;
        }
        if (ancestor == null) {
            return child;
        }
        if (policy.preserves(STRUCTURE)) {
            return ancestor;
        }
        if (policy.overrideStructure()) {
            return policy.preserves(STRUCTURE + "." + ancestor.tag()) ? ancestor : child;
        }
        return mergeNode(ancestor, child, STRUCTURE, policy);
    }

    private static Node mergeNode(Node ancestor, Node child, String parentPath, InheritancePolicy policy) {
        if (!ancestor.tag().equals(child.tag())) {
            return child;
        }
        String path = parentPath + "." + ancestor.tag();
        if (policy.preserves(path)) {
            return ancestor;
        }
        PropertyBag a = ancestor.props();
        PropertyBag c = child.props();

        List<Node> children;
        boolean single;
        String childrenPath = path + "." + PropertyBag.CHILDREN;
        if (policy.preserves(childrenPath) || c.children().isEmpty()) {
            children = a.children();
            single = a.singleChild();
        } else if (a.children().isEmpty()) {
            children = c.children();
            single = c.singleChild();
        } else if (a.singleChild() && c.singleChild()) {
            children = List.of(mergeNode(a.children().get(0), c.children().get(0), childrenPath, policy));
            single = true;
        } else {
            children = c.children();
            single = c.singleChild();
        }

        var props = new PropertyBag(
            pick(a.text(), c.text(), path + "." + PropertyBag.TEXT, policy),
            children,
            single,
            pick(a.module(), c.module(), path + "." + PropertyBag.MODULE, policy),
            mergeMaps(a.attributes(), c.attributes(), path, policy)
        );
        return child.withProps(props);
    }

    private static String pick(String ancestor, String child, String path, InheritancePolicy policy) {
        if (ancestor != null && policy.preserves(path)) {
            return ancestor;
        }
        return child != null ? child : ancestor;
    }

    /**
     * Generic deep merge of attribute and extra-section maps.
     *
     * @param path dotted path of the map itself, {@code null} for top-level sections
     */
    @SuppressWarnings("unchecked")
    private static Map<String, Object> mergeMaps(
        Map<String, Object> ancestor,
        Map<String, Object> child,
        String path,
        InheritancePolicy policy
    ) {
        var merged = new LinkedHashMap<>(ancestor);
        for (var entry : child.entrySet()) {
            String key = entry.getKey();
            String keyPath = path == null ? key : path + "." + key;
            Object existing = ancestor.get(key);
            if (existing != null && policy.preserves(keyPath)) {
                continue;
            }
            Object value = entry.getValue();
            if (existing instanceof Map<?, ?> existingMap && value instanceof Map<?, ?> valueMap) {
                merged.put(key, mergeMaps(
                    (Map<String, Object>) existingMap,
                    (Map<String, Object>) valueMap,
                    keyPath,
                    policy
                ));
            } else {
                merged.put(key, value);
            }
        }
        return merged;
    }

    private static List<ModuleDescriptor> mergeModules(List<ModuleDescriptor> ancestor, List<ModuleDescriptor> child) {
        var byAlias = new LinkedHashMap<String, ModuleDescriptor>();
        for (var module : ancestor) {
            byAlias.put(module.alias(), module);
        }
        for (var module : child) {
            byAlias.put(module.alias(), module);
        }
        return new ArrayList<>(byAlias.values());
    }

    /**
     * Concatenates ancestor then child imports without duplicates; a child slot import replaces any
     * ancestor import for the same slot.
     */
    private static List<ImportDeclaration> mergeImports(List<ImportDeclaration> ancestor, List<ImportDeclaration> child) {
        Set<String> childSlots = new HashSet<>();
        for (var declaration : child) {
            if (declaration.isSlotImport()) {
                childSlots.add(declaration.slot());
            }
        }
        var merged = new LinkedHashSet<ImportDeclaration>();
        for (var declaration : ancestor) {
            if (!declaration.isSlotImport() || !childSlots.contains(declaration.slot())) {
                merged.add(declaration);
            }
        }
        merged.addAll(child);
        return new ArrayList<>(merged);
    }

    private static Map<String, TemplateSlot> mergeSlots(
        Map<String, TemplateSlot> ancestor,
        Map<String, TemplateSlot> child,
        InheritancePolicy policy
    ) {
        var merged = new LinkedHashMap<>(ancestor);
        child.forEach((name, slot) -> {
            if (!(ancestor.containsKey(name) && policy.preserves(TEMPLATE_SLOTS + "." + name))) {
                merged.put(name, slot);
            }
        });
        return merged;
    }

    private static <V> Map<String, V> overlay(Map<String, V> ancestor, Map<String, V> child) {
        var merged = new LinkedHashMap<>(ancestor);
        merged.putAll(child);
        return merged;
    }
}
