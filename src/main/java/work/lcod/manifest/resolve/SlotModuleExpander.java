package work.lcod.manifest.resolve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.manifest.error.MissingReferenceException;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.model.ImportDeclaration;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.Node;
import work.lcod.manifest.model.ResolvedModule;
import work.lcod.manifest.model.TemplateSlot;

/**
 * Replaces slot placeholders and module references in one pre-order walk over the structure.
 * The input tree is never modified; changed subtrees are rebuilt.
 * <p>
 * Slot content is chosen in this order: content supplied by the caller, content of a slot import,
 * the slot's default content. A slot without content leaves its placeholder in place unless the
 * slot is required.
 */
public final class SlotModuleExpander {
    private static final Logger log = LoggerFactory.getLogger(SlotModuleExpander.class);

    private final int maxDepth;

    public SlotModuleExpander(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @param source      locator of the manifest, used in error messages
     * @param manifest    merged manifest with {@link Manifest#resolvedModules()} filled and slot imports carrying content
     * @param slotContent caller-supplied slot content by slot name
     * @return the expanded structure, or {@code null} when the manifest has none
     */
    public Node expand(String source, Manifest manifest, Map<String, Node> slotContent) {
        var walk = new Walk(source, manifest.resolvedModules(), fillsFor(source, manifest, slotContent));
        Node structure = manifest.structure() == null ? null : walk.visit(manifest.structure());
        for (var pending : walk.pendingSlots.values()) {
            if (pending.slot.required()) {
                throw new MissingReferenceException(
                    pending.slot.target(),
                    "Placeholder '" + pending.slot.target() + "' of required slot '" + pending.slot.name()
                        + "' not found in " + source
                );
            }
            log.debug("Placeholder '{}' of slot '{}' not found in {}", pending.slot.target(), pending.slot.name(), source);
        }
        if (structure != null && structure.depth() > maxDepth) {
            throw new StructuralException(
                source,
                "Resolved structure of " + source + " is " + structure.depth() + " levels deep (max " + maxDepth + ")"
            );
        }
        return structure;
    }

    /**
     * Expands module references inside a manifest's exports so importers receive self-contained nodes.
     */
    public Map<String, Node> expandExports(String source, Manifest manifest) {
        var walk = new Walk(source, manifest.resolvedModules(), Map.of());
        var exports = new LinkedHashMap<String, Node>();
        manifest.exports().forEach((name, node) -> exports.put(name, walk.visit(node)));
        return exports;
    }

    private static Map<String, Fill> fillsFor(String source, Manifest manifest, Map<String, Node> slotContent) {
        var imported = new LinkedHashMap<String, Node>();
        for (ImportDeclaration declaration : manifest.imports()) {
            if (declaration.isSlotImport() && declaration.content() != null) {
                imported.putIfAbsent(declaration.slot(), declaration.content());
            }
        }
        var fills = new LinkedHashMap<String, Fill>();
        for (TemplateSlot slot : manifest.templateSlots().values()) {
            Node content;
            boolean walkContent;
            if (slotContent.containsKey(slot.name())) {
                content = slotContent.get(slot.name());
                walkContent = true;
            } else if (imported.containsKey(slot.name())) {
                // already resolved against the imported manifest's own modules
                content = imported.get(slot.name());
                walkContent = false;
            } else {
                content = slot.defaultContent();
                walkContent = true;
            }
            if (content == null && slot.required()) {
                throw new MissingReferenceException(
                    slot.name(),
                    "Required slot '" + slot.name() + "' of " + source + " has no content"
                );
            }
            Fill earlier = fills.putIfAbsent(slot.target(), new Fill(slot, content, walkContent));
            if (earlier != null) {
                log.warn(
                    "Slots '{}' and '{}' of {} both target '{}'; '{}' is ignored",
                    earlier.slot().name(), slot.name(), source, slot.target(), slot.name()
                );
            }
        }
        return fills;
    }

    private record Fill(TemplateSlot slot, Node content, boolean walkContent) {}

    private static final class Walk {
        private final String source;
        private final Map<String, ResolvedModule> modules;
        private final Map<String, Fill> pendingSlots;

        private Walk(String source, Map<String, ResolvedModule> modules, Map<String, Fill> fills) {
            this.source = source;
            this.modules = modules;
            this.pendingSlots = new LinkedHashMap<>(fills);
        }

        Node visit(Node node) {
            var id = node.id();
            if (id.isPresent() && pendingSlots.containsKey(id.get())) {
                Fill fill = pendingSlots.remove(id.get());
                if (fill.content() != null) {
                    return fill.walkContent() ? visit(fill.content()) : fill.content();
                }
            }
            if (node.module().isPresent()) {
                return expandModule(node, node.module().get());
            }
            return visitChildren(node);
        }

        private Node visitChildren(Node node) {
            List<Node> children = node.props().children();
            if (children.isEmpty()) {
                return node;
            }
            var expanded = new ArrayList<Node>(children.size());
            boolean changed = false;
            for (Node child : children) {
                Node result = visit(child);
                changed |= result != child;
                expanded.add(result);
            }
            if (!changed) {
                return node;
            }
            return node.withProps(node.props().withChildren(expanded, node.props().singleChild()));
        }

        private Node expandModule(Node node, String alias) {
            ResolvedModule module = modules.get(alias);
            if (module == null) {
                if (node.props().optional()) {
                    log.warn("Node <{}> in {} references unknown module '{}'; kept as is", node.tag(), source, alias);
                    return node;
                }
                throw new MissingReferenceException(
                    alias,
                    "Node <" + node.tag() + "> in " + source + " references unknown module '" + alias + "'"
                );
            }
            if (!module.isLoaded()) {
                log.debug("Module '{}' failed to load; node <{}> in {} kept as is", alias, node.tag(), source);
                return node;
            }
            Node exported = module.exports().get(node.tag());
            if (exported != null) {
                return exported;
            }
            Node structure = module.manifest().structure();
            if (structure != null) {
                return structure;
            }
            return visitChildren(node.withProps(node.props().withModule(null)));
        }
    }
}
