package work.lcod.manifest.resolve;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.manifest.error.MissingReferenceException;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.model.ResolvedModule;
import work.lcod.manifest.model.StyleEntry;

/**
 * Flattens {@code extends} chains inside a style table. Parent properties come first and the
 * entry's own properties are layered on top; the result holds no parent references.
 */
public final class StyleInheritanceResolver {

    /**
     * @return a table with the same names in the same order, every entry flat
     * @throws MissingReferenceException  when a style extends a name absent from the table
     * @throws work.lcod.manifest.error.CircularReferenceException when {@code extends} chains loop, self-reference included
     * @throws StructuralException        when a style extends a raw declaration string
     */
    public Map<String, StyleEntry> resolve(Map<String, StyleEntry> styles) {
        var order = new DependencyResolver<String>("style inheritance");
        for (var style : styles.entrySet()) {
            String name = style.getKey();
            StyleEntry entry = style.getValue();
            order.addNode(name);
            if (entry.hasParent()) {
                if (!styles.containsKey(entry.parent())) {
                    throw new MissingReferenceException(
                        entry.parent(),
                        "Style '" + name + "' extends missing style '" + entry.parent() + "'"
                    );
                }
                order.addDependency(name, entry.parent());
            }
        }

        var flat = new LinkedHashMap<String, StyleEntry>();
        for (String name : order.resolve(styles.keySet())) {
            StyleEntry entry = styles.get(name);
            if (!entry.hasParent()) {
                flat.put(name, entry);
                continue;
            }
            StyleEntry parent = flat.get(entry.parent());
            if (parent.isDeclaration()) {
                throw new StructuralException(
                    name,
                    "Style '" + name + "' cannot extend declaration style '" + entry.parent() + "'"
                );
            }
            var properties = new LinkedHashMap<>(parent.properties());
            properties.putAll(entry.properties());
            flat.put(name, StyleEntry.of(properties));
        }

        var result = new LinkedHashMap<String, StyleEntry>();
        for (String name : styles.keySet()) {
            result.put(name, flat.get(name));
        }
        return result;
    }

    /**
     * Adds the styles of every loaded module under {@code <alias>.<style>} and flattens the combined
     * table, so local styles may extend module styles.
     */
    public Map<String, StyleEntry> resolveWithModules(Map<String, StyleEntry> styles, Map<String, ResolvedModule> modules) {
        var combined = new LinkedHashMap<>(styles);
        modules.forEach((alias, module) -> {
            if (module.isLoaded()) {
                module.manifest().styles().forEach((name, entry) -> combined.put(alias + "." + name, entry));
            }
        });
        return resolve(combined);
    }
}
