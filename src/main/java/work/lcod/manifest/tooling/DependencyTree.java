package work.lcod.manifest.tooling;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ModuleState;

/**
 * Module dependency report of a resolved manifest: one node per module alias, nested the way the
 * modules import each other.
 *
 * @param name    module alias, or the manifest name for the root
 * @param locator canonical locator, {@code null} for the root when unknown
 */
public record DependencyTree(String name, String locator, ModuleState state, String version, List<DependencyTree> children) {
    public DependencyTree {
        children = List.copyOf(children);
    }

    public static DependencyTree of(String locator, Manifest resolved) {
        return new DependencyTree(nameOf(resolved), locator, ModuleState.LOADED, resolved.versionOrDefault(), childrenOf(resolved));
    }

    private static List<DependencyTree> childrenOf(Manifest manifest) {
        var children = new ArrayList<DependencyTree>();
        manifest.resolvedModules().forEach((alias, module) -> {
            if (module.isLoaded()) {
                children.add(new DependencyTree(
                    alias,
                    module.locator(),
                    module.state(),
                    module.manifest().versionOrDefault(),
                    childrenOf(module.manifest())
                ));
            } else {
                children.add(new DependencyTree(alias, module.locator(), module.state(), null, List.of()));
            }
        });
        return children;
    }

    private static String nameOf(Manifest manifest) {
        Object name = manifest.metadata().attributes().get("name");
        if (name != null) {
            return String.valueOf(name);
        }
        return manifest.metadata().title() != null ? manifest.metadata().title() : "root";
    }

    /**
     * Number of nodes below this one.
     */
    public int size() {
        int total = 0;
        for (var child : children) {
            total += 1 + child.size();
        }
        return total;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        if (locator != null) {
            map.put("url", locator);
        }
        map.put("state", state.name().toLowerCase(Locale.ROOT));
        if (version != null) {
            map.put("version", version);
        }
        var nested = new ArrayList<Object>(children.size());
        for (var child : children) {
            nested.add(child.toMap());
        }
        map.put("children", nested);
        return map;
    }
}
