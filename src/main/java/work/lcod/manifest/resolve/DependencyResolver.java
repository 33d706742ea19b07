package work.lcod.manifest.resolve;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lcod.manifest.error.CircularReferenceException;

/**
 * Orders a dependency graph so that every item comes after the items it depends on.
 * Depth-first with a visiting set; reaching an item that is still being visited is a cycle.
 *
 * @param <T> item identity (locator, style name, ...)
 */
public final class DependencyResolver<T> {
    private final String subject;
    private final Map<T, Set<T>> dependencies = new LinkedHashMap<>();

    /**
     * @param subject what the edges describe, used in cycle messages (e.g. {@code "template inheritance"})
     */
    public DependencyResolver(String subject) {
        this.subject = Objects.requireNonNull(subject, "subject");
    }

    public DependencyResolver<T> addNode(T item) {
        dependencies.computeIfAbsent(item, key -> new LinkedHashSet<>());
        return this;
    }

    public DependencyResolver<T> addDependency(T dependent, T dependsOn) {
        addNode(dependsOn);
        dependencies.computeIfAbsent(dependent, key -> new LinkedHashSet<>()).add(dependsOn);
        return this;
    }

    public List<T> resolve(T root) {
        return resolve(List.of(root));
    }

    /**
     * @return the roots and everything they reach, dependencies first
     * @throws CircularReferenceException naming the cycle, e.g. {@code a -> b -> a}
     */
    public List<T> resolve(Collection<T> roots) {
        var ordered = new ArrayList<T>();
        var visited = new HashSet<T>();
        var visiting = new LinkedHashSet<T>();
        for (T root : roots) {
            visit(root, visiting, visited, ordered);
        }
        return ordered;
    }

    private void visit(T item, LinkedHashSet<T> visiting, Set<T> visited, List<T> ordered) {
        if (visiting.contains(item)) {
            throw new CircularReferenceException(subject, cycleOf(visiting, item));
        }
        if (visited.contains(item)) {
            return;
        }
        visiting.add(item);
        for (T dependency : dependencies.getOrDefault(item, Set.of())) {
            visit(dependency, visiting, visited, ordered);
        }
        visiting.remove(item);
        visited.add(item);
        ordered.add(item);
    }

    private List<String> cycleOf(LinkedHashSet<T> visiting, T repeated) {
        var chain = new ArrayList<String>();
        boolean inCycle = false;
        for (T step : visiting) {
            if (step.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                chain.add(String.valueOf(step));
            }
        }
        chain.add(String.valueOf(repeated));
        return chain;
    }
}
