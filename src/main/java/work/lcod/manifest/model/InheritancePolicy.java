package work.lcod.manifest.model;

import java.util.List;

/**
 * Controls how a child manifest is merged onto its template ancestor.
 *
 * @param preserveSlots dotted paths (e.g. {@code structure.header}) where the ancestor value always wins
 */
public record InheritancePolicy(boolean mergeStyles, boolean overrideStructure, List<String> preserveSlots) {
    public static final InheritancePolicy DEFAULT = new InheritancePolicy(true, false, List.of());

    public InheritancePolicy {
        preserveSlots = preserveSlots == null ? List.of() : List.copyOf(preserveSlots);
    }

    public boolean preserves(String path) {
        return preserveSlots.contains(path);
    }
}
