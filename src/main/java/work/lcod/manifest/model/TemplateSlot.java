package work.lcod.manifest.model;

import java.util.Objects;

/**
 * A named content slot: the placeholder node id it replaces and its fallback content.
 */
public record TemplateSlot(String name, String target, boolean required, Node defaultContent) {
    public TemplateSlot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
    }
}
