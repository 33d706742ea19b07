package work.lcod.manifest.model;

import java.util.Objects;

/**
 * A module import declared by a manifest.
 *
 * @param version version constraint, {@code null} when any version is accepted
 */
public record ModuleDescriptor(String alias, String locator, String version, boolean optional) {
    public ModuleDescriptor {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(locator, "locator");
    }
}
