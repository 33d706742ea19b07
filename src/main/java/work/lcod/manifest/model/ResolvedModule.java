package work.lcod.manifest.model;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of loading one module declaration: the resolved child manifest, or the reason it failed.
 */
public record ResolvedModule(
    ModuleDescriptor descriptor,
    String locator,
    ModuleState state,
    Manifest manifest,
    String failure
) {
    public ResolvedModule {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(state, "state");
        if (state == ModuleState.LOADED && manifest == null) {
            throw new IllegalArgumentException("Loaded module requires a manifest: " + descriptor.alias());
        }
    }

    public static ResolvedModule loaded(ModuleDescriptor descriptor, String locator, Manifest manifest) {
        return new ResolvedModule(descriptor, locator, ModuleState.LOADED, manifest, null);
    }

    public static ResolvedModule failed(ModuleDescriptor descriptor, String locator, String failure) {
        return new ResolvedModule(descriptor, locator, ModuleState.FAILED, null, failure);
    }

    public boolean isLoaded() {
        return state == ModuleState.LOADED;
    }

    public Map<String, Node> exports() {
        return manifest == null ? Map.of() : manifest.exports();
    }
}
