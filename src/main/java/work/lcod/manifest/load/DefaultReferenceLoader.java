package work.lcod.manifest.load;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Routes remote locators to the HTTP loader and everything else to the filesystem loader.
 */
public final class DefaultReferenceLoader implements ReferenceLoader {
    private final ReferenceLoader local;
    private final ReferenceLoader remote;

    public DefaultReferenceLoader(ReferenceLoader local, ReferenceLoader remote) {
        this.local = Objects.requireNonNull(local, "local");
        this.remote = Objects.requireNonNull(remote, "remote");
    }

    @Override
    public CompletableFuture<String> load(String locator) {
        return Locators.isRemote(locator) ? remote.load(locator) : local.load(locator);
    }
}
