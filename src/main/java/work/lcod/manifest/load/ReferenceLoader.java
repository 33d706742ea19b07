package work.lcod.manifest.load;

import java.util.concurrent.CompletableFuture;

/**
 * Fetches raw manifest text for a canonical locator (see {@link Locators}). Implementations report
 * failures by completing the future exceptionally, typically with a
 * {@link work.lcod.manifest.error.LoadException} or, when the target does not exist, a
 * {@link work.lcod.manifest.error.MissingReferenceException}.
 */
@FunctionalInterface
public interface ReferenceLoader {
    CompletableFuture<String> load(String locator);
}
