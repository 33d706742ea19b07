package work.lcod.manifest.api;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.manifest.cache.CacheStats;
import work.lcod.manifest.cache.ManifestCache;
import work.lcod.manifest.error.Failures;
import work.lcod.manifest.error.LoadException;
import work.lcod.manifest.error.ResolutionException;
import work.lcod.manifest.load.DefaultReferenceLoader;
import work.lcod.manifest.load.FileSystemReferenceLoader;
import work.lcod.manifest.load.HttpReferenceLoader;
import work.lcod.manifest.load.ReferenceLoader;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.parse.ManifestParser;
import work.lcod.manifest.resolve.ManifestResolver;
import work.lcod.manifest.resolve.ResolutionOptions;

/**
 * Public entry point for embedding the resolver. One engine owns one cache; create separate engines
 * for isolated caches.
 */
public final class ManifestEngine {
    private static final Logger log = LoggerFactory.getLogger(ManifestEngine.class);

    private final ResolverConfiguration configuration;
    private final ManifestParser parser;
    private final ManifestResolver resolver;

    public ManifestEngine(ResolverConfiguration configuration) {
        this(configuration, new DefaultReferenceLoader(
            new FileSystemReferenceLoader(configuration.baseDirectory()),
            new HttpReferenceLoader(configuration.httpTimeout())
        ));
    }

    public ManifestEngine(ResolverConfiguration configuration, ReferenceLoader loader) {
        this.configuration = configuration;
        this.parser = new ManifestParser(configuration.supportedVersions(), configuration.maxDepth());
        this.resolver = new ManifestResolver(loader, parser, new ManifestCache(configuration.cacheMaxAge()));
    }

    public ResolverConfiguration configuration() {
        return configuration;
    }

    public ResolutionResult resolve(ManifestSource source) {
        return resolve(source, ResolutionOptions.DEFAULT);
    }

    public ResolutionResult resolve(ManifestSource source, ResolutionOptions options) {
        return resolveAsync(source, options).join();
    }

    /**
     * Never completes exceptionally; failures are reported through {@link ResolutionResult}.
     */
    public CompletableFuture<ResolutionResult> resolveAsync(ManifestSource source, ResolutionOptions options) {
        var started = Instant.now();
        CompletableFuture<Manifest> resolution;
        try {
            resolution = start(source, options);
        } catch (RuntimeException ex) {
            resolution = CompletableFuture.failedFuture(ex);
        }
        return resolution.handle((manifest, error) -> {
            if (error == null) {
                return ResolutionResult.success(source.display(), manifest, started);
            }
            ResolutionException failure = toResolutionException(source, error);
            log.debug("Resolution of {} failed", source.display(), failure);
            return ResolutionResult.failure(source.display(), failure, started);
        });
    }

    private CompletableFuture<Manifest> start(ManifestSource source, ResolutionOptions options) {
        if (source.locator().isPresent()) {
            return resolver.resolve(source.locator().get(), options);
        }
        Manifest inline = source.manifest()
            .orElseGet(() -> parser.parse(source.name(), source.text().orElseThrow()));
        return resolver.resolve(inline, options);
    }

    private static ResolutionException toResolutionException(ManifestSource source, Throwable error) {
        Throwable cause = Failures.unwrap(error);
        if (cause instanceof ResolutionException resolution) {
            return resolution;
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new LoadException(source.display(), "Unexpected failure resolving " + source.display() + ": " + message, cause);
    }

    public CacheStats cacheStats() {
        return resolver.cache().stats();
    }

    public void clearCache() {
        resolver.cache().clear();
    }
}
