package work.lcod.manifest.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.manifest.model.Manifest;

/**
 * Time-bounded store of resolved manifests with single-flight resolution per key.
 * <p>
 * Entries expire lazily: a stale entry is dropped when it is looked up. Only successful
 * resolutions are stored; a failed resolution releases its in-flight slot so the next caller retries.
 */
public final class ManifestCache {
    private static final Logger log = LoggerFactory.getLogger(ManifestCache.class);

    private final ConcurrentMap<CacheKey, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<CacheKey, CompletableFuture<Manifest>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();
    private final Duration maxAge;
    private final Clock clock;

    public ManifestCache(Duration maxAge) {
        this(maxAge, Clock.systemUTC());
    }

    public ManifestCache(Duration maxAge, Clock clock) {
        this.maxAge = Objects.requireNonNull(maxAge, "maxAge");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative: " + maxAge);
        }
    }

    public Optional<Manifest> get(CacheKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key, entry);
            log.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry.manifest());
    }

    public void put(CacheKey key, Manifest manifest) {
        Objects.requireNonNull(manifest, "manifest");
        entries.put(key, new Entry(manifest, clock.instant()));
    }

    /**
     * Returns the cached manifest for {@code key}, joins the resolution already running for it, or starts
     * one with {@code resolver}. With {@code bypassCache} a fresh entry is ignored, but a running
     * resolution is still shared.
     */
    public CompletableFuture<Manifest> getOrResolve(
        CacheKey key,
        Supplier<CompletableFuture<Manifest>> resolver,
        boolean bypassCache
    ) {
        if (!bypassCache) {
            var cached = get(key);
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cached.get());
            }
        }
        var promise = new CompletableFuture<Manifest>();
        var running = inFlight.putIfAbsent(key, promise);
        if (running != null) {
            log.debug("Joining in-flight resolution: {}", key);
            return running;
        }
        if (!bypassCache) {
            // a resolution may have stored its result and released the slot since the lookup above
            var stored = get(key);
            if (stored.isPresent()) {
                inFlight.remove(key, promise);
                promise.complete(stored.get());
                return promise;
            }
        }
        long startedAt = generation.get();
        CompletableFuture<Manifest> resolution;
        try {
            resolution = resolver.get();
        } catch (RuntimeException ex) {
            resolution = CompletableFuture.failedFuture(ex);
        }
        resolution.whenComplete((manifest, error) -> {
            if (error == null && generation.get() == startedAt) {
                entries.put(key, new Entry(manifest, clock.instant()));
            }
            inFlight.remove(key, promise);
            if (error != null) {
                promise.completeExceptionally(error);
            } else {
                promise.complete(manifest);
            }
        });
        return promise;
    }

    /**
     * Drops every entry and forgets running resolutions; those still complete for their callers but
     * are not stored.
     */
    public void clear() {
        generation.incrementAndGet();
        entries.clear();
        inFlight.clear();
    }

    public CacheStats stats() {
        return new CacheStats(entries.size(), inFlight.size());
    }

    private boolean isExpired(Entry entry) {
        return Duration.between(entry.createdAt(), clock.instant()).compareTo(maxAge) >= 0;
    }

    private record Entry(Manifest manifest, Instant createdAt) {}
}
