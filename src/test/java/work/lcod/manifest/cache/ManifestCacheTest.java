package work.lcod.manifest.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ManifestMetadata;
import work.lcod.manifest.support.MutableClock;

class ManifestCacheTest {
    private static final CacheKey KEY = new CacheKey("page.yaml", "f1", CacheKey.Stage.RESOLVED);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final ManifestCache cache = new ManifestCache(Duration.ofMinutes(5), clock);

    private static Manifest titled(String title) {
        return Manifest.builder()
            .metadata(new ManifestMetadata(title, null, null, null, null, null))
            .build();
    }

    @Test
    void entriesExpireLazilyAtMaxAge() {
        cache.put(KEY, titled("a"));
        clock.advance(Duration.ofMinutes(4));
        assertTrue(cache.get(KEY).isPresent());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.get(KEY).isEmpty());
        assertEquals(0, cache.stats().size());
    }

    @Test
    void stagesAndFingerprintsAreDistinctKeys() {
        cache.put(KEY, titled("resolved"));

        assertTrue(cache.get(new CacheKey("page.yaml", "f1", CacheKey.Stage.MERGED)).isEmpty());
        assertTrue(cache.get(new CacheKey("page.yaml", "f2", CacheKey.Stage.RESOLVED)).isEmpty());
    }

    @Test
    void concurrentCallersShareOneResolution() {
        var calls = new AtomicInteger();
        var pending = new CompletableFuture<Manifest>();

        var first = cache.getOrResolve(KEY, () -> {
            calls.incrementAndGet();
            return pending;
        }, false);
        var second = cache.getOrResolve(KEY, () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(titled("other"));
        }, false);
        assertEquals(1, cache.stats().loading());

        pending.complete(titled("shared"));

        assertEquals(1, calls.get());
        assertSame(first.join(), second.join());
        assertEquals(0, cache.stats().loading());
        assertEquals("shared", cache.get(KEY).orElseThrow().metadata().title());
    }

    @Test
    void racingCallersNeverStartASecondResolution() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int round = 0; round < 200; round++) {
                var roundCache = new ManifestCache(Duration.ofMinutes(5), clock);
                var calls = new AtomicInteger();
                var start = new CountDownLatch(1);
                var callers = new ArrayList<Future<Manifest>>();
                for (int caller = 0; caller < 8; caller++) {
                    callers.add(pool.submit(() -> {
                        start.await();
                        return roundCache.getOrResolve(KEY, () -> {
                            calls.incrementAndGet();
                            return CompletableFuture.supplyAsync(() -> titled("shared"));
                        }, false).join();
                    }));
                }
                start.countDown();
                for (var caller : callers) {
                    assertEquals("shared", caller.get(5, TimeUnit.SECONDS).metadata().title());
                }
                assertEquals(1, calls.get(), "resolutions started in round " + round);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failuresAreNotCachedAndReleaseTheSlot() {
        var failed = cache.getOrResolve(KEY, () -> CompletableFuture.failedFuture(new IllegalStateException("boom")), false);

        assertThrows(CompletionException.class, failed::join);
        assertTrue(cache.get(KEY).isEmpty());

        var retried = cache.getOrResolve(KEY, () -> CompletableFuture.completedFuture(titled("ok")), false);
        assertEquals("ok", retried.join().metadata().title());
    }

    @Test
    void supplierThrowingIsReportedAsFailure() {
        var failed = cache.getOrResolve(KEY, () -> {
            throw new IllegalArgumentException("bad input");
        }, false);

        assertThrows(CompletionException.class, failed::join);
        assertEquals(0, cache.stats().loading());
    }

    @Test
    void bypassIgnoresFreshEntryButStoresResult() {
        cache.put(KEY, titled("old"));

        var fresh = cache.getOrResolve(KEY, () -> CompletableFuture.completedFuture(titled("new")), true).join();

        assertEquals("new", fresh.metadata().title());
        assertEquals("new", cache.get(KEY).orElseThrow().metadata().title());
    }

    @Test
    void clearDuringResolutionPreventsRepopulation() {
        var pending = new CompletableFuture<Manifest>();
        var result = cache.getOrResolve(KEY, () -> pending, false);

        cache.clear();
        pending.complete(titled("late"));

        assertEquals("late", result.join().metadata().title());
        assertFalse(cache.get(KEY).isPresent());
    }
}
