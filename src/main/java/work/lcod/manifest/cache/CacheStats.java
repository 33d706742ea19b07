package work.lcod.manifest.cache;

public record CacheStats(int size, int loading) {}
