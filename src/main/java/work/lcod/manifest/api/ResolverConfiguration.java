package work.lcod.manifest.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of a {@link ManifestEngine}.
 *
 * @param baseDirectory     directory relative local locators are read from
 * @param cacheMaxAge       age after which a cached resolution is stale
 * @param maxDepth          deepest structure tree accepted, after expansion
 * @param supportedVersions manifest version tags accepted by the parser, matched on major.minor
 * @param httpTimeout       timeout of one remote manifest fetch
 */
public record ResolverConfiguration(
    Path baseDirectory,
    Duration cacheMaxAge,
    int maxDepth,
    List<String> supportedVersions,
    Duration httpTimeout
) {
    public static final String FILE_NAME = "manifest-resolver.toml";
    public static final Duration DEFAULT_CACHE_MAX_AGE = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final List<String> DEFAULT_SUPPORTED_VERSIONS = List.of("1.0", "2.0");
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    public ResolverConfiguration {
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        Objects.requireNonNull(cacheMaxAge, "cacheMaxAge");
        Objects.requireNonNull(supportedVersions, "supportedVersions");
        Objects.requireNonNull(httpTimeout, "httpTimeout");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (cacheMaxAge.isNegative()) {
            throw new IllegalArgumentException("cacheMaxAge must not be negative: " + cacheMaxAge);
        }
        supportedVersions = List.copyOf(supportedVersions);
    }

    public static ResolverConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .baseDirectory(baseDirectory)
            .cacheMaxAge(cacheMaxAge)
            .maxDepth(maxDepth)
            .supportedVersions(supportedVersions)
            .httpTimeout(httpTimeout);
    }

    public static final class Builder {
        private Path baseDirectory = Path.of("").toAbsolutePath();
        private Duration cacheMaxAge = DEFAULT_CACHE_MAX_AGE;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private List<String> supportedVersions = DEFAULT_SUPPORTED_VERSIONS;
        private Duration httpTimeout = DEFAULT_HTTP_TIMEOUT;

        public Builder baseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        public Builder cacheMaxAge(Duration cacheMaxAge) {
            this.cacheMaxAge = cacheMaxAge;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder supportedVersions(List<String> supportedVersions) {
            this.supportedVersions = supportedVersions;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public ResolverConfiguration build() {
            return new ResolverConfiguration(
                baseDirectory,
                cacheMaxAge,
                maxDepth,
                supportedVersions,
                httpTimeout
            );
        }
    }
}
