package work.lcod.manifest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResolverConfigurationLoaderTest {
    @TempDir
    Path directory;

    @Test
    void missingFileYieldsDefaultsRootedAtDirectory() {
        var configuration = ResolverConfigurationLoader.loadFrom(directory);

        assertEquals(directory.toAbsolutePath().normalize(), configuration.baseDirectory());
        assertEquals(ResolverConfiguration.DEFAULT_CACHE_MAX_AGE, configuration.cacheMaxAge());
        assertEquals(ResolverConfiguration.DEFAULT_MAX_DEPTH, configuration.maxDepth());
        assertEquals(ResolverConfiguration.DEFAULT_SUPPORTED_VERSIONS, configuration.supportedVersions());
    }

    @Test
    void readsEveryKey() throws Exception {
        Files.writeString(directory.resolve(ResolverConfiguration.FILE_NAME), """
            [resolver]
            baseDirectory = "ui"
            cacheMaxAge = "90s"
            maxDepth = 12
            supportedVersions = ["2.0"]

            [http]
            timeout = 2500
            """);

        var configuration = ResolverConfigurationLoader.loadFrom(directory);

        assertEquals(directory.toAbsolutePath().resolve("ui").normalize(), configuration.baseDirectory());
        assertEquals(Duration.ofSeconds(90), configuration.cacheMaxAge());
        assertEquals(12, configuration.maxDepth());
        assertEquals(List.of("2.0"), configuration.supportedVersions());
        assertEquals(Duration.ofMillis(2500), configuration.httpTimeout());
    }

    @Test
    void rejectsInvalidValues() throws Exception {
        Path file = Files.writeString(directory.resolve("bad.toml"), """
            [resolver]
            cacheMaxAge = "soon"
            """);

        var failure = assertThrows(IllegalArgumentException.class, () -> ResolverConfigurationLoader.load(file));
        assertTrue(failure.getMessage().contains("resolver.cacheMaxAge"));
    }

    @Test
    void rejectsMalformedToml() throws Exception {
        Path file = Files.writeString(directory.resolve("broken.toml"), "[resolver\nmaxDepth = 3\n");

        assertThrows(IllegalArgumentException.class, () -> ResolverConfigurationLoader.load(file));
    }

    @Test
    void builderValidatesValues() {
        assertEquals(ResolverConfiguration.DEFAULT_HTTP_TIMEOUT, ResolverConfiguration.defaults().httpTimeout());
        assertThrows(IllegalArgumentException.class, () -> ResolverConfiguration.builder().maxDepth(0).build());
        assertThrows(IllegalArgumentException.class, () -> ResolverConfiguration.builder().cacheMaxAge(Duration.ofSeconds(-1)).build());
    }
}
