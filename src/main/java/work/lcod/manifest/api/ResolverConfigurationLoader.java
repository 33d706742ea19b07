package work.lcod.manifest.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import work.lcod.manifest.shared.DurationParser;

/**
 * Reads {@value ResolverConfiguration#FILE_NAME}:
 * <pre>
 * [resolver]
 * baseDirectory = "manifests"
 * cacheMaxAge = "5m"
 * maxDepth = 64
 * supportedVersions = ["1.0", "2.0"]
 *
 * [http]
 * timeout = "30s"
 * </pre>
 * Missing keys keep their defaults. A relative {@code baseDirectory} is read from the directory
 * holding the file.
 */
public final class ResolverConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(ResolverConfigurationLoader.class);

    private ResolverConfigurationLoader() {}

    /**
     * Loads {@code directory/manifest-resolver.toml} when it exists, otherwise returns defaults
     * rooted at {@code directory}.
     */
    public static ResolverConfiguration loadFrom(Path directory) {
        Path file = directory.resolve(ResolverConfiguration.FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return ResolverConfiguration.builder().baseDirectory(directory.toAbsolutePath().normalize()).build();
        }
        return load(file);
    }

    /**
     * @throws IllegalArgumentException when the file cannot be read, is not valid TOML or holds invalid values
     */
    public static ResolverConfiguration load(Path file) {
        TomlParseResult toml;
        try {
            toml = Toml.parse(file);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read configuration " + file + ": " + ex.getMessage(), ex);
        }
        if (toml.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration " + file + ": " + toml.errors().get(0).toString());
        }
        Path parent = file.toAbsolutePath().getParent();
        var builder = ResolverConfiguration.builder().baseDirectory(parent);

        String baseDirectory = toml.getString("resolver.baseDirectory");
        if (baseDirectory != null && !baseDirectory.isBlank()) {
            builder.baseDirectory(parent.resolve(baseDirectory).normalize());
        }
        duration(toml, "resolver.cacheMaxAge", file).ifPresent(builder::cacheMaxAge);
        duration(toml, "http.timeout", file).ifPresent(builder::httpTimeout);
        if (toml.contains("resolver.maxDepth")) {
            if (!toml.isLong("resolver.maxDepth")) {
                throw new IllegalArgumentException("resolver.maxDepth in " + file + " must be an integer");
            }
            builder.maxDepth(Math.toIntExact(toml.getLong("resolver.maxDepth")));
        }
        if (toml.contains("resolver.supportedVersions")) {
            builder.supportedVersions(versions(toml, file));
        }
        ResolverConfiguration configuration = builder.build();
        log.debug("Loaded configuration from {}: {}", file, configuration);
        return configuration;
    }

    private static Optional<Duration> duration(TomlParseResult toml, String key, Path file) {
        if (!toml.contains(key)) {
            return Optional.empty();
        }
        if (toml.isLong(key)) {
            return Optional.of(Duration.ofMillis(toml.getLong(key)));
        }
        if (!toml.isString(key)) {
            throw new IllegalArgumentException(key + " in " + file + " must be a duration such as \"30s\"");
        }
        try {
            return DurationParser.parse(toml.getString(key));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(key + " in " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static List<String> versions(TomlParseResult toml, Path file) {
        if (!toml.isArray("resolver.supportedVersions")) {
            throw new IllegalArgumentException("resolver.supportedVersions in " + file + " must be an array of strings");
        }
        TomlArray array = toml.getArray("resolver.supportedVersions");
        var versions = new ArrayList<String>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            versions.add(String.valueOf(value));
        }
        return versions;
    }
}
