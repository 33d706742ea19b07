package work.lcod.manifest.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import picocli.CommandLine;
import work.lcod.manifest.api.ManifestEngine;
import work.lcod.manifest.api.ResolverConfiguration;
import work.lcod.manifest.api.ResolverConfigurationLoader;
import work.lcod.manifest.resolve.ResolutionOptions;

/**
 * Options shared by every subcommand: where configuration and manifests live.
 */
final class EngineOptions {
    @CommandLine.Option(
        names = "--config",
        description = "Configuration file (default: ./" + ResolverConfiguration.FILE_NAME + " when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(
        names = {"-b", "--base-dir"},
        description = "Directory relative manifest locators are read from (overrides the configuration).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String baseDir;

    @CommandLine.Option(
        names = "--no-cache",
        description = "Ignore cached resolutions."
    )
    private boolean noCache;

    ResolverConfiguration configuration() {
        Path workingDir = Paths.get("").toAbsolutePath();
        ResolverConfiguration configuration;
        if (config != null) {
            Path file = Paths.get(config).toAbsolutePath().normalize();
            if (!Files.isRegularFile(file)) {
                throw new IllegalArgumentException("Configuration file not found: " + file);
            }
            configuration = ResolverConfigurationLoader.load(file);
        } else {
            configuration = ResolverConfigurationLoader.loadFrom(workingDir);
        }
        if (baseDir != null) {
            configuration = configuration.toBuilder()
                .baseDirectory(Paths.get(baseDir).toAbsolutePath().normalize())
                .build();
        }
        return configuration;
    }

    ManifestEngine engine() {
        return new ManifestEngine(configuration());
    }

    ResolutionOptions resolutionOptions() {
        return ResolutionOptions.DEFAULT.withIgnoreCache(noCache);
    }
}
