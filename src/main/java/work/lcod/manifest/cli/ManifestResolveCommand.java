package work.lcod.manifest.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.manifest.api.ManifestEngine;
import work.lcod.manifest.api.ManifestSource;
import work.lcod.manifest.api.ResolutionResult;
import work.lcod.manifest.emit.JsonManifestEmitter;
import work.lcod.manifest.emit.ManifestEmitter;
import work.lcod.manifest.emit.YamlManifestEmitter;
import work.lcod.manifest.load.Locators;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.resolve.ResolutionOptions;
import work.lcod.manifest.tooling.DependencyTree;
import work.lcod.manifest.tooling.ManifestBundler;

@CommandLine.Command(
    name = "manifest-resolve",
    description = "Resolve UI manifests: template inheritance, modules, styles and slots.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ManifestResolveCommand.Resolve.class,
        ManifestResolveCommand.Deps.class,
        ManifestResolveCommand.Bundle.class
    }
)
final class ManifestResolveCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    static ManifestEmitter emitterFor(CommandLine commandLine, String format) {
        return switch (format.toLowerCase(Locale.ROOT)) {
            case "json" -> new JsonManifestEmitter();
            case "yaml", "yml" -> new YamlManifestEmitter();
            default -> throw new CommandLine.ParameterException(commandLine, "Unsupported format: " + format + " (json|yaml)");
        };
    }

    /**
     * Prints the failure and returns its exit code, or {@code 0} when {@code result} succeeded.
     */
    static int reportFailure(CommandLine commandLine, ResolutionResult result) {
        if (result.isSuccess()) {
            return Main.EXIT_OK;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(
            ResolutionErrorHandler.describe(result.errorKind().code(), result.message())
        ));
        return result.status().exitCode();
    }

    @CommandLine.Command(
        name = "resolve",
        description = "Resolve one manifest and print it.",
        mixinStandardHelpOptions = true,
        showDefaultValues = true
    )
    static final class Resolve implements Callable<Integer> {
        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        private EngineOptions engineOptions = new EngineOptions();

        @CommandLine.Parameters(index = "0", paramLabel = "LOCATOR", description = "Manifest path or HTTP(S) URL.")
        private String locator;

        @CommandLine.Option(names = {"-f", "--format"}, description = "Output format (json|yaml).", defaultValue = "json")
        private String format;

        @CommandLine.Option(
            names = "--slot",
            paramLabel = "NAME=LOCATOR",
            description = "Fill a slot with the structure of another manifest."
        )
        private Map<String, String> slots = new LinkedHashMap<>();

        @Override
        public Integer call() {
            CommandLine commandLine = spec.commandLine();
            ManifestEmitter emitter = emitterFor(commandLine, format);
            ManifestEngine engine = engineOptions.engine();
            ResolutionOptions options = engineOptions.resolutionOptions();
            for (var slot : slots.entrySet()) {
                ResolutionResult content = engine.resolve(ManifestSource.forLocator(slot.getValue()), options);
                if (!content.isSuccess()) {
                    return reportFailure(commandLine, content);
                }
                if (content.manifest().structure() != null) {
                    options = options.withSlotContent(slot.getKey(), content.manifest().structure());
                }
            }
            ResolutionResult result = engine.resolve(ManifestSource.forLocator(locator), options);
            if (!result.isSuccess()) {
                return reportFailure(commandLine, result);
            }
            commandLine.getOut().println(emitter.emit(result.manifest()).content());
            return 0;
        }
    }

    @CommandLine.Command(
        name = "deps",
        description = "Print the module dependency tree of a manifest as JSON.",
        mixinStandardHelpOptions = true
    )
    static final class Deps implements Callable<Integer> {
        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        private EngineOptions engineOptions = new EngineOptions();

        @CommandLine.Parameters(index = "0", paramLabel = "LOCATOR", description = "Manifest path or HTTP(S) URL.")
        private String locator;

        @Override
        public Integer call() throws Exception {
            CommandLine commandLine = spec.commandLine();
            ResolutionResult result = engineOptions.engine()
                .resolve(ManifestSource.forLocator(locator), engineOptions.resolutionOptions());
            if (!result.isSuccess()) {
                return reportFailure(commandLine, result);
            }
            DependencyTree tree = DependencyTree.of(Locators.canonical(locator), result.manifest());
            commandLine.getOut().println(JSON_WRITER.writeValueAsString(tree.toMap()));
            return 0;
        }
    }

    @CommandLine.Command(
        name = "bundle",
        description = "Resolve several manifests and combine them into one.",
        mixinStandardHelpOptions = true,
        showDefaultValues = true
    )
    static final class Bundle implements Callable<Integer> {
        @CommandLine.Spec
        private CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        private EngineOptions engineOptions = new EngineOptions();

        @CommandLine.Parameters(arity = "1..*", paramLabel = "LOCATOR", description = "Manifests to bundle, in order.")
        private List<String> locators = new ArrayList<>();

        @CommandLine.Option(names = {"-n", "--name"}, description = "Name of the bundle.", defaultValue = "bundled-manifest")
        private String name;

        @CommandLine.Option(names = {"-f", "--format"}, description = "Output format (json|yaml).", defaultValue = "json")
        private String format;

        @Override
        public Integer call() {
            CommandLine commandLine = spec.commandLine();
            ManifestEmitter emitter = emitterFor(commandLine, format);
            ManifestEngine engine = engineOptions.engine();
            var manifests = new LinkedHashMap<String, Manifest>();
            for (String locator : locators) {
                ResolutionResult result = engine.resolve(ManifestSource.forLocator(locator), engineOptions.resolutionOptions());
                if (!result.isSuccess()) {
                    return reportFailure(commandLine, result);
                }
                manifests.put(bundleKey(locator), result.manifest());
            }
            Manifest bundled = new ManifestBundler().bundle(name, manifests);
            commandLine.getOut().println(emitter.emit(bundled).content());
            return 0;
        }

        /**
         * File name without extension, e.g. {@code pages/home.yaml -> home}.
         */
        static String bundleKey(String locator) {
            String canonical = Locators.canonical(locator);
            String last = canonical.substring(canonical.lastIndexOf('/') + 1);
            int dot = last.lastIndexOf('.');
            return dot > 0 ? last.substring(0, dot) : last;
        }
    }
}
