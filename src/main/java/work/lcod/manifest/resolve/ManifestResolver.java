package work.lcod.manifest.resolve;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.manifest.cache.CacheKey;
import work.lcod.manifest.cache.ManifestCache;
import work.lcod.manifest.error.Failures;
import work.lcod.manifest.error.ResolutionException;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.error.VersionMismatchException;
import work.lcod.manifest.load.Locators;
import work.lcod.manifest.load.ReferenceLoader;
import work.lcod.manifest.model.ImportDeclaration;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ModuleDescriptor;
import work.lcod.manifest.model.ModuleState;
import work.lcod.manifest.model.Node;
import work.lcod.manifest.model.ResolvedModule;
import work.lcod.manifest.parse.ManifestParser;
import work.lcod.manifest.parse.ManifestWriter;
import work.lcod.manifest.shared.Digests;

/**
 * Resolves a manifest into a flat one: template chain merged, module table filled, styles
 * flattened, slots and module references expanded.
 * <p>
 * Only loading is asynchronous. Once the reference graph is complete, cycles are checked and every
 * manifest is merged then resolved in dependency order by plain synchronous code. Intermediate
 * results are stored in the cache so other roots sharing an ancestor or a module reuse them.
 */
public final class ManifestResolver {
    private static final Logger log = LoggerFactory.getLogger(ManifestResolver.class);
    private static final String INLINE_PREFIX = "inline:";

    private final GraphLoader graphLoader;
    private final ManifestCache cache;
    private final TemplateInheritanceEngine templates = new TemplateInheritanceEngine();
    private final StyleInheritanceResolver styles = new StyleInheritanceResolver();
    private final SlotModuleExpander expander;

    public ManifestResolver(ReferenceLoader loader, ManifestParser parser, ManifestCache cache) {
        this.graphLoader = new GraphLoader(loader, parser);
        this.cache = Objects.requireNonNull(cache, "cache");
        this.expander = new SlotModuleExpander(parser.maxDepth());
    }

    public ManifestCache cache() {
        return cache;
    }

    /**
     * @param locator path relative to the loader's base directory, absolute path, or URL
     */
    public CompletableFuture<Manifest> resolve(String locator, ResolutionOptions options) {
        String root;
        try {
            root = Locators.canonical(locator);
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(new StructuralException(locator, ex.getMessage(), ex));
        }
        var key = new CacheKey(root, options.fingerprint(), CacheKey.Stage.RESOLVED);
        return cache.getOrResolve(
            key,
            () -> graphLoader.load(root, lookupFor(options)).thenApply(graph -> build(graph, options)),
            options.ignoreCache()
        );
    }

    /**
     * Resolves a manifest supplied in memory. Relative references inside it are read relative to the
     * loader's base directory; its cache key is derived from its content.
     */
    public CompletableFuture<Manifest> resolve(Manifest inline, ResolutionOptions options) {
        String root = inlineId(inline);
        var key = new CacheKey(root, options.fingerprint(), CacheKey.Stage.RESOLVED);
        return cache.getOrResolve(
            key,
            () -> graphLoader.load(root, inline, lookupFor(options)).thenApply(graph -> build(graph, options)),
            options.ignoreCache()
        );
    }

    static String inlineId(Manifest inline) {
        return INLINE_PREFIX + Digests.sha256Hex(ManifestWriter.toJson(inline));
    }

    private GraphLoader.CacheLookup lookupFor(ResolutionOptions options) {
        if (options.ignoreCache()) {
            return GraphLoader.CacheLookup.NONE;
        }
        String fingerprint = options.dependencyFingerprint();
        return (locator, stage) -> cache.get(new CacheKey(locator, fingerprint, stage));
    }

    private Manifest build(ReferenceGraph graph, ResolutionOptions options) {
        var session = new Session(graph, options);
        for (String locator : graph.dependencyOrder()) {
            var entry = graph.find(locator).orElseThrow();
            if (entry.state() == ModuleState.FAILED) {
                continue;
            }
            if (locator.equals(graph.root()) || !graph.isRequired(locator)) {
                continue;
            }
            for (var reference : graph.referencesTo(locator)) {
                if (reference.kind().requiredStage() == CacheKey.Stage.MERGED) {
                    session.merged(locator);
                } else {
                    session.resolved(locator);
                }
            }
        }
        Manifest result = session.resolveRoot();
        session.storeIntermediates();
        log.debug("Resolved {} from {} manifest(s)", graph.root(), graph.entries().size());
        return result;
    }

    /**
     * Memo of one build. Non-root results go to the cache under the dependency fingerprint once the
     * root has resolved; the root result is stored by the caller's single-flight entry.
     */
    private final class Session {
        private final ReferenceGraph graph;
        private final ResolutionOptions options;
        private final String fingerprint;
        private final Map<String, Manifest> merged = new HashMap<>();
        private final Map<String, Manifest> resolved = new HashMap<>();
        private final Map<CacheKey, Manifest> computed = new LinkedHashMap<>();

        private Session(ReferenceGraph graph, ResolutionOptions options) {
            this.graph = graph;
            this.options = options;
            this.fingerprint = options.dependencyFingerprint();
        }

        Manifest resolveRoot() {
            return resolve(graph.root(), options.slotContent(), true);
        }

        void storeIntermediates() {
            computed.forEach(cache::put);
        }

        Manifest merged(String locator) {
            Manifest known = merged.get(locator);
            if (known != null) {
                return known;
            }
            var entry = entryOf(locator);
            Manifest result = entry.cached(CacheKey.Stage.MERGED).orElse(null);
            if (result == null) {
                Manifest raw = rawOf(entry);
                if (raw.metadata().hasAncestor()) {
                    result = templates.merge(merged(raw.metadata().extendsLocator()), raw);
                } else {
                    result = raw.toBuilder().metadata(raw.metadata().withoutAncestor()).build();
                }
                computed.put(new CacheKey(locator, fingerprint, CacheKey.Stage.MERGED), result);
            }
            merged.put(locator, result);
            return result;
        }

        Manifest resolved(String locator) {
            return resolve(locator, Map.of(), false);
        }

        private Manifest resolve(String locator, Map<String, Node> slotContent, boolean root) {
            if (!root) {
                Manifest known = resolved.get(locator);
                if (known != null) {
                    return known;
                }
                var cachedResolved = entryOf(locator).cached(CacheKey.Stage.RESOLVED);
                if (cachedResolved.isPresent()) {
                    resolved.put(locator, cachedResolved.get());
                    return cachedResolved.get();
                }
            }
            Manifest base = merged(locator);
            var modules = moduleTable(locator, base);
            var withModules = base.toBuilder()
                .resolvedModules(modules)
                .imports(fillSlotImports(locator, base))
                .styles(options.prefixModuleStyles()
                    ? styles.resolveWithModules(base.styles(), modules)
                    : styles.resolve(base.styles()))
                .build();
            Manifest result = withModules.toBuilder()
                .structure(expander.expand(locator, withModules, slotContent))
                .exports(expander.expandExports(locator, withModules))
                .build();
            if (!root) {
                computed.put(new CacheKey(locator, fingerprint, CacheKey.Stage.RESOLVED), result);
                resolved.put(locator, result);
            }
            return result;
        }

        private Map<String, ResolvedModule> moduleTable(String locator, Manifest manifest) {
            var table = new LinkedHashMap<String, ResolvedModule>();
            for (ModuleDescriptor descriptor : manifest.modules()) {
                table.put(descriptor.alias(), resolveModule(locator, descriptor));
            }
            return table;
        }

        private ResolvedModule resolveModule(String from, ModuleDescriptor descriptor) {
            String target = descriptor.locator();
            var entry = entryOf(target);
            if (entry.state() == ModuleState.FAILED) {
                return optionalFailure(from, descriptor, Failures.asResolutionException(entry.failure(), target));
            }
            Manifest module;
            try {
                module = resolved(target);
            } catch (ResolutionException ex) {
                return optionalFailure(from, descriptor, ex);
            }
            VersionConstraint constraint;
            try {
                constraint = VersionConstraint.parse(descriptor.version());
            } catch (IllegalArgumentException ex) {
                throw new StructuralException(
                    descriptor.alias(),
                    "Invalid version constraint '" + descriptor.version() + "' for module '" + descriptor.alias()
                        + "' in " + from,
                    ex
                );
            }
            String actual = module.versionOrDefault();
            boolean satisfied;
            try {
                satisfied = constraint.isSatisfiedBy(actual);
            } catch (IllegalArgumentException ex) {
                satisfied = false;
            }
            if (!satisfied) {
                var mismatch = new VersionMismatchException(descriptor.alias(), constraint.toString(), actual);
                return optionalFailure(from, descriptor, mismatch);
            }
            return ResolvedModule.loaded(descriptor, target, module);
        }

        private ResolvedModule optionalFailure(String from, ModuleDescriptor descriptor, RuntimeException failure) {
            if (!descriptor.optional()) {
                throw failure;
            }
            log.warn("Optional module '{}' of {} unavailable: {}", descriptor.alias(), from, failure.getMessage());
            return ResolvedModule.failed(descriptor, descriptor.locator(), failure.getMessage());
        }

        private List<ImportDeclaration> fillSlotImports(String from, Manifest manifest) {
            var imports = new ArrayList<ImportDeclaration>(manifest.imports().size());
            for (var declaration : manifest.imports()) {
                if (!declaration.needsLoading()) {
                    imports.add(declaration);
                    continue;
                }
                var entry = entryOf(declaration.locator());
                if (entry.state() == ModuleState.FAILED) {
                    imports.add(optionalFailure(from, declaration,
                        Failures.asResolutionException(entry.failure(), declaration.locator())));
                    continue;
                }
                Manifest content;
                try {
                    content = resolved(declaration.locator());
                } catch (ResolutionException ex) {
                    imports.add(optionalFailure(from, declaration, ex));
                    continue;
                }
                imports.add(declaration.withContent(content.structure()));
            }
            return imports;
        }

        private ImportDeclaration optionalFailure(String from, ImportDeclaration declaration, ResolutionException failure) {
            if (!declaration.optional()) {
                throw failure;
            }
            log.warn("Optional import for slot '{}' of {} unavailable: {}", declaration.slot(), from, failure.getMessage());
            return declaration;
        }

        private ReferenceGraph.Entry entryOf(String locator) {
            return graph.find(locator)
                .orElseThrow(() -> new IllegalStateException("Reference graph has no entry for " + locator));
        }

        private Manifest rawOf(ReferenceGraph.Entry entry) {
            if (entry.state() == ModuleState.FAILED) {
                throw Failures.asResolutionException(entry.failure(), entry.locator());
            }
            if (entry.manifest() == null) {
                throw new IllegalStateException("Manifest " + entry.locator() + " was neither loaded nor cached");
            }
            return entry.manifest();
        }
    }
}
