package work.lcod.manifest.resolve;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.manifest.cache.CacheKey;
import work.lcod.manifest.error.Failures;
import work.lcod.manifest.error.StructuralException;
import work.lcod.manifest.load.ReferenceLoader;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ModuleState;
import work.lcod.manifest.parse.ManifestParser;

/**
 * Loads the transitive reference closure of a root manifest.
 * <p>
 * Loading proceeds in waves: all references discovered in one wave are fetched concurrently, and
 * the next wave starts once they have all settled. A locator is fetched at most once per call. A
 * failed required reference fails the whole load as soon as it is observed; failed optional ones
 * stay in the graph as {@link ModuleState#FAILED} entries.
 */
final class GraphLoader {
    private static final Logger log = LoggerFactory.getLogger(GraphLoader.class);

    private final ReferenceLoader loader;
    private final ManifestParser parser;

    GraphLoader(ReferenceLoader loader, ManifestParser parser) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * Cached stage manifests that may stand in for a raw load.
     */
    @FunctionalInterface
    interface CacheLookup {
        CacheLookup NONE = (locator, stage) -> Optional.empty();

        Optional<Manifest> find(String locator, CacheKey.Stage stage);
    }

    CompletableFuture<ReferenceGraph> load(String rootLocator, CacheLookup lookup) {
        var session = new Session(new ReferenceGraph(rootLocator), lookup);
        var root = session.graph.entry(rootLocator);
        return fetch(session.graph, root).thenCompose(ignored -> expand(session, List.of(root)));
    }

    /**
     * Builds the graph for a manifest supplied in memory; {@code rootId} only names it.
     */
    CompletableFuture<ReferenceGraph> load(String rootId, Manifest inline, CacheLookup lookup) {
        Manifest canonical;
        try {
            canonical = ReferenceCanonicalizer.canonicalize(inline, rootId, null);
        } catch (StructuralException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        var session = new Session(new ReferenceGraph(rootId), lookup);
        var root = session.graph.entry(rootId);
        root.startLoading();
        root.loaded(canonical);
        return expand(session, List.of(root));
    }

    private CompletableFuture<ReferenceGraph> expand(Session session, List<ReferenceGraph.Entry> wave) {
        var graph = session.graph;
        var targets = new LinkedHashSet<String>();
        for (var entry : wave) {
            Manifest source = entry.manifest();
            boolean raw = source != null;
            if (!raw) {
                source = entry.cached(CacheKey.Stage.MERGED).orElse(null);
            }
            if (source == null || !session.expanded.add(entry.locator() + (raw ? "#raw" : "#merged"))) {
                continue;
            }
            for (var reference : referencesOf(entry.locator(), source, raw)) {
                graph.addReference(reference);
                targets.add(reference.to());
            }
        }

        var toFetch = new ArrayList<ReferenceGraph.Entry>();
        var servedFromCache = new ArrayList<ReferenceGraph.Entry>();
        for (var target : targets) {
            var entry = graph.entry(target);
            if (entry.state() == ModuleState.FAILED && graph.isRequired(target)) {
                return CompletableFuture.failedFuture(entry.failure());
            }
            if (entry.state() != ModuleState.UNRESOLVED) {
                continue;
            }
            Set<CacheKey.Stage> needed = neededStages(graph, target);
            if (coveredByCache(session, entry, needed)) {
                if (!needed.contains(CacheKey.Stage.RESOLVED)) {
                    servedFromCache.add(entry);
                }
            } else {
                toFetch.add(entry);
            }
        }
        if (toFetch.isEmpty() && servedFromCache.isEmpty()) {
            return CompletableFuture.completedFuture(graph);
        }

        var fetches = new ArrayList<CompletableFuture<Void>>(toFetch.size());
        for (var entry : toFetch) {
            fetches.add(fetch(graph, entry));
        }
        var next = new ArrayList<ReferenceGraph.Entry>(toFetch);
        next.addAll(servedFromCache);
        return allOrFirstFailure(fetches).thenCompose(ignored -> expand(session, next));
    }

    private static Set<CacheKey.Stage> neededStages(ReferenceGraph graph, String locator) {
        var stages = EnumSet.noneOf(CacheKey.Stage.class);
        for (var reference : graph.referencesTo(locator)) {
            stages.add(reference.kind().requiredStage());
        }
        return stages;
    }

    private static boolean coveredByCache(Session session, ReferenceGraph.Entry entry, Set<CacheKey.Stage> needed) {
        for (var stage : needed) {
            if (entry.cached(stage).isPresent()) {
                continue;
            }
            var hit = session.lookup.find(entry.locator(), stage);
            if (hit.isEmpty()) {
                return false;
            }
            log.debug("Using cached {} manifest for {}", stage, entry.locator());
            entry.remember(stage, hit.get());
        }
        return true;
    }

    /**
     * @param raw whether {@code manifest} is the unmerged source; merged manifests no longer name their ancestor
     */
    private static List<ReferenceGraph.Reference> referencesOf(String from, Manifest manifest, boolean raw) {
        var references = new ArrayList<ReferenceGraph.Reference>();
        if (raw && manifest.metadata().hasAncestor()) {
            String ancestor = manifest.metadata().extendsLocator();
            references.add(new ReferenceGraph.Reference(from, ancestor, ReferenceGraph.Kind.TEMPLATE, ancestor, false));
        }
        for (var module : manifest.modules()) {
            references.add(new ReferenceGraph.Reference(
                from, module.locator(), ReferenceGraph.Kind.MODULE, module.alias(), module.optional()
            ));
        }
        for (var declaration : manifest.imports()) {
            if (declaration.needsLoading()) {
                references.add(new ReferenceGraph.Reference(
                    from, declaration.locator(), ReferenceGraph.Kind.SLOT, declaration.slot(), declaration.optional()
                ));
            }
        }
        return references;
    }

    private CompletableFuture<Void> fetch(ReferenceGraph graph, ReferenceGraph.Entry entry) {
        if (!entry.startLoading()) {
            return CompletableFuture.completedFuture(null);
        }
        String locator = entry.locator();
        log.debug("Loading manifest {}", locator);
        CompletableFuture<String> text;
        try {
            text = loader.load(locator);
        } catch (RuntimeException ex) {
            text = CompletableFuture.failedFuture(ex);
        }
        return text
            .thenApply(source -> ReferenceCanonicalizer.canonicalize(parser.parse(locator, source), locator, locator))
            .handle((manifest, error) -> {
                if (error == null) {
                    entry.loaded(manifest);
                    return null;
                }
                var failure = Failures.asResolutionException(error, locator);
                entry.failed(failure);
                if (graph.isRequired(locator)) {
                    throw new CompletionException(failure);
                }
                log.warn("Optional manifest {} could not be loaded: {}", locator, failure.getMessage());
                return null;
            });
    }

    /**
     * Completes when every future has completed, or exceptionally as soon as one of them fails.
     */
    private static CompletableFuture<Void> allOrFirstFailure(List<CompletableFuture<Void>> futures) {
        var all = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
        var result = new CompletableFuture<Void>();
        all.whenComplete((ignored, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(null);
            }
        });
        for (var future : futures) {
            future.whenComplete((ignored, error) -> {
                if (error != null) {
                    result.completeExceptionally(error);
                }
            });
        }
        return result;
    }

    private static final class Session {
        private final ReferenceGraph graph;
        private final CacheLookup lookup;
        private final Set<String> expanded = new HashSet<>();

        private Session(ReferenceGraph graph, CacheLookup lookup) {
            this.graph = graph;
            this.lookup = lookup == null ? CacheLookup.NONE : lookup;
        }
    }
}
