package work.lcod.manifest.resolve;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import work.lcod.manifest.cache.CacheKey;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.model.ModuleState;

/**
 * Manifests reachable from one resolution root, keyed by canonical locator, plus the typed
 * references between them. Built by {@link GraphLoader}; read by {@link ManifestResolver}.
 */
public final class ReferenceGraph {
    private final String root;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final List<Reference> references = new CopyOnWriteArrayList<>();

    ReferenceGraph(String root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public String root() {
        return root;
    }

    public Entry entry(String locator) {
        return entries.computeIfAbsent(locator, Entry::new);
    }

    public Optional<Entry> find(String locator) {
        return Optional.ofNullable(entries.get(locator));
    }

    public Map<String, Entry> entries() {
        return Map.copyOf(entries);
    }

    void addReference(Reference reference) {
        references.add(reference);
        entry(reference.to());
    }

    public List<Reference> referencesTo(String locator) {
        var incoming = new ArrayList<Reference>();
        for (var reference : references) {
            if (reference.to().equals(locator)) {
                incoming.add(reference);
            }
        }
        return incoming;
    }

    /**
     * True when {@code locator} can be reached from the root through non-optional references only.
     * Anything pulled in solely by an optional module or import may fail without failing the root.
     */
    public boolean isRequired(String locator) {
        var reached = new HashSet<String>();
        var pending = new ArrayDeque<String>();
        reached.add(root);
        pending.add(root);
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (current.equals(locator)) {
                return true;
            }
            for (var reference : references) {
                if (!reference.optional() && reference.from().equals(current) && reached.add(reference.to())) {
                    pending.add(reference.to());
                }
            }
        }
        return false;
    }

    /**
     * Orders the graph dependencies-first.
     *
     * @throws work.lcod.manifest.error.CircularReferenceException when the references form a cycle
     */
    public List<String> dependencyOrder() {
        var resolver = new DependencyResolver<String>("manifest reference");
        resolver.addNode(root);
        for (var reference : references) {
            resolver.addDependency(reference.from(), reference.to());
        }
        return resolver.resolve(root);
    }

    public enum Kind {
        TEMPLATE(CacheKey.Stage.MERGED),
        MODULE(CacheKey.Stage.RESOLVED),
        SLOT(CacheKey.Stage.RESOLVED);

        private final CacheKey.Stage requiredStage;

        Kind(CacheKey.Stage requiredStage) {
            this.requiredStage = requiredStage;
        }

        /**
         * How far the referenced manifest must be resolved for the referrer to use it.
         */
        public CacheKey.Stage requiredStage() {
            return requiredStage;
        }
    }

    /**
     * @param label module alias or slot name; the locator itself for template references
     */
    public record Reference(String from, String to, Kind kind, String label, boolean optional) {}

    /**
     * One referenced manifest. Moves through {@link ModuleState} at most once per resolution call:
     * either it is fetched ({@code LOADING} then {@code LOADED}/{@code FAILED}) or it is served from
     * cache and stays {@code UNRESOLVED}.
     */
    public static final class Entry {
        private final String locator;
        private final AtomicReference<ModuleState> state = new AtomicReference<>(ModuleState.UNRESOLVED);
        private final Map<CacheKey.Stage, Manifest> cached = new EnumMap<>(CacheKey.Stage.class);
        private volatile Manifest manifest;
        private volatile Throwable failure;

        Entry(String locator) {
            this.locator = locator;
        }

        public String locator() {
            return locator;
        }

        public ModuleState state() {
            return state.get();
        }

        public Manifest manifest() {
            return manifest;
        }

        public Throwable failure() {
            return failure;
        }

        public synchronized Optional<Manifest> cached(CacheKey.Stage stage) {
            return Optional.ofNullable(cached.get(stage));
        }

        synchronized void remember(CacheKey.Stage stage, Manifest value) {
            cached.put(stage, value);
        }

        boolean startLoading() {
            return transition(ModuleState.UNRESOLVED, ModuleState.LOADING);
        }

        void loaded(Manifest value) {
            this.manifest = value;
            if (!transition(ModuleState.LOADING, ModuleState.LOADED)) {
                throw new IllegalStateException("Manifest " + locator + " is not loading (" + state.get() + ")");
            }
        }

        void failed(Throwable cause) {
            this.failure = cause;
            if (!transition(ModuleState.LOADING, ModuleState.FAILED)) {
                throw new IllegalStateException("Manifest " + locator + " is not loading (" + state.get() + ")");
            }
        }

        private boolean transition(ModuleState from, ModuleState to) {
            if (!from.canMoveTo(to)) {
                throw new IllegalStateException("Illegal transition " + from + " -> " + to + " for " + locator);
            }
            return state.compareAndSet(from, to);
        }
    }
}
