package work.lcod.manifest.error;

import java.util.List;

/**
 * Cycle in a template chain, a module graph, or a style {@code extends} chain.
 */
public final class CircularReferenceException extends ResolutionException {
    private final List<String> chain;

    public CircularReferenceException(String what, List<String> chain) {
        super(
            ErrorKind.CIRCULAR_REFERENCE,
            chain.isEmpty() ? null : chain.get(chain.size() - 1),
            "Circular " + what + " detected: " + String.join(" -> ", chain)
        );
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
