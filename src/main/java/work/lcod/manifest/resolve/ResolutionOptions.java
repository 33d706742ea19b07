package work.lcod.manifest.resolve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import work.lcod.manifest.model.Node;
import work.lcod.manifest.parse.ManifestWriter;
import work.lcod.manifest.shared.Digests;

/**
 * Per-call resolution switches.
 *
 * @param ignoreCache        skip fresh cache entries (results are still stored)
 * @param slotContent        content for the root manifest's slots, by slot name; wins over imports and defaults
 * @param prefixModuleStyles add module styles to the style table as {@code <alias>.<style>}
 */
public record ResolutionOptions(boolean ignoreCache, Map<String, Node> slotContent, boolean prefixModuleStyles) {
    public static final ResolutionOptions DEFAULT = new ResolutionOptions(false, Map.of(), true);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ResolutionOptions {
        slotContent = slotContent == null ? Map.of() : Map.copyOf(slotContent);
    }

    public ResolutionOptions withIgnoreCache(boolean ignore) {
        return new ResolutionOptions(ignore, slotContent, prefixModuleStyles);
    }

    public ResolutionOptions withSlotContent(String slot, Node content) {
        var copy = new LinkedHashMap<>(slotContent);
        copy.put(slot, content);
        return new ResolutionOptions(ignoreCache, copy, prefixModuleStyles);
    }

    /**
     * Digest of every option that changes the resolved root. {@code ignoreCache} only changes how the
     * cache is used and is left out. Without slot content this equals {@link #dependencyFingerprint()}.
     */
    public String fingerprint() {
        if (slotContent.isEmpty()) {
            return dependencyFingerprint();
        }
        var content = new TreeMap<String, Object>();
        slotContent.forEach((slot, node) -> content.put(slot, ManifestWriter.nodeMap(node)));
        var fields = new LinkedHashMap<String, Object>();
        fields.put("prefixModuleStyles", prefixModuleStyles);
        fields.put("slotContent", content);
        return digest(fields);
    }

    /**
     * Digest of the options that also shape ancestors and modules; slot content only reaches the root.
     */
    public String dependencyFingerprint() {
        return digest(Map.of("prefixModuleStyles", prefixModuleStyles));
    }

    private static String digest(Map<String, Object> fields) {
        try {
            return Digests.sha256Hex(MAPPER.writeValueAsString(fields)).substring(0, 16);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to fingerprint resolution options", ex);
        }
    }
}
