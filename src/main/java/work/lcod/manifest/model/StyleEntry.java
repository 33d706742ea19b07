package work.lcod.manifest.model;

import java.util.Map;

/**
 * One entry of a manifest style table: a property map with an optional parent style,
 * or a raw declaration string such as {@code "padding: 4px; color: red"}.
 */
public record StyleEntry(Map<String, Object> properties, String parent, String declaration) {
    public static final String EXTENDS = "extends";

    public StyleEntry {
        properties = Values.freezeMap(properties);
        if (properties.containsKey(EXTENDS)) {
            throw new IllegalArgumentException("'extends' must be passed as parent, not as a property");
        }
        if (declaration != null && parent != null) {
            throw new IllegalArgumentException("A declaration style cannot extend another style");
        }
    }

    public static StyleEntry of(Map<String, Object> properties) {
        return new StyleEntry(properties, null, null);
    }

    public static StyleEntry extending(String parent, Map<String, Object> properties) {
        return new StyleEntry(properties, parent, null);
    }

    public static StyleEntry declaration(String css) {
        return new StyleEntry(Map.of(), null, css);
    }

    public boolean hasParent() {
        return parent != null && !parent.isBlank();
    }

    public boolean isDeclaration() {
        return declaration != null;
    }
}
