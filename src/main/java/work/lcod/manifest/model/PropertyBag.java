package work.lcod.manifest.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node properties: the reserved {@code text}, {@code children} and {@code module} keys plus open attributes.
 *
 * @param singleChild whether {@code children} was written as one node rather than a sequence;
 *                    kept so the manifest serializes back in the shape it was authored in
 */
public record PropertyBag(
    String text,
    List<Node> children,
    boolean singleChild,
    String module,
    Map<String, Object> attributes
) {
    public static final String TEXT = "text";
    public static final String CHILDREN = "children";
    public static final String MODULE = "module";
    public static final Set<String> RESERVED = Set.of(TEXT, CHILDREN, MODULE);

    private static final PropertyBag EMPTY = new PropertyBag(null, List.of(), false, null, Map.of());

    public PropertyBag {
        children = Values.freezeList(children);
        singleChild = singleChild && children.size() == 1;
        attributes = Values.freezeMap(attributes);
        for (var key : attributes.keySet()) {
            if (RESERVED.contains(key)) {
                throw new IllegalArgumentException("Reserved key used as attribute: " + key);
            }
        }
    }

    public static PropertyBag empty() {
        return EMPTY;
    }

    public boolean optional() {
        return Boolean.TRUE.equals(attributes.get("optional"));
    }

    public PropertyBag withText(String newText) {
        return new PropertyBag(newText, children, singleChild, module, attributes);
    }

    public PropertyBag withChildren(List<Node> newChildren, boolean single) {
        return new PropertyBag(text, newChildren, single, module, attributes);
    }

    public PropertyBag withModule(String newModule) {
        return new PropertyBag(text, children, singleChild, newModule, attributes);
    }
}
