package work.lcod.manifest.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A structure node: a tag name plus its property bag. In manifest text a node is the
 * single-key object {@code {tag: {...props}}}.
 */
public record Node(String tag, PropertyBag props) {
    public Node {
        Objects.requireNonNull(tag, "tag");
        if (tag.isBlank()) {
            throw new IllegalArgumentException("Node tag must not be blank");
        }
        props = props == null ? PropertyBag.empty() : props;
    }

    public static Node of(String tag) {
        return new Node(tag, PropertyBag.empty());
    }

    public Optional<String> id() {
        Object id = props.attributes().get("id");
        return id == null ? Optional.empty() : Optional.of(String.valueOf(id));
    }

    public Optional<String> module() {
        return Optional.ofNullable(props.module());
    }

    public Node withProps(PropertyBag newProps) {
        return new Node(tag, newProps);
    }

    /**
     * Depth of this subtree, counting this node as 1.
     */
    public int depth() {
        int deepest = 0;
        for (var child : props.children()) {
            deepest = Math.max(deepest, child.depth());
        }
        return deepest + 1;
    }
}
