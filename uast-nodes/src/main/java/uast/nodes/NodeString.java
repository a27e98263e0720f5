package uast.nodes;

import java.util.Objects;

/// A string node.
public record NodeString(String value) implements Node {

    public NodeString {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static NodeString of(String value) {
        return new NodeString(value);
    }

    @Override
    public Kind kind() {
        return Kind.STRING;
    }

    @Override
    public String toString() {
        return NodeJson.toJson(this);
    }
}
