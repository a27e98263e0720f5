package uast.nodes;

/// A 64-bit integer node.
public record NodeInt(long value) implements Node {

    public static NodeInt of(long value) {
        return new NodeInt(value);
    }

    @Override
    public Kind kind() {
        return Kind.INT;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
