package uast.nodes;

/// A double precision floating point node.
public record NodeFloat(double value) implements Node {

    public static NodeFloat of(double value) {
        return new NodeFloat(value);
    }

    @Override
    public Kind kind() {
        return Kind.FLOAT;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
