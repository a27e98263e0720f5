package uast.nodes;

/// A boolean node.
public record NodeBool(boolean value) implements Node {

    private static final NodeBool TRUE = new NodeBool(true);
    private static final NodeBool FALSE = new NodeBool(false);

    public static NodeBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Kind kind() {
        return Kind.BOOL;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
