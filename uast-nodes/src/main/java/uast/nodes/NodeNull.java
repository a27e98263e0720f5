package uast.nodes;

/// The null node. Also used as a placeholder for deleted array elements.
public record NodeNull() implements Node {

    private static final NodeNull INSTANCE = new NodeNull();

    /// {@return the null node}
    public static NodeNull of() {
        return INSTANCE;
    }

    @Override
    public Kind kind() {
        return Kind.NULL;
    }

    @Override
    public boolean isEmpty() {
        return true;
    }

    @Override
    public String toString() {
        return "null";
    }
}
