package uast.transformer;

import uast.nodes.Node;

/// A bound value has a different kind than an operator requires.
@SuppressWarnings("serial")
public final class UnexpectedTypeException extends TransformException {

    private static final long serialVersionUID = 1L;

    private static final int MAX_SHOWN = 120;

    public UnexpectedTypeException(String what, String expected, Node actual) {
        super(what + ": expected " + expected + ", got " + actual.kind() + " " + abbreviate(actual));
    }

    /// Casts a node to the required type.
    /// @param type the required node class
    /// @param node the value to check
    /// @param what describes the value in the error message
    /// @param <T> the required node type
    /// @return the node, cast
    /// @throws UnexpectedTypeException if the node has another type
    public static <T extends Node> T require(Class<T> type, Node node, String what) {
        if (!type.isInstance(node)) {
            throw new UnexpectedTypeException(what, type.getSimpleName(), node);
        }
        return type.cast(node);
    }

    private static String abbreviate(Node node) {
        final var text = node.toString();
        return text.length() <= MAX_SHOWN ? text : text.substring(0, MAX_SHOWN) + "...";
    }
}
