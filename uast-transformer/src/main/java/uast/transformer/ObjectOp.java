package uast.transformer;

import uast.nodes.Node;
import uast.nodes.NodeObject;

import java.util.Set;

/// A pattern over a known set of object fields.
///
/// Object patterns can be joined, selected between, or combined with a capture of the remaining
/// fields (see [Ops#part(String, ObjectOp)]).
public interface ObjectOp extends Op {

    /// {@return every field name this pattern may consume}
    Set<String> fieldNames();

    /// Tests an object that holds only fields from [#fieldNames()].
    /// @param state the capture store
    /// @param node the projected object
    /// @return `true` if the object matches exactly
    boolean checkObject(State state, NodeObject node);

    /// Builds the fields described by this pattern.
    /// @param state the capture store
    /// @param node the object being passed through, or `null`
    /// @return a new object with the constructed fields
    NodeObject constructObject(State state, NodeObject node);

    @Override
    default boolean check(State state, Node node) {
        return node instanceof NodeObject obj && checkObject(state, obj);
    }

    @Override
    default Node construct(State state, Node node) {
        return constructObject(state, node instanceof NodeObject obj ? obj : null);
    }
}
