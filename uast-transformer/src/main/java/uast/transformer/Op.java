package uast.transformer;

import uast.nodes.Node;

/// A bidirectional pattern: the unit every rewrite rule is built from.
///
/// `check` matches a node and captures variables into a [State]; `construct` builds a node
/// from the captured variables. A mapping applies the source pattern's `check` and then the
/// target pattern's `construct`. Running a mapping in reverse swaps the two, so
/// `construct` of a source pattern is only exercised by reverse transforms.
public interface Op extends Sel {

    /// Builds a node from the variables bound in `state`.
    /// @param state the capture store filled by a successful check
    /// @param node the node being passed through from the previous stage, or `null`
    /// @return the constructed node, never `null`
    /// @throws TransformException if the bindings cannot produce a node
    Node construct(State state, Node node);

    /// {@return `true` if `construct` fully rebuilds what `check` consumed}
    ///
    /// Operators whose reverse path is a placeholder report `false` and fail with
    /// [UnsupportedReverseException] instead of returning a lossy result.
    default boolean reversible() {
        return true;
    }
}
