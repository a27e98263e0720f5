package uast.transformer;

import uast.nodes.Node;

/// A check-only pattern: tests a node without being able to build one.
@FunctionalInterface
public interface Sel {

    /// Tests whether `node` conforms to this pattern.
    ///
    /// A `false` result means "try the next rule". It is not an error, and any bindings made
    /// while testing are discarded by the caller.
    /// @param state the capture store of the current attempt
    /// @param node the node to test
    /// @return `true` if the node matches
    boolean check(State state, Node node);
}
