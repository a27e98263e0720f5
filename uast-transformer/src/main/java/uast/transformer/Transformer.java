package uast.transformer;

import uast.nodes.Node;

/// A pure function from one tree to another.
@FunctionalInterface
public interface Transformer {

    /// Transforms a whole tree.
    /// @param root the root of the input tree
    /// @return the transformed tree; the input is never modified
    /// @throws TransformException on a fatal error, in which case no result is produced
    Node transform(Node root);
}
