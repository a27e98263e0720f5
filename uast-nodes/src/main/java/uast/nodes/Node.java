package uast.nodes;

/// A value in the syntax tree model.
///
/// Instances are immutable. Operations that "change" a node return a new node and share every
/// untouched child with the original, so a subtree reachable through several paths can never be
/// altered behind the back of another path.
///
/// ## Pattern Matching
/// ```java
/// if (node instanceof NodeObject obj && Uast.isType(obj, Uast.GROUP)) {
///     NodeArray items = (NodeArray) obj.get("Nodes");
/// }
/// ```
public sealed interface Node
        permits NodeNull, NodeBool, NodeInt, NodeFloat, NodeString, NodeArray, NodeObject {

    /// {@return the kind of this node}
    Kind kind();

    /// {@return `true` for null nodes, empty arrays and empty objects}
    default boolean isEmpty() {
        return false;
    }

    /// {@return the compact JSON form of this node}
    String toString();
}
