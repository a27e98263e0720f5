/// Immutable tree values for native and canonical syntax trees.
///
/// A tree is built from [uast.nodes.Node] values: null, booleans, integers, floats, strings,
/// arrays and objects. Objects use the reserved keys in [uast.nodes.Uast] for the type
/// discriminator, the position range and raw tokens. [uast.nodes.NodeJson] reads and writes
/// trees as JSON.
package uast.nodes;
