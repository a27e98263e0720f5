/// Bidirectional tree pattern matching and rewriting.
///
/// A rule ([Mapping]) pairs a source [Op] with a target [Op]. Applying a rule checks the source
/// against a node, capturing variables into a [State], and then constructs the target from those
/// variables. A [Mappings] stage applies a list of rules bottom-up to a whole tree, and a
/// [Pipeline] chains stages.
///
/// A pattern that does not match simply returns `false`. Fatal conditions are reported with
/// subclasses of [TransformException] and abort the whole transform.
package uast.transformer;
