package uast.transformer;

import uast.nodes.Node;
import uast.nodes.Uast;

import java.util.Objects;
import java.util.Optional;

import static java.util.Map.entry;
import static uast.transformer.Ops.join;
import static uast.transformer.Ops.obj;
import static uast.transformer.Ops.string;
import static uast.transformer.Ops.uastType;
import static uast.transformer.Ops.var;

/// One rewrite rule: a source pattern to check and a target pattern to construct.
///
/// @param name a label used in log output
/// @param source the pattern a node must match
/// @param target the pattern built from the captured variables
/// @param semanticType the canonical type this rule produces, or `null`
public record Mapping(String name, Op source, Op target, String semanticType) {

    private static final String POS = "@pos";

    public Mapping {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    public static Mapping map(Op source, Op target) {
        return map("map", source, target);
    }

    public static Mapping map(String name, Op source, Op target) {
        return new Mapping(name, source, target, null);
    }

    /// Maps a native node type to a canonical one.
    ///
    /// The source additionally matches `@type` against `nativeType` and captures `@pos`; the
    /// target is a [Ops#uastType] object that carries the captured `@pos` over.
    /// @param nativeType the native type discriminator
    /// @param uastType the canonical type produced
    /// @param source the remaining native fields, matched exactly
    /// @param target the canonical fields to set
    /// @return the mapping
    public static Mapping semantic(String nativeType, String uastType, ObjectOp source, ObjectOp target) {
        final var src = join(obj(
                entry(Uast.KEY_TYPE, string(nativeType)),
                entry(Uast.KEY_POS, var(POS))), source);
        final var dst = uastType(uastType, join(target, obj(entry(Uast.KEY_POS, var(POS)))));
        return new Mapping(nativeType, src, dst, uastType);
    }

    /// Applies the rule to one node.
    ///
    /// Every attempt gets a fresh [State], so nothing captured by a failed attempt is visible to
    /// the next one.
    /// @param node the node to rewrite
    /// @return the rewritten node, or empty if the source pattern did not match
    /// @throws TransformException if the match succeeded but the target could not be built
    public Optional<Node> apply(Node node) {
        final var state = new State();
        if (!source.check(state, node)) {
            return Optional.empty();
        }
        return Optional.of(target.construct(state, null));
    }

    /// {@return the rule with source and target swapped}
    public Mapping reverse() {
        return new Mapping(name + " (reverse)", target, source, semanticType);
    }

    /// {@return `true` if [#reverse()] can construct what this rule consumed}
    public boolean reversible() {
        return source.reversible();
    }
}
