package uast.normalizer;

import uast.nodes.Node;
import uast.nodes.NodeArray;
import uast.nodes.NodeBool;
import uast.nodes.Uast;
import uast.transformer.Op;
import uast.transformer.State;
import uast.transformer.UnexpectedTypeException;
import uast.transformer.UnsupportedReverseException;

import java.util.Objects;

/// Extracts a marker element from an array and exposes its presence as a boolean.
///
/// The first element whose `@type` equals `keyword` is removed. `flag` is then checked against
/// `true` and `rest` against the array without that element, in original order. Without such an
/// element `flag` is checked against `false` and `rest` against the unchanged array.
///
/// Construct cannot put a removed marker back: it only succeeds when the flag is `false`.
///
/// @param keyword the `@type` of the marker, such as `ParamsKeyword`
/// @param flag the pattern for the presence flag
/// @param rest the pattern for the remaining elements
public record KeywordFlag(String keyword, Op flag, Op rest) implements Op {

    public KeywordFlag {
        Objects.requireNonNull(keyword, "keyword must not be null");
        Objects.requireNonNull(flag, "flag must not be null");
        Objects.requireNonNull(rest, "rest must not be null");
    }

    @Override
    public boolean check(State state, Node node) {
        if (!(node instanceof NodeArray arr)) return false;
        for (int i = 0; i < arr.size(); i++) {
            if (Uast.isType(arr.get(i), keyword)) {
                return flag.check(state, NodeBool.of(true)) && rest.check(state, arr.without(i));
            }
        }
        return flag.check(state, NodeBool.of(false)) && rest.check(state, arr);
    }

    @Override
    public Node construct(State state, Node node) {
        final var present = UnexpectedTypeException.require(NodeBool.class, flag.construct(state, null), "flag of " + keyword);
        final var remainder = rest.construct(state, node);
        if (present.value()) {
            throw new UnsupportedReverseException("cannot re-create the removed " + keyword + " element");
        }
        return remainder;
    }

    @Override
    public boolean reversible() {
        return false;
    }
}
