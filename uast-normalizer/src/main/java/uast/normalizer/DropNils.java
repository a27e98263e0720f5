package uast.normalizer;

import uast.nodes.Node;
import uast.nodes.NodeArray;
import uast.nodes.NodeNull;
import uast.transformer.Op;
import uast.transformer.State;

import java.util.ArrayList;
import java.util.Objects;

/// Removes null placeholders from an array before handing it to `op`.
///
/// Earlier rules delete array elements by replacing them with null, so the array can be
/// compacted in one go. A null in place of the array reads as the empty array. Construct passes
/// through to `op` and does not put the nulls back.
public record DropNils(Op op) implements Op {

    public DropNils {
        Objects.requireNonNull(op, "op must not be null");
    }

    @Override
    public boolean check(State state, Node node) {
        if (node instanceof NodeNull) {
            return op.check(state, NodeArray.empty());
        }
        if (!(node instanceof NodeArray arr)) return false;
        final var out = new ArrayList<Node>(arr.size());
        for (final var element : arr.elements()) {
            if (!(element instanceof NodeNull)) out.add(element);
        }
        return op.check(state, out.size() == arr.size() ? arr : NodeArray.of(out));
    }

    @Override
    public Node construct(State state, Node node) {
        return op.construct(state, node);
    }

    @Override
    public boolean reversible() {
        return false;
    }
}
