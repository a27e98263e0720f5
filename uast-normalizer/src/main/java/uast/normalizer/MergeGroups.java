package uast.normalizer;

import uast.nodes.Node;
import uast.nodes.NodeArray;
import uast.nodes.NodeNull;
import uast.nodes.NodeObject;
import uast.nodes.Uast;
import uast.transformer.InvariantViolationException;
import uast.transformer.Op;
import uast.transformer.State;
import uast.transformer.UnsupportedReverseException;

import java.util.ArrayList;
import java.util.Objects;

/// Collapses a `uast:Group` around a `uast:FunctionGroup` and tidies function groups.
///
/// - A group whose `Nodes` contain a function group is replaced by that function group, with
///   the group's other elements spliced around the function group's own `Nodes`.
/// - A function group loses the null entries of its `Nodes`. Groups nested inside its array
///   slots (attributes, modifiers) are replaced by their contents.
///
/// Anything else, and any node that is already tidy, is not matched.
public record MergeGroups(Op sub) implements Op {

    public MergeGroups {
        Objects.requireNonNull(sub, "sub must not be null");
    }

    @Override
    public boolean check(State state, Node node) {
        if (!(node instanceof NodeObject obj)) return false;
        return switch (Uast.typeOf(obj)) {
            case Uast.GROUP -> checkGroup(state, obj);
            case Uast.FUNCTION_GROUP -> checkFunctionGroup(state, obj);
            default -> false;
        };
    }

    private boolean checkGroup(State state, NodeObject group) {
        final var nodes = nodesOf(group);
        int index = -1;
        for (int i = 0; i < nodes.size(); i++) {
            if (Uast.isType(nodes.get(i), Uast.FUNCTION_GROUP)) {
                index = i;
                break;
            }
        }
        if (index < 0) return false;

        final var functionGroup = (NodeObject) nodes.get(index);
        final var out = new ArrayList<Node>();
        out.addAll(nodes.elements().subList(0, index));
        out.addAll(nodesOf(functionGroup).elements());
        out.addAll(nodes.elements().subList(index + 1, nodes.size()));
        return sub.check(state, functionGroup.with(Uast.NODES, NodeArray.of(out)));
    }

    private boolean checkFunctionGroup(State state, NodeObject functionGroup) {
        final var nodes = nodesOf(functionGroup);
        final var out = new ArrayList<Node>(nodes.size());
        boolean modified = false;
        for (final var element : nodes.elements()) {
            if (element instanceof NodeNull) {
                modified = true;
            } else if (element instanceof NodeArray slot) {
                final var flat = flatten(slot);
                modified |= flat != slot;
                out.add(flat);
            } else {
                out.add(element);
            }
        }
        return modified && sub.check(state, functionGroup.with(Uast.NODES, NodeArray.of(out)));
    }

    /// Replaces every group in an array slot by its contents.
    private static NodeArray flatten(NodeArray slot) {
        ArrayList<Node> out = null;
        for (int i = 0; i < slot.size(); i++) {
            final var element = slot.get(i);
            if (Uast.isType(element, Uast.GROUP)) {
                if (out == null) out = new ArrayList<>(slot.elements().subList(0, i));
                out.addAll(nodesOf((NodeObject) element).elements());
            } else if (out != null) {
                out.add(element);
            }
        }
        return out == null ? slot : NodeArray.of(out);
    }

    private static NodeArray nodesOf(NodeObject group) {
        if (!(group.get(Uast.NODES) instanceof NodeArray nodes)) {
            throw new InvariantViolationException("expected an array in " + Uast.typeOf(group) + "." + Uast.NODES
                    + ", got " + group.get(Uast.NODES));
        }
        return nodes;
    }

    @Override
    public Node construct(State state, Node node) {
        throw new UnsupportedReverseException("merged groups cannot be split again");
    }

    @Override
    public boolean reversible() {
        return false;
    }
}
