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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Moves leading and trailing trivia out of a node.
///
/// The node loses its trivia fields. The trivia then either goes into the node's own trivia
/// target field (see [NormalizerConfig#triviaTargetFields()]), or the node is wrapped in a
/// `uast:Group` whose `Nodes` are `leading ++ [node] ++ trailing`.
///
/// Trivia of a token ends up in a group around the token, because the token has no better
/// place for it. When the parent is visited, every relocatable field that holds such a group
/// is unwrapped again: the elements before the first non-trivia element join the parent's
/// leading trivia, the ones after it join the trailing trivia, and the field gets the token
/// back. This relies on children being visited before their parents.
///
/// A node without any trivia is not matched, so the node is left as it is.
///
/// @param config the trivia tables
/// @param sub the pattern the relocated node is handed to
public record MoveTrivia(NormalizerConfig config, Op sub) implements Op {

    private static final Logger LOG = Logger.getLogger(MoveTrivia.class.getName());

    public MoveTrivia {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(sub, "sub must not be null");
    }

    @Override
    public boolean check(State state, Node node) {
        if (!(node instanceof NodeObject original)) return false;
        final var leading = new ArrayList<Node>();
        final var trailing = new ArrayList<Node>();

        var obj = original;
        final var lead = obj.get(config.leadingTriviaField());
        final var trail = obj.get(config.trailingTriviaField());
        if (lead instanceof NodeArray || trail instanceof NodeArray) {
            if (lead instanceof NodeArray arr) leading.addAll(arr.elements());
            if (trail instanceof NodeArray arr) trailing.addAll(arr.elements());
            obj = obj.without(config.leadingTriviaField(), config.trailingTriviaField());
        }

        final var members = new LinkedHashMap<>(obj.members());
        boolean unwrapped = false;
        for (final var entry : obj.members().entrySet()) {
            final var key = entry.getKey();
            if (!config.isRelocatable(key) || !(entry.getValue() instanceof NodeObject group)
                    || !Uast.isType(group, Uast.GROUP) || !(group.get(Uast.NODES) instanceof NodeArray nodes)) {
                continue;
            }
            final int anchor = firstNonTrivia(nodes);
            if (anchor < 0) {
                members.put(key, unanchored(original, key, nodes, leading));
            } else {
                leading.addAll(nodes.elements().subList(0, anchor));
                trailing.addAll(0, nodes.elements().subList(anchor + 1, nodes.size()));
                members.put(key, nodes.get(anchor));
            }
            unwrapped = true;
        }
        if (unwrapped) {
            obj = NodeObject.of(members);
        }

        if (leading.isEmpty() && trailing.isEmpty()) {
            return obj != original && sub.check(state, obj);
        }

        final var target = config.triviaTargetField(Uast.typeOf(obj));
        if (target.isPresent()) {
            final var field = target.get();
            if (!(obj.get(field) instanceof NodeArray existing)) {
                throw new InvariantViolationException("expected an array in " + Uast.typeOf(obj) + "." + field
                        + " to receive trivia, got " + obj.get(field));
            }
            return sub.check(state, obj.with(field, NodeArray.of(concat(leading, existing.elements(), trailing))));
        }

        final var wrapped = Uast.newObject(Uast.GROUP)
                .with(Uast.NODES, NodeArray.of(concat(leading, List.of(obj), trailing)));
        return sub.check(state, wrapped);
    }

    @Override
    public Node construct(State state, Node node) {
        throw new UnsupportedReverseException("trivia cannot be moved back into the nodes it came from");
    }

    @Override
    public boolean reversible() {
        return false;
    }

    private int firstNonTrivia(NodeArray nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            if (!config.isTrivia(nodes.get(i))) return i;
        }
        return -1;
    }

    private Node unanchored(NodeObject owner, String key, NodeArray nodes, List<Node> leading) {
        if (config.unanchoredTrivia() == UnanchoredTriviaPolicy.FAIL) {
            throw new InvariantViolationException("group in " + Uast.typeOf(owner) + "." + key
                    + " holds trivia only; cannot split it into leading and trailing trivia");
        }
        LOG.warning(() -> "Group in " + Uast.typeOf(owner) + "." + key + " holds " + nodes.size()
                + " trivia nodes and no token; treating all of them as leading trivia");
        leading.addAll(nodes.elements());
        return NodeNull.of();
    }

    private static List<Node> concat(List<Node> first, List<Node> second, List<Node> third) {
        final var out = new ArrayList<Node>(first.size() + second.size() + third.size());
        out.addAll(first);
        out.addAll(second);
        out.addAll(third);
        return out;
    }
}
