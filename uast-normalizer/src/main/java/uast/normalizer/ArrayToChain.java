package uast.normalizer;

import uast.nodes.Node;
import uast.nodes.NodeArray;
import uast.nodes.NodeNull;
import uast.nodes.NodeObject;
import uast.transformer.InvariantViolationException;
import uast.transformer.Op;
import uast.transformer.State;
import uast.transformer.UnexpectedTypeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Converts between a list of modifier objects plus a terminal node and a nested chain.
///
/// In the chain every modifier holds the next one under `field`, and the innermost modifier
/// holds the terminal. The first list element is the outermost link:
///
/// ```
/// modifiers [ref, out], terminal int   <->   ref{Type: out{Type: int}}
/// ```
///
/// @param field the field linking one modifier to the next
/// @param modifiers the pattern for the list of modifiers, outermost first
/// @param terminal the pattern for the innermost node
public record ArrayToChain(String field, Op modifiers, Op terminal) implements Op {

    public ArrayToChain {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(modifiers, "modifiers must not be null");
        Objects.requireNonNull(terminal, "terminal must not be null");
    }

    /// Decodes a chain: peels links off from the outside until a node without `field` remains.
    @Override
    public boolean check(State state, Node node) {
        final var links = new ArrayList<Node>();
        var current = node;
        while (current instanceof NodeObject link && link.has(field)) {
            links.add(link.without(field));
            current = link.get(field);
        }
        return terminal.check(state, current) && modifiers.check(state, NodeArray.of(links));
    }

    /// Encodes a chain, wrapping the terminal from the innermost modifier outwards.
    ///
    /// The first modifier in the list becomes the outermost link, so `[scoped, ref]` around `T`
    /// yields `scoped(ref(T))` and not `ref(scoped(T))`.
    /// @throws InvariantViolationException if a modifier already holds `field`
    @Override
    public Node construct(State state, Node node) {
        final var mods = modifierList(modifiers.construct(state, null));
        var chain = terminal.construct(state, node);
        for (int i = mods.size() - 1; i >= 0; i--) {
            final var mod = UnexpectedTypeException.require(NodeObject.class, mods.get(i), "modifier " + i);
            if (mod.has(field)) {
                throw new InvariantViolationException("modifier " + mod + " already has field '" + field + "'");
            }
            chain = mod.with(field, chain);
        }
        return chain;
    }

    private static List<Node> modifierList(Node node) {
        if (node instanceof NodeNull) return List.of();
        return UnexpectedTypeException.require(NodeArray.class, node, "modifiers").elements();
    }
}
