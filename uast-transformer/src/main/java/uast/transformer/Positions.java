package uast.transformer;

import uast.nodes.Node;
import uast.nodes.NodeInt;
import uast.nodes.NodeObject;
import uast.nodes.Uast;

import java.util.Objects;

import static java.util.Map.entry;
import static uast.transformer.Ops.obj;
import static uast.transformer.Ops.offsetsToPositions;
import static uast.transformer.Ops.part;
import static uast.transformer.Ops.var;

/// Conversion of temporary offset fields into a canonical `@pos` node.
public final class Positions {

    private static final String REST = "_rest";
    private static final String START = "_start";
    private static final String END = "_end";

    private Positions() {}

    /// Builds the rule that consumes two numeric offset fields of any object and replaces them
    /// with a `uast:Positions` node under `@pos`.
    /// @param startKey the field holding the start offset
    /// @param endKey the field holding the end offset
    /// @return the mapping; construct fails with [UnexpectedTypeException] on non-integral offsets
    public static Mapping mapping(String startKey, String endKey) {
        return Mapping.map("positions(" + startKey + ", " + endKey + ")",
                part(REST, obj(
                        entry(startKey, var(START)),
                        entry(endKey, var(END)))),
                part(REST, obj(
                        entry(Uast.KEY_POS, offsetsToPositions(START, END)))));
    }

    record PositionsOp(String startVar, String endVar) implements Op {
        PositionsOp {
            Objects.requireNonNull(startVar, "startVar must not be null");
            Objects.requireNonNull(endVar, "endVar must not be null");
        }

        @Override
        public boolean check(State state, Node node) {
            if (!(node instanceof NodeObject pos) || !Uast.isType(pos, Uast.POSITIONS)) return false;
            final var start = offsetOf(pos.get("start"));
            final var end = offsetOf(pos.get("end"));
            return start != null && end != null && state.bind(startVar, start) && state.bind(endVar, end);
        }

        @Override
        public Node construct(State state, Node node) {
            final var start = UnexpectedTypeException.require(NodeInt.class, state.get(startVar), "start offset '" + startVar + "'");
            final var end = UnexpectedTypeException.require(NodeInt.class, state.get(endVar), "end offset '" + endVar + "'");
            return Uast.positions(start.value(), end.value());
        }

        private static NodeInt offsetOf(Node position) {
            return position instanceof NodeObject obj && obj.get("offset") instanceof NodeInt offset ? offset : null;
        }
    }
}
