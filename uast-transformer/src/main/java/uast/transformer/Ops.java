package uast.transformer;

import uast.nodes.Kind;
import uast.nodes.Node;
import uast.nodes.NodeArray;
import uast.nodes.NodeBool;
import uast.nodes.NodeInt;
import uast.nodes.NodeNull;
import uast.nodes.NodeObject;
import uast.nodes.NodeString;
import uast.nodes.Uast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Factories for the base patterns that rule tables are written with.
///
/// Rule tables are meant to be read as data, so the usual entry point is a static import:
///
/// ```java
/// import static java.util.Map.entry;
/// import static uast.transformer.Ops.*;
///
/// var src = obj(
///         entry("Value", var("name")),
///         entry("ValueText", var("name")),
///         entry("Text", any()));
/// ```
public final class Ops {

    private Ops() {}

    // ---------------------------------------------------------------- values

    /// {@return a pattern that matches every node}
    ///
    /// Nothing is captured, so the pattern cannot construct a node: its reverse path fails with
    /// [UnsupportedReverseException].
    public static Op any() {
        return AnyOp.INSTANCE;
    }

    /// {@return a capture: binds the node under `name` on check and emits it on construct}
    public static Op var(String name) {
        return new VarOp(name);
    }

    /// {@return an exact-value match that constructs the same value}
    public static Op is(Node value) {
        return new IsOp(value);
    }

    public static Op nil() {
        return is(NodeNull.of());
    }

    public static Op string(String value) {
        return is(NodeString.of(value));
    }

    public static Op integer(long value) {
        return is(NodeInt.of(value));
    }

    public static Op bool(boolean value) {
        return is(NodeBool.of(value));
    }

    // ---------------------------------------------------------------- structure

    /// {@return an exact object shape}
    /// @see Obj
    @SafeVarargs
    public static Obj obj(Map.Entry<String, ? extends Op>... fields) {
        return Obj.of(fields);
    }

    /// Matches the listed fields and captures all remaining fields as one object under `var`.
    ///
    /// On construct the listed fields are built first and the captured remainder is appended.
    /// @param var the capture name for the remaining fields
    /// @param fields the pattern over the known fields
    /// @return the pattern
    public static Op part(String var, ObjectOp fields) {
        return new PartOp(var, fields);
    }

    /// {@return an array of exactly these elements, in order}
    public static Op arr(Op... elements) {
        return new ArrOp(List.of(elements));
    }

    /// {@return an array of exactly one element}
    public static Op one(Op element) {
        return arr(element);
    }

    /// {@return `op`, guarded by a check-only selector}
    public static Op check(Sel sel, Op op) {
        return new CheckOp(sel, op);
    }

    /// {@return `op`, restricted to nodes that are not null, an empty array or an empty object}
    public static Op notEmpty(Op op) {
        return new NotEmptyOp(op);
    }

    /// Concatenation: the trailing elements are matched one to one, and the leading slice of any
    /// length is matched by `head`.
    /// @param head pattern for the leading slice; a null head constructs as an empty slice
    /// @param tail patterns for the last elements
    /// @return the pattern
    public static Op append(Op head, Op... tail) {
        return new AppendOp(head, List.of(tail));
    }

    /// {@return an array whose first element matches `first` and whose remainder matches `rest`}
    public static Op prependOne(Op first, Op rest) {
        return new PrependOneOp(first, rest);
    }

    /// Canonical object pattern.
    ///
    /// Check requires the `@type` discriminator and matches the listed fields, ignoring the
    /// schema fields that were left out. Construct starts from the schema defaults of `type`.
    /// @param type a canonical type name, see [Uast]
    /// @param fields the pattern over the fields that carry information
    /// @return the pattern
    /// @throws IllegalArgumentException if `type` is not canonical
    public static Op uastType(String type, ObjectOp fields) {
        return new UastTypeOp(type, fields);
    }

    /// {@return a pattern over the union of disjoint field sets}
    /// @throws IllegalArgumentException if two parts share a field
    public static ObjectOp join(ObjectOp... parts) {
        return new JoinObjOp(List.of(parts));
    }

    // ---------------------------------------------------------------- alternatives

    /// Ordered alternatives.
    ///
    /// The first case that matches wins and its index is bound under `var`, so construct can
    /// pick the same branch again. Each case is tried on a scratch copy of the state.
    /// @param var the disambiguation tag
    /// @param cases the alternatives, in priority order
    /// @return the pattern
    public static Op cases(String var, Op... cases) {
        return new CasesOp(var, List.of(cases));
    }

    /// Ordered alternatives over object shapes, sharing the fields of `common`.
    /// @param var the disambiguation tag
    /// @param common fields every case has, or `null`
    /// @param cases the alternatives, in priority order
    /// @return the pattern
    public static ObjectOp casesObj(String var, Obj common, List<Obj> cases) {
        final var out = new ArrayList<ObjectOp>(cases.size());
        for (final var c : cases) {
            out.add(common == null ? c : common.merge(c));
        }
        return new CasesObjOp(var, out);
    }

    /// Two alternatives tagged by a boolean: `var` is bound to `true` when `then` matched.
    public static Op ifThen(String var, Op then, Op otherwise) {
        return new IfOp(var, then, otherwise);
    }

    // ---------------------------------------------------------------- helpers

    /// {@return a canonical `uast:Positions` builder from two captured offsets}
    /// @see Positions
    public static Op offsetsToPositions(String startVar, String endVar) {
        return new Positions.PositionsOp(startVar, endVar);
    }

    /// {@return a raw comment token splitter}
    /// @see Comments
    public static Op commentText(String startToken, String endToken, String var) {
        return new Comments.CommentTextOp(startToken, endToken, var);
    }

    /// {@return the fields of a `uast:Comment` built from a [#commentText] capture}
    public static ObjectOp commentNode(boolean block, String var) {
        return new Comments.CommentNodeOp(block, var);
    }

    // ---------------------------------------------------------------- selectors

    /// {@return a selector requiring each listed field to be present and to match}
    ///
    /// Fields that are not listed are ignored.
    @SafeVarargs
    public static Sel has(Map.Entry<String, ? extends Sel>... fields) {
        final var out = new LinkedHashMap<String, Sel>(fields.length);
        for (final var entry : fields) {
            out.put(entry.getKey(), entry.getValue());
        }
        return new HasSel(Map.copyOf(out));
    }

    public static Sel hasType(String type) {
        return new TypeSel(type);
    }

    public static Sel in(Node... values) {
        return new InSel(Set.of(values));
    }

    public static Sel in(String... values) {
        return in(Arrays.stream(values).map(NodeString::of).toArray(Node[]::new));
    }

    public static Sel not(Sel sel) {
        return new NotSel(sel);
    }

    public static Sel ofKind(Kind... kinds) {
        final var set = EnumSet.noneOf(Kind.class);
        set.addAll(Arrays.asList(kinds));
        return new KindSel(set);
    }

    // ---------------------------------------------------------------- shared plumbing

    /// {@return the members of `node` whose names are in `names`, in node order}
    static NodeObject project(NodeObject node, Set<String> names) {
        final var out = new LinkedHashMap<String, Node>();
        for (final var entry : node.members().entrySet()) {
            if (names.contains(entry.getKey())) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return out.size() == node.size() ? node : NodeObject.of(out);
    }

    /// {@return the elements of an array value; null reads as the empty array}
    static List<Node> elementsOf(Node node, String what) {
        if (node instanceof NodeNull) return List.of();
        return UnexpectedTypeException.require(NodeArray.class, node, what).elements();
    }

    static boolean checkCases(State state, String var, List<? extends Op> cases, Node node) {
        for (int i = 0; i < cases.size(); i++) {
            final var scratch = state.copy();
            if (scratch.bind(var, NodeInt.of(i)) && cases.get(i).check(scratch, node)) {
                state.commit(scratch);
                return true;
            }
        }
        return false;
    }

    static int caseIndex(State state, String var, int size) {
        final var index = UnexpectedTypeException.require(NodeInt.class, state.get(var), "case tag '" + var + "'").value();
        if (index < 0 || index >= size) {
            throw new InvariantViolationException("case tag '" + var + "' = " + index + " is out of range for " + size + " cases");
        }
        return (int) index;
    }

    private static boolean allReversible(List<? extends Op> ops) {
        return ops.stream().allMatch(Op::reversible);
    }

    // ---------------------------------------------------------------- implementations

    private record AnyOp() implements Op {
        static final AnyOp INSTANCE = new AnyOp();

        @Override
        public boolean check(State state, Node node) {
            return true;
        }

        @Override
        public Node construct(State state, Node node) {
            throw new UnsupportedReverseException("any() discards what it matched and cannot construct a node");
        }

        @Override
        public boolean reversible() {
            return false;
        }
    }

    private record VarOp(String name) implements Op {
        VarOp {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public boolean check(State state, Node node) {
            return state.bind(name, node);
        }

        @Override
        public Node construct(State state, Node node) {
            return state.get(name);
        }
    }

    private record IsOp(Node value) implements Op {
        IsOp {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean check(State state, Node node) {
            return value.equals(node);
        }

        @Override
        public Node construct(State state, Node node) {
            return value;
        }
    }

    private record ArrOp(List<Op> elements) implements Op {
        @Override
        public boolean check(State state, Node node) {
            if (!(node instanceof NodeArray arr) || arr.size() != elements.size()) return false;
            for (int i = 0; i < elements.size(); i++) {
                if (!elements.get(i).check(state, arr.get(i))) return false;
            }
            return true;
        }

        @Override
        public Node construct(State state, Node node) {
            final var previous = node instanceof NodeArray arr && arr.size() == elements.size() ? arr : null;
            final var out = new ArrayList<Node>(elements.size());
            for (int i = 0; i < elements.size(); i++) {
                out.add(elements.get(i).construct(state, previous == null ? null : previous.get(i)));
            }
            return NodeArray.of(out);
        }

        @Override
        public boolean reversible() {
            return allReversible(elements);
        }
    }

    private record CheckOp(Sel sel, Op op) implements Op {
        CheckOp {
            Objects.requireNonNull(sel, "sel must not be null");
            Objects.requireNonNull(op, "op must not be null");
        }

        @Override
        public boolean check(State state, Node node) {
            return sel.check(state, node) && op.check(state, node);
        }

        @Override
        public Node construct(State state, Node node) {
            return op.construct(state, node);
        }

        @Override
        public boolean reversible() {
            return op.reversible();
        }
    }

    private record NotEmptyOp(Op op) implements Op {
        @Override
        public boolean check(State state, Node node) {
            return !node.isEmpty() && op.check(state, node);
        }

        @Override
        public Node construct(State state, Node node) {
            final var out = op.construct(state, node);
            if (out.isEmpty()) {
                throw new InvariantViolationException("expected a non-empty value, got " + out);
            }
            return out;
        }

        @Override
        public boolean reversible() {
            return op.reversible();
        }
    }

    private record PartOp(String var, ObjectOp fields) implements Op {
        PartOp {
            Objects.requireNonNull(var, "var must not be null");
            Objects.requireNonNull(fields, "fields must not be null");
        }

        @Override
        public boolean check(State state, Node node) {
            if (!(node instanceof NodeObject obj)) return false;
            final var known = project(obj, fields.fieldNames());
            if (!fields.checkObject(state, known)) return false;
            return state.bind(var, obj.without(known.keys().toArray(String[]::new)));
        }

        @Override
        public Node construct(State state, Node node) {
            final var rest = UnexpectedTypeException.require(NodeObject.class, state.get(var), "remaining fields '" + var + "'");
            final var previous = node instanceof NodeObject obj ? project(obj, fields.fieldNames()) : null;
            final var out = new LinkedHashMap<>(fields.constructObject(state, previous).members());
            for (final var entry : rest.members().entrySet()) {
                if (out.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                    throw new InvariantViolationException("field '" + entry.getKey() + "' is constructed and also kept in '" + var + "'");
                }
            }
            return NodeObject.of(out);
        }

        @Override
        public boolean reversible() {
            return fields.reversible();
        }
    }

    private record AppendOp(Op head, List<Op> tail) implements Op {
        @Override
        public boolean check(State state, Node node) {
            if (!(node instanceof NodeArray arr) || arr.size() < tail.size()) return false;
            final int split = arr.size() - tail.size();
            if (!head.check(state, arr.slice(0, split))) return false;
            for (int i = 0; i < tail.size(); i++) {
                if (!tail.get(i).check(state, arr.get(split + i))) return false;
            }
            return true;
        }

        @Override
        public Node construct(State state, Node node) {
            final var out = new ArrayList<>(elementsOf(head.construct(state, null), "head of append"));
            for (final var op : tail) {
                out.add(op.construct(state, null));
            }
            return NodeArray.of(out);
        }

        @Override
        public boolean reversible() {
            return head.reversible() && allReversible(tail);
        }
    }

    private record PrependOneOp(Op first, Op rest) implements Op {
        @Override
        public boolean check(State state, Node node) {
            return node instanceof NodeArray arr && arr.size() > 0
                    && first.check(state, arr.get(0))
                    && rest.check(state, arr.slice(1, arr.size()));
        }

        @Override
        public Node construct(State state, Node node) {
            final var out = new ArrayList<Node>();
            out.add(first.construct(state, null));
            out.addAll(elementsOf(rest.construct(state, null), "rest of prependOne"));
            return NodeArray.of(out);
        }

        @Override
        public boolean reversible() {
            return first.reversible() && rest.reversible();
        }
    }

    private record UastTypeOp(String type, ObjectOp fields) implements Op {
        UastTypeOp {
            if (!Uast.isCanonical(type)) {
                throw new IllegalArgumentException("not a canonical type: " + type);
            }
            Objects.requireNonNull(fields, "fields must not be null");
        }

        @Override
        public boolean check(State state, Node node) {
            return node instanceof NodeObject obj && Uast.isType(obj, type)
                    && fields.checkObject(state, project(obj, fields.fieldNames()));
        }

        @Override
        public Node construct(State state, Node node) {
            final var previous = node instanceof NodeObject obj ? project(obj, fields.fieldNames()) : null;
            final var out = new LinkedHashMap<>(Uast.newObject(type).members());
            out.putAll(fields.constructObject(state, previous).members());
            return NodeObject.of(out);
        }

        @Override
        public boolean reversible() {
            return fields.reversible();
        }
    }

    private record JoinObjOp(List<ObjectOp> parts, Set<String> fieldNames) implements ObjectOp {
        JoinObjOp(List<ObjectOp> parts) {
            this(parts, union(parts));
        }

        private static Set<String> union(List<ObjectOp> parts) {
            final var names = new LinkedHashSet<String>();
            for (final var part : parts) {
                for (final var name : part.fieldNames()) {
                    if (!names.add(name)) {
                        throw new IllegalArgumentException("field joined twice: " + name);
                    }
                }
            }
            return Set.copyOf(names);
        }

        @Override
        public boolean checkObject(State state, NodeObject node) {
            if (!fieldNames.containsAll(node.keys())) return false;
            for (final var part : parts) {
                if (!part.checkObject(state, project(node, part.fieldNames()))) return false;
            }
            return true;
        }

        @Override
        public NodeObject constructObject(State state, NodeObject node) {
            final var out = new LinkedHashMap<String, Node>();
            for (final var part : parts) {
                final var previous = node == null ? null : project(node, part.fieldNames());
                for (final var entry : part.constructObject(state, previous).members().entrySet()) {
                    if (out.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                        throw new InvariantViolationException("field '" + entry.getKey() + "' is constructed twice");
                    }
                }
            }
            return NodeObject.of(out);
        }

        @Override
        public boolean reversible() {
            return allReversible(parts);
        }
    }

    private record CasesOp(String var, List<Op> cases) implements Op {
        @Override
        public boolean check(State state, Node node) {
            return checkCases(state, var, cases, node);
        }

        @Override
        public Node construct(State state, Node node) {
            return cases.get(caseIndex(state, var, cases.size())).construct(state, node);
        }

        @Override
        public boolean reversible() {
            return allReversible(cases);
        }
    }

    private record CasesObjOp(String var, List<ObjectOp> cases) implements ObjectOp {
        @Override
        public Set<String> fieldNames() {
            final var names = new LinkedHashSet<String>();
            cases.forEach(c -> names.addAll(c.fieldNames()));
            return names;
        }

        @Override
        public boolean checkObject(State state, NodeObject node) {
            return checkCases(state, var, cases, node);
        }

        @Override
        public NodeObject constructObject(State state, NodeObject node) {
            return cases.get(caseIndex(state, var, cases.size())).constructObject(state, node);
        }

        @Override
        public boolean reversible() {
            return allReversible(cases);
        }
    }

    private record IfOp(String var, Op then, Op otherwise) implements Op {
        @Override
        public boolean check(State state, Node node) {
            final var scratch = state.copy();
            if (scratch.bind(var, NodeBool.of(true)) && then.check(scratch, node)) {
                state.commit(scratch);
                return true;
            }
            final var fallback = state.copy();
            if (fallback.bind(var, NodeBool.of(false)) && otherwise.check(fallback, node)) {
                state.commit(fallback);
                return true;
            }
            return false;
        }

        @Override
        public Node construct(State state, Node node) {
            final var flag = UnexpectedTypeException.require(NodeBool.class, state.get(var), "flag '" + var + "'");
            return (flag.value() ? then : otherwise).construct(state, node);
        }

        @Override
        public boolean reversible() {
            return then.reversible() && otherwise.reversible();
        }
    }

    private record HasSel(Map<String, Sel> fields) implements Sel {
        @Override
        public boolean check(State state, Node node) {
            if (!(node instanceof NodeObject obj)) return false;
            for (final var entry : fields.entrySet()) {
                final var value = obj.get(entry.getKey());
                if (value == null || !entry.getValue().check(state, value)) return false;
            }
            return true;
        }
    }

    private record TypeSel(String type) implements Sel {
        @Override
        public boolean check(State state, Node node) {
            return Uast.isType(node, type);
        }
    }

    private record InSel(Set<Node> values) implements Sel {
        @Override
        public boolean check(State state, Node node) {
            return values.contains(node);
        }
    }

    private record NotSel(Sel sel) implements Sel {
        @Override
        public boolean check(State state, Node node) {
            // bindings made by the negated selector must not survive
            return !sel.check(state.copy(), node);
        }
    }

    private record KindSel(Set<Kind> kinds) implements Sel {
        @Override
        public boolean check(State state, Node node) {
            return kinds.contains(node.kind());
        }
    }
}
