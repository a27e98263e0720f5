package uast.transformer;

import uast.nodes.Node;
import uast.nodes.NodeObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Exact object shape: every listed field must be present and match, and no other field may
/// appear.
public record Obj(Map<String, Op> fields) implements ObjectOp {

    private static final Obj EMPTY = new Obj(Map.of());

    public Obj {
        Objects.requireNonNull(fields, "fields must not be null");
        final var copy = new LinkedHashMap<String, Op>(fields.size());
        for (final var entry : fields.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "field name must not be null"),
                    Objects.requireNonNull(entry.getValue(), () -> "pattern for '" + entry.getKey() + "' must not be null"));
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public static Obj empty() {
        return EMPTY;
    }

    /// Builds a shape from field entries, keeping their order.
    /// @throws IllegalArgumentException if a field is listed twice
    @SafeVarargs
    public static Obj of(Map.Entry<String, ? extends Op>... fields) {
        final var out = new LinkedHashMap<String, Op>(fields.length);
        for (final var entry : fields) {
            if (out.put(entry.getKey(), entry.getValue()) != null) {
                throw new IllegalArgumentException("field listed twice: " + entry.getKey());
            }
        }
        return new Obj(out);
    }

    /// {@return a copy with `name` matched by `op`, replacing any previous pattern for it}
    public Obj with(String name, Op op) {
        final var out = new LinkedHashMap<>(fields);
        out.put(name, op);
        return new Obj(out);
    }

    /// {@return a shape holding the fields of both}
    /// @throws IllegalArgumentException if both list the same field
    public Obj merge(Obj other) {
        final var out = new LinkedHashMap<>(fields);
        for (final var entry : other.fields.entrySet()) {
            if (out.put(entry.getKey(), entry.getValue()) != null) {
                throw new IllegalArgumentException("field listed twice: " + entry.getKey());
            }
        }
        return new Obj(out);
    }

    @Override
    public Set<String> fieldNames() {
        return fields.keySet();
    }

    @Override
    public boolean checkObject(State state, NodeObject node) {
        if (node.size() != fields.size()) return false;
        for (final var entry : fields.entrySet()) {
            final var value = node.get(entry.getKey());
            if (value == null || !entry.getValue().check(state, value)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public NodeObject constructObject(State state, NodeObject node) {
        final var out = new LinkedHashMap<String, Node>(fields.size());
        for (final var entry : fields.entrySet()) {
            final var previous = node == null ? null : node.get(entry.getKey());
            out.put(entry.getKey(), entry.getValue().construct(state, previous));
        }
        return NodeObject.of(out);
    }

    @Override
    public boolean reversible() {
        return fields.values().stream().allMatch(Op::reversible);
    }
}
