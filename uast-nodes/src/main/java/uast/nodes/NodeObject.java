package uast.nodes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// A mapping from field names to nodes.
///
/// Field order is preserved for display but does not take part in equality: two objects are
/// equal when their member maps are equal.
///
/// Reserved keys are listed in [Uast]: the type discriminator `@type`, the position range `@pos`
/// and the raw token `@token`.
public record NodeObject(Map<String, Node> members) implements Node {

    private static final NodeObject EMPTY = new NodeObject(Map.of());

    public NodeObject {
        Objects.requireNonNull(members, "members must not be null");
        final var copy = new LinkedHashMap<String, Node>(members.size());
        for (final var entry : members.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "member name must not be null"),
                    Objects.requireNonNull(entry.getValue(), () -> "member '" + entry.getKey() + "' must not be null"));
        }
        members = Collections.unmodifiableMap(copy);
    }

    /// {@return the empty object}
    public static NodeObject empty() {
        return EMPTY;
    }

    public static NodeObject of(Map<String, ? extends Node> members) {
        return new NodeObject(Collections.unmodifiableMap(members));
    }

    /// {@return the member named `name`, or `null` when absent}
    public Node get(String name) {
        return members.get(name);
    }

    public boolean has(String name) {
        return members.containsKey(name);
    }

    public Set<String> keys() {
        return members.keySet();
    }

    public int size() {
        return members.size();
    }

    /// {@return a copy of this object with `name` set to `value`}
    ///
    /// An existing member keeps its position; a new member is appended.
    public NodeObject with(String name, Node value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        final var out = new LinkedHashMap<>(members);
        out.put(name, value);
        return new NodeObject(out);
    }

    /// {@return a copy of this object without the named members}
    public NodeObject without(String... names) {
        final var out = new LinkedHashMap<>(members);
        boolean removed = false;
        for (final var name : names) {
            removed |= out.remove(name) != null;
        }
        return removed ? new NodeObject(out) : this;
    }

    @Override
    public Kind kind() {
        return Kind.OBJECT;
    }

    @Override
    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public String toString() {
        return NodeJson.toJson(this);
    }
}
