package uast.nodes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// An ordered sequence of nodes.
///
/// Null placeholders are stored as [NodeNull], never as Java `null`.
public record NodeArray(List<Node> elements) implements Node {

    private static final NodeArray EMPTY = new NodeArray(List.of());

    public NodeArray {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements); // rejects null elements
    }

    /// {@return the empty array}
    public static NodeArray empty() {
        return EMPTY;
    }

    public static NodeArray of(List<? extends Node> elements) {
        return new NodeArray(List.copyOf(elements));
    }

    public static NodeArray of(Node... elements) {
        return new NodeArray(Arrays.asList(elements));
    }

    /// {@return the concatenation of the given arrays, in order}
    public static NodeArray concat(List<? extends Node> first, List<? extends Node> second) {
        final var out = new ArrayList<Node>(first.size() + second.size());
        out.addAll(first);
        out.addAll(second);
        return new NodeArray(out);
    }

    public int size() {
        return elements.size();
    }

    public Node get(int index) {
        return elements.get(index);
    }

    /// {@return a new array without the element at `index`, keeping the order of the rest}
    public NodeArray without(int index) {
        Objects.checkIndex(index, elements.size());
        final var out = new ArrayList<Node>(elements.size() - 1);
        out.addAll(elements.subList(0, index));
        out.addAll(elements.subList(index + 1, elements.size()));
        return new NodeArray(out);
    }

    /// {@return a new array with `value` at `index`}
    public NodeArray with(int index, Node value) {
        Objects.requireNonNull(value, "value must not be null");
        final var out = new ArrayList<>(elements);
        out.set(index, value);
        return new NodeArray(out);
    }

    /// {@return the elements in `[from, to)` as a new array}
    public NodeArray slice(int from, int to) {
        return new NodeArray(elements.subList(from, to));
    }

    @Override
    public Kind kind() {
        return Kind.ARRAY;
    }

    @Override
    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String toString() {
        return NodeJson.toJson(this);
    }
}
