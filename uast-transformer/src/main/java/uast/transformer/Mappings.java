package uast.transformer;

import uast.nodes.Node;
import uast.nodes.NodeArray;
import uast.nodes.NodeObject;
import uast.nodes.Uast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// A pipeline stage that applies a list of rules to every node of a tree.
///
/// The walk is depth-first and post-order: all children of a node are transformed before the
/// node itself is offered to the rules. Each node is visited once. At a node, every rule is
/// tried in declaration order, and each rule sees the output of the rules before it.
///
/// Unchanged subtrees are shared with the input: a node is only rebuilt when one of its
/// children changed.
public final class Mappings implements Transformer {

    private static final Logger LOG = Logger.getLogger(Mappings.class.getName());

    private final String name;
    private final List<Mapping> mappings;

    public Mappings(String name, List<Mapping> mappings) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.mappings = List.copyOf(Objects.requireNonNull(mappings, "mappings must not be null"));
    }

    public static Mappings of(String name, Mapping... mappings) {
        return new Mappings(name, List.of(mappings));
    }

    public String name() {
        return name;
    }

    public List<Mapping> mappings() {
        return mappings;
    }

    /// {@return a stage applying the reverse of every rule}
    public Mappings reverse() {
        return new Mappings(name + " (reverse)", mappings.stream().map(Mapping::reverse).toList());
    }

    /// {@return `true` if every rule can be reversed}
    public boolean reversible() {
        return mappings.stream().allMatch(Mapping::reversible);
    }

    @Override
    public Node transform(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        LOG.fine(() -> "Stage '" + name + "' with " + mappings.size() + " rules");
        final var walk = new Walk();
        final var out = walk.visit(root);
        LOG.fine(() -> "Stage '" + name + "' done: " + walk.rewrites + " rewrites");
        return out;
    }

    private final class Walk {
        int rewrites;

        Node visit(Node node) {
            Node current = node;
            if (node instanceof NodeArray arr) {
                current = visitArray(arr);
            } else if (node instanceof NodeObject obj) {
                current = visitObject(obj);
            }
            return rewrite(current);
        }

        private Node visitArray(NodeArray arr) {
            List<Node> out = null;
            for (int i = 0; i < arr.size(); i++) {
                final var child = arr.get(i);
                final var next = visit(child);
                if (out == null && next != child) {
                    out = new ArrayList<>(arr.elements().subList(0, i));
                }
                if (out != null) out.add(next);
            }
            return out == null ? arr : NodeArray.of(out);
        }

        private Node visitObject(NodeObject obj) {
            LinkedHashMap<String, Node> out = null;
            for (final var entry : obj.members().entrySet()) {
                final var child = entry.getValue();
                final var next = visit(child);
                if (out == null && next != child) {
                    out = new LinkedHashMap<>(obj.members());
                }
                if (out != null) out.put(entry.getKey(), next);
            }
            return out == null ? obj : NodeObject.of(out);
        }

        private Node rewrite(Node node) {
            var current = node;
            for (final var mapping : mappings) {
                final var result = mapping.apply(current);
                if (result.isPresent()) {
                    final var matched = current;
                    LOG.finer(() -> name + ": " + mapping.name() + " rewrote " + describe(matched));
                    current = result.get();
                    rewrites++;
                }
            }
            return current;
        }
    }

    private static String describe(Node node) {
        final var type = Uast.typeOf(node);
        return type.isEmpty() ? node.kind().name() : type;
    }
}
