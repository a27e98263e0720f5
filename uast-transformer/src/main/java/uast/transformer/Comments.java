package uast.transformer;

import uast.nodes.Node;
import uast.nodes.NodeBool;
import uast.nodes.NodeObject;
import uast.nodes.NodeString;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Set;

/// Splitting of raw comment tokens into the parts of a `uast:Comment`.
///
/// A raw token such as `"/*\n   * text\n   */"` is split into:
///
/// - `Prefix`: whitespace between the start token and the text
/// - `Text`: the comment text, with the common indentation of its continuation lines removed
/// - `Suffix`: whitespace between the text and the end token
/// - `Tab`: the indentation that was removed from every continuation line
///
/// Joining the parts back restores the raw token, except for blank continuation lines that
/// were shorter than the indentation.
public final class Comments {

    static final String TEXT = "Text";
    static final String PREFIX = "Prefix";
    static final String SUFFIX = "Suffix";
    static final String TAB = "Tab";
    static final String BLOCK = "Block";

    private Comments() {}

    /// Splits a raw comment token.
    /// @param raw the raw token, delimiters included
    /// @param start the opening delimiter, such as `//`
    /// @param end the closing delimiter, empty for line comments
    /// @return the parts as an object, or `null` if the delimiters are not present
    static NodeObject split(String raw, String start, String end) {
        if (raw.length() < start.length() + end.length() || !raw.startsWith(start) || !raw.endsWith(end)) {
            return null;
        }
        var text = raw.substring(start.length(), raw.length() - end.length());

        int from = 0;
        while (from < text.length() && Character.isWhitespace(text.charAt(from))) from++;
        final var prefix = text.substring(0, from);
        text = text.substring(from);

        int to = text.length();
        while (to > 0 && Character.isWhitespace(text.charAt(to - 1))) to--;
        final var suffix = text.substring(to);
        text = text.substring(0, to);

        final var lines = text.split("\n", -1);
        final var tab = commonIndent(lines);
        if (!tab.isEmpty()) {
            for (int i = 1; i < lines.length; i++) {
                if (lines[i].startsWith(tab)) {
                    lines[i] = lines[i].substring(tab.length());
                }
            }
            text = String.join("\n", lines);
        }
        return parts(text, prefix, suffix, tab);
    }

    /// Joins parts produced by [#split] back into a raw token.
    static String join(NodeObject parts, String start, String end) {
        final var text = part(parts, TEXT);
        final var tab = part(parts, TAB);
        final var lines = text.split("\n", -1);
        for (int i = 1; i < lines.length; i++) {
            if (!lines[i].isEmpty()) {
                lines[i] = tab + lines[i];
            }
        }
        return start + part(parts, PREFIX) + String.join("\n", lines) + part(parts, SUFFIX) + end;
    }

    private static String commonIndent(String[] lines) {
        String common = null;
        for (int i = 1; i < lines.length; i++) {
            final var line = lines[i];
            if (line.isBlank()) continue;
            int n = 0;
            while (n < line.length() && Character.isWhitespace(line.charAt(n))) n++;
            final var indent = line.substring(0, n);
            if (common == null) {
                common = indent;
            } else {
                int k = 0;
                while (k < common.length() && k < indent.length() && common.charAt(k) == indent.charAt(k)) k++;
                common = common.substring(0, k);
            }
        }
        return common == null ? "" : common;
    }

    private static NodeObject parts(String text, String prefix, String suffix, String tab) {
        final var out = new LinkedHashMap<String, Node>();
        out.put(TEXT, NodeString.of(text));
        out.put(PREFIX, NodeString.of(prefix));
        out.put(SUFFIX, NodeString.of(suffix));
        out.put(TAB, NodeString.of(tab));
        return NodeObject.of(out);
    }

    private static String part(NodeObject parts, String name) {
        final var value = parts.get(name);
        if (value == null) {
            throw new InvariantViolationException("comment parts lack '" + name + "'");
        }
        return UnexpectedTypeException.require(NodeString.class, value, "comment " + name).value();
    }

    record CommentTextOp(String start, String end, String var) implements Op {
        CommentTextOp {
            Objects.requireNonNull(start, "start must not be null");
            Objects.requireNonNull(end, "end must not be null");
            Objects.requireNonNull(var, "var must not be null");
        }

        @Override
        public boolean check(State state, Node node) {
            if (!(node instanceof NodeString raw)) return false;
            final var parts = split(raw.value(), start, end);
            return parts != null && state.bind(var, parts);
        }

        @Override
        public Node construct(State state, Node node) {
            final var parts = UnexpectedTypeException.require(NodeObject.class, state.get(var), "comment '" + var + "'");
            return NodeString.of(join(parts, start, end));
        }
    }

    record CommentNodeOp(boolean block, String var) implements ObjectOp {
        private static final Set<String> FIELDS = Set.of(BLOCK, TEXT, PREFIX, SUFFIX, TAB);

        @Override
        public Set<String> fieldNames() {
            return FIELDS;
        }

        @Override
        public boolean checkObject(State state, NodeObject node) {
            if (node.size() != FIELDS.size() || !NodeBool.of(block).equals(node.get(BLOCK))) return false;
            for (final var name : new String[]{TEXT, PREFIX, SUFFIX, TAB}) {
                if (!(node.get(name) instanceof NodeString)) return false;
            }
            return state.bind(var, parts(part(node, TEXT), part(node, PREFIX), part(node, SUFFIX), part(node, TAB)));
        }

        @Override
        public NodeObject constructObject(State state, NodeObject node) {
            final var parts = UnexpectedTypeException.require(NodeObject.class, state.get(var), "comment '" + var + "'");
            final var out = new LinkedHashMap<String, Node>();
            out.put(BLOCK, NodeBool.of(block));
            out.put(TEXT, NodeString.of(part(parts, TEXT)));
            out.put(PREFIX, NodeString.of(part(parts, PREFIX)));
            out.put(SUFFIX, NodeString.of(part(parts, SUFFIX)));
            out.put(TAB, NodeString.of(part(parts, TAB)));
            return NodeObject.of(out);
        }
    }
}
