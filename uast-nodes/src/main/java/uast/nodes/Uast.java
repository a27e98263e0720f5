package uast.nodes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Reserved keys and the canonical type vocabulary.
///
/// Every canonical construct is an object whose `@type` names one of the constants below.
/// [#newObject(String)] builds such an object with all schema fields set to their defaults:
/// `""` for strings, `false` for flags and null for nested nodes, except for the `Nodes`
/// arrays of groups, which start empty.
public final class Uast {

    /// Type discriminator key
    public static final String KEY_TYPE = "@type";
    /// Position range key
    public static final String KEY_POS = "@pos";
    /// Raw token key for leaves and comments
    public static final String KEY_TOKEN = "@token";

    public static final String IDENTIFIER = "uast:Identifier";
    public static final String STRING = "uast:String";
    public static final String BOOL = "uast:Bool";
    public static final String QUALIFIED_IDENTIFIER = "uast:QualifiedIdentifier";
    public static final String COMMENT = "uast:Comment";
    public static final String GROUP = "uast:Group";
    public static final String FUNCTION_GROUP = "uast:FunctionGroup";
    public static final String BLOCK = "uast:Block";
    public static final String ALIAS = "uast:Alias";
    public static final String IMPORT = "uast:Import";
    public static final String ARGUMENT = "uast:Argument";
    public static final String FUNCTION_TYPE = "uast:FunctionType";
    public static final String FUNCTION = "uast:Function";
    public static final String POSITIONS = "uast:Positions";
    public static final String POSITION = "uast:Position";

    /// Field holding the children of [#GROUP] and [#FUNCTION_GROUP]
    public static final String NODES = "Nodes";

    private static final Map<String, NodeObject> SCHEMA = schema();

    private Uast() {}

    private static Map<String, NodeObject> schema() {
        final var s = new LinkedHashMap<String, NodeObject>();
        final Node str = NodeString.of("");
        final Node no = NodeBool.of(false);
        final Node nil = NodeNull.of();
        s.put(IDENTIFIER, fields("Name", str));
        s.put(STRING, fields("Value", str, "Format", str));
        s.put(BOOL, fields("Value", no));
        s.put(QUALIFIED_IDENTIFIER, fields("Names", nil));
        s.put(COMMENT, fields("Block", no, "Prefix", str, "Suffix", str, "Tab", str, "Text", str));
        s.put(GROUP, fields(NODES, NodeArray.empty()));
        s.put(FUNCTION_GROUP, fields(NODES, NodeArray.empty()));
        s.put(BLOCK, fields("Statements", nil));
        s.put(ALIAS, fields("Name", nil, "Node", nil));
        s.put(IMPORT, fields("All", no, "Names", nil, "Path", nil, "Target", nil));
        s.put(ARGUMENT, fields("Init", nil, "MapVariadic", no, "Name", nil, "Receiver", no, "Type", nil, "Variadic", no));
        s.put(FUNCTION_TYPE, fields("Arguments", nil, "Returns", nil));
        s.put(FUNCTION, fields("Body", nil, "Type", nil));
        s.put(POSITIONS, fields("end", nil, "start", nil));
        s.put(POSITION, fields("offset", NodeInt.of(0)));
        return Map.copyOf(s);
    }

    private static NodeObject fields(Object... pairs) {
        final var out = new LinkedHashMap<String, Node>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.put((String) pairs[i], (Node) pairs[i + 1]);
        }
        return NodeObject.of(out);
    }

    /// {@return the `@type` of an object node, or the empty string for anything else}
    public static String typeOf(Node node) {
        if (node instanceof NodeObject obj && obj.get(KEY_TYPE) instanceof NodeString type) {
            return type.value();
        }
        return "";
    }

    public static boolean isType(Node node, String type) {
        return typeOf(node).equals(type);
    }

    /// {@return `true` when `type` is part of the canonical vocabulary}
    public static boolean isCanonical(String type) {
        return SCHEMA.containsKey(type);
    }

    /// {@return the schema field names of a canonical type, without reserved keys}
    public static Set<String> fieldsOf(String type) {
        return schemaOf(type).keys();
    }

    /// Builds a canonical object of the given type with every schema field at its default.
    /// @param type a canonical type name
    /// @return a new object whose first member is `@type`
    /// @throws IllegalArgumentException if the type is not canonical
    public static NodeObject newObject(String type) {
        final var out = new LinkedHashMap<String, Node>();
        out.put(KEY_TYPE, NodeString.of(type));
        out.putAll(schemaOf(type).members());
        return NodeObject.of(out);
    }

    /// Builds a `uast:Positions` node spanning two byte offsets.
    ///
    /// Native offsets carry no line or column information, so positions hold offsets only.
    /// @param start the start offset (inclusive)
    /// @param end the end offset (exclusive)
    /// @return the positions node
    public static NodeObject positions(long start, long end) {
        final var out = new LinkedHashMap<String, Node>();
        out.put(KEY_TYPE, NodeString.of(POSITIONS));
        out.put("start", position(start));
        out.put("end", position(end));
        return NodeObject.of(out);
    }

    private static NodeObject position(long offset) {
        final var out = new LinkedHashMap<String, Node>();
        out.put(KEY_TYPE, NodeString.of(POSITION));
        out.put("offset", NodeInt.of(offset));
        return NodeObject.of(out);
    }

    private static NodeObject schemaOf(String type) {
        Objects.requireNonNull(type, "type must not be null");
        final var fields = SCHEMA.get(type);
        if (fields == null) {
            throw new IllegalArgumentException("not a canonical type: " + type);
        }
        return fields;
    }
}
