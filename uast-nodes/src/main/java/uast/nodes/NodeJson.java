package uast.nodes;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.logging.Logger;

/// JSON codec for [Node] trees.
///
/// Native syntax trees arrive as JSON documents produced by the native parser, and canonical
/// trees are handed on in the same form. Integral numbers decode to [NodeInt], numbers with a
/// fraction or exponent to [NodeFloat].
///
/// Usage:
/// ```java
/// Node tree = NodeJson.parse(nativeJson);
/// String out = NodeJson.toDisplayString(tree, 2);
/// ```
public final class NodeJson {

    private static final Logger LOG = Logger.getLogger(NodeJson.class.getName());

    private static final JsonFactory FACTORY = new JsonFactory();

    private NodeJson() {}

    /// Parses a JSON document.
    /// @param json the document text
    /// @return the root node
    /// @throws NodeJsonException if the text is not a single well-formed JSON value
    public static Node parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try (JsonParser parser = FACTORY.createParser(json)) {
            return readDocument(parser);
        } catch (IOException e) {
            throw new NodeJsonException("malformed JSON: " + e.getMessage(), e);
        }
    }

    /// Parses a JSON document from a reader. The reader is not closed.
    /// @param reader the document source
    /// @return the root node
    /// @throws NodeJsonException if the input is not a single well-formed JSON value
    public static Node parse(Reader reader) {
        Objects.requireNonNull(reader, "reader must not be null");
        try (JsonParser parser = FACTORY.createParser(reader)) {
            parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
            return readDocument(parser);
        } catch (IOException e) {
            throw new NodeJsonException("malformed JSON: " + e.getMessage(), e);
        }
    }

    /// {@return the compact JSON form of a node}
    public static String toJson(Node node) {
        return write(node, 0);
    }

    /// {@return an indented JSON form of a node, for logs and diagnostics}
    public static String toDisplayString(Node node, int indent) {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        return write(node, indent);
    }

    private static Node readDocument(JsonParser parser) throws IOException {
        final var first = parser.nextToken();
        if (first == null) {
            throw new NodeJsonException("empty JSON document");
        }
        final var root = readValue(parser, first);
        final var trailing = parser.nextToken();
        if (trailing != null) {
            throw new NodeJsonException("unexpected trailing token " + trailing + " at " + parser.currentLocation());
        }
        LOG.finer(() -> "Parsed JSON document with root kind " + root.kind());
        return root;
    }

    private static Node readValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> NodeString.of(parser.getText());
            case VALUE_NUMBER_INT -> NodeInt.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> NodeFloat.of(parser.getDoubleValue());
            case VALUE_TRUE -> NodeBool.of(true);
            case VALUE_FALSE -> NodeBool.of(false);
            case VALUE_NULL -> NodeNull.of();
            default -> throw new NodeJsonException("unexpected JSON token " + token + " at " + parser.currentLocation());
        };
    }

    private static NodeObject readObject(JsonParser parser) throws IOException {
        final var members = new LinkedHashMap<String, Node>();
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final var name = parser.currentName();
            final var value = readValue(parser, parser.nextToken());
            if (members.put(name, value) != null) {
                throw new NodeJsonException("duplicate member '" + name + "' at " + parser.currentLocation());
            }
        }
        return NodeObject.of(members);
    }

    private static NodeArray readArray(JsonParser parser) throws IOException {
        final var elements = new ArrayList<Node>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, token));
        }
        return NodeArray.of(elements);
    }

    private static String write(Node node, int indent) {
        Objects.requireNonNull(node, "node must not be null");
        final var out = new StringWriter();
        try (JsonGenerator gen = FACTORY.createGenerator(out)) {
            if (indent > 0) {
                final var indenter = new DefaultIndenter(" ".repeat(indent), DefaultIndenter.SYS_LF);
                gen.setPrettyPrinter(new DefaultPrettyPrinter()
                        .withObjectIndenter(indenter)
                        .withArrayIndenter(indenter));
            }
            writeValue(gen, node);
        } catch (IOException e) {
            throw new NodeJsonException("cannot write JSON: " + e.getMessage(), e);
        }
        return out.toString();
    }

    private static void writeValue(JsonGenerator gen, Node node) throws IOException {
        if (node instanceof NodeObject obj) {
            gen.writeStartObject();
            for (final var entry : obj.members().entrySet()) {
                gen.writeFieldName(entry.getKey());
                writeValue(gen, entry.getValue());
            }
            gen.writeEndObject();
        } else if (node instanceof NodeArray arr) {
            gen.writeStartArray();
            for (final var element : arr.elements()) {
                writeValue(gen, element);
            }
            gen.writeEndArray();
        } else if (node instanceof NodeString s) {
            gen.writeString(s.value());
        } else if (node instanceof NodeInt i) {
            gen.writeNumber(i.value());
        } else if (node instanceof NodeFloat f) {
            gen.writeNumber(f.value());
        } else if (node instanceof NodeBool b) {
            gen.writeBoolean(b.value());
        } else {
            gen.writeNull();
        }
    }
}
