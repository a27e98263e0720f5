package uast.transformer;

import net.jqwik.api.*;

import uast.nodes.NodeString;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Property-based tests for splitting raw comments and joining them back.
class CommentsPropertyTest extends TransformerLoggingConfig {

    @Provide
    Arbitrary<List<String>> lines() {
        return Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(6)
                .list().ofMinSize(1).ofMaxSize(4);
    }

    @Provide
    Arbitrary<String> indents() {
        return Arbitraries.of("", " ", "   ", "\t");
    }

    @Property(generation = GenerationMode.AUTO)
    void lineComment_joinRestoresRaw(@ForAll("lines") List<String> words, @ForAll("indents") String prefix) {
        final var raw = "//" + prefix + String.join(" ", words);

        final var parts = Comments.split(raw, "//", "");

        assertThat(parts).isNotNull();
        assertThat(Comments.join(parts, "//", "")).isEqualTo(raw);
    }

    @Property(generation = GenerationMode.AUTO)
    void blockComment_indentIsMovedToTab(@ForAll("lines") List<String> lines, @ForAll("indents") String indent) {
        final var raw = "/* " + String.join("\n" + indent, lines) + " */";

        final var parts = Comments.split(raw, "/*", "*/");

        assertThat(parts).isNotNull();
        assertThat(parts.get("Text")).isEqualTo(NodeString.of(String.join("\n", lines)));
        assertThat(parts.get("Tab")).isEqualTo(NodeString.of(lines.size() > 1 ? indent : ""));
        assertThat(Comments.join(parts, "/*", "*/")).isEqualTo(raw);
    }
}
