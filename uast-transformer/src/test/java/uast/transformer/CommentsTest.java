package uast.transformer;

import org.junit.jupiter.api.Test;
import uast.nodes.NodeJson;
import uast.nodes.NodeString;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;
import static uast.transformer.Ops.*;

class CommentsTest extends TransformerLoggingConfig {

    private static final Logger LOG = Logger.getLogger(CommentsTest.class.getName());

    @Test
    void split_lineComment() {
        LOG.info(() -> "TEST: split_lineComment");

        final var parts = Comments.split("// hello world", "//", "");

        assertThat(parts).isEqualTo(NodeJson.parse("""
            {"Text": "hello world", "Prefix": " ", "Suffix": "", "Tab": ""}
            """));
    }

    @Test
    void split_blockCommentRemovesCommonIndent() {
        LOG.info(() -> "TEST: split_blockCommentRemovesCommonIndent");

        final var raw = "/*\n   * first\n   * second\n   */";
        final var parts = Comments.split(raw, "/*", "*/");

        assertThat(parts).isEqualTo(NodeJson.parse("""
            {"Text": "* first\\n* second", "Prefix": "\\n   ", "Suffix": "\\n   ", "Tab": "   "}
            """));
        assertThat(Comments.join(parts, "/*", "*/")).isEqualTo(raw);
    }

    @Test
    void split_rejectsMissingDelimiters() {
        LOG.info(() -> "TEST: split_rejectsMissingDelimiters");

        assertThat(Comments.split("# not a comment", "//", "")).isNull();
        assertThat(Comments.split("/* open", "/*", "*/")).isNull();
        assertThat(Comments.split("/*/", "/*", "*/")).isNull();
    }

    @Test
    void split_emptyComment() {
        LOG.info(() -> "TEST: split_emptyComment");

        final var parts = Comments.split("///", "///", "");

        assertThat(parts.get("Text")).isEqualTo(NodeString.of(""));
        assertThat(Comments.join(parts, "///", "")).isEqualTo("///");
    }

    @Test
    void commentText_checkAndConstructAreInverse() {
        LOG.info(() -> "TEST: commentText_checkAndConstructAreInverse");

        final var op = commentText("//", "", "text");
        final var state = new State();
        final var raw = NodeString.of("//   indented  ");

        assertThat(op.check(state, raw)).isTrue();
        assertThat(op.construct(state, null)).isEqualTo(raw);
        assertThat(op.check(new State(), NodeString.of("/* other */"))).isFalse();
    }

    @Test
    void commentNode_buildsCommentFields() {
        LOG.info(() -> "TEST: commentNode_buildsCommentFields");

        final var state = new State();
        assertThat(commentText("/*", "*/", "c").check(state, NodeString.of("/* note */"))).isTrue();

        final var fields = commentNode(true, "c").construct(state, null);

        assertThat(fields).isEqualTo(NodeJson.parse("""
            {"Block": true, "Text": "note", "Prefix": " ", "Suffix": " ", "Tab": ""}
            """));

        final var reverse = new State();
        assertThat(commentNode(true, "c").check(reverse, fields)).isTrue();
        assertThat(commentNode(false, "c").check(new State(), fields)).isFalse();
        assertThat(commentText("/*", "*/", "c").construct(reverse, null)).isEqualTo(NodeString.of("/* note */"));
    }
}
