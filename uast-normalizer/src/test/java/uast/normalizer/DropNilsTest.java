package uast.normalizer;

import org.junit.jupiter.api.Test;
import uast.nodes.Node;
import uast.nodes.NodeJson;
import uast.transformer.State;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;
import static uast.transformer.Ops.*;

class DropNilsTest extends NormalizerLoggingConfig {

    private static final Logger LOG = Logger.getLogger(DropNilsTest.class.getName());

    private static Node json(String text) {
        return NodeJson.parse(text);
    }

    @Test
    void check_removesNullsKeepingOrder() {
        LOG.info(() -> "TEST: check_removesNullsKeepingOrder");

        final var state = new State();

        assertThat(new DropNils(var("arr")).check(state, json("[null, 1, null, 2, 3, null]"))).isTrue();
        assertThat(state.get("arr")).isEqualTo(json("[1, 2, 3]"));
    }

    @Test
    void check_arrayWithoutNullsIsPassedAsIs() {
        LOG.info(() -> "TEST: check_arrayWithoutNullsIsPassedAsIs");

        final var state = new State();
        final var arr = json("[1, 2]");

        assertThat(new DropNils(var("arr")).check(state, arr)).isTrue();
        assertThat(state.get("arr")).isSameAs(arr);
    }

    @Test
    void check_nullReadsAsEmptyArray() {
        LOG.info(() -> "TEST: check_nullReadsAsEmptyArray");

        final var state = new State();

        assertThat(new DropNils(var("arr")).check(state, json("null"))).isTrue();
        assertThat(state.get("arr")).isEqualTo(json("[]"));
    }

    @Test
    void check_otherKindsAreNoMatch() {
        LOG.info(() -> "TEST: check_otherKindsAreNoMatch");

        assertThat(new DropNils(var("arr")).check(new State(), json("{}"))).isFalse();
        assertThat(new DropNils(var("arr")).check(new State(), json("0"))).isFalse();
    }

    @Test
    void construct_passesThroughAndIsNotReversible() {
        LOG.info(() -> "TEST: construct_passesThroughAndIsNotReversible");

        final var state = new State();
        state.bind("arr", json("[1]"));
        final var op = new DropNils(var("arr"));

        assertThat(op.construct(state, null)).isEqualTo(json("[1]"));
        assertThat(op.reversible()).isFalse();
    }
}
