package uast.transformer;

import org.junit.jupiter.api.Test;
import uast.nodes.NodeInt;
import uast.nodes.NodeString;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class StateTest extends TransformerLoggingConfig {

    private static final Logger LOG = Logger.getLogger(StateTest.class.getName());

    @Test
    void bind_sameValueTwiceSucceeds() {
        LOG.info(() -> "TEST: bind_sameValueTwiceSucceeds");

        final var state = new State();

        assertThat(state.bind("x", NodeInt.of(1))).isTrue();
        assertThat(state.bind("x", NodeInt.of(1))).isTrue();
        assertThat(state.bind("x", NodeInt.of(2))).isFalse();
        assertThat(state.get("x")).isEqualTo(NodeInt.of(1));
    }

    @Test
    void get_unboundIsInvariantViolation() {
        LOG.info(() -> "TEST: get_unboundIsInvariantViolation");

        final var state = new State();

        assertThat(state.find("missing")).isEmpty();
        assertThatThrownBy(() -> state.get("missing"))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("'missing'");
    }

    @Test
    void copy_isIsolatedUntilCommitted() {
        LOG.info(() -> "TEST: copy_isIsolatedUntilCommitted");

        final var state = new State();
        state.bind("a", NodeString.of("kept"));

        final var scratch = state.copy();
        scratch.bind("b", NodeString.of("tentative"));

        assertThat(state.isBound("b")).isFalse();

        state.commit(scratch);

        assertThat(state.bindings()).containsOnlyKeys("a", "b");
    }
}
