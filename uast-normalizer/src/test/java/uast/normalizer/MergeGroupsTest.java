package uast.normalizer;

import org.junit.jupiter.api.Test;
import uast.nodes.Node;
import uast.nodes.NodeJson;
import uast.transformer.InvariantViolationException;
import uast.transformer.Mapping;
import uast.transformer.State;
import uast.transformer.UnsupportedReverseException;

import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;
import static uast.transformer.Ops.*;

class MergeGroupsTest extends NormalizerLoggingConfig {

    private static final Logger LOG = Logger.getLogger(MergeGroupsTest.class.getName());

    private static final Mapping MERGE = Mapping.map(new MergeGroups(var("g")), var("g"));

    private static Node json(String text) {
        return NodeJson.parse(text);
    }

    @Test
    void group_aroundFunctionGroupIsMergedIntoIt() {
        LOG.info(() -> "TEST: group_aroundFunctionGroupIsMergedIntoIt");

        final var out = MERGE.apply(json("""
            {"@type": "uast:Group", "Nodes": [
              {"@type": "uast:Comment", "n": 1},
              {"@type": "uast:FunctionGroup", "@pos": 7, "Nodes": [{"@type": "A"}, {"@type": "B"}]},
              {"@type": "uast:Comment", "n": 2}]}
            """));

        assertThat(out).contains(json("""
            {"@type": "uast:FunctionGroup", "@pos": 7, "Nodes": [
              {"@type": "uast:Comment", "n": 1},
              {"@type": "A"},
              {"@type": "B"},
              {"@type": "uast:Comment", "n": 2}]}
            """));
    }

    @Test
    void group_withoutFunctionGroupIsNotMatched() {
        LOG.info(() -> "TEST: group_withoutFunctionGroupIsNotMatched");

        assertThat(MERGE.apply(json("{\"@type\": \"uast:Group\", \"Nodes\": [{\"@type\": \"A\"}]}"))).isEmpty();
    }

    @Test
    void functionGroup_nullsAreCompacted() {
        LOG.info(() -> "TEST: functionGroup_nullsAreCompacted");

        final var out = MERGE.apply(json("""
            {"@type": "uast:FunctionGroup", "Nodes": [null, {"@type": "A"}, null, {"@type": "uast:Alias"}]}
            """));

        assertThat(out).contains(json("""
            {"@type": "uast:FunctionGroup", "Nodes": [{"@type": "A"}, {"@type": "uast:Alias"}]}
            """));
    }

    @Test
    void functionGroup_groupsInSlotsAreFlattened() {
        LOG.info(() -> "TEST: functionGroup_groupsInSlotsAreFlattened");

        final var out = MERGE.apply(json("""
            {"@type": "uast:FunctionGroup", "Nodes": [
              [{"@type": "uast:Group", "Nodes": [{"@type": "uast:Comment"}, {"@type": "PublicKeyword"}]},
               {"@type": "StaticKeyword"},
               {"@type": "uast:Group", "Nodes": [{"@type": "AsyncKeyword"}]}],
              {"@type": "uast:Group", "Nodes": []},
              {"@type": "uast:Alias"}]}
            """));

        // only array slots are flattened; a group standing on its own is left in place
        assertThat(out).contains(json("""
            {"@type": "uast:FunctionGroup", "Nodes": [
              [{"@type": "uast:Comment"}, {"@type": "PublicKeyword"}, {"@type": "StaticKeyword"}, {"@type": "AsyncKeyword"}],
              {"@type": "uast:Group", "Nodes": []},
              {"@type": "uast:Alias"}]}
            """));
    }

    @Test
    void functionGroup_alreadyTidyIsNotMatched() {
        LOG.info(() -> "TEST: functionGroup_alreadyTidyIsNotMatched");

        assertThat(MERGE.apply(json("""
            {"@type": "uast:FunctionGroup", "Nodes": [[{"@type": "PublicKeyword"}], {"@type": "uast:Alias"}]}
            """))).isEmpty();
    }

    @Test
    void mergedOutput_isStable() {
        LOG.info(() -> "TEST: mergedOutput_isStable");

        final var once = MERGE.apply(json("""
            {"@type": "uast:Group", "Nodes": [
              {"@type": "uast:FunctionGroup", "Nodes": [null, [{"@type": "uast:Group", "Nodes": [1]}], {"@type": "uast:Alias"}]}]}
            """)).orElseThrow();
        final var twice = MERGE.apply(once).orElse(once);
        final var thrice = MERGE.apply(twice);

        assertThat(twice).isEqualTo(json("{\"@type\": \"uast:FunctionGroup\", \"Nodes\": [[1], {\"@type\": \"uast:Alias\"}]}"));
        assertThat(thrice).isEmpty();
    }

    @Test
    void otherNodes_areNotMatched() {
        LOG.info(() -> "TEST: otherNodes_areNotMatched");

        assertThat(MERGE.apply(json("{\"@type\": \"uast:Block\", \"Statements\": []}"))).isEmpty();
        assertThat(MERGE.apply(json("[null]"))).isEmpty();
    }

    @Test
    void nodesNotArray_isInvariantViolation() {
        LOG.info(() -> "TEST: nodesNotArray_isInvariantViolation");

        assertThatThrownBy(() -> MERGE.apply(json("{\"@type\": \"uast:Group\", \"Nodes\": null}")))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("uast:Group.Nodes");
    }

    @Test
    void construct_isUnsupported() {
        LOG.info(() -> "TEST: construct_isUnsupported");

        assertThatThrownBy(() -> new MergeGroups(var("g")).construct(new State(), null))
                .isInstanceOf(UnsupportedReverseException.class);
    }
}
