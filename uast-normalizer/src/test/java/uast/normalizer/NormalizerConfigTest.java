package uast.normalizer;

import org.junit.jupiter.api.Test;
import uast.nodes.NodeJson;

import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.*;

class NormalizerConfigTest extends NormalizerLoggingConfig {

    private static final Logger LOG = Logger.getLogger(NormalizerConfigTest.class.getName());

    @Test
    void csharp_tables() {
        LOG.info(() -> "TEST: csharp_tables");

        final var config = NormalizerConfig.csharp();

        assertThat(config.triviaTargetField("Block")).contains("Statements");
        assertThat(config.triviaTargetField("CompilationUnit")).contains("Members");
        assertThat(config.triviaTargetField("ClassDeclaration")).isEmpty();
        assertThat(config.fullSpanTypes()).containsExactly("SingleLineDocumentationCommentTrivia");
        assertThat(config.unanchoredTrivia()).isEqualTo(UnanchoredTriviaPolicy.TREAT_AS_LEADING);
    }

    @Test
    void isRelocatable_byNameOrSuffix() {
        LOG.info(() -> "TEST: isRelocatable_byNameOrSuffix");

        final var config = NormalizerConfig.csharp();

        assertThat(config.isRelocatable("ReturnType")).isTrue();
        assertThat(config.isRelocatable("SemicolonToken")).isTrue();
        assertThat(config.isRelocatable("StaticKeyword")).isTrue();
        assertThat(config.isRelocatable("Type")).isFalse();
        assertThat(config.isRelocatable("@token")).isFalse();
    }

    @Test
    void isTrivia_bySuffix() {
        LOG.info(() -> "TEST: isTrivia_bySuffix");

        final var config = NormalizerConfig.csharp();

        assertThat(config.isTrivia(NodeJson.parse("{\"@type\": \"SingleLineCommentTrivia\"}"))).isTrue();
        assertThat(config.isTrivia(NodeJson.parse("{\"@type\": \"SemicolonToken\"}"))).isFalse();
        assertThat(config.isTrivia(NodeJson.parse("[]"))).isFalse();
    }

    @Test
    void copies_leaveOriginalUntouched() {
        LOG.info(() -> "TEST: copies_leaveOriginalUntouched");

        final var base = NormalizerConfig.csharp();
        final var changed = base
                .withTriviaTargetField("NamespaceDeclaration", "Members")
                .withFullSpanTypes(Set.of())
                .withUnanchoredTrivia(UnanchoredTriviaPolicy.FAIL);

        assertThat(changed.triviaTargetField("NamespaceDeclaration")).contains("Members");
        assertThat(changed.triviaTargetField("Block")).contains("Statements");
        assertThat(changed.fullSpanTypes()).isEmpty();
        assertThat(base.triviaTargetField("NamespaceDeclaration")).isEmpty();
        assertThat(base.unanchoredTrivia()).isEqualTo(UnanchoredTriviaPolicy.TREAT_AS_LEADING);
    }

    @Test
    void constructor_rejectsEmptyTriviaSuffix() {
        LOG.info(() -> "TEST: constructor_rejectsEmptyTriviaSuffix");

        assertThatThrownBy(() -> new NormalizerConfig(Map.of(), Set.of(), Set.of(), Set.of(), "",
                "LeadingTrivia", "TrailingTrivia", UnanchoredTriviaPolicy.FAIL))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("triviaTypeSuffix");
    }
}
