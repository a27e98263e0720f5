package uast.normalizer;

import uast.nodes.Node;
import uast.nodes.Uast;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Lookup tables and policies of the normalizer.
///
/// The configuration is handed to the operators and rule tables when a [Normalizer] is created;
/// nothing reads it from global state.
///
/// @param triviaTargetFields node type to the array field that absorbs relocated trivia instead
///                           of wrapping the node in a `uast:Group`
/// @param fullSpanTypes node types positioned by `FullSpan` rather than `Span`
/// @param relocatableFields field names whose wrapped token is unwrapped by [MoveTrivia]
/// @param relocatableSuffixes field name suffixes with the same meaning
/// @param triviaTypeSuffix the `@type` suffix that marks a trivia node
/// @param leadingTriviaField the field holding leading trivia
/// @param trailingTriviaField the field holding trailing trivia
/// @param unanchoredTrivia what to do with a token wrapper that lost its token
public record NormalizerConfig(
        Map<String, String> triviaTargetFields,
        Set<String> fullSpanTypes,
        Set<String> relocatableFields,
        Set<String> relocatableSuffixes,
        String triviaTypeSuffix,
        String leadingTriviaField,
        String trailingTriviaField,
        UnanchoredTriviaPolicy unanchoredTrivia) {

    public NormalizerConfig {
        triviaTargetFields = Map.copyOf(Objects.requireNonNull(triviaTargetFields, "triviaTargetFields must not be null"));
        fullSpanTypes = Set.copyOf(Objects.requireNonNull(fullSpanTypes, "fullSpanTypes must not be null"));
        relocatableFields = Set.copyOf(Objects.requireNonNull(relocatableFields, "relocatableFields must not be null"));
        relocatableSuffixes = Set.copyOf(Objects.requireNonNull(relocatableSuffixes, "relocatableSuffixes must not be null"));
        Objects.requireNonNull(triviaTypeSuffix, "triviaTypeSuffix must not be null");
        Objects.requireNonNull(leadingTriviaField, "leadingTriviaField must not be null");
        Objects.requireNonNull(trailingTriviaField, "trailingTriviaField must not be null");
        Objects.requireNonNull(unanchoredTrivia, "unanchoredTrivia must not be null");
        if (triviaTypeSuffix.isEmpty()) {
            throw new IllegalArgumentException("triviaTypeSuffix must not be empty");
        }
    }

    /// {@return the tables for the C# syntax tree}
    public static NormalizerConfig csharp() {
        return new NormalizerConfig(
                Map.of("Block", "Statements", "CompilationUnit", "Members"),
                Set.of("SingleLineDocumentationCommentTrivia"),
                Set.of("ReturnType"),
                Set.of("Token", "Keyword"),
                "Trivia",
                "LeadingTrivia",
                "TrailingTrivia",
                UnanchoredTriviaPolicy.TREAT_AS_LEADING);
    }

    public NormalizerConfig withTriviaTargetField(String type, String field) {
        final var fields = new LinkedHashMap<>(triviaTargetFields);
        fields.put(type, field);
        return new NormalizerConfig(fields, fullSpanTypes, relocatableFields, relocatableSuffixes,
                triviaTypeSuffix, leadingTriviaField, trailingTriviaField, unanchoredTrivia);
    }

    public NormalizerConfig withFullSpanTypes(Set<String> types) {
        return new NormalizerConfig(triviaTargetFields, types, relocatableFields, relocatableSuffixes,
                triviaTypeSuffix, leadingTriviaField, trailingTriviaField, unanchoredTrivia);
    }

    public NormalizerConfig withRelocatableFields(Set<String> names, Set<String> suffixes) {
        return new NormalizerConfig(triviaTargetFields, fullSpanTypes, names, suffixes,
                triviaTypeSuffix, leadingTriviaField, trailingTriviaField, unanchoredTrivia);
    }

    public NormalizerConfig withUnanchoredTrivia(UnanchoredTriviaPolicy policy) {
        return new NormalizerConfig(triviaTargetFields, fullSpanTypes, relocatableFields, relocatableSuffixes,
                triviaTypeSuffix, leadingTriviaField, trailingTriviaField, policy);
    }

    /// {@return the trivia target field of a node type, if it has one}
    public Optional<String> triviaTargetField(String type) {
        return Optional.ofNullable(triviaTargetFields.get(type));
    }

    /// {@return `true` if a token wrapped under `field` is unwrapped during trivia relocation}
    public boolean isRelocatable(String field) {
        if (relocatableFields.contains(field)) return true;
        for (final var suffix : relocatableSuffixes) {
            if (field.endsWith(suffix)) return true;
        }
        return false;
    }

    /// {@return `true` if the node is a trivia node (comment, whitespace, directive)}
    public boolean isTrivia(Node node) {
        return Uast.typeOf(node).endsWith(triviaTypeSuffix);
    }
}
