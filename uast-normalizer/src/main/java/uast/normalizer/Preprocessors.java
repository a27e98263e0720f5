package uast.normalizer;

import uast.nodes.Uast;
import uast.transformer.Mapping;
import uast.transformer.Obj;
import uast.transformer.Positions;
import uast.transformer.Sel;

import java.util.ArrayList;
import java.util.List;

import static java.util.Map.entry;
import static uast.transformer.Mapping.map;
import static uast.transformer.Ops.*;

/// Clean-up rules applied to the native tree before normalization.
final class Preprocessors {

    static final String SPAN_START = "spanStart";
    static final String SPAN_END = "spanEnd";

    private static final List<String> COMMENT_TYPES = List.of(
            "SingleLineCommentTrivia",
            "SingleLineDocumentationCommentTrivia",
            "MultiLineCommentTrivia");

    private Preprocessors() {}

    static List<Mapping> rules(NormalizerConfig config) {
        final var rules = new ArrayList<Mapping>();

        // whitespace carries no information; null it out and compact the trivia arrays below
        rules.add(map("drop whitespace trivia",
                obj(
                        entry(Uast.KEY_TYPE, check(in("WhitespaceTrivia", "EndOfLineTrivia", "SkippedTokensTrivia"), any())),
                        entry("FullSpan", any()),
                        entry("Span", any()),
                        entry("SpanStart", any()),
                        entry("IsDirective", bool(false))),
                nil()));
        rules.add(dropNils(config.leadingTriviaField()));
        rules.add(dropNils(config.trailingTriviaField()));

        // an empty span is one with Length == 0
        rules.add(map("drop TextSpan.IsEmpty",
                part("_", obj(
                        entry(Uast.KEY_TYPE, string("TextSpan")),
                        entry("IsEmpty", any()))),
                part("_", obj(
                        entry(Uast.KEY_TYPE, string("TextSpan"))))));
        // duplicates Span.Start
        rules.add(map("drop SpanStart",
                part("_", obj(entry("SpanStart", any()))),
                part("_", Obj.empty())));

        rules.add(spanOffsets(config));
        rules.add(Positions.mapping(SPAN_START, SPAN_END));

        for (final var type : COMMENT_TYPES) {
            rules.add(map("empty @token for " + type,
                    check(not(has(entry(Uast.KEY_TOKEN, any()))),
                            part("_", obj(entry(Uast.KEY_TYPE, string(type))))),
                    part("_", obj(
                            entry(Uast.KEY_TYPE, string(type)),
                            entry(Uast.KEY_TOKEN, string(""))))));
        }
        return List.copyOf(rules);
    }

    private static Mapping dropNils(String field) {
        return map("drop nils in " + field,
                part("_", obj(entry(field, new DropNils(var("arr"))))),
                part("_", obj(entry(field, var("arr")))));
    }

    /// Moves the offsets of `Span`, or of `FullSpan` for the configured types, to temporary
    /// fields on the node itself, where [Positions#mapping] picks them up.
    private static Mapping spanOffsets(NormalizerConfig config) {
        final Sel fullSpan = in(config.fullSpanTypes().toArray(String[]::new));
        final Sel span = not(fullSpan);
        return map("span offsets",
                part("_", casesObj("case", null, List.of(
                        obj(
                                entry(Uast.KEY_TYPE, check(fullSpan, var("typ"))),
                                entry("FullSpan", textSpan()),
                                entry("Span", any())),
                        obj(
                                entry(Uast.KEY_TYPE, check(span, var("typ"))),
                                entry("Span", textSpan()),
                                entry("FullSpan", any()))))),
                part("_", casesObj("case",
                        obj(
                                entry(SPAN_START, var("start")),
                                entry(SPAN_END, var("end"))),
                        List.of(
                                obj(entry(Uast.KEY_TYPE, check(fullSpan, var("typ")))),
                                obj(entry(Uast.KEY_TYPE, check(span, var("typ"))))))));
    }

    private static Obj textSpan() {
        return obj(
                entry(Uast.KEY_TYPE, string("TextSpan")),
                entry("Length", any()),
                entry("Start", var("start")),
                entry("End", var("end")));
    }
}
