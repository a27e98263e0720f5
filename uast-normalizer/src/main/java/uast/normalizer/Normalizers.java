package uast.normalizer;

import uast.nodes.Uast;
import uast.transformer.Mapping;
import uast.transformer.Obj;

import java.util.ArrayList;
import java.util.List;

import static java.util.Map.entry;
import static uast.transformer.Mapping.map;
import static uast.transformer.Mapping.semantic;
import static uast.transformer.Ops.*;

/// Rules that turn native C# nodes into canonical ones.
///
/// Rules are listed in the order they are tried at each node. Children are converted before
/// their parents, so a parent rule can rely on canonical children (for example a qualified name
/// sees `uast:Identifier` on both sides).
final class Normalizers {

    private Normalizers() {}

    /// {@return the trivia relocation rule, which has a stage to itself}
    static Mapping moveTrivia(NormalizerConfig config) {
        return map("move trivia",
                new MoveTrivia(config, var("group")),
                check(hasType(Uast.GROUP), var("group")));
    }

    static List<Mapping> rules(NormalizerConfig config) {
        final var rules = new ArrayList<Mapping>();
        rules.addAll(identifiers());
        rules.addAll(literals());
        rules.add(semantic("Block", Uast.BLOCK,
                obj(
                        entry("Statements", var("stmts")),
                        entry("OpenBraceToken", any()),
                        entry("CloseBraceToken", any()),
                        entry("IsMissing", bool(false)),
                        entry("IsStructuredTrivia", bool(false))),
                obj(entry("Statements", var("stmts")))));
        rules.addAll(comments());
        rules.add(usingDirective());
        rules.add(qualifiedName());
        rules.addAll(parameters());
        rules.addAll(FunctionMappings.rules());
        rules.add(map("merge groups",
                new MergeGroups(var("group")),
                check(has(entry(Uast.KEY_TYPE, in(Uast.FUNCTION_GROUP, Uast.GROUP))), var("group"))));
        return List.copyOf(rules);
    }

    private static List<Mapping> identifiers() {
        return List.of(
                map("drop empty IdentifierToken",
                        check(has(
                                entry(Uast.KEY_TYPE, string("IdentifierToken")),
                                entry("Text", string("")),
                                entry("Value", string("")),
                                entry("ValueText", string(""))), any()),
                        nil()),
                // Text may hold the verbatim form (@for); Value is the name itself
                semantic("IdentifierToken", Uast.IDENTIFIER,
                        obj(
                                entry("IsMissing", bool(false)),
                                entry("Text", any()),
                                entry("Value", var("name")),
                                entry("ValueText", var("name"))),
                        obj(entry("Name", var("name")))),
                map("drop empty IdentifierName",
                        check(has(
                                entry(Uast.KEY_TYPE, string("IdentifierName")),
                                entry("Identifier", nil())), any()),
                        nil()),
                map("unwrap IdentifierName",
                        obj(
                                entry(Uast.KEY_TYPE, string("IdentifierName")),
                                entry(Uast.KEY_POS, any()),
                                entry("Identifier", var("ident")),
                                entry("Arity", integer(0)),
                                entry("IsMissing", bool(false)),
                                entry("IsStructuredTrivia", bool(false)),
                                entry("IsUnmanaged", any()),
                                entry("IsVar", any())),
                        var("ident")),
                // a keyword used as a parameter name
                semantic("ArgListKeyword", Uast.IDENTIFIER,
                        obj(
                                entry("IsMissing", bool(false)),
                                entry("Text", string("__arglist")),
                                entry("Value", string("__arglist")),
                                entry("ValueText", string("__arglist"))),
                        obj(entry("Name", string("__arglist")))));
    }

    private static List<Mapping> literals() {
        return List.of(
                semantic("StringLiteralExpression", Uast.STRING,
                        obj(
                                entry("Token", obj(
                                        entry(Uast.KEY_TYPE, string("StringLiteralToken")),
                                        entry(Uast.KEY_POS, any()),
                                        entry("IsMissing", bool(false)),
                                        entry("Text", any()),
                                        entry("Value", var("val")),
                                        entry("ValueText", var("val")))),
                                entry("IsMissing", bool(false)),
                                entry("IsStructuredTrivia", bool(false))),
                        obj(entry("Value", var("val")))),
                // its trivia fields were removed by the trivia stage
                semantic("InterpolatedStringTextToken", Uast.STRING,
                        obj(
                                entry("IsMissing", bool(false)),
                                entry("Text", any()),
                                entry("Value", var("val")),
                                entry("ValueText", var("val"))),
                        obj(entry("Value", var("val")))),
                semantic("InterpolatedStringText", Uast.STRING,
                        obj(
                                entry("TextToken", obj(
                                        entry(Uast.KEY_TYPE, string(Uast.STRING)),
                                        entry(Uast.KEY_POS, any()),
                                        entry("Format", string("")),
                                        entry("Value", var("val")))),
                                entry("IsMissing", bool(false)),
                                entry("IsStructuredTrivia", bool(false))),
                        obj(entry("Value", var("val")))),
                booleanLiteral(true),
                booleanLiteral(false));
    }

    private static Mapping booleanLiteral(boolean value) {
        final var text = Boolean.toString(value);
        final var keyword = value ? "TrueKeyword" : "FalseKeyword";
        return semantic(value ? "TrueLiteralExpression" : "FalseLiteralExpression", Uast.BOOL,
                obj(
                        entry("Token", obj(
                                entry(Uast.KEY_TYPE, string(keyword)),
                                entry(Uast.KEY_POS, any()),
                                entry("Text", string(text)),
                                entry("Value", bool(value)),
                                entry("ValueText", string(text)),
                                entry("IsMissing", bool(false)))),
                        entry("IsMissing", bool(false)),
                        entry("IsStructuredTrivia", bool(false))),
                obj(entry("Value", bool(value))));
    }

    private static List<Mapping> comments() {
        return List.of(
                comment("SingleLineCommentTrivia", "//", "", false),
                comment("MultiLineCommentTrivia", "/*", "*/", true),
                comment("SingleLineDocumentationCommentTrivia", "///", "", false));
    }

    private static Mapping comment(String type, String start, String end, boolean block) {
        return semantic(type, Uast.COMMENT,
                obj(
                        entry(Uast.KEY_TOKEN, commentText(start, end, "text")),
                        entry("IsDirective", bool(false))),
                commentNode(block, "text"));
    }

    /// `using [static] [Alias =] Name;` becomes a `uast:Import` of everything in `Name`.
    ///
    /// An alias wraps the path in a `uast:Alias`; a static import sets the target to
    /// `{"static": true}`.
    private static Mapping usingDirective() {
        return semantic("UsingDirective", Uast.IMPORT,
                obj(
                        entry("Name", var("path")),
                        entry("SemicolonToken", any()),
                        entry("UsingKeyword", any()),
                        entry("IsMissing", bool(false)),
                        entry("IsStructuredTrivia", bool(false)),
                        entry("StaticKeyword", ifThen("isStatic",
                                check(hasType("StaticKeyword"), any()),
                                check(hasType("None"), any()))),
                        entry("Alias", ifThen("isAlias",
                                obj(
                                        entry(Uast.KEY_TYPE, string("NameEquals")),
                                        entry(Uast.KEY_POS, any()),
                                        entry("EqualsToken", any()),
                                        entry("IsMissing", bool(false)),
                                        entry("IsStructuredTrivia", bool(false)),
                                        entry("Name", var("alias"))),
                                nil()))),
                obj(
                        entry("Path", ifThen("isAlias",
                                uastType(Uast.ALIAS, obj(
                                        entry("Name", var("alias")),
                                        entry("Node", var("path")))),
                                var("path"))),
                        entry("All", bool(true)),
                        entry("Target", ifThen("isStatic",
                                obj(entry("static", bool(true))),
                                nil()))));
    }

    /// Qualified names are a left-leaning linked list. The innermost link has an identifier on
    /// both sides; every outer link finds its left side already converted and appends its right
    /// identifier to the names collected so far.
    private static Mapping qualifiedName() {
        return semantic("QualifiedName", Uast.QUALIFIED_IDENTIFIER,
                casesObj("case",
                        obj(
                                entry("Right", var("right")),
                                entry("Arity", integer(0)),
                                entry("DotToken", any()),
                                entry("IsMissing", bool(false)),
                                entry("IsStructuredTrivia", bool(false)),
                                entry("IsUnmanaged", bool(false)),
                                entry("IsVar", bool(false))),
                        List.of(
                                obj(entry("Left", check(hasType(Uast.IDENTIFIER), var("left")))),
                                obj(entry("Left", uastType(Uast.QUALIFIED_IDENTIFIER, obj(
                                        // TODO: take the start position of the whole name from here
                                        entry(Uast.KEY_POS, any()),
                                        entry("Names", var("names")))))))),
                casesObj("case", null, List.of(
                        obj(entry("Names", arr(var("left"), var("right")))),
                        obj(entry("Names", append(var("names"), var("right")))))));
    }

    private static List<Mapping> parameters() {
        final Obj common = obj(
                entry("AttributeLists", arr()),
                entry("Default", var("def_init")),
                entry("IsMissing", bool(false)),
                entry("Type", var("type")));
        return List.of(
                // old style variadic: a parameter named __arglist
                semantic("Parameter", Uast.ARGUMENT,
                        common.merge(obj(
                                entry("Identifier", check(has(
                                        entry(Uast.KEY_TYPE, string(Uast.IDENTIFIER)),
                                        entry("Name", string("__arglist"))), var("name"))),
                                entry("IsStructuredTrivia", bool(false)),
                                entry("Modifiers", arr()))),
                        obj(
                                entry("Name", var("name")),
                                entry("Type", var("type")),
                                entry("Init", var("def_init")),
                                entry("Variadic", bool(true)),
                                entry("MapVariadic", bool(false)),
                                entry("Receiver", bool(false)))),
                // params and this become flags; ref, out and in wrap the type
                semantic("Parameter", Uast.ARGUMENT,
                        common.merge(obj(
                                entry("Identifier", check(has(entry(Uast.KEY_TYPE, string(Uast.IDENTIFIER))), var("name"))),
                                entry("IsStructuredTrivia", any()),
                                entry("Modifiers", new KeywordFlag("ParamsKeyword", var("variadic"),
                                        new KeywordFlag("ThisKeyword", var("this"), var("rest")))))),
                        obj(
                                entry("Name", var("name")),
                                entry("Type", new ArrayToChain("Type", var("rest"), var("type"))),
                                entry("Init", var("def_init")),
                                entry("Variadic", var("variadic")),
                                entry("MapVariadic", bool(false)),
                                entry("Receiver", var("this")))));
    }
}
