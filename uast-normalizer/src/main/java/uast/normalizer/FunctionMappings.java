package uast.normalizer;

import uast.nodes.Kind;
import uast.nodes.Uast;
import uast.transformer.Mapping;
import uast.transformer.Obj;
import uast.transformer.Op;

import java.util.ArrayList;
import java.util.List;

import static java.util.Map.entry;
import static uast.transformer.Mapping.semantic;
import static uast.transformer.Ops.*;

/// Rules for method, constructor and destructor declarations.
///
/// Each declaration becomes a `uast:FunctionGroup` whose `Nodes` hold, in order: the attribute
/// slot, the modifier slot, any extra slots, and a `uast:Alias` naming the `uast:Function`.
/// Empty slots are null and are compacted away by [MergeGroups].
final class FunctionMappings {

    private FunctionMappings() {}

    static List<Mapping> rules() {
        return List.of(
                function("MethodDeclaration", true,
                        obj(
                                entry("Arity", any()),
                                entry("ExplicitInterfaceSpecifier", nil()),
                                entry("ConstraintClauses", cases("caseConstraint",
                                        arr(),
                                        notEmpty(var("constraints")))),
                                entry("TypeParameterList", cases("caseTypeParams",
                                        nil(),
                                        arr(),
                                        notEmpty(var("typeParams"))))),
                        cases("caseTypeParams",
                                nil(),
                                nil(),
                                notEmpty(var("typeParams"))),
                        cases("caseConstraint",
                                nil(),
                                notEmpty(var("constraints")))),
                constructor(),
                function("DestructorDeclaration", false,
                        obj(entry("TildeToken", any()))));
    }

    /// Fields shared by every declaration kind.
    private static Obj declaration() {
        return obj(
                entry("Identifier", var("name")),
                entry("ParameterList", obj(
                        entry(Uast.KEY_TYPE, string("ParameterList")),
                        entry(Uast.KEY_POS, any()),
                        entry("OpenParenToken", any()),
                        entry("CloseParenToken", any()),
                        entry("IsMissing", bool(false)),
                        entry("IsStructuredTrivia", bool(false)),
                        entry("Parameters", var("params")))),
                entry("IsMissing", bool(false)),
                entry("IsStructuredTrivia", bool(false)),
                entry("SemicolonToken", any()),
                entry("AttributeLists", cases("caseAttrs",
                        arr(),
                        check(ofKind(Kind.ARRAY), var("attr")),
                        check(ofKind(Kind.OBJECT), var("attr")))),
                entry("Modifiers", cases("caseMods",
                        arr(),
                        notEmpty(var("modifiers")))));
    }

    private static Op attributeSlot() {
        return cases("caseAttrs",
                nil(),
                var("attr"),
                arr(var("attr")));
    }

    private static Op modifierSlot() {
        return cases("caseMods",
                nil(),
                notEmpty(var("modifiers")));
    }

    /// Maps a declaration with either a block body or an arrow expression body.
    ///
    /// An arrow body `=> expr` becomes a `uast:Block` holding a single `ReturnStatement`,
    /// positioned at the arrow clause and the arrow token.
    /// @param type the native declaration type
    /// @param returns whether the declaration has a `ReturnType`
    /// @param other extra native fields of this declaration kind
    /// @param extraSlots extra `Nodes` slots, placed before the alias
    private static Mapping function(String type, boolean returns, Obj other, Op... extraSlots) {
        var src = declaration().merge(other);
        var signature = obj(entry("Arguments", var("params")));
        if (returns) {
            src = src.with("ReturnType", var("rettype"));
            signature = signature.with("Returns", one(uastType(Uast.ARGUMENT, obj(entry("Type", var("rettype"))))));
        }

        final var slots = new ArrayList<Op>();
        slots.add(attributeSlot());
        slots.add(modifierSlot());
        slots.addAll(List.of(extraSlots));
        slots.add(uastType(Uast.ALIAS, obj(
                entry("Name", var("name")),
                entry("Node", uastType(Uast.FUNCTION, obj(
                        entry("Type", uastType(Uast.FUNCTION_TYPE, signature)),
                        entry("Body", cases("isArrow",
                                uastType(Uast.BLOCK, obj(
                                        entry(Uast.KEY_POS, var("arrow_pos")),
                                        entry("Statements", arr(obj(
                                                entry(Uast.KEY_TYPE, string("ReturnStatement")),
                                                entry(Uast.KEY_POS, var("arrow_pos_tok")),
                                                entry("Expression", var("arrow"))))))),
                                var("body")))))))));

        return semantic(type, Uast.FUNCTION_GROUP,
                casesObj("isArrow", src, List.of(
                        obj(
                                entry("Body", nil()),
                                entry("ExpressionBody", obj(
                                        entry(Uast.KEY_TYPE, string("ArrowExpressionClause")),
                                        entry(Uast.KEY_POS, var("arrow_pos")),
                                        entry("ArrowToken", obj(
                                                entry(Uast.KEY_TYPE, string("EqualsGreaterThanToken")),
                                                entry(Uast.KEY_POS, var("arrow_pos_tok")),
                                                entry("IsMissing", bool(false)),
                                                entry("Text", any()),
                                                entry("Value", any()),
                                                entry("ValueText", any()))),
                                        entry("IsMissing", bool(false)),
                                        entry("IsStructuredTrivia", bool(false)),
                                        entry("Expression", var("arrow"))))),
                        obj(
                                entry("ExpressionBody", nil()),
                                entry("Body", var("body"))))),
                obj(entry(Uast.NODES, arr(slots.toArray(Op[]::new)))));
    }

    /// Constructors may call a base constructor (`: base(...)`). The call becomes the first
    /// statement of the body.
    private static Mapping constructor() {
        final var src = declaration().merge(obj(
                entry("ExpressionBody", nil()),
                entry("Initializer", ifThen("hasBaseInit",
                        check(hasType("BaseConstructorInitializer"), var("baseInit")),
                        nil())),
                entry("Body", part("bodyMap", obj(entry("Statements", var("stmts")))))));
        return semantic("ConstructorDeclaration", Uast.FUNCTION_GROUP,
                src,
                obj(entry(Uast.NODES, arr(
                        attributeSlot(),
                        modifierSlot(),
                        uastType(Uast.ALIAS, obj(
                                entry("Name", var("name")),
                                entry("Node", uastType(Uast.FUNCTION, obj(
                                        entry("Body", part("bodyMap", obj(
                                                entry("Statements", ifThen("hasBaseInit",
                                                        prependOne(var("baseInit"), var("stmts")),
                                                        var("stmts")))))),
                                        entry("Type", uastType(Uast.FUNCTION_TYPE, obj(
                                                entry("Arguments", var("params"))))))))))))));
    }
}
