package org.pyta.cfg.analysis;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.checkers.CheckContext;
import org.pyta.lint.Diagnostic;

import java.util.stream.Stream;

/**
 * E9970: A function annotated with a return type must not reach the end of its body.
 *
 * Functions annotated {@code None} or {@code Optional[...]} and stub bodies (only a docstring,
 * {@code pass}, {@code ...} or {@code raise}) are not checked.
 */
public class MissingReturnAnalysis implements GraphAnalysis {

    private static final String RULE_ID = "E9970";
    private static final String SYMBOL = "missing-return-statement";

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public String symbol() {
        return SYMBOL;
    }

    @Override
    public String description() {
        return "Functions with a return type annotation return on every path";
    }

    @Override
    public Stream<Diagnostic> analyze(ControlFlowGraph graph, CheckContext ctx) {
        var unit = ctx.unit();
        var tree = ctx.tree();
        if (!unit.isFunction()) {
            return Stream.empty();
        }
        var annotation = tree.child(unit.node(), "returns");
        if (annotation.isEmpty() || allowsNone(tree, annotation.get()) || isStub(tree, unit.node())) {
            return Stream.empty();
        }

        var live = DeadBranches.deadBranches(tree, ctx.folding())
                               .liveBlocks(graph);
        var fallsOff = graph.exits()
                            .stream()
                            .filter(live::contains)
                            .anyMatch(exit -> !Returns.isExplicitReturn(exit));
        if (!fallsOff) {
            return Stream.empty();
        }
        var name = Returns.functionName(unit.node());
        return Stream.of(ctx.diagnostic(RULE_ID,
                                        SYMBOL,
                                        unit.span(),
                                        "Function \"" + name + "\" is annotated to return a value, but some paths "
                                        + "reach the end of the function without a return statement.")
                            .withFix("Add a return statement to every path of \"" + name + "\""));
    }

    private static boolean allowsNone(SyntaxTree tree, SyntaxNode annotation) {
        return switch (annotation.kind()) {
            case CONSTANT -> annotation.hasAttribute("type", "NoneType") || annotation.hasAttribute("value", "None");
            case NAME -> annotation.hasAttribute("id", "None");
            case SUBSCRIPT -> tree.child(annotation, "value")
                                  .filter(value -> value.hasAttribute("id", "Optional")
                                                   || value.hasAttribute("attr", "Optional"))
                                  .isPresent();
            // X | None
            case BIN_OP -> annotation.hasAttribute("op", "BitOr") && tree.children(annotation)
                                                                         .stream()
                                                                         .anyMatch(side -> allowsNone(tree, side));
            default -> false;
        };
    }

    private static boolean isStub(SyntaxTree tree, SyntaxNode function) {
        return tree.children(function, "body")
                   .stream()
                   .allMatch(statement -> statement.is(NodeKind.PASS)
                                          || statement.is(NodeKind.RAISE)
                                          || statement.is(NodeKind.EXPR) && tree.child(statement, "value")
                                                                                .filter(value -> value.is(NodeKind.CONSTANT))
                                                                                .filter(value -> value.hasAttribute("type", "str")
                                                                                                 || value.hasAttribute("type", "ellipsis"))
                                                                                .isPresent());
    }
}
