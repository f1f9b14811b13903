package org.pyta.cfg.analysis;

import org.pyta.ast.AnalysisUnit;
import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.BasicBlock;

/// Helpers shared by the return-path analyses.
final class Returns {

    private Returns() {}

    /// Whether the exit block leaves through an explicit {@code return}.
    static boolean isExplicitReturn(BasicBlock exit) {
        return exit.endsWith(NodeKind.RETURN);
    }

    /// Whether a {@code return} statement carries a value other than {@code None}.
    static boolean returnsValue(SyntaxTree tree, SyntaxNode returnStatement) {
        return tree.child(returnStatement, "value")
                   .filter(value -> !(value.is(NodeKind.CONSTANT) && value.hasAttribute("type", "NoneType")))
                   .isPresent();
    }

    /// Whether the exit block ends with a {@code return} that carries a value.
    static boolean exitReturnsValue(SyntaxTree tree, BasicBlock exit) {
        return isExplicitReturn(exit) && returnsValue(tree,
                                                      exit.lastStatement()
                                                          .orElseThrow());
    }

    static boolean isGenerator(SyntaxTree tree, AnalysisUnit unit) {
        return unit.nodes(tree)
                   .filter(node -> !insideLambda(tree, node, unit))
                   .anyMatch(node -> node.is(NodeKind.YIELD) || node.is(NodeKind.YIELD_FROM));
    }

    private static boolean insideLambda(SyntaxTree tree, SyntaxNode node, AnalysisUnit unit) {
        return tree.ancestors(node)
                   .takeWhile(ancestor -> ancestor.index() != unit.node()
                                                                  .index())
                   .anyMatch(ancestor -> ancestor.is(NodeKind.LAMBDA));
    }

    static String functionName(SyntaxNode function) {
        return function.identifier()
                       .orElse("<function>");
    }
}
