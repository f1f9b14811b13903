package org.pyta.checkers;

import org.pyta.ast.SyntaxNode;
import org.pyta.lint.AnalysisError;
import org.pyta.lint.Diagnostic;
import org.pyta.lint.MalformedInputException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single pre-order pass over the nodes of one unit, invoking every checker registered for
 * each node's kind.
 *
 * A checker that throws is disabled for the rest of the unit and reported as an
 * {@code analysis-incomplete} diagnostic under its own rule id; the other checkers continue.
 * A {@link MalformedInputException} is not isolated: it abandons the whole unit.
 */
public final class UnitTraversal {
    private static final Logger log = LoggerFactory.getLogger(UnitTraversal.class);

    private final CheckerRegistry registry;

    private UnitTraversal(CheckerRegistry registry) {
        this.registry = registry;
    }

    public static UnitTraversal unitTraversal(CheckerRegistry registry) {
        return new UnitTraversal(registry);
    }

    /**
     * Run all registered checkers over the unit described by the context.
     *
     * @return diagnostics in traversal order
     */
    public List<Diagnostic> traverse(CheckContext ctx) {
        var diagnostics = new ArrayList<Diagnostic>();
        var failed = new HashSet<NodeChecker>();

        ctx.unit()
           .nodes(ctx.tree())
           .forEach(node -> visit(node, ctx, failed, diagnostics));
        return diagnostics;
    }

    private void visit(SyntaxNode node, CheckContext ctx, Set<NodeChecker> failed, List<Diagnostic> diagnostics) {
        for (var checker : registry.checkersFor(node.kind())) {
            if (failed.contains(checker)) {
                continue;
            }
            try {
                diagnostics.addAll(checker.check(node, ctx)
                                          .toList());
            } catch (MalformedInputException e) {
                throw e;
            } catch (RuntimeException e) {
                var failure = new AnalysisError.CheckerFailure(checker.ruleId(), node.span(), e);
                log.warn("Checker {} failed on {} in {}: {}",
                         checker.ruleId(),
                         node,
                         ctx.unit()
                            .qualifiedName(),
                         e.toString(),
                         e);
                failed.add(checker);
                diagnostics.add(Diagnostic.analysisIncomplete(checker.ruleId(), failure.span(), failure.message()));
            }
        }
    }
}
