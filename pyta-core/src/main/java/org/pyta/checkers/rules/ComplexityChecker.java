package org.pyta.checkers.rules;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.cfg.analysis.Complexity;
import org.pyta.checkers.CheckContext;
import org.pyta.checkers.NodeChecker;
import org.pyta.lint.Diagnostic;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * R1260: A function's cyclomatic complexity must stay within the configured limit.
 *
 * The complexity is measured on the control-flow graph when the unit has one that models all
 * of its statements, otherwise it is estimated from the syntax tree.
 */
public class ComplexityChecker implements NodeChecker {

    private static final String RULE_ID = "R1260";
    private static final String SYMBOL = "too-complex";

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
        return "Limit the cyclomatic complexity of functions";
    }

    @Override
    public Set<NodeKind> kinds() {
        return EnumSet.of(NodeKind.FUNCTION_DEF, NodeKind.ASYNC_FUNCTION_DEF);
    }

    @Override
    public Stream<Diagnostic> check(SyntaxNode function, CheckContext ctx) {
        var limit = ctx.analysis()
                       .config()
                       .maxComplexity();
        var complexity = ctx.graph()
                            .filter(graph -> graph.unsupported()
                                                  .isEmpty())
                            .map(Complexity::mccabe)
                            .orElseGet(() -> Complexity.estimate(ctx.tree(), ctx.unit()));
        if (complexity <= limit) {
            return Stream.empty();
        }
        var name = function.identifier()
                           .orElse(ctx.unit()
                                      .qualifiedName());
        return Stream.of(ctx.diagnostic(RULE_ID,
                                        SYMBOL,
                                        function.span(),
                                        "\"" + name + "\" has a cyclomatic complexity of " + complexity
                                        + ", more than the limit of " + limit
                                        + ". A function with this many paths is hard to test and understand.")
                            .withFix("Split \"" + name + "\" into smaller functions"));
    }
}
