package org.pyta.cfg.analysis;

import org.pyta.cfg.ControlFlowGraph;
import org.pyta.checkers.CheckContext;
import org.pyta.lint.Diagnostic;

import java.util.stream.Stream;

/**
 * R1710: A function that returns a value on some path must return one on every path.
 *
 * Compares the reachable exits of the graph: a {@code return} with a value against an exit
 * that falls off the end of the body or returns nothing; a bare {@code return} and {@code return None}
 * both return nothing. Generators are not checked.
 */
public class InconsistentReturnAnalysis implements GraphAnalysis {

    private static final String RULE_ID = "R1710";
    private static final String SYMBOL = "inconsistent-return-statements";

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
        return "Either every return statement returns a value or none does";
    }

    @Override
    public Stream<Diagnostic> analyze(ControlFlowGraph graph, CheckContext ctx) {
        var unit = ctx.unit();
        var tree = ctx.tree();
        if (!unit.isFunction() || Returns.isGenerator(tree, unit)) {
            return Stream.empty();
        }

        var live = DeadBranches.deadBranches(tree, ctx.folding())
                               .liveBlocks(graph);
        var exits = graph.exits()
                         .stream()
                         .filter(live::contains)
                         .toList();
        var returnsValue = exits.stream()
                                .anyMatch(exit -> Returns.exitReturnsValue(tree, exit));
        var fallsOff = exits.stream()
                            .anyMatch(exit -> !Returns.isExplicitReturn(exit));
        var returnsNothing = exits.stream()
                                  .anyMatch(exit -> Returns.isExplicitReturn(exit)
                                                    && !Returns.exitReturnsValue(tree, exit));
        if (!returnsValue || !(fallsOff || returnsNothing)) {
            return Stream.empty();
        }

        var name = Returns.functionName(unit.node());
        var reason = fallsOff
                     ? "but can also reach the end of its body without a return statement"
                     : "but also has return statements that return None";
        return Stream.of(ctx.diagnostic(RULE_ID,
                                        SYMBOL,
                                        unit.span(),
                                        "Function \"" + name + "\" returns a value on some paths " + reason
                                        + ", which returns None. Every path should return a value.")
                            .withFix(fallsOff
                                     ? "Add a return statement with a value at the end of \"" + name + "\""
                                     : "Return a value other than None from every return statement in \"" + name
                                       + "\", or from none of them"));
    }
}
