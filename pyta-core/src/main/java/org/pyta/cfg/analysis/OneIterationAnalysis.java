package org.pyta.cfg.analysis;

import org.pyta.ast.NodeKind;
import org.pyta.cfg.BasicBlock;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.cfg.EdgeKind;
import org.pyta.checkers.CheckContext;
import org.pyta.lint.Diagnostic;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Stream;

/**
 * E9996: A loop whose body always leaves the loop on the first iteration.
 *
 * The body is entered, but no reachable path inside the loop returns to the header.
 */
public class OneIterationAnalysis implements GraphAnalysis {

    private static final String RULE_ID = "E9996";
    private static final String SYMBOL = "one-iteration";

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
        return "No loops that can only run once";
    }

    @Override
    public Stream<Diagnostic> analyze(ControlFlowGraph graph, CheckContext ctx) {
        var branches = DeadBranches.deadBranches(ctx.tree(), ctx.folding());
        var live = branches.liveBlocks(graph);
        var dominators = Dominators.dominators(graph, edge -> !branches.isDead(edge));

        return graph.blocks()
                    .stream()
                    .filter(live::contains)
                    .filter(OneIterationAnalysis::isLoopHeader)
                    .filter(header -> bodyEntered(header, live) && !loopsBack(header, live, dominators))
                    .map(header -> {
                        var loop = header.lastStatement()
                                         .orElseThrow();
                        return ctx.diagnostic(RULE_ID,
                                              SYMBOL,
                                              loop.span(),
                                              "This loop will only ever run for one iteration: every path through "
                                              + "its body leaves the loop with return, break or raise.")
                                  .withFix("Use an if statement instead of the loop, or move the statement that "
                                           + "leaves the loop under a condition");
                    })
                    .sorted(Comparator.comparing(Diagnostic::span));
    }

    private static boolean isLoopHeader(BasicBlock block) {
        return block.endsWith(NodeKind.WHILE) || block.endsWith(NodeKind.FOR) || block.endsWith(NodeKind.ASYNC_FOR);
    }

    private static boolean bodyEntered(BasicBlock header, Set<BasicBlock> live) {
        return header.successors()
                     .stream()
                     .anyMatch(edge -> edge.kind() == EdgeKind.TRUE_BRANCH && live.contains(edge.target()));
    }

    /// A live back edge from a block the header dominates, that is from inside the loop.
    private static boolean loopsBack(BasicBlock header, Set<BasicBlock> live, Dominators dominators) {
        return header.predecessors()
                     .stream()
                     .anyMatch(edge -> edge.kind() == EdgeKind.LOOP_BACK
                                       && live.contains(edge.source())
                                       && dominators.dominates(header, edge.source()));
    }
}
