package org.pyta.cfg.analysis;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.BasicBlock;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.cfg.Edge;
import org.pyta.checkers.CheckContext;
import org.pyta.lint.Diagnostic;

import java.util.Comparator;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * W0101: Code that no execution can reach.
 *
 * Every non-empty block that the entry cannot reach without taking a dead branch is reported
 * at its first statement.
 */
public class UnreachableCodeAnalysis implements GraphAnalysis {

    private static final String RULE_ID = "W0101";
    private static final String SYMBOL = "unreachable";

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
        return "No code that can never run";
    }

    @Override
    public Stream<Diagnostic> analyze(ControlFlowGraph graph, CheckContext ctx) {
        var branches = DeadBranches.deadBranches(ctx.tree(), ctx.folding());
        var dead = branches.deadEdges(graph);
        var live = Reachability.reachableBlocks(graph, edge -> !dead.contains(edge));
        var structurallyReachable = Reachability.reachableBlocks(graph);

        return graph.blocks()
                    .stream()
                    .filter(block -> !block.isEmpty() && !live.contains(block))
                    .map(block -> report(block, structurallyReachable, dead, branches, ctx))
                    .sorted(Comparator.comparing(Diagnostic::span));
    }

    private Diagnostic report(BasicBlock block,
                              Set<BasicBlock> structurallyReachable,
                              Set<Edge> dead,
                              DeadBranches branches,
                              CheckContext ctx) {
        var first = block.firstStatement()
                         .orElseThrow();
        var message = structurallyReachable.contains(block)
                      ? deadBranchMessage(block, dead, branches)
                      : afterTerminalMessage(ctx.tree(), first);
        return ctx.diagnostic(RULE_ID, SYMBOL, first.span(), message)
                  .withFix("Remove the code that can never run, or fix the logic that skips it");
    }

    private static String deadBranchMessage(BasicBlock block, Set<Edge> dead, DeadBranches branches) {
        var condition = block.predecessors()
                             .stream()
                             .filter(dead::contains)
                             .findFirst()
                             .flatMap(edge -> edge.source()
                                                  .lastStatement())
                             .flatMap(branches::condition)
                             .map(DeadBranches::describe);
        return condition.map(text -> "This code is never run because " + text + " is a constant, so this branch "
                                     + "can never be taken.")
                        .orElse("This code is never run because it is only reached through a branch that can "
                                + "never be taken.");
    }

    private static String afterTerminalMessage(SyntaxTree tree, SyntaxNode first) {
        return precedingTerminal(tree, first).map(terminal -> "This code is unreachable because it follows a \""
                                                              + terminal.kind()
                                                                        .pythonName()
                                                                        .toLowerCase()
                                                              + "\" statement on line " + terminal.span()
                                                                                                  .startLine()
                                                              + ", which always leaves this block.")
                                             .orElse("This code is unreachable: no path from the start of the "
                                                     + "program leads here.");
    }

    private static Optional<SyntaxNode> precedingTerminal(SyntaxTree tree, SyntaxNode statement) {
        return tree.previousSibling(statement)
                   .filter(previous -> previous.is(NodeKind.RETURN)
                                       || previous.is(NodeKind.RAISE)
                                       || previous.is(NodeKind.BREAK)
                                       || previous.is(NodeKind.CONTINUE));
    }
}
