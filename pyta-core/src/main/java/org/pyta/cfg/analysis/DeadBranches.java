package org.pyta.cfg.analysis;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.BasicBlock;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.cfg.Edge;
import org.pyta.cfg.EdgeKind;
import org.pyta.checkers.ConstantFolding;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Branch edges that can never be taken because their condition has a constant truth value.
 *
 * <ul>
 *     <li>{@code if}/{@code while} with an always-true test: the false branch is dead;</li>
 *     <li>{@code if}/{@code while} with an always-false test: the true branch is dead;</li>
 *     <li>{@code for} over an empty literal: the loop body is dead.</li>
 * </ul>
 */
public final class DeadBranches {
    private final SyntaxTree tree;
    private final ConstantFolding folding;

    private DeadBranches(SyntaxTree tree, ConstantFolding folding) {
        this.tree = tree;
        this.folding = folding;
    }

    public static DeadBranches deadBranches(SyntaxTree tree, ConstantFolding folding) {
        return new DeadBranches(tree, folding);
    }

    public Set<Edge> deadEdges(ControlFlowGraph graph) {
        var dead = new LinkedHashSet<Edge>();
        for (var edge : graph.edges()) {
            if (isDead(edge)) {
                dead.add(edge);
            }
        }
        return Collections.unmodifiableSet(dead);
    }

    /// Blocks reachable from the entry without taking a dead branch.
    public Set<BasicBlock> liveBlocks(ControlFlowGraph graph) {
        var dead = deadEdges(graph);
        return Reachability.reachableBlocks(graph, edge -> !dead.contains(edge));
    }

    public boolean isDead(Edge edge) {
        if (edge.kind() != EdgeKind.TRUE_BRANCH && edge.kind() != EdgeKind.FALSE_BRANCH) {
            return false;
        }
        var branching = edge.source()
                            .lastStatement();
        if (branching.isEmpty()) {
            return false;
        }
        var statement = branching.get();
        return switch (statement.kind()) {
            case IF, WHILE -> condition(statement).flatMap(folding::truthiness)
                                                  .map(value -> value
                                                                ? edge.kind() == EdgeKind.FALSE_BRANCH
                                                                : edge.kind() == EdgeKind.TRUE_BRANCH)
                                                  .orElse(false);
            case FOR, ASYNC_FOR -> edge.kind() == EdgeKind.TRUE_BRANCH && tree.child(statement, "iter")
                                                                              .flatMap(folding::truthiness)
                                                                              .map(value -> !value)
                                                                              .orElse(false);
            default -> false;
        };
    }

    /// The tested expression of the statement a dead edge leaves from.
    public Optional<SyntaxNode> condition(SyntaxNode statement) {
        return statement.is(NodeKind.FOR) || statement.is(NodeKind.ASYNC_FOR)
               ? tree.child(statement, "iter")
               : tree.child(statement, "test");
    }

    /// Short source-like rendering of a constant condition for messages.
    public static String describe(SyntaxNode condition) {
        if (condition.is(NodeKind.CONSTANT)) {
            var value = condition.attribute("value")
                                 .orElse("");
            return condition.hasAttribute("type", "str")
                   ? "\"" + value + "\""
                   : value;
        }
        return switch (condition.kind()) {
            case LIST -> "the list on line " + condition.span()
                                                        .startLine();
            case TUPLE -> "the tuple on line " + condition.span()
                                                          .startLine();
            default -> "the condition on line " + condition.span()
                                                           .startLine();
        };
    }
}
