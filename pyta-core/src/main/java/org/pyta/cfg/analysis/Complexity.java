package org.pyta.cfg.analysis;

import org.pyta.ast.AnalysisUnit;
import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.cfg.EdgeKind;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * McCabe cyclomatic complexity.
 */
public final class Complexity {
    private static final Set<NodeKind> DECISIONS = EnumSet.of(NodeKind.IF,
                                                              NodeKind.IF_EXP,
                                                              NodeKind.FOR,
                                                              NodeKind.ASYNC_FOR,
                                                              NodeKind.WHILE,
                                                              NodeKind.EXCEPT_HANDLER,
                                                              NodeKind.BOOL_OP,
                                                              NodeKind.MATCH_CASE);

    private Complexity() {}

    /**
     * {@code E - N + 2} over the reachable part of the graph, closed by a virtual exit node that
     * every block without a normal successor flows into.
     *
     * The exception edges of a protected region count once per handler, as the branch into
     * that handler.
     */
    public static int mccabe(ControlFlowGraph graph) {
        var reachable = Reachability.reachableBlocks(graph);
        var edges = 0;
        var handlers = new HashSet<Integer>();

        for (var block : reachable) {
            var normal = 0;
            for (var edge : block.successors()) {
                if (edge.kind() == EdgeKind.EXCEPTION) {
                    handlers.add(edge.target()
                                     .id());
                } else {
                    normal++;
                }
            }
            // Blocks without a normal successor return, raise or fall off the end
            edges += normal == 0
                     ? 1
                     : normal;
        }
        edges += handlers.size();
        var nodes = reachable.size() + 1;
        return Math.max(1, edges - nodes + 2);
    }

    /// One plus the number of branching, looping, handler and boolean-operator nodes of the unit.
    public static int estimate(SyntaxTree tree, AnalysisUnit unit) {
        return 1 + (int) unit.nodes(tree)
                             .filter(node -> DECISIONS.contains(node.kind()))
                             .count();
    }
}
