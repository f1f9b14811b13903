package org.pyta.cfg.analysis;

import org.pyta.cfg.BasicBlock;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.cfg.Edge;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Forward reachability from the entry block.
 *
 * Pure function of the graph: repeated calls return equal sets.
 */
public final class Reachability {

    private Reachability() {}

    /// Blocks reachable from the entry over any edge, in visiting order.
    public static Set<BasicBlock> reachableBlocks(ControlFlowGraph graph) {
        return reachableBlocks(graph, edge -> true);
    }

    /// Blocks reachable from the entry over the edges accepted by {@code follow}.
    public static Set<BasicBlock> reachableBlocks(ControlFlowGraph graph, Predicate<Edge> follow) {
        var visited = new LinkedHashSet<BasicBlock>();
        var worklist = new ArrayDeque<BasicBlock>();
        visited.add(graph.entry());
        worklist.add(graph.entry());

        while (!worklist.isEmpty()) {
            var block = worklist.poll();
            for (var edge : block.successors()) {
                if (follow.test(edge) && visited.add(edge.target())) {
                    worklist.add(edge.target());
                }
            }
        }
        return Collections.unmodifiableSet(visited);
    }
}
