package org.pyta.cfg.analysis;

import org.pyta.ast.SyntaxNode;
import org.pyta.cfg.BasicBlock;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.cfg.EdgeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Worklist solver for backward dataflow problems over sets of names.
 *
 * Facts flow from the exit of each block to its entry through the per-statement
 * {@link Transfer}; the facts leaving a block are the {@link Meet} of its successors' entry
 * facts. Blocks without successors start from the boundary fact.
 *
 * An exception may leave a block before any of its statements runs, so the facts after every
 * statement of such a block are also met with the entry facts of its exception handlers.
 */
public final class BackwardDataflow {

    /// How facts of several successors combine.
    public enum Meet {
        /// May-analysis: a fact holds if it holds on some path.
        UNION,
        /// Must-analysis: a fact holds if it holds on every path.
        INTERSECTION
    }

    /// Effect of one statement: facts before the statement given the facts after it.
    @FunctionalInterface
    public interface Transfer {
        Set<String> apply(SyntaxNode statement, Set<String> after);
    }

    private final Meet meet;
    private final Transfer transfer;
    private final Set<String> boundary;
    private final Set<String> universe;

    private BackwardDataflow(Meet meet, Transfer transfer, Set<String> boundary, Set<String> universe) {
        this.meet = meet;
        this.transfer = transfer;
        this.boundary = Set.copyOf(boundary);
        this.universe = Set.copyOf(universe);
    }

    /**
     * @param meet     how successor facts combine
     * @param transfer per-statement effect
     * @param boundary facts at the end of blocks without successors
     * @param universe every possible fact; the initial value for {@link Meet#INTERSECTION}
     */
    public static BackwardDataflow backwardDataflow(Meet meet,
                                                    Transfer transfer,
                                                    Set<String> boundary,
                                                    Set<String> universe) {
        return new BackwardDataflow(meet, transfer, boundary, universe);
    }

    /// Solve over the given blocks; edges to blocks outside the set are ignored.
    public Solution solve(ControlFlowGraph graph, Set<BasicBlock> blocks) {
        var in = new HashMap<BasicBlock, Set<String>>();
        var initial = meet == Meet.UNION
                      ? Set.<String>of()
                      : universe;
        for (var block : blocks) {
            in.put(block, initial);
        }

        var worklist = new ArrayDeque<BasicBlock>();
        var queued = new HashSet<BasicBlock>();
        // Reverse creation order reaches a fixpoint faster for backward problems
        var ordered = graph.blocks();
        for (int i = ordered.size() - 1; i >= 0; i--) {
            var block = ordered.get(i);
            if (blocks.contains(block)) {
                worklist.add(block);
                queued.add(block);
            }
        }

        while (!worklist.isEmpty()) {
            var block = worklist.poll();
            queued.remove(block);
            var facts = out(block, blocks, in);
            var statements = block.statements();
            for (int i = statements.size() - 1; i >= 0; i--) {
                facts = transfer.apply(statements.get(i), facts);
            }
            facts = withHandlers(facts, handlerFacts(block, blocks, in));
            if (!facts.equals(in.get(block))) {
                in.put(block, Set.copyOf(facts));
                for (var edge : block.predecessors()) {
                    var source = edge.source();
                    if (blocks.contains(source) && queued.add(source)) {
                        worklist.add(source);
                    }
                }
            }
        }
        return new Solution(blocks, Map.copyOf(in));
    }

    private Set<String> out(BasicBlock block, Set<BasicBlock> blocks, Map<BasicBlock, Set<String>> in) {
        var successors = block.successors()
                              .stream()
                              .filter(edge -> blocks.contains(edge.target()))
                              .map(edge -> in.get(edge.target()))
                              .toList();
        return successors.isEmpty()
               ? boundary
               : combine(successors);
    }

    private Set<String> combine(List<Set<String>> facts) {
        var result = new HashSet<>(facts.get(0));
        for (int i = 1; i < facts.size(); i++) {
            if (meet == Meet.UNION) {
                result.addAll(facts.get(i));
            } else {
                result.retainAll(facts.get(i));
            }
        }
        return result;
    }

    private List<Set<String>> handlerFacts(BasicBlock block,
                                           Set<BasicBlock> blocks,
                                           Map<BasicBlock, Set<String>> in) {
        return block.successors()
                    .stream()
                    .filter(edge -> edge.kind() == EdgeKind.EXCEPTION && blocks.contains(edge.target()))
                    .map(edge -> in.get(edge.target()))
                    .toList();
    }

    private Set<String> withHandlers(Set<String> facts, List<Set<String>> handlers) {
        if (handlers.isEmpty()) {
            return Set.copyOf(facts);
        }
        var all = new ArrayList<Set<String>>();
        all.add(facts);
        all.addAll(handlers);
        return Set.copyOf(combine(all));
    }

    /// Fixpoint of one dataflow problem.
    public final class Solution {
        private final Set<BasicBlock> blocks;
        private final Map<BasicBlock, Set<String>> in;

        private Solution(Set<BasicBlock> blocks, Map<BasicBlock, Set<String>> in) {
            this.blocks = blocks;
            this.in = in;
        }

        /// Facts at the entry of a block.
        public Set<String> in(BasicBlock block) {
            return in.getOrDefault(block, Set.of());
        }

        /// Facts at the exit of a block.
        public Set<String> out(BasicBlock block) {
            return BackwardDataflow.this.out(block, blocks, in);
        }

        /// Facts right after each statement of a block, in statement order.
        public List<Set<String>> afterEachStatement(BasicBlock block) {
            var statements = block.statements();
            var handlers = handlerFacts(block, blocks, in);
            var result = new ArrayList<Set<String>>();
            var facts = out(block);
            for (int i = statements.size() - 1; i >= 0; i--) {
                result.add(withHandlers(facts, handlers));
                facts = transfer.apply(statements.get(i), facts);
            }
            Collections.reverse(result);
            return List.copyOf(result);
        }
    }
}
