package org.pyta.cfg.analysis;

import org.pyta.cfg.BasicBlock;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.cfg.Edge;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Dominator sets of the blocks reachable from the entry.
 *
 * Block {@code a} dominates block {@code b} when every path from the entry to {@code b}
 * passes through {@code a}. Computed by iterating
 * {@code dom(b) = {b} ∪ ⋂ dom(p)} over the predecessors {@code p} until nothing changes.
 */
public final class Dominators {
    private final BasicBlock entry;
    private final Map<BasicBlock, Set<BasicBlock>> dominators;

    private Dominators(BasicBlock entry, Map<BasicBlock, Set<BasicBlock>> dominators) {
        this.entry = entry;
        this.dominators = dominators;
    }

    public static Dominators dominators(ControlFlowGraph graph) {
        return dominators(graph, edge -> true);
    }

    /// Dominators over the subgraph of edges accepted by {@code follow}.
    public static Dominators dominators(ControlFlowGraph graph, Predicate<Edge> follow) {
        var blocks = Reachability.reachableBlocks(graph, follow);
        var entry = graph.entry();
        var result = new HashMap<BasicBlock, Set<BasicBlock>>();
        for (var block : blocks) {
            result.put(block, block == entry
                              ? Set.of(entry)
                              : blocks);
        }

        var changed = true;
        while (changed) {
            changed = false;
            for (var block : blocks) {
                if (block == entry) {
                    continue;
                }
                var update = meetOfPredecessors(block, blocks, follow, result);
                update.add(block);
                if (!update.equals(result.get(block))) {
                    result.put(block, update);
                    changed = true;
                }
            }
        }

        var frozen = new HashMap<BasicBlock, Set<BasicBlock>>();
        result.forEach((block, set) -> frozen.put(block, Set.copyOf(set)));
        return new Dominators(entry, Map.copyOf(frozen));
    }

    private static Set<BasicBlock> meetOfPredecessors(BasicBlock block,
                                                      Set<BasicBlock> blocks,
                                                      Predicate<Edge> follow,
                                                      Map<BasicBlock, Set<BasicBlock>> current) {
        Set<BasicBlock> meet = null;
        for (var edge : block.predecessors()) {
            if (!follow.test(edge) || !blocks.contains(edge.source())) {
                continue;
            }
            if (meet == null) {
                meet = new LinkedHashSet<>(current.get(edge.source()));
            } else {
                meet.retainAll(current.get(edge.source()));
            }
        }
        return meet == null
               ? new LinkedHashSet<>()
               : meet;
    }

    /// All blocks dominating {@code block}, itself included; empty for unreachable blocks.
    public Set<BasicBlock> of(BasicBlock block) {
        return dominators.getOrDefault(block, Set.of());
    }

    public boolean dominates(BasicBlock dominator, BasicBlock block) {
        return of(block).contains(dominator);
    }

    /// Closest strict dominator; empty for the entry and for unreachable blocks.
    public Optional<BasicBlock> immediateDominator(BasicBlock block) {
        if (block == entry || !dominators.containsKey(block)) {
            return Optional.empty();
        }
        var strict = of(block).stream()
                              .filter(candidate -> candidate != block)
                              .toList();
        // The immediate dominator is the strict dominator dominated by all the others.
        return strict.stream()
                     .filter(candidate -> of(candidate).containsAll(strict))
                     .findFirst();
    }
}
