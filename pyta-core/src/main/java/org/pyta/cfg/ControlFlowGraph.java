package org.pyta.cfg;

import org.pyta.ast.SyntaxNode;
import org.pyta.lint.AnalysisError;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Control-flow graph of one module or function body.
 *
 * Owns its blocks and edges; edges never point into another graph. The entry block has no
 * incoming edges. Exit blocks are the blocks ending in an explicit {@code return} plus the
 * block that falls off the end of the body, if any.
 */
public final class ControlFlowGraph {
    private final SyntaxNode unit;
    private final BasicBlock entry;
    private final List<BasicBlock> blocks;
    private final List<Edge> edges;
    private final Set<BasicBlock> exits;
    private final List<AnalysisError.UnsupportedConstruct> unsupported;
    private final Map<Integer, BasicBlock> blockByStatement;

    ControlFlowGraph(SyntaxNode unit,
                     BasicBlock entry,
                     List<BasicBlock> blocks,
                     List<Edge> edges,
                     Set<BasicBlock> exits,
                     List<AnalysisError.UnsupportedConstruct> unsupported) {
        this.unit = unit;
        this.entry = entry;
        this.blocks = List.copyOf(blocks);
        this.edges = List.copyOf(edges);
        this.exits = Collections.unmodifiableSet(new LinkedHashSet<>(exits));
        this.unsupported = List.copyOf(unsupported);

        var index = new HashMap<Integer, BasicBlock>();
        for (var block : blocks) {
            for (var statement : block.statements()) {
                index.put(statement.index(), block);
            }
        }
        this.blockByStatement = Map.copyOf(index);
    }

    /// The module or function node this graph was built for.
    public SyntaxNode unit() {
        return unit;
    }

    public BasicBlock entry() {
        return entry;
    }

    /// Blocks in creation order; block ids equal their position.
    public List<BasicBlock> blocks() {
        return blocks;
    }

    public List<Edge> edges() {
        return edges;
    }

    public Set<BasicBlock> exits() {
        return exits;
    }

    /// Constructs that were kept as opaque statements.
    public List<AnalysisError.UnsupportedConstruct> unsupported() {
        return unsupported;
    }

    /// Block holding the given statement.
    public Optional<BasicBlock> blockOf(SyntaxNode statement) {
        return Optional.ofNullable(blockByStatement.get(statement.index()));
    }

    @Override
    public String toString() {
        return "ControlFlowGraph{" + unit.kind()
                                         .pythonName() + ", blocks=" + blocks.size() + ", edges=" + edges.size()
               + ", exits=" + exits + "}";
    }
}
