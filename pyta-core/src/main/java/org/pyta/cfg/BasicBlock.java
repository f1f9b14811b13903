package org.pyta.cfg;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Straight-line sequence of statements with a single entry and a single exit.
 *
 * Blocks are created and linked by {@link ControlFlowGraphBuilder}; once the graph is built
 * they are only read. Identity equality is intended: two blocks are never interchangeable.
 */
public final class BasicBlock {
    private final int id;
    private final List<SyntaxNode> statements = new ArrayList<>();
    private final List<Edge> successors = new ArrayList<>();
    private final List<Edge> predecessors = new ArrayList<>();
    private boolean terminal;

    BasicBlock(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public List<SyntaxNode> statements() {
        return Collections.unmodifiableList(statements);
    }

    public List<Edge> successors() {
        return Collections.unmodifiableList(successors);
    }

    public List<Edge> predecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    /// Whether the block ends in {@code return}, {@code raise}, {@code break} or {@code continue}.
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public Optional<SyntaxNode> firstStatement() {
        return statements.isEmpty()
               ? Optional.empty()
               : Optional.of(statements.get(0));
    }

    public Optional<SyntaxNode> lastStatement() {
        return statements.isEmpty()
               ? Optional.empty()
               : Optional.of(statements.get(statements.size() - 1));
    }

    /// Whether the last statement is of the given kind.
    public boolean endsWith(NodeKind kind) {
        return lastStatement().filter(statement -> statement.is(kind))
                              .isPresent();
    }

    void append(SyntaxNode statement) {
        statements.add(statement);
    }

    void markTerminal() {
        terminal = true;
    }

    void addSuccessor(Edge edge) {
        successors.add(edge);
    }

    void addPredecessor(Edge edge) {
        predecessors.add(edge);
    }

    @Override
    public String toString() {
        return "B" + id;
    }
}
