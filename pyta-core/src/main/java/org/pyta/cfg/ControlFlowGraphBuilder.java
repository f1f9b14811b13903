package org.pyta.cfg;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.checkers.ConstantFolding;
import org.pyta.lint.AnalysisError;
import org.pyta.lint.MalformedInputException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the control-flow graph of a module or function body.
 *
 * Statements are traversed in source order with a cursor on the current block:
 * <ul>
 *     <li>simple statements are appended to the current block;</li>
 *     <li>{@code if} closes the block and opens one block per branch plus a join block when a branch falls through;</li>
 *     <li>loops get a header block holding the loop statement, a body entered on the true branch, a loop-back edge
 *     to the header and a false-branch exit;</li>
 *     <li>{@code return}, {@code raise}, {@code break} and {@code continue} terminate their block;</li>
 *     <li>every block of a {@code try} body gets an exception edge to each handler; the block after an
 *     enclosing loop, even when a {@code break} in the body creates it, stays outside the protected region.</li>
 * </ul>
 * After a terminating statement the cursor is empty and the next statement opens a block
 * without predecessors, which the reachability analysis reports.
 *
 * The builder assumes syntactically valid input; it only rejects trees that miss children it
 * needs. Nested function and class definitions are opaque statements.
 */
public final class ControlFlowGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(ControlFlowGraphBuilder.class);

    private final SyntaxTree tree;
    private final ConstantFolding folding;

    private ControlFlowGraphBuilder(SyntaxTree tree, ConstantFolding folding) {
        this.tree = tree;
        this.folding = folding;
    }

    public static ControlFlowGraphBuilder controlFlowGraphBuilder(SyntaxTree tree) {
        return new ControlFlowGraphBuilder(tree, ConstantFolding.constantFolding(tree));
    }

    public static ControlFlowGraphBuilder controlFlowGraphBuilder(SyntaxTree tree, ConstantFolding folding) {
        return new ControlFlowGraphBuilder(tree, folding);
    }

    /**
     * Build the graph for a module or function.
     *
     * @param unit {@code Module}, {@code FunctionDef} or {@code AsyncFunctionDef} node
     * @return the graph
     * @throws MalformedInputException if the tree misses a child the graph depends on
     */
    public ControlFlowGraph build(SyntaxNode unit) {
        if (!unit.is(NodeKind.MODULE) && !unit.kind()
                                              .isFunction()) {
            throw malformed(unit, "cannot build a control-flow graph for " + unit.kind()
                                                                                .pythonName());
        }
        var construction = new Construction(unit);
        var graph = construction.run();
        log.debug("Built {} for {}", graph, unit);
        return graph;
    }

    private static MalformedInputException malformed(SyntaxNode node, String detail) {
        return new MalformedInputException(new AnalysisError.MalformedInput(node.span(), detail));
    }

    /// Mutable state of one build; discarded once the graph is returned.
    private final class Construction {
        private final SyntaxNode unit;
        private final List<BasicBlock> blocks = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Set<BasicBlock> exits = new LinkedHashSet<>();
        private final List<AnalysisError.UnsupportedConstruct> unsupported = new ArrayList<>();
        private final Deque<Loop> loops = new ArrayDeque<>();
        private BasicBlock cursor;

        private Construction(SyntaxNode unit) {
            this.unit = unit;
        }

        private ControlFlowGraph run() {
            var entry = newBlock();
            cursor = entry;
            // An empty file is a valid module; a function always has a body
            sequence(unit.is(NodeKind.MODULE)
                     ? tree.children(unit, "body")
                     : requiredBody(unit, "body"));

            if (cursor != null) {
                exits.add(cursor);
            }
            return new ControlFlowGraph(unit, entry, blocks, edges, exits, unsupported);
        }

        private void sequence(List<SyntaxNode> statements) {
            for (var statement : statements) {
                statement(statement);
            }
        }

        private void statement(SyntaxNode statement) {
            switch (statement.kind()) {
                case IF -> ifStatement(statement);
                case WHILE, FOR, ASYNC_FOR -> loop(statement);
                case TRY -> tryStatement(statement);
                case WITH, ASYNC_WITH -> {
                    simple(statement);
                    sequence(requiredBody(statement, "body"));
                }
                case RETURN -> {
                    simple(statement);
                    exits.add(cursor);
                    terminate();
                }
                case RAISE -> {
                    simple(statement);
                    terminate();
                }
                case BREAK -> {
                    simple(statement);
                    connect(cursor, innermostLoop(statement).after(), EdgeKind.UNCONDITIONAL);
                    terminate();
                }
                case CONTINUE -> {
                    simple(statement);
                    connect(cursor, innermostLoop(statement).header(), EdgeKind.LOOP_BACK);
                    terminate();
                }
                case MATCH, TRY_STAR -> {
                    simple(statement);
                    unsupported.add(new AnalysisError.UnsupportedConstruct(statement.span(), statement.kind()));
                }
                default -> {
                    if (!statement.kind()
                                  .isStatement()) {
                        throw malformed(statement, "expected a statement but found " + statement.kind()
                                                                                            .pythonName());
                    }
                    simple(statement);
                }
            }
        }

        private void simple(SyntaxNode statement) {
            ensureCursor().append(statement);
        }

        private void ifStatement(SyntaxNode node) {
            required(node, "test");
            var condition = ensureCursor();
            condition.append(node);

            var thenBlock = newBlock();
            connect(condition, thenBlock, EdgeKind.TRUE_BRANCH);
            cursor = thenBlock;
            sequence(requiredBody(node, "body"));
            var thenEnd = cursor;

            var orElse = tree.children(node, "orelse");
            BasicBlock elseEnd = null;
            if (!orElse.isEmpty()) {
                var elseBlock = newBlock();
                connect(condition, elseBlock, EdgeKind.FALSE_BRANCH);
                cursor = elseBlock;
                sequence(orElse);
                elseEnd = cursor;
            }

            if (thenEnd == null && elseEnd == null && !orElse.isEmpty()) {
                cursor = null;
                return;
            }
            var join = newBlock();
            if (thenEnd != null) {
                connect(thenEnd, join, EdgeKind.UNCONDITIONAL);
            }
            if (elseEnd != null) {
                connect(elseEnd, join, EdgeKind.UNCONDITIONAL);
            }
            if (orElse.isEmpty()) {
                connect(condition, join, EdgeKind.FALSE_BRANCH);
            }
            cursor = join;
        }

        private void loop(SyntaxNode node) {
            var infinite = false;
            if (node.is(NodeKind.WHILE)) {
                infinite = folding.truthiness(required(node, "test"))
                                  .orElse(false);
            } else {
                required(node, "target");
                required(node, "iter");
            }

            var before = ensureCursor();
            var header = newBlock();
            connect(before, header, EdgeKind.UNCONDITIONAL);
            header.append(node);

            var loop = new Loop(header);
            var body = newBlock();
            connect(header, body, EdgeKind.TRUE_BRANCH);
            cursor = body;
            loops.push(loop);
            sequence(requiredBody(node, "body"));
            loops.pop();
            if (cursor != null) {
                connect(cursor, header, EdgeKind.LOOP_BACK);
            }

            var orElse = tree.children(node, "orelse");
            if (infinite) {
                // The else clause of an endless loop never runs; build it without predecessors
                cursor = null;
                if (!orElse.isEmpty()) {
                    sequence(orElse);
                    if (cursor != null && loop.hasAfter()) {
                        connect(cursor, loop.after(), EdgeKind.UNCONDITIONAL);
                    }
                }
            } else if (orElse.isEmpty()) {
                connect(header, loop.after(), EdgeKind.FALSE_BRANCH);
            } else {
                var elseBlock = newBlock();
                connect(header, elseBlock, EdgeKind.FALSE_BRANCH);
                cursor = elseBlock;
                sequence(orElse);
                if (cursor != null) {
                    connect(cursor, loop.after(), EdgeKind.UNCONDITIONAL);
                }
            }
            cursor = loop.hasAfter()
                     ? loop.after()
                     : null;
        }

        private void tryStatement(SyntaxNode node) {
            var before = ensureCursor();
            var bodyStart = newBlock();
            connect(before, bodyStart, EdgeKind.UNCONDITIONAL);
            var protectedFrom = bodyStart.id();
            var enclosingLoops = List.copyOf(loops);

            cursor = bodyStart;
            sequence(requiredBody(node, "body"));
            var bodyEnd = cursor;
            var protectedTo = blocks.size();

            var ends = new ArrayList<BasicBlock>();
            for (var handler : tree.children(node, "handlers")) {
                var handlerBlock = newBlock();
                for (var block : region(protectedFrom, protectedTo, enclosingLoops)) {
                    connect(block, handlerBlock, EdgeKind.EXCEPTION);
                }
                handlerBlock.append(handler);
                cursor = handlerBlock;
                sequence(requiredBody(handler, "body"));
                if (cursor != null) {
                    ends.add(cursor);
                }
            }

            var orElse = tree.children(node, "orelse");
            if (orElse.isEmpty()) {
                if (bodyEnd != null) {
                    ends.add(0, bodyEnd);
                }
            } else {
                if (bodyEnd != null) {
                    var elseBlock = newBlock();
                    connect(bodyEnd, elseBlock, EdgeKind.UNCONDITIONAL);
                    cursor = elseBlock;
                } else {
                    cursor = null;
                }
                sequence(orElse);
                if (cursor != null) {
                    ends.add(0, cursor);
                }
            }

            var finalBody = tree.children(node, "finalbody");
            if (finalBody.isEmpty()) {
                join(ends);
                return;
            }

            var finallyBlock = newBlock();
            for (var block : region(protectedFrom, finallyBlock.id(), enclosingLoops)) {
                connect(block, finallyBlock, EdgeKind.EXCEPTION);
            }
            for (var end : ends) {
                connect(end, finallyBlock, EdgeKind.UNCONDITIONAL);
            }
            cursor = finallyBlock;
            sequence(finalBody);

            if (cursor != null && !ends.isEmpty()) {
                // Only normal completion of the try statement continues past the finally clause
                var after = newBlock();
                connect(cursor, after, EdgeKind.UNCONDITIONAL);
                cursor = after;
            } else {
                cursor = null;
            }
        }

        /// Blocks created while building a try statement, minus the exits of loops enclosing it.
        private List<BasicBlock> region(int from, int to, List<Loop> enclosingLoops) {
            return blocks.subList(from, to)
                         .stream()
                         .filter(block -> enclosingLoops.stream()
                                                        .noneMatch(loop -> loop.isAfter(block)))
                         .toList();
        }

        private void join(List<BasicBlock> ends) {
            if (ends.isEmpty()) {
                cursor = null;
                return;
            }
            var join = newBlock();
            for (var end : ends) {
                connect(end, join, EdgeKind.UNCONDITIONAL);
            }
            cursor = join;
        }

        private Loop innermostLoop(SyntaxNode statement) {
            var loop = loops.peek();
            if (loop == null) {
                throw malformed(statement, "'" + statement.kind()
                                                          .pythonName()
                                                          .toLowerCase() + "' outside of a loop");
            }
            return loop;
        }

        private BasicBlock ensureCursor() {
            if (cursor == null) {
                cursor = newBlock();
            }
            return cursor;
        }

        private void terminate() {
            cursor.markTerminal();
            cursor = null;
        }

        private BasicBlock newBlock() {
            var block = new BasicBlock(blocks.size());
            blocks.add(block);
            return block;
        }

        private void connect(BasicBlock source, BasicBlock target, EdgeKind kind) {
            var edge = new Edge(source, target, kind);
            source.addSuccessor(edge);
            target.addPredecessor(edge);
            edges.add(edge);
        }

        private SyntaxNode required(SyntaxNode node, String field) {
            return tree.child(node, field)
                       .orElseThrow(() -> malformed(node,
                                                    node.kind()
                                                        .pythonName() + " node has no '" + field + "'"));
        }

        private List<SyntaxNode> requiredBody(SyntaxNode node, String field) {
            var body = tree.children(node, field);
            if (body.isEmpty()) {
                throw malformed(node,
                                node.kind()
                                    .pythonName() + " node has an empty '" + field + "'");
            }
            return body;
        }

        /// Loop being built; the block after the loop is created on first use.
        private final class Loop {
            private final BasicBlock header;
            private BasicBlock after;

            private Loop(BasicBlock header) {
                this.header = header;
            }

            private BasicBlock header() {
                return header;
            }

            private BasicBlock after() {
                if (after == null) {
                    after = newBlock();
                }
                return after;
            }

            private boolean hasAfter() {
                return after != null;
            }

            private boolean isAfter(BasicBlock block) {
                return after == block;
            }
        }
    }
}
