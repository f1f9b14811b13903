package org.pyta.checkers.rules;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.checkers.CheckContext;
import org.pyta.checkers.NodeChecker;
import org.pyta.checkers.Scopes;
import org.pyta.lint.Diagnostic;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * R1702: Compound statements must not nest deeper than the configured limit.
 *
 * Nesting counts {@code if}, loops, {@code try} and {@code with} blocks inside one unit; an
 * {@code elif} stays at the depth of its {@code if}. The rule fires once per unit, at the
 * first block past the limit.
 */
public class NestedBlocksChecker implements NodeChecker {

    private static final String RULE_ID = "R1702";
    private static final String SYMBOL = "too-many-nested-blocks";
    private static final Set<NodeKind> BLOCKS = EnumSet.of(NodeKind.IF,
                                                           NodeKind.FOR,
                                                           NodeKind.ASYNC_FOR,
                                                           NodeKind.WHILE,
                                                           NodeKind.TRY,
                                                           NodeKind.TRY_STAR,
                                                           NodeKind.WITH,
                                                           NodeKind.ASYNC_WITH);

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
        return "Limit the nesting depth of compound statements";
    }

    @Override
    public Set<NodeKind> kinds() {
        return EnumSet.of(NodeKind.MODULE, NodeKind.FUNCTION_DEF, NodeKind.ASYNC_FUNCTION_DEF);
    }

    @Override
    public Stream<Diagnostic> check(SyntaxNode unitNode, CheckContext ctx) {
        var tree = ctx.tree();
        var limit = ctx.analysis()
                       .config()
                       .maxNestedBlocks();

        return ctx.unit()
                  .nodes(tree)
                  .filter(node -> BLOCKS.contains(node.kind()))
                  .filter(node -> depth(tree, node, unitNode) > limit)
                  .findFirst()
                  .map(node -> ctx.diagnostic(RULE_ID,
                                              SYMBOL,
                                              node.span(),
                                              "This block is nested " + depth(tree, node, unitNode)
                                              + " levels deep, more than the limit of " + limit
                                              + ". Deeply nested code is hard to follow; move the inner part into a "
                                              + "helper function or return early.")
                                  .withFix("Extract the innermost blocks into a separate function"))
                  .stream();
    }

    static int depth(SyntaxTree tree, SyntaxNode node, SyntaxNode unitNode) {
        var depth = countsAsLevel(tree, node) ? 1 : 0;
        var current = tree.parent(node);
        while (current.isPresent() && current.get()
                                             .index() != unitNode.index()) {
            if (countsAsLevel(tree, current.get())) {
                depth++;
            }
            current = tree.parent(current.get());
        }
        return depth;
    }

    private static boolean countsAsLevel(SyntaxTree tree, SyntaxNode node) {
        return BLOCKS.contains(node.kind()) && !Scopes.isElif(tree, node);
    }
}
