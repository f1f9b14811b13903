package org.pyta.checkers;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;

import java.util.Optional;

/**
 * Scope-related queries shared by checkers.
 */
public final class Scopes {

    private Scopes() {}

    /**
     * Nearest enclosing function definition.
     */
    public static Optional<SyntaxNode> enclosingFunction(SyntaxTree tree, SyntaxNode node) {
        return tree.ancestors(node)
                   .filter(ancestor -> ancestor.kind()
                                               .isFunction())
                   .findFirst();
    }

    /**
     * Whether the node sits in the body of an {@code if __name__ == "__main__":} block.
     */
    public static boolean isInsideMainBlock(SyntaxTree tree, SyntaxNode node) {
        var current = node;
        var parent = tree.parent(current);
        while (parent.isPresent()) {
            var ancestor = parent.get();
            if (ancestor.is(NodeKind.IF) && current.field()
                                                   .equals("body") && isMainGuard(tree, ancestor)) {
                return true;
            }
            current = ancestor;
            parent = tree.parent(current);
        }
        return false;
    }

    /**
     * Whether an {@code if} statement tests {@code __name__ == "__main__"}.
     */
    public static boolean isMainGuard(SyntaxTree tree, SyntaxNode ifStatement) {
        return tree.child(ifStatement, "test")
                   .filter(test -> test.is(NodeKind.COMPARE) && test.hasAttribute("ops", "Eq"))
                   .filter(test -> tree.child(test, "left")
                                       .filter(left -> left.is(NodeKind.NAME) && left.hasAttribute("id", "__name__"))
                                       .isPresent())
                   .flatMap(test -> tree.child(test, "comparators"))
                   .filter(right -> right.is(NodeKind.CONSTANT) && right.hasAttribute("value", "__main__"))
                   .isPresent();
    }

    /**
     * Whether the node is an {@code elif}: the only statement of another {@code if}'s else clause.
     */
    public static boolean isElif(SyntaxTree tree, SyntaxNode node) {
        return node.is(NodeKind.IF) && node.field()
                                           .equals("orelse") && tree.parent(node)
                                                                    .filter(parent -> parent.is(NodeKind.IF))
                                                                    .map(parent -> tree.children(parent, "orelse")
                                                                                       .size() == 1)
                                                                    .orElse(false);
    }
}
