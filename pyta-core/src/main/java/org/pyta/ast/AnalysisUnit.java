package org.pyta.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.stream.Stream;

/**
 * A module body or a single function body, analyzed independently of every other unit.
 *
 * @param node          {@code Module}, {@code FunctionDef} or {@code AsyncFunctionDef} node
 * @param qualifiedName Python-style qualified name ({@code <module>}, {@code Shape.area}, {@code outer.<locals>.inner})
 */
public record AnalysisUnit(SyntaxNode node, String qualifiedName) {
    public static final String MODULE_NAME = "<module>";

    public static AnalysisUnit analysisUnit(SyntaxNode node, String qualifiedName) {
        return new AnalysisUnit(node, qualifiedName);
    }

    public boolean isModule() {
        return node.is(NodeKind.MODULE);
    }

    public boolean isFunction() {
        return node.kind()
                   .isFunction();
    }

    public SourceSpan span() {
        return node.span();
    }

    /**
     * Nodes that belong to this unit, pre-order: the unit node and its descendants, except the
     * bodies of nested functions, which are units of their own.
     */
    public Stream<SyntaxNode> nodes(SyntaxTree tree) {
        var result = new ArrayList<SyntaxNode>();
        var stack = new ArrayDeque<SyntaxNode>();
        stack.push(node);

        while (!stack.isEmpty()) {
            var current = stack.pop();
            if (current.index() != node.index() && current.kind()
                                                          .isFunction()) {
                continue;
            }
            result.add(current);
            var children = tree.children(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result.stream();
    }
}
