package org.pyta.engine;

import org.pyta.ast.AnalysisUnit;
import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a file into analysis units: the module body followed by every function and method,
 * at any depth, in source order.
 */
public final class UnitCollector {

    private UnitCollector() {}

    public static List<AnalysisUnit> units(SyntaxTree tree) {
        var units = new ArrayList<AnalysisUnit>();
        var root = tree.root();
        units.add(AnalysisUnit.analysisUnit(root,
                                            AnalysisUnit.MODULE_NAME));
        tree.descendants(root)
            .filter(node -> node.kind()
                                .isFunction())
            .forEach(function -> units.add(AnalysisUnit.analysisUnit(function, qualifiedName(tree, function))));
        return List.copyOf(units);
    }

    /// {@code f}, {@code Shape.area}, {@code outer.<locals>.inner}.
    static String qualifiedName(SyntaxTree tree, SyntaxNode definition) {
        var parts = new ArrayList<String>();
        parts.add(name(definition));
        tree.ancestors(definition)
            .forEach(ancestor -> {
                if (ancestor.kind()
                            .isFunction()) {
                    parts.add(0, "<locals>");
                    parts.add(0, name(ancestor));
                } else if (ancestor.is(NodeKind.CLASS_DEF)) {
                    parts.add(0, name(ancestor));
                } else if (ancestor.is(NodeKind.LAMBDA)) {
                    parts.add(0, "<locals>");
                    parts.add(0, "<lambda>");
                }
            });
        return String.join(".", parts);
    }

    private static String name(SyntaxNode definition) {
        return definition.identifier()
                         .orElse("<anonymous>");
    }
}
