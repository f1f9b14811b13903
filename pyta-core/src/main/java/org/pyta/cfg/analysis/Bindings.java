package org.pyta.cfg.analysis;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Local names a block statement reads and binds.
 *
 * For compound statements only the part evaluated in the block itself counts: the test of an
 * {@code if} or {@code while}, the iterable and target of a {@code for}, the items of a
 * {@code with} and the type and name of an {@code except} clause. Statements the graph keeps
 * opaque read every name they mention and bind nothing.
 *
 * @param uses  names read, in source order
 * @param defs  names certainly bound
 */
public record Bindings(Set<String> uses, Set<String> defs) {
    public Bindings {
        uses = Set.copyOf(uses);
        defs = Set.copyOf(defs);
    }

    public static Bindings bindings(SyntaxTree tree, SyntaxNode statement) {
        return switch (statement.kind()) {
            case IF, WHILE -> of(tree, tree.children(statement, "test"));
            case FOR, ASYNC_FOR -> new Bindings(loads(tree, tree.children(statement, "iter")),
                                                stores(tree, tree.children(statement, "target")));
            case WITH, ASYNC_WITH -> of(tree, tree.children(statement, "items"));
            case EXCEPT_HANDLER -> new Bindings(loads(tree, tree.children(statement, "type")),
                                                statement.attribute("name")
                                                         .map(Set::of)
                                                         .orElse(Set.of()));
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF -> new Bindings(loads(tree, List.of(statement)),
                                                                             statement.attribute("name")
                                                                                      .map(Set::of)
                                                                                      .orElse(Set.of()));
            case ANN_ASSIGN -> tree.child(statement, "value")
                                   .isPresent()
                               ? of(tree, List.of(statement))
                               : new Bindings(loads(tree, List.of(statement)), Set.of());
            case AUG_ASSIGN -> augmented(tree, statement);
            case MATCH, TRY_STAR, TRY -> new Bindings(loads(tree, List.of(statement)), Set.of());
            default -> of(tree, List.of(statement));
        };
    }

    /// Apply to the facts after the statement for liveness: {@code (after - defs) + uses}.
    public Set<String> liveBefore(Set<String> liveAfter) {
        var result = new LinkedHashSet<>(liveAfter);
        result.removeAll(defs);
        result.addAll(uses);
        return result;
    }

    // x += 1 reads x before binding it
    private static Bindings augmented(SyntaxTree tree, SyntaxNode statement) {
        var target = tree.children(statement, "target");
        var uses = new LinkedHashSet<>(loads(tree, List.of(statement)));
        uses.addAll(stores(tree, target));
        return new Bindings(uses, stores(tree, target));
    }

    private static Bindings of(SyntaxTree tree, List<SyntaxNode> parts) {
        return new Bindings(loads(tree, parts), stores(tree, parts));
    }

    private static Set<String> loads(SyntaxTree tree, List<SyntaxNode> parts) {
        return names(tree, parts, "Load", "Del");
    }

    private static Set<String> stores(SyntaxTree tree, List<SyntaxNode> parts) {
        return names(tree, parts, "Store");
    }

    private static Set<String> names(SyntaxTree tree, List<SyntaxNode> parts, String... contexts) {
        var names = new LinkedHashSet<String>();
        parts.stream()
             .flatMap(tree::subtree)
             .filter(node -> node.is(NodeKind.NAME))
             .filter(node -> Stream.of(contexts)
                                   .anyMatch(context -> node.hasAttribute("ctx", context)))
             .filter(node -> !node.hasAttribute("ctx", "Store") || !insideNestedScope(tree, node, parts))
             .forEach(node -> node.identifier()
                                  .ifPresent(names::add));
        return names;
    }

    // Comprehension and lambda variables do not bind names of the enclosing function
    private static boolean insideNestedScope(SyntaxTree tree, SyntaxNode node, List<SyntaxNode> parts) {
        return tree.ancestors(node)
                   .takeWhile(ancestor -> parts.stream()
                                               .noneMatch(part -> part.index() == ancestor.index()))
                   .anyMatch(ancestor -> ancestor.is(NodeKind.LAMBDA)
                                         || ancestor.is(NodeKind.COMPREHENSION)
                                         || ancestor.is(NodeKind.LIST_COMP)
                                         || ancestor.is(NodeKind.SET_COMP)
                                         || ancestor.is(NodeKind.DICT_COMP)
                                         || ancestor.is(NodeKind.GENERATOR_EXP));
    }
}
