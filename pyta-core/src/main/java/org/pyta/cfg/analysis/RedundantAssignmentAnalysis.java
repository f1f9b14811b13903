package org.pyta.cfg.analysis;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.checkers.CheckContext;
import org.pyta.lint.Diagnostic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * E9959: An assignment whose value is overwritten on every path before it is read.
 *
 * Two backward analyses over the reachable blocks of a function: liveness (may-analysis,
 * union) and must-redefine (must-analysis, intersection). An assignment to a local name is
 * redundant when the name is dead right after it and reassigned on every path to the exit.
 *
 * Names declared {@code global} or {@code nonlocal}, names read by nested functions, lambdas
 * or classes, and {@code _} are never reported.
 */
public class RedundantAssignmentAnalysis implements GraphAnalysis {

    private static final String RULE_ID = "E9959";
    private static final String SYMBOL = "redundant-assignment";

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
        return "No assignments whose value is always overwritten before use";
    }

    @Override
    public Stream<Diagnostic> analyze(ControlFlowGraph graph, CheckContext ctx) {
        var unit = ctx.unit();
        if (!unit.isFunction()) {
            return Stream.empty();
        }
        var tree = ctx.tree();
        var reachable = Reachability.reachableBlocks(graph);
        var excluded = excludedNames(tree, unit.node());

        var universe = new HashSet<String>();
        for (var block : reachable) {
            for (var statement : block.statements()) {
                universe.addAll(Bindings.bindings(tree, statement)
                                        .defs());
            }
        }

        var liveness = BackwardDataflow.backwardDataflow(BackwardDataflow.Meet.UNION,
                                                         (statement, after) -> Bindings.bindings(tree, statement)
                                                                                       .liveBefore(after),
                                                         Set.of(),
                                                         universe)
                                       .solve(graph, reachable);
        var redefined = BackwardDataflow.backwardDataflow(BackwardDataflow.Meet.INTERSECTION,
                                                          (statement, after) -> {
                                                              var before = new HashSet<>(after);
                                                              before.addAll(Bindings.bindings(tree, statement)
                                                                                    .defs());
                                                              return before;
                                                          },
                                                          Set.of(),
                                                          universe)
                                        .solve(graph, reachable);

        var diagnostics = new ArrayList<Diagnostic>();
        for (var block : reachable) {
            var statements = block.statements();
            var liveAfter = liveness.afterEachStatement(block);
            var redefinedAfter = redefined.afterEachStatement(block);
            for (int i = 0; i < statements.size(); i++) {
                var statement = statements.get(i);
                for (var target : simpleTargets(tree, statement)) {
                    var name = target.identifier()
                                     .orElse("_");
                    if (name.equals("_") || excluded.contains(name)) {
                        continue;
                    }
                    if (!liveAfter.get(i)
                                  .contains(name) && redefinedAfter.get(i)
                                                                   .contains(name)) {
                        diagnostics.add(report(statement, name, ctx));
                    }
                }
            }
        }
        diagnostics.sort(Comparator.comparing(Diagnostic::span));
        return diagnostics.stream();
    }

    private static Diagnostic report(SyntaxNode statement, String name, CheckContext ctx) {
        return ctx.diagnostic(RULE_ID,
                              SYMBOL,
                              statement.span(),
                              "The value assigned to \"" + name + "\" here is never used: every path "
                              + "assigns \"" + name + "\" again before reading it.")
                  .withFix("Remove this assignment to \"" + name + "\"");
    }

    private static List<SyntaxNode> simpleTargets(SyntaxTree tree, SyntaxNode statement) {
        return switch (statement.kind()) {
            case ASSIGN -> tree.children(statement, "targets")
                               .stream()
                               .filter(target -> target.is(NodeKind.NAME))
                               .toList();
            case ANN_ASSIGN -> tree.child(statement, "value")
                                   .isPresent()
                               ? tree.children(statement, "target")
                                     .stream()
                                     .filter(target -> target.is(NodeKind.NAME))
                                     .toList()
                               : List.of();
            default -> List.of();
        };
    }

    // Names whose binding is visible outside the straight flow of this function
    private static Set<String> excludedNames(SyntaxTree tree, SyntaxNode function) {
        var excluded = new LinkedHashSet<String>();
        tree.descendants(function)
            .forEach(node -> {
                if (node.is(NodeKind.GLOBAL) || node.is(NodeKind.NONLOCAL)) {
                    node.attribute("names")
                        .ifPresent(names -> excluded.addAll(List.of(names.split(","))));
                } else if (node.is(NodeKind.NAME) && !node.hasAttribute("ctx", "Store") && insideNestedScope(tree,
                                                                                                             node,
                                                                                                             function)) {
                    node.identifier()
                        .ifPresent(excluded::add);
                }
            });
        return excluded;
    }

    private static boolean insideNestedScope(SyntaxTree tree, SyntaxNode node, SyntaxNode function) {
        return tree.ancestors(node)
                   .takeWhile(ancestor -> ancestor.index() != function.index())
                   .anyMatch(ancestor -> ancestor.kind()
                                                 .isScope());
    }
}
