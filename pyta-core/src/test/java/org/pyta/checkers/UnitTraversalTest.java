package org.pyta.checkers;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.ast.SyntaxTree;
import org.pyta.checkers.rules.BareExceptChecker;
import org.pyta.engine.UnitCollector;
import org.pyta.lint.AnalysisContext;
import org.pyta.lint.Diagnostic;
import org.pyta.lint.DiagnosticSeverity;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pyta.ast.PySyntax.*;
import static org.pyta.checkers.CheckerRegistry.checkerRegistry;
import static org.pyta.checkers.UnitTraversal.unitTraversal;

class UnitTraversalTest {

    @Test
    void traverse_visitsEachNodeOfTheUnitOnce() {
        var visits = new AtomicInteger();
        var counter = new RecordingChecker("X0001", Set.of(NodeKind.NAME), node -> {
            visits.incrementAndGet();
            return Stream.empty();
        });
        var tree = tree(module(assign("a", name("b")), def("f", ret(name("c")))));

        traverseModule(tree, counter);

        // the name inside f belongs to the unit of f
        assertThat(visits).hasValue(2);
    }

    @Test
    void traverse_isolatesFailingChecker_andKeepsOthersRunning() {
        var failing = new RecordingChecker("X0002", Set.of(NodeKind.EXCEPT_HANDLER), node -> {
            throw new IllegalStateException("boom");
        });
        var tree = tree(module(tryStmt(pass()).handler(bareExcept(pass())),
                               tryStmt(pass()).handler(bareExcept(pass()))));

        var diagnostics = traverseModule(tree, failing, new BareExceptChecker());

        assertThat(diagnostics).filteredOn(d -> d.ruleId()
                                                 .equals("X0002"))
                               .singleElement()
                               .satisfies(d -> {
                                   assertThat(d.symbol()).isEqualTo(Diagnostic.ANALYSIS_INCOMPLETE);
                                   assertThat(d.severity()).isEqualTo(DiagnosticSeverity.INFO);
                                   assertThat(d.message()).contains("IllegalStateException");
                               });
        assertThat(diagnostics).filteredOn(d -> d.ruleId()
                                                 .equals("W0702"))
                               .hasSize(2);
    }

    private static List<Diagnostic> traverseModule(SyntaxTree tree, NodeChecker... checkers) {
        var unit = UnitCollector.units(tree)
                                .get(0);
        var ctx = CheckContext.checkContext(tree, unit, Optional.empty(), AnalysisContext.defaultContext());
        return unitTraversal(checkerRegistry(List.of(checkers))).traverse(ctx);
    }

    private record RecordingChecker(String ruleId,
                                    Set<NodeKind> kinds,
                                    Function<SyntaxNode, Stream<Diagnostic>> action) implements NodeChecker {
        @Override
        public String symbol() {
            return "recording";
        }

        @Override
        public String description() {
            return "Test checker";
        }

        @Override
        public Stream<Diagnostic> check(SyntaxNode node, CheckContext ctx) {
            return action.apply(node);
        }
    }
}
