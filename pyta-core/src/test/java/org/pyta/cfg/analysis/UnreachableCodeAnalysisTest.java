package org.pyta.cfg.analysis;

import org.pyta.ast.SyntaxTree;
import org.pyta.lint.AnalysisContext;
import org.pyta.lint.Diagnostic;
import org.pyta.lint.DiagnosticSeverity;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pyta.ast.PySyntax.*;
import static org.pyta.engine.PythonAnalyzer.pythonAnalyzer;

class UnreachableCodeAnalysisTest {

    @Test
    void analyze_reportsStatementAfterReturn_withItsSpan() {
        var tree = tree(module(def("f", ret(num(1)), assign("x", num(2)))));

        var diagnostics = analyze(tree);

        assertThat(diagnostics).hasSize(1);
        var diagnostic = diagnostics.get(0);
        assertThat(diagnostic.ruleId()).isEqualTo("W0101");
        assertThat(diagnostic.symbol()).isEqualTo("unreachable");
        assertThat(diagnostic.severity()).isEqualTo(DiagnosticSeverity.WARNING);
        assertThat(diagnostic.span()).isEqualTo(statementAt(tree, 3).span());
        assertThat(diagnostic.message()).contains("\"return\" statement on line 2");
    }

    @Test
    void analyze_reportsStatementAfterRaise() {
        var tree = tree(module(def("f", raise(call("ValueError")), expr(call("cleanup")))));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(3);
    }

    @Test
    void analyze_reportsStatementAfterBreakAndContinue() {
        var tree = tree(module(def("f",
                                   forLoop("x", name("xs"), brk(), assign("a", num(1))),
                                   whileLoop(name("c"), cont(), assign("b", num(2))))));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(4, 7);
    }

    @Test
    void analyze_reportsNothing_whenConditionalReturnIsFollowedByReturn() {
        var tree = tree(module(def("f",
                                   ifStmt(name("cond"), ret(num(1))),
                                   ret(num(2))).params("cond")));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsFollowingStatement_whenBothBranchesReturn() {
        var tree = tree(module(def("f",
                                   ifStmt(name("c"), ret(num(1))).orElse(ret(num(2))),
                                   assign("x", num(3)))));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(5);
    }

    @Test
    void analyze_reportsBodyOfAlwaysFalseCondition() {
        var tree = tree(module(def("f",
                                   ifStmt(bool(false), assign("x", num(1))),
                                   ret(num(0)))));

        var diagnostics = analyze(tree);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0)
                              .span()).isEqualTo(statementAt(tree, 3).span());
        assertThat(diagnostics.get(0)
                              .message()).contains("False");
    }

    @Test
    void analyze_reportsElseBranchOfAlwaysTrueCondition() {
        var tree = tree(module(def("f",
                                   ifStmt(bool(true), ret(num(1))).orElse(ret(num(2))))));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(4);
    }

    @Test
    void analyze_reportsElseClauseOfEndlessLoop() {
        var tree = tree(module(def("f",
                                   whileLoop(bool(true), ifStmt(name("done"), brk())).orElse(assign("x", num(1))),
                                   ret())));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(5);
    }

    @Test
    void analyze_reportsCodeAfterTryFinally_whenBodyReturns() {
        var tree = tree(module(def("f",
                                   tryStmt(ret(num(1))).finallyBody(expr(call("close"))),
                                   assign("y", num(3)))));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(5);
    }

    @Test
    void analyze_reportsModuleLevelCode() {
        var tree = tree(module(raise(call("SystemExit")), expr(call("print", str("never")))));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(2);
    }

    @Test
    void analyze_ordersFindingsBySpan() {
        var tree = tree(module(def("f",
                                   ifStmt(name("c"), ret(num(1)), pass()),
                                   ret(num(2)),
                                   pass())));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(4, 6);
    }

    private static List<Diagnostic> analyze(SyntaxTree tree) {
        return pythonAnalyzer(AnalysisContext.defaultContext(), List.of(), List.of(new UnreachableCodeAnalysis()))
                  .analyze(tree)
                  .diagnostics()
                  .toList();
    }
}
