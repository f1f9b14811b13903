package org.pyta.cfg.analysis;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxTree;
import org.pyta.lint.AnalysisContext;
import org.pyta.lint.Diagnostic;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pyta.ast.PySyntax.*;
import static org.pyta.engine.PythonAnalyzer.pythonAnalyzer;

class OneIterationAnalysisTest {

    @Test
    void analyze_reportsLoop_whenBodyAlwaysReturns() {
        var tree = tree(module(def("first", forLoop("x", name("xs"), ret(name("x")))).params("xs")));

        var diagnostics = analyze(tree);

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertThat(d.ruleId()).isEqualTo("E9996");
                                   assertThat(d.symbol()).isEqualTo("one-iteration");
                                   assertThat(d.span()).isEqualTo(find(tree, NodeKind.FOR).span());
                               });
    }

    @Test
    void analyze_reportsEndlessLoop_whenBodyAlwaysBreaks() {
        var tree = tree(module(def("f", whileLoop(bool(true), expr(call("step")), brk()))));

        assertThat(analyze(tree)).hasSize(1);
    }

    @Test
    void analyze_reportsNothing_whenBodyCanLoopBack() {
        var tree = tree(module(def("f",
                                   whileLoop(name("c"), ifStmt(name("d"), brk()), assign("x", num(1))))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsNothing_whenContinueLoopsBack() {
        var tree = tree(module(def("f",
                                   forLoop("x", name("xs"), ifStmt(name("x"), cont()), ret(name("x"))))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsNothing_whenBodyIsNeverEntered() {
        var tree = tree(module(def("f", forLoop("x", list(), ret(name("x"))))));

        assertThat(analyze(tree)).isEmpty();
    }

    private static List<Diagnostic> analyze(SyntaxTree tree) {
        return pythonAnalyzer(AnalysisContext.defaultContext(), List.of(), List.of(new OneIterationAnalysis()))
                  .analyze(tree)
                  .diagnostics()
                  .toList();
    }
}
