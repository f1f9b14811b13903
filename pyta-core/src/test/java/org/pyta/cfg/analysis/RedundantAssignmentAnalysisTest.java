package org.pyta.cfg.analysis;

import org.pyta.ast.SyntaxTree;
import org.pyta.lint.AnalysisContext;
import org.pyta.lint.Diagnostic;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pyta.ast.PySyntax.*;
import static org.pyta.engine.PythonAnalyzer.pythonAnalyzer;

class RedundantAssignmentAnalysisTest {

    @Test
    void analyze_reportsAssignment_overwrittenInBothBranches() {
        var tree = tree(module(def("f",
                                   assign("x", num(0)),
                                   ifStmt(name("c"), assign("x", num(1))).orElse(assign("x", num(2))),
                                   ret(name("x")))));

        var diagnostics = analyze(tree);

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertThat(d.ruleId()).isEqualTo("E9959");
                                   assertThat(d.span()).isEqualTo(statementAt(tree, 2).span());
                                   assertThat(d.message()).contains("\"x\"");
                               });
    }

    @Test
    void analyze_reportsNothing_whenOneBranchKeepsValue() {
        var tree = tree(module(def("f",
                                   assign("x", num(0)),
                                   ifStmt(name("c"), assign("x", num(1))),
                                   ret(name("x")))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsStraightLineOverwrite() {
        var tree = tree(module(def("f",
                                   assign("total", num(1)),
                                   assign("total", num(2)),
                                   ret(name("total")))));

        assertThat(analyze(tree)).extracting(d -> d.span()
                                                   .startLine())
                                 .containsExactly(2);
    }

    @Test
    void analyze_reportsNothing_whenValueIsReadBeforeOverwrite() {
        var tree = tree(module(def("f",
                                   assign("x", num(1)),
                                   assign("x", binOp(name("x"), "Add", num(1))),
                                   ret(name("x")))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsNothing_forGlobalNames() {
        var tree = tree(module(def("f",
                                   global("counter"),
                                   assign("counter", num(1)),
                                   assign("counter", num(2)))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsNothing_forNamesReadByNestedFunction() {
        var tree = tree(module(def("outer",
                                   assign("x", num(1)),
                                   def("inner", ret(name("x"))),
                                   assign("x", num(2)),
                                   ret(name("inner")))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsNothing_whenHandlerReadsValue() {
        var tree = tree(module(def("f",
                                   assign("x", num(1)),
                                   tryStmt(assign("x", call("g"))).handler(except(name("ValueError"),
                                                                                  ret(name("x")))),
                                   ret(name("x")))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsNothing_whenLoopMayNotRun() {
        var tree = tree(module(def("f",
                                   assign("best", num(0)),
                                   forLoop("item", name("items"), assign("best", name("item"))),
                                   ret(name("best")))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_ignoresModuleLevelAndUnderscore() {
        var tree = tree(module(assign("X", num(1)),
                               assign("X", num(2)),
                               def("f", assign("_", num(1)), assign("_", num(2)), ret())));

        assertThat(analyze(tree)).isEmpty();
    }

    private static List<Diagnostic> analyze(SyntaxTree tree) {
        return pythonAnalyzer(AnalysisContext.defaultContext(), List.of(), List.of(new RedundantAssignmentAnalysis()))
                  .analyze(tree)
                  .diagnostics()
                  .toList();
    }
}
