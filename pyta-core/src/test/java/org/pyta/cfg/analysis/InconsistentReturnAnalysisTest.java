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

class InconsistentReturnAnalysisTest {

    @Test
    void analyze_reportsFunction_whenFalseBranchFallsOffTheEnd() {
        var tree = tree(module(def("f", ifStmt(name("cond"), ret(num(1)))).params("cond")));

        var diagnostics = analyze(tree);

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0)
                              .ruleId()).isEqualTo("R1710");
        assertThat(diagnostics.get(0)
                              .span()).isEqualTo(find(tree, NodeKind.FUNCTION_DEF).span());
        assertThat(diagnostics.get(0)
                              .message()).contains("\"f\"")
                                         .contains("end of its body");
    }

    @Test
    void analyze_reportsNothing_whenEveryPathReturnsValue() {
        var tree = tree(module(def("f",
                                   ifStmt(name("cond"), ret(num(1))),
                                   ret(num(2)))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsBareReturnMixedWithValueReturn() {
        var tree = tree(module(def("f",
                                   ifStmt(name("cond"), ret()),
                                   ret(num(2)))));

        assertThat(analyze(tree)).singleElement()
                                 .satisfies(d -> assertThat(d.message()).contains("return None"));
    }

    @Test
    void analyze_treatsReturnNoneAsNoValue_withoutSuggestingReturnNone() {
        var tree = tree(module(def("f",
                                   ifStmt(name("cond"), ret(none())),
                                   ret(num(2)))));

        assertThat(analyze(tree)).singleElement()
                                 .satisfies(d -> {
                                     assertThat(d.message()).contains("return statements that return None");
                                     assertThat(d.suggestedFix()).hasValueSatisfying(fix -> assertThat(fix).contains("other than None")
                                                                                                         .doesNotContain("e.g. \"return None\""));
                                 });
    }

    @Test
    void analyze_reportsNothing_forProcedure() {
        var tree = tree(module(def("log",
                                   ifStmt(name("quiet"), ret()),
                                   expr(call("write", name("message"))))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_skipsGenerators() {
        var tree = tree(module(def("numbers",
                                   ifStmt(name("empty"), ret(num(0))),
                                   expr(yieldExpr(num(1))))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_reportsNothing_forEndlessLoopThatReturns() {
        var tree = tree(module(def("poll",
                                   whileLoop(bool(true), ifStmt(call("ready"), ret(call("read")))))));

        assertThat(analyze(tree)).isEmpty();
    }

    @Test
    void analyze_ignoresUnreachableFallOff() {
        var tree = tree(module(def("f",
                                   ifStmt(bool(true), ret(num(1))))));

        assertThat(analyze(tree)).isEmpty();
    }

    private static List<Diagnostic> analyze(SyntaxTree tree) {
        return pythonAnalyzer(AnalysisContext.defaultContext(), List.of(), List.of(new InconsistentReturnAnalysis()))
                  .analyze(tree)
                  .diagnostics()
                  .toList();
    }
}
