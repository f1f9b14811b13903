package org.pyta.checkers;

import org.pyta.ast.NodeKind;
import org.pyta.checkers.rules.BareExceptChecker;
import org.pyta.checkers.rules.ConstantTestChecker;
import org.pyta.checkers.rules.InvalidNameChecker;
import org.pyta.engine.DefaultRules;
import org.pyta.lint.AnalysisContext;
import org.pyta.lint.CheckerConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pyta.ast.PySyntax.*;
import static org.pyta.checkers.CheckerRegistry.checkerRegistry;
import static org.pyta.engine.PythonAnalyzer.pythonAnalyzer;

class CheckerRegistryTest {

    @Test
    void checkersFor_returnsCheckersRegisteredForKind_inRegistrationOrder() {
        var names = new InvalidNameChecker();
        var constants = new ConstantTestChecker();
        var registry = checkerRegistry(List.of(names, constants, new BareExceptChecker()));

        assertThat(registry.checkersFor(NodeKind.IF)).containsExactly(constants);
        assertThat(registry.checkersFor(NodeKind.FUNCTION_DEF)).containsExactly(names);
        assertThat(registry.checkersFor(NodeKind.LAMBDA)).isEmpty();
    }

    @Test
    void enabledIn_dropsDisabledRules() {
        var registry = checkerRegistry(List.of(new InvalidNameChecker(), new BareExceptChecker()));
        var context = AnalysisContext.analysisContext(CheckerConfig.defaultConfig()
                                                                   .withDisabledRule("W0702"), "test.py");

        var enabled = registry.enabledIn(context);

        assertThat(enabled.checkers()).extracting(NodeChecker::ruleId)
                                      .containsExactly("C0103");
        assertThat(enabled.checkersFor(NodeKind.EXCEPT_HANDLER)).isEmpty();
    }

    @Test
    void traversal_producesSameReport_forAnyCheckerOrder() {
        var tree = tree(module(assign("limit", num(3)),
                               def("readValues",
                                   global("limit"),
                                   tryStmt(ret(call("input"))).handler(bareExcept(pass())),
                                   ifStmt(bool(true), pass()))));
        var checkers = new ArrayList<>(DefaultRules.checkers());
        var reversed = new ArrayList<>(checkers);
        Collections.reverse(reversed);

        var forward = pythonAnalyzer(AnalysisContext.defaultContext(), checkers, List.of()).analyze(tree);
        var backward = pythonAnalyzer(AnalysisContext.defaultContext(), reversed, List.of()).analyze(tree);

        assertThat(forward.diagnostics()
                          .toList()).isNotEmpty()
                                    .containsExactlyElementsOf(backward.diagnostics()
                                                                       .toList());
    }
}
