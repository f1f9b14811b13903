package org.pyta.checkers.rules;

import org.pyta.ast.NodeKind;
import org.pyta.lint.CheckerConfig;

import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pyta.ast.PySyntax.*;
import static org.pyta.checkers.rules.RuleFixture.check;

class ForbiddenIoCheckerTest {

    private final ForbiddenIoChecker checker = new ForbiddenIoChecker();

    @Test
    void printInsideFunction_isReportedAtCall() {
        var tree = tree(module(def("show", expr(call("print", name("value"))))));

        assertThat(check(checker, tree)).singleElement()
                                        .satisfies(d -> {
                                            assertThat(d.ruleId()).isEqualTo("E9998");
                                            assertThat(d.symbol()).isEqualTo("forbidden-IO-function");
                                            assertThat(d.span()).isEqualTo(find(tree, NodeKind.CALL).span());
                                            assertThat(d.message()).startsWith("Function \"print\"");
                                        });
    }

    @Test
    void inputInsideMethod_isReported() {
        var tree = tree(module(cls("Prompt", def("ask", ret(call("input"))).params("self"))));

        assertThat(check(checker, tree)).hasSize(1);
    }

    @Test
    void callsAtModuleLevel_areAllowed() {
        var tree = tree(module(expr(call("print", str("hi"))),
                               ifStmt(compare(name("__name__"), "Eq", str("__main__")), expr(call("input")))));

        assertThat(check(checker, tree)).isEmpty();
    }

    @Test
    void forbiddenFunctions_comeFromConfig() {
        var config = CheckerConfig.defaultConfig()
                                  .withForbiddenIoFunctions(Set.of("open"));
        var tree = tree(module(def("load", expr(call("print")), ret(call("open", str("data.txt"))))));

        assertThat(check(checker, config, tree)).singleElement()
                                                .satisfies(d -> assertThat(d.message()).contains("\"open\""));
    }
}
