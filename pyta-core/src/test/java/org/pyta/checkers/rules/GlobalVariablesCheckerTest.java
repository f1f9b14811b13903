package org.pyta.checkers.rules;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pyta.ast.PySyntax.*;
import static org.pyta.checkers.rules.RuleFixture.check;

class GlobalVariablesCheckerTest {

    private final GlobalVariablesChecker checker = new GlobalVariablesChecker();

    @Test
    void globalInsideFunction_isReportedWithNames() {
        var tree = tree(module(assign("counter", num(0)),
                               def("bump", global("counter", "total"), augAssign("counter", "Add", num(1)))));

        assertThat(check(checker, tree)).singleElement()
                                        .satisfies(d -> {
                                            assertThat(d.ruleId()).isEqualTo("E9997");
                                            assertThat(d.symbol()).isEqualTo("forbidden-global-variables");
                                            assertThat(d.message()).contains("(counter, total)");
                                            assertThat(d.span()
                                                        .startLine()).isEqualTo(3);
                                        });
    }

    @Test
    void globalAtModuleLevel_isIgnored() {
        var tree = tree(module(global("counter")));

        assertThat(check(checker, tree)).isEmpty();
    }

    @Test
    void nonlocal_isIgnored() {
        var tree = tree(module(def("outer", assign("n", num(0)), def("inner", nonlocal("n")))));

        assertThat(check(checker, tree)).isEmpty();
    }
}
