package org.pyta.checkers.rules;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.checkers.CheckContext;
import org.pyta.checkers.NodeChecker;
import org.pyta.lint.Diagnostic;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * W0125: Conditions must depend on the program state.
 *
 * Applies to {@code if}, {@code while} and conditional expressions. The intentional endless
 * loop {@code while True:} (or {@code while 1:}) is accepted.
 */
public class ConstantTestChecker implements NodeChecker {

    private static final String RULE_ID = "W0125";
    private static final String SYMBOL = "using-constant-test";

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
        return "No conditions with a constant truth value";
    }

    @Override
    public Set<NodeKind> kinds() {
        return EnumSet.of(NodeKind.IF, NodeKind.WHILE, NodeKind.IF_EXP);
    }

    @Override
    public Stream<Diagnostic> check(SyntaxNode node, CheckContext ctx) {
        var test = ctx.tree()
                      .child(node, "test");
        if (test.isEmpty()) {
            return Stream.empty();
        }
        if (node.is(NodeKind.WHILE) && ctx.folding()
                                          .isLiteralTrue(test.get())) {
            return Stream.empty();
        }
        return ctx.folding()
                  .truthiness(test.get())
                  .map(value -> ctx.diagnostic(RULE_ID,
                                               SYMBOL,
                                               test.get()
                                                   .span(),
                                               "This condition is always " + (value ? "true" : "false")
                                               + ", so the " + statementName(node) + " does not depend on the "
                                               + "program's data. " + (value
                                                                       ? "The other branch can never run."
                                                                       : "This branch can never run."))
                                   .withFix("Replace the condition with an expression that can be both true and "
                                            + "false, or remove the dead branch"))
                  .stream();
    }

    private static String statementName(SyntaxNode node) {
        return switch (node.kind()) {
            case IF -> "if statement";
            case WHILE -> "while loop";
            default -> "conditional expression";
        };
    }
}
