package org.pyta.checkers.rules;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.checkers.CheckContext;
import org.pyta.checkers.NodeChecker;
import org.pyta.checkers.Scopes;
import org.pyta.lint.Diagnostic;

import java.util.Set;
import java.util.stream.Stream;

/**
 * E9997: Functions must not rebind module-level variables through {@code global}.
 */
public class GlobalVariablesChecker implements NodeChecker {

    private static final String RULE_ID = "E9997";
    private static final String SYMBOL = "forbidden-global-variables";

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
        return "No global statements inside functions";
    }

    @Override
    public Set<NodeKind> kinds() {
        return Set.of(NodeKind.GLOBAL);
    }

    @Override
    public Stream<Diagnostic> check(SyntaxNode node, CheckContext ctx) {
        if (Scopes.enclosingFunction(ctx.tree(), node)
                  .isEmpty()) {
            return Stream.empty();
        }
        var names = node.attribute("names")
                        .orElse("");
        return Stream.of(ctx.diagnostic(RULE_ID,
                                        SYMBOL,
                                        node.span(),
                                        "Using global variables (" + names.replace(",", ", ")
                                        + ") inside a function makes it depend on hidden state. "
                                        + "Pass the values in as parameters and return the results instead.")
                            .withFix("Remove the global statement and add a parameter for each variable"));
    }
}
