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
 * E9998: Functions must not call the configured input/output built-ins.
 *
 * Calls at module level and in the main block are allowed.
 */
public class ForbiddenIoChecker implements NodeChecker {

    private static final String RULE_ID = "E9998";
    private static final String SYMBOL = "forbidden-IO-function";

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
        return "No input/output built-ins inside functions";
    }

    @Override
    public Set<NodeKind> kinds() {
        return Set.of(NodeKind.CALL);
    }

    @Override
    public Stream<Diagnostic> check(SyntaxNode call, CheckContext ctx) {
        var tree = ctx.tree();
        var function = tree.child(call, "func")
                           .filter(func -> func.is(NodeKind.NAME))
                           .flatMap(SyntaxNode::identifier)
                           .filter(name -> ctx.analysis()
                                              .config()
                                              .forbiddenIoFunctions()
                                              .contains(name));
        if (function.isEmpty() || Scopes.enclosingFunction(tree, call)
                                        .isEmpty()) {
            return Stream.empty();
        }
        var name = function.get();
        return Stream.of(ctx.diagnostic(RULE_ID,
                                        SYMBOL,
                                        call.span(),
                                        "Function \"" + name + "\" should not be called inside a function. "
                                        + "Functions should receive their data as parameters and give results back "
                                        + "with return, leaving input and output to the main program.")
                            .withFix("Move the call to \"" + name + "\" to the main block and pass the value "
                                     + "through parameters or return values"));
    }
}
