package org.pyta.checkers.rules;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.checkers.CheckContext;
import org.pyta.checkers.NodeChecker;
import org.pyta.lint.Diagnostic;

import java.util.Set;
import java.util.stream.Stream;

/**
 * W0702: An except clause must name the exception it handles.
 */
public class BareExceptChecker implements NodeChecker {

    private static final String RULE_ID = "W0702";
    private static final String SYMBOL = "bare-except";

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
        return "No bare except clauses";
    }

    @Override
    public Set<NodeKind> kinds() {
        return Set.of(NodeKind.EXCEPT_HANDLER);
    }

    @Override
    public Stream<Diagnostic> check(SyntaxNode handler, CheckContext ctx) {
        if (ctx.tree()
               .child(handler, "type")
               .isPresent()) {
            return Stream.empty();
        }
        return Stream.of(ctx.diagnostic(RULE_ID,
                                        SYMBOL,
                                        handler.span(),
                                        "This except clause catches every exception, including ones you did not "
                                        + "expect, such as typing mistakes in your own code. Name the exception you "
                                        + "want to handle.")
                            .withFix("Replace \"except:\" with the specific exception, e.g. \"except ValueError:\""));
    }
}
