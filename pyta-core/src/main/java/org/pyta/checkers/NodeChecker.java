package org.pyta.checkers;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SyntaxNode;
import org.pyta.lint.Diagnostic;

import java.util.Set;
import java.util.stream.Stream;

/**
 * A syntactic rule invoked on nodes of the kinds it registers for.
 *
 * Checkers must not keep state between invocations nor modify the tree: running them in
 * any order yields the same diagnostics.
 */
public interface NodeChecker {

    /**
     * Get the rule ID (e.g., "C0103").
     */
    String ruleId();

    /**
     * Get the readable rule name (e.g., "invalid-name").
     */
    String symbol();

    /**
     * Get a short description of what this rule checks.
     */
    String description();

    /**
     * Node kinds this checker is invoked for.
     */
    Set<NodeKind> kinds();

    /**
     * Inspect a node of one of the registered kinds.
     *
     * @param node node to inspect
     * @param ctx  the unit being analyzed, with configuration and ancestor access
     * @return stream of diagnostics found
     */
    Stream<Diagnostic> check(SyntaxNode node, CheckContext ctx);
}
