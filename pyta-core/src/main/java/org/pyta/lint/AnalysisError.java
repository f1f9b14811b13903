package org.pyta.lint;

import org.pyta.ast.NodeKind;
import org.pyta.ast.SourceSpan;

/**
 * Errors raised while analyzing a unit.
 */
public sealed interface AnalysisError {
    /**
     * Span the error refers to.
     */
    SourceSpan span();

    /**
     * Human-readable description.
     */
    String message();

    /**
     * The syntax tree violates a structural precondition. The whole unit is abandoned.
     */
    record MalformedInput(SourceSpan span, String detail) implements AnalysisError {
        @Override
        public String message() {
            return "Malformed syntax tree at " + span + ": " + detail;
        }
    }

    /**
     * A recognized construct the control-flow builder does not model; treated as an opaque statement.
     */
    record UnsupportedConstruct(SourceSpan span, NodeKind kind) implements AnalysisError {
        @Override
        public String message() {
            return "control flow inside this '" + kind.pythonName() + "' statement is not analyzed";
        }
    }

    /**
     * A checker or analysis threw while running. Only that rule is affected.
     */
    record CheckerFailure(String ruleId, SourceSpan span, Throwable cause) implements AnalysisError {
        @Override
        public String message() {
            return "rule " + ruleId + " stopped with an internal error ("
                   + cause.getClass().getSimpleName() + ")";
        }
    }
}
