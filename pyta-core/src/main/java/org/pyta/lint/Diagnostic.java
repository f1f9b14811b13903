package org.pyta.lint;

import org.pyta.ast.SourceSpan;

import java.util.Optional;

/**
 * A single finding reported to the student.
 *
 * @param ruleId       rule identifier, e.g. {@code W0101}
 * @param symbol       readable rule name, e.g. {@code unreachable}
 * @param severity     severity level
 * @param span         source region the finding refers to
 * @param message      human-readable explanation
 * @param suggestedFix optional hint on how to fix the problem
 */
public record Diagnostic(String ruleId,
                         String symbol,
                         DiagnosticSeverity severity,
                         SourceSpan span,
                         String message,
                         Optional<String> suggestedFix) {
    public static final String ANALYSIS_FAILED_ID = "F0001";
    public static final String ANALYSIS_FAILED = "analysis-failed";
    public static final String ANALYSIS_INCOMPLETE_ID = "F0002";
    public static final String ANALYSIS_INCOMPLETE = "analysis-incomplete";

    /**
     * Factory method for a diagnostic without a suggested fix.
     */
    public static Diagnostic diagnostic(String ruleId,
                                        String symbol,
                                        DiagnosticSeverity severity,
                                        SourceSpan span,
                                        String message) {
        return new Diagnostic(ruleId, symbol, severity, span, message, Optional.empty());
    }

    /**
     * Builder-style method to attach a suggested fix.
     */
    public Diagnostic withFix(String fix) {
        return new Diagnostic(ruleId, symbol, severity, span, message, Optional.of(fix));
    }

    /**
     * Diagnostic reported when a unit could not be analyzed at all.
     */
    public static Diagnostic analysisFailed(SourceSpan span, String reason) {
        return diagnostic(ANALYSIS_FAILED_ID,
                          ANALYSIS_FAILED,
                          DiagnosticSeverity.ERROR,
                          span,
                          "This code could not be analyzed, so no other problems are reported for it: " + reason);
    }

    /**
     * Diagnostic reported when part of an analysis was skipped.
     *
     * @param ruleId rule whose results are incomplete
     */
    public static Diagnostic analysisIncomplete(String ruleId, SourceSpan span, String reason) {
        return diagnostic(ruleId,
                          ANALYSIS_INCOMPLETE,
                          DiagnosticSeverity.INFO,
                          span,
                          "Analysis of this code is incomplete: " + reason);
    }

    public boolean isAnalysisProblem() {
        return ANALYSIS_FAILED.equals(symbol) || ANALYSIS_INCOMPLETE.equals(symbol);
    }

    @Override
    public String toString() {
        return span.startLine() + ":" + span.startColumn() + " " + ruleId + " (" + symbol + ") " + message;
    }
}
