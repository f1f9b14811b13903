package org.pyta.engine;

import org.pyta.ast.SourceSpan;
import org.pyta.lint.Diagnostic;

import java.util.List;

/**
 * Diagnostics of one analysis unit, in report order.
 *
 * @param unitName    qualified name of the unit
 * @param span        span of the module or function definition
 * @param diagnostics ordered diagnostics
 */
public record UnitReport(String unitName, SourceSpan span, List<Diagnostic> diagnostics) {
    public UnitReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public static UnitReport unitReport(String unitName, SourceSpan span, List<Diagnostic> diagnostics) {
        return new UnitReport(unitName, span, diagnostics);
    }

    /// Whether the unit could not be analyzed.
    public boolean failed() {
        return diagnostics.stream()
                          .anyMatch(diagnostic -> diagnostic.ruleId()
                                                            .equals(Diagnostic.ANALYSIS_FAILED_ID));
    }
}
