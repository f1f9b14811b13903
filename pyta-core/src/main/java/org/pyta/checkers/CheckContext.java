package org.pyta.checkers;

import org.pyta.ast.AnalysisUnit;
import org.pyta.ast.SourceSpan;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.lint.AnalysisContext;
import org.pyta.lint.Diagnostic;
import org.pyta.lint.DiagnosticSeverity;

import java.util.Optional;

/// Read-only view handed to checkers and graph analyses while one unit is analyzed.
public record CheckContext(SyntaxTree tree,
                           AnalysisUnit unit,
                           Optional<ControlFlowGraph> graph,
                           AnalysisContext analysis,
                           ConstantFolding folding) {
    public static CheckContext checkContext(SyntaxTree tree,
                                            AnalysisUnit unit,
                                            Optional<ControlFlowGraph> graph,
                                            AnalysisContext analysis) {
        return new CheckContext(tree, unit, graph, analysis, ConstantFolding.constantFolding(tree));
    }

    /// Get the configured severity for a rule.
    public DiagnosticSeverity severityFor(String ruleId) {
        return analysis.severityFor(ruleId);
    }

    /// Create a diagnostic with the configured severity of its rule.
    public Diagnostic diagnostic(String ruleId, String symbol, SourceSpan span, String message) {
        return Diagnostic.diagnostic(ruleId, symbol, severityFor(ruleId), span, message);
    }
}
