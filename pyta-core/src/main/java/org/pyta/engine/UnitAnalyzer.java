package org.pyta.engine;

import org.pyta.ast.AnalysisUnit;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.ControlFlowGraph;
import org.pyta.cfg.ControlFlowGraphBuilder;
import org.pyta.cfg.analysis.GraphAnalysis;
import org.pyta.checkers.CheckContext;
import org.pyta.checkers.CheckerRegistry;
import org.pyta.checkers.UnitTraversal;
import org.pyta.lint.AnalysisContext;
import org.pyta.lint.AnalysisError;
import org.pyta.lint.Diagnostic;
import org.pyta.lint.DiagnosticAggregator;
import org.pyta.lint.MalformedInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the pipeline for one unit: control-flow graph, graph analyses, the shared checker
 * traversal and aggregation.
 *
 * A malformed unit yields a single {@code analysis-failed} diagnostic and nothing else. A
 * failing analysis only loses its own results.
 */
public final class UnitAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(UnitAnalyzer.class);

    private final AnalysisContext context;
    private final CheckerRegistry registry;
    private final List<GraphAnalysis> analyses;

    private UnitAnalyzer(AnalysisContext context, CheckerRegistry registry, List<GraphAnalysis> analyses) {
        this.context = context;
        this.registry = registry.enabledIn(context);
        this.analyses = analyses.stream()
                                .filter(analysis -> context.isRuleEnabled(analysis.ruleId()))
                                .toList();
    }

    public static UnitAnalyzer unitAnalyzer(AnalysisContext context,
                                            CheckerRegistry registry,
                                            List<GraphAnalysis> analyses) {
        return new UnitAnalyzer(context, registry, analyses);
    }

    public UnitReport analyze(SyntaxTree tree, AnalysisUnit unit) {
        try {
            var graph = ControlFlowGraphBuilder.controlFlowGraphBuilder(tree)
                                               .build(unit.node());
            var ctx = CheckContext.checkContext(tree, unit, Optional.of(graph), context);

            var incomplete = graph.unsupported()
                                  .stream()
                                  .map(construct -> Diagnostic.analysisIncomplete(Diagnostic.ANALYSIS_INCOMPLETE_ID,
                                                                                  construct.span(),
                                                                                  construct.message()))
                                  .toList();
            var graphFindings = runAnalyses(graph, ctx);
            var checkerFindings = UnitTraversal.unitTraversal(registry)
                                               .traverse(ctx);

            var diagnostics = DiagnosticAggregator.aggregate(incomplete.stream(),
                                                             graphFindings.stream(),
                                                             checkerFindings.stream())
                                                  .toList();
            log.debug("Analyzed {} in {}: {} diagnostics", unit.qualifiedName(), tree.fileName(), diagnostics.size());
            return UnitReport.unitReport(unit.qualifiedName(), unit.span(), diagnostics);
        } catch (MalformedInputException e) {
            log.warn("Cannot analyze {} in {}: {}", unit.qualifiedName(), tree.fileName(), e.getMessage());
            return UnitReport.unitReport(unit.qualifiedName(),
                                         unit.span(),
                                         List.of(Diagnostic.analysisFailed(unit.span(),
                                                                           e.error()
                                                                            .detail())));
        }
    }

    private List<Diagnostic> runAnalyses(ControlFlowGraph graph, CheckContext ctx) {
        var findings = new ArrayList<Diagnostic>();
        for (var analysis : analyses) {
            try {
                findings.addAll(analysis.analyze(graph, ctx)
                                        .toList());
            } catch (MalformedInputException e) {
                throw e;
            } catch (RuntimeException e) {
                var failure = new AnalysisError.CheckerFailure(analysis.ruleId(), ctx.unit()
                                                                                     .span(), e);
                log.warn("Analysis {} failed on {}: {}", analysis.ruleId(), ctx.unit()
                                                                               .qualifiedName(), e.toString(), e);
                findings.add(Diagnostic.analysisIncomplete(analysis.ruleId(), failure.span(), failure.message()));
            }
        }
        return findings;
    }
}
