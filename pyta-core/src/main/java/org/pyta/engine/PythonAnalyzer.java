package org.pyta.engine;

import org.pyta.ast.AnalysisUnit;
import org.pyta.ast.SyntaxTree;
import org.pyta.cfg.analysis.GraphAnalysis;
import org.pyta.checkers.CheckerRegistry;
import org.pyta.checkers.NodeChecker;
import org.pyta.lint.AnalysisContext;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the checker engine.
 *
 * Units share no mutable state, so they can be analyzed on several threads; the report is the
 * same either way.
 */
public final class PythonAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(PythonAnalyzer.class);

    private final AnalysisContext context;
    private final CheckerRegistry registry;
    private final List<GraphAnalysis> analyses;

    private PythonAnalyzer(AnalysisContext context, List<NodeChecker> checkers, List<GraphAnalysis> analyses) {
        this.context = context;
        this.registry = CheckerRegistry.checkerRegistry(checkers);
        this.analyses = List.copyOf(analyses);
    }

    /**
     * Factory method with default configuration and rules.
     */
    public static PythonAnalyzer pythonAnalyzer() {
        return pythonAnalyzer(AnalysisContext.defaultContext());
    }

    /**
     * Factory method with the default rules.
     */
    public static PythonAnalyzer pythonAnalyzer(AnalysisContext context) {
        return pythonAnalyzer(context, DefaultRules.checkers(), DefaultRules.analyses());
    }

    /**
     * Factory method with custom rules.
     */
    public static PythonAnalyzer pythonAnalyzer(AnalysisContext context,
                                                List<NodeChecker> checkers,
                                                List<GraphAnalysis> analyses) {
        return new PythonAnalyzer(context, checkers, analyses);
    }

    public AnalysisContext context() {
        return context;
    }

    /**
     * Analyze every unit of a file on the calling thread.
     */
    public FileReport analyze(SyntaxTree tree) {
        var analyzer = unitAnalyzer(tree);
        var reports = UnitCollector.units(tree)
                                   .stream()
                                   .map(unit -> analyzer.analyze(tree, unit))
                                   .toList();
        return report(tree, reports);
    }

    /**
     * Analyze the units of a file as separate tasks of the given executor.
     *
     * The executor is not shut down.
     */
    public FileReport analyze(SyntaxTree tree, ExecutorService executor) {
        var analyzer = unitAnalyzer(tree);
        var futures = UnitCollector.units(tree)
                                   .stream()
                                   .map(unit -> CompletableFuture.supplyAsync(() -> analyzer.analyze(tree, unit),
                                                                              executor))
                                   .toList();
        try {
            var reports = futures.stream()
                                 .map(CompletableFuture::join)
                                 .toList();
            return report(tree, reports);
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Analyze a single unit.
     */
    public UnitReport analyzeUnit(SyntaxTree tree, AnalysisUnit unit) {
        return unitAnalyzer(tree).analyze(tree, unit);
    }

    private UnitAnalyzer unitAnalyzer(SyntaxTree tree) {
        return UnitAnalyzer.unitAnalyzer(context.withFileName(tree.fileName()), registry, analyses);
    }

    private static FileReport report(SyntaxTree tree, List<UnitReport> reports) {
        var report = FileReport.fileReport(tree.fileName(), reports);
        log.debug("Analyzed {}: {} units, {} diagnostics", tree.fileName(), reports.size(), report.total());
        return report;
    }
}
