package org.pyta.cfg.analysis;

import org.pyta.cfg.ControlFlowGraph;
import org.pyta.checkers.CheckContext;
import org.pyta.lint.Diagnostic;

import java.util.stream.Stream;

/**
 * A rule evaluated on the control-flow graph of one unit.
 *
 * Analyses only read the graph; each one is run in isolation, so a failure of one does not
 * affect the others.
 */
public interface GraphAnalysis {

    /**
     * Get the rule ID (e.g., "W0101").
     */
    String ruleId();

    /**
     * Get the readable rule name (e.g., "unreachable").
     */
    String symbol();

    /**
     * Get a short description of what this analysis reports.
     */
    String description();

    /**
     * Analyze a graph.
     *
     * @param graph graph of the unit described by the context
     * @param ctx   the unit being analyzed
     * @return stream of diagnostics found, ordered by source position
     */
    Stream<Diagnostic> analyze(ControlFlowGraph graph, CheckContext ctx);
}
