package org.pyta.engine;

import org.pyta.cfg.analysis.GraphAnalysis;
import org.pyta.cfg.analysis.InconsistentReturnAnalysis;
import org.pyta.cfg.analysis.MissingReturnAnalysis;
import org.pyta.cfg.analysis.OneIterationAnalysis;
import org.pyta.cfg.analysis.RedundantAssignmentAnalysis;
import org.pyta.cfg.analysis.UnreachableCodeAnalysis;
import org.pyta.checkers.NodeChecker;
import org.pyta.checkers.rules.BareExceptChecker;
import org.pyta.checkers.rules.ComplexityChecker;
import org.pyta.checkers.rules.ConstantTestChecker;
import org.pyta.checkers.rules.ForbiddenImportChecker;
import org.pyta.checkers.rules.ForbiddenIoChecker;
import org.pyta.checkers.rules.GlobalVariablesChecker;
import org.pyta.checkers.rules.InvalidNameChecker;
import org.pyta.checkers.rules.NestedBlocksChecker;

import java.util.List;

/**
 * The rule set run by default.
 */
public final class DefaultRules {

    private DefaultRules() {}

    public static List<NodeChecker> checkers() {
        return List.of(new InvalidNameChecker(),
                       new NestedBlocksChecker(),
                       new BareExceptChecker(),
                       new ConstantTestChecker(),
                       new ComplexityChecker(),
                       new GlobalVariablesChecker(),
                       new ForbiddenIoChecker(),
                       new ForbiddenImportChecker());
    }

    public static List<GraphAnalysis> analyses() {
        return List.of(new UnreachableCodeAnalysis(),
                       new InconsistentReturnAnalysis(),
                       new MissingReturnAnalysis(),
                       new OneIterationAnalysis(),
                       new RedundantAssignmentAnalysis());
    }
}
