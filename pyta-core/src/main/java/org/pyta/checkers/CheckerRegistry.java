package org.pyta.checkers;

import org.pyta.ast.NodeKind;
import org.pyta.lint.AnalysisContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatch table from node kind to the checkers registered for it.
 *
 * Registration order is kept per kind so that traversal output is deterministic.
 */
public final class CheckerRegistry {
    private final List<NodeChecker> checkers;
    private final Map<NodeKind, List<NodeChecker>> dispatch;

    private CheckerRegistry(List<NodeChecker> checkers) {
        this.checkers = List.copyOf(checkers);
        var table = new EnumMap<NodeKind, List<NodeChecker>>(NodeKind.class);
        for (var checker : this.checkers) {
            for (var kind : checker.kinds()) {
                table.computeIfAbsent(kind, unused -> new ArrayList<>())
                     .add(checker);
            }
        }
        table.replaceAll((kind, registered) -> List.copyOf(registered));
        this.dispatch = Collections.unmodifiableMap(table);
    }

    public static CheckerRegistry checkerRegistry(List<NodeChecker> checkers) {
        return new CheckerRegistry(checkers);
    }

    public List<NodeChecker> checkers() {
        return checkers;
    }

    /// Checkers registered for a node kind, in registration order.
    public List<NodeChecker> checkersFor(NodeKind kind) {
        return dispatch.getOrDefault(kind, List.of());
    }

    /// Registry without the checkers whose rules are disabled in the given context.
    public CheckerRegistry enabledIn(AnalysisContext context) {
        return new CheckerRegistry(checkers.stream()
                                           .filter(checker -> context.isRuleEnabled(checker.ruleId()))
                                           .toList());
    }
}
