package org.pyta.lint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the checker engine.
 *
 * @param ruleSeverities       severity per rule id; rules not listed default to {@link DiagnosticSeverity#WARNING}
 * @param disabledRules        rule ids that are not run
 * @param maxNestedBlocks      deepest allowed nesting of compound statements
 * @param maxComplexity        highest allowed cyclomatic complexity per function
 * @param forbiddenIoFunctions built-in functions students may not call inside functions
 * @param allowedImports       glob patterns of importable modules; empty allows every module
 */
public record CheckerConfig(Map<String, DiagnosticSeverity> ruleSeverities,
                            Set<String> disabledRules,
                            int maxNestedBlocks,
                            int maxComplexity,
                            Set<String> forbiddenIoFunctions,
                            List<String> allowedImports) {
    public CheckerConfig {
        ruleSeverities = Map.copyOf(ruleSeverities);
        disabledRules = Set.copyOf(disabledRules);
        forbiddenIoFunctions = Set.copyOf(forbiddenIoFunctions);
        allowedImports = List.copyOf(allowedImports);
    }

    /**
     * Default configuration.
     */
    public static final CheckerConfig DEFAULT = new CheckerConfig(
            Map.ofEntries(
                    // Control flow
                    Map.entry("W0101", DiagnosticSeverity.WARNING),     // Unreachable code
                    Map.entry("R1710", DiagnosticSeverity.REFACTOR),    // Inconsistent return statements
                    Map.entry("E9970", DiagnosticSeverity.ERROR),       // Missing return statement
                    Map.entry("E9996", DiagnosticSeverity.ERROR),       // Loop runs only once
                    Map.entry("E9959", DiagnosticSeverity.ERROR),       // Redundant assignment
                    // Style
                    Map.entry("C0103", DiagnosticSeverity.CONVENTION),  // Invalid name
                    Map.entry("R1702", DiagnosticSeverity.REFACTOR),    // Too many nested blocks
                    Map.entry("R1260", DiagnosticSeverity.REFACTOR),    // Too complex
                    // Forbidden constructs
                    Map.entry("W0702", DiagnosticSeverity.WARNING),     // Bare except
                    Map.entry("W0125", DiagnosticSeverity.WARNING),     // Constant condition
                    Map.entry("E9997", DiagnosticSeverity.ERROR),       // Global statement
                    Map.entry("E9998", DiagnosticSeverity.ERROR),       // Forbidden IO function
                    Map.entry("E9999", DiagnosticSeverity.ERROR)        // Forbidden import
            ),
            Set.of(),
            5,
            10,
            Set.of("input", "print", "open"),
            List.of()
    );

    /**
     * Factory method for default config.
     */
    public static CheckerConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Builder-style method to set rule severity.
     */
    public CheckerConfig withRuleSeverity(String ruleId, DiagnosticSeverity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new CheckerConfig(newSeverities,
                                 disabledRules,
                                 maxNestedBlocks,
                                 maxComplexity,
                                 forbiddenIoFunctions,
                                 allowedImports);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public CheckerConfig withDisabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.add(ruleId);
        return new CheckerConfig(ruleSeverities,
                                 newDisabled,
                                 maxNestedBlocks,
                                 maxComplexity,
                                 forbiddenIoFunctions,
                                 allowedImports);
    }

    public CheckerConfig withMaxNestedBlocks(int maxNestedBlocks) {
        return new CheckerConfig(ruleSeverities,
                                 disabledRules,
                                 maxNestedBlocks,
                                 maxComplexity,
                                 forbiddenIoFunctions,
                                 allowedImports);
    }

    public CheckerConfig withMaxComplexity(int maxComplexity) {
        return new CheckerConfig(ruleSeverities,
                                 disabledRules,
                                 maxNestedBlocks,
                                 maxComplexity,
                                 forbiddenIoFunctions,
                                 allowedImports);
    }

    public CheckerConfig withForbiddenIoFunctions(Set<String> forbiddenIoFunctions) {
        return new CheckerConfig(ruleSeverities,
                                 disabledRules,
                                 maxNestedBlocks,
                                 maxComplexity,
                                 forbiddenIoFunctions,
                                 allowedImports);
    }

    public CheckerConfig withAllowedImports(List<String> allowedImports) {
        return new CheckerConfig(ruleSeverities,
                                 disabledRules,
                                 maxNestedBlocks,
                                 maxComplexity,
                                 forbiddenIoFunctions,
                                 allowedImports);
    }
}
