package org.pyta.lint;

import java.util.List;
import java.util.regex.Pattern;

/// Context for one analysis run: configuration plus the name of the analyzed file.
public record AnalysisContext(CheckerConfig config,
                              String fileName,
                              List<Pattern> allowedImportPatterns) {
    public AnalysisContext {
        allowedImportPatterns = List.copyOf(allowedImportPatterns);
    }

    /// Get the configured severity for a rule.
    public DiagnosticSeverity severityFor(String ruleId) {
        return config.ruleSeverities()
                     .getOrDefault(ruleId, DiagnosticSeverity.WARNING);
    }

    /// Check if a rule is enabled.
    public boolean isRuleEnabled(String ruleId) {
        return ! config.disabledRules()
                      .contains(ruleId);
    }

    /// Check if importing a module is allowed. Without configured patterns every module is allowed.
    public boolean isImportAllowed(String moduleName) {
        if (allowedImportPatterns.isEmpty()) {
            return true;
        }
        return allowedImportPatterns.stream()
                                    .anyMatch(pattern -> pattern.matcher(moduleName)
                                                                .matches());
    }

    /// Factory method with default configuration.
    public static AnalysisContext defaultContext() {
        return analysisContext(CheckerConfig.defaultConfig(), "<unknown>");
    }

    /// Factory method with custom configuration.
    public static AnalysisContext analysisContext(CheckerConfig config, String fileName) {
        var patterns = config.allowedImports()
                             .stream()
                             .map(AnalysisContext::globToRegex)
                             .map(Pattern::compile)
                             .toList();
        return new AnalysisContext(config, fileName, patterns);
    }

    private static String globToRegex(String glob) {
        // Use placeholder to avoid ** being affected by * replacement
        return glob.replace(".", "\\.")
                   .replace("**", "\0DOTSTAR\0")
                   .replace("*", "[^.]*")
                   .replace("\0DOTSTAR\0", ".*");
    }

    /// Builder-style method to set config.
    public AnalysisContext withConfig(CheckerConfig config) {
        return analysisContext(config, fileName);
    }

    /// Builder-style method to set file name.
    public AnalysisContext withFileName(String fileName) {
        return new AnalysisContext(config, fileName, allowedImportPatterns);
    }
}
