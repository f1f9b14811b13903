package org.pyta.lint;

/**
 * Severity of a diagnostic.
 *
 * Mirrors the message categories students see in reports: errors first, then warnings,
 * refactoring suggestions, conventions and informational notes.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    REFACTOR,
    CONVENTION,
    INFO
}
