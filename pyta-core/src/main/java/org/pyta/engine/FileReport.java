package org.pyta.engine;

import org.pyta.ast.AnalysisUnit;
import org.pyta.ast.SourceSpan;
import org.pyta.lint.AnalysisError;
import org.pyta.lint.Diagnostic;
import org.pyta.lint.DiagnosticSeverity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Result of analyzing one file: the unit reports in unit order plus the number of diagnostics
 * per severity.
 */
public record FileReport(String fileName,
                         List<UnitReport> units,
                         Map<DiagnosticSeverity, Integer> severityCounts) {
    public FileReport {
        units = List.copyOf(units);
        severityCounts = Collections.unmodifiableMap(new EnumMap<>(severityCounts));
    }

    public static FileReport fileReport(String fileName, List<UnitReport> units) {
        var counts = new EnumMap<DiagnosticSeverity, Integer>(DiagnosticSeverity.class);
        for (var severity : DiagnosticSeverity.values()) {
            counts.put(severity, 0);
        }
        units.stream()
             .flatMap(unit -> unit.diagnostics()
                                  .stream())
             .forEach(diagnostic -> counts.merge(diagnostic.severity(), 1, Integer::sum));
        return new FileReport(fileName, units, counts);
    }

    /// Report for a file whose syntax tree could not be built.
    public static FileReport failed(String fileName, AnalysisError.MalformedInput error) {
        var span = error.span() == null
                   ? SourceSpan.FILE_START
                   : error.span();
        return fileReport(fileName,
                          List.of(UnitReport.unitReport(AnalysisUnit.MODULE_NAME,
                                                        span,
                                                        List.of(Diagnostic.analysisFailed(span, error.message())))));
    }

    /// All diagnostics, unit by unit.
    public Stream<Diagnostic> diagnostics() {
        return units.stream()
                    .flatMap(unit -> unit.diagnostics()
                                         .stream());
    }

    public int count(DiagnosticSeverity severity) {
        return severityCounts.getOrDefault(severity, 0);
    }

    public int total() {
        return severityCounts.values()
                             .stream()
                             .mapToInt(Integer::intValue)
                             .sum();
    }

    public boolean hasErrors() {
        return count(DiagnosticSeverity.ERROR) > 0;
    }
}
