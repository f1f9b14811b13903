package org.pyta.engine;

import org.pyta.ast.SourceSpan;
import org.pyta.lint.AnalysisError;
import org.pyta.lint.Diagnostic;
import org.pyta.lint.DiagnosticSeverity;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileReportTest {

    @Test
    void fileReport_countsEverySeverity_includingZeroes() {
        var span = SourceSpan.line(1, 0, 4);
        var unit = UnitReport.unitReport("<module>",
                                         span,
                                         List.of(diagnostic("E9999", DiagnosticSeverity.ERROR, span),
                                                 diagnostic("W0702", DiagnosticSeverity.WARNING, span),
                                                 diagnostic("E9998", DiagnosticSeverity.ERROR, span)));

        var report = FileReport.fileReport("main.py", List.of(unit));

        assertThat(report.severityCounts()).containsOnlyKeys(DiagnosticSeverity.values());
        assertThat(report.count(DiagnosticSeverity.ERROR)).isEqualTo(2);
        assertThat(report.count(DiagnosticSeverity.INFO)).isZero();
        assertThat(report.total()).isEqualTo(3);
        assertThat(report.hasErrors()).isTrue();
    }

    @Test
    void failed_reportsSingleAnalysisFailedDiagnostic() {
        var span = SourceSpan.line(3, 0, 10);

        var report = FileReport.failed("broken.py", new AnalysisError.MalformedInput(span, "unknown node type 'Foo'"));

        assertThat(report.units()).singleElement()
                                  .satisfies(unit -> {
                                      assertThat(unit.unitName()).isEqualTo("<module>");
                                      assertThat(unit.failed()).isTrue();
                                  });
        assertThat(report.diagnostics()).singleElement()
                                        .satisfies(d -> {
                                            assertThat(d.ruleId()).isEqualTo(Diagnostic.ANALYSIS_FAILED_ID);
                                            assertThat(d.span()).isEqualTo(span);
                                            assertThat(d.message()).contains("unknown node type 'Foo'");
                                        });
        assertThat(report.hasErrors()).isTrue();
    }

    private static Diagnostic diagnostic(String ruleId, DiagnosticSeverity severity, SourceSpan span) {
        return Diagnostic.diagnostic(ruleId, "symbol", severity, span, "message");
    }
}
