package org.pyta.lint;

import org.pyta.ast.SourceSpan;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Merges the diagnostic streams produced for one analysis unit.
 *
 * Exact duplicates (same rule id and span) are dropped and the rest is ordered by span start,
 * then rule id. The result is a single-use stream: nothing is computed until it is consumed,
 * and a consumed stream cannot be replayed.
 */
public final class DiagnosticAggregator {
    /**
     * Report order: span start, rule id, then span end and message so that equal inputs always
     * produce the same sequence.
     */
    public static final Comparator<Diagnostic> ORDER = Comparator.comparingInt((Diagnostic d) -> d.span()
                                                                                               .startLine())
                                                                 .thenComparingInt(d -> d.span()
                                                                                         .startColumn())
                                                                 .thenComparing(Diagnostic::ruleId)
                                                                 .thenComparing(Diagnostic::span)
                                                                 .thenComparing(Diagnostic::message);

    private DiagnosticAggregator() {}

    /**
     * Aggregate several diagnostic streams.
     */
    @SafeVarargs
    public static Stream<Diagnostic> aggregate(Stream<Diagnostic>... streams) {
        return Stream.of(streams)
                     .flatMap(Function.identity())
                     .sequential()
                     .filter(firstOccurrence())
                     .sorted(ORDER);
    }

    /**
     * Aggregate an already collected set of diagnostics.
     */
    public static Stream<Diagnostic> aggregate(Collection<Diagnostic> diagnostics) {
        return aggregate(diagnostics.stream());
    }

    private static Predicate<Diagnostic> firstOccurrence() {
        var seen = new HashSet<Key>();
        return diagnostic -> seen.add(new Key(diagnostic.ruleId(), diagnostic.span()));
    }

    private record Key(String ruleId, SourceSpan span) {}
}
