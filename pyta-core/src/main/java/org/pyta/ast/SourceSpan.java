package org.pyta.ast;

import java.util.Comparator;

/// Source region of a node. Lines are 1-based, columns 0-based, as in Python's ast.
public record SourceSpan(int startLine,
                         int startColumn,
                         int endLine,
                         int endColumn) implements Comparable<SourceSpan> {
    public static final SourceSpan FILE_START = new SourceSpan(1, 0, 1, 0);

    private static final Comparator<SourceSpan> ORDER = Comparator.comparingInt(SourceSpan::startLine)
                                                                  .thenComparingInt(SourceSpan::startColumn)
                                                                  .thenComparingInt(SourceSpan::endLine)
                                                                  .thenComparingInt(SourceSpan::endColumn);

    public SourceSpan {
        if (startLine < 1 || endLine < startLine || (endLine == startLine && endColumn < startColumn)) {
            throw new IllegalArgumentException("Invalid span " + startLine + ":" + startColumn + "-" + endLine + ":"
                                               + endColumn);
        }
    }

    public static SourceSpan sourceSpan(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceSpan(startLine, startColumn, endLine, endColumn);
    }

    /// Single-line span.
    public static SourceSpan line(int line, int startColumn, int endColumn) {
        return new SourceSpan(line, startColumn, line, endColumn);
    }

    /// Smallest span covering both this span and {@code other}.
    public SourceSpan union(SourceSpan other) {
        var start = compareStart(other) <= 0
                    ? this
                    : other;
        var endsLater = endLine > other.endLine || (endLine == other.endLine && endColumn >= other.endColumn);
        var end = endsLater
                  ? this
                  : other;
        return new SourceSpan(start.startLine, start.startColumn, end.endLine, end.endColumn);
    }

    public boolean contains(SourceSpan other) {
        return compareStart(other) <= 0 && (endLine > other.endLine
                                            || (endLine == other.endLine && endColumn >= other.endColumn));
    }

    /// Compare start positions only.
    public int compareStart(SourceSpan other) {
        return startLine != other.startLine
               ? Integer.compare(startLine, other.startLine)
               : Integer.compare(startColumn, other.startColumn);
    }

    @Override
    public int compareTo(SourceSpan other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
