package org.pyta.lint;

/**
 * Unchecked carrier for {@link AnalysisError.MalformedInput}.
 *
 * Thrown by the syntax tree builder, the parse adapter and the control-flow graph builder
 * when their input violates a structural precondition.
 */
public final class MalformedInputException extends RuntimeException {
    private final AnalysisError.MalformedInput error;

    public MalformedInputException(AnalysisError.MalformedInput error) {
        super(error.message());
        this.error = error;
    }

    public MalformedInputException(AnalysisError.MalformedInput error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public AnalysisError.MalformedInput error() {
        return error;
    }
}
