package io.github.pierce.analyzer;

/**
 * Base exception for analysis failures. Always carries the {@link EngineError}
 * that describes the failure to the caller.
 */
public class AnalysisException extends RuntimeException {

    private final EngineError error;

    public AnalysisException(EngineError error) {
        super(formatMessage(error));
        this.error = error;
    }

    public AnalysisException(EngineError error, Throwable cause) {
        super(formatMessage(error), cause);
        this.error = error;
    }

    private static String formatMessage(EngineError error) {
        if (error == null) {
            throw new IllegalArgumentException("Engine error cannot be null");
        }
        return error.code() + ": " + error.detail();
    }

    /**
     * Returns the structured error.
     */
    public EngineError getError() {
        return error;
    }
}
