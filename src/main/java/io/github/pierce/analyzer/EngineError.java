package io.github.pierce.analyzer;

/**
 * The single structured failure an analysis can end with.
 *
 * <p>The set of variants is closed: callers can map every variant to a response
 * without inspecting engine internals.</p>
 */
public sealed interface EngineError permits EngineError.EncodingError, EngineError.Rejected, EngineError.NoValidRows {

    /**
     * Returns a stable name for the error kind.
     */
    String code();

    /**
     * Returns a human-readable description of what was wrong with the input.
     */
    String detail();

    /**
     * The bytes could not be decoded, or the requested encoding is not supported.
     */
    record EncodingError(String detail) implements EngineError {
        @Override
        public String code() {
            return "EncodingError";
        }
    }

    /**
     * A structural rule rejected the file. Re-running with the same input and
     * limits always yields the same rejection.
     */
    record Rejected(ValidationRule rule, String detail) implements EngineError, ValidationOutcome {
        @Override
        public String code() {
            return rule.getRuleName();
        }

        @Override
        public boolean isAccepted() {
            return false;
        }
    }

    /**
     * The file parsed, but every data row had the wrong number of cells.
     */
    record NoValidRows(int malformedRowCount, String detail) implements EngineError {
        @Override
        public String code() {
            return "NoValidRows";
        }
    }
}
