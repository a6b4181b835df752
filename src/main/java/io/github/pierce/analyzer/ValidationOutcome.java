package io.github.pierce.analyzer;

/**
 * Result of structural validation: either {@link Accepted} or {@link EngineError.Rejected}.
 */
public sealed interface ValidationOutcome permits ValidationOutcome.Accepted, EngineError.Rejected {

    boolean isAccepted();

    static ValidationOutcome accepted() {
        return Accepted.INSTANCE;
    }

    static ValidationOutcome rejected(ValidationRule rule, String detail) {
        return new EngineError.Rejected(rule, detail);
    }

    /**
     * The file passed every structural rule.
     */
    final class Accepted implements ValidationOutcome {

        private static final Accepted INSTANCE = new Accepted();

        private Accepted() {
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public String toString() {
            return "Accepted";
        }
    }
}
