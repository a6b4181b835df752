package io.github.pierce.analyzer;

/**
 * Structural rules a file is checked against before any cell is interpreted.
 */
public enum ValidationRule {
    UNSUPPORTED_EXTENSION("UnsupportedExtension"),
    FILE_TOO_LARGE("FileTooLarge"),
    EMPTY_FILE("EmptyFile"),
    TOO_MANY_ROWS("TooManyRows"),
    TOO_MANY_COLUMNS("TooManyColumns"),
    DUPLICATE_COLUMN("DuplicateColumn"),
    /** Only raised when malformed rows are configured to reject the file */
    MALFORMED_ROW("MalformedRow");

    private final String ruleName;

    ValidationRule(String ruleName) {
        this.ruleName = ruleName;
    }

    /**
     * Returns the rule name reported to callers.
     */
    public String getRuleName() {
        return ruleName;
    }
}
