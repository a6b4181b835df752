package io.github.pierce.analyzer.inference;

/**
 * Semantic type of a column, declared from the most to the least specific.
 *
 * <p>A column is assigned the first constant, in declaration order, that every
 * non-null cell of the column satisfies. {@link #STRING} is satisfied by every cell.</p>
 */
public enum ColumnType {
    INTEGER("Integer"),
    FLOAT("Float"),
    BOOLEAN("Boolean"),
    DATE("Date"),
    STRING("String");

    private final String displayName;

    ColumnType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns true when values of this type have a natural ordering, so min and max apply.
     */
    public boolean isOrdered() {
        return switch (this) {
            case INTEGER, FLOAT, DATE -> true;
            case BOOLEAN, STRING -> false;
        };
    }

    /**
     * Returns true when this type is narrower than {@code other}.
     */
    public boolean isMoreSpecificThan(ColumnType other) {
        return ordinal() < other.ordinal();
    }
}
