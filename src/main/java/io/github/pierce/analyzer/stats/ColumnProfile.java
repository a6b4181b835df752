package io.github.pierce.analyzer.stats;

import io.github.pierce.analyzer.inference.ColumnType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Inferred type and summary statistics of one column.
 *
 * <p>Min and max are present only for ordered types and hold the parsed value:
 * {@link Long} for INTEGER, {@link java.math.BigDecimal} for FLOAT and
 * {@link java.time.LocalDate} or {@link java.time.LocalDateTime} for DATE.</p>
 */
public final class ColumnProfile {

    private final String name;
    private final ColumnType type;
    private final int nullCount;
    private final int nonNullCount;
    private final int distinctCount;
    private final Object min;
    private final Object max;
    private final List<String> sampleValues;

    public ColumnProfile(String name, ColumnType type, int nullCount, int nonNullCount, int distinctCount,
                         Object min, Object max, List<String> sampleValues) {
        if (name == null || type == null) {
            throw new IllegalArgumentException("Column name and type are required");
        }
        if ((min != null || max != null) && !type.isOrdered()) {
            throw new IllegalArgumentException("Column type " + type.getDisplayName() + " has no min/max");
        }
        if ((min == null) != (max == null)) {
            throw new IllegalArgumentException("Min and max must be present together for column '" + name + "'");
        }
        if (distinctCount > nonNullCount) {
            throw new IllegalArgumentException("Distinct count " + distinctCount
                    + " exceeds non-null count " + nonNullCount + " for column '" + name + "'");
        }
        this.name = name;
        this.type = type;
        this.nullCount = nullCount;
        this.nonNullCount = nonNullCount;
        this.distinctCount = distinctCount;
        this.min = min;
        this.max = max;
        this.sampleValues = List.copyOf(sampleValues);
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public int getNullCount() {
        return nullCount;
    }

    public int getNonNullCount() {
        return nonNullCount;
    }

    /**
     * Null plus non-null cells; equals the report's row count.
     */
    public int getRowCount() {
        return nullCount + nonNullCount;
    }

    public int getDistinctCount() {
        return distinctCount;
    }

    /**
     * Distinct values over all rows of the column, 0 for an empty column.
     */
    public double getDistinctRatio() {
        int rows = getRowCount();
        return rows == 0 ? 0.0 : (double) distinctCount / rows;
    }

    public Optional<Object> getMin() {
        return Optional.ofNullable(min);
    }

    public Optional<Object> getMax() {
        return Optional.ofNullable(max);
    }

    /**
     * The first non-null values of the column, as text.
     */
    public List<String> getSampleValues() {
        return sampleValues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnProfile that)) return false;
        return nullCount == that.nullCount
                && nonNullCount == that.nonNullCount
                && distinctCount == that.distinctCount
                && name.equals(that.name)
                && type == that.type
                && Objects.equals(min, that.min)
                && Objects.equals(max, that.max)
                && sampleValues.equals(that.sampleValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nullCount, nonNullCount, distinctCount, min, max, sampleValues);
    }

    @Override
    public String toString() {
        return "ColumnProfile{name='" + name + "', type=" + type.getDisplayName()
                + ", nulls=" + nullCount + ", distinct=" + distinctCount
                + (min != null ? ", min=" + min + ", max=" + max : "") + "}";
    }
}
