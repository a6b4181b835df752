package io.github.pierce.analyzer.stats;

import io.github.pierce.analyzer.config.InferenceConfig;
import io.github.pierce.analyzer.inference.CellClassifier;
import io.github.pierce.analyzer.inference.CellClassifierRegistry;
import io.github.pierce.analyzer.inference.CellNormalizer;
import io.github.pierce.analyzer.inference.ColumnType;
import io.github.pierce.analyzer.inference.DateValue;
import io.github.pierce.analyzer.parser.ParsedTable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Computes null count, distinct count and, for ordered types, min and max of a column.
 *
 * <p>Ordered types compare parsed values, so {@code 1.0} and {@code 1.00} are one
 * distinct FLOAT value and {@code 9} sorts below {@code 10}. BOOLEAN and STRING
 * columns compare the normalized cell text and carry no min/max.</p>
 */
public class ColumnStatisticsCollector {

    // bounds up to 10^18 are written without an exponent
    private static final int MAX_PLAIN_EXPONENT = 18;

    private final CellClassifierRegistry registry;
    private final boolean trimWhitespace;

    public ColumnStatisticsCollector(InferenceConfig config) {
        this(new CellClassifierRegistry(config), config != null ? config.isTrimWhitespace() : true);
    }

    public ColumnStatisticsCollector(CellClassifierRegistry registry, boolean trimWhitespace) {
        this.registry = registry;
        this.trimWhitespace = trimWhitespace;
    }

    /**
     * Profiles every column of the table over its well-formed rows.
     *
     * @param types inferred column types in header order
     */
    public List<ColumnProfile> collect(ParsedTable table, List<ColumnType> types, int sampleValueCount) {
        if (types.size() != table.getColumnCount()) {
            throw new IllegalArgumentException("Expected " + table.getColumnCount()
                    + " column types but got " + types.size());
        }
        List<ColumnProfile> profiles = new ArrayList<>(types.size());
        for (int column = 0; column < types.size(); column++) {
            profiles.add(collect(table.getHeader().get(column), types.get(column),
                    table.columnValues(column), sampleValueCount));
        }
        return profiles;
    }

    /**
     * Profiles one column. Every non-null cell must be a literal of {@code type}.
     */
    public ColumnProfile collect(String name, ColumnType type, List<String> rawCells, int sampleValueCount) {
        List<String> values = new ArrayList<>(rawCells.size());
        for (String raw : rawCells) {
            values.add(CellNormalizer.normalize(raw, trimWhitespace));
        }
        return switch (type) {
            case INTEGER -> ordered(name, type, values, registry.getInteger(),
                    Function.identity(), UnaryOperator.identity(), sampleValueCount);
            case FLOAT -> ordered(name, type, values, registry.getFloat(),
                    BigDecimal::stripTrailingZeros, ColumnStatisticsCollector::plainDecimal, sampleValueCount);
            case DATE -> dates(name, values, sampleValueCount);
            case BOOLEAN, STRING -> unordered(name, type, values, sampleValueCount);
        };
    }

    private <T extends Comparable<? super T>> ColumnProfile ordered(
            String name, ColumnType type, List<String> values, CellClassifier<T> classifier,
            Function<? super T, ?> distinctKey, UnaryOperator<T> boundForm, int sampleValueCount) {
        Tally<T> tally = new Tally<>(sampleValueCount);
        for (String cell : values) {
            if (cell == null) {
                tally.nulls++;
                continue;
            }
            T parsed = classifier.parse(cell).orElseThrow(() -> notALiteral(name, type, cell));
            tally.add(cell, parsed, distinctKey.apply(parsed));
        }
        if (tally.min == null) {
            return tally.toProfile(name, type, null, null);
        }
        return tally.toProfile(name, type, boundForm.apply(tally.min), boundForm.apply(tally.max));
    }

    /**
     * Drops trailing fractional zeros so equal bounds spelled differently ({@code 10.0}, {@code 1e1})
     * report the same value. Large exponents stay in scientific form.
     */
    static BigDecimal plainDecimal(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0 && stripped.scale() >= -MAX_PLAIN_EXPONENT) {
            return stripped.setScale(0);
        }
        return stripped;
    }

    private ColumnProfile dates(String name, List<String> values, int sampleValueCount) {
        Tally<DateValue> tally = new Tally<>(sampleValueCount);
        boolean anyTime = false;
        for (String cell : values) {
            if (cell == null) {
                tally.nulls++;
                continue;
            }
            DateValue parsed = registry.getDate().parse(cell)
                    .orElseThrow(() -> notALiteral(name, ColumnType.DATE, cell));
            anyTime |= parsed.timeOfDay();
            tally.add(cell, parsed, parsed.dateTime());
        }
        if (tally.min == null) {
            return tally.toProfile(name, ColumnType.DATE, null, null);
        }
        // date-only columns report plain dates
        Object min = anyTime ? tally.min.dateTime() : tally.min.date();
        Object max = anyTime ? tally.max.dateTime() : tally.max.date();
        return tally.toProfile(name, ColumnType.DATE, min, max);
    }

    private ColumnProfile unordered(String name, ColumnType type, List<String> values, int sampleValueCount) {
        Tally<String> tally = new Tally<>(sampleValueCount);
        for (String cell : values) {
            if (cell == null) {
                tally.nulls++;
            } else {
                tally.distinct.add(cell);
                tally.count(cell);
            }
        }
        return tally.toProfile(name, type, null, null);
    }

    private static IllegalArgumentException notALiteral(String name, ColumnType type, String cell) {
        return new IllegalArgumentException("Cell '" + cell + "' in column '" + name
                + "' is not a valid " + type.getDisplayName());
    }

    /**
     * Running counters for one column.
     */
    private static final class Tally<T extends Comparable<? super T>> {
        private final int sampleLimit;
        private final Set<Object> distinct = new HashSet<>();
        private final List<String> samples = new ArrayList<>();
        private int nulls;
        private int nonNulls;
        private T min;
        private T max;

        Tally(int sampleLimit) {
            this.sampleLimit = sampleLimit;
        }

        void add(String cell, T value, Object distinctKey) {
            distinct.add(distinctKey);
            if (min == null || value.compareTo(min) < 0) {
                min = value;
            }
            if (max == null || value.compareTo(max) > 0) {
                max = value;
            }
            count(cell);
        }

        void count(String cell) {
            nonNulls++;
            if (samples.size() < sampleLimit) {
                samples.add(cell);
            }
        }

        ColumnProfile toProfile(String name, ColumnType type, Object minValue, Object maxValue) {
            return new ColumnProfile(name, type, nulls, nonNulls, distinct.size(), minValue, maxValue, samples);
        }
    }
}
