package io.github.pierce.analyzer.inference;

import java.util.Optional;

/**
 * Decides whether a single cell is a valid literal of one column type.
 *
 * <p>Classification is total: implementations return an empty result for cells they
 * reject and never throw, so a column can be narrowed without exception-driven flow.</p>
 *
 * @param <T> the parsed value type
 */
public interface CellClassifier<T> {

    /**
     * Parses a non-null, already normalized cell.
     *
     * @param cell the cell text, never empty
     * @return the parsed value, or empty when the cell is not a literal of this type
     */
    Optional<T> parse(String cell);

    /**
     * Returns the column type this classifier recognizes.
     */
    ColumnType getColumnType();

    /**
     * Returns true when the cell is a literal of this type.
     */
    default boolean accepts(String cell) {
        return parse(cell).isPresent();
    }
}
