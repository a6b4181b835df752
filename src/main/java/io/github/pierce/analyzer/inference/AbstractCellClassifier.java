package io.github.pierce.analyzer.inference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Base class for cell classifiers providing null guarding and a safety net around parsing.
 *
 * @param <T> the parsed value type
 */
public abstract class AbstractCellClassifier<T> implements CellClassifier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractCellClassifier.class);

    private final ColumnType columnType;

    protected AbstractCellClassifier(ColumnType columnType) {
        this.columnType = columnType;
    }

    @Override
    public final Optional<T> parse(String cell) {
        if (cell == null || cell.isEmpty()) {
            return Optional.empty();
        }
        try {
            return doParse(cell);
        } catch (RuntimeException e) {
            // a classifier bug must not abort inference; the cell simply does not qualify
            LOG.warn("{} classifier failed on '{}'", columnType.getDisplayName(), truncate(cell), e);
            return Optional.empty();
        }
    }

    /**
     * Performs the actual classification. Subclasses should not rely on exceptions
     * to reject a cell.
     */
    protected abstract Optional<T> doParse(String cell);

    @Override
    public ColumnType getColumnType() {
        return columnType;
    }

    protected static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static String truncate(String cell) {
        return cell.length() > 50 ? cell.substring(0, 47) + "..." : cell;
    }
}
