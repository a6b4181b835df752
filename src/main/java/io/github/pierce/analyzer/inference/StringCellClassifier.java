package io.github.pierce.analyzer.inference;

import java.util.Optional;

/**
 * Accepts every cell. This is the universal fallback of type inference.
 */
public class StringCellClassifier extends AbstractCellClassifier<String> {

    public StringCellClassifier() {
        super(ColumnType.STRING);
    }

    @Override
    protected Optional<String> doParse(String cell) {
        return Optional.of(cell);
    }
}
