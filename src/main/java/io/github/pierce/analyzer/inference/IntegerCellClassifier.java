package io.github.pierce.analyzer.inference;

import java.util.Optional;

/**
 * Recognizes 64-bit signed integer literals: an optional sign followed by ASCII digits.
 */
public class IntegerCellClassifier extends AbstractCellClassifier<Long> {

    private static final String MAX_MAGNITUDE = "9223372036854775807";
    private static final String MIN_MAGNITUDE = "9223372036854775808";

    public IntegerCellClassifier() {
        super(ColumnType.INTEGER);
    }

    @Override
    protected Optional<Long> doParse(String cell) {
        int start = 0;
        boolean negative = false;
        char first = cell.charAt(0);
        if (first == '+' || first == '-') {
            negative = first == '-';
            start = 1;
        }
        if (start == cell.length()) {
            return Optional.empty();
        }
        for (int i = start; i < cell.length(); i++) {
            if (!isAsciiDigit(cell.charAt(i))) {
                return Optional.empty();
            }
        }
        if (!fitsInLong(cell, start, negative)) {
            return Optional.empty();
        }
        return Optional.of(Long.parseLong(cell));
    }

    private static boolean fitsInLong(String cell, int start, boolean negative) {
        int firstSignificant = start;
        while (firstSignificant < cell.length() - 1 && cell.charAt(firstSignificant) == '0') {
            firstSignificant++;
        }
        String magnitude = cell.substring(firstSignificant);
        String limit = negative ? MIN_MAGNITUDE : MAX_MAGNITUDE;
        if (magnitude.length() != limit.length()) {
            return magnitude.length() < limit.length();
        }
        return magnitude.compareTo(limit) <= 0;
    }
}
