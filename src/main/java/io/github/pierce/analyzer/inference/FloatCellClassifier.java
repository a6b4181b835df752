package io.github.pierce.analyzer.inference;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes decimal and scientific-notation literals such as {@code 9.5}, {@code -.25}
 * or {@code 6.02e23}. Values are kept as exact {@link BigDecimal}s.
 *
 * <p>{@code NaN} and {@code Infinity} are not numeric literals here.</p>
 */
public class FloatCellClassifier extends AbstractCellClassifier<BigDecimal> {

    private static final Pattern DECIMAL_LITERAL =
            Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE]([+-]?\\d+))?");

    // keeps the exponent inside BigDecimal's int scale
    private static final int MAX_EXPONENT_DIGITS = 9;

    public FloatCellClassifier() {
        super(ColumnType.FLOAT);
    }

    @Override
    protected Optional<BigDecimal> doParse(String cell) {
        Matcher matcher = DECIMAL_LITERAL.matcher(cell);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String exponent = matcher.group(1);
        if (exponent != null && significantDigits(exponent) > MAX_EXPONENT_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(cell));
    }

    private static int significantDigits(String exponent) {
        int i = 0;
        if (exponent.charAt(0) == '+' || exponent.charAt(0) == '-') {
            i++;
        }
        while (i < exponent.length() - 1 && exponent.charAt(i) == '0') {
            i++;
        }
        return exponent.length() - i;
    }
}
