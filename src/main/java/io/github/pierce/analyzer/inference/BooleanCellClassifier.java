package io.github.pierce.analyzer.inference;

import io.github.pierce.analyzer.config.InferenceConfig;
import io.github.pierce.analyzer.config.InferenceConfig.BooleanTokenPair;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Recognizes boolean tokens from a configured set of true/false pairs, ignoring case.
 *
 * <p>When a token appears in more than one pair the first pair decides its value.</p>
 */
public class BooleanCellClassifier extends AbstractCellClassifier<Boolean> {

    private final Map<String, Boolean> tokens;

    public BooleanCellClassifier() {
        this(InferenceConfig.DEFAULT_BOOLEAN_TOKENS);
    }

    public BooleanCellClassifier(List<BooleanTokenPair> pairs) {
        super(ColumnType.BOOLEAN);
        Map<String, Boolean> lookup = new HashMap<>();
        for (BooleanTokenPair pair : pairs) {
            lookup.putIfAbsent(pair.trueToken(), Boolean.TRUE);
            lookup.putIfAbsent(pair.falseToken(), Boolean.FALSE);
        }
        this.tokens = Map.copyOf(lookup);
    }

    @Override
    protected Optional<Boolean> doParse(String cell) {
        return Optional.ofNullable(tokens.get(cell.toLowerCase(Locale.ROOT)));
    }
}
