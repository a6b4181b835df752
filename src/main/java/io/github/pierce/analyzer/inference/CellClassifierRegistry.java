package io.github.pierce.analyzer.inference;

import io.github.pierce.analyzer.config.InferenceConfig;

import java.util.EnumSet;
import java.util.Set;

/**
 * Holds one classifier per column type, built from an inference configuration.
 */
public class CellClassifierRegistry {

    private final IntegerCellClassifier integerClassifier;
    private final FloatCellClassifier floatClassifier;
    private final BooleanCellClassifier booleanClassifier;
    private final DateCellClassifier dateClassifier;
    private final StringCellClassifier stringClassifier;

    public CellClassifierRegistry(InferenceConfig config) {
        InferenceConfig effective = config != null ? config : InferenceConfig.defaults();
        this.integerClassifier = new IntegerCellClassifier();
        this.floatClassifier = new FloatCellClassifier();
        this.booleanClassifier = new BooleanCellClassifier(effective.getBooleanTokens());
        this.dateClassifier = new DateCellClassifier(effective.getDatePatterns());
        this.stringClassifier = new StringCellClassifier();
    }

    /**
     * Returns the classifier for a column type.
     */
    public CellClassifier<?> forType(ColumnType type) {
        return switch (type) {
            case INTEGER -> integerClassifier;
            case FLOAT -> floatClassifier;
            case BOOLEAN -> booleanClassifier;
            case DATE -> dateClassifier;
            case STRING -> stringClassifier;
        };
    }

    public IntegerCellClassifier getInteger() {
        return integerClassifier;
    }

    public FloatCellClassifier getFloat() {
        return floatClassifier;
    }

    public BooleanCellClassifier getBoolean() {
        return booleanClassifier;
    }

    public DateCellClassifier getDate() {
        return dateClassifier;
    }

    /**
     * Returns every type the cell is a valid literal of. STRING is always included.
     */
    public Set<ColumnType> satisfiedTypes(String cell) {
        EnumSet<ColumnType> types = EnumSet.noneOf(ColumnType.class);
        for (ColumnType type : ColumnType.values()) {
            if (forType(type).accepts(cell)) {
                types.add(type);
            }
        }
        return types;
    }

    /**
     * Returns the most specific type the cell is a literal of.
     */
    public ColumnType classify(String cell) {
        for (ColumnType type : ColumnType.values()) {
            if (forType(type).accepts(cell)) {
                return type;
            }
        }
        return ColumnType.STRING;
    }
}
