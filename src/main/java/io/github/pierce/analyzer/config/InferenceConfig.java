package io.github.pierce.analyzer.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CSV dialect and type inference settings for one analysis.
 *
 * <p>This class uses the builder pattern for configuration and is immutable
 * once constructed. It is passed explicitly into every analysis so that
 * concurrent analyses never share settings.</p>
 */
public final class InferenceConfig {

    public static final char DEFAULT_DELIMITER = ',';
    public static final char DEFAULT_QUOTE_CHAR = '"';

    public static final List<BooleanTokenPair> DEFAULT_BOOLEAN_TOKENS = List.of(
            new BooleanTokenPair("true", "false"),
            new BooleanTokenPair("yes", "no"),
            new BooleanTokenPair("1", "0")
    );

    public static final List<String> DEFAULT_DATE_PATTERNS = List.of(
            "yyyy-MM-dd",
            "yyyy-MM-dd'T'HH:mm:ss",
            "yyyy-MM-dd HH:mm:ss",
            "yyyy/MM/dd",
            "MM/dd/yyyy",
            "dd.MM.yyyy"
    );

    // Dialect
    private final char delimiter;
    private final char quoteChar;

    // Cell handling
    private final boolean trimWhitespace;
    private final MalformedRowPolicy malformedRowPolicy;

    // Type vocabulary
    private final List<BooleanTokenPair> booleanTokens;
    private final List<String> datePatterns;

    private InferenceConfig(Builder builder) {
        if (builder.delimiter == builder.quoteChar) {
            throw new IllegalArgumentException("Delimiter and quote character must differ: '" + builder.delimiter + "'");
        }
        if (builder.delimiter == '\n' || builder.delimiter == '\r'
                || builder.quoteChar == '\n' || builder.quoteChar == '\r') {
            throw new IllegalArgumentException("Line break characters cannot be used as delimiter or quote");
        }
        this.delimiter = builder.delimiter;
        this.quoteChar = builder.quoteChar;
        this.trimWhitespace = builder.trimWhitespace;
        this.malformedRowPolicy = builder.malformedRowPolicy;
        this.booleanTokens = List.copyOf(builder.booleanTokens);
        this.datePatterns = List.copyOf(builder.datePatterns);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration: comma delimited, double-quote quoting,
     * trimmed cells, malformed rows excluded.
     */
    public static InferenceConfig defaults() {
        return builder().build();
    }

    public char getDelimiter() {
        return delimiter;
    }

    public char getQuoteChar() {
        return quoteChar;
    }

    public boolean isTrimWhitespace() {
        return trimWhitespace;
    }

    public MalformedRowPolicy getMalformedRowPolicy() {
        return malformedRowPolicy;
    }

    public List<BooleanTokenPair> getBooleanTokens() {
        return booleanTokens;
    }

    /**
     * Date patterns in {@link java.time.format.DateTimeFormatter} syntax, tried in order.
     */
    public List<String> getDatePatterns() {
        return datePatterns;
    }

    public Builder toBuilder() {
        return builder()
                .delimiter(delimiter)
                .quoteChar(quoteChar)
                .trimWhitespace(trimWhitespace)
                .malformedRowPolicy(malformedRowPolicy)
                .booleanTokens(booleanTokens)
                .datePatterns(datePatterns);
    }

    @Override
    public String toString() {
        return "InferenceConfig{delimiter='" + delimiter + "', quoteChar='" + quoteChar
                + "', trimWhitespace=" + trimWhitespace + ", malformedRowPolicy=" + malformedRowPolicy
                + ", booleanTokens=" + booleanTokens + ", datePatterns=" + datePatterns + "}";
    }

    // Types

    public enum MalformedRowPolicy {
        /** Count malformed rows and leave them out of inference and statistics */
        EXCLUDE,
        /** Reject the whole file on the first malformed row */
        REJECT
    }

    /**
     * A pair of tokens spelling true and false. Matching is case-insensitive.
     */
    public record BooleanTokenPair(String trueToken, String falseToken) {
        public BooleanTokenPair {
            if (trueToken == null || trueToken.isBlank() || falseToken == null || falseToken.isBlank()) {
                throw new IllegalArgumentException("Boolean tokens cannot be blank");
            }
            trueToken = trueToken.trim().toLowerCase(Locale.ROOT);
            falseToken = falseToken.trim().toLowerCase(Locale.ROOT);
            if (trueToken.equals(falseToken)) {
                throw new IllegalArgumentException("True and false tokens must differ: " + trueToken);
            }
        }
    }

    // Builder

    public static final class Builder {
        private char delimiter = DEFAULT_DELIMITER;
        private char quoteChar = DEFAULT_QUOTE_CHAR;
        private boolean trimWhitespace = true;
        private MalformedRowPolicy malformedRowPolicy = MalformedRowPolicy.EXCLUDE;
        private List<BooleanTokenPair> booleanTokens = new ArrayList<>(DEFAULT_BOOLEAN_TOKENS);
        private List<String> datePatterns = new ArrayList<>(DEFAULT_DATE_PATTERNS);

        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder quoteChar(char quoteChar) {
            this.quoteChar = quoteChar;
            return this;
        }

        public Builder trimWhitespace(boolean trim) {
            this.trimWhitespace = trim;
            return this;
        }

        public Builder malformedRowPolicy(MalformedRowPolicy policy) {
            if (policy == null) {
                throw new IllegalArgumentException("Malformed row policy cannot be null");
            }
            this.malformedRowPolicy = policy;
            return this;
        }

        public Builder booleanTokens(List<BooleanTokenPair> tokens) {
            this.booleanTokens = new ArrayList<>(tokens);
            return this;
        }

        public Builder addBooleanTokens(String trueToken, String falseToken) {
            this.booleanTokens.add(new BooleanTokenPair(trueToken, falseToken));
            return this;
        }

        public Builder datePatterns(List<String> patterns) {
            this.datePatterns = new ArrayList<>(patterns);
            return this;
        }

        public Builder addDatePattern(String pattern) {
            this.datePatterns.add(pattern);
            return this;
        }

        public InferenceConfig build() {
            return new InferenceConfig(this);
        }
    }
}
