package io.github.pierce.analyzer.inference;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import io.github.pierce.analyzer.config.InferenceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes dates matching one of an ordered list of patterns; the first matching
 * pattern decides the value.
 *
 * <p>Patterns use {@link DateTimeFormatter} syntax and are resolved strictly, so
 * {@code 2024-02-30} is not a date. A pattern must yield a full calendar date; a
 * time of day is optional. Compiled formatters are shared across classifiers through
 * a bounded cache.</p>
 */
public class DateCellClassifier extends AbstractCellClassifier<DateValue> {

    private static final Logger LOG = LoggerFactory.getLogger(DateCellClassifier.class);

    private static final LoadingCache<String, Optional<DateTimeFormatter>> FORMATTERS = CacheBuilder.newBuilder()
            .maximumSize(256)
            .build(new CacheLoader<String, Optional<DateTimeFormatter>>() {
                @Override
                public Optional<DateTimeFormatter> load(String pattern) {
                    return compile(pattern);
                }
            });

    private final List<DateTimeFormatter> formatters;

    public DateCellClassifier() {
        this(InferenceConfig.DEFAULT_DATE_PATTERNS);
    }

    public DateCellClassifier(List<String> patterns) {
        super(ColumnType.DATE);
        List<DateTimeFormatter> compiled = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            FORMATTERS.getUnchecked(pattern).ifPresent(compiled::add);
        }
        this.formatters = List.copyOf(compiled);
    }

    @Override
    protected Optional<DateValue> doParse(String cell) {
        for (DateTimeFormatter formatter : formatters) {
            Optional<DateValue> value = tryParse(formatter, cell);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<DateValue> tryParse(DateTimeFormatter formatter, String cell) {
        ParsePosition position = new ParsePosition(0);
        if (formatter.parseUnresolved(cell, position) == null
                || position.getErrorIndex() >= 0
                || position.getIndex() != cell.length()) {
            return Optional.empty();
        }
        TemporalAccessor parsed;
        try {
            parsed = formatter.parse(cell);
        } catch (DateTimeParseException e) {
            // shape matched but the fields do not form a valid date, e.g. February 30th
            return Optional.empty();
        }
        LocalDate date = parsed.query(TemporalQueries.localDate());
        if (date == null) {
            return Optional.empty();
        }
        LocalTime time = parsed.query(TemporalQueries.localTime());
        return Optional.of(time == null ? DateValue.ofDate(date) : DateValue.ofDateTime(date.atTime(time)));
    }

    private static Optional<DateTimeFormatter> compile(String pattern) {
        try {
            DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern);
            if (usesYearOfEra(pattern)) {
                // strict resolution needs an era to turn year-of-era into a year
                builder.parseDefaulting(ChronoField.ERA, 1);
            }
            return Optional.of(builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring invalid date pattern '{}': {}", pattern, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean usesYearOfEra(String pattern) {
        boolean quoted = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == 'y') {
                return true;
            }
        }
        return false;
    }
}
