package io.github.pierce.analyzer.inference;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A parsed date cell. Date-only values sit at the start of their day.
 *
 * @param dateTime  the instant on the local timeline used for ordering and equality
 * @param timeOfDay whether the matching pattern carried a time of day
 */
public record DateValue(LocalDateTime dateTime, boolean timeOfDay) implements Comparable<DateValue> {

    public static DateValue ofDate(LocalDate date) {
        return new DateValue(date.atStartOfDay(), false);
    }

    public static DateValue ofDateTime(LocalDateTime dateTime) {
        return new DateValue(dateTime, true);
    }

    public LocalDate date() {
        return dateTime.toLocalDate();
    }

    @Override
    public int compareTo(DateValue other) {
        return dateTime.compareTo(other.dateTime);
    }
}
