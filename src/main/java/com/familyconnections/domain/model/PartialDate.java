package com.familyconnections.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Date known to at least month precision.
 *
 * <p>Registries often publish only the month and year of birth; the day is
 * then absent and arithmetic falls back to whole months so no precision is
 * invented.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class PartialDate {

    public enum Precision {
        MONTH,
        DAY
    }

    private final YearMonth yearMonth;

    /**
     * Day of month, or null when only the month is known.
     */
    private final Integer day;

    public static PartialDate of(LocalDate date) {
        Objects.requireNonNull(date, "date");
        return new PartialDate(YearMonth.from(date), date.getDayOfMonth());
    }

    public static PartialDate of(YearMonth yearMonth) {
        Objects.requireNonNull(yearMonth, "yearMonth");
        return new PartialDate(yearMonth, null);
    }

    public Precision getPrecision() {
        return day == null ? Precision.MONTH : Precision.DAY;
    }

    /**
     * Absolute distance to another date in fractional years, computed at the
     * coarser of the two precisions. Whole calendar years count exactly, so
     * two birthdays exactly N years apart are {@code N.0} years apart whatever
     * leap days lie between them.
     */
    public double yearsBetween(PartialDate other) {
        if (getPrecision() == Precision.DAY && other.getPrecision() == Precision.DAY) {
            LocalDate a = toLocalDate();
            LocalDate b = other.toLocalDate();
            LocalDate earlier = a.isBefore(b) ? a : b;
            LocalDate later = a.isBefore(b) ? b : a;

            long years = ChronoUnit.YEARS.between(earlier, later);
            LocalDate anniversary = earlier.plusYears(years);
            long remainder = ChronoUnit.DAYS.between(anniversary, later);
            long yearLength = ChronoUnit.DAYS.between(anniversary, anniversary.plusYears(1));
            return years + (double) remainder / yearLength;
        }
        long months = Math.abs(ChronoUnit.MONTHS.between(yearMonth, other.yearMonth));
        return months / 12.0;
    }

    private LocalDate toLocalDate() {
        return yearMonth.atDay(day);
    }

    @Override
    public String toString() {
        return day == null ? yearMonth.toString() : toLocalDate().toString();
    }
}
