package com.familyconnections.domain.scoring;

import com.familyconnections.domain.exception.InvalidConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Window within which two appointment or resignation dates count as
 * synchronized: either the same calendar month, or at most {@code days}
 * apart (inclusive).
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SynchronizationTolerance {

    public enum Mode {
        SAME_MONTH,
        DAYS
    }

    private static final SynchronizationTolerance SAME_MONTH = new SynchronizationTolerance(Mode.SAME_MONTH, 0);

    private final Mode mode;
    private final int days;

    public static SynchronizationTolerance sameMonth() {
        return SAME_MONTH;
    }

    public static SynchronizationTolerance days(int days) {
        if (days < 0) {
            throw new InvalidConfigurationException("synchronization tolerance must be >= 0 days, got " + days);
        }
        return new SynchronizationTolerance(Mode.DAYS, days);
    }

    /**
     * Parses {@code same-month}, {@code <n>d} or a bare day count.
     *
     * @throws InvalidConfigurationException if the value is not recognised
     */
    public static SynchronizationTolerance parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("synchronization tolerance must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("same-month") || v.equals("same_month") || v.equals("month")) {
            return SAME_MONTH;
        }
        String digits = v.endsWith("d") ? v.substring(0, v.length() - 1).trim() : v;
        try {
            return days(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                "synchronization tolerance must be 'same-month' or a day count like '14d', got '" + value + "'");
        }
    }

    public boolean within(LocalDate a, LocalDate b) {
        if (mode == Mode.SAME_MONTH) {
            return YearMonth.from(a).equals(YearMonth.from(b));
        }
        return Math.abs(ChronoUnit.DAYS.between(a, b)) <= days;
    }

    @Override
    public String toString() {
        return mode == Mode.SAME_MONTH ? "same-month" : days + "d";
    }
}
