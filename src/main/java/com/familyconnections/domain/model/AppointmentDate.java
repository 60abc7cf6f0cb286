package com.familyconnections.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Start of a tenure as far as the registry knows it.
 *
 * <p>Three cases are kept apart:
 * <ul>
 *   <li>{@link Kind#EXACT}: the appointment date is known</li>
 *   <li>{@link Kind#NOT_LATER_THAN}: only an upper bound is known
 *       (registry "appointed before" field); the true date may be any
 *       earlier day</li>
 *   <li>{@link Kind#UNKNOWN}: nothing is known</li>
 * </ul>
 *
 * <p>Collapsing these into a single {@link LocalDate} would overstate precision
 * in overlap and synchronization checks.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AppointmentDate {

    private static final AppointmentDate UNKNOWN = new AppointmentDate(Kind.UNKNOWN, null);

    public enum Kind {
        EXACT,
        NOT_LATER_THAN,
        UNKNOWN
    }

    private final Kind kind;
    private final LocalDate date;

    public static AppointmentDate exact(LocalDate date) {
        return new AppointmentDate(Kind.EXACT, Objects.requireNonNull(date, "date"));
    }

    public static AppointmentDate notLaterThan(LocalDate bound) {
        return new AppointmentDate(Kind.NOT_LATER_THAN, Objects.requireNonNull(bound, "bound"));
    }

    public static AppointmentDate unknown() {
        return UNKNOWN;
    }

    public boolean isExact() {
        return kind == Kind.EXACT;
    }

    /**
     * Latest day the appointment can have happened on. For an upper bound this
     * is the bound itself, which yields the shortest possible tenure.
     */
    public Optional<LocalDate> latestPossible() {
        return Optional.ofNullable(date);
    }

    @Override
    public String toString() {
        switch (kind) {
            case EXACT:
                return date.toString();
            case NOT_LATER_THAN:
                return "before " + date;
            default:
                return "unknown";
        }
    }
}
