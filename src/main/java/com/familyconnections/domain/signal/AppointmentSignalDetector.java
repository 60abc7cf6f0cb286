package com.familyconnections.domain.signal;

import com.familyconnections.domain.model.DetectorResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.NormalizedRole;
import com.familyconnections.domain.model.SignalCategory;
import com.familyconnections.domain.scoring.ScoringConfiguration;
import com.familyconnections.domain.scoring.SynchronizationTolerance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Evidence from the two officers' appointment histories.
 *
 * <p><strong>Shared companies:</strong> each company number held by both
 * officers scores once, as concurrent service when any pair of tenures
 * overlaps by at least one day, otherwise as a historical shared company.
 *
 * <p><strong>Synchronized timing:</strong> across all companies, every
 * appointment date is compared with every appointment date, every resignation
 * with every resignation, and every resignation with the other officer's
 * appointments (succession). Each distinct event within the configured
 * tolerance scores once.
 *
 * <p><strong>Imprecise appointment dates:</strong> an "appointed before" value
 * is only an upper bound. Overlap uses the bound as the start (the shortest
 * tenure consistent with the data); a resigned role with no appointment date
 * starts, at the latest, on its resignation day. Synchronization ignores
 * bounded and unknown appointment dates entirely.
 *
 * <p>Multiple roles held by one officer at one company are reported as
 * context when the detector scores, but earn no points on their own.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Slf4j
@RequiredArgsConstructor
public class AppointmentSignalDetector implements SignalDetector {

    private final ScoringConfiguration config;

    @Override
    public SignalCategory category() {
        return SignalCategory.APPOINTMENT;
    }

    @Override
    public DetectorResult detect(NormalizedOfficer first, NormalizedOfficer second) {
        double points = 0.0;
        List<String> reasons = new ArrayList<>();

        Map<String, List<NormalizedRole>> firstByCompany = rolesByCompany(first);
        Map<String, List<NormalizedRole>> secondByCompany = rolesByCompany(second);

        Set<String> sharedCompanies = new TreeSet<>(firstByCompany.keySet());
        sharedCompanies.retainAll(secondByCompany.keySet());

        for (String companyNumber : sharedCompanies) {
            List<NormalizedRole> firstRoles = firstByCompany.get(companyNumber);
            List<NormalizedRole> secondRoles = secondByCompany.get(companyNumber);
            String company = companyLabel(companyNumber, firstRoles, secondRoles);
            if (anyOverlap(firstRoles, secondRoles)) {
                points += config.getConcurrentServicePoints();
                reasons.add("Concurrent service at company " + company);
            } else {
                points += config.getHistoricalSharedCompanyPoints();
                reasons.add("Historical shared company " + company + " (tenures do not overlap)");
            }
        }

        Set<String> synchronizedEvents = synchronizedEvents(first, second);
        points += config.getSynchronizedTimingPoints() * synchronizedEvents.size();
        reasons.addAll(synchronizedEvents);

        double weighted = points * config.weightFor(SignalCategory.APPOINTMENT);
        if (weighted <= 0) {
            return DetectorResult.none();
        }

        reasons.addAll(multipleRoleNotes(first, firstByCompany));
        reasons.addAll(multipleRoleNotes(second, secondByCompany));

        log.debug("Appointment signal {} vs {}: {} shared companies, {} synchronized events, {} points",
            first.label(), second.label(), sharedCompanies.size(), synchronizedEvents.size(), weighted);
        return DetectorResult.of(weighted, reasons);
    }

    private static Map<String, List<NormalizedRole>> rolesByCompany(NormalizedOfficer officer) {
        Map<String, List<NormalizedRole>> byCompany = new LinkedHashMap<>();
        for (NormalizedRole role : officer.getRoles()) {
            if (!role.getCompanyNumber().isEmpty()) {
                byCompany.computeIfAbsent(role.getCompanyNumber(), k -> new ArrayList<>()).add(role);
            }
        }
        return byCompany;
    }

    private static boolean anyOverlap(List<NormalizedRole> firstRoles, List<NormalizedRole> secondRoles) {
        for (NormalizedRole a : firstRoles) {
            for (NormalizedRole b : secondRoles) {
                if (overlaps(a, b)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Two active roles overlap today whatever their start. Otherwise the
     * inclusive intervals must share at least one day, each starting at its
     * latest possible start.
     */
    static boolean overlaps(NormalizedRole a, NormalizedRole b) {
        if (a.isActive() && b.isActive()) {
            return true;
        }
        Optional<LocalDate> startA = latestStart(a);
        Optional<LocalDate> startB = latestStart(b);
        if (startA.isEmpty() || startB.isEmpty()) {
            return false;
        }
        LocalDate endA = a.resignation().orElse(LocalDate.MAX);
        LocalDate endB = b.resignation().orElse(LocalDate.MAX);
        if (startA.get().isAfter(endA) || startB.get().isAfter(endB)) {
            return false;
        }
        LocalDate latestStart = startA.get().isAfter(startB.get()) ? startA.get() : startB.get();
        LocalDate earliestEnd = endA.isBefore(endB) ? endA : endB;
        return !latestStart.isAfter(earliestEnd);
    }

    /**
     * Known or bounded appointment date; failing that, a resigned officer held
     * office at least on the resignation day. Active roles with no appointment
     * date have no known start.
     */
    private static Optional<LocalDate> latestStart(NormalizedRole role) {
        Optional<LocalDate> appointed = role.getAppointment().latestPossible();
        return appointed.isPresent() ? appointed : role.resignation();
    }

    private Set<String> synchronizedEvents(NormalizedOfficer first, NormalizedOfficer second) {
        SynchronizationTolerance tolerance = config.getSynchronizationTolerance();
        Set<String> events = new TreeSet<>();

        for (NormalizedRole a : first.getRoles()) {
            for (NormalizedRole b : second.getRoles()) {
                if (a.getAppointment().isExact() && b.getAppointment().isExact()
                        && tolerance.within(a.getAppointment().getDate(), b.getAppointment().getDate())) {
                    events.add("Synchronized appointments: "
                        + orderedEvents(event(a.getAppointment().getDate(), a), event(b.getAppointment().getDate(), b)));
                }
                if (!a.isActive() && !b.isActive() && tolerance.within(a.getResignedOn(), b.getResignedOn())) {
                    events.add("Synchronized resignations: "
                        + orderedEvents(event(a.getResignedOn(), a), event(b.getResignedOn(), b)));
                }
                succession(a, b, tolerance).ifPresent(events::add);
                succession(b, a, tolerance).ifPresent(events::add);
            }
        }
        return events;
    }

    /**
     * One officer resigns while the other is appointed.
     */
    private static Optional<String> succession(NormalizedRole resigning, NormalizedRole appointed,
                                               SynchronizationTolerance tolerance) {
        if (resigning.isActive() || !appointed.getAppointment().isExact()) {
            return Optional.empty();
        }
        LocalDate resignedOn = resigning.getResignedOn();
        LocalDate appointedOn = appointed.getAppointment().getDate();
        if (!tolerance.within(resignedOn, appointedOn)) {
            return Optional.empty();
        }
        return Optional.of("Synchronized succession: resignation on " + event(resignedOn, resigning)
            + " and appointment on " + event(appointedOn, appointed));
    }

    private static String event(LocalDate date, NormalizedRole role) {
        return date + " at " + role.getCompanyNumber();
    }

    private static String orderedEvents(String a, String b) {
        return a.compareTo(b) <= 0 ? a + " and " + b : b + " and " + a;
    }

    /**
     * Company number with the alphabetically first name either side knows.
     */
    private static String companyLabel(String companyNumber, List<NormalizedRole> firstRoles,
                                       List<NormalizedRole> secondRoles) {
        return Stream.concat(firstRoles.stream(), secondRoles.stream())
            .map(NormalizedRole::getCompanyName)
            .filter(Objects::nonNull)
            .sorted()
            .findFirst()
            .map(name -> companyNumber + " (" + name + ")")
            .orElse(companyNumber);
    }

    private static List<String> multipleRoleNotes(NormalizedOfficer officer,
                                                  Map<String, List<NormalizedRole>> byCompany) {
        List<String> notes = new ArrayList<>();
        byCompany.forEach((companyNumber, roles) -> {
            if (roles.size() > 1) {
                String roleTypes = roles.stream()
                    .map(NormalizedRole::getRoleType)
                    .map(type -> type.isEmpty() ? "unspecified" : type)
                    .collect(Collectors.joining(", "));
                notes.add("Note: " + officer.getDisplayName() + " holds " + roles.size()
                    + " roles at company " + companyNumber + " (" + roleTypes + ")");
            }
        });
        return notes;
    }
}
