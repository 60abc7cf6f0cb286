package com.familyconnections.domain.signal;

import com.familyconnections.domain.model.DetectorResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.PartialDate;
import com.familyconnections.domain.model.SignalCategory;
import com.familyconnections.domain.scoring.ScoringConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * Classifies the age gap between two officers.
 *
 * <p>Gap at or below the sibling range: possible siblings. Gap at or above
 * the generational gap: possible parent and child. Anything in between is
 * ambiguous and scores nothing. Both comparisons are inclusive.
 */
@Slf4j
@RequiredArgsConstructor
public class AgeSignalDetector implements SignalDetector {

    private final ScoringConfiguration config;

    @Override
    public SignalCategory category() {
        return SignalCategory.AGE;
    }

    @Override
    public DetectorResult detect(NormalizedOfficer first, NormalizedOfficer second) {
        if (first.getDateOfBirth() == null || second.getDateOfBirth() == null) {
            return DetectorResult.none();
        }

        PartialDate a = first.getDateOfBirth();
        PartialDate b = second.getDateOfBirth();
        double gap = a.yearsBetween(b);
        double weight = config.weightFor(SignalCategory.AGE);

        if (gap <= config.getSiblingAgeRange()) {
            log.debug("Age gap {} between {} and {} is within sibling range", gap, first.label(), second.label());
            return DetectorResult.of(config.getSiblingPoints() * weight, List.of(String.format(Locale.ROOT,
                "Age gap of %.1f years suggests possible siblings", gap)));
        }
        if (gap >= config.getGenerationalAgeGap()) {
            log.debug("Age gap {} between {} and {} is generational", gap, first.label(), second.label());
            return DetectorResult.of(config.getParentChildPoints() * weight, List.of(String.format(Locale.ROOT,
                "Age gap of %.1f years suggests possible parent-child relationship", gap)));
        }
        return DetectorResult.none();
    }
}
