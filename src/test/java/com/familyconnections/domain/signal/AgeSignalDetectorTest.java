package com.familyconnections.domain.signal;

import com.familyconnections.domain.model.DetectorResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.OfficerRecord;
import com.familyconnections.domain.scoring.ScoringConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.familyconnections.domain.OfficerFixtures.normalized;
import static org.junit.jupiter.api.Assertions.*;

class AgeSignalDetectorTest {

    private final AgeSignalDetector detector = new AgeSignalDetector(ScoringConfiguration.defaults());

    @Test
    void siblingRangeIsInclusive() {
        DetectorResult result = detector.detect(born("1960-01"), born("1963-01"));

        assertEquals(2.0, result.points());
        assertEquals(List.of("Age gap of 3.0 years suggests possible siblings"), result.reasons());
    }

    @Test
    void generationalGapIsInclusive() {
        DetectorResult result = detector.detect(born("1930-01"), born("1960-01"));

        assertEquals(3.0, result.points());
        assertEquals(List.of("Age gap of 30.0 years suggests possible parent-child relationship"),
            result.reasons());
    }

    @Test
    void siblingRangeIsInclusiveAtDayPrecision() {
        DetectorResult result = detector.detect(born("2000-01-01"), born("2003-01-01"));

        assertEquals(2.0, result.points());
        assertEquals(List.of("Age gap of 3.0 years suggests possible siblings"), result.reasons());
    }

    @Test
    void generationalGapIsInclusiveAtDayPrecision() {
        DetectorResult result = detector.detect(born("1970-01-01"), born("2000-01-01"));

        assertEquals(3.0, result.points());
        assertEquals(List.of("Age gap of 30.0 years suggests possible parent-child relationship"),
            result.reasons());
    }

    @Test
    void oneDayPastSiblingRangeIsAmbiguous() {
        assertFalse(detector.detect(born("2000-01-01"), born("2003-01-02")).fired());
    }

    @Test
    void ambiguousGapScoresNothing() {
        DetectorResult result = detector.detect(born("1960-01"), born("1963-02"));

        assertFalse(result.fired());
        assertTrue(result.reasons().isEmpty());
    }

    @Test
    void thirtyThreeYearGapIsGenerational() {
        DetectorResult result = detector.detect(born("1924-10"), born("1958-03"));

        assertEquals(List.of("Age gap of 33.4 years suggests possible parent-child relationship"),
            result.reasons());
    }

    @Test
    void symmetric() {
        assertEquals(detector.detect(born("1930-05"), born("1961-02")),
            detector.detect(born("1961-02"), born("1930-05")));
    }

    @Test
    void missingDateOfBirthScoresNothing() {
        NormalizedOfficer unknown = normalized(OfficerRecord.builder().fullName("Ann Other").build());

        assertFalse(detector.detect(unknown, born("1960-01")).fired());
        assertFalse(detector.detect(born("1960-01"), unknown).fired());
    }

    @Test
    void weightApplied() {
        AgeSignalDetector weighted = new AgeSignalDetector(ScoringConfiguration.builder().ageWeight(2.0).build());

        assertEquals(4.0, weighted.detect(born("1960-01"), born("1961-06")).points());
    }

    private static NormalizedOfficer born(String dateOfBirth) {
        return normalized(OfficerRecord.builder()
            .fullName("Ann Other")
            .dateOfBirth(dateOfBirth)
            .build());
    }
}
