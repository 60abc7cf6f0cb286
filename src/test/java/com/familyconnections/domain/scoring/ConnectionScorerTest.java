package com.familyconnections.domain.scoring;

import com.familyconnections.domain.exception.InvalidConfigurationException;
import com.familyconnections.domain.exception.MalformedRecordException;
import com.familyconnections.domain.model.AddressRecord;
import com.familyconnections.domain.model.ConfidenceTier;
import com.familyconnections.domain.model.ConnectionScoreResult;
import com.familyconnections.domain.model.OfficerRecord;
import com.familyconnections.domain.model.SignalCategory;
import com.familyconnections.domain.normalize.OfficerRecordNormalizer;
import com.familyconnections.domain.signal.AgeSignalDetector;
import com.familyconnections.domain.signal.NameSignalDetector;
import com.familyconnections.domain.signal.SignalDetector;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static com.familyconnections.domain.OfficerFixtures.GREGORY_ADDRESS;
import static com.familyconnections.domain.OfficerFixtures.GREGORY_COMPANY;
import static com.familyconnections.domain.OfficerFixtures.johnKennedyGregory;
import static com.familyconnections.domain.OfficerFixtures.nameOnly;
import static com.familyconnections.domain.OfficerFixtures.williamGregory;
import static org.junit.jupiter.api.Assertions.*;

class ConnectionScorerTest {

    private final ConnectionScorer scorer = new ConnectionScorer(ScoringConfiguration.defaults());

    @Test
    void fatherAndSonReachHighConfidence() {
        ConnectionScoreResult result = scorer.score(williamGregory(), johnKennedyGregory());

        assertEquals(List.of(
            "Surname match: Gregory (100% similar)",
            "Age gap of 33.4 years suggests possible parent-child relationship",
            "Concurrent service at company 01329163 (" + GREGORY_COMPANY + ")",
            "Exact address match",
            "Company name " + GREGORY_COMPANY + " (William John Gregory) contains surname Gregory of John Kennedy Gregory",
            "Company name " + GREGORY_COMPANY + " (John Kennedy Gregory) contains surname Gregory of William John Gregory"),
            result.reasons());
        assertEquals(16.0, result.totalScore());
        assertEquals(ConfidenceTier.HIGH, result.confidence());

        assertEquals(2.0, result.resultFor(SignalCategory.NAME).points());
        assertEquals(3.0, result.resultFor(SignalCategory.AGE).points());
        assertEquals(3.0, result.resultFor(SignalCategory.APPOINTMENT).points());
        assertEquals(4.0, result.resultFor(SignalCategory.ADDRESS).points());
        assertEquals(4.0, result.resultFor(SignalCategory.COMPANY_NAME).points());
    }

    @Test
    void unrelatedOfficersScoreZero() {
        ConnectionScoreResult result = scorer.score(nameOnly("Ann Baker"), nameOnly("Tom Okafor"));

        assertEquals(0.0, result.totalScore());
        assertTrue(result.reasons().isEmpty());
        assertEquals(ConfidenceTier.LOW, result.confidence());
    }

    @Test
    void deterministic() {
        assertEquals(scorer.score(williamGregory(), johnKennedyGregory()),
            scorer.score(williamGregory(), johnKennedyGregory()));
    }

    @Test
    void symmetric() {
        ConnectionScoreResult forward = scorer.score(williamGregory(), johnKennedyGregory());
        ConnectionScoreResult backward = scorer.score(johnKennedyGregory(), williamGregory());

        assertEquals(forward.totalScore(), backward.totalScore());
        assertEquals(forward.confidence(), backward.confidence());
        assertEquals(new HashSet<>(forward.reasons()), new HashSet<>(backward.reasons()));
    }

    @Test
    void sharedMiddleNameNeverLowersScore() {
        OfficerRecord first = williamGregory();
        OfficerRecord second = johnKennedyGregory();
        double before = scorer.score(first, second).totalScore();

        double after = scorer.score(first, second.toBuilder().middleName("John").build()).totalScore();

        assertEquals(before + 3.0, after);
    }

    @Test
    void siblingBoundaryIsInclusive() {
        OfficerRecord older = nameOnly("Ann Baker").toBuilder().dateOfBirth("1960-01").build();
        OfficerRecord younger = nameOnly("Tom Okafor").toBuilder().dateOfBirth("1963-01").build();

        ConnectionScoreResult result = scorer.score(older, younger);

        assertEquals(2.0, result.totalScore());
        assertEquals(List.of("Age gap of 3.0 years suggests possible siblings"), result.reasons());
    }

    @Test
    void missingOptionalDataDegradesQuietly() {
        OfficerRecord sparse = OfficerRecord.builder()
            .fullName("John Gregory")
            .dateOfBirth("sometime in the fifties")
            .build();

        ConnectionScoreResult result = scorer.score(williamGregory(), sparse);

        // surname match plus the surname in William's company name
        assertEquals(4.0, result.totalScore());
        assertEquals(0.0, result.resultFor(SignalCategory.AGE).points());
        assertEquals(0.0, result.resultFor(SignalCategory.ADDRESS).points());
    }

    @Test
    void partnerDataUnusableAgainstSparseRecordChangesNothing() {
        OfficerRecord sparse = nameOnly("John Gregory");
        OfficerRecord located = williamGregory().toBuilder()
            .address(AddressRecord.builder().fullAddress(GREGORY_ADDRESS).latitude(51.45).longitude(-2.59).build())
            .build();
        OfficerRecord stripped = located.toBuilder()
            .dateOfBirth(null)
            .address(AddressRecord.builder().fullAddress(GREGORY_ADDRESS).build())
            .build();

        ConnectionScoreResult withData = scorer.score(located, sparse);
        ConnectionScoreResult withoutData = scorer.score(sparse, stripped);

        assertEquals(withData.totalScore(), withoutData.totalScore());
        assertEquals(withData.confidence(), withoutData.confidence());
        assertEquals(new HashSet<>(withData.reasons()), new HashSet<>(withoutData.reasons()));
        for (ConnectionScoreResult result : List.of(withData, withoutData)) {
            assertEquals(0.0, result.resultFor(SignalCategory.AGE).points());
            assertEquals(0.0, result.resultFor(SignalCategory.ADDRESS).points());
        }
    }

    @Test
    void malformedRecordFailsFast() {
        OfficerRecord nameless = OfficerRecord.builder().officerId("BAD-1").surname("Gregory").build();

        MalformedRecordException e = assertThrows(MalformedRecordException.class,
            () -> scorer.score(williamGregory(), nameless));
        assertEquals("BAD-1", e.getOfficerId());
    }

    @Test
    void maxScoreClampsTotalBeforeTiering() {
        ConnectionScorer clamped = new ConnectionScorer(ScoringConfiguration.builder().maxScore(8.0).build());

        ConnectionScoreResult result = clamped.score(williamGregory(), johnKennedyGregory());

        assertEquals(8.0, result.totalScore());
        assertEquals(ConfidenceTier.MEDIUM, result.confidence());
        assertEquals(6, result.reasons().size());
    }

    @Test
    void zeroWeightSilencesCategory() {
        ConnectionScorer noAddress = new ConnectionScorer(ScoringConfiguration.builder().addressWeight(0.0).build());

        ConnectionScoreResult result = noAddress.score(williamGregory(), johnKennedyGregory());

        assertEquals(12.0, result.totalScore());
        assertFalse(result.reasons().contains("Exact address match"));
    }

    @Test
    void invalidConfigurationRejectedAtConstruction() {
        ScoringConfiguration invalid = ScoringConfiguration.builder().lowConfidenceCut(12.0).build();

        assertThrows(InvalidConfigurationException.class, () -> new ConnectionScorer(invalid));
    }

    @Test
    void invalidConfigurationReportedBeforeDetectorsAreBuilt() {
        ScoringConfiguration invalid = ScoringConfiguration.builder()
            .lowConfidenceCut(12.0)
            .synchronizationTolerance(null)
            .build();

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
            () -> new ConnectionScorer(invalid));
        assertEquals(2, e.getViolations().size());
        assertTrue(e.getViolations().contains("synchronizationTolerance must be set"));
        assertTrue(e.getViolations().stream().anyMatch(v -> v.startsWith("confidence cuts")));

        NullPointerException npe = assertThrows(NullPointerException.class,
            () -> new ConnectionScorer(null));
        assertEquals("configuration", npe.getMessage());
    }

    @Test
    void duplicateCategoryRejected() {
        ScoringConfiguration config = ScoringConfiguration.defaults();
        List<SignalDetector> detectors = List.of(new NameSignalDetector(config), new NameSignalDetector(config));

        assertThrows(InvalidConfigurationException.class,
            () -> new ConnectionScorer(config, new OfficerRecordNormalizer(), detectors));
    }

    @Test
    void customDetectorListRespected() {
        ScoringConfiguration config = ScoringConfiguration.defaults();
        ConnectionScorer ageOnly = new ConnectionScorer(config, new OfficerRecordNormalizer(),
            List.of(new AgeSignalDetector(config)));

        ConnectionScoreResult result = ageOnly.score(williamGregory(), johnKennedyGregory());

        assertEquals(3.0, result.totalScore());
        assertEquals(List.of(SignalCategory.AGE), List.copyOf(result.breakdown().keySet()));
    }
}
