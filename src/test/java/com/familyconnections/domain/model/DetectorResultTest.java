package com.familyconnections.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DetectorResultTest {

    @Test
    void zeroPointsDropReasons() {
        DetectorResult result = DetectorResult.of(0.0, List.of("should not survive"));

        assertFalse(result.fired());
        assertTrue(result.reasons().isEmpty());
    }

    @Test
    void negativePointsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DetectorResult(-1.0, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new DetectorResult(Double.NaN, List.of()));
    }

    @Test
    void breakdownDefaultsToNoneForMissingCategory() {
        ConnectionScoreResult result = new ConnectionScoreResult(0.0, List.of(), ConfidenceTier.LOW,
            Map.of(SignalCategory.NAME, DetectorResult.of(2.0, List.of("Surname match"))));

        assertEquals(2.0, result.resultFor(SignalCategory.NAME).points());
        assertSame(DetectorResult.none(), result.resultFor(SignalCategory.ADDRESS));
    }

    @Test
    void tiersAreOrdered() {
        assertTrue(ConfidenceTier.HIGH.isAtLeast(ConfidenceTier.MEDIUM));
        assertTrue(ConfidenceTier.LOW.isAtLeast(ConfidenceTier.LOW));
        assertFalse(ConfidenceTier.LOW.isAtLeast(ConfidenceTier.MEDIUM));
    }
}
