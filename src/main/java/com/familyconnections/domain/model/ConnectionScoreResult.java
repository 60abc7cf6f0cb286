package com.familyconnections.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of scoring one pair of officers.
 *
 * @param totalScore sum of all detector points, clamped to the configured maximum if one is set
 * @param reasons    every detector's reasons, in invocation order
 * @param confidence tier derived from {@code totalScore} alone
 * @param breakdown  per-category detector results, iterated in {@link SignalCategory} order
 */
public record ConnectionScoreResult(
    double totalScore,
    List<String> reasons,
    ConfidenceTier confidence,
    Map<SignalCategory, DetectorResult> breakdown
) {

    public ConnectionScoreResult {
        reasons = List.copyOf(reasons);
        Map<SignalCategory, DetectorResult> copy = new EnumMap<>(SignalCategory.class);
        copy.putAll(breakdown);
        breakdown = Collections.unmodifiableMap(copy);
    }

    public DetectorResult resultFor(SignalCategory category) {
        return breakdown.getOrDefault(category, DetectorResult.none());
    }
}
