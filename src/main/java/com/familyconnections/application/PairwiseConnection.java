package com.familyconnections.application;

import com.familyconnections.domain.model.ConfidenceTier;
import com.familyconnections.domain.model.ConnectionScoreResult;

/**
 * Scored pair within a group, identified by position in the input list.
 *
 * @param firstIndex  index of the first record (always the lower index)
 * @param secondIndex index of the second record
 * @param firstLabel  officer id, or display name when no id was supplied
 * @param secondLabel officer id, or display name when no id was supplied
 * @param result      the pair's score
 */
public record PairwiseConnection(
    int firstIndex,
    int secondIndex,
    String firstLabel,
    String secondLabel,
    ConnectionScoreResult result
) {

    public double totalScore() {
        return result.totalScore();
    }

    public ConfidenceTier confidence() {
        return result.confidence();
    }
}
