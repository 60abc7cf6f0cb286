package com.familyconnections.application;

import java.util.List;

/**
 * Outcome of scoring every unordered pair in a group of officers.
 *
 * @param recordCount     size of the input group
 * @param pairsEvaluated  pairs that were scored, including those filtered out by confidence
 * @param connections     scored pairs at or above the requested confidence, best first
 * @param failures        pairs skipped because a record was malformed
 */
public record GroupAnalysis(
    int recordCount,
    int pairsEvaluated,
    List<PairwiseConnection> connections,
    List<PairFailure> failures
) {

    public GroupAnalysis {
        connections = List.copyOf(connections);
        failures = List.copyOf(failures);
    }

    public static GroupAnalysis empty(int recordCount) {
        return new GroupAnalysis(recordCount, 0, List.of(), List.of());
    }
}
