package com.familyconnections.application;

import com.familyconnections.config.AnalysisProperties;
import com.familyconnections.config.ExecutorConfiguration;
import com.familyconnections.config.PerformanceConfiguration.ScoringMetrics;
import com.familyconnections.domain.exception.MalformedRecordException;
import com.familyconnections.domain.model.ConfidenceTier;
import com.familyconnections.domain.model.ConnectionScoreResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.OfficerRecord;
import com.familyconnections.domain.scoring.ConnectionScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Application service for family-connection scoring.
 *
 * <p>Wraps the stateless {@link ConnectionScorer} with metrics and adds
 * group analysis: every unordered pair in a group is scored on the scoring
 * executor. A malformed record fails only the pairs it belongs to.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class FamilyConnectionService {

    private static final Comparator<PairwiseConnection> BEST_FIRST =
        Comparator.comparingDouble(PairwiseConnection::totalScore).reversed()
            .thenComparingInt(PairwiseConnection::firstIndex)
            .thenComparingInt(PairwiseConnection::secondIndex);

    private final ConnectionScorer scorer;
    private final Executor scoringExecutor;
    private final ScoringMetrics metrics;
    private final AnalysisProperties analysisProperties;

    public FamilyConnectionService(ConnectionScorer scorer,
                                   @Qualifier(ExecutorConfiguration.SCORING_EXECUTOR) Executor scoringExecutor,
                                   ScoringMetrics metrics,
                                   AnalysisProperties analysisProperties) {
        this.scorer = scorer;
        this.scoringExecutor = scoringExecutor;
        this.metrics = metrics;
        this.analysisProperties = analysisProperties;
    }

    /**
     * Score one pair of officers.
     *
     * @throws MalformedRecordException if either record lacks a usable name
     */
    public ConnectionScoreResult score(OfficerRecord first, OfficerRecord second) {
        try {
            ConnectionScoreResult result = scorer.score(first, second);
            metrics.recordPairScored(result.confidence());
            return result;
        } catch (MalformedRecordException e) {
            metrics.recordPairFailed();
            throw e;
        }
    }

    /**
     * Analyze a group using the configured minimum confidence.
     */
    public GroupAnalysis analyzeGroup(List<OfficerRecord> records) {
        return analyzeGroup(records, analysisProperties.getMinimumConfidence());
    }

    /**
     * Score every unordered pair of a group.
     *
     * @param records           officers to compare; positions identify them in the result
     * @param minimumConfidence connections below this tier are left out
     * @return connections best first, plus one failure per pair with a malformed record
     */
    public GroupAnalysis analyzeGroup(List<OfficerRecord> records, ConfidenceTier minimumConfidence) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(minimumConfidence, "minimumConfidence");
        if (records.size() < 2) {
            return GroupAnalysis.empty(records.size());
        }
        return metrics.timeGroupAnalysis(() -> runAnalysis(records, minimumConfidence));
    }

    private GroupAnalysis runAnalysis(List<OfficerRecord> records, ConfidenceTier minimumConfidence) {
        int size = records.size();
        log.info("Analyzing group of {} officers ({} pairs)", size, (long) size * (size - 1) / 2);

        NormalizedOfficer[] normalized = new NormalizedOfficer[size];
        String[] rejections = new String[size];
        for (int i = 0; i < size; i++) {
            try {
                normalized[i] = scorer.normalize(records.get(i));
            } catch (MalformedRecordException e) {
                rejections[i] = e.getMessage();
            }
        }

        List<PairFailure> failures = new ArrayList<>();
        List<CompletableFuture<PairwiseConnection>> pending = new ArrayList<>();

        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (rejections[i] != null || rejections[j] != null) {
                    String message = rejections[i] != null ? rejections[i] : rejections[j];
                    log.warn("Skipping pair ({}, {}): {}", i, j, message);
                    metrics.recordPairFailed();
                    failures.add(new PairFailure(i, j, message));
                    continue;
                }
                NormalizedOfficer first = normalized[i];
                NormalizedOfficer second = normalized[j];
                int firstIndex = i;
                int secondIndex = j;
                pending.add(CompletableFuture.supplyAsync(
                    () -> new PairwiseConnection(firstIndex, secondIndex, first.label(), second.label(),
                        scorer.score(first, second)),
                    scoringExecutor));
            }
        }

        List<PairwiseConnection> connections = new ArrayList<>();
        for (CompletableFuture<PairwiseConnection> future : pending) {
            PairwiseConnection connection = future.join();
            metrics.recordPairScored(connection.confidence());
            if (connection.confidence().isAtLeast(minimumConfidence)) {
                connections.add(connection);
            }
        }
        connections.sort(BEST_FIRST);

        log.info("Group analysis complete: {} pairs scored, {} at or above {}, {} failed",
            pending.size(), connections.size(), minimumConfidence, failures.size());
        return new GroupAnalysis(size, pending.size(), connections, failures);
    }
}
