package com.familyconnections.domain.model;

import java.util.List;

/**
 * Output of a single detector run.
 *
 * @param points  weighted contribution, never negative
 * @param reasons human-readable explanations; empty when {@code points} is zero
 */
public record DetectorResult(
    double points,
    List<String> reasons
) {

    private static final DetectorResult NONE = new DetectorResult(0.0, List.of());

    public DetectorResult {
        if (points < 0 || Double.isNaN(points)) {
            throw new IllegalArgumentException("Detector points must be non-negative, got " + points);
        }
        reasons = List.copyOf(reasons);
    }

    public static DetectorResult none() {
        return NONE;
    }

    /**
     * Builds a result, dropping the reasons when nothing was scored.
     */
    public static DetectorResult of(double points, List<String> reasons) {
        return points > 0 ? new DetectorResult(points, reasons) : NONE;
    }

    public boolean fired() {
        return points > 0;
    }
}
