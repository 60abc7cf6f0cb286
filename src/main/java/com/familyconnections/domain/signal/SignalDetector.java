package com.familyconnections.domain.signal;

import com.familyconnections.domain.model.DetectorResult;
import com.familyconnections.domain.model.NormalizedOfficer;
import com.familyconnections.domain.model.SignalCategory;

/**
 * One independent source of family-connection evidence.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>be pure functions of the two officers and their configuration</li>
 *   <li>be symmetric in total points: {@code detect(a, b)} and
 *       {@code detect(b, a)} score the same and report the same reason set</li>
 *   <li>never throw for missing optional data; they return
 *       {@link DetectorResult#none()} instead</li>
 *   <li>apply their category weight before returning</li>
 * </ul>
 *
 * @author Platform Team
 * @since 1.0.0
 */
public interface SignalDetector {

    SignalCategory category();

    DetectorResult detect(NormalizedOfficer first, NormalizedOfficer second);
}
