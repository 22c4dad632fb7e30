package com.calibrationplatform.common.fusion;

import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.LayerScore;

import java.util.Map;

/**
 * Strategy contract for combining per-layer scores into one calibration score.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Traceable</b>: every summand appears in {@link FusionResult#terms()}</li>
 * </ul>
 *
 * <p>Current implementation: {@link ChoquetFusionOperator}.
 */
public interface FusionOperator {

    /**
     * @param activeScores scores of the active layers only; absent layers contribute nothing
     * @param config       validated weights for the subject's role
     * @return the fused result, never {@code null}
     */
    FusionResult fuse(Map<CanonicalLayer, LayerScore> activeScores, FusionConfiguration config);
}
