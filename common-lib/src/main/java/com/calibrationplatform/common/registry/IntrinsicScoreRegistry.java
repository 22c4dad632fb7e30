package com.calibrationplatform.common.registry;

import com.calibrationplatform.common.model.IntrinsicScore;

/**
 * Source of externally computed BASE-layer scores.
 *
 * <p>Implementations must return {@code status = NONE} for unknown methods,
 * never {@code null}.
 */
public interface IntrinsicScoreRegistry {

    IntrinsicScore getIntrinsic(String methodId);
}
