package com.calibrationplatform.common.layer;

import com.calibrationplatform.common.model.CanonicalLayer;
import com.calibrationplatform.common.model.LayerScore;

/**
 * Pure scoring function for one canonical layer.
 *
 * <p>Implementations are stateless apart from their immutable rubric and must return
 * a score in [0,1]. A missing evidence field raises
 * {@link com.calibrationplatform.common.exception.EvidenceException}; a hard gate is a
 * regular {@code 0.0} result, not an exception.
 */
public interface LayerEvaluator {

    CanonicalLayer layer();

    LayerScore evaluate(LayerInput input);
}
