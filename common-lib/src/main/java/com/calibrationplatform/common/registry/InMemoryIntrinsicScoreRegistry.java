package com.calibrationplatform.common.registry;

import com.calibrationplatform.common.model.IntrinsicScore;
import com.calibrationplatform.common.model.IntrinsicStatus;

import java.util.Map;

/** Read-only registry backed by a map built once at load time. */
public final class InMemoryIntrinsicScoreRegistry implements IntrinsicScoreRegistry {

    private static final IntrinsicScore UNKNOWN = IntrinsicScore.withStatus(IntrinsicStatus.NONE);

    private final Map<String, IntrinsicScore> scores;

    public InMemoryIntrinsicScoreRegistry(Map<String, IntrinsicScore> scores) {
        this.scores = Map.copyOf(scores);
    }

    @Override
    public IntrinsicScore getIntrinsic(String methodId) {
        return scores.getOrDefault(methodId, UNKNOWN);
    }
}
