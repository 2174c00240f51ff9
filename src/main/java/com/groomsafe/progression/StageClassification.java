package com.groomsafe.progression;

import com.groomsafe.model.GroomingStage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Winning stage, its confidence, and the raw score of every candidate stage.
 */
public record StageClassification(
        GroomingStage stage,
        double confidence,
        Map<GroomingStage, Double> stageScores
) {
    public StageClassification {
        stage = stage == null ? GroomingStage.UNKNOWN : stage;
        Map<GroomingStage, Double> copy = new EnumMap<>(GroomingStage.class);
        if (stageScores != null) {
            copy.putAll(stageScores);
        }
        stageScores = Collections.unmodifiableMap(copy);
    }
}
