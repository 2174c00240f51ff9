package com.groomsafe.shield;

import com.groomsafe.model.GroomingStage;
import com.groomsafe.model.RiskLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chart-ready data for the analyst dashboard.
 */
public record VisualizationData(
        Gauge riskGauge,
        Map<String, Double> featureRadar,
        Heatmap temporalHeatmap,
        StageProgress stageProgression
) {
    public VisualizationData {
        featureRadar = Collections.unmodifiableMap(new LinkedHashMap<>(featureRadar));
    }

    public record Gauge(double score, RiskLevel level, double confidence) {
    }

    /**
     * Adult message counts per hour of day, index 0 to 23.
     */
    public record Heatmap(List<Integer> messageCounts, int peakHour) {
        public Heatmap {
            messageCounts = List.copyOf(messageCounts);
        }
    }

    public record StageProgress(GroomingStage currentStage, double confidence) {
    }
}
