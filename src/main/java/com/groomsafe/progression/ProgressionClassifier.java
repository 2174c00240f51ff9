package com.groomsafe.progression;

import com.groomsafe.config.Config;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.GroomingStage;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a feature vector to the most likely progression stage. Each candidate stage has
 * its own scoring formula; the highest score wins, ties going to the stage declared first.
 */
public final class ProgressionClassifier {
    static final List<GroomingStage> CANDIDATES = List.of(
            GroomingStage.INITIAL_CONTACT,
            GroomingStage.TRUST_BUILDING,
            GroomingStage.EMOTIONAL_DEPENDENCY,
            GroomingStage.ISOLATION_ATTEMPTS,
            GroomingStage.ESCALATION_RISK
    );

    private static final double TRUST_BAND_LOW = 0.2;
    private static final double TRUST_BAND_HIGH = 0.5;
    private static final double ESCALATION_HIGH = 0.6;
    private static final double ESCALATION_ELEVATED = 0.5;
    private static final double LOW_SIGNAL_CONFIDENCE = 0.5;

    private final double initialContactCeiling;
    private final double minWinnerScore;
    private final double minConfidence;

    public ProgressionClassifier() {
        this(null);
    }

    public ProgressionClassifier(Config config) {
        this.initialContactCeiling = positiveDouble(config, "stage.initial_contact.mean_ceiling", 0.2);
        this.minWinnerScore = positiveDouble(config, "stage.min_winner_score", 0.15);
        this.minConfidence = positiveDouble(config, "stage.min_confidence", 0.1);
    }

    public StageClassification classify(BehavioralFeatures features) {
        Map<GroomingStage, Double> scores = new EnumMap<>(GroomingStage.class);
        scores.put(GroomingStage.INITIAL_CONTACT, scoreInitialContact(features));
        scores.put(GroomingStage.TRUST_BUILDING, scoreTrustBuilding(features));
        scores.put(GroomingStage.EMOTIONAL_DEPENDENCY, scoreEmotionalDependency(features));
        scores.put(GroomingStage.ISOLATION_ATTEMPTS, scoreIsolationAttempts(features));
        scores.put(GroomingStage.ESCALATION_RISK, scoreEscalationRisk(features));
        return decide(scores);
    }

    /**
     * Picks the winner from precomputed stage scores.
     */
    StageClassification decide(Map<GroomingStage, Double> scores) {
        GroomingStage winner = null;
        double best = Double.NEGATIVE_INFINITY;
        for (GroomingStage stage : CANDIDATES) {
            double score = scores.getOrDefault(stage, 0.0);
            // strict '>' keeps the earlier stage on ties
            if (score > best) {
                best = score;
                winner = stage;
            }
        }

        List<Double> ordered = new ArrayList<>();
        for (GroomingStage stage : CANDIDATES) {
            ordered.add(scores.getOrDefault(stage, 0.0));
        }
        ordered.sort((a, b) -> Double.compare(b, a));
        double runnerUp = ordered.size() > 1 ? ordered.get(1) : 0.0;

        if (best < minWinnerScore) {
            return new StageClassification(GroomingStage.INITIAL_CONTACT, LOW_SIGNAL_CONFIDENCE, scores);
        }

        double confidence = Math.min(best + (best - runnerUp) * 0.5, 1.0);
        confidence = Math.max(confidence, minConfidence);
        return new StageClassification(winner, clamp(confidence), scores);
    }

    double scoreInitialContact(BehavioralFeatures f) {
        double mean = f.mean();
        if (mean < initialContactCeiling) {
            return 1.0 - (mean / initialContactCeiling);
        }
        return 0.0;
    }

    double scoreTrustBuilding(BehavioralFeatures f) {
        double blend = f.contactFrequencyScore * 0.4
                + f.emotionalDependencyIndicators * 0.3
                + f.toneShiftScore * 0.3;
        double pressure = (f.isolationPressure + f.secrecyPressure) / 2.0;
        double trust = blend * (1.0 - pressure * 0.5);
        if (trust > TRUST_BAND_LOW && trust < TRUST_BAND_HIGH) {
            return trust * 2.0;
        }
        return trust * 0.5;
    }

    double scoreEmotionalDependency(BehavioralFeatures f) {
        return clamp(f.emotionalDependencyIndicators * 0.5
                + f.contactFrequencyScore * 0.25
                + f.persistenceAfterNonresponse * 0.25);
    }

    double scoreIsolationAttempts(BehavioralFeatures f) {
        return clamp(f.isolationPressure * 0.35
                + f.secrecyPressure * 0.35
                + f.platformMigrationAttempts * 0.30);
    }

    double scoreEscalationRisk(BehavioralFeatures f) {
        double[] values = f.vector();
        int highCount = 0;
        int elevatedCount = 0;
        double elevatedSum = 0.0;
        for (double v : values) {
            if (v > ESCALATION_HIGH) {
                highCount++;
            }
            if (v > ESCALATION_ELEVATED) {
                elevatedCount++;
                elevatedSum += v;
            }
        }
        double elevatedMean = elevatedCount == 0 ? 0.0 : elevatedSum / elevatedCount;
        return clamp(((double) highCount / values.length) * 0.5 + elevatedMean * 0.5);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static double positiveDouble(Config config, String key, double fallback) {
        if (config == null) {
            return fallback;
        }
        double value = config.getDouble(key, fallback);
        return Double.isFinite(value) && value > 0.0 ? value : fallback;
    }
}
