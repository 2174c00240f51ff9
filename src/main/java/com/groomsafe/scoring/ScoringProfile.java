package com.groomsafe.scoring;

import com.groomsafe.config.Config;
import com.groomsafe.core.ConfigurationException;
import com.groomsafe.model.FeatureName;
import com.groomsafe.model.GroomingStage;
import com.groomsafe.progression.StageCatalog;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Feature weights and stage multipliers, validated once when the profile is built.
 */
public final class ScoringProfile {
    static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private final Map<FeatureName, Double> weights;
    private final Map<GroomingStage, Double> multipliers;

    public ScoringProfile(Map<FeatureName, Double> weights, Map<GroomingStage, Double> multipliers) {
        this.weights = Collections.unmodifiableMap(validateWeights(weights));
        this.multipliers = Collections.unmodifiableMap(validateMultipliers(multipliers));
    }

    public static ScoringProfile defaults() {
        return fromConfig(Config.defaults());
    }

    public static ScoringProfile fromConfig(Config config) {
        Map<FeatureName, Double> weights = new EnumMap<>(FeatureName.class);
        for (FeatureName name : FeatureName.values()) {
            weights.put(name, config.getDouble("risk.weight." + name.wireName(), Double.NaN));
        }
        Map<GroomingStage, Double> multipliers = new EnumMap<>(GroomingStage.class);
        for (GroomingStage stage : GroomingStage.values()) {
            multipliers.put(stage, config.getDouble(
                    "risk.multiplier." + stage.wireName(),
                    StageCatalog.defaultMultiplier(stage)
            ));
        }
        return new ScoringProfile(weights, multipliers);
    }

    public double weight(FeatureName name) {
        return weights.get(name);
    }

    public double multiplier(GroomingStage stage) {
        return multipliers.get(stage);
    }

    public Map<FeatureName, Double> weights() {
        return weights;
    }

    public Map<GroomingStage, Double> multipliers() {
        return multipliers;
    }

    private static Map<FeatureName, Double> validateWeights(Map<FeatureName, Double> raw) {
        if (raw == null) {
            throw new ConfigurationException("feature weights are required");
        }
        Map<FeatureName, Double> out = new EnumMap<>(FeatureName.class);
        double sum = 0.0;
        for (FeatureName name : FeatureName.values()) {
            Double weight = raw.get(name);
            if (weight == null || !Double.isFinite(weight)) {
                throw new ConfigurationException("missing weight for feature " + name.wireName());
            }
            if (weight < 0.0) {
                throw new ConfigurationException("negative weight for feature " + name.wireName() + ": " + weight);
            }
            out.put(name, weight);
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            throw new ConfigurationException(String.format(Locale.US, "feature weights must sum to 1.0, got %.6f", sum));
        }
        return out;
    }

    private static Map<GroomingStage, Double> validateMultipliers(Map<GroomingStage, Double> raw) {
        if (raw == null) {
            throw new ConfigurationException("stage multipliers are required");
        }
        Map<GroomingStage, Double> out = new EnumMap<>(GroomingStage.class);
        for (GroomingStage stage : GroomingStage.values()) {
            Double multiplier = raw.get(stage);
            if (multiplier == null || !Double.isFinite(multiplier) || multiplier < 0.0) {
                throw new ConfigurationException("invalid multiplier for stage " + stage.wireName() + ": " + multiplier);
            }
            out.put(stage, multiplier);
        }
        return out;
    }
}
