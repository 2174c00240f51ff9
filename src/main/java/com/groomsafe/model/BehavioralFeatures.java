package com.groomsafe.model;

import lombok.Builder;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Eight behavioral scalars for one conversation. Every value is clamped to [0, 1] on
 * construction.
 */
public final class BehavioralFeatures {
    public static final String FEATURE_VERSION = "1.0.0";

    public final UUID conversationId;
    public final double contactFrequencyScore;
    public final double persistenceAfterNonresponse;
    public final double timeOfDayIrregularity;
    public final double emotionalDependencyIndicators;
    public final double isolationPressure;
    public final double secrecyPressure;
    public final double platformMigrationAttempts;
    public final double toneShiftScore;
    public final Instant extractedAt;
    public final String featureVersion;

    @Builder
    public BehavioralFeatures(
            UUID conversationId,
            double contactFrequencyScore,
            double persistenceAfterNonresponse,
            double timeOfDayIrregularity,
            double emotionalDependencyIndicators,
            double isolationPressure,
            double secrecyPressure,
            double platformMigrationAttempts,
            double toneShiftScore,
            Instant extractedAt,
            String featureVersion
    ) {
        this.conversationId = conversationId;
        this.contactFrequencyScore = unit(contactFrequencyScore);
        this.persistenceAfterNonresponse = unit(persistenceAfterNonresponse);
        this.timeOfDayIrregularity = unit(timeOfDayIrregularity);
        this.emotionalDependencyIndicators = unit(emotionalDependencyIndicators);
        this.isolationPressure = unit(isolationPressure);
        this.secrecyPressure = unit(secrecyPressure);
        this.platformMigrationAttempts = unit(platformMigrationAttempts);
        this.toneShiftScore = unit(toneShiftScore);
        this.extractedAt = extractedAt == null ? Instant.now() : extractedAt;
        this.featureVersion = featureVersion == null || featureVersion.isBlank() ? FEATURE_VERSION : featureVersion;
    }

    public static BehavioralFeatures zero(UUID conversationId, Instant extractedAt) {
        return BehavioralFeatures.builder()
                .conversationId(conversationId)
                .extractedAt(extractedAt)
                .build();
    }

    public double value(FeatureName name) {
        return switch (name) {
            case CONTACT_FREQUENCY_SCORE -> contactFrequencyScore;
            case PERSISTENCE_AFTER_NONRESPONSE -> persistenceAfterNonresponse;
            case TIME_OF_DAY_IRREGULARITY -> timeOfDayIrregularity;
            case EMOTIONAL_DEPENDENCY_INDICATORS -> emotionalDependencyIndicators;
            case ISOLATION_PRESSURE -> isolationPressure;
            case SECRECY_PRESSURE -> secrecyPressure;
            case PLATFORM_MIGRATION_ATTEMPTS -> platformMigrationAttempts;
            case TONE_SHIFT_SCORE -> toneShiftScore;
        };
    }

    /**
     * Values in {@link FeatureName} declaration order.
     */
    public double[] vector() {
        FeatureName[] names = FeatureName.values();
        double[] out = new double[names.length];
        for (int i = 0; i < names.length; i++) {
            out[i] = value(names[i]);
        }
        return out;
    }

    public Map<FeatureName, Double> asMap() {
        Map<FeatureName, Double> out = new EnumMap<>(FeatureName.class);
        for (FeatureName name : FeatureName.values()) {
            out.put(name, value(name));
        }
        return out;
    }

    public double mean() {
        double sum = 0.0;
        double[] values = vector();
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double unit(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
