package com.groomsafe.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Explainable assessment of one conversation. Signals risk, does not assign guilt.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RiskAssessment {
    public static final String MODEL_VERSION = "1.0.0";

    public final UUID assessmentId;
    public final UUID conversationId;
    public final double score;
    public final double confidence;
    public final RiskLevel riskLevel;
    public final GroomingStage stage;
    public final double stageConfidence;
    public final List<FeatureContribution> featureContributions;
    public final String reasoningSummary;
    public final boolean requiresHumanReview;
    public final Instant assessedAt;
    public final String modelVersion;
}
