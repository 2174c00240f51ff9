package com.groomsafe.explain;

import com.groomsafe.model.FeatureName;
import com.groomsafe.model.RiskLevel;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Human-readable account of one assessment: why it was flagged, which features drove it,
 * what stage it reached and what to do next.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Explanation {
    public final UUID assessmentId;
    public final UUID conversationId;
    public final Instant timestamp;
    public final String modelVersion;
    public final String summary;
    public final FlaggingRationale flaggingRationale;
    public final FeatureAnalysis featureAnalysis;
    public final StageAnalysis stageAnalysis;
    public final RiskEvolution riskEvolution;
    public final ConfidenceAnalysis confidenceAnalysis;
    public final List<String> recommendations;
    public final List<String> limitations;

    public record FlaggingRationale(
            boolean flagged,
            List<String> primaryReasons,
            RiskLevel riskLevel,
            boolean requiresAction
    ) {
        public FlaggingRationale {
            primaryReasons = List.copyOf(primaryReasons);
        }
    }

    public record ContributorView(
            FeatureName feature,
            double value,
            double contribution,
            String description
    ) {
    }

    public record FeatureAnalysis(
            List<ContributorView> topContributors,
            List<ContributorView> moderateContributors,
            int highCount,
            int moderateCount,
            int lowCount,
            String interpretation
    ) {
        public FeatureAnalysis {
            topContributors = List.copyOf(topContributors);
            moderateContributors = List.copyOf(moderateContributors);
        }
    }

    public record StageAnalysis(
            String currentStage,
            double stageConfidence,
            String severity,
            String typicalDuration,
            String potentialNextStage,
            List<String> warningSigns
    ) {
        public StageAnalysis {
            warningSigns = List.copyOf(warningSigns);
        }
    }

    public record RiskEvolution(
            double durationHours,
            int messageCount,
            String progressionRate,
            String riskTrajectory,
            String timelineSummary
    ) {
    }

    public record ConfidenceAnalysis(
            double confidenceScore,
            String confidenceLabel,
            List<String> factors,
            String reliability
    ) {
        public ConfidenceAnalysis {
            factors = List.copyOf(factors);
        }
    }
}
