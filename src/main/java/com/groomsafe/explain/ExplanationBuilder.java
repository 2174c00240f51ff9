package com.groomsafe.explain;

import com.groomsafe.core.ValidationException;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.FeatureContribution;
import com.groomsafe.model.FeatureName;
import com.groomsafe.model.RiskAssessment;
import com.groomsafe.progression.StageCatalog;
import com.groomsafe.progression.StageProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the explanation for an assessment. Pure: no state, no clock, no I/O.
 */
public final class ExplanationBuilder {
    static final double TOP_CONTRIBUTION = 0.1;
    static final double MODERATE_CONTRIBUTION = 0.05;
    static final int TOP_LIMIT = 5;
    static final double HIGH_FEATURE = 0.6;

    static final String RELIABILITY = "High confidence assessments are more reliable for decision-making. "
            + "Low confidence assessments may require additional data or human review.";

    static final List<String> LIMITATIONS = List.of(
            "This is a risk signaling system, not a criminal accusation tool",
            "False positives are possible; human review is essential",
            "System analyzes behavioral patterns, not content semantics",
            "Effectiveness depends on data quality and completeness",
            "Cultural and contextual factors may not be fully captured",
            "System is designed as one component of comprehensive safety measures",
            "Regular model updates and validation are required for accuracy"
    );

    public Explanation explain(RiskAssessment assessment, BehavioralFeatures features, Conversation conversation) {
        if (assessment == null || features == null || conversation == null) {
            throw new ValidationException("assessment, features and conversation are required");
        }
        return Explanation.builder()
                .assessmentId(assessment.assessmentId)
                .conversationId(assessment.conversationId)
                .timestamp(assessment.assessedAt)
                .modelVersion(assessment.modelVersion)
                .summary(summary(assessment))
                .flaggingRationale(flaggingRationale(assessment, features))
                .featureAnalysis(featureAnalysis(assessment.featureContributions))
                .stageAnalysis(stageAnalysis(assessment))
                .riskEvolution(riskEvolution(conversation, assessment))
                .confidenceAnalysis(confidenceAnalysis(assessment, conversation))
                .recommendations(recommendations(assessment))
                .limitations(LIMITATIONS)
                .build();
    }

    static String summary(RiskAssessment a) {
        return String.format(Locale.US,
                "Risk assessment classified as %s with score %.1f/100 (confidence: %.2f). "
                        + "Conversation stage: %s. Human review %s.",
                a.riskLevel.wireName().toUpperCase(Locale.ROOT),
                a.score,
                a.confidence,
                a.stage.title(),
                a.requiresHumanReview ? "IS REQUIRED" : "not required");
    }

    static Explanation.FlaggingRationale flaggingRationale(RiskAssessment a, BehavioralFeatures f) {
        List<String> reasons = new ArrayList<>();
        if (a.score > 60) {
            reasons.add(String.format(Locale.US, "High risk score (%.1f/100) exceeds safety threshold", a.score));
        }
        if (a.stage.isAdvanced()) {
            reasons.add("Advanced grooming stage detected: " + a.stage.title());
        }

        List<String> high = new ArrayList<>();
        for (Map.Entry<String, Double> entry : rationaleFeatures(f).entrySet()) {
            if (entry.getValue() > HIGH_FEATURE) {
                high.add(String.format(Locale.US, "%s (%.2f)", entry.getKey(), entry.getValue()));
            }
        }
        if (!high.isEmpty()) {
            reasons.add("High-risk behavioral patterns: " + String.join(", ", high));
        }
        if (reasons.isEmpty()) {
            reasons.add("Moderate behavioral signals warrant monitoring");
        }
        return new Explanation.FlaggingRationale(a.score > 40, reasons, a.riskLevel, a.requiresHumanReview);
    }

    private static Map<String, Double> rationaleFeatures(BehavioralFeatures f) {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("Emotional dependency patterns", f.emotionalDependencyIndicators);
        out.put("Isolation pressure", f.isolationPressure);
        out.put("Secrecy pressure", f.secrecyPressure);
        out.put("Platform migration attempts", f.platformMigrationAttempts);
        out.put("Contact frequency escalation", f.contactFrequencyScore);
        out.put("Persistence after non-response", f.persistenceAfterNonresponse);
        return out;
    }

    static Explanation.FeatureAnalysis featureAnalysis(List<FeatureContribution> contributions) {
        List<FeatureContribution> sorted = new ArrayList<>(contributions);
        sorted.sort(Comparator.comparingDouble((FeatureContribution c) -> c.contributionWeight).reversed());

        List<Explanation.ContributorView> top = new ArrayList<>();
        List<Explanation.ContributorView> moderate = new ArrayList<>();
        Set<FeatureName> topNames = EnumSet.noneOf(FeatureName.class);
        int low = 0;
        for (FeatureContribution c : sorted) {
            double w = c.contributionWeight;
            if (w > TOP_CONTRIBUTION) {
                topNames.add(c.featureName);
                top.add(new Explanation.ContributorView(c.featureName, c.value, w, c.description));
            } else if (w > MODERATE_CONTRIBUTION) {
                moderate.add(new Explanation.ContributorView(c.featureName, c.value, w, c.description));
            } else {
                low++;
            }
        }
        int highCount = top.size();
        List<Explanation.ContributorView> shown = top.size() > TOP_LIMIT ? top.subList(0, TOP_LIMIT) : top;
        return new Explanation.FeatureAnalysis(shown, moderate, highCount, moderate.size(), low, interpret(topNames));
    }

    /**
     * Reads the co-occurrence of high contributors; first matching rule wins.
     */
    static String interpret(Set<FeatureName> top) {
        if (top.isEmpty()) {
            return "No significant behavioral patterns detected";
        }
        if (top.contains(FeatureName.EMOTIONAL_DEPENDENCY_INDICATORS)) {
            if (top.contains(FeatureName.ISOLATION_PRESSURE)) {
                return "Pattern suggests emotional manipulation with isolation tactics";
            }
            return "Pattern suggests emotional manipulation strategy";
        }
        if (top.contains(FeatureName.PLATFORM_MIGRATION_ATTEMPTS) && top.contains(FeatureName.SECRECY_PRESSURE)) {
            return "Pattern suggests attempt to move conversation to private channels";
        }
        if (top.contains(FeatureName.CONTACT_FREQUENCY_SCORE)
                && top.contains(FeatureName.PERSISTENCE_AFTER_NONRESPONSE)) {
            return "Pattern suggests escalating and persistent contact behavior";
        }
        return "Multiple behavioral risk indicators detected";
    }

    static Explanation.StageAnalysis stageAnalysis(RiskAssessment a) {
        StageProfile profile = StageCatalog.profile(a.stage);
        return new Explanation.StageAnalysis(
                a.stage.title(),
                a.stageConfidence,
                profile.severity(),
                profile.typicalDuration(),
                profile.nextStage(),
                profile.warningSigns()
        );
    }

    static Explanation.RiskEvolution riskEvolution(Conversation conversation, RiskAssessment a) {
        double hours = conversation.durationHours();
        int count = conversation.messageCount();
        return new Explanation.RiskEvolution(
                round2(hours),
                count,
                progressionRate(hours),
                trajectory(a.score),
                String.format(Locale.US, "Conversation spanned %.1f hours with %d messages, reaching %s stage",
                        hours, count, a.stage.spaced())
        );
    }

    static String progressionRate(double hours) {
        if (hours <= 0.0) {
            return "unknown";
        }
        if (hours < 24) {
            return "rapid (less than 24 hours)";
        }
        if (hours < 168) {
            return "moderate (days)";
        }
        return "gradual (weeks or more)";
    }

    static String trajectory(double score) {
        if (score < 30) {
            return "stable at low risk";
        }
        if (score < 60) {
            return "increasing to moderate risk";
        }
        if (score < 80) {
            return "escalating to high risk";
        }
        return "critical escalation";
    }

    static Explanation.ConfidenceAnalysis confidenceAnalysis(RiskAssessment a, Conversation conversation) {
        int count = conversation.messageCount();
        List<String> factors = new ArrayList<>();
        if (count < 5) {
            factors.add("Limited data (few messages)");
        } else if (count > 20) {
            factors.add("Sufficient data (many messages)");
        }
        String label;
        if (a.confidence > 0.7) {
            label = "high";
        } else if (a.confidence > 0.5) {
            label = "moderate";
        } else {
            label = "low";
        }
        return new Explanation.ConfidenceAnalysis(a.confidence, label, factors, RELIABILITY);
    }

    static List<String> recommendations(RiskAssessment a) {
        List<String> out = new ArrayList<>();
        if (a.score >= 80) {
            out.add("URGENT: Immediate human review required");
            out.add("Escalate to platform safety team");
            out.add("Consider emergency intervention protocols");
            out.add("Preserve all evidence for potential investigation");
            out.add("Activate victim support resources");
        } else if (a.score >= 60) {
            out.add("High-priority human review required within 24 hours");
            out.add("Consider platform-level safety interventions");
            out.add("Monitor for escalation patterns");
            out.add("Prepare support resources");
        } else if (a.score >= 40) {
            out.add("Increased monitoring recommended");
            out.add("Track feature progression over time");
            out.add("Consider educational interventions");
        } else {
            out.add("Continue baseline monitoring");
            out.add("Track for pattern changes");
        }
        out.addAll(StageCatalog.explanationAdditions(a.stage));
        return List.copyOf(out);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
