package com.groomsafe.scoring;

import com.groomsafe.config.Config;
import com.groomsafe.core.ValidationException;
import com.groomsafe.features.FeatureExtractor;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.FeatureContribution;
import com.groomsafe.model.FeatureName;
import com.groomsafe.model.GroomingStage;
import com.groomsafe.model.RiskAssessment;
import com.groomsafe.model.RiskLevel;
import com.groomsafe.progression.ProgressionClassifier;
import com.groomsafe.progression.StageCatalog;
import com.groomsafe.progression.StageClassification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Combines features and the classified stage into a 0-100 risk score with confidence,
 * per-feature contributions and a review flag.
 */
public final class RiskSynthesizer {
    private static final Logger LOG = LogManager.getLogger(RiskSynthesizer.class);

    private static final List<FeatureName> CRITICAL_FEATURES = List.of(
            FeatureName.EMOTIONAL_DEPENDENCY_INDICATORS,
            FeatureName.ISOLATION_PRESSURE,
            FeatureName.SECRECY_PRESSURE
    );
    private static final double PRIMARY_FACTOR_FLOOR = 0.3;
    private static final int PRIMARY_FACTOR_LIMIT = 3;

    private final FeatureExtractor extractor;
    private final ProgressionClassifier classifier;
    private final ScoringProfile profile;
    private final Clock clock;
    private final double synergyThreshold;
    private final double synergyBoost;
    private final double reviewThreshold;
    private final double criticalThreshold;
    private final double isolationMinConfidence;

    public RiskSynthesizer() {
        this(Config.defaults());
    }

    public RiskSynthesizer(Config config) {
        this(
                new FeatureExtractor(config),
                new ProgressionClassifier(config),
                ScoringProfile.fromConfig(config),
                config,
                Clock.systemUTC()
        );
    }

    public RiskSynthesizer(
            FeatureExtractor extractor,
            ProgressionClassifier classifier,
            ScoringProfile profile,
            Config config,
            Clock clock
    ) {
        Config cfg = config == null ? Config.defaults() : config;
        this.extractor = extractor;
        this.classifier = classifier;
        this.profile = profile;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.synergyThreshold = cfg.getDouble("risk.synergy.threshold");
        this.synergyBoost = cfg.getDouble("risk.synergy.boost");
        this.reviewThreshold = cfg.getDouble("risk.review.threshold");
        this.criticalThreshold = cfg.getDouble("risk.review.critical_threshold");
        this.isolationMinConfidence = cfg.getDouble("risk.review.isolation_min_confidence");
    }

    public FeatureExtractor extractor() {
        return extractor;
    }

    public RiskAssessment assess(Conversation conversation) {
        requireMessages(conversation);
        return assess(conversation, extractor.extract(conversation));
    }

    /**
     * Scores a conversation whose features were already extracted.
     */
    public RiskAssessment assess(Conversation conversation, BehavioralFeatures features) {
        requireMessages(conversation);
        if (features == null) {
            throw new ValidationException("features are required");
        }

        StageClassification classification = classifier.classify(features);
        GroomingStage stage = classification.stage();
        double multiplier = profile.multiplier(stage);

        double baseRisk = baseRisk(features);
        double score = clamp(baseRisk * multiplier * 100.0, 0.0, 100.0);
        double confidence = confidence(features, classification.confidence(), conversation.messageCount());
        boolean review = requiresHumanReview(score, stage, confidence);

        RiskAssessment assessment = RiskAssessment.builder()
                .assessmentId(UUID.randomUUID())
                .conversationId(conversation.id)
                .score(score)
                .confidence(confidence)
                .riskLevel(RiskLevel.fromScore(score))
                .stage(stage)
                .stageConfidence(classification.confidence())
                .featureContributions(contributions(features, multiplier))
                .reasoningSummary(reasoning(score, stage, features, conversation.messageCount()))
                .requiresHumanReview(review)
                .assessedAt(clock.instant())
                .modelVersion(RiskAssessment.MODEL_VERSION)
                .build();

        LOG.debug("assessed conversation={} base={} stage={} multiplier={} score={}",
                conversation.id, baseRisk, stage.wireName(), multiplier, score);
        return assessment;
    }

    /**
     * Weighted feature sum plus the synergy boost when several critical features co-occur.
     */
    double baseRisk(BehavioralFeatures features) {
        double weighted = 0.0;
        for (FeatureName name : FeatureName.values()) {
            weighted += features.value(name) * profile.weight(name);
        }

        int highCritical = 0;
        for (FeatureName name : CRITICAL_FEATURES) {
            if (features.value(name) > synergyThreshold) {
                highCritical++;
            }
        }
        if (highCritical >= 2) {
            weighted = Math.min(weighted + synergyBoost * (highCritical - 1), 1.0);
        }
        return clamp(weighted, 0.0, 1.0);
    }

    static double confidence(BehavioralFeatures features, double stageConfidence, int messageCount) {
        double dataConfidence;
        if (messageCount < 5) {
            dataConfidence = 0.3;
        } else if (messageCount < 10) {
            dataConfidence = 0.5;
        } else if (messageCount < 20) {
            dataConfidence = 0.7;
        } else {
            dataConfidence = 0.9;
        }
        double consistency = 1.0 - Math.min(variance(features.vector()), 0.5) * 2.0;
        return clamp(dataConfidence * 0.4 + stageConfidence * 0.3 + consistency * 0.3, 0.0, 1.0);
    }

    boolean requiresHumanReview(double score, GroomingStage stage, double confidence) {
        if (score >= criticalThreshold) {
            return true;
        }
        if (score >= reviewThreshold) {
            return true;
        }
        if (stage == GroomingStage.ESCALATION_RISK) {
            return true;
        }
        return stage == GroomingStage.ISOLATION_ATTEMPTS && confidence > isolationMinConfidence;
    }

    List<FeatureContribution> contributions(BehavioralFeatures features, double multiplier) {
        List<FeatureContribution> out = new ArrayList<>();
        for (FeatureName name : FeatureName.values()) {
            double value = features.value(name);
            out.add(new FeatureContribution(
                    name,
                    value,
                    value * profile.weight(name) * multiplier,
                    name.description()
            ));
        }
        // stable sort: equal weights stay in declared feature order
        out.sort(Comparator.comparingDouble((FeatureContribution c) -> c.contributionWeight).reversed());
        return List.copyOf(out);
    }

    static String reasoning(double score, GroomingStage stage, BehavioralFeatures features, int messageCount) {
        List<FeatureName> byValue = new ArrayList<>(List.of(FeatureName.values()));
        byValue.sort(Comparator.comparingDouble((FeatureName n) -> features.value(n)).reversed());

        List<String> factors = new ArrayList<>();
        for (FeatureName name : byValue.subList(0, PRIMARY_FACTOR_LIMIT)) {
            double value = features.value(name);
            if (value > PRIMARY_FACTOR_FLOOR) {
                factors.add(String.format(Locale.US, "%s (%.2f)", name.label(), value));
            }
        }

        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.US, "Risk Score: %.1f/100", score));
        parts.add("Classification: " + stage.title());
        parts.add(StageCatalog.description(stage));
        parts.add("Message Count: " + messageCount);
        if (!factors.isEmpty()) {
            parts.add("Primary Risk Factors: " + String.join(", ", factors));
        }
        return String.join(" | ", parts);
    }

    static double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double sq = 0.0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        return sq / values.length;
    }

    private static void requireMessages(Conversation conversation) {
        if (conversation == null || conversation.messages.isEmpty()) {
            throw new ValidationException("conversation must contain at least one message");
        }
    }

    private static double clamp(double v, double lo, double hi) {
        if (!Double.isFinite(v)) {
            return lo;
        }
        return Math.max(lo, Math.min(hi, v));
    }
}
