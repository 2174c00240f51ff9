package com.groomsafe.shield;

import com.groomsafe.config.Config;
import com.groomsafe.core.ConfigurationException;
import com.groomsafe.core.ValidationException;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.FeatureName;
import com.groomsafe.model.Message;
import com.groomsafe.model.RiskAssessment;
import com.groomsafe.model.RiskLevel;
import com.groomsafe.progression.StageCatalog;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds abstracted summaries and chart data for analysts. Output is derived from
 * timestamps, counts and feature scores only; message text is never read.
 */
public final class SafeSummaryBuilder {
    private static final double INDICATOR_THRESHOLD = 0.5;
    private static final double MIGRATION_MARKER_THRESHOLD = 0.6;
    private static final double MIDPOINT_SCORE_FACTOR = 0.6;
    private static final int DEFAULT_PEAK_HOUR = 12;

    private final ZoneId zone;

    public SafeSummaryBuilder() {
        this(ZoneId.of("UTC"));
    }

    public SafeSummaryBuilder(Config config) {
        this(resolveZone(config.getString("features.zone", "UTC")));
    }

    public SafeSummaryBuilder(ZoneId zone) {
        this.zone = zone == null ? ZoneId.of("UTC") : zone;
    }

    public SafeSummary createSafeSummary(
            Conversation conversation,
            RiskAssessment assessment,
            BehavioralFeatures features,
            String exposureLevel
    ) {
        return createSafeSummary(conversation, assessment, features, ExposureLevel.fromWireOrMinimal(exposureLevel));
    }

    public SafeSummary createSafeSummary(
            Conversation conversation,
            RiskAssessment assessment,
            BehavioralFeatures features,
            ExposureLevel exposureLevel
    ) {
        requireInputs(conversation, assessment, features);
        ExposureLevel level = exposureLevel == null ? ExposureLevel.MINIMAL : exposureLevel;
        double hours = round2(conversation.durationHours());

        return SafeSummary.builder()
                .conversationId(conversation.id)
                .messageCount(conversation.messageCount())
                .durationHours(hours)
                .temporalPatternSummary(temporalSummary(conversation.messageCount(), hours, features))
                .behavioralCluster(behavioralCluster(features))
                .keyRiskIndicators(riskIndicators(features, assessment))
                .timelineEvents(timeline(conversation, features, assessment, level))
                .exposureLevel(level)
                .analystSafetyCertified(true)
                .build();
    }

    public VisualizationData visualizationData(
            Conversation conversation,
            BehavioralFeatures features,
            RiskAssessment assessment
    ) {
        requireInputs(conversation, assessment, features);
        Map<String, Double> radar = new LinkedHashMap<>();
        radar.put("contact_frequency", features.contactFrequencyScore);
        radar.put("persistence", features.persistenceAfterNonresponse);
        radar.put("time_irregularity", features.timeOfDayIrregularity);
        radar.put("emotional_dependency", features.emotionalDependencyIndicators);
        radar.put("isolation", features.isolationPressure);
        radar.put("secrecy", features.secrecyPressure);
        radar.put("platform_migration", features.platformMigrationAttempts);
        radar.put("tone_shift", features.toneShiftScore);

        return new VisualizationData(
                new VisualizationData.Gauge(assessment.score, assessment.riskLevel, assessment.confidence),
                radar,
                heatmap(conversation),
                new VisualizationData.StageProgress(assessment.stage, assessment.stageConfidence)
        );
    }

    static String temporalSummary(int messageCount, double hours, BehavioralFeatures features) {
        double rate = hours > 0.0 ? messageCount / hours : 0.0;
        String intensity;
        if (rate > 10) {
            intensity = "Very high";
        } else if (rate > 5) {
            intensity = "High";
        } else if (rate > 2) {
            intensity = "Moderate";
        } else {
            intensity = "Low";
        }

        String timing;
        if (features.timeOfDayIrregularity > 0.6) {
            timing = "with significant off-hours activity";
        } else if (features.timeOfDayIrregularity > 0.3) {
            timing = "with some off-hours activity";
        } else {
            timing = "during normal hours";
        }
        return String.format(Locale.US, "%s messaging intensity (%.1f msg/hr) over %.1f hours, %s",
                intensity, rate, hours, timing);
    }

    /**
     * Dominant pattern by feature value; ties go to the earlier feature.
     */
    static String behavioralCluster(BehavioralFeatures features) {
        FeatureName dominant = FeatureName.values()[0];
        for (FeatureName name : FeatureName.values()) {
            if (features.value(name) > features.value(dominant)) {
                dominant = name;
            }
        }
        double score = features.value(dominant);
        if (score < 0.3) {
            return "Low Risk Behavioral Pattern";
        }
        if (score < 0.6) {
            return "Moderate Risk: " + patternLabel(dominant);
        }
        return "High Risk: " + patternLabel(dominant);
    }

    static String patternLabel(FeatureName name) {
        return switch (name) {
            case CONTACT_FREQUENCY_SCORE -> "High Contact Frequency";
            case PERSISTENCE_AFTER_NONRESPONSE -> "Persistence Pattern";
            case TIME_OF_DAY_IRREGULARITY -> "Temporal Anomaly";
            case EMOTIONAL_DEPENDENCY_INDICATORS -> "Emotional Manipulation";
            case ISOLATION_PRESSURE -> "Isolation Tactics";
            case SECRECY_PRESSURE -> "Secrecy Pressure";
            case PLATFORM_MIGRATION_ATTEMPTS -> "Platform Migration";
            case TONE_SHIFT_SCORE -> "Linguistic Shifts";
        };
    }

    static List<String> riskIndicators(BehavioralFeatures features, RiskAssessment assessment) {
        List<String> out = new ArrayList<>();
        for (FeatureName name : FeatureName.values()) {
            String indicator = indicatorText(name);
            if (!indicator.isEmpty() && features.value(name) > INDICATOR_THRESHOLD) {
                out.add(indicator);
            }
        }
        String stageIndicator = StageCatalog.riskIndicator(assessment.stage);
        if (!stageIndicator.isEmpty()) {
            out.add(stageIndicator);
        }
        if (out.isEmpty()) {
            out.add("No significant risk indicators");
        }
        return List.copyOf(out);
    }

    private static String indicatorText(FeatureName name) {
        return switch (name) {
            case CONTACT_FREQUENCY_SCORE -> "Escalating contact pattern detected";
            case PERSISTENCE_AFTER_NONRESPONSE -> "Persistent messaging despite non-response";
            case TIME_OF_DAY_IRREGULARITY -> "Off-hours messaging pattern";
            case EMOTIONAL_DEPENDENCY_INDICATORS -> "Emotional manipulation indicators";
            case ISOLATION_PRESSURE -> "Isolation attempt signals";
            case SECRECY_PRESSURE -> "Secrecy or privacy pressure";
            case PLATFORM_MIGRATION_ATTEMPTS -> "Platform migration attempts";
            case TONE_SHIFT_SCORE -> "";
        };
    }

    static List<TimelineEvent> timeline(
            Conversation conversation,
            BehavioralFeatures features,
            RiskAssessment assessment,
            ExposureLevel level
    ) {
        List<Message> sorted = conversation.sortedMessages();
        Message first = sorted.get(0);
        Message last = sorted.get(sorted.size() - 1);

        List<TimelineEvent> events = new ArrayList<>();
        events.add(new TimelineEvent(first.timestamp, TimelineEvent.CONVERSATION_START,
                "Initial contact", RiskLevel.MINIMAL, null));
        if (sorted.size() >= 3) {
            Message middle = sorted.get(sorted.size() / 2);
            events.add(new TimelineEvent(middle.timestamp, TimelineEvent.BEHAVIORAL_SHIFT,
                    "Mid-conversation behavioral analysis point",
                    RiskLevel.fromScore(assessment.score * MIDPOINT_SCORE_FACTOR), null));
        }
        events.add(new TimelineEvent(last.timestamp, TimelineEvent.RISK_ASSESSMENT,
                String.format(Locale.US, "Final risk score: %.1f", assessment.score),
                assessment.riskLevel, assessment.stage));
        if (level == ExposureLevel.DETAILED && features.platformMigrationAttempts > MIGRATION_MARKER_THRESHOLD) {
            events.add(new TimelineEvent(last.timestamp, TimelineEvent.PLATFORM_MIGRATION,
                    "Platform migration attempt detected", RiskLevel.HIGH, null));
        }
        return List.copyOf(events);
    }

    VisualizationData.Heatmap heatmap(Conversation conversation) {
        int[] counts = new int[24];
        boolean any = false;
        for (Message message : conversation.messages) {
            if (message.isAdult()) {
                counts[message.hourOfDay(zone)]++;
                any = true;
            }
        }
        int peak = DEFAULT_PEAK_HOUR;
        if (any) {
            peak = 0;
            for (int hour = 1; hour < 24; hour++) {
                if (counts[hour] > counts[peak]) {
                    peak = hour;
                }
            }
        }
        List<Integer> out = new ArrayList<>(24);
        for (int count : counts) {
            out.add(count);
        }
        return new VisualizationData.Heatmap(out, peak);
    }

    private static void requireInputs(Conversation conversation, RiskAssessment assessment, BehavioralFeatures f) {
        if (conversation == null || assessment == null || f == null) {
            throw new ValidationException("conversation, assessment and features are required");
        }
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static ZoneId resolveZone(String raw) {
        try {
            return ZoneId.of(raw);
        } catch (DateTimeException e) {
            throw new ConfigurationException("invalid features.zone: " + raw, e);
        }
    }
}
