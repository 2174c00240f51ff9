package com.groomsafe.shield;

import com.groomsafe.Conversations;
import com.groomsafe.json.AssessmentJsonWriter;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.GroomingStage;
import com.groomsafe.model.Message;
import com.groomsafe.model.RiskAssessment;
import com.groomsafe.model.RiskLevel;
import com.groomsafe.model.SenderRole;
import com.groomsafe.scoring.RiskSynthesizer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.groomsafe.Conversations.minor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SafeSummaryBuilderTest {

    private final RiskSynthesizer synthesizer = new RiskSynthesizer();
    private final SafeSummaryBuilder builder = new SafeSummaryBuilder();

    @Test
    void createSafeSummary_shouldAbstractBenignConversation() {
        Conversation conversation = Conversations.benign();
        BehavioralFeatures features = synthesizer.extractor().extract(conversation);
        RiskAssessment a = synthesizer.assess(conversation, features);

        SafeSummary summary = builder.createSafeSummary(conversation, a, features, ExposureLevel.MODERATE);

        assertEquals(6, summary.messageCount);
        assertEquals(5.0, summary.durationHours);
        assertEquals("Low messaging intensity (1.2 msg/hr) over 5.0 hours, during normal hours",
                summary.temporalPatternSummary);
        assertEquals("Low Risk Behavioral Pattern", summary.behavioralCluster);
        assertEquals(List.of("No significant risk indicators"), summary.keyRiskIndicators);
        assertEquals(3, summary.timelineEvents.size());
        assertEquals(Instant.parse("2024-03-01T13:00:00Z"), summary.timelineEvents.get(1).timestamp());
        assertEquals(RiskLevel.MINIMAL, summary.timelineEvents.get(1).riskLevel());
        assertTrue(summary.analystSafetyCertified);
    }

    @Test
    void createSafeSummary_shouldFlagHighRiskConversation() {
        Conversation conversation = Conversations.highRisk();
        BehavioralFeatures features = synthesizer.extractor().extract(conversation);
        RiskAssessment a = synthesizer.assess(conversation, features);

        SafeSummary minimal = builder.createSafeSummary(conversation, a, features, ExposureLevel.MINIMAL);
        SafeSummary detailed = builder.createSafeSummary(conversation, a, features, ExposureLevel.DETAILED);

        assertEquals("Moderate messaging intensity (3.0 msg/hr) over 4.0 hours, with significant off-hours activity",
                minimal.temporalPatternSummary);
        assertEquals("High Risk: Temporal Anomaly", minimal.behavioralCluster);
        assertTrue(minimal.keyRiskIndicators.contains("Secrecy or privacy pressure"));
        assertTrue(minimal.keyRiskIndicators.contains("Persistent messaging despite non-response"));
        assertEquals("Isolation attempt phase detected",
                minimal.keyRiskIndicators.get(minimal.keyRiskIndicators.size() - 1));

        assertEquals(3, minimal.timelineEvents.size());
        assertEquals(RiskLevel.MODERATE, minimal.timelineEvents.get(1).riskLevel());
        TimelineEvent last = minimal.timelineEvents.get(2);
        assertEquals(TimelineEvent.RISK_ASSESSMENT, last.eventType());
        assertEquals("Final risk score: 95.0", last.description());
        assertEquals(GroomingStage.ISOLATION_ATTEMPTS, last.stage());
        assertNull(minimal.timelineEvents.get(0).stage());

        assertEquals(4, detailed.timelineEvents.size());
        assertEquals(TimelineEvent.PLATFORM_MIGRATION, detailed.timelineEvents.get(3).eventType());
    }

    @Test
    void createSafeSummary_shouldTreatUnknownExposureAsMinimal() {
        Conversation conversation = Conversations.highRisk();
        BehavioralFeatures features = synthesizer.extractor().extract(conversation);
        RiskAssessment a = synthesizer.assess(conversation, features);

        SafeSummary summary = builder.createSafeSummary(conversation, a, features, "everything");

        assertEquals(ExposureLevel.MINIMAL, summary.exposureLevel);
        assertEquals(3, summary.timelineEvents.size());
    }

    @Test
    void createSafeSummary_shouldNeverContainMessageText() {
        Conversation conversation = Conversations.highRisk();
        BehavioralFeatures features = synthesizer.extractor().extract(conversation);
        RiskAssessment a = synthesizer.assess(conversation, features);

        SafeSummary summary = builder.createSafeSummary(conversation, a, features, ExposureLevel.DETAILED);
        String rendered = new AssessmentJsonWriter().safeSummary(summary).toString().toLowerCase();

        for (Message message : conversation.messages) {
            if (message.abstractedText.length() > 4) {
                assertFalse(rendered.contains(message.abstractedText.toLowerCase()), message.abstractedText);
            }
        }
    }

    @Test
    void visualizationData_shouldBucketAdultMessagesByHour() {
        Conversation conversation = Conversations.highRisk();
        BehavioralFeatures features = synthesizer.extractor().extract(conversation);
        RiskAssessment a = synthesizer.assess(conversation, features);

        VisualizationData data = builder.visualizationData(conversation, features, a);

        assertEquals(24, data.temporalHeatmap().messageCounts().size());
        assertEquals(6, data.temporalHeatmap().messageCounts().get(23));
        assertEquals(2, data.temporalHeatmap().messageCounts().get(1));
        assertEquals(0, data.temporalHeatmap().messageCounts().get(0));
        assertEquals(23, data.temporalHeatmap().peakHour());
        assertEquals(95.0, data.riskGauge().score(), 1e-9);
        assertEquals(8, data.featureRadar().size());
        assertEquals(GroomingStage.ISOLATION_ATTEMPTS, data.stageProgression().currentStage());
    }

    @Test
    void visualizationData_shouldDefaultPeakHourWithoutAdultMessages() {
        Conversation conversation = Conversation.builder().messages(List.of(
                minor("2024-03-01T03:00:00Z", "a"),
                minor("2024-03-01T04:00:00Z", "b"))).build();
        BehavioralFeatures features = synthesizer.extractor().extract(conversation);
        RiskAssessment a = synthesizer.assess(conversation, features);

        VisualizationData data = builder.visualizationData(conversation, features, a);

        assertEquals(12, data.temporalHeatmap().peakHour());
        assertTrue(data.temporalHeatmap().messageCounts().stream().allMatch(c -> c == 0));
    }

    @Test
    void visualizationData_shouldBucketByHourAsWritten() {
        ZoneOffset saoPaulo = ZoneOffset.ofHours(-3);
        Conversation conversation = Conversation.builder().messages(List.of(
                Message.builder().timestamp(Instant.parse("2024-03-01T22:00:00Z")).offset(saoPaulo)
                        .senderRole(SenderRole.ADULT).abstractedText("a").build(),
                Message.builder().timestamp(Instant.parse("2024-03-01T23:00:00Z")).offset(saoPaulo)
                        .senderRole(SenderRole.ADULT).abstractedText("b").build(),
                Message.builder().timestamp(Instant.parse("2024-03-01T23:10:00Z")).offset(saoPaulo)
                        .senderRole(SenderRole.ADULT).abstractedText("c").build())).build();
        BehavioralFeatures features = synthesizer.extractor().extract(conversation);
        RiskAssessment a = synthesizer.assess(conversation, features);

        VisualizationData data = builder.visualizationData(conversation, features, a);

        assertEquals(1, data.temporalHeatmap().messageCounts().get(19));
        assertEquals(2, data.temporalHeatmap().messageCounts().get(20));
        assertEquals(0, data.temporalHeatmap().messageCounts().get(23));
        assertEquals(20, data.temporalHeatmap().peakHour());
    }
}
