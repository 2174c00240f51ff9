package com.groomsafe.pipeline;

import com.groomsafe.Conversations;
import com.groomsafe.config.Config;
import com.groomsafe.core.PipelineTelemetry;
import com.groomsafe.core.ValidationException;
import com.groomsafe.model.GroomingStage;
import com.groomsafe.model.RiskLevel;
import com.groomsafe.shield.ExposureLevel;
import com.groomsafe.shield.SafetyDecision;
import com.groomsafe.shield.VisualizationData;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssessmentPipelineTest {

    private static final Instant NOW = Instant.parse("2024-04-01T00:00:00Z");

    private final AssessmentPipeline pipeline = new AssessmentPipeline(
            Config.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void run_shouldProduceConsistentResultWithoutSummaryByDefault() {
        PipelineResult result = pipeline.run(Conversations.highRisk());

        assertEquals(GroomingStage.ISOLATION_ATTEMPTS, result.assessment.stage);
        assertEquals(result.assessment.assessmentId, result.explanation.assessmentId);
        assertEquals(result.conversation.id, result.features.conversationId);
        assertEquals(NOW, result.assessment.assessedAt);
        assertTrue(result.auditReport.contains("GROOMSAFE RISK ASSESSMENT AUDIT REPORT"));
        assertFalse(result.hasSafeSummary());
        assertNull(result.safeSummary);
        assertEquals(PipelineTelemetry.STEP_EXTRACT, result.steps.get(0).name());
        assertEquals(4, result.steps.size());
    }

    @Test
    void run_shouldBuildSafeSummaryWhenExposureRequested() {
        PipelineResult result = pipeline.run(Conversations.highRisk(), ExposureLevel.DETAILED);

        assertTrue(result.hasSafeSummary());
        assertEquals(ExposureLevel.DETAILED, result.safeSummary.exposureLevel);
        assertEquals(result.conversation.id, result.safeSummary.conversationId);

        VisualizationData data = pipeline.visualization(result);
        assertEquals(result.assessment.score, data.riskGauge().score());
    }

    @Test
    void run_shouldRejectNullConversation() {
        assertThrows(ValidationException.class, () -> pipeline.run(null));
    }

    @Test
    void runJson_shouldRenderFixtureEndToEnd() throws IOException {
        String json;
        try (InputStream in = getClass().getResourceAsStream("/conversations/high-risk.json")) {
            json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        JSONObject out = pipeline.runJson(json, "moderate");

        assertEquals("5b0c6f2e-8d1a-4c3b-9f4e-2a7d1e6c9b10",
                out.getJSONObject("assessment").getString("conversation_id"));
        assertEquals("critical", out.getJSONObject("assessment").getString("risk_level"));
        assertEquals("moderate", out.getJSONObject("safe_summary").getString("exposure_level"));
        assertTrue(out.has("features"));
        assertTrue(out.has("explanation"));
    }

    @Test
    void defaultConstructor_shouldLoadLayeredConfiguration() {
        AssessmentPipeline layered = new AssessmentPipeline();

        assertEquals(20, layered.exposureGuard().limits().maxCasesPerSession());
        assertEquals(GroomingStage.ISOLATION_ATTEMPTS, layered.run(Conversations.highRisk()).assessment.stage);
    }

    @Test
    void exposureGuard_shouldUseConfiguredLimits() {
        AssessmentPipeline strict = new AssessmentPipeline(
                Config.fromMap(Map.of("shield.max_high_risk_per_session", "1")), Clock.fixed(NOW, ZoneOffset.UTC));
        assertEquals(1, strict.exposureGuard().limits().maxHighRiskPerSession());
        PipelineResult result = strict.run(Conversations.highRisk());

        strict.exposureGuard().logExposure("analyst-7", result.assessment.riskLevel, 4.0);
        SafetyDecision next = strict.exposureGuard().checkSafety("analyst-7", RiskLevel.CRITICAL);

        assertFalse(next.safeToProceed);
        assertEquals("Maximum high-risk exposures exceeded", next.reason);
    }
}
