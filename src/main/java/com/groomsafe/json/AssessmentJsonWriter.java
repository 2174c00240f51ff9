package com.groomsafe.json;

import com.groomsafe.explain.Explanation;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.FeatureContribution;
import com.groomsafe.model.FeatureName;
import com.groomsafe.model.RiskAssessment;
import com.groomsafe.shield.SafeSummary;
import com.groomsafe.shield.SafetyDecision;
import com.groomsafe.shield.TimelineEvent;
import com.groomsafe.shield.VisualizationData;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Renders assessment outputs as JSON with snake_case keys and lowercase wire tags.
 */
public final class AssessmentJsonWriter {

    public JSONObject assessment(RiskAssessment a) {
        JSONObject root = new JSONObject();
        root.put("assessment_id", a.assessmentId.toString());
        root.put("conversation_id", a.conversationId.toString());
        root.put("grooming_risk_score", a.score);
        root.put("confidence_level", a.confidence);
        root.put("risk_level", a.riskLevel.wireName());
        root.put("current_stage", a.stage.wireName());
        root.put("stage_confidence", a.stageConfidence);
        JSONArray contributions = new JSONArray();
        for (FeatureContribution c : a.featureContributions) {
            JSONObject item = new JSONObject();
            item.put("feature_name", c.featureName.wireName());
            item.put("value", c.value);
            item.put("contribution_weight", c.contributionWeight);
            item.put("description", c.description);
            contributions.put(item);
        }
        root.put("feature_contributions", contributions);
        root.put("reasoning_summary", a.reasoningSummary);
        root.put("requires_human_review", a.requiresHumanReview);
        root.put("assessment_timestamp", a.assessedAt.toString());
        root.put("model_version", a.modelVersion);
        return root;
    }

    public JSONObject features(BehavioralFeatures f) {
        JSONObject root = new JSONObject();
        root.put("conversation_id", f.conversationId.toString());
        for (FeatureName name : FeatureName.values()) {
            root.put(name.wireName(), f.value(name));
        }
        root.put("extracted_at", f.extractedAt.toString());
        root.put("feature_version", f.featureVersion);
        return root;
    }

    public JSONObject explanation(Explanation e) {
        JSONObject root = new JSONObject();
        root.put("assessment_id", e.assessmentId.toString());
        root.put("conversation_id", e.conversationId.toString());
        root.put("timestamp", e.timestamp.toString());
        root.put("model_version", e.modelVersion);
        root.put("summary", e.summary);

        Explanation.FlaggingRationale fr = e.flaggingRationale;
        JSONObject rationale = new JSONObject();
        rationale.put("flagged", fr.flagged());
        rationale.put("primary_reasons", new JSONArray(fr.primaryReasons()));
        rationale.put("risk_level", fr.riskLevel().wireName());
        rationale.put("requires_action", fr.requiresAction());
        root.put("flagging_rationale", rationale);

        Explanation.FeatureAnalysis fa = e.featureAnalysis;
        JSONObject analysis = new JSONObject();
        analysis.put("top_contributors", contributors(fa.topContributors(), true));
        analysis.put("moderate_contributors", contributors(fa.moderateContributors(), false));
        JSONObject counts = new JSONObject();
        counts.put("high", fa.highCount());
        counts.put("moderate", fa.moderateCount());
        counts.put("low", fa.lowCount());
        analysis.put("feature_count", counts);
        analysis.put("interpretation", fa.interpretation());
        root.put("feature_analysis", analysis);

        Explanation.StageAnalysis sa = e.stageAnalysis;
        JSONObject stage = new JSONObject();
        stage.put("current_stage", sa.currentStage());
        stage.put("stage_confidence", sa.stageConfidence());
        stage.put("severity", sa.severity());
        stage.put("typical_duration", sa.typicalDuration());
        stage.put("potential_next_stage", sa.potentialNextStage());
        stage.put("warning_signs", new JSONArray(sa.warningSigns()));
        root.put("stage_analysis", stage);

        Explanation.RiskEvolution re = e.riskEvolution;
        JSONObject evolution = new JSONObject();
        evolution.put("conversation_duration_hours", re.durationHours());
        evolution.put("message_count", re.messageCount());
        evolution.put("progression_rate", re.progressionRate());
        evolution.put("risk_trajectory", re.riskTrajectory());
        evolution.put("timeline_summary", re.timelineSummary());
        root.put("risk_evolution", evolution);

        Explanation.ConfidenceAnalysis ca = e.confidenceAnalysis;
        JSONObject confidence = new JSONObject();
        confidence.put("confidence_score", ca.confidenceScore());
        confidence.put("confidence_label", ca.confidenceLabel());
        confidence.put("factors", new JSONArray(ca.factors()));
        confidence.put("reliability", ca.reliability());
        root.put("confidence_analysis", confidence);

        root.put("recommendations", new JSONArray(e.recommendations));
        root.put("limitations", new JSONArray(e.limitations));
        return root;
    }

    public JSONObject safeSummary(SafeSummary s) {
        JSONObject root = new JSONObject();
        root.put("conversation_id", s.conversationId.toString());
        root.put("message_count", s.messageCount);
        root.put("conversation_duration_hours", s.durationHours);
        root.put("temporal_pattern_summary", s.temporalPatternSummary);
        root.put("behavioral_cluster", s.behavioralCluster);
        root.put("key_risk_indicators", new JSONArray(s.keyRiskIndicators));
        JSONArray events = new JSONArray();
        for (TimelineEvent event : s.timelineEvents) {
            JSONObject item = new JSONObject();
            item.put("timestamp", event.timestamp().toString());
            item.put("event_type", event.eventType());
            item.put("description", event.description());
            item.put("risk_level", event.riskLevel().wireName());
            if (event.stage() != null) {
                item.put("stage", event.stage().wireName());
            }
            events.put(item);
        }
        root.put("timeline_events", events);
        root.put("exposure_level", s.exposureLevel.wireName());
        root.put("analyst_safety_certified", s.analystSafetyCertified);
        return root;
    }

    public JSONObject safetyDecision(SafetyDecision d) {
        JSONObject root = new JSONObject();
        root.put("safe_to_proceed", d.safeToProceed);
        if (!d.safeToProceed) {
            root.put("reason", d.reason);
            root.put("recommendation", d.recommendation);
        } else {
            root.put("remaining_cases", d.remainingCases);
        }
        root.put("cases_reviewed", d.casesReviewed);
        root.put("high_risk_exposures", d.highRiskExposures);
        root.put("session_duration_minutes", d.sessionDurationMinutes);
        return root;
    }

    public JSONObject visualization(VisualizationData v) {
        JSONObject root = new JSONObject();
        JSONObject gauge = new JSONObject();
        gauge.put("score", v.riskGauge().score());
        gauge.put("level", v.riskGauge().level().wireName());
        gauge.put("confidence", v.riskGauge().confidence());
        root.put("risk_score_gauge", gauge);
        root.put("feature_radar", new JSONObject(v.featureRadar()));

        JSONObject heatmap = new JSONObject();
        JSONArray hours = new JSONArray();
        for (int h = 0; h < 24; h++) {
            hours.put(h);
        }
        heatmap.put("hours", hours);
        heatmap.put("message_counts", new JSONArray(v.temporalHeatmap().messageCounts()));
        heatmap.put("peak_hour", v.temporalHeatmap().peakHour());
        root.put("temporal_heatmap", heatmap);

        JSONObject stage = new JSONObject();
        stage.put("current_stage", v.stageProgression().currentStage().wireName());
        stage.put("confidence", v.stageProgression().confidence());
        root.put("stage_progression", stage);
        return root;
    }

    private static JSONArray contributors(List<Explanation.ContributorView> views, boolean withDescription) {
        JSONArray out = new JSONArray();
        for (Explanation.ContributorView view : views) {
            JSONObject item = new JSONObject();
            item.put("feature", view.feature().wireName());
            item.put("value", view.value());
            item.put("contribution", view.contribution());
            if (withDescription) {
                item.put("description", view.description());
            }
            out.put(item);
        }
        return out;
    }
}
