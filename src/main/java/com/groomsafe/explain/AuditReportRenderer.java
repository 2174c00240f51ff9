package com.groomsafe.explain;

import com.groomsafe.model.RiskAssessment;
import com.groomsafe.progression.StageCatalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the plain-text audit report kept for compliance review.
 */
public final class AuditReportRenderer {
    private static final String HEAVY_RULE = "=".repeat(80);
    private static final String LIGHT_RULE = "-".repeat(80);

    public String render(Explanation explanation, RiskAssessment assessment) {
        List<String> lines = new ArrayList<>();
        lines.add(HEAVY_RULE);
        lines.add("GROOMSAFE RISK ASSESSMENT AUDIT REPORT");
        lines.add(HEAVY_RULE);
        lines.add("");
        lines.add("Assessment ID: " + assessment.assessmentId);
        lines.add("Conversation ID: " + assessment.conversationId);
        lines.add("Timestamp: " + assessment.assessedAt);
        lines.add("Model Version: " + explanation.modelVersion);

        section(lines, "SUMMARY");
        lines.add(explanation.summary);

        section(lines, "RISK METRICS");
        lines.add(String.format(Locale.US, "Risk Score: %.2f/100", assessment.score));
        lines.add("Risk Level: " + assessment.riskLevel.wireName().toUpperCase(Locale.ROOT));
        lines.add(String.format(Locale.US, "Confidence: %.2f", assessment.confidence));
        lines.add("Stage: " + assessment.stage.title());
        lines.add(String.format(Locale.US, "Stage Confidence: %.2f", assessment.stageConfidence));

        section(lines, "PRIMARY RISK FACTORS");
        bullets(lines, explanation.flaggingRationale.primaryReasons());

        section(lines, "TOP CONTRIBUTING FEATURES");
        for (Explanation.ContributorView c : explanation.featureAnalysis.topContributors()) {
            lines.add(String.format(Locale.US, "- %s: %.3f (contribution: %.3f)",
                    c.feature().wireName(), c.value(), c.contribution()));
            lines.add("  " + c.description());
        }

        section(lines, "STAGE GUIDANCE");
        lines.add(StageCatalog.description(assessment.stage));
        bullets(lines, StageCatalog.recommendations(assessment.stage));

        section(lines, "RECOMMENDATIONS");
        bullets(lines, explanation.recommendations);

        section(lines, "LIMITATIONS");
        bullets(lines, explanation.limitations);

        lines.add("");
        lines.add(HEAVY_RULE);
        lines.add("END OF REPORT");
        lines.add(HEAVY_RULE);
        return String.join("\n", lines);
    }

    private static void section(List<String> lines, String title) {
        lines.add("");
        lines.add(LIGHT_RULE);
        lines.add(title);
        lines.add(LIGHT_RULE);
    }

    private static void bullets(List<String> lines, List<String> items) {
        for (String item : items) {
            lines.add("- " + item);
        }
    }
}
