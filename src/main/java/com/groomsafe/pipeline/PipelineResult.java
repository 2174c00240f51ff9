package com.groomsafe.pipeline;

import com.groomsafe.core.PipelineTelemetry;
import com.groomsafe.explain.Explanation;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.RiskAssessment;
import com.groomsafe.shield.SafeSummary;

import java.util.List;

/**
 * Everything produced for one conversation. {@code safeSummary} is null unless an
 * exposure level was requested.
 */
public final class PipelineResult {
    public final Conversation conversation;
    public final BehavioralFeatures features;
    public final RiskAssessment assessment;
    public final Explanation explanation;
    public final String auditReport;
    public final SafeSummary safeSummary;
    public final List<PipelineTelemetry.StepRecord> steps;

    public PipelineResult(
            Conversation conversation,
            BehavioralFeatures features,
            RiskAssessment assessment,
            Explanation explanation,
            String auditReport,
            SafeSummary safeSummary,
            List<PipelineTelemetry.StepRecord> steps
    ) {
        this.conversation = conversation;
        this.features = features;
        this.assessment = assessment;
        this.explanation = explanation;
        this.auditReport = auditReport == null ? "" : auditReport;
        this.safeSummary = safeSummary;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public boolean hasSafeSummary() {
        return safeSummary != null;
    }
}
