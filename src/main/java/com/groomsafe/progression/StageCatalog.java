package com.groomsafe.progression;

import com.groomsafe.model.GroomingStage;

import java.util.List;

/**
 * Fixed per-stage tables. Every lookup is an exhaustive switch, so adding a stage
 * without filling in each table fails compilation.
 */
public final class StageCatalog {

    private StageCatalog() {
    }

    public static double defaultMultiplier(GroomingStage stage) {
        return switch (stage) {
            case INITIAL_CONTACT -> 0.4;
            case TRUST_BUILDING -> 0.6;
            case EMOTIONAL_DEPENDENCY -> 0.8;
            case ISOLATION_ATTEMPTS -> 0.95;
            // Above 1.0 on purpose: strong escalation saturates at 100.
            case ESCALATION_RISK -> 1.2;
            case UNKNOWN -> 0.5;
        };
    }

    public static String description(GroomingStage stage) {
        return switch (stage) {
            case INITIAL_CONTACT -> "Initial contact phase with minimal behavioral signals. "
                    + "Conversation appears exploratory with low risk indicators.";
            case TRUST_BUILDING -> "Trust building phase characterized by increasing contact frequency "
                    + "and developing rapport. Moderate behavioral signals present.";
            case EMOTIONAL_DEPENDENCY -> "Emotional dependency phase with patterns suggesting emotional "
                    + "manipulation or dependency building. Elevated risk indicators.";
            case ISOLATION_ATTEMPTS -> "Isolation attempt phase showing secrecy pressure, isolation tactics, "
                    + "or platform migration attempts. High risk indicators present.";
            case ESCALATION_RISK -> "Escalation risk phase with multiple high-risk behavioral signals. "
                    + "Urgent patterns detected requiring immediate review.";
            case UNKNOWN -> "Unable to classify stage due to insufficient data or ambiguous patterns.";
        };
    }

    /**
     * Stage guidance listed in the audit report.
     */
    public static List<String> recommendations(GroomingStage stage) {
        return switch (stage) {
            case INITIAL_CONTACT -> List.of(
                    "Continue monitoring conversation patterns",
                    "Establish baseline behavioral metrics",
                    "No immediate intervention required"
            );
            case TRUST_BUILDING -> List.of(
                    "Increased monitoring recommended",
                    "Track feature progression over time",
                    "Consider educational interventions for potential victim"
            );
            case EMOTIONAL_DEPENDENCY -> List.of(
                    "High-priority monitoring required",
                    "Human review recommended within 24 hours",
                    "Consider platform-level safety interventions",
                    "Prepare support resources for potential victim"
            );
            case ISOLATION_ATTEMPTS -> List.of(
                    "Urgent human review required",
                    "Consider immediate safety interventions",
                    "Alert platform safety team",
                    "Document evidence for potential investigation"
            );
            case ESCALATION_RISK -> List.of(
                    "CRITICAL: Immediate human review required",
                    "Escalate to platform safety team immediately",
                    "Consider emergency intervention protocols",
                    "Preserve all evidence for law enforcement",
                    "Activate victim support resources"
            );
            case UNKNOWN -> List.of(
                    "Gather additional data for classification",
                    "Manual review may be required",
                    "Continue baseline monitoring"
            );
        };
    }

    public static StageProfile profile(GroomingStage stage) {
        return switch (stage) {
            case INITIAL_CONTACT -> new StageProfile(
                    "low", "days to weeks", "Trust Building",
                    List.of("Increasing contact frequency", "Personal questions"));
            case TRUST_BUILDING -> new StageProfile(
                    "moderate", "weeks to months", "Emotional Dependency",
                    List.of("Emotional manipulation", "Isolation attempts"));
            case EMOTIONAL_DEPENDENCY -> new StageProfile(
                    "high", "variable", "Isolation Attempts",
                    List.of("Secrecy requests", "Platform migration"));
            case ISOLATION_ATTEMPTS -> new StageProfile(
                    "critical", "variable", "Escalation Risk",
                    List.of("Off-platform contact", "Meeting requests"));
            case ESCALATION_RISK -> new StageProfile(
                    "critical", "immediate", "None (intervention required)",
                    List.of("All escalation indicators"));
            case UNKNOWN -> new StageProfile("unknown", "unknown", "unknown", List.of());
        };
    }

    /**
     * Extra recommendations appended by the explanation for advanced stages; empty otherwise.
     */
    public static List<String> explanationAdditions(GroomingStage stage) {
        return switch (stage) {
            case ESCALATION_RISK -> List.of("CRITICAL: Immediate action required");
            case ISOLATION_ATTEMPTS -> List.of(
                    "Alert platform safety team",
                    "Document evidence for investigation"
            );
            case INITIAL_CONTACT, TRUST_BUILDING, EMOTIONAL_DEPENDENCY, UNKNOWN -> List.of();
        };
    }

    /**
     * Analyst-safe indicator line for the stage; empty when the stage adds nothing.
     */
    public static String riskIndicator(GroomingStage stage) {
        return switch (stage) {
            case TRUST_BUILDING -> "Trust building phase detected";
            case EMOTIONAL_DEPENDENCY -> "Emotional dependency phase detected";
            case ISOLATION_ATTEMPTS -> "Isolation attempt phase detected";
            case ESCALATION_RISK -> "ESCALATION RISK PHASE DETECTED";
            case INITIAL_CONTACT, UNKNOWN -> "";
        };
    }
}
