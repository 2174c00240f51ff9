package com.groomsafe.shield;

/**
 * Outcome of an exposure check. A denial is data, not an exception.
 */
public final class SafetyDecision {
    public final boolean safeToProceed;
    public final String reason;
    public final String recommendation;
    public final int casesReviewed;
    public final int highRiskExposures;
    public final double sessionDurationMinutes;
    public final int remainingCases;

    public SafetyDecision(
            boolean safeToProceed,
            String reason,
            String recommendation,
            int casesReviewed,
            int highRiskExposures,
            double sessionDurationMinutes,
            int remainingCases
    ) {
        this.safeToProceed = safeToProceed;
        this.reason = reason == null ? "" : reason;
        this.recommendation = recommendation == null ? "" : recommendation;
        this.casesReviewed = Math.max(0, casesReviewed);
        this.highRiskExposures = Math.max(0, highRiskExposures);
        this.sessionDurationMinutes = Math.max(0.0, sessionDurationMinutes);
        this.remainingCases = Math.max(0, remainingCases);
    }

    public static SafetyDecision allow(AnalystExposureState state, double sessionMinutes, int remainingCases) {
        return new SafetyDecision(true, "", "", state.casesReviewed(), state.highRiskExposures(),
                sessionMinutes, remainingCases);
    }

    public static SafetyDecision deny(
            String reason,
            String recommendation,
            AnalystExposureState state,
            double sessionMinutes
    ) {
        return new SafetyDecision(false, reason, recommendation, state.casesReviewed(), state.highRiskExposures(),
                sessionMinutes, 0);
    }
}
