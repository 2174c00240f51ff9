package com.groomsafe.shield;

import java.time.Instant;

/**
 * Immutable snapshot of one analyst's current review session.
 */
public record AnalystExposureState(
        String analystId,
        Instant sessionStart,
        int casesReviewed,
        int highRiskExposures,
        double totalExposureMinutes
) {
}
