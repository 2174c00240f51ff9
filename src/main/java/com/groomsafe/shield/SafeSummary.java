package com.groomsafe.shield;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Analyst-facing view of a conversation built only from counts, timings and
 * feature scores.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SafeSummary {
    public final UUID conversationId;
    public final int messageCount;
    public final double durationHours;
    public final String temporalPatternSummary;
    public final String behavioralCluster;
    public final List<String> keyRiskIndicators;
    public final List<TimelineEvent> timelineEvents;
    public final ExposureLevel exposureLevel;
    public final boolean analystSafetyCertified;
}
