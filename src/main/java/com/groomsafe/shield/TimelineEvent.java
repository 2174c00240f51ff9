package com.groomsafe.shield;

import com.groomsafe.model.GroomingStage;
import com.groomsafe.model.RiskLevel;

import java.time.Instant;

/**
 * One abstracted point on a conversation timeline. Carries no message content.
 * {@code stage} is set only on the final assessment event.
 */
public record TimelineEvent(
        Instant timestamp,
        String eventType,
        String description,
        RiskLevel riskLevel,
        GroomingStage stage
) {
    public static final String CONVERSATION_START = "conversation_start";
    public static final String BEHAVIORAL_SHIFT = "behavioral_shift";
    public static final String RISK_ASSESSMENT = "risk_assessment";
    public static final String PLATFORM_MIGRATION = "platform_migration";
}
