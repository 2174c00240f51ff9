package com.groomsafe.model;

import com.groomsafe.core.ValidationException;

import java.util.Locale;

/**
 * The eight behavioral features in their fixed declared order.
 */
public enum FeatureName {
    CONTACT_FREQUENCY_SCORE(
            "contact_frequency_score",
            "Escalation in contact frequency over time",
            "Contact frequency escalation"
    ),
    PERSISTENCE_AFTER_NONRESPONSE(
            "persistence_after_nonresponse",
            "Continued messaging despite non-response",
            "Persistence after non-response"
    ),
    TIME_OF_DAY_IRREGULARITY(
            "time_of_day_irregularity",
            "Messaging at unusual hours",
            "Unusual messaging hours"
    ),
    EMOTIONAL_DEPENDENCY_INDICATORS(
            "emotional_dependency_indicators",
            "Patterns suggesting emotional manipulation",
            "Emotional dependency patterns"
    ),
    ISOLATION_PRESSURE(
            "isolation_pressure",
            "Attempts to isolate target from others",
            "Isolation pressure"
    ),
    SECRECY_PRESSURE(
            "secrecy_pressure",
            "Requests for secrecy or privacy",
            "Secrecy requests"
    ),
    PLATFORM_MIGRATION_ATTEMPTS(
            "platform_migration_attempts",
            "Attempts to move conversation to other platforms",
            "Platform migration attempts"
    ),
    TONE_SHIFT_SCORE(
            "tone_shift_score",
            "Changes in linguistic tone over time",
            "Tone shifts"
    );

    private final String wireName;
    private final String description;
    private final String label;

    FeatureName(String wireName, String description, String label) {
        this.wireName = wireName;
        this.description = description;
        this.label = label;
    }

    public String wireName() {
        return wireName;
    }

    public String description() {
        return description;
    }

    public String label() {
        return label;
    }

    public boolean isKeywordFeature() {
        return this == EMOTIONAL_DEPENDENCY_INDICATORS
                || this == ISOLATION_PRESSURE
                || this == SECRECY_PRESSURE
                || this == PLATFORM_MIGRATION_ATTEMPTS;
    }

    public static FeatureName fromWire(String raw) {
        String text = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (FeatureName name : values()) {
            if (name.wireName.equals(text)) {
                return name;
            }
        }
        throw new ValidationException("unknown feature: " + raw);
    }
}
