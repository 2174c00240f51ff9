package com.groomsafe.model;

import com.groomsafe.core.ValidationException;

import java.util.Locale;

public enum RiskLevel {
    MINIMAL("minimal"),
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isHighRisk() {
        return this == HIGH || this == CRITICAL;
    }

    /**
     * Bucket boundaries are inclusive upper bounds: 20, 40, 60, 80.
     */
    public static RiskLevel fromScore(double score) {
        if (score <= 20.0) {
            return MINIMAL;
        }
        if (score <= 40.0) {
            return LOW;
        }
        if (score <= 60.0) {
            return MODERATE;
        }
        if (score <= 80.0) {
            return HIGH;
        }
        return CRITICAL;
    }

    public static RiskLevel fromWire(String raw) {
        String text = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.wireName.equals(text)) {
                return level;
            }
        }
        throw new ValidationException("unknown risk level: " + raw);
    }
}
