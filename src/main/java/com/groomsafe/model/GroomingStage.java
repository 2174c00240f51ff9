package com.groomsafe.model;

import com.groomsafe.core.ValidationException;

import java.util.Locale;

/**
 * Progression stages in severity order. Declaration order is also the tie-break order
 * used by the stage classifier.
 */
public enum GroomingStage {
    INITIAL_CONTACT("initial_contact"),
    TRUST_BUILDING("trust_building"),
    EMOTIONAL_DEPENDENCY("emotional_dependency"),
    ISOLATION_ATTEMPTS("isolation_attempts"),
    ESCALATION_RISK("escalation_risk"),
    UNKNOWN("unknown");

    private final String wireName;

    GroomingStage(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * "isolation_attempts" becomes "Isolation Attempts".
     */
    public String title() {
        StringBuilder sb = new StringBuilder();
        for (String part : wireName.split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    public String spaced() {
        return wireName.replace('_', ' ');
    }

    public boolean isAdvanced() {
        return this == ISOLATION_ATTEMPTS || this == ESCALATION_RISK;
    }

    public static GroomingStage fromWire(String raw) {
        String text = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (GroomingStage stage : values()) {
            if (stage.wireName.equals(text)) {
                return stage;
            }
        }
        throw new ValidationException("unknown grooming stage: " + raw);
    }
}
