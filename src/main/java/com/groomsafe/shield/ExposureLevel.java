package com.groomsafe.shield;

import java.util.Locale;

/**
 * How much detail a safe summary may show an analyst.
 */
public enum ExposureLevel {
    MINIMAL("minimal"),
    MODERATE("moderate"),
    DETAILED("detailed");

    private final String wireName;

    ExposureLevel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Lenient: anything unrecognized, including null, maps to {@link #MINIMAL}.
     */
    public static ExposureLevel fromWireOrMinimal(String raw) {
        String text = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (ExposureLevel level : values()) {
            if (level.wireName.equals(text)) {
                return level;
            }
        }
        return MINIMAL;
    }
}
