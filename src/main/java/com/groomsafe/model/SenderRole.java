package com.groomsafe.model;

import com.groomsafe.core.ValidationException;

import java.util.Locale;

public enum SenderRole {
    ADULT("adult"),
    MINOR("minor"),
    UNKNOWN("unknown");

    private final String wireName;

    SenderRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static SenderRole fromWire(String raw) {
        String text = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (SenderRole role : values()) {
            if (role.wireName.equals(text)) {
                return role;
            }
        }
        throw new ValidationException("unknown sender_role: " + raw);
    }
}
