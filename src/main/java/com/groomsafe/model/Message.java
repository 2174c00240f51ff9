package com.groomsafe.model;

import com.groomsafe.core.ValidationException;
import lombok.Builder;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One sanitized message. The text is an abstracted representation, never raw content.
 */
public final class Message {
    public final UUID id;
    public final Instant timestamp;
    public final SenderRole senderRole;
    public final String abstractedText;
    public final Map<String, Object> metadata;
    /**
     * Offset the timestamp was written with, or null when the source carried none.
     */
    public final ZoneOffset offset;

    @Builder
    public Message(
            UUID id,
            Instant timestamp,
            SenderRole senderRole,
            String abstractedText,
            Map<String, Object> metadata,
            ZoneOffset offset
    ) {
        if (timestamp == null) {
            throw new ValidationException("message timestamp is required");
        }
        if (senderRole == null) {
            throw new ValidationException("message sender_role is required");
        }
        if (abstractedText == null) {
            throw new ValidationException("message abstracted_text is required");
        }
        this.id = id == null ? UUID.randomUUID() : id;
        this.timestamp = timestamp;
        this.senderRole = senderRole;
        this.abstractedText = abstractedText;
        this.metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.offset = offset;
    }

    /**
     * Hour of day as written in the source timestamp. Without a recorded offset the hour
     * is read in {@code fallbackZone}.
     */
    public int hourOfDay(ZoneId fallbackZone) {
        if (offset != null) {
            return timestamp.atOffset(offset).getHour();
        }
        return timestamp.atZone(fallbackZone).getHour();
    }

    public boolean isAdult() {
        return senderRole == SenderRole.ADULT;
    }

    public boolean isMinor() {
        return senderRole == SenderRole.MINOR;
    }
}
