package com.groomsafe.model;

import com.groomsafe.core.ValidationException;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * An anonymized message sequence. Messages keep their arrival order; callers that need
 * chronological order use {@link #sortedMessages()}.
 */
public final class Conversation {
    public final UUID id;
    public final List<Message> messages;
    public final Instant startTime;
    public final Instant endTime;
    public final String platformType;
    public final boolean synthetic;

    private final List<Message> sorted;

    @Builder
    public Conversation(
            UUID id,
            List<Message> messages,
            Instant startTime,
            Instant endTime,
            String platformType,
            boolean synthetic
    ) {
        if (messages == null || messages.isEmpty()) {
            throw new ValidationException("conversation must contain at least one message");
        }
        for (Message message : messages) {
            if (message == null) {
                throw new ValidationException("conversation contains a null message");
            }
        }
        this.id = id == null ? UUID.randomUUID() : id;
        this.messages = List.copyOf(messages);
        List<Message> byTime = new ArrayList<>(messages);
        // List.sort is stable, so equal timestamps keep arrival order.
        byTime.sort(Comparator.comparing(m -> m.timestamp));
        this.sorted = Collections.unmodifiableList(byTime);
        this.startTime = startTime == null ? byTime.get(0).timestamp : startTime;
        this.endTime = endTime;
        this.platformType = platformType;
        this.synthetic = synthetic;
    }

    public List<Message> sortedMessages() {
        return sorted;
    }

    public int messageCount() {
        return messages.size();
    }

    public Instant firstTimestamp() {
        return sorted.get(0).timestamp;
    }

    public Instant lastTimestamp() {
        return sorted.get(sorted.size() - 1).timestamp;
    }

    /**
     * Span between the earliest and latest message, zero for a single message.
     */
    public double durationHours() {
        if (sorted.size() < 2) {
            return 0.0;
        }
        return Duration.between(firstTimestamp(), lastTimestamp()).toMillis() / 3_600_000.0;
    }
}
