package com.groomsafe.json;

import com.groomsafe.core.ValidationException;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.Message;
import com.groomsafe.model.SenderRole;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Parses conversations from their JSON exchange form. Message timestamps keep the offset
 * they were written with; timestamps without an offset are read as UTC instants and
 * carry no offset.
 */
public final class ConversationJsonReader {

    public Conversation read(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("conversation json is empty");
        }
        try {
            return conversation(new JSONObject(json));
        } catch (JSONException e) {
            throw new ValidationException("malformed conversation json: " + e.getMessage(), e);
        }
    }

    public Conversation read(InputStream in) {
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return conversation(new JSONObject(new JSONTokener(reader)));
        } catch (JSONException e) {
            throw new ValidationException("malformed conversation json: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ValidationException("failed to read conversation json: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a JSON array of conversations, as produced by dataset exports.
     */
    public List<Conversation> readAll(String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException("conversation json is empty");
        }
        try {
            JSONArray array = new JSONArray(json);
            List<Conversation> out = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                out.add(conversation(array.getJSONObject(i)));
            }
            return out;
        } catch (JSONException e) {
            throw new ValidationException("malformed conversation json: " + e.getMessage(), e);
        }
    }

    Conversation conversation(JSONObject root) {
        JSONArray array = root.optJSONArray("messages");
        if (array == null || array.isEmpty()) {
            throw new ValidationException("conversation must contain at least one message");
        }
        List<Message> messages = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                throw new ValidationException("messages[" + i + "] is not an object");
            }
            messages.add(message(item, i));
        }
        return Conversation.builder()
                .id(optUuid(root, "conversation_id"))
                .messages(messages)
                .startTime(optInstant(root, "start_time"))
                .endTime(optInstant(root, "end_time"))
                .platformType(root.optString("platform_type", null))
                .synthetic(root.optBoolean("is_synthetic", false))
                .build();
    }

    private Message message(JSONObject item, int index) {
        String timestamp = item.optString("timestamp", "");
        if (timestamp.isBlank()) {
            throw new ValidationException("messages[" + index + "].timestamp is required");
        }
        if (!item.has("abstracted_text") || item.isNull("abstracted_text")) {
            throw new ValidationException("messages[" + index + "].abstracted_text is required");
        }
        JSONObject metadata = item.optJSONObject("metadata");
        Map<String, Object> meta = metadata == null ? Map.of() : metadata.toMap();
        OffsetDateTime written = parseWritten(timestamp);
        return Message.builder()
                .id(optUuid(item, "message_id"))
                .timestamp(written != null ? written.toInstant() : parseLocal(timestamp))
                .offset(written != null ? written.getOffset() : null)
                .senderRole(SenderRole.fromWire(item.optString("sender_role", "")))
                .abstractedText(item.getString("abstracted_text"))
                .metadata(meta)
                .build();
    }

    static Instant parseInstant(String raw) {
        OffsetDateTime written = parseWritten(raw);
        return written != null ? written.toInstant() : parseLocal(raw);
    }

    /**
     * The timestamp with its offset, or null when it was written without one.
     */
    private static OffsetDateTime parseWritten(String raw) {
        try {
            return OffsetDateTime.parse(raw.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant parseLocal(String raw) {
        try {
            return LocalDateTime.parse(raw.trim()).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ValidationException("invalid timestamp: " + raw, e);
        }
    }

    private static Instant optInstant(JSONObject obj, String key) {
        String raw = obj.optString(key, "");
        return raw.isBlank() ? null : parseInstant(raw);
    }

    private static UUID optUuid(JSONObject obj, String key) {
        String raw = obj.optString(key, "");
        if (raw.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid " + key + ": " + raw, e);
        }
    }
}
