package com.groomsafe;

import com.groomsafe.model.Conversation;
import com.groomsafe.model.Message;
import com.groomsafe.model.SenderRole;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared conversation fixtures for tests.
 */
public final class Conversations {

    private Conversations() {
    }

    /**
     * Daytime small talk with alternating replies.
     */
    public static Conversation benign() {
        List<Message> messages = new ArrayList<>();
        messages.add(adult("2024-03-01T10:00:00Z", "hello there"));
        messages.add(minor("2024-03-01T11:00:00Z", "hi"));
        messages.add(adult("2024-03-01T12:00:00Z", "how was your day"));
        messages.add(minor("2024-03-01T13:00:00Z", "good thanks"));
        messages.add(adult("2024-03-01T14:00:00Z", "nice weather today"));
        messages.add(minor("2024-03-01T15:00:00Z", "yes it is"));
        return Conversation.builder().messages(messages).platformType("test").build();
    }

    /**
     * Late-night messaging with secrecy, isolation, dependency and migration phrases.
     */
    public static Conversation highRisk() {
        List<Message> messages = new ArrayList<>();
        messages.add(adult("2024-03-01T23:00:00Z", "hey, you are special to me"));
        messages.add(minor("2024-03-01T23:05:00Z", "hi"));
        messages.add(adult("2024-03-01T23:10:00Z", "our secret ok? don't tell your parents"));
        messages.add(adult("2024-03-01T23:20:00Z", "let's move to WhatsApp, just us"));
        messages.add(adult("2024-03-01T23:30:00Z", "nobody else understands you like me, don't tell anyone"));
        messages.add(adult("2024-03-01T23:40:00Z", "keep this private, delete the chat"));
        messages.add(adult("2024-03-01T23:50:00Z", "I need you, this stays between us"));
        messages.add(minor("2024-03-02T00:30:00Z", "ok"));
        messages.add(adult("2024-03-02T01:00:00Z", "add me on whatsapp, your parents won't understand"));
        messages.add(adult("2024-03-02T01:30:00Z", "delete our messages, it is our secret"));
        messages.add(minor("2024-03-02T02:00:00Z", "fine"));
        messages.add(adult("2024-03-02T03:00:00Z", "miss you, don't tell your parents about whatsapp"));
        return Conversation.builder().messages(messages).platformType("test").build();
    }

    public static Conversation single() {
        return Conversation.builder()
                .messages(List.of(adult("2024-03-01T10:00:00Z", "hello")))
                .build();
    }

    public static Message adult(String timestamp, String text) {
        return message(timestamp, SenderRole.ADULT, text);
    }

    public static Message minor(String timestamp, String text) {
        return message(timestamp, SenderRole.MINOR, text);
    }

    public static Message message(String timestamp, SenderRole role, String text) {
        return Message.builder()
                .timestamp(Instant.parse(timestamp))
                .senderRole(role)
                .abstractedText(text)
                .build();
    }
}
