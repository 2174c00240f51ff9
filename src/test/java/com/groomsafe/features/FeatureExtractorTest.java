package com.groomsafe.features;

import com.groomsafe.Conversations;
import com.groomsafe.json.ConversationJsonReader;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.FeatureName;
import com.groomsafe.model.Message;
import com.groomsafe.model.SenderRole;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.groomsafe.Conversations.adult;
import static com.groomsafe.Conversations.message;
import static com.groomsafe.Conversations.minor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureExtractorTest {

    private static final Instant NOW = Instant.parse("2024-04-01T00:00:00Z");

    private final FeatureExtractor extractor = new FeatureExtractor(
            PhraseTable.loadDefault(), ZoneId.of("UTC"), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void extract_shouldReturnZeroVectorForSingleMessage() {
        Conversation conversation = Conversations.single();
        BehavioralFeatures f = extractor.extract(conversation);

        for (double v : f.vector()) {
            assertEquals(0.0, v);
        }
        assertEquals(conversation.id, f.conversationId);
        assertEquals(NOW, f.extractedAt);
    }

    @Test
    void extract_shouldScoreBenignConversationLow() {
        BehavioralFeatures f = extractor.extract(Conversations.benign());

        assertEquals(0.0, f.contactFrequencyScore);
        assertEquals(0.2, f.persistenceAfterNonresponse, 1e-12);
        assertEquals(0.0, f.timeOfDayIrregularity);
        assertEquals(0.0, f.emotionalDependencyIndicators);
        assertEquals(0.0, f.isolationPressure);
        assertEquals(0.0, f.secrecyPressure);
        assertEquals(0.0, f.platformMigrationAttempts);
        assertEquals(0.0, f.toneShiftScore);
    }

    @Test
    void extract_shouldSaturateKeywordAndTimingFeaturesForHighRisk() {
        BehavioralFeatures f = extractor.extract(Conversations.highRisk());

        assertEquals(1.0, f.timeOfDayIrregularity);
        assertEquals(1.0, f.emotionalDependencyIndicators);
        assertEquals(1.0, f.isolationPressure);
        assertEquals(1.0, f.secrecyPressure);
        assertEquals(1.0, f.platformMigrationAttempts);
        assertEquals(0.725, f.persistenceAfterNonresponse, 1e-12);
        assertEquals(0.0625, f.contactFrequencyScore, 1e-9);
        for (double v : f.vector()) {
            assertTrue(v >= 0.0 && v <= 1.0);
        }
    }

    @Test
    void extract_shouldReadHoursInConfiguredZone() {
        FeatureExtractor newYork = new FeatureExtractor(
                PhraseTable.loadDefault(), ZoneId.of("America/New_York"), Clock.fixed(NOW, ZoneOffset.UTC));

        // 10:00, 12:00 and 14:00 UTC are 05:00, 07:00 and 09:00 in New York
        BehavioralFeatures f = newYork.extract(Conversations.benign());

        assertEquals(0.5, f.timeOfDayIrregularity, 1e-12);
    }

    @Test
    void extract_shouldReadHoursAsWrittenWhenTimestampCarriesOffset() {
        Conversation conversation = new ConversationJsonReader().read("{\"messages\": ["
                + "{\"timestamp\": \"2024-03-01T19:00:00-03:00\", \"sender_role\": \"adult\", \"abstracted_text\": \"hi\"},"
                + "{\"timestamp\": \"2024-03-01T19:30:00-03:00\", \"sender_role\": \"minor\", \"abstracted_text\": \"hey\"},"
                + "{\"timestamp\": \"2024-03-01T20:00:00-03:00\", \"sender_role\": \"adult\", \"abstracted_text\": \"ok\"}"
                + "]}");
        FeatureExtractor newYork = new FeatureExtractor(
                PhraseTable.loadDefault(), ZoneId.of("America/New_York"), Clock.fixed(NOW, ZoneOffset.UTC));

        // 22:00 and 23:00 UTC, but 19:00 and 20:00 where they were sent
        assertEquals(0.0, extractor.extract(conversation).timeOfDayIrregularity);
        assertEquals(0.0, newYork.extract(conversation).timeOfDayIrregularity);
    }

    @Test
    void extract_shouldBeIndependentOfArrivalOrder() {
        Conversation ordered = Conversations.highRisk();
        List<Message> reversed = new ArrayList<>(ordered.messages);
        Collections.reverse(reversed);
        Conversation shuffled = Conversation.builder().id(ordered.id).messages(reversed).build();

        assertEquals(
                Arrays.toString(extractor.extract(ordered).vector()),
                Arrays.toString(extractor.extract(shuffled).vector()));
    }

    @Test
    void contactFrequency_shouldSaturateWhenEarlyDensityIsNegligible() {
        List<Message> adultOnly = List.of(
                adult("2024-03-01T00:00:00Z", "a"),
                adult("2024-03-13T12:00:00Z", "b"),
                adult("2024-03-13T13:00:00Z", "c"),
                adult("2024-03-13T13:30:00Z", "d"),
                adult("2024-03-13T14:00:00Z", "e"));

        assertEquals(1.0, extractor.contactFrequency(adultOnly, adultOnly));
    }

    @Test
    void contactFrequency_shouldBeZeroWhenHalfSpanTooShort() {
        List<Message> adultOnly = List.of(
                adult("2024-03-01T10:00:00Z", "a"),
                adult("2024-03-01T10:01:00Z", "b"),
                adult("2024-03-01T12:00:00Z", "c"),
                adult("2024-03-01T13:00:00Z", "d"));

        assertEquals(0.0, extractor.contactFrequency(adultOnly, adultOnly));
    }

    @Test
    void persistence_shouldIgnoreUnknownSenders() {
        List<Message> messages = List.of(
                adult("2024-03-01T10:00:00Z", "a"),
                message("2024-03-01T10:01:00Z", SenderRole.UNKNOWN, "?"),
                adult("2024-03-01T10:02:00Z", "b"),
                minor("2024-03-01T10:03:00Z", "c"),
                adult("2024-03-01T10:04:00Z", "d"));

        // runs [2, 1]: (2 * 0.5 + 1.5 * 0.5) / 5
        assertEquals(0.35, extractor.persistence(messages), 1e-12);
    }

    @Test
    void keywordScore_shouldUseFloorOfOneForSmallConversations() {
        List<Message> adultOnly = List.of(
                adult("2024-03-01T10:00:00Z", "add me on whatsapp"),
                adult("2024-03-01T10:05:00Z", "hello"));

        assertEquals(1.0, extractor.keywordScore(adultOnly, FeatureName.PLATFORM_MIGRATION_ATTEMPTS));
        assertEquals(0.0, extractor.keywordScore(adultOnly, FeatureName.ISOLATION_PRESSURE));
        assertThrows(IllegalArgumentException.class,
                () -> FeatureExtractor.keywordDivisor(FeatureName.TONE_SHIFT_SCORE));
    }

    @Test
    void toneShift_shouldCompareMeanLengthOfHalves() {
        List<Message> adultOnly = List.of(
                adult("2024-03-01T10:00:00Z", "abcd"),
                adult("2024-03-01T10:01:00Z", "abcd"),
                adult("2024-03-01T10:02:00Z", "abcde"),
                adult("2024-03-01T10:03:00Z", "abcde"));

        assertEquals(0.5, extractor.toneShift(adultOnly), 1e-12);
        assertEquals(0.0, extractor.toneShift(adultOnly.subList(0, 3)));
    }
}
