package com.groomsafe.features;

import com.groomsafe.config.Config;
import com.groomsafe.core.ConfigurationException;
import com.groomsafe.model.BehavioralFeatures;
import com.groomsafe.model.Conversation;
import com.groomsafe.model.FeatureName;
import com.groomsafe.model.Message;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the eight behavioral features of a conversation from timing, turn-taking and
 * fixed phrase matching. Messages are always processed in timestamp order.
 */
public final class FeatureExtractor {
    private static final int NORMAL_HOUR_START = 9;
    private static final int NORMAL_HOUR_END = 21;
    private static final int LATE_NIGHT_START = 23;
    private static final int EARLY_MORNING_END = 6;

    private static final double MIN_HALF_SPAN_HOURS = 0.1;
    private static final double MIN_FIRST_DENSITY = 0.01;
    private static final double SECOND_DENSITY_FLOOR = 0.1;
    private static final double MAX_DENSITY_RATIO = 3.0;
    private static final double PERSISTENCE_SATURATION_RUN = 5.0;
    private static final double TONE_SATURATION_SHIFT = 0.5;

    private final PhraseTable phrases;
    private final ZoneId zone;
    private final Clock clock;

    public FeatureExtractor() {
        this(PhraseTable.loadDefault(), ZoneId.of("UTC"), Clock.systemUTC());
    }

    public FeatureExtractor(Config config) {
        this(
                PhraseTable.loadResource(config.getString("features.phrase_table", PhraseTable.DEFAULT_RESOURCE)),
                resolveZone(config.getString("features.zone", "UTC")),
                Clock.systemUTC()
        );
    }

    public FeatureExtractor(PhraseTable phrases, ZoneId zone, Clock clock) {
        this.phrases = phrases;
        this.zone = zone == null ? ZoneId.of("UTC") : zone;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public BehavioralFeatures extract(Conversation conversation) {
        List<Message> messages = conversation.sortedMessages();
        if (messages.size() < 2) {
            return BehavioralFeatures.zero(conversation.id, clock.instant());
        }
        List<Message> adult = adultMessages(messages);

        return BehavioralFeatures.builder()
                .conversationId(conversation.id)
                .contactFrequencyScore(contactFrequency(messages, adult))
                .persistenceAfterNonresponse(persistence(messages))
                .timeOfDayIrregularity(timeIrregularity(adult))
                .emotionalDependencyIndicators(keywordScore(adult, FeatureName.EMOTIONAL_DEPENDENCY_INDICATORS))
                .isolationPressure(keywordScore(adult, FeatureName.ISOLATION_PRESSURE))
                .secrecyPressure(keywordScore(adult, FeatureName.SECRECY_PRESSURE))
                .platformMigrationAttempts(keywordScore(adult, FeatureName.PLATFORM_MIGRATION_ATTEMPTS))
                .toneShiftScore(toneShift(adult))
                .extractedAt(clock.instant())
                .featureVersion(BehavioralFeatures.FEATURE_VERSION)
                .build();
    }

    /**
     * Ratio of adult message density in the later half to the earlier half, scaled so a
     * threefold increase saturates at 1.
     */
    double contactFrequency(List<Message> messages, List<Message> adult) {
        if (messages.size() < 3 || adult.size() < 3) {
            return 0.0;
        }
        int mid = adult.size() / 2;
        List<Message> first = adult.subList(0, mid);
        List<Message> second = adult.subList(mid, adult.size());

        double firstSpan = spanHours(first);
        double secondSpan = spanHours(second);
        if (firstSpan < MIN_HALF_SPAN_HOURS || secondSpan < MIN_HALF_SPAN_HOURS) {
            return 0.0;
        }

        double firstDensity = first.size() / firstSpan;
        double secondDensity = second.size() / secondSpan;
        double escalation;
        if (firstDensity < MIN_FIRST_DENSITY) {
            escalation = secondDensity > SECOND_DENSITY_FLOOR ? 1.0 : 0.0;
        } else {
            escalation = Math.min(secondDensity / firstDensity, MAX_DENSITY_RATIO) / MAX_DENSITY_RATIO;
        }
        return unit(escalation);
    }

    /**
     * Runs of adult messages not interrupted by a minor reply. Unknown senders neither
     * extend nor close a run.
     */
    double persistence(List<Message> messages) {
        if (messages.size() < 3) {
            return 0.0;
        }
        List<Integer> runs = new ArrayList<>();
        int current = 0;
        for (Message message : messages) {
            if (message.isAdult()) {
                current++;
            } else if (message.isMinor()) {
                if (current > 0) {
                    runs.add(current);
                }
                current = 0;
            }
        }
        if (current > 0) {
            runs.add(current);
        }
        if (runs.isEmpty()) {
            return 0.0;
        }

        int max = 0;
        double sum = 0.0;
        for (int run : runs) {
            max = Math.max(max, run);
            sum += run;
        }
        double mean = sum / runs.size();
        return unit(Math.min((max * 0.5 + mean * 0.5) / PERSISTENCE_SATURATION_RUN, 1.0));
    }

    double timeIrregularity(List<Message> adult) {
        if (adult.isEmpty()) {
            return 0.0;
        }
        int irregular = 0;
        int highlyIrregular = 0;
        for (Message message : adult) {
            int hour = message.hourOfDay(zone);
            if (hour >= LATE_NIGHT_START || hour < EARLY_MORNING_END) {
                highlyIrregular++;
                irregular++;
            } else if (hour < NORMAL_HOUR_START || hour >= NORMAL_HOUR_END) {
                irregular++;
            }
        }
        double irregularRatio = (double) irregular / adult.size();
        double highlyIrregularRatio = (double) highlyIrregular / adult.size();
        return unit(irregularRatio * 0.5 + highlyIrregularRatio * 0.5);
    }

    /**
     * Adult messages with at least one phrase hit, normalized by a per-feature share of the
     * adult message count.
     */
    double keywordScore(List<Message> adult, FeatureName feature) {
        if (adult.isEmpty()) {
            return 0.0;
        }
        int matches = 0;
        for (Message message : adult) {
            if (phrases.matchesAny(feature, message.abstractedText)) {
                matches++;
            }
        }
        double denominator = Math.max(adult.size() * keywordDivisor(feature), 1.0);
        return unit(Math.min(matches / denominator, 1.0));
    }

    double toneShift(List<Message> adult) {
        if (adult.size() < 4) {
            return 0.0;
        }
        int mid = adult.size() / 2;
        double early = meanLength(adult.subList(0, mid));
        double late = meanLength(adult.subList(mid, adult.size()));
        if (early <= 0.0) {
            return 0.0;
        }
        double shift = Math.abs(late - early) / early;
        return unit(Math.min(shift / TONE_SATURATION_SHIFT, 1.0));
    }

    static double keywordDivisor(FeatureName feature) {
        return switch (feature) {
            case EMOTIONAL_DEPENDENCY_INDICATORS -> 0.3;
            case ISOLATION_PRESSURE -> 0.2;
            case SECRECY_PRESSURE, PLATFORM_MIGRATION_ATTEMPTS -> 0.15;
            case CONTACT_FREQUENCY_SCORE, PERSISTENCE_AFTER_NONRESPONSE, TIME_OF_DAY_IRREGULARITY, TONE_SHIFT_SCORE ->
                    throw new IllegalArgumentException("not a keyword feature: " + feature.wireName());
        };
    }

    private static List<Message> adultMessages(List<Message> sorted) {
        List<Message> out = new ArrayList<>();
        for (Message message : sorted) {
            if (message.isAdult()) {
                out.add(message);
            }
        }
        return out;
    }

    private static double spanHours(List<Message> ordered) {
        if (ordered.size() < 2) {
            return 0.0;
        }
        Duration span = Duration.between(ordered.get(0).timestamp, ordered.get(ordered.size() - 1).timestamp);
        return span.toMillis() / 3_600_000.0;
    }

    private static double meanLength(List<Message> messages) {
        if (messages.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (Message message : messages) {
            total += message.abstractedText.codePointCount(0, message.abstractedText.length());
        }
        return total / messages.size();
    }

    private static double unit(double v) {
        if (!Double.isFinite(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static ZoneId resolveZone(String raw) {
        try {
            return ZoneId.of(raw);
        } catch (DateTimeException e) {
            throw new ConfigurationException("invalid features.zone: " + raw, e);
        }
    }
}
