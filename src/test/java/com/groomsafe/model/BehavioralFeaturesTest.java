package com.groomsafe.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BehavioralFeaturesTest {

    @Test
    void builder_shouldClampIntoUnitInterval() {
        BehavioralFeatures f = BehavioralFeatures.builder()
                .conversationId(UUID.randomUUID())
                .contactFrequencyScore(1.7)
                .persistenceAfterNonresponse(-0.2)
                .toneShiftScore(Double.NaN)
                .secrecyPressure(0.4)
                .extractedAt(Instant.EPOCH)
                .build();

        assertEquals(1.0, f.contactFrequencyScore);
        assertEquals(0.0, f.persistenceAfterNonresponse);
        assertEquals(0.0, f.toneShiftScore);
        assertEquals(0.4, f.value(FeatureName.SECRECY_PRESSURE));
        assertEquals(BehavioralFeatures.FEATURE_VERSION, f.featureVersion);
    }

    @Test
    void vector_shouldFollowDeclaredFeatureOrder() {
        BehavioralFeatures f = BehavioralFeatures.builder()
                .contactFrequencyScore(0.1)
                .toneShiftScore(0.8)
                .build();
        double[] v = f.vector();

        assertEquals(8, v.length);
        assertEquals(0.1, v[0]);
        assertEquals(0.8, v[7]);
        assertEquals(0.1125, f.mean(), 1e-12);
        assertEquals(8, f.asMap().size());
    }

    @Test
    void zero_shouldHaveAllFeaturesAtZero() {
        BehavioralFeatures f = BehavioralFeatures.zero(UUID.randomUUID(), Instant.EPOCH);
        for (double v : f.vector()) {
            assertEquals(0.0, v);
        }
    }
}
