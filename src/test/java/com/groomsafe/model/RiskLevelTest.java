package com.groomsafe.model;

import com.groomsafe.core.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RiskLevelTest {

    @Test
    void fromScore_shouldUseInclusiveUpperBounds() {
        assertEquals(RiskLevel.MINIMAL, RiskLevel.fromScore(0.0));
        assertEquals(RiskLevel.MINIMAL, RiskLevel.fromScore(20.0));
        assertEquals(RiskLevel.LOW, RiskLevel.fromScore(20.01));
        assertEquals(RiskLevel.LOW, RiskLevel.fromScore(40.0));
        assertEquals(RiskLevel.MODERATE, RiskLevel.fromScore(60.0));
        assertEquals(RiskLevel.HIGH, RiskLevel.fromScore(80.0));
        assertEquals(RiskLevel.CRITICAL, RiskLevel.fromScore(80.5));
        assertEquals(RiskLevel.CRITICAL, RiskLevel.fromScore(100.0));
    }

    @Test
    void isHighRisk_shouldCoverHighAndCriticalOnly() {
        assertTrue(RiskLevel.HIGH.isHighRisk());
        assertTrue(RiskLevel.CRITICAL.isHighRisk());
        assertFalse(RiskLevel.MODERATE.isHighRisk());
        assertFalse(RiskLevel.MINIMAL.isHighRisk());
    }

    @Test
    void fromWire_shouldParseLowercaseTagsAndRejectUnknown() {
        assertEquals(RiskLevel.CRITICAL, RiskLevel.fromWire("critical"));
        assertEquals(GroomingStage.ISOLATION_ATTEMPTS, GroomingStage.fromWire("isolation_attempts"));
        assertEquals(SenderRole.MINOR, SenderRole.fromWire("MINOR"));
        assertThrows(ValidationException.class, () -> RiskLevel.fromWire("severe"));
        assertThrows(ValidationException.class, () -> SenderRole.fromWire("parent"));
    }

    @Test
    void stageTitle_shouldCapitalizeWords() {
        assertEquals("Isolation Attempts", GroomingStage.ISOLATION_ATTEMPTS.title());
        assertEquals("isolation attempts", GroomingStage.ISOLATION_ATTEMPTS.spaced());
    }
}
