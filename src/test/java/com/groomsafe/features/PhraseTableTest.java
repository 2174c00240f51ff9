package com.groomsafe.features;

import com.groomsafe.core.ConfigurationException;
import com.groomsafe.model.FeatureName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhraseTableTest {

    private final PhraseTable table = PhraseTable.loadDefault();

    @Test
    void loadDefault_shouldCoverKeywordFeaturesInThreeLanguages() {
        for (FeatureName name : FeatureName.values()) {
            if (name.isKeywordFeature()) {
                assertFalse(table.phrases(name).isEmpty(), name.wireName());
            } else {
                assertTrue(table.phrases(name).isEmpty(), name.wireName());
            }
        }
        assertTrue(table.languages().containsAll(List.of("en", "pt", "es")));
    }

    @Test
    void matchesAny_shouldBeCaseInsensitiveSubstring() {
        assertTrue(table.matchesAny(FeatureName.PLATFORM_MIGRATION_ATTEMPTS, "Add me on WhatsApp"));
        assertTrue(table.matchesAny(FeatureName.SECRECY_PRESSURE, "This is OUR SECRET"));
        assertFalse(table.matchesAny(FeatureName.SECRECY_PRESSURE, "nice weather today"));
    }

    @Test
    void parse_shouldSkipCommentsAndRejectBadRows() throws Exception {
        String good = "# header\n\nsecrecy_pressure\ten\tHush\n";
        PhraseTable parsed = PhraseTable.parse(stream(good), "inline");
        assertEquals(List.of("hush"), parsed.phrases(FeatureName.SECRECY_PRESSURE));

        assertThrows(ConfigurationException.class,
                () -> PhraseTable.parse(stream("secrecy_pressure\ten\n"), "inline"));
        assertThrows(ConfigurationException.class,
                () -> PhraseTable.parse(stream("no_such_feature\ten\tx\n"), "inline"));
        assertThrows(ConfigurationException.class,
                () -> PhraseTable.parse(stream("tone_shift_score\ten\tx\n"), "inline"));
    }

    @Test
    void loadResource_shouldFailForMissingResource() {
        assertThrows(ConfigurationException.class, () -> PhraseTable.loadResource("missing-table.tsv"));
    }

    private static ByteArrayInputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
