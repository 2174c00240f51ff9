package com.groomsafe.features;

import com.groomsafe.core.ConfigurationException;
import com.groomsafe.core.ValidationException;
import com.groomsafe.model.FeatureName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Declarative (feature, language, phrase) table used by the keyword features. Matching is
 * case-insensitive substring containment.
 *
 * <p>The resource format is one tab-separated row per line; blank lines and lines starting
 * with {@code #} are skipped.
 */
public final class PhraseTable {
    private static final Logger LOG = LogManager.getLogger(PhraseTable.class);

    public static final String DEFAULT_RESOURCE = "phrase-table.tsv";

    private final List<PhraseRow> rows;
    private final Map<FeatureName, List<String>> phrasesByFeature;

    private PhraseTable(List<PhraseRow> rows) {
        Map<FeatureName, Set<String>> grouped = new EnumMap<>(FeatureName.class);
        List<PhraseRow> normalized = new ArrayList<>();
        for (PhraseRow row : rows) {
            if (row == null || row.feature() == null) {
                throw new ConfigurationException("phrase row without feature");
            }
            if (!row.feature().isKeywordFeature()) {
                throw new ConfigurationException("feature is not keyword based: " + row.feature().wireName());
            }
            String phrase = row.phrase() == null ? "" : row.phrase().trim().toLowerCase(Locale.ROOT);
            if (phrase.isEmpty()) {
                throw new ConfigurationException("empty phrase for feature " + row.feature().wireName());
            }
            String language = row.language() == null ? "" : row.language().trim().toLowerCase(Locale.ROOT);
            normalized.add(new PhraseRow(row.feature(), language, phrase));
            grouped.computeIfAbsent(row.feature(), ignored -> new LinkedHashSet<>()).add(phrase);
        }
        Map<FeatureName, List<String>> byFeature = new EnumMap<>(FeatureName.class);
        for (Map.Entry<FeatureName, Set<String>> entry : grouped.entrySet()) {
            byFeature.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.rows = Collections.unmodifiableList(normalized);
        this.phrasesByFeature = Collections.unmodifiableMap(byFeature);
    }

    public static PhraseTable of(List<PhraseRow> rows) {
        return new PhraseTable(rows == null ? List.of() : rows);
    }

    public static PhraseTable loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static PhraseTable loadResource(String resourceName) {
        try (InputStream in = PhraseTable.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new ConfigurationException("phrase table resource not found: " + resourceName);
            }
            PhraseTable table = parse(in, resourceName);
            LOG.debug("phrase table {} loaded: rows={} languages={}", resourceName, table.rows.size(), table.languages());
            return table;
        } catch (IOException e) {
            throw new ConfigurationException("failed to read phrase table " + resourceName, e);
        }
    }

    static PhraseTable parse(InputStream in, String sourceName) throws IOException {
        List<PhraseRow> rows = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] parts = line.split("\t");
                if (parts.length != 3) {
                    throw new ConfigurationException(sourceName + ":" + lineNo + " expected 3 tab-separated columns");
                }
                FeatureName feature;
                try {
                    feature = FeatureName.fromWire(parts[0]);
                } catch (ValidationException e) {
                    throw new ConfigurationException(sourceName + ":" + lineNo + " " + e.getMessage(), e);
                }
                rows.add(new PhraseRow(feature, parts[1], parts[2]));
            }
        }
        return new PhraseTable(rows);
    }

    /**
     * True when the text contains at least one phrase registered for the feature.
     */
    public boolean matchesAny(FeatureName feature, String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        List<String> phrases = phrasesByFeature.getOrDefault(feature, List.of());
        if (phrases.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : phrases) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    public List<String> phrases(FeatureName feature) {
        return phrasesByFeature.getOrDefault(feature, List.of());
    }

    public List<PhraseRow> rows() {
        return rows;
    }

    public Set<String> languages() {
        Set<String> out = new LinkedHashSet<>();
        for (PhraseRow row : rows) {
            out.add(row.language());
        }
        return out;
    }
}
