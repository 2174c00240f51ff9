package com.groomsafe.features;

import com.groomsafe.model.FeatureName;

/**
 * One row of the keyword table: a phrase that signals {@code feature} in {@code language}.
 */
public record PhraseRow(FeatureName feature, String language, String phrase) {
}
