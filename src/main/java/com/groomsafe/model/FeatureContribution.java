package com.groomsafe.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FeatureContribution {
    public final FeatureName featureName;
    public final double value;
    public final double contributionWeight;
    public final String description;
}
