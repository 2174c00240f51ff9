package com.groomsafe.progression;

import java.util.List;

public record StageProfile(
        String severity,
        String typicalDuration,
        String nextStage,
        List<String> warningSigns
) {
    public StageProfile {
        warningSigns = warningSigns == null ? List.of() : List.copyOf(warningSigns);
    }
}
