package com.groomsafe.shield;

import com.groomsafe.config.Config;
import com.groomsafe.core.ConfigurationException;

/**
 * Per-session wellbeing limits for analysts.
 */
public record ExposureLimits(
        int maxCasesPerSession,
        int maxHighRiskPerSession,
        int maxSessionMinutes,
        int mandatoryBreakMinutes
) {
    public ExposureLimits {
        if (maxCasesPerSession <= 0 || maxHighRiskPerSession <= 0
                || maxSessionMinutes <= 0 || mandatoryBreakMinutes < 0) {
            throw new ConfigurationException("exposure limits must be positive: cases=" + maxCasesPerSession
                    + " high_risk=" + maxHighRiskPerSession
                    + " session_minutes=" + maxSessionMinutes
                    + " break_minutes=" + mandatoryBreakMinutes);
        }
    }

    public static ExposureLimits defaults() {
        return fromConfig(Config.defaults());
    }

    public static ExposureLimits fromConfig(Config config) {
        return new ExposureLimits(
                config.getInt("shield.max_cases_per_session"),
                config.getInt("shield.max_high_risk_per_session"),
                config.getInt("shield.max_session_minutes"),
                config.getInt("shield.mandatory_break_minutes")
        );
    }

    public String breakRecommendation() {
        return "Mandatory " + mandatoryBreakMinutes + "-minute break required";
    }
}
