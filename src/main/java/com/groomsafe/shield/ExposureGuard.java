package com.groomsafe.shield;

import com.groomsafe.config.Config;
import com.groomsafe.core.ValidationException;
import com.groomsafe.model.RiskLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks analyst exposure per review session and enforces break limits.
 * Calls for one analyst are serialized; different analysts never contend.
 */
public final class ExposureGuard {
    private static final Logger LOG = LogManager.getLogger(ExposureGuard.class);

    static final String REASON_SESSION_DURATION = "Maximum session duration exceeded";
    static final String REASON_CASE_LIMIT = "Maximum cases per session exceeded";
    static final String REASON_HIGH_RISK_LIMIT = "Maximum high-risk exposures exceeded";

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final ExposureLimits limits;
    private final Clock clock;

    public ExposureGuard() {
        this(ExposureLimits.defaults(), Clock.systemUTC());
    }

    public ExposureGuard(Config config) {
        this(ExposureLimits.fromConfig(config), Clock.systemUTC());
    }

    public ExposureGuard(ExposureLimits limits, Clock clock) {
        this.limits = limits == null ? ExposureLimits.defaults() : limits;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ExposureLimits limits() {
        return limits;
    }

    public SafetyDecision checkSafety(String analystId, RiskLevel riskLevel) {
        Session session = session(analystId);
        session.lock.lock();
        try {
            AnalystExposureState state = session.snapshot(analystId);
            double minutes = minutesSince(session.start);

            String reason = null;
            if (minutes > limits.maxSessionMinutes()) {
                reason = REASON_SESSION_DURATION;
            } else if (session.casesReviewed >= limits.maxCasesPerSession()) {
                reason = REASON_CASE_LIMIT;
            } else if (riskLevel != null && riskLevel.isHighRisk()
                    && session.highRiskExposures >= limits.maxHighRiskPerSession()) {
                reason = REASON_HIGH_RISK_LIMIT;
            }

            if (reason != null) {
                LOG.warn("exposure check denied: analyst={} reason={} cases={} high_risk={} session_minutes={}",
                        analystId, reason, session.casesReviewed, session.highRiskExposures,
                        String.format(Locale.US, "%.1f", minutes));
                return SafetyDecision.deny(reason, limits.breakRecommendation(), state, minutes);
            }
            return SafetyDecision.allow(state, minutes, limits.maxCasesPerSession() - session.casesReviewed);
        } finally {
            session.lock.unlock();
        }
    }

    public void logExposure(String analystId, RiskLevel riskLevel, double durationMinutes) {
        if (!Double.isFinite(durationMinutes) || durationMinutes < 0.0) {
            throw new ValidationException("exposure duration must be a non-negative number: " + durationMinutes);
        }
        Session session = session(analystId);
        session.lock.lock();
        try {
            session.casesReviewed++;
            session.totalMinutes += durationMinutes;
            if (riskLevel != null && riskLevel.isHighRisk()) {
                session.highRiskExposures++;
            }
            LOG.debug("exposure logged: analyst={} level={} cases={} high_risk={}",
                    analystId, riskLevel == null ? "none" : riskLevel.wireName(),
                    session.casesReviewed, session.highRiskExposures);
        } finally {
            session.lock.unlock();
        }
    }

    public void resetSession(String analystId) {
        Session session = session(analystId);
        session.lock.lock();
        try {
            session.start = clock.instant();
            session.casesReviewed = 0;
            session.highRiskExposures = 0;
            session.totalMinutes = 0.0;
        } finally {
            session.lock.unlock();
        }
        LOG.info("analyst session reset: analyst={}", analystId);
    }

    public AnalystExposureState state(String analystId) {
        Session session = session(analystId);
        session.lock.lock();
        try {
            return session.snapshot(analystId);
        } finally {
            session.lock.unlock();
        }
    }

    private Session session(String analystId) {
        if (analystId == null || analystId.trim().isEmpty()) {
            throw new ValidationException("analyst id is required");
        }
        return sessions.computeIfAbsent(analystId, ignored -> new Session(clock.instant()));
    }

    private double minutesSince(Instant start) {
        return Math.max(0L, Duration.between(start, clock.instant()).toMillis()) / 60_000.0;
    }

    private static final class Session {
        private final ReentrantLock lock = new ReentrantLock();
        private Instant start;
        private int casesReviewed;
        private int highRiskExposures;
        private double totalMinutes;

        private Session(Instant start) {
            this.start = start;
        }

        private AnalystExposureState snapshot(String analystId) {
            return new AnalystExposureState(analystId, start, casesReviewed, highRiskExposures, totalMinutes);
        }
    }
}
