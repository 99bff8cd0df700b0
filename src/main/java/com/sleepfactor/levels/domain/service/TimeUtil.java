package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.application.config.LevelEstimationConfig;
import com.sleepfactor.levels.domain.constant.AppConstant;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Centralized access to the current time and the zone used to combine dates
 * with clock times. Backed by a {@link Clock} so callers can be tested at a
 * fixed instant.
 */
@ApplicationScoped
public class TimeUtil {

    private static final Logger log = Logger.getLogger(TimeUtil.class);

    private final Clock clock;
    private final ZoneId defaultZoneId;

    @Inject
    public TimeUtil(LevelEstimationConfig config) {
        this(Clock.systemUTC(), parseZone(config.zoneId()));
    }

    public TimeUtil(Clock clock, ZoneId defaultZoneId) {
        this.clock = clock;
        this.defaultZoneId = defaultZoneId;
    }

    /**
     * Get current time as UTC Instant.
     */
    public Instant getCurrentTimeUTC() {
        return clock.instant();
    }

    public ZoneId getDefaultZoneId() {
        return defaultZoneId;
    }

    /**
     * Hours between two instants, negative when {@code to} precedes {@code from}.
     */
    public static double elapsedHours(Instant from, Instant to) {
        Duration elapsed = Duration.between(from, to);
        return elapsed.getSeconds() / AppConstant.SECONDS_PER_HOUR
                + elapsed.getNano() / (AppConstant.SECONDS_PER_HOUR * 1_000_000_000L);
    }

    static ZoneId parseZone(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            log.warnf("Invalid zone id '%s' configured, falling back to UTC: %s", zoneId, e.getMessage());
            return ZoneOffset.UTC;
        }
    }
}
