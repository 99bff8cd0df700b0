package com.sleepfactor.levels.domain.service;

import com.sleepfactor.levels.application.config.LevelEstimationConfig;
import com.sleepfactor.levels.domain.constant.AppConstant;
import com.sleepfactor.levels.exception.InvalidConfigurationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;

/**
 * Sizes the history a caller must query before the decay sum can be trusted:
 * {@code max(minimumDays, ceil(halfLives * halfLifeHours / 24))} days.
 * <p>
 * Three half-lives leave 12.5% of a dose, which is enough for coarse insight
 * correlation. The window bounds the query only; {@link LevelEstimator} never
 * consults it.
 */
@ApplicationScoped
public class LookbackWindowPolicy {

    private static final Logger log = Logger.getLogger(LookbackWindowPolicy.class);

    private final int minimumDays;
    private final double halfLivesCovered;

    @Inject
    public LookbackWindowPolicy(LevelEstimationConfig config) {
        this(config.lookback().minimumDays(), config.lookback().halfLives());
    }

    public LookbackWindowPolicy() {
        this(AppConstant.MIN_LOOKBACK_DAYS, AppConstant.LOOKBACK_HALF_LIVES);
    }

    public LookbackWindowPolicy(int minimumDays, double halfLivesCovered) {
        if (minimumDays < AppConstant.MIN_LOOKBACK_DAYS) {
            throw new InvalidConfigurationException(
                    "lookback minimum days must be at least " + AppConstant.MIN_LOOKBACK_DAYS + " but was " + minimumDays);
        }
        if (Double.isNaN(halfLivesCovered) || Double.isInfinite(halfLivesCovered) || halfLivesCovered <= 0) {
            throw new InvalidConfigurationException(
                    "lookback half-lives must be a finite positive number but was " + halfLivesCovered);
        }
        this.minimumDays = minimumDays;
        this.halfLivesCovered = halfLivesCovered;
    }

    /**
     * @param halfLifeHours strictly positive half-life
     * @return number of days to query, never less than the configured minimum
     */
    public int lookbackDays(double halfLifeHours) {
        DecayFunction.requireValidHalfLife(halfLifeHours);
        double coveringDays = Math.ceil(halfLivesCovered * halfLifeHours / AppConstant.HOURS_PER_DAY);
        int days = (int) Math.min(Integer.MAX_VALUE, Math.max(minimumDays, coveringDays));

        if (log.isTraceEnabled()) {
            log.tracef("Lookback for half-life %.2fh: %d days", halfLifeHours, days);
        }
        return days;
    }

    /**
     * Earliest consumption instant to query for an estimation at {@code referenceInstant}.
     */
    public Instant windowStart(Instant referenceInstant, double halfLifeHours) {
        return referenceInstant.minus(Duration.ofDays(lookbackDays(halfLifeHours)));
    }
}
